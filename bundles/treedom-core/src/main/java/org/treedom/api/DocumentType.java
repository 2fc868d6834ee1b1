/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.treedom.api;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.exception.DomException;
import org.treedom.name.Name;

import java.util.Map;
import java.util.Optional;

/**
 * A document type declaration with its entity and notation tables. Nothing is expanded or
 * validated; the tables are filled through {@link #createEntity} and {@link #createNotation}.
 */
public interface DocumentType extends Node {

  Map<Name, Entity> getEntities();

  Map<Name, Notation> getNotations();

  Optional<String> getPublicId();

  Optional<String> getSystemId();

  Optional<String> getInternalSubset();

  void setInternalSubset(@Nullable String internalSubset);

  /**
   * Declare an entity, replacing one of the same name.
   *
   * @param name the entity name
   * @param publicId the public identifier, may be {@code null}
   * @param systemId the system identifier, may be {@code null}
   * @param notationName the notation of an unparsed entity, may be {@code null}
   * @return the new entity
   * @throws DomException if the name is malformed
   */
  Entity createEntity(String name, @Nullable String publicId, @Nullable String systemId,
      @Nullable String notationName) throws DomException;

  Notation createNotation(String name, @Nullable String publicId, @Nullable String systemId)
      throws DomException;
}
