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

/**
 * Factory of documents and document types.
 */
public interface DomImplementation {

  /**
   * Determines if a feature is supported.
   *
   * @param feature the feature name, compared case-insensitively
   * @param version the version
   * @return {@code true} for {@code Core} and {@code XML} in versions {@code 1.0} and {@code 2.0}
   */
  boolean hasFeature(String feature, String version);

  /**
   * Create a detached document type, which is adopted by the first document it is added to.
   *
   * @param qualifiedName the name
   * @param publicId the public identifier, may be {@code null}
   * @param systemId the system identifier, may be {@code null}
   * @return the document type
   * @throws DomException if the name is malformed
   */
  DocumentType createDocumentType(String qualifiedName, @Nullable String publicId, @Nullable String systemId)
      throws DomException;

  /**
   * Create a document together with its document element.
   *
   * @param namespaceUri the namespace URI of the document element, {@code null} or empty for none
   * @param qualifiedName the name of the document element
   * @param doctype the document type, may be {@code null}
   * @return the document
   * @throws DomException if the name is malformed or the document type belongs to another document
   */
  Document createDocument(@Nullable String namespaceUri, String qualifiedName, @Nullable DocumentType doctype)
      throws DomException;
}
