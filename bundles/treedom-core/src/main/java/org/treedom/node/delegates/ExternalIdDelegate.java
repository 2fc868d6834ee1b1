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

package org.treedom.node.delegates;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.node.NodeKind;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Delegate for nodes which point to external resources: entities and notations, and the public and
 * system identifiers of a document type.
 */
public class ExternalIdDelegate extends ExtensionDelegate {

  /** The kind. */
  private final NodeKind kind;

  /** Public identifier. */
  private final @Nullable String publicId;

  /** System identifier. */
  private final @Nullable String systemId;

  /** Notation of an unparsed entity. */
  private final @Nullable String notationName;

  /**
   * Constructor.
   *
   * @param kind the kind of the node
   * @param publicId the public identifier, may be {@code null}
   * @param systemId the system identifier, may be {@code null}
   * @param notationName the notation name of an unparsed entity, may be {@code null}
   */
  public ExternalIdDelegate(final NodeKind kind, final @Nullable String publicId, final @Nullable String systemId,
      final @Nullable String notationName) {
    this.kind = requireNonNull(kind);
    this.publicId = publicId;
    this.systemId = systemId;
    this.notationName = notationName;
  }

  @Override
  public NodeKind getKind() {
    return kind;
  }

  public Optional<String> getPublicId() {
    return Optional.ofNullable(publicId);
  }

  public Optional<String> getSystemId() {
    return Optional.ofNullable(systemId);
  }

  public Optional<String> getNotationName() {
    return Optional.ofNullable(notationName);
  }

  @Override
  public ExternalIdDelegate copy() {
    return new ExternalIdDelegate(kind, publicId, systemId, notationName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .omitNullValues()
                      .add("kind", kind)
                      .add("publicId", publicId)
                      .add("systemId", systemId)
                      .add("notationName", notationName)
                      .toString();
  }
}
