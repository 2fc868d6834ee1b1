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
import org.treedom.name.Name;
import org.treedom.node.NodeImpl;
import org.treedom.node.NodeKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Delegate for document types: external identifiers, the internal subset, and the entity and
 * notation tables.
 */
public class DocumentTypeDelegate extends ExtensionDelegate {

  /** Public and system identifier. */
  private final ExternalIdDelegate externalIdDelegate;

  /** Declared entities. */
  private final Map<Name, NodeImpl> entities;

  /** Declared notations. */
  private final Map<Name, NodeImpl> notations;

  /** The internal subset as text. */
  private @Nullable String internalSubset;

  /**
   * Constructor.
   *
   * @param externalIdDelegate the identifiers
   */
  public DocumentTypeDelegate(final ExternalIdDelegate externalIdDelegate) {
    this.externalIdDelegate = requireNonNull(externalIdDelegate);
    entities = new LinkedHashMap<>();
    notations = new LinkedHashMap<>();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT_TYPE;
  }

  public ExternalIdDelegate getExternalIdDelegate() {
    return externalIdDelegate;
  }

  public Map<Name, NodeImpl> getEntities() {
    return entities;
  }

  public Map<Name, NodeImpl> getNotations() {
    return notations;
  }

  public Optional<String> getInternalSubset() {
    return Optional.ofNullable(internalSubset);
  }

  public void setInternalSubset(final @Nullable String internalSubset) {
    this.internalSubset = internalSubset;
  }

  @Override
  public DocumentTypeDelegate copy() {
    final DocumentTypeDelegate copy = new DocumentTypeDelegate(externalIdDelegate.copy());
    copy.internalSubset = internalSubset;
    return copy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("externalId", externalIdDelegate)
                      .add("entities", entities.keySet())
                      .add("notations", notations.keySet())
                      .add("internalSubset", internalSubset)
                      .toString();
  }
}
