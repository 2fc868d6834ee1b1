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
import org.treedom.node.NodeImpl;
import org.treedom.node.NodeKind;

import java.util.Optional;

/**
 * Delegate holding the two distinguished children of a document: its document type and its
 * document element. Both are also part of the document's children.
 */
public class DocumentDelegate extends ExtensionDelegate {

  /** The document type, if any. */
  private @Nullable NodeImpl doctype;

  /** The document element, if any. */
  private @Nullable NodeImpl documentElement;

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }

  public Optional<NodeImpl> getDoctype() {
    return Optional.ofNullable(doctype);
  }

  public void setDoctype(final @Nullable NodeImpl doctype) {
    assert doctype == null || doctype.getNodeType() == NodeKind.DOCUMENT_TYPE;
    this.doctype = doctype;
  }

  public Optional<NodeImpl> getDocumentElement() {
    return Optional.ofNullable(documentElement);
  }

  public void setDocumentElement(final @Nullable NodeImpl documentElement) {
    assert documentElement == null || documentElement.getNodeType() == NodeKind.ELEMENT;
    this.documentElement = documentElement;
  }

  /**
   * Clear the slot the node occupies, if any.
   *
   * @param node the node
   */
  public void clearSlot(final NodeImpl node) {
    if (node == doctype) {
      doctype = null;
    }
    if (node == documentElement) {
      documentElement = null;
    }
  }

  @Override
  public DocumentDelegate copy() {
    return new DocumentDelegate();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("doctype", doctype == null ? null : doctype.getNodeName())
                      .add("documentElement", documentElement == null ? null : documentElement.getNodeName())
                      .toString();
  }
}
