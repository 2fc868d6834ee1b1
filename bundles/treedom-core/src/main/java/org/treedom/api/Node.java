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
import org.treedom.api.visitor.NodeVisitor;
import org.treedom.api.visitor.VisitResult;
import org.treedom.exception.DomException;
import org.treedom.name.Name;
import org.treedom.node.NodeKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The base capability of every node of a tree.
 *
 * <p>
 * Nodes are linked to their parent and owner document by weak back-references only; a tree is kept
 * alive by the references held on its root. Equality of nodes is identity. Implementations are not
 * thread-safe: a tree shared between threads must be guarded by one lock around the whole tree.
 * </p>
 *
 * <p>
 * Operations which may fail declare {@link DomException}. Calling a capability a node doesn't
 * support (for instance element operations on a text node) is not an error: it is logged and the
 * call degrades to an empty result.
 * </p>
 */
public interface Node {

  /**
   * Get the kind of the node, which never changes.
   *
   * @return the node kind
   */
  NodeKind getNodeType();

  /**
   * Get the name of the node. Kinds which aren't named individually have a fixed name such as
   * {@code #text}.
   *
   * @return the name
   */
  Name getName();

  /**
   * Get the DOM node name: the qualified name or the fixed name of the kind.
   *
   * @return the node name
   */
  String getNodeName();

  /**
   * Get the node value, which is defined for attributes, character data and processing
   * instructions only.
   *
   * @return the value if any
   */
  Optional<String> getNodeValue();

  /**
   * Set the node value. Has no effect on kinds whose value is always absent. For attributes this is
   * {@link Attribute#setValue(String)}.
   *
   * @param value the new value
   * @throws DomException if an attribute rejects the value
   */
  void setNodeValue(String value) throws DomException;

  Optional<Node> getParentNode();

  /**
   * Get a snapshot of the children in document order.
   *
   * @return an immutable list of the children
   */
  List<Node> getChildNodes();

  Optional<Node> getFirstChild();

  Optional<Node> getLastChild();

  Optional<Node> getPreviousSibling();

  Optional<Node> getNextSibling();

  /**
   * Get a snapshot of the attributes; empty for every node but elements.
   *
   * @return an immutable map of the attributes keyed by name
   */
  Map<Name, Attribute> getAttributes();

  /**
   * Get the document which created the node. A document has no owner document.
   *
   * @return the owner document, or empty if there is none or it is gone
   */
  Optional<Document> getOwnerDocument();

  /**
   * Insert a node before a reference child. A node which already has a parent is removed from it
   * first, the children of a document fragment are moved over in order.
   *
   * @param newChild the node to insert
   * @param refChild the child to insert before, {@code null} to append; appends as well if it is not
   *        a child of this node
   * @return {@code newChild}
   * @throws DomException {@link org.treedom.exception.DomErrorType#HIERARCHY_REQUEST} if the kind of
   *         {@code newChild} is not allowed here or if it is this node or an ancestor,
   *         {@link org.treedom.exception.DomErrorType#WRONG_DOCUMENT} if it was created by another
   *         document
   */
  Node insertBefore(Node newChild, @Nullable Node refChild) throws DomException;

  /**
   * Replace a child.
   *
   * @param newChild the node to put in place
   * @param oldChild the child to replace
   * @return {@code oldChild}, detached
   * @throws DomException {@link org.treedom.exception.DomErrorType#NOT_FOUND} if {@code oldChild} is
   *         not a child of this node, and the errors of {@link #insertBefore(Node, Node)}
   */
  Node replaceChild(Node newChild, Node oldChild) throws DomException;

  /**
   * Remove a child.
   *
   * @param oldChild the child to remove
   * @return {@code oldChild}, detached
   * @throws DomException {@link org.treedom.exception.DomErrorType#NOT_FOUND} if it is not a child
   */
  Node removeChild(Node oldChild) throws DomException;

  /**
   * Append a child, see {@link #insertBefore(Node, Node)}.
   *
   * @param newChild the node to append
   * @return {@code newChild}
   * @throws DomException if it may not be appended
   */
  Node appendChild(Node newChild) throws DomException;

  boolean hasChildNodes();

  boolean hasAttributes();

  /**
   * Copy the node. The copy is detached and owned by the same document. Attributes are always
   * copied, children only if {@code deep} is set.
   *
   * @param deep whether to copy the subtree
   * @return the copy
   */
  Node cloneNode(boolean deep);

  /**
   * Merge adjacent text nodes and remove empty ones throughout the subtree.
   */
  void normalize();

  boolean isSupported(String feature, String version);

  Optional<String> getNamespaceUri();

  Optional<String> getPrefix();

  String getLocalName();

  boolean isSameNode(@Nullable Node other);

  /**
   * Accept a visitor.
   *
   * @param visitor the visitor
   * @return the result of the visitor callback for this node's kind
   */
  VisitResult accept(NodeVisitor visitor);
}
