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

package org.treedom.node;

import org.slf4j.LoggerFactory;
import org.treedom.api.Attribute;
import org.treedom.api.CharacterData;
import org.treedom.api.Document;
import org.treedom.api.Element;
import org.treedom.api.Node;
import org.treedom.api.Text;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.utils.LogWrapper;

import java.util.Optional;

/**
 * Kind checks and typed casts of nodes. The {@code as*} methods log a cast to the wrong kind and
 * return an empty optional; the {@code require*} methods fail instead.
 */
public final class Nodes {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(Nodes.class));

  private Nodes() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get the implementation of a node.
   *
   * @param node the node
   * @return the node as {@link NodeImpl}
   * @throws DomException {@link DomErrorType#WRONG_DOCUMENT} if the node comes from another
   *         implementation
   */
  public static NodeImpl asImpl(final Node node) throws DomException {
    if (node instanceof NodeImpl) {
      return (NodeImpl) node;
    }
    throw new DomException(DomErrorType.WRONG_DOCUMENT, "Node %s comes from a foreign implementation.",
        node.getClass().getName());
  }

  public static boolean isElement(final Node node) {
    return node.getNodeType() == NodeKind.ELEMENT;
  }

  /**
   * Determines if the node is a text or CDATA node.
   *
   * @param node the node
   * @return {@code true} if it is
   */
  public static boolean isText(final Node node) {
    return node.getNodeType() == NodeKind.TEXT || node.getNodeType() == NodeKind.CDATA;
  }

  public static Optional<Element> asElement(final Node node) {
    return node.getNodeType() == NodeKind.ELEMENT && node instanceof Element
        ? Optional.of((Element) node)
        : failedCast("asElement", node);
  }

  public static Optional<Attribute> asAttribute(final Node node) {
    return node.getNodeType() == NodeKind.ATTRIBUTE && node instanceof Attribute
        ? Optional.of((Attribute) node)
        : failedCast("asAttribute", node);
  }

  public static Optional<Document> asDocument(final Node node) {
    return node.getNodeType() == NodeKind.DOCUMENT && node instanceof Document
        ? Optional.of((Document) node)
        : failedCast("asDocument", node);
  }

  public static Optional<Text> asText(final Node node) {
    return isText(node) && node instanceof Text ? Optional.of((Text) node) : failedCast("asText", node);
  }

  public static Optional<CharacterData> asCharacterData(final Node node) {
    return node.getNodeType().isCharacterData() && node instanceof CharacterData
        ? Optional.of((CharacterData) node)
        : failedCast("asCharacterData", node);
  }

  /**
   * Cast a node to an element.
   *
   * @param node the node
   * @return the element
   * @throws DomException {@link DomErrorType#INVALID_STATE} if the node is no element
   */
  public static Element requireElement(final Node node) throws DomException {
    return asElement(node).orElseThrow(() -> invalidState(node, NodeKind.ELEMENT));
  }

  /**
   * Cast a node to an attribute.
   *
   * @param node the node
   * @return the attribute
   * @throws DomException {@link DomErrorType#INVALID_STATE} if the node is no attribute
   */
  public static Attribute requireAttribute(final Node node) throws DomException {
    return asAttribute(node).orElseThrow(() -> invalidState(node, NodeKind.ATTRIBUTE));
  }

  private static DomException invalidState(final Node node, final NodeKind expected) {
    return new DomException(DomErrorType.INVALID_STATE, "Expected a node of kind %s, but got %s.", expected,
        node.getNodeType());
  }

  private static <T> Optional<T> failedCast(final String operation, final Node node) {
    LOGWRAPPER.invalidNodeKind(operation, node.getNodeType());
    return Optional.empty();
  }
}
