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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An element with its attributes and namespace declarations.
 *
 * <p>
 * Lookups by name never fail: a name which can't be parsed is logged and finds nothing.
 * </p>
 */
public interface Element extends Node {

  String getTagName();

  Optional<String> getAttribute(String name);

  /**
   * Set an attribute, replacing one of the same name.
   *
   * @param name the qualified name
   * @param value the value
   * @throws DomException if the name is malformed
   */
  void setAttribute(String name, String value) throws DomException;

  /**
   * Remove an attribute, if present. Removing a namespace declaration removes its mapping.
   *
   * @param name the qualified name
   */
  void removeAttribute(String name);

  Optional<Attribute> getAttributeNode(String name);

  /**
   * Install an attribute node, replacing one of the same name. A namespace declaration installs
   * its namespace mapping too.
   *
   * @param attribute the attribute
   * @return the installed attribute
   * @throws DomException {@link org.treedom.exception.DomErrorType#INVALID_STATE} if this is no
   *         element or the argument no attribute,
   *         {@link org.treedom.exception.DomErrorType#WRONG_DOCUMENT} if the attribute was created by
   *         another document, {@link org.treedom.exception.DomErrorType#INUSE_ATTRIBUTE} if it is
   *         installed on another element, {@link org.treedom.exception.DomErrorType#NAMESPACE} if the
   *         declared namespace mapping is illegal
   */
  Attribute setAttributeNode(Attribute attribute) throws DomException;

  /**
   * Remove an installed attribute node.
   *
   * @param attribute the attribute
   * @return the removed attribute
   * @throws DomException {@link org.treedom.exception.DomErrorType#NOT_FOUND} if it is not installed
   *         on this element
   */
  Attribute removeAttributeNode(Attribute attribute) throws DomException;

  /**
   * Find this element and its descendant elements with a tag name, in document order.
   *
   * @param tagName the qualified name, {@code "*"} matches every element
   * @return the matching elements
   */
  List<Element> getElementsByTagName(String tagName);

  Optional<String> getAttributeNS(String namespaceUri, String localName);

  void setAttributeNS(@Nullable String namespaceUri, String qualifiedName, String value) throws DomException;

  void removeAttributeNS(String namespaceUri, String localName);

  Optional<Attribute> getAttributeNodeNS(String namespaceUri, String localName);

  Attribute setAttributeNodeNS(Attribute attribute) throws DomException;

  List<Element> getElementsByTagNameNS(String namespaceUri, String localName);

  boolean hasAttribute(String name);

  boolean hasAttributeNS(String namespaceUri, String localName);

  /**
   * Resolve a prefix against the element's name and namespace declarations, and those of its
   * ancestors unless configured otherwise.
   *
   * @param prefix the prefix, {@code null} or empty for the default namespace
   * @return the namespace URI if the prefix is bound
   */
  Optional<String> lookupNamespaceUri(@Nullable String prefix);

  /**
   * Get the namespace mappings declared on this element. The default namespace is keyed by the
   * empty string.
   *
   * @return an immutable map from prefix to namespace URI
   */
  Map<String, String> getNamespaceMappings();
}
