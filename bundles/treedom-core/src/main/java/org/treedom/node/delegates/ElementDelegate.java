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
import com.google.common.collect.ImmutableMap;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.name.Name;
import org.treedom.node.NodeImpl;
import org.treedom.node.NodeKind;
import org.treedom.settings.Constants;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Delegate for elements: the attributes, keyed by name, and the namespace mappings declared on the
 * element, keyed by prefix with the empty string standing for the default namespace.
 */
public class ElementDelegate extends ExtensionDelegate {

  /** Attributes in insertion order. */
  private final Map<Name, NodeImpl> attributes;

  /** Prefix to namespace URI. */
  private final Map<String, String> namespaces;

  /**
   * Constructor.
   */
  public ElementDelegate() {
    attributes = new LinkedHashMap<>();
    namespaces = new LinkedHashMap<>();
  }

  /**
   * Copy constructor, copies the namespace mappings only.
   *
   * @param delegate the delegate to copy
   */
  private ElementDelegate(final ElementDelegate delegate) {
    attributes = new LinkedHashMap<>();
    namespaces = new LinkedHashMap<>(delegate.namespaces);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  public Optional<NodeImpl> getAttribute(final Name name) {
    return Optional.ofNullable(attributes.get(name));
  }

  /**
   * Put an attribute, replacing one of the same name.
   *
   * @param attribute the attribute node
   * @return the replaced attribute, if any
   */
  public Optional<NodeImpl> putAttribute(final NodeImpl attribute) {
    assert attribute.getNodeType() == NodeKind.ATTRIBUTE;
    return Optional.ofNullable(attributes.put(attribute.getName(), attribute));
  }

  public Optional<NodeImpl> removeAttribute(final Name name) {
    return Optional.ofNullable(attributes.remove(name));
  }

  public Collection<NodeImpl> getAttributeNodes() {
    return attributes.values();
  }

  public Map<Name, NodeImpl> getAttributes() {
    return attributes;
  }

  /**
   * Declare a namespace mapping.
   *
   * @param prefix the prefix, empty for the default namespace
   * @param namespaceUri the namespace URI, empty to undeclare the default namespace
   * @throws DomException {@link DomErrorType#NAMESPACE} if the reserved prefixes or namespaces are
   *         misused or a prefix is bound to the empty URI
   */
  public void putNamespace(final String prefix, final String namespaceUri) throws DomException {
    requireNonNull(prefix);
    requireNonNull(namespaceUri);
    if (Constants.XMLNS_PREFIX.equals(prefix) || Constants.XMLNS_NAMESPACE_URI.equals(namespaceUri)) {
      throw new DomException(DomErrorType.NAMESPACE, "The xmlns prefix and namespace may not be declared.");
    }
    if (Constants.XML_PREFIX.equals(prefix) != Constants.XML_NAMESPACE_URI.equals(namespaceUri)) {
      throw new DomException(DomErrorType.NAMESPACE, "The xml prefix must be bound to %s and only to it.",
          Constants.XML_NAMESPACE_URI);
    }
    if (!prefix.isEmpty() && namespaceUri.isEmpty()) {
      throw new DomException(DomErrorType.NAMESPACE, "Prefix '%s' may not be bound to the empty URI.", prefix);
    }
    namespaces.put(prefix, namespaceUri);
  }

  public Optional<String> getNamespace(final String prefix) {
    return Optional.ofNullable(namespaces.get(prefix));
  }

  public void removeNamespace(final String prefix) {
    namespaces.remove(prefix);
  }

  public Map<String, String> getNamespaces() {
    return ImmutableMap.copyOf(namespaces);
  }

  @Override
  public ElementDelegate copy() {
    return new ElementDelegate(this);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("attributes", attributes.keySet())
                      .add("namespaces", namespaces)
                      .toString();
  }
}
