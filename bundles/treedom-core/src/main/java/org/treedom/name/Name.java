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

package org.treedom.name;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.settings.Constants;
import org.treedom.utils.XMLToken;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Immutable, possibly namespace qualified name of a node.
 *
 * <p>
 * Two names are equal if their prefix and local name are equal, which makes a name usable as the
 * key of an element's attribute map. The namespace URI is carried along but doesn't take part in
 * equality; namespace-aware lookups compare it explicitly.
 * </p>
 */
public final class Name implements Comparable<Name> {

  /** Names of node kinds which have no name of their own. */
  private static final ImmutableSet<String> NODE_NAMES = ImmutableSet.of(Constants.TEXT_NODE_NAME,
      Constants.CDATA_NODE_NAME, Constants.COMMENT_NODE_NAME, Constants.DOCUMENT_NODE_NAME,
      Constants.DOCUMENT_FRAGMENT_NODE_NAME);

  /** The local part. */
  private final String localName;

  /** The prefix, {@code null} if the name is unprefixed. */
  private final @Nullable String prefix;

  /** The namespace URI, {@code null} if the name is in no namespace. */
  private final @Nullable String namespaceUri;

  private Name(final @Nullable String namespaceUri, final @Nullable String prefix, final String localName) {
    this.namespaceUri = namespaceUri;
    this.prefix = prefix;
    this.localName = localName;
  }

  /**
   * Parse a (possibly prefixed) name.
   *
   * @param qualifiedName the name as it appears in markup
   * @return the name
   * @throws DomException {@link DomErrorType#INVALID_CHARACTER} if {@code qualifiedName} is not an
   *         XML name, {@link DomErrorType#NAMESPACE} if it is a name but not a qualified name
   */
  public static Name parse(final String qualifiedName) throws DomException {
    checkQualifiedName(qualifiedName);
    final int colon = qualifiedName.indexOf(':');
    if (colon == -1) {
      return new Name(null, null, qualifiedName);
    }
    return new Name(null, qualifiedName.substring(0, colon), qualifiedName.substring(colon + 1));
  }

  /**
   * Create a name in a namespace.
   *
   * @param namespaceUri the namespace URI, {@code null} or empty for no namespace
   * @param qualifiedName the name as it appears in markup
   * @return the name
   * @throws DomException if {@code qualifiedName} is malformed, or if its prefix doesn't fit the
   *         namespace URI
   */
  public static Name fromNamespace(final @Nullable String namespaceUri, final String qualifiedName)
      throws DomException {
    final Name name = parse(qualifiedName);
    final String uri = Strings.emptyToNull(namespaceUri);
    if (name.prefix != null) {
      if (uri == null) {
        throw new DomException(DomErrorType.NAMESPACE, "Prefix '%s' requires a namespace URI.", name.prefix);
      }
      if (Constants.XML_PREFIX.equals(name.prefix) && !Constants.XML_NAMESPACE_URI.equals(uri)) {
        throw new DomException(DomErrorType.NAMESPACE, "Prefix 'xml' must be bound to %s.",
            Constants.XML_NAMESPACE_URI);
      }
    }
    if (name.isNamespaceDeclaration() && !Constants.XMLNS_NAMESPACE_URI.equals(uri)) {
      throw new DomException(DomErrorType.NAMESPACE, "'%s' must be in namespace %s.", qualifiedName,
          Constants.XMLNS_NAMESPACE_URI);
    }
    return new Name(uri, name.prefix, name.localName);
  }

  /**
   * Get the fixed name of a node kind which is not named by the document, like {@code #text}.
   *
   * @param nodeName one of the {@code *_NODE_NAME} constants of {@link Constants}
   * @return the name
   * @throws IllegalArgumentException if {@code nodeName} is no such name
   */
  public static Name ofNodeName(final String nodeName) {
    if (!NODE_NAMES.contains(requireNonNull(nodeName))) {
      throw new IllegalArgumentException("Not a reserved node name: " + nodeName);
    }
    return new Name(null, null, nodeName);
  }

  private static void checkQualifiedName(final String qualifiedName) throws DomException {
    requireNonNull(qualifiedName);
    if (!XMLToken.isName(qualifiedName)) {
      throw new DomException(DomErrorType.INVALID_CHARACTER, "'%s' is not a valid XML name.", qualifiedName);
    }
    if (!XMLToken.isQName(qualifiedName)) {
      throw new DomException(DomErrorType.NAMESPACE, "'%s' is not a valid qualified name.", qualifiedName);
    }
  }

  /**
   * Determines if this is the name of a namespace declaration attribute, that is {@code xmlns} or
   * {@code xmlns:*}.
   *
   * @return {@code true} if it is, {@code false} otherwise
   */
  public boolean isNamespaceDeclaration() {
    return prefix == null
        ? Constants.XMLNS_PREFIX.equals(localName)
        : Constants.XMLNS_PREFIX.equals(prefix);
  }

  /**
   * Get the prefix a namespace declaration attribute of this name declares.
   *
   * @return the declared prefix, or an empty optional for the default namespace declaration (and
   *         for names which aren't namespace declarations)
   */
  public Optional<String> getDeclaredPrefix() {
    if (prefix != null && Constants.XMLNS_PREFIX.equals(prefix)) {
      return Optional.of(localName);
    }
    return Optional.empty();
  }

  public String getLocalName() {
    return localName;
  }

  public Optional<String> getPrefix() {
    return Optional.ofNullable(prefix);
  }

  public Optional<String> getNamespaceUri() {
    return Optional.ofNullable(namespaceUri);
  }

  @Override
  public int compareTo(final Name other) {
    return ComparisonChain.start()
                          .compare(prefix, other.prefix, Ordering.natural().nullsFirst())
                          .compare(localName, other.localName)
                          .result();
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(prefix, localName);
  }

  @Override
  public boolean equals(final Object obj) {
    if (obj instanceof Name) {
      final Name other = (Name) obj;
      return Objects.equal(prefix, other.prefix) && Objects.equal(localName, other.localName);
    }
    return false;
  }

  /**
   * The qualified name as it appears in markup, {@code prefix:local} or {@code local}.
   */
  @Override
  public String toString() {
    return prefix == null ? localName : prefix + ':' + localName;
  }
}
