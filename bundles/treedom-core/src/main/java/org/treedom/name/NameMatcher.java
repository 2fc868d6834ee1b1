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

import org.treedom.settings.Constants;

/**
 * Wildcard-aware name comparison used by tag-name queries. {@link Name#equals(Object)} is never
 * wildcard-aware; these checks are.
 */
public final class NameMatcher {

  private NameMatcher() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Match a node name against a queried tag name. {@code "*"} on either side matches anything.
   *
   * @param candidate the name of the node
   * @param tagName the queried qualified name
   * @return {@code true} on a match
   */
  public static boolean matchesTagName(final Name candidate, final String tagName) {
    return matches(candidate.toString(), tagName);
  }

  /**
   * Match a node name against a queried namespace URI and local name. A node without namespace only
   * matches the wildcard namespace; otherwise the namespace URIs must be equal or one of them must
   * be the wildcard. Local names are compared the same way.
   *
   * @param candidate the name of the node
   * @param namespaceUri the queried namespace URI
   * @param localName the queried local name
   * @return {@code true} on a match
   */
  public static boolean matchesNamespaced(final Name candidate, final String namespaceUri,
      final String localName) {
    final boolean namespaceMatches = candidate.getNamespaceUri()
                                              .map(uri -> matches(uri, namespaceUri))
                                              .orElse(Constants.WILDCARD.equals(namespaceUri));
    return namespaceMatches && matches(candidate.getLocalName(), localName);
  }

  private static boolean matches(final String test, final String against) {
    return test.equals(against) || Constants.WILDCARD.equals(test) || Constants.WILDCARD.equals(against);
  }
}
