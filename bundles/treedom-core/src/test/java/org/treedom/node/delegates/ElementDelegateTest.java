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

import org.junit.Test;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.node.NodeKind;
import org.treedom.settings.Constants;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.treedom.DomTestHelper.assertFails;

public final class ElementDelegateTest {

  @Test
  public void testNamespaces() throws DomException {
    final ElementDelegate delegate = new ElementDelegate();
    assertEquals(NodeKind.ELEMENT, delegate.getKind());
    delegate.putNamespace("p", "http://example.org/p");
    delegate.putNamespace("", "");
    delegate.putNamespace(Constants.XML_PREFIX, Constants.XML_NAMESPACE_URI);

    assertEquals("http://example.org/p", delegate.getNamespace("p").orElseThrow());
    assertEquals("", delegate.getNamespace("").orElseThrow());
    assertEquals(3, delegate.getNamespaces().size());

    delegate.removeNamespace("p");
    assertFalse(delegate.getNamespace("p").isPresent());
  }

  @Test
  public void testIllegalNamespaces() {
    final ElementDelegate delegate = new ElementDelegate();
    assertFails(DomErrorType.NAMESPACE, () -> delegate.putNamespace(Constants.XMLNS_PREFIX, "http://example.org/"));
    assertFails(DomErrorType.NAMESPACE, () -> delegate.putNamespace("p", Constants.XMLNS_NAMESPACE_URI));
    assertFails(DomErrorType.NAMESPACE, () -> delegate.putNamespace(Constants.XML_PREFIX, "http://example.org/"));
    assertFails(DomErrorType.NAMESPACE, () -> delegate.putNamespace("p", Constants.XML_NAMESPACE_URI));
    assertFails(DomErrorType.NAMESPACE, () -> delegate.putNamespace("p", ""));
    assertTrue(delegate.getNamespaces().isEmpty());
  }

  @Test
  public void testCopy() throws DomException {
    final ElementDelegate delegate = new ElementDelegate();
    delegate.putNamespace("p", "http://example.org/p");
    final ElementDelegate copy = delegate.copy();
    copy.removeNamespace("p");
    assertTrue(delegate.getNamespace("p").isPresent());
    assertTrue(copy.getAttributes().isEmpty());
  }
}
