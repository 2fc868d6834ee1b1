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

package org.treedom.access;

import org.junit.Test;
import org.treedom.DomTestHelper;
import org.treedom.api.Document;
import org.treedom.api.DocumentType;
import org.treedom.api.Element;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.node.NodeKind;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.treedom.DomTestHelper.assertFails;
import static org.treedom.DomTestHelper.nodeNames;

public final class DomImplementationImplTest {

  private final DomImplementationImpl implementation = DomTestHelper.implementation();

  @Test
  public void testCreateDocument() throws DomException {
    final Document document = implementation.createDocument(DomTestHelper.NAMESPACE, DomTestHelper.ROOT, null);
    final Element root = document.getDocumentElement().orElseThrow();

    assertEquals(NodeKind.DOCUMENT, document.getNodeType());
    assertEquals(DomTestHelper.ROOT, root.getTagName());
    assertEquals(DomTestHelper.NAMESPACE, root.getNamespaceUri().orElseThrow());
    assertFalse(root.getPrefix().isPresent());
    assertSame(document, root.getParentNode().orElseThrow());
    assertSame(implementation, document.getImplementation());
    assertFalse(document.getDoctype().isPresent());
    assertEquals(1, document.getChildNodes().size());
  }

  @Test
  public void testCreateDocumentWithPrefix() throws DomException {
    final Document document = implementation.createDocument("http://example.org/p", "p:root", null);
    final Element root = document.getDocumentElement().orElseThrow();
    assertEquals("p", root.getPrefix().orElseThrow());
    assertEquals("root", root.getLocalName());
    assertEquals("http://example.org/p", root.lookupNamespaceUri("p").orElseThrow());
  }

  @Test
  public void testCreateDocumentWithDoctype() throws DomException {
    final DocumentType doctype = implementation.createDocumentType("root", null, "root.dtd");
    final Document document = implementation.createDocument(null, "root", doctype);
    assertEquals(Arrays.asList("root", "root"), nodeNames(document.getChildNodes()));
    assertSame(doctype, document.getFirstChild().orElseThrow());
    assertSame(document, doctype.getParentNode().orElseThrow());
  }

  @Test
  public void testNameErrors() {
    assertFails(DomErrorType.INVALID_CHARACTER, () -> implementation.createDocument(null, "1root", null));
    assertFails(DomErrorType.NAMESPACE, () -> implementation.createDocument(null, "p:root", null));
    assertFails(DomErrorType.NAMESPACE, () -> implementation.createDocument("http://example.org/", "xml:root", null));
    assertFails(DomErrorType.INVALID_CHARACTER, () -> implementation.createDocumentType("a b", null, null));
  }

  @Test
  public void testDoctypeOfOtherImplementation() throws DomException {
    final DocumentType doctype = implementation.createDocumentType("root", null, null);
    final Document owner = DomTestHelper.implementation().createDocument(null, "root", doctype);
    assertFails(DomErrorType.WRONG_DOCUMENT, () -> implementation.createDocument(null, "root", doctype));
    assertSame(owner, doctype.getOwnerDocument().orElseThrow());
  }

  @Test
  public void testHasFeature() {
    assertTrue(implementation.hasFeature("Core", "2.0"));
    assertTrue(implementation.hasFeature("XML", "1.0"));
    assertTrue(implementation.hasFeature("core", "1.0"));
    assertFalse(implementation.hasFeature("Core", "3.0"));
    assertFalse(implementation.hasFeature("Traversal", "2.0"));
  }

  @Test
  public void testGetInstance() {
    final DomImplementationImpl instance = DomImplementationImpl.getInstance();
    assertSame(instance, DomImplementationImpl.getInstance());
    assertTrue(instance.getConfiguration().isCDataPadding());
  }
}
