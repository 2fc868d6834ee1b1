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

import org.junit.Before;
import org.junit.Test;
import org.treedom.DomTestHelper;
import org.treedom.access.DomConfiguration;
import org.treedom.access.DomImplementationImpl;
import org.treedom.api.Attribute;
import org.treedom.api.Document;
import org.treedom.api.Element;
import org.treedom.api.EntityReference;
import org.treedom.api.Text;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.name.Name;
import org.treedom.settings.Constants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.treedom.DomTestHelper.assertFails;
import static org.treedom.DomTestHelper.nodeNames;

/**
 * Test attributes, namespace mappings and element lookup of elements.
 */
public final class ElementTest {

  private static final String OTHER_NAMESPACE = "http://example.org/other";

  private Document document;

  private Element root;

  @Before
  public void setUp() throws DomException {
    document = DomTestHelper.createDocument();
    root = DomTestHelper.documentElement(document);
  }

  @Test
  public void testSetAttribute() throws DomException {
    root.setAttribute("id", "1");
    assertEquals("1", root.getAttribute("id").orElseThrow());
    assertTrue(root.hasAttribute("id"));
    assertTrue(root.hasAttributes());

    root.setAttribute("id", "2");
    assertEquals("last write wins", "2", root.getAttribute("id").orElseThrow());
    assertEquals(1, root.getAttributes().size());

    final Attribute attribute = root.getAttributeNode("id").orElseThrow();
    assertSame(root, attribute.getOwnerElement().orElseThrow());
    assertSame(document, attribute.getOwnerDocument().orElseThrow());
    assertFalse("attributes have no parent", attribute.getParentNode().isPresent());
    assertTrue(attribute.isSpecified());
  }

  @Test
  public void testAttributeOrder() throws DomException {
    root.setAttribute("b", "1");
    root.setAttribute("a", "2");
    root.setAttribute("c", "3");
    assertEquals(Arrays.asList("b", "a", "c"), nodeNames(root.getAttributes().values()));
    assertEquals(Name.parse("a"), new ArrayList<>(root.getAttributes().keySet()).get(1));
  }

  @Test
  public void testMissingAttribute() throws DomException {
    assertFalse(root.getAttribute("missing").isPresent());
    assertFalse(root.hasAttribute("missing"));
    assertFalse(root.hasAttributes());
    root.removeAttribute("missing");
  }

  @Test
  public void testLenientLookups() throws DomException {
    assertFalse("an invalid name is never found", root.getAttribute("1nvalid").isPresent());
    root.removeAttribute("1nvalid");

    final Element text = (Element) document.createTextNode("text");
    assertFalse(text.getAttribute("id").isPresent());
    assertFalse(text.getAttributeNode("id").isPresent());
    assertFalse(text.getAttributeNS(DomTestHelper.NAMESPACE, "id").isPresent());
    assertTrue(text.getElementsByTagName("*").isEmpty());
    assertTrue(text.getNamespaceMappings().isEmpty());
    assertFalse(text.lookupNamespaceUri("p").isPresent());
    text.removeAttribute("id");
  }

  @Test
  public void testSetAttributeInvalid() throws DomException {
    assertFails(DomErrorType.INVALID_CHARACTER, () -> root.setAttribute("1nvalid", "x"));

    final Element text = (Element) document.createTextNode("text");
    assertFails(DomErrorType.INVALID_STATE, () -> text.setAttribute("id", "x"));
    assertFails(DomErrorType.INVALID_STATE, () -> root.setAttributeNode((Attribute) document.createComment("c")));
  }

  @Test
  public void testSetAttributeNode() throws DomException {
    final Attribute first = document.createAttribute("id", "1");
    final Attribute second = document.createAttribute("id", "2");

    assertSame(first, root.setAttributeNode(first));
    assertSame("installing again is a no-op", first, root.setAttributeNode(first));
    root.setAttributeNode(second);

    assertEquals("2", root.getAttribute("id").orElseThrow());
    assertFalse(first.getOwnerElement().isPresent());
    assertSame(root, second.getOwnerElement().orElseThrow());
  }

  @Test
  public void testAttributeInUse() throws DomException {
    final Element other = document.createElement("other");
    root.appendChild(other);
    root.setAttribute("id", "1");
    final Attribute attribute = root.getAttributeNode("id").orElseThrow();

    assertFails(DomErrorType.INUSE_ATTRIBUTE, () -> other.setAttributeNode(attribute));
    assertFalse(other.hasAttributes());

    root.removeAttributeNode(attribute);
    other.setAttributeNode(attribute);
    assertSame(other, attribute.getOwnerElement().orElseThrow());
  }

  @Test
  public void testAttributeFromOtherDocument() throws DomException {
    final Document otherDocument = DomTestHelper.createDocument();
    final Attribute foreign = otherDocument.createAttribute("id", "1");
    assertFails(DomErrorType.WRONG_DOCUMENT, () -> root.setAttributeNode(foreign));
    assertFalse(root.hasAttributes());
  }

  @Test
  public void testRemoveAttributeNode() throws DomException {
    root.setAttribute("id", "1");
    final Attribute attribute = root.getAttributeNode("id").orElseThrow();

    assertSame(attribute, root.removeAttributeNode(attribute));
    assertFalse(root.hasAttribute("id"));
    assertFalse(attribute.getOwnerElement().isPresent());
    assertEquals("1", attribute.getValue());

    assertFails(DomErrorType.NOT_FOUND, () -> root.removeAttributeNode(attribute));
    assertFails(DomErrorType.NOT_FOUND, () -> root.removeAttributeNode(document.createAttribute("id")));
  }

  @Test
  public void testAttributeValue() throws DomException {
    final Attribute attribute = document.createAttribute("a");
    assertEquals("", attribute.getValue());
    attribute.setValue("v");
    assertEquals("v", attribute.getNodeValue().orElseThrow());
    attribute.setNodeValue("w");
    assertEquals("w", attribute.getValue());
  }

  @Test
  public void testAttributeValueFromChildren() throws DomException {
    final Attribute attribute = document.createAttribute("a", "ignored");
    attribute.appendChild(document.createTextNode("x"));
    final EntityReference reference = document.createEntityReference("entity");
    reference.appendChild(document.createTextNode("y"));
    attribute.appendChild(reference);
    attribute.appendChild(document.createTextNode("z"));
    root.setAttributeNode(attribute);

    assertEquals("xyz", attribute.getValue());
    assertEquals("xyz", attribute.getNodeValue().orElseThrow());
    assertEquals("xyz", root.getAttribute("a").orElseThrow());
    assertEquals("<root a=\"xyz\"></root>", root.toString());

    attribute.setValue("v");
    assertFalse("setting the value replaces the children", attribute.hasChildNodes());
    assertEquals("v", attribute.getValue());
  }

  @Test
  public void testRebindNamespaceDeclaration() throws DomException {
    root.setAttribute("xmlns:p", OTHER_NAMESPACE);
    final Attribute declaration = root.getAttributeNode("xmlns:p").orElseThrow();

    declaration.setValue("http://example.org/rebound");
    assertEquals("http://example.org/rebound", root.lookupNamespaceUri("p").orElseThrow());
    declaration.setNodeValue(OTHER_NAMESPACE);
    assertEquals(OTHER_NAMESPACE, root.lookupNamespaceUri("p").orElseThrow());

    assertFails(DomErrorType.NAMESPACE, () -> declaration.setValue(""));
    assertEquals("a rejected value changes nothing", OTHER_NAMESPACE, declaration.getValue());
    assertEquals(OTHER_NAMESPACE, root.lookupNamespaceUri("p").orElseThrow());

    root.removeAttributeNode(declaration);
    declaration.setValue("http://example.org/detached");
    assertFalse("a removed declaration binds nothing", root.lookupNamespaceUri("p").isPresent());
  }

  @Test
  public void testNamespaceDeclarations() throws DomException {
    root.setAttribute("xmlns:p", OTHER_NAMESPACE);
    root.setAttributeNS(Constants.XMLNS_NAMESPACE_URI, "xmlns:q", "http://example.org/q");

    assertEquals(OTHER_NAMESPACE, root.lookupNamespaceUri("p").orElseThrow());
    assertEquals("http://example.org/q", root.lookupNamespaceUri("q").orElseThrow());
    assertEquals("the own namespace is bound to the element's prefix", DomTestHelper.NAMESPACE,
        root.lookupNamespaceUri(null).orElseThrow());
    assertFalse(root.lookupNamespaceUri("unknown").isPresent());
    assertEquals(2, root.getNamespaceMappings().size());

    root.removeAttribute("xmlns:p");
    assertFalse(root.lookupNamespaceUri("p").isPresent());
  }

  @Test
  public void testReservedPrefixes() {
    assertEquals(Constants.XML_NAMESPACE_URI, root.lookupNamespaceUri("xml").orElseThrow());
    assertEquals(Constants.XMLNS_NAMESPACE_URI, root.lookupNamespaceUri("xmlns").orElseThrow());
  }

  @Test
  public void testIllegalNamespaceDeclarations() {
    assertFails(DomErrorType.NAMESPACE, () -> root.setAttribute("xmlns:p", ""));
    assertFails(DomErrorType.NAMESPACE, () -> root.setAttribute("xmlns:xml", OTHER_NAMESPACE));
    assertFails(DomErrorType.NAMESPACE, () -> root.setAttribute("xmlns:p", Constants.XML_NAMESPACE_URI));
    assertFails(DomErrorType.NAMESPACE, () -> root.setAttribute("xmlns:p", Constants.XMLNS_NAMESPACE_URI));
    assertFails(DomErrorType.NAMESPACE, () -> root.setAttributeNS(OTHER_NAMESPACE, "xmlns:p", OTHER_NAMESPACE));
    assertFalse(root.hasAttributes());
    assertTrue(root.getNamespaceMappings().isEmpty());
  }

  @Test
  public void testInheritedNamespaces() throws DomException {
    root.setAttribute("xmlns:p", OTHER_NAMESPACE);
    final Element child = document.createElement("child");
    final Element grandChild = document.createElement("grand-child");
    root.appendChild(child);
    child.appendChild(grandChild);
    child.setAttribute("xmlns", "");

    assertEquals(OTHER_NAMESPACE, grandChild.lookupNamespaceUri("p").orElseThrow());
    assertFalse("the default namespace is undeclared", grandChild.lookupNamespaceUri(null).isPresent());
    assertEquals(DomTestHelper.NAMESPACE, root.lookupNamespaceUri("").orElseThrow());
  }

  @Test
  public void testNamespacesNotInherited() throws DomException {
    final DomImplementationImpl implementation =
        new DomImplementationImpl(DomConfiguration.newBuilder().inheritNamespaceMappings(false).build());
    final Document localDocument = implementation.createDocument(null, "root", null);
    final Element localRoot = localDocument.getDocumentElement().orElseThrow();
    localRoot.setAttribute("xmlns:p", OTHER_NAMESPACE);
    final Element child = localDocument.createElement("child");
    localRoot.appendChild(child);

    assertEquals(OTHER_NAMESPACE, localRoot.lookupNamespaceUri("p").orElseThrow());
    assertFalse(child.lookupNamespaceUri("p").isPresent());
  }

  @Test
  public void testNamespacedAttributes() throws DomException {
    root.setAttributeNS(OTHER_NAMESPACE, "p:a", "1");
    assertEquals("1", root.getAttributeNS(OTHER_NAMESPACE, "a").orElseThrow());
    assertEquals("1", root.getAttribute("p:a").orElseThrow());
    assertTrue(root.hasAttributeNS(OTHER_NAMESPACE, "a"));
    assertFalse(root.hasAttributeNS(DomTestHelper.NAMESPACE, "a"));

    root.setAttributeNS(OTHER_NAMESPACE, "q:a", "2");
    assertEquals("same namespace and local name replace the attribute", 1, root.getAttributes().size());
    assertEquals("2", root.getAttributeNS(OTHER_NAMESPACE, "a").orElseThrow());
    assertEquals("q", root.getAttributeNodeNS(OTHER_NAMESPACE, "a").orElseThrow().getPrefix().orElseThrow());

    root.removeAttributeNS(OTHER_NAMESPACE, "a");
    assertFalse(root.hasAttributes());
  }

  @Test
  public void testAttributesWithoutNamespace() throws DomException {
    root.setAttributeNS(null, "a", "1");
    assertEquals("1", root.getAttributeNS("", "a").orElseThrow());
    assertFalse(root.getAttributeNodeNS(OTHER_NAMESPACE, "a").isPresent());
  }

  @Test
  public void testSetAttributeNodeNS() throws DomException {
    final Attribute attribute = document.createAttributeNS(OTHER_NAMESPACE, "p:a", "1");
    assertSame(attribute, root.setAttributeNodeNS(attribute));
    assertEquals(OTHER_NAMESPACE, attribute.getNamespaceUri().orElseThrow());
    assertEquals("a", attribute.getLocalName());
    assertSame(attribute, root.getAttributeNodeNS(OTHER_NAMESPACE, "a").orElseThrow());
  }

  @Test
  public void testGetElementsByTagName() throws DomException {
    final Element a = document.createElement("a");
    final Element b = document.createElement("b");
    final Element nestedA = document.createElement("a");
    final Element c = document.createElement("c");
    root.appendChild(a);
    a.appendChild(b);
    b.appendChild(nestedA);
    root.appendChild(c);
    root.appendChild(document.createTextNode("text"));

    assertEquals(Arrays.asList(a, nestedA), root.getElementsByTagName("a"));
    assertEquals(Arrays.asList("root", "a", "b", "a", "c"), nodeNames(root.getElementsByTagName("*")));
    assertEquals(Arrays.asList("b", "a"), nodeNames(b.getElementsByTagName("*")));
    assertEquals(Arrays.asList(a, nestedA), document.getElementsByTagName("a"));
    assertTrue(root.getElementsByTagName("d").isEmpty());
  }

  @Test
  public void testGetElementsByTagNameNS() throws DomException {
    final Element plain = document.createElement("item");
    final Element other = document.createElementNS(OTHER_NAMESPACE, "p:item");
    final Element own = document.createElementNS(DomTestHelper.NAMESPACE, "item");
    root.appendChild(plain);
    root.appendChild(other);
    root.appendChild(own);

    assertEquals(Collections.singletonList(other), root.getElementsByTagNameNS(OTHER_NAMESPACE, "item"));
    assertEquals(Arrays.asList(plain, other, own), root.getElementsByTagNameNS("*", "item"));
    assertEquals(Arrays.asList(root, own), root.getElementsByTagNameNS(DomTestHelper.NAMESPACE, "*"));
    assertEquals(Collections.singletonList(other), document.getElementsByTagNameNS(OTHER_NAMESPACE, "*"));
    assertEquals("the tag name includes the prefix", Collections.singletonList(other),
        root.getElementsByTagName("p:item"));
  }

  @Test
  public void testNoDescentIntoEntityReferences() throws DomException {
    final EntityReference reference = document.createEntityReference("entity");
    final Element hidden = document.createElement("hidden");
    reference.appendChild(hidden);
    root.appendChild(reference);
    final Element visible = document.createElement("hidden");
    root.appendChild(visible);

    assertEquals(Collections.singletonList(visible), root.getElementsByTagName("hidden"));
  }

  @Test
  public void testTextContent() throws DomException {
    final Text text = document.createTextNode("content");
    root.appendChild(text);
    assertEquals("root", root.getTagName());
    assertEquals("root", root.getNodeName());
    assertFalse(root.getNodeValue().isPresent());
    assertSame(text, root.getFirstChild().orElseThrow());
  }
}
