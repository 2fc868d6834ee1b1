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

package org.treedom.axis;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.treedom.DomTestHelper;
import org.treedom.api.Document;
import org.treedom.api.Element;
import org.treedom.api.Node;
import org.treedom.api.Text;
import org.treedom.api.visitor.NodeVisitor;
import org.treedom.api.visitor.VisitResult;
import org.treedom.api.visitor.VisitResultType;
import org.treedom.exception.DomException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.treedom.DomTestHelper.nodeNames;

/**
 * Test {@link VisitorDescendantAxis} on the tree
 *
 * <pre>
 * root
 *   a
 *     a1
 *     a2
 *   b
 *     b1
 *   c
 *     #text
 * </pre>
 */
public final class VisitorDescendantAxisTest {

  private Document document;

  private Element root;

  private Element a;

  @Before
  public void setUp() throws DomException {
    document = DomTestHelper.createDocument();
    root = DomTestHelper.documentElement(document);
    a = (Element) root.appendChild(document.createElement("a"));
    a.appendChild(document.createElement("a1"));
    a.appendChild(document.createElement("a2"));
    final Node b = root.appendChild(document.createElement("b"));
    b.appendChild(document.createElement("b1"));
    final Node c = root.appendChild(document.createElement("c"));
    c.appendChild(document.createTextNode("text"));
  }

  private static List<String> traverse(final VisitorDescendantAxis axis) {
    return nodeNames(ImmutableList.copyOf(axis));
  }

  /** Visitor answering {@code result} for the element named {@code name}. */
  private static NodeVisitor visitorFor(final String name, final VisitResult result) {
    return new NodeVisitor() {
      @Override
      public VisitResult visit(final Element element) {
        return element.getTagName().equals(name) ? result : VisitResultType.CONTINUE;
      }
    };
  }

  @Test
  public void testIncludeSelf() {
    assertEquals(Arrays.asList("root", "a", "a1", "a2", "b", "b1", "c", "#text"),
        traverse(VisitorDescendantAxis.newBuilder(root).includeSelf().build()));
  }

  @Test
  public void testExcludeSelf() {
    assertEquals(Arrays.asList("a", "a1", "a2", "b", "b1", "c", "#text"),
        traverse(VisitorDescendantAxis.newBuilder(root).build()));
  }

  @Test
  public void testSubtree() {
    assertEquals(Arrays.asList("a1", "a2"), traverse(VisitorDescendantAxis.newBuilder(a).build()));
    assertEquals(Arrays.asList("a", "a1", "a2"), traverse(VisitorDescendantAxis.newBuilder(a).includeSelf().build()));
  }

  @Test
  public void testLeaf() throws DomException {
    final Text text = document.createTextNode("leaf");
    assertEquals(Collections.emptyList(), traverse(VisitorDescendantAxis.newBuilder(text).build()));
    assertEquals(Collections.singletonList("#text"),
        traverse(VisitorDescendantAxis.newBuilder(text).includeSelf().build()));
  }

  @Test
  public void testSkipSubtree() {
    assertEquals(Arrays.asList("root", "a", "b", "b1", "c", "#text"), traverse(
        VisitorDescendantAxis.newBuilder(root).includeSelf().visitor(visitorFor("a", VisitResultType.SKIPSUBTREE)).build()));
    assertEquals(Collections.singletonList("root"), traverse(
        VisitorDescendantAxis.newBuilder(root).includeSelf().visitor(visitorFor("root", VisitResultType.SKIPSUBTREE)).build()));
  }

  @Test
  public void testSkipSiblings() {
    assertEquals(Arrays.asList("root", "a", "a1", "b", "b1", "c", "#text"), traverse(
        VisitorDescendantAxis.newBuilder(root).includeSelf().visitor(visitorFor("a1", VisitResultType.SKIPSIBLINGS)).build()));
    assertEquals("the start node has no siblings to skip", Arrays.asList("a", "a1", "a2"), traverse(
        VisitorDescendantAxis.newBuilder(a).includeSelf().visitor(visitorFor("a", VisitResultType.SKIPSIBLINGS)).build()));
  }

  @Test
  public void testTerminate() {
    assertEquals(Arrays.asList("root", "a", "a1", "a2", "b"), traverse(
        VisitorDescendantAxis.newBuilder(root).includeSelf().visitor(visitorFor("b", VisitResultType.TERMINATE)).build()));
  }

  @Test
  public void testVisitorCalls() {
    final NodeVisitor visitor = mock(NodeVisitor.class);
    final List<String> names =
        traverse(VisitorDescendantAxis.newBuilder(root).includeSelf().visitor(visitor).build());

    assertEquals(8, names.size());
    verify(visitor, times(7)).visit(any(Element.class));
    verify(visitor, times(1)).visit(any(Text.class));
  }
}
