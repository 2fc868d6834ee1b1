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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public final class NodeKindTest {

  @Test
  public void testIds() {
    assertEquals(1, NodeKind.ELEMENT.getId());
    assertEquals(9, NodeKind.DOCUMENT.getId());
    assertEquals(12, NodeKind.NOTATION.getId());
  }

  @Test
  public void testFixedNodeNames() {
    assertEquals("#text", NodeKind.TEXT.getFixedNodeName());
    assertEquals("#document", NodeKind.DOCUMENT.getFixedNodeName());
    assertNull(NodeKind.ELEMENT.getFixedNodeName());
    assertNull(NodeKind.ATTRIBUTE.getFixedNodeName());
  }

  @Test
  public void testDocumentChildren() {
    assertTrue(NodeKind.DOCUMENT.allowsChild(NodeKind.ELEMENT));
    assertTrue(NodeKind.DOCUMENT.allowsChild(NodeKind.DOCUMENT_TYPE));
    assertTrue(NodeKind.DOCUMENT.allowsChild(NodeKind.COMMENT));
    assertTrue(NodeKind.DOCUMENT.allowsChild(NodeKind.PROCESSING_INSTRUCTION));
    assertFalse(NodeKind.DOCUMENT.allowsChild(NodeKind.TEXT));
    assertFalse(NodeKind.DOCUMENT.allowsChild(NodeKind.CDATA));
  }

  @Test
  public void testContentChildren() {
    for (final NodeKind parent : new NodeKind[] { NodeKind.ELEMENT, NodeKind.DOCUMENT_FRAGMENT,
        NodeKind.ENTITY_REFERENCE, NodeKind.ENTITY }) {
      assertTrue(parent.allowsChild(NodeKind.ELEMENT));
      assertTrue(parent.allowsChild(NodeKind.TEXT));
      assertTrue(parent.allowsChild(NodeKind.CDATA));
      assertTrue(parent.allowsChild(NodeKind.ENTITY_REFERENCE));
      assertFalse(parent.allowsChild(NodeKind.DOCUMENT_TYPE));
      assertFalse(parent.allowsChild(NodeKind.ATTRIBUTE));
      assertFalse(parent.allowsChild(NodeKind.DOCUMENT));
    }
    assertTrue(NodeKind.ATTRIBUTE.allowsChild(NodeKind.TEXT));
    assertTrue(NodeKind.ATTRIBUTE.allowsChild(NodeKind.ENTITY_REFERENCE));
    assertFalse(NodeKind.ATTRIBUTE.allowsChild(NodeKind.ELEMENT));
  }

  @Test
  public void testLeaves() {
    for (final NodeKind parent : new NodeKind[] { NodeKind.TEXT, NodeKind.CDATA, NodeKind.COMMENT,
        NodeKind.PROCESSING_INSTRUCTION, NodeKind.DOCUMENT_TYPE, NodeKind.NOTATION }) {
      for (final NodeKind child : NodeKind.values()) {
        assertFalse(parent + " may not have " + child + " children", parent.allowsChild(child));
      }
    }
  }

  @Test
  public void testValues() {
    assertTrue(NodeKind.ATTRIBUTE.hasValue());
    assertTrue(NodeKind.COMMENT.hasValue());
    assertFalse(NodeKind.ELEMENT.hasValue());
    assertTrue(NodeKind.CDATA.isCharacterData());
    assertFalse(NodeKind.PROCESSING_INSTRUCTION.isCharacterData());
  }
}
