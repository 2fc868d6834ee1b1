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

package org.treedom.utils;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Test {@link XMLToken}.
 */
public final class XMLTokenTest {

  @Test
  public void testIsName() {
    assertTrue(XMLToken.isName("a"));
    assertTrue(XMLToken.isName("a:b:c"));
    assertTrue(XMLToken.isName(":a"));
    assertTrue(XMLToken.isName("élément"));
    assertFalse(XMLToken.isName(""));
    assertFalse(XMLToken.isName("-a"));
    assertFalse(XMLToken.isName("a b"));
  }

  @Test
  public void testIsNCName() {
    assertTrue(XMLToken.isNCName("child-1"));
    assertTrue(XMLToken.isNCName("_x.y"));
    assertFalse(XMLToken.isNCName("p:x"));
    assertFalse(XMLToken.isNCName("1x"));
  }

  @Test
  public void testIsQName() {
    assertTrue(XMLToken.isQName("x"));
    assertTrue(XMLToken.isQName("p:x"));
    assertFalse(XMLToken.isQName("p:"));
    assertFalse(XMLToken.isQName(":x"));
    assertFalse(XMLToken.isQName("a:b:c"));
    assertFalse(XMLToken.isQName(""));
  }

  @Test
  public void testSupplementaryCharacters() {
    assertTrue(XMLToken.isNCName(new String(Character.toChars(0x10000)) + "a"));
  }
}
