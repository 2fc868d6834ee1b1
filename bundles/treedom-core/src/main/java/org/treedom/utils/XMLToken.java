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

import static java.util.Objects.requireNonNull;

/**
 * This class provides convenience operations for XML-specific character operations, working on
 * Java strings (code points) rather than encoded bytes.
 */
public final class XMLToken {
  /** Hidden constructor. */
  private XMLToken() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Checks if the specified character is a name start character, as required e.g. by QName and
   * NCName.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCStartChar(final int ch) {
    return ch < 0x80
        ? ch >= 'A' && ch <= 'Z' || ch >= 'a' && ch <= 'z' || ch == '_'
        : ch < 0x300
            ? ch >= 0xC0 && ch != 0xD7 && ch != 0xF7
            : ch >= 0x370 && ch <= 0x37D || ch >= 0x37F && ch <= 0x1FFF
                || ch >= 0x200C && ch <= 0x200D || ch >= 0x2070 && ch <= 0x218F
                || ch >= 0x2C00 && ch <= 0x2EFF || ch >= 0x3001 && ch <= 0xD7FF
                || ch >= 0xF900 && ch <= 0xFDCF || ch >= 0xFDF0 && ch <= 0xFFFD
                || ch >= 0x10000 && ch <= 0xEFFFF;
  }

  /**
   * Checks if the specified character is an XML letter.
   *
   * @param ch character
   * @return result of check
   */
  public static boolean isNCChar(final int ch) {
    return isNCStartChar(ch) || (ch < 0x100
        ? digit(ch) || ch == '-' || ch == '.' || ch == 0xB7
        : ch >= 0x300 && ch <= 0x36F || ch == 0x203F || ch == 0x2040);
  }

  /**
   * Checks if the specified character is an XML first-letter.
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean isStartChar(final int ch) {
    return isNCStartChar(ch) || ch == ':';
  }

  /**
   * Checks if the specified character is an XML letter.
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean isChar(final int ch) {
    return isNCChar(ch) || ch == ':';
  }

  /**
   * Checks if the specified token is a valid NCName.
   *
   * @param value value to be checked
   * @return result of check
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static boolean isNCName(final String value) {
    final int length = requireNonNull(value).length();
    return length != 0 && ncName(value, 0) == length;
  }

  /**
   * Checks if the specified token is a valid name.
   *
   * @param value value to be checked
   * @return result of check
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static boolean isName(final String value) {
    final int length = requireNonNull(value).length();
    for (int i = 0; i < length; ) {
      final int c = value.codePointAt(i);
      if (i == 0
          ? !isStartChar(c)
          : !isChar(c))
        return false;
      i += Character.charCount(c);
    }
    return length != 0;
  }

  /**
   * Checks if the specified token is a valid QName, that is an NCName optionally preceded by an
   * NCName prefix and a colon.
   *
   * @param value value to be checked
   * @return result of check
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static boolean isQName(final String value) {
    final int length = requireNonNull(value).length();
    if (length == 0)
      return false;
    final int i = ncName(value, 0);
    if (i == length)
      return true;
    if (i == 0 || value.charAt(i) != ':')
      return false;
    final int j = ncName(value, i + 1);
    return j != i + 1 && j == length;
  }

  /**
   * Checks the specified token as an NCName.
   *
   * @param value value to be checked
   * @param start start position
   * @return end position
   */
  private static int ncName(final String value, final int start) {
    final int length = value.length();
    for (int i = start; i < length; ) {
      final int c = value.codePointAt(i);
      if (i == start
          ? !isNCStartChar(c)
          : !isNCChar(c))
        return i;
      i += Character.charCount(c);
    }
    return length;
  }

  /**
   * Checks if the specified character is a digit (0 - 9).
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean digit(final int ch) {
    return ch >= '0' && ch <= '9';
  }
}
