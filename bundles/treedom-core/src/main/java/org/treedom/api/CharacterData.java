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

package org.treedom.api;

import org.treedom.exception.DomException;

import java.util.Optional;

/**
 * Character data shared by text, CDATA and comment nodes. Offsets and counts are UTF-16 code units,
 * i.e. {@link String} indexes.
 */
public interface CharacterData extends Node {

  Optional<String> getData();

  void setData(String data);

  /**
   * Get the number of UTF-16 code units of the data.
   *
   * @return the length, {@code 0} if no data is set
   */
  int getLength();

  /**
   * Extract a range of the data. A zero {@code count} yields the empty string whatever the offset.
   *
   * @param offset the start offset
   * @param count the number of code units, clamped to the end of the data
   * @return the substring
   * @throws DomException {@link org.treedom.exception.DomErrorType#INDEX_SIZE} if a value is negative,
   *         if there is no data or if {@code offset} is not below the length
   */
  String substringData(int offset, int count) throws DomException;

  void appendData(String data);

  void insertData(int offset, String data) throws DomException;

  void deleteData(int offset, int count) throws DomException;

  /**
   * Replace a range of the data.
   *
   * @param offset the start offset
   * @param count the number of code units to replace, clamped to the end of the data
   * @param data the replacement
   * @throws DomException {@link org.treedom.exception.DomErrorType#INDEX_SIZE} if a value is negative
   *         or {@code offset} is not below the length; without data only the empty range at offset
   *         {@code 0} is accepted
   */
  void replaceData(int offset, int count, String data) throws DomException;
}
