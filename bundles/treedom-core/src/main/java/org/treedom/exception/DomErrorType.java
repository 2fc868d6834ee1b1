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

package org.treedom.exception;

/**
 * Classification of {@link DomException}s, following the DOM exception codes a tree operation can
 * raise.
 */
public enum DomErrorType {

  /** An offset or count is out of bounds of character data. */
  INDEX_SIZE,

  /** A malformed string, or an operation invoked on an incompatible node kind. */
  SYNTAX,

  /** A structural precondition is violated. */
  INVALID_STATE,

  /** A node is inserted somewhere it doesn't belong. */
  HIERARCHY_REQUEST,

  /** A node is used in a different document than the one that created it. */
  WRONG_DOCUMENT,

  /** A qualified name and its namespace URI don't fit together. */
  NAMESPACE,

  /** A name contains a character which is not allowed. */
  INVALID_CHARACTER,

  /** A referenced node does not exist in the context where it is expected. */
  NOT_FOUND,

  /** An attribute is added to an element while it is still owned by another element. */
  INUSE_ATTRIBUTE
}
