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

import static java.util.Objects.requireNonNull;

/**
 * Exception to hold all relevant failures of tree construction, mutation and query operations.
 *
 */
public class DomException extends Exception {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /** The kind of failure. */
  private final DomErrorType type;

  /**
   * Constructor.
   *
   * @param type the kind of failure
   * @param message message
   */
  public DomException(final DomErrorType type, final String message) {
    super(message);
    this.type = requireNonNull(type);
  }

  /**
   * Constructor with a format string.
   *
   * @param type the kind of failure
   * @param message message format
   * @param args format arguments
   */
  public DomException(final DomErrorType type, final String message, final Object... args) {
    super(String.format(message, args));
    this.type = requireNonNull(type);
  }

  /**
   * Constructor.
   *
   * @param type the kind of failure
   * @param message message
   * @param throwable the cause
   */
  public DomException(final DomErrorType type, final String message, final Throwable throwable) {
    super(message, throwable);
    this.type = requireNonNull(type);
  }

  /**
   * Get the kind of failure.
   *
   * @return the error type
   */
  public DomErrorType getType() {
    return type;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + type + "]: " + getMessage();
  }
}
