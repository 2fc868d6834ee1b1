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

import org.treedom.node.NodeKind;
import org.slf4j.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Provides some logging helper methods, above all for the lenient tier of the tree API: calls that
 * hit a node of the wrong kind or an unparsable name are reported here and degrade to a default
 * value instead of failing.
 */
public final class LogWrapper {

  /** Logger. */
  private final Logger logger;

  /**
   * Constructor.
   *
   * @param logger logger
   */
  public LogWrapper(final Logger logger) {
    this.logger = requireNonNull(logger);
  }

  /**
   * Report an operation invoked on a node whose kind doesn't support it.
   *
   * @param operation the operation name
   * @param actual the kind of the node
   */
  public void invalidNodeKind(final String operation, final NodeKind actual) {
    warn("Operation '{}' is not supported by node kind {}.", operation, actual);
  }

  /**
   * Report access to kind-specific state the node doesn't carry.
   *
   * @param operation the operation name
   * @param actual the kind of the node
   */
  public void invalidExtension(final String operation, final NodeKind actual) {
    warn("Operation '{}' accessed extension state a {} node doesn't have.", operation, actual);
  }

  /**
   * Report a name argument that could not be parsed.
   *
   * @param operation the operation name
   * @param name the offending name
   */
  public void invalidName(final String operation, final String name) {
    warn("Operation '{}' got an invalid name: '{}'.", operation, name);
  }

  /**
   * Log error information.
   *
   * @param exception Exception to log.
   */
  public void error(final Exception exception) {
    if (logger.isErrorEnabled()) {
      logger.error(exception.getMessage(), exception);
    }
  }

  /**
   * Log debugging information.
   *
   * @param message Message to log.
   * @param objects objects for data
   */
  public void debug(final String message, final Object... objects) {
    if (logger.isDebugEnabled()) {
      logger.debug(message, objects);
    }
  }

  /**
   * Warn information.
   *
   * @param message Message to log.
   * @param objects objects for data
   */
  public void warn(final String message, final Object... objects) {
    if (logger.isWarnEnabled()) {
      logger.warn(message, objects);
    }
  }
}
