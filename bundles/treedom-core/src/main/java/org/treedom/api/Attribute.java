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
 * An attribute. Attributes are owned by an element but never part of its children, so they have no
 * parent node.
 */
public interface Attribute extends Node {

  /**
   * Get the value. An attribute with children takes its value from the text below them, looking
   * through entity references, otherwise from the value last set.
   *
   * @return the value, empty if none was given
   */
  String getValue();

  /**
   * Set the value, replacing any children. A namespace declaration installed on an element
   * rebinds its prefix in the element's namespace mappings.
   *
   * @param value the new value
   * @throws DomException {@link org.treedom.exception.DomErrorType#NAMESPACE} if the new value is
   *         no legal binding for a declared prefix; the value is left unchanged then
   */
  void setValue(String value) throws DomException;

  /**
   * Get the element the attribute is installed on.
   *
   * @return the element, or empty if it is not installed
   */
  Optional<Element> getOwnerElement();

  /**
   * Without a schema there are no default attribute values, so every attribute is specified.
   *
   * @return {@code true}
   */
  boolean isSpecified();
}
