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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.exception.DomException;

import java.util.List;
import java.util.Optional;

/**
 * A document: the root of a tree and the factory of its nodes. Every node created here is
 * detached and owned by this document.
 */
public interface Document extends Node {

  Optional<DocumentType> getDoctype();

  DomImplementation getImplementation();

  /**
   * Get the root element.
   *
   * @return the document element if there is one
   */
  Optional<Element> getDocumentElement();

  /**
   * Create an element.
   *
   * @param tagName the qualified name
   * @return the new element
   * @throws DomException if the name is malformed
   */
  Element createElement(String tagName) throws DomException;

  /**
   * Create an element in a namespace.
   *
   * @param namespaceUri the namespace URI, {@code null} or empty for none
   * @param qualifiedName the qualified name
   * @return the new element
   * @throws DomException if the name is malformed or doesn't fit the namespace
   */
  Element createElementNS(@Nullable String namespaceUri, String qualifiedName) throws DomException;

  DocumentFragment createDocumentFragment();

  Text createTextNode(String data);

  Comment createComment(String data);

  CDataSection createCDataSection(String data);

  /**
   * Create a processing instruction.
   *
   * @param target the target, which must be an XML name
   * @param data the data, may be {@code null}
   * @return the new processing instruction
   * @throws DomException if the target is malformed
   */
  ProcessingInstruction createProcessingInstruction(String target, @Nullable String data) throws DomException;

  Attribute createAttribute(String name) throws DomException;

  Attribute createAttribute(String name, String value) throws DomException;

  Attribute createAttributeNS(@Nullable String namespaceUri, String qualifiedName) throws DomException;

  Attribute createAttributeNS(@Nullable String namespaceUri, String qualifiedName, String value)
      throws DomException;

  EntityReference createEntityReference(String name) throws DomException;

  /**
   * Find the elements with a tag name below and including the document element, in document order.
   *
   * @param tagName the qualified name, {@code "*"} matches every element
   * @return the matching elements
   */
  List<Element> getElementsByTagName(String tagName);

  List<Element> getElementsByTagNameNS(String namespaceUri, String localName);

  /**
   * Without a schema no attribute is known to be an ID, so this never finds anything.
   *
   * @param elementId the ID
   * @return always empty
   */
  Optional<Element> getElementById(String elementId);
}
