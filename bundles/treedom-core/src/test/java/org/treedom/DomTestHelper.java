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

package org.treedom;

import org.treedom.access.DomConfiguration;
import org.treedom.access.DomImplementationImpl;
import org.treedom.api.Document;
import org.treedom.api.Element;
import org.treedom.api.Node;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

/**
 * Helper class for tests. Tests must hold on to the documents they create, since nodes only keep
 * weak references to their owner document.
 */
public final class DomTestHelper {

  /** Namespace of the test documents. */
  public static final String NAMESPACE = "http://example.org/";

  /** Name of the document element of the test documents. */
  public static final String ROOT = "root";

  /** Operation which may fail. */
  public interface DomOperation {
    void run() throws DomException;
  }

  private DomTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get an implementation with the default configuration.
   *
   * @return the implementation
   */
  public static DomImplementationImpl implementation() {
    return new DomImplementationImpl(DomConfiguration.defaults());
  }

  /**
   * Create a document with the document element {@value #ROOT} in namespace {@value #NAMESPACE}.
   *
   * @return the document
   * @throws DomException if creation fails
   */
  public static Document createDocument() throws DomException {
    return implementation().createDocument(NAMESPACE, ROOT, null);
  }

  public static Element documentElement(final Document document) {
    return document.getDocumentElement().orElseThrow();
  }

  /**
   * Get the node names of nodes, for comparing node sequences.
   *
   * @param nodes the nodes
   * @return the node names in the same order
   */
  public static List<String> nodeNames(final Collection<? extends Node> nodes) {
    return nodes.stream().map(Node::getNodeName).collect(Collectors.toList());
  }

  /**
   * Assert that an operation fails with the given error type.
   *
   * @param expected the expected error type
   * @param operation the operation
   */
  public static void assertFails(final DomErrorType expected, final DomOperation operation) {
    try {
      operation.run();
      fail("Expected a DomException of type " + expected);
    } catch (final DomException e) {
      assertEquals("Unexpected error type: " + e.getMessage(), expected, e.getType());
    }
  }
}
