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

package org.treedom.axis;

import com.google.common.collect.AbstractIterator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.api.Node;
import org.treedom.api.visitor.NodeVisitor;
import org.treedom.api.visitor.VisitResult;
import org.treedom.api.visitor.VisitResultType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Iterate over all descendants of a node in document order (pre-order). The start node is
 * optionally included. Furthermore a {@link NodeVisitor} is usable to guide the traversal: each
 * node is visited right before the traversal moves on from it, and the {@link VisitResult}
 * decides whether its subtree or its following siblings are skipped, or the traversal ends.
 * </p>
 *
 * <p>
 * Children are read when the traversal enters a node, so changes to the children of nodes already
 * entered aren't seen.
 * </p>
 */
public final class VisitorDescendantAxis extends AbstractIterator<Node> {

  /** Iterators over the remaining siblings of the ancestors of the current node. */
  private final Deque<Iterator<Node>> siblingStack;

  /** The node to start at. */
  private final Node startNode;

  /** Optional visitor. */
  private final @Nullable NodeVisitor visitor;

  /** Determines if the start node is included. */
  private final boolean includeSelf;

  /** Determines if it is the first call. */
  private boolean isFirstCall;

  /** The node returned last. */
  private @Nullable Node current;

  /**
   * Get a new builder instance.
   *
   * @param startNode the node to start at
   * @return {@link Builder} instance
   */
  public static Builder newBuilder(final Node startNode) {
    return new Builder(startNode);
  }

  /** The builder. */
  public static class Builder {

    /** Optional visitor. */
    private @Nullable NodeVisitor visitor;

    /** The node to start at. */
    private final Node startNode;

    /** Determines if current node should be included or not. */
    private boolean includeSelf;

    /**
     * Constructor.
     *
     * @param startNode the node to start at
     */
    public Builder(final Node startNode) {
      this.startNode = requireNonNull(startNode);
    }

    /**
     * Set include self option.
     *
     * @return this builder instance
     */
    public Builder includeSelf() {
      includeSelf = true;
      return this;
    }

    /**
     * Set visitor.
     *
     * @param visitor the visitor
     * @return this builder instance
     */
    public Builder visitor(final NodeVisitor visitor) {
      this.visitor = requireNonNull(visitor);
      return this;
    }

    /**
     * Build a new instance.
     *
     * @return new {@link VisitorDescendantAxis} instance
     */
    public VisitorDescendantAxis build() {
      return new VisitorDescendantAxis(this);
    }
  }

  /**
   * Private constructor.
   *
   * @param builder the builder to construct a new instance
   */
  private VisitorDescendantAxis(final Builder builder) {
    startNode = builder.startNode;
    visitor = builder.visitor;
    includeSelf = builder.includeSelf;
    siblingStack = new ArrayDeque<>();
    isFirstCall = true;
  }

  @Override
  protected Node computeNext() {
    if (isFirstCall) {
      isFirstCall = false;
      if (includeSelf) {
        current = startNode;
        return startNode;
      }
      siblingStack.push(startNode.getChildNodes().iterator());
    } else {
      assert current != null;
      // A visitor returning null is treated like CONTINUE.
      final VisitResult result = visitor == null ? null : current.accept(visitor);

      if (result == VisitResultType.TERMINATE) {
        return endOfData();
      }

      // The iterator on top holds the siblings of the current node, except for the start node.
      if (result == VisitResultType.SKIPSIBLINGS && current != startNode && !siblingStack.isEmpty()) {
        siblingStack.pop();
      }

      if (result != VisitResultType.SKIPSUBTREE && current.hasChildNodes()) {
        siblingStack.push(current.getChildNodes().iterator());
      }
    }

    while (!siblingStack.isEmpty()) {
      final Iterator<Node> siblings = siblingStack.peek();
      if (siblings.hasNext()) {
        current = siblings.next();
        return current;
      }
      siblingStack.pop();
    }

    return endOfData();
  }
}
