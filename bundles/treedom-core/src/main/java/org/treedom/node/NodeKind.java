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

package org.treedom.node;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.treedom.api.Attribute;
import org.treedom.api.CDataSection;
import org.treedom.api.Comment;
import org.treedom.api.Document;
import org.treedom.api.DocumentFragment;
import org.treedom.api.DocumentType;
import org.treedom.api.Element;
import org.treedom.api.Entity;
import org.treedom.api.EntityReference;
import org.treedom.api.Notation;
import org.treedom.api.ProcessingInstruction;
import org.treedom.api.Text;
import org.treedom.api.visitor.NodeVisitor;
import org.treedom.api.visitor.VisitResult;
import org.treedom.settings.Constants;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Enumeration for the different kinds of nodes of a tree. Every kind knows its DOM node type
 * number, the fixed node name of unnamed kinds, whether its node value is defined at all, and which
 * kinds it accepts as children.
 */
public enum NodeKind {

  /** Element kind. */
  ELEMENT((short) 1, null, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Element) node);
    }
  },

  /** Attribute kind. */
  ATTRIBUTE((short) 2, null, true) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Attribute) node);
    }
  },

  /** Text kind. */
  TEXT((short) 3, Constants.TEXT_NODE_NAME, true) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Text) node);
    }
  },

  /** CDATA section kind. */
  CDATA((short) 4, Constants.CDATA_NODE_NAME, true) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((CDataSection) node);
    }
  },

  /** Entity reference kind. */
  ENTITY_REFERENCE((short) 5, null, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((EntityReference) node);
    }
  },

  /** Entity kind. */
  ENTITY((short) 6, null, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Entity) node);
    }
  },

  /** Processing instruction kind. */
  PROCESSING_INSTRUCTION((short) 7, null, true) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((ProcessingInstruction) node);
    }
  },

  /** Comment kind. */
  COMMENT((short) 8, Constants.COMMENT_NODE_NAME, true) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Comment) node);
    }
  },

  /** Document kind. */
  DOCUMENT((short) 9, Constants.DOCUMENT_NODE_NAME, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Document) node);
    }
  },

  /** Document type kind. */
  DOCUMENT_TYPE((short) 10, null, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((DocumentType) node);
    }
  },

  /** Document fragment kind. */
  DOCUMENT_FRAGMENT((short) 11, Constants.DOCUMENT_FRAGMENT_NODE_NAME, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((DocumentFragment) node);
    }
  },

  /** Notation kind. */
  NOTATION((short) 12, null, false) {
    @Override
    public VisitResult accept(final NodeVisitor visitor, final NodeImpl node) {
      return visitor.visit((Notation) node);
    }
  };

  /** Child kinds each kind accepts. */
  private static final Map<NodeKind, Set<NodeKind>> ALLOWED_CHILDREN = new EnumMap<>(NodeKind.class);

  static {
    for (final NodeKind kind : values()) {
      ALLOWED_CHILDREN.put(kind, EnumSet.noneOf(NodeKind.class));
    }

    ALLOWED_CHILDREN.put(DOCUMENT, EnumSet.of(ELEMENT, COMMENT, PROCESSING_INSTRUCTION, DOCUMENT_TYPE));

    final Set<NodeKind> content = EnumSet.of(ELEMENT, TEXT, COMMENT, PROCESSING_INSTRUCTION, CDATA, ENTITY_REFERENCE);
    for (final NodeKind kind : EnumSet.of(DOCUMENT_FRAGMENT, ELEMENT, ENTITY_REFERENCE, ENTITY)) {
      ALLOWED_CHILDREN.put(kind, content);
    }

    ALLOWED_CHILDREN.put(ATTRIBUTE, EnumSet.of(TEXT, ENTITY_REFERENCE));
  }

  /** DOM node type number. */
  private final short id;

  /** Fixed node name, {@code null} if nodes of this kind are named individually. */
  private final @Nullable String nodeName;

  /** Determines if nodes of this kind carry a node value. */
  private final boolean hasValue;

  /**
   * Constructor.
   *
   * @param id DOM node type number
   * @param nodeName fixed node name or {@code null}
   * @param hasValue if the node value is defined for the kind
   */
  NodeKind(final short id, final @Nullable String nodeName, final boolean hasValue) {
    this.id = id;
    this.nodeName = nodeName;
    this.hasValue = hasValue;
  }

  /**
   * Dispatch to the visitor method of the node kind.
   *
   * @param visitor the visitor
   * @param node the node of this kind
   * @return the result of the visitor
   */
  public abstract VisitResult accept(NodeVisitor visitor, NodeImpl node);

  /**
   * Get the DOM node type number.
   *
   * @return the number
   */
  public short getId() {
    return id;
  }

  /**
   * Get the fixed node name of kinds which aren't named individually, like {@code #text}.
   *
   * @return the fixed node name, {@code null} otherwise
   */
  public @Nullable String getFixedNodeName() {
    return nodeName;
  }

  /**
   * Determines if nodes of this kind carry a node value.
   *
   * @return {@code true} if they do, {@code false} if their node value is always absent
   */
  public boolean hasValue() {
    return hasValue;
  }

  /**
   * Determines if a node of this kind may have a child of the given kind.
   *
   * @param child the kind of the prospective child
   * @return {@code true} if allowed, {@code false} otherwise
   */
  public boolean allowsChild(final NodeKind child) {
    return ALLOWED_CHILDREN.get(this).contains(child);
  }

  /**
   * Determines if nodes of this kind hold character data.
   *
   * @return {@code true} for text, CDATA and comment nodes
   */
  public boolean isCharacterData() {
    return this == TEXT || this == CDATA || this == COMMENT;
  }
}
