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

package org.treedom.service.xml.serialize;

import org.treedom.access.DomConfiguration;
import org.treedom.api.Attribute;
import org.treedom.api.Document;
import org.treedom.api.DocumentType;
import org.treedom.api.Entity;
import org.treedom.api.Node;
import org.treedom.api.Notation;
import org.treedom.api.ProcessingInstruction;
import org.treedom.settings.Constants;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Renders a node and its subtree as markup text for debugging and tests. Nothing is escaped or
 * indented, so the output is only well-formed if the content is.
 * </p>
 *
 * <p>
 * A document renders its document type first, then the remaining children, then the document
 * element.
 * </p>
 */
public final class NodeRenderer {

  /** Determines if CDATA sections get a space inside each delimiter. */
  private final boolean cdataPadding;

  /**
   * Constructor.
   *
   * @param configuration the configuration to take the rendering options from
   */
  public NodeRenderer(final DomConfiguration configuration) {
    cdataPadding = requireNonNull(configuration).isCDataPadding();
  }

  /**
   * Render a node.
   *
   * @param node the node to render
   * @return the markup
   */
  public String render(final Node node) {
    final StringBuilder builder = new StringBuilder();
    emit(builder, requireNonNull(node));
    return builder.toString();
  }

  private void emit(final StringBuilder builder, final Node node) {
    switch (node.getNodeType()) {
      case ELEMENT:
        builder.append(Constants.ELEMENT_START_START).append(node.getNodeName());
        for (final Attribute attribute : node.getAttributes().values()) {
          builder.append(' ');
          emit(builder, attribute);
        }
        builder.append(Constants.ELEMENT_START_END);
        emitChildren(builder, node);
        builder.append(Constants.ELEMENT_END_START).append(node.getNodeName()).append(Constants.ELEMENT_END_END);
        break;
      case ATTRIBUTE:
        builder.append(node.getNodeName()).append("=\"").append(((Attribute) node).getValue()).append('"');
        break;
      case TEXT:
        builder.append(node.getNodeValue().orElse(""));
        break;
      case CDATA:
        final String padding = cdataPadding ? " " : "";
        builder.append(Constants.CDATA_START)
               .append(padding)
               .append(node.getNodeValue().orElse(""))
               .append(padding)
               .append(Constants.CDATA_END);
        break;
      case COMMENT:
        builder.append(Constants.COMMENT_START).append(node.getNodeValue().orElse("")).append(Constants.COMMENT_END);
        break;
      case PROCESSING_INSTRUCTION:
        final ProcessingInstruction pi = (ProcessingInstruction) node;
        builder.append(Constants.PI_START).append(pi.getTarget());
        pi.getData().ifPresent(data -> builder.append(' ').append(data));
        builder.append(Constants.PI_END);
        break;
      case ENTITY_REFERENCE:
        builder.append(Constants.ENTITY_REFERENCE_START).append(node.getNodeName()).append(Constants.ENTITY_REFERENCE_END);
        break;
      case ENTITY:
        final Entity entity = (Entity) node;
        builder.append(Constants.ENTITY_START).append(' ').append(node.getNodeName());
        emitExternalId(builder, entity.getPublicId(), entity.getSystemId());
        entity.getNotationName().ifPresent(notation -> builder.append(' ').append(Constants.NDATA).append(' ').append(notation));
        builder.append(Constants.DECLARATION_END);
        break;
      case NOTATION:
        final Notation notation = (Notation) node;
        builder.append(Constants.NOTATION_START).append(' ').append(node.getNodeName());
        emitExternalId(builder, notation.getPublicId(), notation.getSystemId());
        builder.append(Constants.DECLARATION_END);
        break;
      case DOCUMENT_TYPE:
        final DocumentType doctype = (DocumentType) node;
        builder.append(Constants.DOCTYPE_START).append(' ').append(node.getNodeName());
        emitExternalId(builder, doctype.getPublicId(), doctype.getSystemId());
        builder.append(Constants.DOCTYPE_END);
        break;
      case DOCUMENT:
        final Document document = (Document) node;
        document.getDoctype().ifPresent(type -> emit(builder, type));
        for (final Node child : node.getChildNodes()) {
          if (!isDocumentSlot(document, child)) {
            emit(builder, child);
          }
        }
        document.getDocumentElement().ifPresent(element -> emit(builder, element));
        break;
      case DOCUMENT_FRAGMENT:
        emitChildren(builder, node);
        break;
      default:
        throw new AssertionError("Unknown node kind: " + node.getNodeType());
    }
  }

  private void emitChildren(final StringBuilder builder, final Node node) {
    for (final Node child : node.getChildNodes()) {
      emit(builder, child);
    }
  }

  private static void emitExternalId(final StringBuilder builder, final Optional<String> publicId,
      final Optional<String> systemId) {
    publicId.ifPresent(id -> builder.append(' ').append(Constants.DOCTYPE_PUBLIC).append(" \"").append(id).append('"'));
    systemId.ifPresent(id -> builder.append(' ').append(Constants.DOCTYPE_SYSTEM).append(" \"").append(id).append('"'));
  }

  private static boolean isDocumentSlot(final Document document, final Node child) {
    return document.getDoctype().map(child::isSameNode).orElse(false)
        || document.getDocumentElement().map(child::isSameNode).orElse(false);
  }
}
