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

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;
import org.treedom.access.DomImplementationImpl;
import org.treedom.api.Attribute;
import org.treedom.api.CDataSection;
import org.treedom.api.Comment;
import org.treedom.api.Document;
import org.treedom.api.DocumentFragment;
import org.treedom.api.DocumentType;
import org.treedom.api.DomImplementation;
import org.treedom.api.Element;
import org.treedom.api.Entity;
import org.treedom.api.EntityReference;
import org.treedom.api.Node;
import org.treedom.api.Notation;
import org.treedom.api.ProcessingInstruction;
import org.treedom.api.Text;
import org.treedom.api.visitor.NodeVisitor;
import org.treedom.api.visitor.VisitResult;
import org.treedom.api.visitor.VisitResultType;
import org.treedom.axis.VisitorDescendantAxis;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.name.Name;
import org.treedom.name.NameMatcher;
import org.treedom.node.delegates.DocumentDelegate;
import org.treedom.node.delegates.DocumentTypeDelegate;
import org.treedom.node.delegates.ElementDelegate;
import org.treedom.node.delegates.ExtensionDelegate;
import org.treedom.node.delegates.ExternalIdDelegate;
import org.treedom.service.xml.serialize.NodeRenderer;
import org.treedom.settings.Constants;
import org.treedom.utils.LogWrapper;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * The single node implementation behind every capability interface. A node consists of its kind,
 * name, optional value, weak references to its parent and owner document, a strong list of children
 * and the kind-specific state of an {@link ExtensionDelegate}.
 * </p>
 *
 * <p>
 * Calling a capability of another kind, for instance {@link #getAttribute(String)} on a text node,
 * is logged and answered with an empty result; operations declaring {@link DomException} fail with
 * {@link DomErrorType#INVALID_STATE} instead where the kind matters. Equality is identity.
 * </p>
 */
public final class NodeImpl implements Document, Element, Attribute, CDataSection, Comment, ProcessingInstruction,
    DocumentType, DocumentFragment, Entity, EntityReference, Notation {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(NodeImpl.class));

  /** Descends through elements only. */
  private static final NodeVisitor ELEMENT_TREE_VISITOR = new NodeVisitor() {
    @Override
    public VisitResult visit(final EntityReference node) {
      return VisitResultType.SKIPSUBTREE;
    }
  };

  /** The kind. */
  private final NodeKind kind;

  /** The name. */
  private final Name name;

  /** The implementation which created the node or its document. */
  private final DomImplementationImpl implementation;

  /** Kind-specific state, {@code null} for kinds without any. */
  private final @Nullable ExtensionDelegate extension;

  /** Children in document order. */
  private final List<NodeImpl> children;

  /** The node value. */
  private @Nullable String value;

  /** The parent. */
  private @Nullable WeakReference<NodeImpl> parent;

  /** The document which created the node. */
  private @Nullable WeakReference<NodeImpl> ownerDocument;

  /** The element an attribute is installed on. */
  private @Nullable WeakReference<NodeImpl> ownerElement;

  /**
   * Constructor.
   *
   * @param kind the kind
   * @param name the name
   * @param value the node value, may be {@code null}
   * @param extension the kind-specific state, may be {@code null}
   * @param implementation the creating implementation
   * @param ownerDocument the owner document, may be {@code null}
   */
  private NodeImpl(final NodeKind kind, final Name name, final @Nullable String value,
      final @Nullable ExtensionDelegate extension, final DomImplementationImpl implementation,
      final @Nullable NodeImpl ownerDocument) {
    assert extension == null || extension.getKind() == kind;
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
    this.implementation = requireNonNull(implementation);
    this.value = value;
    this.extension = extension;
    this.ownerDocument = ownerDocument == null ? null : new WeakReference<>(ownerDocument);
    children = new ArrayList<>();
  }

  /**
   * Create an empty document.
   *
   * @param implementation the creating implementation
   * @return the document
   */
  public static NodeImpl newDocument(final DomImplementationImpl implementation) {
    return new NodeImpl(NodeKind.DOCUMENT, Name.ofNodeName(Constants.DOCUMENT_NODE_NAME), null,
        new DocumentDelegate(), implementation, null);
  }

  /**
   * Create a document type, which has no owner document until it is added to one.
   *
   * @param implementation the creating implementation
   * @param name the name
   * @param publicId the public identifier, may be {@code null}
   * @param systemId the system identifier, may be {@code null}
   * @return the document type
   */
  public static NodeImpl newDocumentType(final DomImplementationImpl implementation, final Name name,
      final @Nullable String publicId, final @Nullable String systemId) {
    return new NodeImpl(NodeKind.DOCUMENT_TYPE, name, null,
        new DocumentTypeDelegate(new ExternalIdDelegate(NodeKind.DOCUMENT_TYPE, publicId, systemId, null)),
        implementation, null);
  }

  public @Nullable ExtensionDelegate getExtension() {
    return extension;
  }

  private static @Nullable NodeImpl upgrade(final @Nullable WeakReference<NodeImpl> reference) {
    return reference == null ? null : reference.get();
  }

  private @Nullable NodeImpl parentImpl() {
    return upgrade(parent);
  }

  /**
   * The document nodes of this node belong to: the node itself for a document, the owner document
   * otherwise.
   */
  private @Nullable NodeImpl effectiveDocument() {
    return kind == NodeKind.DOCUMENT ? this : upgrade(ownerDocument);
  }

  private boolean checkKind(final NodeKind expected, final String operation) {
    if (kind != expected) {
      LOGWRAPPER.invalidNodeKind(operation, kind);
      return false;
    }
    return true;
  }

  private <T extends ExtensionDelegate> Optional<T> delegate(final Class<T> type, final String operation) {
    if (type.isInstance(extension)) {
      return Optional.of(type.cast(extension));
    }
    LOGWRAPPER.invalidExtension(operation, kind);
    return Optional.empty();
  }

  private <T extends ExtensionDelegate> T requireDelegate(final Class<T> type, final String operation)
      throws DomException {
    return delegate(type, operation).orElseThrow(
        () -> new DomException(DomErrorType.INVALID_STATE, "Operation '%s' is not supported by node kind %s.",
            operation, kind));
  }

  private static Optional<Name> parseLeniently(final String qualifiedName, final String operation) {
    try {
      return Optional.of(Name.parse(qualifiedName));
    } catch (final DomException e) {
      LOGWRAPPER.invalidName(operation, qualifiedName);
      return Optional.empty();
    }
  }

  // ------------------------------------------------------------------------------------------
  // Node
  // ------------------------------------------------------------------------------------------

  @Override
  public NodeKind getNodeType() {
    return kind;
  }

  @Override
  public Name getName() {
    return name;
  }

  @Override
  public String getNodeName() {
    final String fixedNodeName = kind.getFixedNodeName();
    return fixedNodeName == null ? name.toString() : fixedNodeName;
  }

  @Override
  public Optional<String> getNodeValue() {
    return kind == NodeKind.ATTRIBUTE ? Optional.of(getValue()) : Optional.ofNullable(value);
  }

  @Override
  public void setNodeValue(final String value) throws DomException {
    requireNonNull(value);
    if (kind == NodeKind.ATTRIBUTE) {
      setValue(value);
      return;
    }
    if (!kind.hasValue()) {
      LOGWRAPPER.debug("Ignoring node value of {} node.", kind);
      return;
    }
    this.value = value;
  }

  @Override
  public Optional<Node> getParentNode() {
    return Optional.ofNullable(parentImpl());
  }

  @Override
  public List<Node> getChildNodes() {
    return ImmutableList.copyOf(children);
  }

  @Override
  public Optional<Node> getFirstChild() {
    return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
  }

  @Override
  public Optional<Node> getLastChild() {
    return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
  }

  @Override
  public Optional<Node> getPreviousSibling() {
    return sibling(-1);
  }

  @Override
  public Optional<Node> getNextSibling() {
    return sibling(1);
  }

  private Optional<Node> sibling(final int step) {
    final NodeImpl parentNode = parentImpl();
    if (parentNode == null) {
      return Optional.empty();
    }
    final int index = parentNode.children.indexOf(this);
    assert index != -1 : "node not among the children of its parent";
    final int siblingIndex = index + step;
    return siblingIndex >= 0 && siblingIndex < parentNode.children.size()
        ? Optional.of(parentNode.children.get(siblingIndex))
        : Optional.empty();
  }

  @Override
  public Map<Name, Attribute> getAttributes() {
    return extension instanceof ElementDelegate
        ? ImmutableMap.copyOf(((ElementDelegate) extension).getAttributes())
        : ImmutableMap.of();
  }

  @Override
  public boolean hasAttributes() {
    return extension instanceof ElementDelegate && !((ElementDelegate) extension).getAttributes().isEmpty();
  }

  @Override
  public Optional<Document> getOwnerDocument() {
    return kind == NodeKind.DOCUMENT ? Optional.empty() : Optional.ofNullable(upgrade(ownerDocument));
  }

  @Override
  public Node insertBefore(final Node newChild, final @Nullable Node refChild) throws DomException {
    final NodeImpl child = Nodes.asImpl(newChild);
    @Nullable NodeImpl reference = refChild == null ? null : Nodes.asImpl(refChild);

    if (child.kind == NodeKind.DOCUMENT_FRAGMENT) {
      checkFragmentInsertable(child, null);
      final int index = reference == null ? -1 : children.indexOf(reference);
      moveFragment(child, index == -1 ? children.size() : index);
      return child;
    }

    checkInsertable(child, null);
    if (reference == child) {
      reference = child.sibling(1).map(NodeImpl.class::cast).orElse(null);
    }

    final NodeImpl oldParent = child.parentImpl();
    if (oldParent != null) {
      oldParent.detach(child);
    }
    final int index = reference == null ? -1 : children.indexOf(reference);
    attach(child, index == -1 ? children.size() : index);
    return child;
  }

  @Override
  public Node appendChild(final Node newChild) throws DomException {
    return insertBefore(newChild, null);
  }

  @Override
  public Node replaceChild(final Node newChild, final Node oldChild) throws DomException {
    final NodeImpl replaced = Nodes.asImpl(oldChild);
    if (!children.contains(replaced)) {
      throw new DomException(DomErrorType.NOT_FOUND, "Node to replace is not a child of this node.");
    }
    final NodeImpl child = Nodes.asImpl(newChild);
    if (child == replaced) {
      return replaced;
    }

    if (child.kind == NodeKind.DOCUMENT_FRAGMENT) {
      checkFragmentInsertable(child, replaced);
      final int index = children.indexOf(replaced);
      detach(replaced);
      moveFragment(child, index);
      return replaced;
    }

    checkInsertable(child, replaced);
    final NodeImpl oldParent = child.parentImpl();
    if (oldParent != null) {
      oldParent.detach(child);
    }
    final int index = children.indexOf(replaced);
    detach(replaced);
    attach(child, index);
    return replaced;
  }

  @Override
  public Node removeChild(final Node oldChild) throws DomException {
    final NodeImpl child = Nodes.asImpl(oldChild);
    if (!children.contains(child)) {
      throw new DomException(DomErrorType.NOT_FOUND, "Node to remove is not a child of this node.");
    }
    detach(child);
    return child;
  }

  /**
   * Check whether a node may become a child of this node.
   *
   * @param child the prospective child
   * @param replaced the child it replaces, may be {@code null}
   * @throws DomException if it may not
   */
  private void checkInsertable(final NodeImpl child, final @Nullable NodeImpl replaced) throws DomException {
    if (child.kind == NodeKind.ATTRIBUTE) {
      throw new DomException(DomErrorType.HIERARCHY_REQUEST, "An attribute never has a parent.");
    }
    if (!kind.allowsChild(child.kind)) {
      throw new DomException(DomErrorType.HIERARCHY_REQUEST, "A %s node may not be a child of a %s node.",
          child.kind, kind);
    }
    for (NodeImpl ancestor = this; ancestor != null; ancestor = ancestor.parentImpl()) {
      if (ancestor == child) {
        throw new DomException(DomErrorType.HIERARCHY_REQUEST, "A node may not be inserted below itself.");
      }
    }
    if (extension instanceof DocumentDelegate) {
      final DocumentDelegate documentDelegate = (DocumentDelegate) extension;
      if (child.kind == NodeKind.ELEMENT) {
        checkSlotFree(documentDelegate.getDocumentElement().orElse(null), child, replaced);
      } else if (child.kind == NodeKind.DOCUMENT_TYPE) {
        checkSlotFree(documentDelegate.getDoctype().orElse(null), child, replaced);
      }
    }
    checkSameDocument(child);
  }

  private static void checkSlotFree(final @Nullable NodeImpl occupant, final NodeImpl child,
      final @Nullable NodeImpl replaced) throws DomException {
    if (occupant != null && occupant != child && occupant != replaced) {
      throw new DomException(DomErrorType.HIERARCHY_REQUEST, "The document already has a %s child.", child.kind);
    }
  }

  private void checkFragmentInsertable(final NodeImpl fragment, final @Nullable NodeImpl replaced)
      throws DomException {
    for (NodeImpl ancestor = this; ancestor != null; ancestor = ancestor.parentImpl()) {
      if (ancestor == fragment) {
        throw new DomException(DomErrorType.HIERARCHY_REQUEST, "A fragment may not be inserted into itself.");
      }
    }
    int elements = 0;
    for (final NodeImpl child : fragment.children) {
      checkInsertable(child, replaced);
      if (child.kind == NodeKind.ELEMENT) {
        elements++;
      }
    }
    if (kind == NodeKind.DOCUMENT && elements > 1) {
      throw new DomException(DomErrorType.HIERARCHY_REQUEST, "A document may have one element child only.");
    }
  }

  private void checkSameDocument(final NodeImpl node) throws DomException {
    final NodeImpl document = effectiveDocument();
    final NodeImpl nodeDocument = node.effectiveDocument();
    if (document != null && nodeDocument != null && document != nodeDocument) {
      throw new DomException(DomErrorType.WRONG_DOCUMENT, "Node %s was created by another document.",
          node.getNodeName());
    }
  }

  private void moveFragment(final NodeImpl fragment, final int index) {
    int position = index;
    for (final NodeImpl child : ImmutableList.copyOf(fragment.children)) {
      fragment.detach(child);
      attach(child, position++);
    }
  }

  /** Link a validated, parentless node in as child at the index. */
  private void attach(final NodeImpl child, final int index) {
    assert child.parentImpl() == null;
    final NodeImpl document = effectiveDocument();
    if (document != null) {
      child.adopt(document);
    }
    children.add(index, child);
    child.parent = new WeakReference<>(this);
    if (extension instanceof DocumentDelegate) {
      final DocumentDelegate documentDelegate = (DocumentDelegate) extension;
      if (child.kind == NodeKind.ELEMENT) {
        documentDelegate.setDocumentElement(child);
      } else if (child.kind == NodeKind.DOCUMENT_TYPE) {
        documentDelegate.setDoctype(child);
      }
    }
    LOGWRAPPER.debug("Attached {} to {} at position {}.", child.getNodeName(), getNodeName(), index);
  }

  private void detach(final NodeImpl child) {
    children.remove(child);
    child.parent = null;
    if (extension instanceof DocumentDelegate) {
      ((DocumentDelegate) extension).clearSlot(child);
    }
    LOGWRAPPER.debug("Detached {} from {}.", child.getNodeName(), getNodeName());
  }

  /** Set the owner document throughout the subtree, including attributes and declarations. */
  private void adopt(final NodeImpl document) {
    if (upgrade(ownerDocument) == document) {
      return;
    }
    ownerDocument = new WeakReference<>(document);
    if (extension instanceof ElementDelegate) {
      for (final NodeImpl attribute : ((ElementDelegate) extension).getAttributeNodes()) {
        attribute.adopt(document);
      }
    } else if (extension instanceof DocumentTypeDelegate) {
      final DocumentTypeDelegate doctypeDelegate = (DocumentTypeDelegate) extension;
      doctypeDelegate.getEntities().values().forEach(entity -> entity.adopt(document));
      doctypeDelegate.getNotations().values().forEach(notation -> notation.adopt(document));
    }
    for (final NodeImpl child : children) {
      child.adopt(document);
    }
  }

  @Override
  public boolean hasChildNodes() {
    return !children.isEmpty();
  }

  @Override
  public Node cloneNode(final boolean deep) {
    return copy(deep, kind == NodeKind.DOCUMENT ? null : effectiveDocument());
  }

  private NodeImpl copy(final boolean deep, final @Nullable NodeImpl owner) {
    final NodeImpl copy =
        new NodeImpl(kind, name, value, extension == null ? null : extension.copy(), implementation, owner);
    final NodeImpl descendantOwner = kind == NodeKind.DOCUMENT ? copy : owner;

    if (extension instanceof ElementDelegate) {
      final ElementDelegate copyDelegate = (ElementDelegate) requireNonNull(copy.extension);
      for (final NodeImpl attribute : ((ElementDelegate) extension).getAttributeNodes()) {
        final NodeImpl attributeCopy = attribute.copy(true, descendantOwner);
        attributeCopy.ownerElement = new WeakReference<>(copy);
        copyDelegate.putAttribute(attributeCopy);
      }
    } else if (extension instanceof DocumentTypeDelegate) {
      final DocumentTypeDelegate doctypeDelegate = (DocumentTypeDelegate) extension;
      final DocumentTypeDelegate copyDelegate = (DocumentTypeDelegate) requireNonNull(copy.extension);
      doctypeDelegate.getEntities()
                     .forEach((entityName, entity) -> copyDelegate.getEntities()
                                                                  .put(entityName, entity.copy(true, descendantOwner)));
      doctypeDelegate.getNotations()
                     .forEach((notationName, notation) -> copyDelegate.getNotations()
                                                                      .put(notationName,
                                                                           notation.copy(true, descendantOwner)));
    }

    if (deep || kind == NodeKind.ATTRIBUTE) {
      for (final NodeImpl child : children) {
        final NodeImpl childCopy = child.copy(true, descendantOwner);
        copy.children.add(childCopy);
        childCopy.parent = new WeakReference<>(copy);
        if (copy.extension instanceof DocumentDelegate) {
          final DocumentDelegate documentDelegate = (DocumentDelegate) copy.extension;
          if (childCopy.kind == NodeKind.ELEMENT) {
            documentDelegate.setDocumentElement(childCopy);
          } else if (childCopy.kind == NodeKind.DOCUMENT_TYPE) {
            documentDelegate.setDoctype(childCopy);
          }
        }
      }
    }
    return copy;
  }

  @Override
  public void normalize() {
    if (extension instanceof ElementDelegate) {
      ((ElementDelegate) extension).getAttributeNodes().forEach(NodeImpl::normalize);
    }
    NodeImpl previousText = null;
    for (final NodeImpl child : ImmutableList.copyOf(children)) {
      if (child.kind != NodeKind.TEXT) {
        previousText = null;
        child.normalize();
      } else if (Strings.isNullOrEmpty(child.value)) {
        detach(child);
      } else if (previousText != null) {
        previousText.value = previousText.value + child.value;
        detach(child);
      } else {
        previousText = child;
      }
    }
  }

  @Override
  public boolean isSupported(final String feature, final String version) {
    return implementation.hasFeature(feature, version);
  }

  @Override
  public Optional<String> getNamespaceUri() {
    return name.getNamespaceUri();
  }

  @Override
  public Optional<String> getPrefix() {
    return name.getPrefix();
  }

  @Override
  public String getLocalName() {
    return name.getLocalName();
  }

  @Override
  public boolean isSameNode(final @Nullable Node other) {
    return this == other;
  }

  @Override
  public VisitResult accept(final NodeVisitor visitor) {
    return kind.accept(requireNonNull(visitor), this);
  }

  // ------------------------------------------------------------------------------------------
  // Document
  // ------------------------------------------------------------------------------------------

  @Override
  public Optional<DocumentType> getDoctype() {
    return delegate(DocumentDelegate.class, "getDoctype").flatMap(DocumentDelegate::getDoctype).map(DocumentType.class::cast);
  }

  @Override
  public DomImplementation getImplementation() {
    return implementation;
  }

  @Override
  public Optional<Element> getDocumentElement() {
    return delegate(DocumentDelegate.class, "getDocumentElement").flatMap(DocumentDelegate::getDocumentElement)
                                                                 .map(Element.class::cast);
  }

  /** The document new nodes are owned by: this node if it is a document. */
  private @Nullable NodeImpl factoryDocument(final String operation) {
    checkKind(NodeKind.DOCUMENT, operation);
    return effectiveDocument();
  }

  private NodeImpl newNode(final NodeKind nodeKind, final Name nodeName, final @Nullable String nodeValue,
      final @Nullable ExtensionDelegate nodeExtension, final String operation) {
    return new NodeImpl(nodeKind, nodeName, nodeValue, nodeExtension, implementation, factoryDocument(operation));
  }

  @Override
  public Element createElement(final String tagName) throws DomException {
    return newNode(NodeKind.ELEMENT, Name.parse(tagName), null, new ElementDelegate(), "createElement");
  }

  @Override
  public Element createElementNS(final @Nullable String namespaceUri, final String qualifiedName)
      throws DomException {
    return newNode(NodeKind.ELEMENT, Name.fromNamespace(namespaceUri, qualifiedName), null, new ElementDelegate(),
        "createElementNS");
  }

  @Override
  public DocumentFragment createDocumentFragment() {
    return newNode(NodeKind.DOCUMENT_FRAGMENT, Name.ofNodeName(Constants.DOCUMENT_FRAGMENT_NODE_NAME), null, null,
        "createDocumentFragment");
  }

  @Override
  public Text createTextNode(final String data) {
    return newNode(NodeKind.TEXT, Name.ofNodeName(Constants.TEXT_NODE_NAME), requireNonNull(data), null,
        "createTextNode");
  }

  @Override
  public Comment createComment(final String data) {
    return newNode(NodeKind.COMMENT, Name.ofNodeName(Constants.COMMENT_NODE_NAME), requireNonNull(data), null,
        "createComment");
  }

  @Override
  public CDataSection createCDataSection(final String data) {
    return newNode(NodeKind.CDATA, Name.ofNodeName(Constants.CDATA_NODE_NAME), requireNonNull(data), null,
        "createCDataSection");
  }

  @Override
  public ProcessingInstruction createProcessingInstruction(final String target, final @Nullable String data)
      throws DomException {
    return newNode(NodeKind.PROCESSING_INSTRUCTION, Name.parse(target), data, null, "createProcessingInstruction");
  }

  @Override
  public Attribute createAttribute(final String name) throws DomException {
    return createAttribute(name, "");
  }

  @Override
  public Attribute createAttribute(final String name, final String value) throws DomException {
    return newNode(NodeKind.ATTRIBUTE, Name.parse(name), requireNonNull(value), null, "createAttribute");
  }

  @Override
  public Attribute createAttributeNS(final @Nullable String namespaceUri, final String qualifiedName)
      throws DomException {
    return createAttributeNS(namespaceUri, qualifiedName, "");
  }

  @Override
  public Attribute createAttributeNS(final @Nullable String namespaceUri, final String qualifiedName,
      final String value) throws DomException {
    return newNode(NodeKind.ATTRIBUTE, Name.fromNamespace(namespaceUri, qualifiedName), requireNonNull(value), null,
        "createAttributeNS");
  }

  @Override
  public EntityReference createEntityReference(final String name) throws DomException {
    return newNode(NodeKind.ENTITY_REFERENCE, Name.parse(name), null, null, "createEntityReference");
  }

  @Override
  public Optional<Element> getElementById(final String elementId) {
    LOGWRAPPER.debug("No attribute is known to be an ID, '{}' not looked up.", elementId);
    return Optional.empty();
  }

  // ------------------------------------------------------------------------------------------
  // Element
  // ------------------------------------------------------------------------------------------

  @Override
  public String getTagName() {
    return name.toString();
  }

  @Override
  public Optional<String> getAttribute(final String name) {
    return getAttributeNode(name).map(Attribute::getValue);
  }

  @Override
  public void setAttribute(final String name, final String value) throws DomException {
    requireDelegate(ElementDelegate.class, "setAttribute");
    setAttributeNode(newAttribute(Name.parse(name), value));
  }

  private NodeImpl newAttribute(final Name attributeName, final String attributeValue) {
    return new NodeImpl(NodeKind.ATTRIBUTE, attributeName, requireNonNull(attributeValue), null, implementation,
        effectiveDocument());
  }

  @Override
  public void removeAttribute(final String name) {
    delegate(ElementDelegate.class, "removeAttribute").ifPresent(
        delegate -> parseLeniently(name, "removeAttribute").flatMap(delegate::removeAttribute)
                                                         .ifPresent(attribute -> release(delegate, attribute)));
  }

  @Override
  public Optional<Attribute> getAttributeNode(final String name) {
    final Optional<ElementDelegate> delegate = delegate(ElementDelegate.class, "getAttributeNode");
    if (delegate.isEmpty()) {
      return Optional.empty();
    }
    return parseLeniently(name, "getAttributeNode").flatMap(delegate.get()::getAttribute);
  }

  @Override
  public Attribute setAttributeNode(final Attribute attribute) throws DomException {
    final ElementDelegate delegate = requireDelegate(ElementDelegate.class, "setAttributeNode");
    final NodeImpl attributeNode = Nodes.asImpl(attribute);
    if (attributeNode.kind != NodeKind.ATTRIBUTE) {
      throw new DomException(DomErrorType.INVALID_STATE, "Expected an attribute, but got a %s node.",
          attributeNode.kind);
    }
    checkSameDocument(attributeNode);

    final NodeImpl owner = upgrade(attributeNode.ownerElement);
    if (owner != null && owner != this) {
      throw new DomException(DomErrorType.INUSE_ATTRIBUTE, "Attribute %s is installed on another element.",
          attributeNode.getName());
    }
    if (owner == this) {
      return attributeNode;
    }

    final Name attributeName = attributeNode.getName();
    if (attributeName.isNamespaceDeclaration()) {
      delegate.putNamespace(attributeName.getDeclaredPrefix().orElse(""), attributeNode.getValue());
    }
    delegate.putAttribute(attributeNode).ifPresent(replaced -> replaced.ownerElement = null);
    attributeNode.ownerElement = new WeakReference<>(this);
    final NodeImpl document = effectiveDocument();
    if (document != null) {
      attributeNode.adopt(document);
    }
    LOGWRAPPER.debug("Set attribute {} on {}.", attributeName, getNodeName());
    return attributeNode;
  }

  @Override
  public Attribute removeAttributeNode(final Attribute attribute) throws DomException {
    final ElementDelegate delegate = requireDelegate(ElementDelegate.class, "removeAttributeNode");
    final NodeImpl attributeNode = Nodes.asImpl(attribute);
    if (delegate.getAttribute(attributeNode.getName()).orElse(null) != attributeNode) {
      throw new DomException(DomErrorType.NOT_FOUND, "Attribute %s is not installed on this element.",
          attributeNode.getName());
    }
    delegate.removeAttribute(attributeNode.getName());
    release(delegate, attributeNode);
    return attributeNode;
  }

  /** Unlink a removed attribute and the namespace mapping it declared. */
  private void release(final ElementDelegate delegate, final NodeImpl attribute) {
    attribute.ownerElement = null;
    final Name attributeName = attribute.getName();
    if (attributeName.isNamespaceDeclaration()) {
      delegate.removeNamespace(attributeName.getDeclaredPrefix().orElse(""));
    }
    LOGWRAPPER.debug("Removed attribute {} from {}.", attributeName, getNodeName());
  }

  @Override
  public List<Element> getElementsByTagName(final String tagName) {
    requireNonNull(tagName);
    return findElements("getElementsByTagName", element -> NameMatcher.matchesTagName(element.getName(), tagName));
  }

  @Override
  public List<Element> getElementsByTagNameNS(final String namespaceUri, final String localName) {
    requireNonNull(namespaceUri);
    requireNonNull(localName);
    return findElements("getElementsByTagNameNS",
        element -> NameMatcher.matchesNamespaced(element.getName(), namespaceUri, localName));
  }

  /**
   * Collect the matching elements in document order, starting at the document element of a
   * document or at this element.
   */
  private List<Element> findElements(final String operation, final Predicate<Node> matcher) {
    final Node start;
    if (kind == NodeKind.DOCUMENT) {
      final Optional<Element> documentElement = getDocumentElement();
      if (documentElement.isEmpty()) {
        return ImmutableList.of();
      }
      start = documentElement.get();
    } else if (checkKind(NodeKind.ELEMENT, operation)) {
      start = this;
    } else {
      return ImmutableList.of();
    }

    final ImmutableList.Builder<Element> result = ImmutableList.builder();
    final VisitorDescendantAxis axis =
        VisitorDescendantAxis.newBuilder(start).includeSelf().visitor(ELEMENT_TREE_VISITOR).build();
    while (axis.hasNext()) {
      final Node node = axis.next();
      if (Nodes.isElement(node) && matcher.test(node)) {
        Nodes.asElement(node).ifPresent(result::add);
      }
    }
    return result.build();
  }

  @Override
  public Optional<String> getAttributeNS(final String namespaceUri, final String localName) {
    return getAttributeNodeNS(namespaceUri, localName).map(Attribute::getValue);
  }

  @Override
  public void setAttributeNS(final @Nullable String namespaceUri, final String qualifiedName, final String value)
      throws DomException {
    final ElementDelegate delegate = requireDelegate(ElementDelegate.class, "setAttributeNS");
    final Name attributeName = Name.fromNamespace(namespaceUri, qualifiedName);
    final Optional<NodeImpl> existing =
        findAttributeNS(delegate, attributeName.getNamespaceUri().orElse(null), attributeName.getLocalName());
    if (existing.isPresent() && !existing.get().getName().equals(attributeName)) {
      delegate.removeAttribute(existing.get().getName());
      release(delegate, existing.get());
    }
    setAttributeNode(newAttribute(attributeName, value));
  }

  @Override
  public void removeAttributeNS(final String namespaceUri, final String localName) {
    delegate(ElementDelegate.class, "removeAttributeNS").ifPresent(
        delegate -> findAttributeNS(delegate, namespaceUri, localName).ifPresent(attribute -> {
          delegate.removeAttribute(attribute.getName());
          release(delegate, attribute);
        }));
  }

  @Override
  public Optional<Attribute> getAttributeNodeNS(final String namespaceUri, final String localName) {
    final Optional<ElementDelegate> delegate = delegate(ElementDelegate.class, "getAttributeNodeNS");
    if (delegate.isEmpty()) {
      return Optional.empty();
    }
    return findAttributeNS(delegate.get(), namespaceUri, localName).map(Attribute.class::cast);
  }

  private static Optional<NodeImpl> findAttributeNS(final ElementDelegate delegate,
      final @Nullable String namespaceUri, final String localName) {
    final String uri = Strings.emptyToNull(namespaceUri);
    for (final NodeImpl attribute : delegate.getAttributeNodes()) {
      final Name attributeName = attribute.getName();
      if (Objects.equal(uri, attributeName.getNamespaceUri().orElse(null))
          && attributeName.getLocalName().equals(localName)) {
        return Optional.of(attribute);
      }
    }
    return Optional.empty();
  }

  @Override
  public Attribute setAttributeNodeNS(final Attribute attribute) throws DomException {
    return setAttributeNode(attribute);
  }

  @Override
  public boolean hasAttribute(final String name) {
    return getAttributeNode(name).isPresent();
  }

  @Override
  public boolean hasAttributeNS(final String namespaceUri, final String localName) {
    return getAttributeNodeNS(namespaceUri, localName).isPresent();
  }

  @Override
  public Optional<String> lookupNamespaceUri(final @Nullable String prefix) {
    if (!checkKind(NodeKind.ELEMENT, "lookupNamespaceUri")) {
      return Optional.empty();
    }
    final String key = Strings.nullToEmpty(prefix);
    if (Constants.XML_PREFIX.equals(key)) {
      return Optional.of(Constants.XML_NAMESPACE_URI);
    }
    if (Constants.XMLNS_PREFIX.equals(key)) {
      return Optional.of(Constants.XMLNS_NAMESPACE_URI);
    }

    final boolean inherit = implementation.getConfiguration().isInheritNamespaceMappings();
    for (NodeImpl node = this; node != null; node = inherit ? node.parentImpl() : null) {
      if (node.kind != NodeKind.ELEMENT) {
        continue;
      }
      if (node.name.getPrefix().orElse("").equals(key) && node.name.getNamespaceUri().isPresent()) {
        return node.name.getNamespaceUri();
      }
      final Optional<String> declared = ((ElementDelegate) requireNonNull(node.extension)).getNamespace(key);
      if (declared.isPresent()) {
        return declared.filter(uri -> !uri.isEmpty());
      }
    }
    return Optional.empty();
  }

  @Override
  public Map<String, String> getNamespaceMappings() {
    return delegate(ElementDelegate.class, "getNamespaceMappings").map(ElementDelegate::getNamespaces)
                                                                  .orElse(ImmutableMap.of());
  }

  // ------------------------------------------------------------------------------------------
  // Attribute
  // ------------------------------------------------------------------------------------------

  @Override
  public String getValue() {
    checkKind(NodeKind.ATTRIBUTE, "getValue");
    if (children.isEmpty()) {
      return Strings.nullToEmpty(value);
    }
    final StringBuilder builder = new StringBuilder();
    appendText(builder);
    return builder.toString();
  }

  /** Append the text below this node, looking through entity references. */
  private void appendText(final StringBuilder builder) {
    for (final NodeImpl child : children) {
      if (child.kind == NodeKind.TEXT) {
        builder.append(Strings.nullToEmpty(child.value));
      } else {
        child.appendText(builder);
      }
    }
  }

  @Override
  public void setValue(final String value) throws DomException {
    requireNonNull(value);
    if (!checkKind(NodeKind.ATTRIBUTE, "setValue")) {
      return;
    }
    final NodeImpl element = upgrade(ownerElement);
    if (element != null && name.isNamespaceDeclaration()) {
      final ElementDelegate delegate = (ElementDelegate) requireNonNull(element.extension);
      delegate.putNamespace(name.getDeclaredPrefix().orElse(""), value);
    }
    for (final NodeImpl child : ImmutableList.copyOf(children)) {
      detach(child);
    }
    this.value = value;
  }

  @Override
  public Optional<Element> getOwnerElement() {
    return checkKind(NodeKind.ATTRIBUTE, "getOwnerElement")
        ? Optional.ofNullable(upgrade(ownerElement))
        : Optional.empty();
  }

  @Override
  public boolean isSpecified() {
    return true;
  }

  // ------------------------------------------------------------------------------------------
  // CharacterData and ProcessingInstruction
  // ------------------------------------------------------------------------------------------

  private boolean checkCharacterData(final String operation) {
    if (!kind.isCharacterData()) {
      LOGWRAPPER.invalidNodeKind(operation, kind);
      return false;
    }
    return true;
  }

  private static void checkRange(final int offset, final int count) throws DomException {
    if (offset < 0 || count < 0) {
      throw new DomException(DomErrorType.INDEX_SIZE, "Negative offset %d or count %d.", offset, count);
    }
  }

  @Override
  public Optional<String> getData() {
    if (kind.isCharacterData() || checkKind(NodeKind.PROCESSING_INSTRUCTION, "getData")) {
      return Optional.ofNullable(value);
    }
    return Optional.empty();
  }

  @Override
  public void setData(final String data) {
    if (kind.isCharacterData() || checkKind(NodeKind.PROCESSING_INSTRUCTION, "setData")) {
      value = requireNonNull(data);
    }
  }

  @Override
  public int getLength() {
    return checkCharacterData("getLength") && value != null ? value.length() : 0;
  }

  @Override
  public String substringData(final int offset, final int count) throws DomException {
    checkRange(offset, count);
    if (!checkCharacterData("substringData") || count == 0) {
      return "";
    }
    if (value == null || offset >= value.length()) {
      throw new DomException(DomErrorType.INDEX_SIZE, "Offset %d is out of bounds.", offset);
    }
    final int end = (long) offset + count >= value.length() ? value.length() : offset + count;
    return value.substring(offset, end);
  }

  @Override
  public void appendData(final String data) {
    requireNonNull(data);
    if (!checkCharacterData("appendData") || data.isEmpty()) {
      return;
    }
    value = value == null ? data : value + data;
  }

  @Override
  public void insertData(final int offset, final String data) throws DomException {
    requireNonNull(data);
    if (data.isEmpty()) {
      return;
    }
    replaceData(offset, 0, data);
  }

  @Override
  public void deleteData(final int offset, final int count) throws DomException {
    checkRange(offset, count);
    if (count == 0) {
      return;
    }
    replaceData(offset, count, "");
  }

  @Override
  public void replaceData(final int offset, final int count, final String data) throws DomException {
    requireNonNull(data);
    checkRange(offset, count);
    if (!checkCharacterData("replaceData")) {
      return;
    }
    if (Strings.isNullOrEmpty(value)) {
      if (offset != 0 || count != 0) {
        throw new DomException(DomErrorType.INDEX_SIZE, "Range %d+%d is out of bounds of empty data.", offset, count);
      }
      value = data;
      return;
    }
    if (offset >= value.length()) {
      throw new DomException(DomErrorType.INDEX_SIZE, "Offset %d is out of bounds.", offset);
    }
    final int end = (long) offset + count >= value.length() ? value.length() : offset + count;
    value = value.substring(0, offset) + data + value.substring(end);
  }

  @Override
  public Text splitText(final int offset) throws DomException {
    if (kind != NodeKind.TEXT && kind != NodeKind.CDATA) {
      throw new DomException(DomErrorType.SYNTAX, "Only text and CDATA nodes can be split, not %s.", kind);
    }
    if (offset < 0) {
      throw new DomException(DomErrorType.INDEX_SIZE, "Negative offset %d.", offset);
    }
    final String data = Strings.nullToEmpty(value);
    final String tail;
    if (offset >= data.length()) {
      tail = "";
    } else {
      tail = data.substring(offset);
      value = data.substring(0, offset);
    }

    final NodeImpl newNode = new NodeImpl(kind, name, tail, null, implementation, effectiveDocument());
    final NodeImpl parentNode = parentImpl();
    if (parentNode != null) {
      parentNode.insertBefore(newNode, getNextSibling().orElse(null));
    }
    return newNode;
  }

  @Override
  public String getTarget() {
    checkKind(NodeKind.PROCESSING_INSTRUCTION, "getTarget");
    return name.toString();
  }

  // ------------------------------------------------------------------------------------------
  // DocumentType, Entity, Notation
  // ------------------------------------------------------------------------------------------

  @Override
  public Map<Name, Entity> getEntities() {
    return delegate(DocumentTypeDelegate.class, "getEntities").<Map<Name, Entity>>map(
        delegate -> ImmutableMap.copyOf(delegate.getEntities())).orElse(ImmutableMap.of());
  }

  @Override
  public Map<Name, Notation> getNotations() {
    return delegate(DocumentTypeDelegate.class, "getNotations").<Map<Name, Notation>>map(
        delegate -> ImmutableMap.copyOf(delegate.getNotations())).orElse(ImmutableMap.of());
  }

  private Optional<ExternalIdDelegate> externalId(final String operation) {
    if (extension instanceof DocumentTypeDelegate) {
      return Optional.of(((DocumentTypeDelegate) extension).getExternalIdDelegate());
    }
    return delegate(ExternalIdDelegate.class, operation);
  }

  @Override
  public Optional<String> getPublicId() {
    return externalId("getPublicId").flatMap(ExternalIdDelegate::getPublicId);
  }

  @Override
  public Optional<String> getSystemId() {
    return externalId("getSystemId").flatMap(ExternalIdDelegate::getSystemId);
  }

  @Override
  public Optional<String> getNotationName() {
    return checkKind(NodeKind.ENTITY, "getNotationName")
        ? externalId("getNotationName").flatMap(ExternalIdDelegate::getNotationName)
        : Optional.empty();
  }

  @Override
  public Optional<String> getInternalSubset() {
    return delegate(DocumentTypeDelegate.class, "getInternalSubset").flatMap(DocumentTypeDelegate::getInternalSubset);
  }

  @Override
  public void setInternalSubset(final @Nullable String internalSubset) {
    delegate(DocumentTypeDelegate.class, "setInternalSubset").ifPresent(
        delegate -> delegate.setInternalSubset(internalSubset));
  }

  @Override
  public Entity createEntity(final String name, final @Nullable String publicId, final @Nullable String systemId,
      final @Nullable String notationName) throws DomException {
    final DocumentTypeDelegate delegate = requireDelegate(DocumentTypeDelegate.class, "createEntity");
    final NodeImpl entity = new NodeImpl(NodeKind.ENTITY, Name.parse(name), null,
        new ExternalIdDelegate(NodeKind.ENTITY, publicId, systemId, notationName), implementation,
        effectiveDocument());
    delegate.getEntities().put(entity.getName(), entity);
    return entity;
  }

  @Override
  public Notation createNotation(final String name, final @Nullable String publicId, final @Nullable String systemId)
      throws DomException {
    final DocumentTypeDelegate delegate = requireDelegate(DocumentTypeDelegate.class, "createNotation");
    final NodeImpl notation = new NodeImpl(NodeKind.NOTATION, Name.parse(name), null,
        new ExternalIdDelegate(NodeKind.NOTATION, publicId, systemId, null), implementation, effectiveDocument());
    delegate.getNotations().put(notation.getName(), notation);
    return notation;
  }

  // ------------------------------------------------------------------------------------------
  // Object
  // ------------------------------------------------------------------------------------------

  /**
   * Render the subtree as markup.
   */
  @Override
  public String toString() {
    return new NodeRenderer(implementation.getConfiguration()).render(this);
  }
}
