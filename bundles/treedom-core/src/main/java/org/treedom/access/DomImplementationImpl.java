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

package org.treedom.access;

import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;
import org.treedom.api.Document;
import org.treedom.api.DocumentType;
import org.treedom.api.DomImplementation;
import org.treedom.api.Element;
import org.treedom.exception.DomErrorType;
import org.treedom.exception.DomException;
import org.treedom.name.Name;
import org.treedom.node.NodeImpl;
import org.treedom.node.Nodes;
import org.treedom.node.delegates.DocumentDelegate;
import org.treedom.settings.Constants;
import org.treedom.utils.LogWrapper;

import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Creates documents and document types. The implementation holds nothing but its
 * {@link DomConfiguration}, which every node it creates shares.
 */
public final class DomImplementationImpl implements DomImplementation {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DomImplementationImpl.class));

  /** Supported features, lower case. */
  private static final Set<String> FEATURES =
      ImmutableSet.of(Constants.FEATURE_CORE.toLowerCase(Locale.ROOT), Constants.FEATURE_XML.toLowerCase(Locale.ROOT));

  /** Supported versions. */
  private static final Set<String> VERSIONS = ImmutableSet.of(Constants.FEATURE_VERSION_1, Constants.FEATURE_VERSION_2);

  /** Lazily created shared instance. */
  private static volatile @Nullable DomImplementationImpl instance;

  /** The configuration. */
  private final DomConfiguration configuration;

  /**
   * Constructor.
   *
   * @param configuration the configuration of the trees created
   */
  public DomImplementationImpl(final DomConfiguration configuration) {
    this.configuration = requireNonNull(configuration);
  }

  /**
   * Get a shared instance configured by {@link DomConfiguration#load()}.
   *
   * @return the shared instance
   */
  public static DomImplementationImpl getInstance() {
    DomImplementationImpl result = instance;
    if (result == null) {
      synchronized (DomImplementationImpl.class) {
        result = instance;
        if (result == null) {
          result = new DomImplementationImpl(DomConfiguration.load());
          instance = result;
        }
      }
    }
    return result;
  }

  public DomConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public boolean hasFeature(final String feature, final String version) {
    return FEATURES.contains(requireNonNull(feature).toLowerCase(Locale.ROOT))
        && VERSIONS.contains(requireNonNull(version));
  }

  @Override
  public DocumentType createDocumentType(final String qualifiedName, final @Nullable String publicId,
      final @Nullable String systemId) throws DomException {
    return NodeImpl.newDocumentType(this, Name.parse(qualifiedName), publicId, systemId);
  }

  @Override
  public Document createDocument(final @Nullable String namespaceUri, final String qualifiedName,
      final @Nullable DocumentType doctype) throws DomException {
    Name.fromNamespace(namespaceUri, qualifiedName);

    final NodeImpl document = NodeImpl.newDocument(this);
    if (doctype != null) {
      document.appendChild(Nodes.asImpl(doctype));
    }

    final Element documentElement = document.createElementNS(namespaceUri, qualifiedName);
    if (!(document.getExtension() instanceof DocumentDelegate)) {
      LOGWRAPPER.invalidExtension("createDocument", document.getNodeType());
      throw new DomException(DomErrorType.INVALID_STATE, "Document carries no document state.");
    }
    document.appendChild(documentElement);

    LOGWRAPPER.debug("Created document with document element {}.", documentElement.getTagName());
    return document;
  }
}
