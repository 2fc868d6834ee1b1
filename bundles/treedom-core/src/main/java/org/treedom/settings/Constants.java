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

package org.treedom.settings;

/**
 * Interface to hold all constants of the node layer.
 */
public final class Constants {

  /**
   * Private constructor.
   */
  private Constants() {
    // Cannot be instantiated.
    throw new AssertionError("May not be instantiated!");
  }

  // --- Reserved names
  // ----------------------------------------------------------

  /** Wildcard accepted by tag-name queries. */
  public static final String WILDCARD = "*";

  /** Reserved prefix of namespace declarations (and the name of the default declaration). */
  public static final String XMLNS_PREFIX = "xmlns";

  /** Reserved prefix bound to {@link #XML_NAMESPACE_URI}. */
  public static final String XML_PREFIX = "xml";

  /** Namespace URI the {@code xml} prefix is bound to. */
  public static final String XML_NAMESPACE_URI = "http://www.w3.org/XML/1998/namespace";

  /** Namespace URI of namespace declaration attributes. */
  public static final String XMLNS_NAMESPACE_URI = "http://www.w3.org/2000/xmlns/";

  // --- Node names of unnamed kinds
  // ----------------------------------------------

  public static final String TEXT_NODE_NAME = "#text";

  public static final String CDATA_NODE_NAME = "#cdata-section";

  public static final String COMMENT_NODE_NAME = "#comment";

  public static final String DOCUMENT_NODE_NAME = "#document";

  public static final String DOCUMENT_FRAGMENT_NODE_NAME = "#document-fragment";

  // --- Features
  // ----------------------------------------------------------------

  /** Feature name of the DOM core module. */
  public static final String FEATURE_CORE = "Core";

  /** Feature name of the DOM XML module. */
  public static final String FEATURE_XML = "XML";

  /** DOM level 1. */
  public static final String FEATURE_VERSION_1 = "1.0";

  /** DOM level 2. */
  public static final String FEATURE_VERSION_2 = "2.0";

  // --- Markup tokens
  // -----------------------------------------------------------

  public static final String ELEMENT_START_START = "<";

  public static final String ELEMENT_START_END = ">";

  public static final String ELEMENT_END_START = "</";

  public static final String ELEMENT_END_END = ">";

  public static final String CDATA_START = "<![CDATA[";

  public static final String CDATA_END = "]]>";

  public static final String PI_START = "<?";

  public static final String PI_END = "?>";

  public static final String COMMENT_START = "<!--";

  public static final String COMMENT_END = "-->";

  public static final String DOCTYPE_START = "<!DOCTYPE";

  public static final String DOCTYPE_PUBLIC = "PUBLIC";

  public static final String DOCTYPE_SYSTEM = "SYSTEM";

  public static final String DOCTYPE_END = ">";

  public static final String ENTITY_START = "<!ENTITY";

  public static final String NOTATION_START = "<!NOTATION";

  public static final String NDATA = "NDATA";

  public static final String DECLARATION_END = ">";

  public static final String ENTITY_REFERENCE_START = "&";

  public static final String ENTITY_REFERENCE_END = ";";
}
