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

import com.google.common.base.MoreObjects;
import org.slf4j.LoggerFactory;
import org.treedom.utils.LogWrapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable settings of a {@link DomImplementationImpl} and the trees it creates.
 *
 * <p>
 * Format of a properties source:
 * </p>
 *
 * <ul>
 * <li>cdata-padding=no (possible values: yes/no)</li>
 * <li>inherit-namespace-mappings=yes (possible values: yes/no)</li>
 * </ul>
 *
 * <p>
 * Keys which are absent keep their default value.
 * </p>
 */
public final class DomConfiguration {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DomConfiguration.class));

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "treedom.properties";

  /** YES maps to true. */
  private static final boolean YES = true;

  /** NO maps to false. */
  private static final boolean NO = false;

  /** Pad CDATA sections with a space on each side when rendering: yes/no. */
  public static final Object[] S_CDATA_PADDING = {"cdata-padding", NO};

  /** Resolve namespace prefixes through the ancestors' declarations: yes/no. */
  public static final Object[] S_INHERIT_NAMESPACE_MAPPINGS = {"inherit-namespace-mappings", YES};

  /** Configuration with the default values. */
  private static final DomConfiguration DEFAULT = newBuilder().build();

  /** Determines if CDATA sections are padded. */
  private final boolean cdataPadding;

  /** Determines if namespace lookups consult the ancestors. */
  private final boolean inheritNamespaceMappings;

  /**
   * Private constructor.
   *
   * @param builder the builder
   */
  private DomConfiguration(final Builder builder) {
    cdataPadding = builder.cdataPadding;
    inheritNamespaceMappings = builder.inheritNamespaceMappings;
  }

  /**
   * Get a new builder with the default values.
   *
   * @return the builder
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get the configuration with the default values.
   *
   * @return the configuration
   */
  public static DomConfiguration defaults() {
    return DEFAULT;
  }

  /**
   * Create a configuration from properties.
   *
   * @param properties the properties
   * @return the configuration
   * @throws IllegalArgumentException if a value is not {@code yes}, {@code no}, {@code true} or
   *         {@code false}
   */
  public static DomConfiguration fromProperties(final Properties properties) {
    checkNotNull(properties);
    return newBuilder().cdataPadding(readFlag(properties, S_CDATA_PADDING))
                       .inheritNamespaceMappings(readFlag(properties, S_INHERIT_NAMESPACE_MAPPINGS))
                       .build();
  }

  /**
   * Load the configuration from the classpath resource {@value #RESOURCE}, using the default values
   * if it is absent or unreadable.
   *
   * @return the configuration
   */
  public static DomConfiguration load() {
    try (final InputStream in = DomConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        LOGWRAPPER.debug("No {} on the classpath, using defaults.", RESOURCE);
        return DEFAULT;
      }
      final Properties properties = new Properties();
      properties.load(in);
      return fromProperties(properties);
    } catch (final IOException e) {
      LOGWRAPPER.error(e);
      return DEFAULT;
    }
  }

  private static boolean readFlag(final Properties properties, final Object[] setting) {
    final String key = setting[0].toString();
    final String value = properties.getProperty(key);
    if (value == null) {
      return (Boolean) setting[1];
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "yes":
      case "true":
        return true;
      case "no":
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }
  }

  public boolean isCDataPadding() {
    return cdataPadding;
  }

  public boolean isInheritNamespaceMappings() {
    return inheritNamespaceMappings;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add(S_CDATA_PADDING[0].toString(), cdataPadding)
                      .add(S_INHERIT_NAMESPACE_MAPPINGS[0].toString(), inheritNamespaceMappings)
                      .toString();
  }

  /**
   * Builder to setup a {@link DomConfiguration}.
   */
  public static final class Builder {

    /** Determines if CDATA sections are padded. */
    private boolean cdataPadding = (Boolean) S_CDATA_PADDING[1];

    /** Determines if namespace lookups consult the ancestors. */
    private boolean inheritNamespaceMappings = (Boolean) S_INHERIT_NAMESPACE_MAPPINGS[1];

    private Builder() {
    }

    /**
     * Pad CDATA sections with a space inside each delimiter when rendering.
     *
     * @param cdataPadding {@code true} to pad
     * @return this builder
     */
    public Builder cdataPadding(final boolean cdataPadding) {
      this.cdataPadding = cdataPadding;
      return this;
    }

    /**
     * Let namespace lookups fall back to the declarations of ancestor elements.
     *
     * @param inheritNamespaceMappings {@code true} to consult the ancestors
     * @return this builder
     */
    public Builder inheritNamespaceMappings(final boolean inheritNamespaceMappings) {
      this.inheritNamespaceMappings = inheritNamespaceMappings;
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return the configuration
     */
    public DomConfiguration build() {
      return new DomConfiguration(this);
    }
  }
}
