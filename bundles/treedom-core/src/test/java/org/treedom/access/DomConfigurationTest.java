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

import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public final class DomConfigurationTest {

  @Test
  public void testDefaults() {
    final DomConfiguration configuration = DomConfiguration.defaults();
    assertFalse(configuration.isCDataPadding());
    assertTrue(configuration.isInheritNamespaceMappings());
    assertSame(configuration, DomConfiguration.defaults());
  }

  @Test
  public void testBuilder() {
    final DomConfiguration configuration =
        DomConfiguration.newBuilder().cdataPadding(true).inheritNamespaceMappings(false).build();
    assertTrue(configuration.isCDataPadding());
    assertFalse(configuration.isInheritNamespaceMappings());
    assertTrue(configuration.toString().contains("cdata-padding"));
  }

  @Test
  public void testFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty("cdata-padding", " YES ");
    properties.setProperty("inherit-namespace-mappings", "false");
    final DomConfiguration configuration = DomConfiguration.fromProperties(properties);
    assertTrue(configuration.isCDataPadding());
    assertFalse(configuration.isInheritNamespaceMappings());

    final DomConfiguration empty = DomConfiguration.fromProperties(new Properties());
    assertFalse(empty.isCDataPadding());
    assertTrue(empty.isInheritNamespaceMappings());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidProperty() {
    final Properties properties = new Properties();
    properties.setProperty("cdata-padding", "maybe");
    DomConfiguration.fromProperties(properties);
  }

  /** The test classpath carries a treedom.properties enabling CDATA padding. */
  @Test
  public void testLoad() {
    final DomConfiguration configuration = DomConfiguration.load();
    assertTrue(configuration.isCDataPadding());
    assertTrue(configuration.isInheritNamespaceMappings());
  }
}
