/* Copyright 2011 Google Inc. All Rights Reserved.
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.belay.authz.config;

import static com.google.belay.authz.config.ClassLoadUtil.instantiateClass;
import static com.google.belay.authz.config.ClassLoadUtil.loadClass;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.belay.authz.kv.KeyValueStore;
import com.google.belay.authz.kv.memory.InMemoryKeyValueStore;

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.Properties;

public class ClassLoadUtilTest {

  @Rule
  public final JUnitRuleMockery context = new JUnitRuleMockery();

  private ConfigSource cfg;

  @Before
  public void setUp() {
    cfg = context.mock(ConfigSource.class);

    context.checking(new Expectations() {
      {
        ignoring(cfg).getName();
        will(returnValue("test-config"));
      }
    });
  }

  private void specifyParam(final String key, final String value) {
    context.checking(new Expectations() {
      {
        atLeast(1).of(cfg).getParameter(key);
        will(returnValue(value));
      }
    });
  }

  @Test
  public void testLoadClass_missingParam() throws Exception {
    specifyParam("aMissingParam", null);
    try {
      loadClass(cfg, Object.class, "aMissingParam");
      fail("ConfigurationException was expected and not thrown");
    } catch (ConfigurationException e) {
      assertEquals("parameter aMissingParam is not specified in "
          + "configuration test-config", e.getMessage());
    }
  }

  @Test
  public void testLoadClass_doesNotExist() throws Exception {
    specifyParam("x", "a.fake.class");
    try {
      loadClass(cfg, Object.class, "x");
      fail("ConfigurationException was expected and not thrown");
    } catch (ConfigurationException e) {
      assertEquals("Could not load the implementation class a.fake.class",
          e.getMessage());
    }
  }

  @Test
  public void testLoadClass_wrongType() throws Exception {
    specifyParam("x", "java.lang.Integer");
    try {
      loadClass(cfg, String.class, "x");
      fail("ConfigurationException was expected and not thrown");
    } catch (ConfigurationException e) {
      assertEquals("The class java.lang.Integer specified by "
          + "parameter x of configuration test-config is not an "
          + "implementation of java.lang.String", e.getMessage());
    }
  }

  @Test
  public void testLoadClass() throws Exception {
    specifyParam("x", " java.lang.String ");
    Class<String> cls = loadClass(cfg, String.class, "x");
    assertSame(String.class, cls);
  }

  @Test(expected = ConfigurationException.class)
  public void testInstantiateClass_missingNoArgConstructor() throws Exception {
    // java.lang.Boolean does not have a no-arg constructor
    specifyParam("x", "java.lang.Boolean");
    instantiateClass(cfg, Boolean.class, "x");
  }

  @Test
  public void testInstantiateClass() throws Exception {
    specifyParam("x", "java.lang.String");
    String s = instantiateClass(cfg, String.class, "x");
    assertEquals("", s);
  }

  @Test
  public void testKeyValueStoreLoader() throws Exception {
    specifyParam(KeyValueStoreLoader.IMPL_PARAM,
        InMemoryKeyValueStore.class.getName());
    KeyValueStore store = KeyValueStoreLoader.load(cfg);
    assertTrue(store instanceof InMemoryKeyValueStore);
  }

  @Test
  public void testPropertiesConfigSource_fallback() throws Exception {
    Properties base = new Properties();
    base.setProperty("a", "from-base");
    base.setProperty("b", "from-base");
    Properties override = new Properties();
    override.setProperty("a", "from-override");

    ConfigSource source = new PropertiesConfigSource("override", override,
        new PropertiesConfigSource("base", base));
    assertEquals("from-override", source.getParameter("a"));
    assertEquals("from-base", source.getParameter("b"));
    assertNull(source.getParameter("c"));
    assertEquals("override", source.getName());
  }

  @Test
  public void testPropertiesConfigSource_missingResource() throws Exception {
    try {
      PropertiesConfigSource.fromClasspath("no-such-file.properties", null);
      fail("ConfigurationException was expected and not thrown");
    } catch (ConfigurationException e) {
      assertEquals("configuration resource no-such-file.properties is not "
          + "on the classpath", e.getMessage());
    }
  }
}
