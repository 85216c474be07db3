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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * A {@link ConfigSource} over {@link Properties}, optionally falling back to
 * another source for parameters it does not set itself.
 */
public class PropertiesConfigSource implements ConfigSource {

  private final String name;
  private final Properties properties;
  private final ConfigSource fallback;

  public PropertiesConfigSource(String name, Properties properties) {
    this(name, properties, null);
  }

  public PropertiesConfigSource(String name, Properties properties,
      ConfigSource fallback) {
    this.name = name;
    this.properties = properties;
    this.fallback = fallback;
  }

  /**
   * Loads a properties file from the classpath of the current thread.
   *
   * @throws ConfigurationException
   *           if the resource does not exist or cannot be read
   */
  public static PropertiesConfigSource fromClasspath(String resource,
      ConfigSource fallback) throws ConfigurationException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = PropertiesConfigSource.class.getClassLoader();
    }

    InputStream in = loader.getResourceAsStream(resource);
    if (in == null) {
      throw new ConfigurationException(String.format(
          "configuration resource %s is not on the classpath", resource));
    }
    try {
      try {
        Properties props = new Properties();
        props.load(in);
        return new PropertiesConfigSource(resource, props, fallback);
      } finally {
        in.close();
      }
    } catch (IOException e) {
      throw new ConfigurationException(String.format(
          "could not read configuration resource %s", resource), e);
    }
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getParameter(String param) {
    String value = properties.getProperty(param);
    if (value == null && fallback != null) {
      value = fallback.getParameter(param);
    }
    return value;
  }
}
