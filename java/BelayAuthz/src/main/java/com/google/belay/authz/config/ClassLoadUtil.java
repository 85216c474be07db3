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

import java.lang.reflect.InvocationTargetException;

/**
 * Simple class loading tool which attempts to load implementations of a
 * known type based on class names stored in a {@link ConfigSource}.
 */
public class ClassLoadUtil {

  private ClassLoadUtil() {
    // purely static class
  }

  /*
   * type erasure forces this, manual assignability check is made to ensure
   * safety
   */
  @SuppressWarnings("unchecked")
  public static <T> Class<T> loadClass(ConfigSource cfg,
      Class<T> expectedParentType, String paramName)
      throws ConfigurationException {

    String impl = cfg.getParameter(paramName);

    if (impl == null || impl.trim().isEmpty()) {
      String errMsg = String.format("parameter %s is not specified in "
          + "configuration %s", paramName, cfg.getName());
      throw new ConfigurationException(errMsg);
    }
    impl = impl.trim();

    try {
      Class<?> implClass = Class.forName(impl);
      if (!expectedParentType.isAssignableFrom(implClass)) {
        String errMsg = String.format("The class %s specified by "
            + "parameter %s of configuration %s is not an "
            + "implementation of %s", impl, paramName, cfg.getName(),
            expectedParentType.getCanonicalName());
        throw new ConfigurationException(errMsg);
      }

      return (Class<T>) implClass;

    } catch (ClassNotFoundException e) {
      String errorStr = String.format("Could not load the "
          + "implementation class %s", impl);
      throw new ConfigurationException(errorStr, e);
    }
  }

  public static <T> T instantiateClass(ConfigSource cfg,
      Class<T> expectedParentType, String paramName)
      throws ConfigurationException {

    Class<T> implClass = loadClass(cfg, expectedParentType, paramName);
    try {
      return implClass.getDeclaredConstructor().newInstance();
    } catch (InstantiationException e) {
      String errorStr = String.format("Could not instantiate the "
          + "class %s specified by parameter %s of configuration %s",
          implClass.getCanonicalName(), paramName, cfg.getName());
      throw new ConfigurationException(errorStr, e);

    } catch (InvocationTargetException e) {
      String errorStr = String.format("The constructor of class %s "
          + "specified by parameter %s of configuration %s failed",
          implClass.getCanonicalName(), paramName, cfg.getName());
      throw new ConfigurationException(errorStr, e.getCause());

    } catch (NoSuchMethodException | IllegalAccessException e) {
      String errorStr = String.format("The class %s specified by "
          + "parameter %s of configuration %s must have a public, "
          + "no-argument constructor", implClass.getCanonicalName(),
          paramName, cfg.getName());
      throw new ConfigurationException(errorStr, e);
    }
  }
}
