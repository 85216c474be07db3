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

import com.google.belay.authz.kv.KeyValueStore;

/**
 * Simple utility class which can load a {@link KeyValueStore} based on the
 * parameter "KeyValueStoreImpl" of a {@link ConfigSource}.
 */
public class KeyValueStoreLoader {

  public static final String IMPL_PARAM = "KeyValueStoreImpl";

  private KeyValueStoreLoader() {
    // purely static class
  }

  public static KeyValueStore load(ConfigSource cfg)
      throws ConfigurationException {
    return ClassLoadUtil.instantiateClass(cfg, KeyValueStore.class,
        IMPL_PARAM);
  }
}
