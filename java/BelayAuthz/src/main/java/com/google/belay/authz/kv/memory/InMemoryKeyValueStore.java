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

package com.google.belay.authz.kv.memory;

import com.google.belay.authz.kv.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link KeyValueStore} backed by a {@link ConcurrentHashMap}.
 * Everything is lost when the process exits, so this is only suitable for
 * development and tests.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log =
      LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private final ConcurrentHashMap<String, String> values =
      new ConcurrentHashMap<String, String>();

  public InMemoryKeyValueStore() {
    log.warn("Using InMemoryKeyValueStore, tokens and aliases will NOT "
        + "survive restarts");
  }

  @Override
  public String get(String key) {
    return values.get(key);
  }

  @Override
  public void put(String key, String value) {
    if (key == null || value == null) {
      throw new IllegalArgumentException("key and value are required");
    }
    values.put(key, value);
    log.debug("stored {} ({} chars)", key, value.length());
  }

  public int size() {
    return values.size();
  }
}
