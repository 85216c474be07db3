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

package com.google.belay.authz.kv;

/**
 * The storage the authz core is given for its own records: stateful tokens
 * under {@code __TOKEN:} and namespace aliases under {@code __NS_ALIAS:} and
 * {@code __NS_FULL:}. Implementations must have a public no-argument
 * constructor to be usable through {@code KeyValueStoreLoader}.
 */
public interface KeyValueStore {

  /**
   * @return the stored value, or {@code null} if the key is absent
   */
  String get(String key) throws StorageException;

  void put(String key, String value) throws StorageException;
}
