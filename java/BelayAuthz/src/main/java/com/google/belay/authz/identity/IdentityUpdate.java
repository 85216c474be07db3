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

package com.google.belay.authz.identity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A partial change to an identity. Unset fields leave the identity as it
 * was; metadata entries are merged into the existing metadata one key at a
 * time.
 */
public class IdentityUpdate {

  private String displayName;
  private IdentityStatus status;
  private Map<String, Object> metadata;

  public IdentityUpdate displayName(String displayName) {
    this.displayName = displayName;
    return this;
  }

  public IdentityUpdate status(IdentityStatus status) {
    this.status = status;
    return this;
  }

  public IdentityUpdate metadata(String key, Object value) {
    if (metadata == null) {
      metadata = new LinkedHashMap<String, Object>();
    }
    metadata.put(key, value);
    return this;
  }

  public IdentityUpdate metadata(Map<String, Object> entries) {
    for (Map.Entry<String, Object> e : entries.entrySet()) {
      metadata(e.getKey(), e.getValue());
    }
    return this;
  }

  String getDisplayName() {
    return displayName;
  }

  IdentityStatus getStatus() {
    return status;
  }

  Map<String, Object> getMetadata() {
    return metadata;
  }
}
