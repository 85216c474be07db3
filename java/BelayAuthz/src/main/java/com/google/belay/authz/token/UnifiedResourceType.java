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

package com.google.belay.authz.token;

/**
 * Resource types known to the unified token format. Names outside this list
 * are encoded as {@link #UNKNOWN} and decode as {@code "unknown"}.
 */
public enum UnifiedResourceType {

  UNKNOWN(0x00, "unknown"),
  KV(0x01, "kv"),
  BLOB(0x02, "blob"),
  CHANNEL(0x03, "channel"),
  NAMESPACE(0x04, "namespace");

  private final int code;
  private final String name;

  UnifiedResourceType(int code, String name) {
    this.code = code;
    this.name = name;
  }

  public int getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public static UnifiedResourceType fromName(String name) {
    for (UnifiedResourceType t : values()) {
      if (t != UNKNOWN && t.name.equals(name)) {
        return t;
      }
    }
    return UNKNOWN;
  }

  public static UnifiedResourceType fromCode(int code) {
    for (UnifiedResourceType t : values()) {
      if (t.code == code) {
        return t;
      }
    }
    return UNKNOWN;
  }
}
