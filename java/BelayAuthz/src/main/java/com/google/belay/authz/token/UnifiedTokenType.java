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
 * The variants of the unified token envelope, identified by the second byte
 * of the encoded token.
 */
public enum UnifiedTokenType {

  /** Acts as an identity, like a session. */
  BEARER(0x01),

  /** Grants access to one resource. */
  RESOURCE(0x02),

  /** A resource token handed from one party to another. */
  SHARE(0x03),

  /** Lets its holder claim a pre-created identity. */
  INVITATION(0x04);

  private final int code;

  UnifiedTokenType(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public boolean isResourceScoped() {
    return this == RESOURCE || this == SHARE;
  }

  /**
   * @return the type with the given wire code, or {@code null} if there is
   *         none
   */
  public static UnifiedTokenType fromCode(int code) {
    for (UnifiedTokenType t : values()) {
      if (t.code == code) {
        return t;
      }
    }
    return null;
  }
}
