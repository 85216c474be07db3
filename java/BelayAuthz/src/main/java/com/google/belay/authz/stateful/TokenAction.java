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

package com.google.belay.authz.stateful;

/**
 * What a stateful token lets its holder do. The wire name is stored in the
 * {@code action} member of the token record and selects the payload shape.
 */
public enum TokenAction {

  /** Set credentials on an identity that is waiting to be claimed. */
  IDENTITY_CLAIM("identity:claim"),

  /** Access one blob in one namespace. */
  BLOB_ACCESS("blob:access"),

  /** Access one channel. */
  CHANNEL_ACCESS("channel:access");

  private final String wireName;

  TokenAction(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * @return the action with the given wire name, or {@code null} if there is
   *         none
   */
  public static TokenAction fromWireName(String name) {
    for (TokenAction a : values()) {
      if (a.wireName.equals(name)) {
        return a;
      }
    }
    return null;
  }
}
