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
 * Header fields of a unified token read without checking its signature.
 */
public class ParsedUnifiedToken {

  private final int version;
  private final UnifiedTokenType type;
  private final String resourceType;
  private final String resourceId;

  public ParsedUnifiedToken(int version, UnifiedTokenType type,
      String resourceType, String resourceId) {
    this.version = version;
    this.type = type;
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public int getVersion() {
    return version;
  }

  public UnifiedTokenType getType() {
    return type;
  }

  /** Only set for resource and share tokens. */
  public String getResourceType() {
    return resourceType;
  }

  /** Only set for resource and share tokens. */
  public String getResourceId() {
    return resourceId;
  }
}
