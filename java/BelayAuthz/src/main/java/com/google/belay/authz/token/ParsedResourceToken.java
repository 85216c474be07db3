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
 * The unauthenticated routing information of a resource token: enough to
 * find the resource whose secret must then be used to verify it.
 */
public class ParsedResourceToken {

  private final TokenFormat format;
  private final ResourceKind kind;
  private final String resourceId;

  public ParsedResourceToken(TokenFormat format, ResourceKind kind,
      String resourceId) {
    this.format = format;
    this.kind = kind;
    this.resourceId = resourceId;
  }

  public TokenFormat getFormat() {
    return format;
  }

  public ResourceKind getKind() {
    return kind;
  }

  public String getResourceId() {
    return resourceId;
  }
}
