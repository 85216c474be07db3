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
 * A token scoped to a single resource. Used for both the
 * {@link UnifiedTokenType#RESOURCE} and {@link UnifiedTokenType#SHARE} types.
 */
public class ResourceAccessToken extends UnifiedToken {

  private final String resourceType;
  private final String resourceId;
  private final String authorId;
  private final TokenConstraints constraints;

  public ResourceAccessToken(int version, UnifiedTokenType type,
      int permissions, long issuedAt, long expiresAt, String resourceType,
      String resourceId, String authorId, TokenConstraints constraints) {
    super(version, type, permissions, issuedAt, expiresAt);
    if (!type.isResourceScoped()) {
      throw new IllegalArgumentException(type + " is not a resource type");
    }
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    this.authorId = authorId;
    this.constraints = constraints;
  }

  /** One of the {@link UnifiedResourceType} names, or "unknown". */
  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  /** Empty when the token was not issued on anyone's behalf. */
  public String getAuthorId() {
    return authorId;
  }

  /** {@code null} when the token carries no constraints. */
  public TokenConstraints getConstraints() {
    return constraints;
  }
}
