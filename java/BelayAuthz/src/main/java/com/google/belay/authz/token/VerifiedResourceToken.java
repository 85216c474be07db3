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

import java.util.List;

/**
 * The normalized content of a resource token whose signature has been
 * checked. Every format decodes into this one type; {@link #getFormat()}
 * records which decoder produced it.
 */
public class VerifiedResourceToken {

  private final TokenFormat format;
  private final ResourceKind kind;
  private final String resourceId;
  private final List<Permission> permissions;
  private final String authorId;
  private final long expiresAt;

  public VerifiedResourceToken(TokenFormat format, ResourceKind kind,
      String resourceId, List<Permission> permissions, String authorId,
      long expiresAt) {
    this.format = format;
    this.kind = kind;
    this.resourceId = resourceId;
    this.permissions = permissions;
    this.authorId = authorId;
    this.expiresAt = expiresAt;
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

  public List<Permission> getPermissions() {
    return permissions;
  }

  public List<String> getPermissionNames() {
    return Permission.toNames(permissions);
  }

  public boolean hasPermission(Permission permission) {
    return permissions.contains(permission);
  }

  public String getAuthorId() {
    return authorId;
  }

  /** Unix seconds; for V3 and V4 tokens this is rounded down to the hour. */
  public long getExpiresAt() {
    return expiresAt;
  }
}
