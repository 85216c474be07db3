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

import java.util.Set;

/**
 * A verified unified token. The concrete subclass depends on the token type:
 * {@link BearerToken}, {@link ResourceAccessToken} or {@link InvitationToken}.
 */
public abstract class UnifiedToken {

  private final int version;
  private final UnifiedTokenType type;
  private final int permissions;
  private final long issuedAt;
  private final long expiresAt;

  protected UnifiedToken(int version, UnifiedTokenType type, int permissions,
      long issuedAt, long expiresAt) {
    this.version = version;
    this.type = type;
    this.permissions = permissions;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
  }

  public int getVersion() {
    return version;
  }

  public UnifiedTokenType getType() {
    return type;
  }

  /** The raw 16 bit permission field, including resource-specific bits. */
  public int getPermissionBitmap() {
    return permissions;
  }

  public Set<UnifiedPermission> getPermissions() {
    return UnifiedPermission.fromBitmap(permissions);
  }

  public boolean hasPermission(UnifiedPermission permission) {
    return permission.isSetIn(permissions);
  }

  /** Unix seconds. */
  public long getIssuedAt() {
    return issuedAt;
  }

  /** Unix seconds. */
  public long getExpiresAt() {
    return expiresAt;
  }
}
