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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a unified token should contain. Instances are created through the
 * static factory for the wanted type, which makes sure the fields that type
 * needs are present.
 */
public class UnifiedTokenRequest {

  private final UnifiedTokenType type;
  private final int permissions;
  private final long expiresInSeconds;
  private final String identityId;
  private final String resourceType;
  private final String resourceId;
  private final String authorId;
  private final List<String> grantedCapabilities;
  private final TokenConstraints constraints;

  private UnifiedTokenRequest(UnifiedTokenType type, int permissions,
      long expiresInSeconds, String identityId, String resourceType,
      String resourceId, String authorId, List<String> grantedCapabilities,
      TokenConstraints constraints) {
    if (permissions < 0 || permissions > UnifiedPermission.MAX_BITMAP) {
      throw new IllegalArgumentException(String.format(
          "permission bitmap 0x%x does not fit in 16 bits", permissions));
    }
    if (expiresInSeconds < 0) {
      throw new IllegalArgumentException(String.format(
          "expiresInSeconds must not be negative, was %d", expiresInSeconds));
    }
    this.type = type;
    this.permissions = permissions;
    this.expiresInSeconds = expiresInSeconds;
    this.identityId = identityId;
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    this.authorId = authorId;
    this.grantedCapabilities = grantedCapabilities;
    this.constraints = constraints;
  }

  public static UnifiedTokenRequest bearer(String identityId,
      int permissions, long expiresInSeconds) {
    return new UnifiedTokenRequest(UnifiedTokenType.BEARER, permissions,
        expiresInSeconds, required(identityId, "identityId"), null, null,
        null, null, null);
  }

  public static UnifiedTokenRequest resource(String resourceType,
      String resourceId, int permissions, long expiresInSeconds) {
    return new UnifiedTokenRequest(UnifiedTokenType.RESOURCE, permissions,
        expiresInSeconds, null, required(resourceType, "resourceType"),
        required(resourceId, "resourceId"), "", null, null);
  }

  public static UnifiedTokenRequest share(String resourceType,
      String resourceId, String authorId, int permissions,
      long expiresInSeconds) {
    return new UnifiedTokenRequest(UnifiedTokenType.SHARE, permissions,
        expiresInSeconds, null, required(resourceType, "resourceType"),
        required(resourceId, "resourceId"), required(authorId, "authorId"),
        null, null);
  }

  public static UnifiedTokenRequest invitation(String identityId,
      List<String> grantedCapabilities, int permissions,
      long expiresInSeconds) {
    List<String> caps = grantedCapabilities == null
        ? Collections.<String> emptyList()
        : Collections.unmodifiableList(
            new ArrayList<String>(grantedCapabilities));
    return new UnifiedTokenRequest(UnifiedTokenType.INVITATION, permissions,
        expiresInSeconds, required(identityId, "identityId"), null, null,
        null, caps, null);
  }

  /**
   * Returns a copy of this request carrying the given constraints.
   *
   * @throws IllegalArgumentException
   *           if this is not a resource or share request
   */
  public UnifiedTokenRequest withConstraints(TokenConstraints constraints) {
    if (!type.isResourceScoped()) {
      throw new IllegalArgumentException(String.format(
          "%s tokens cannot carry constraints", type));
    }
    return new UnifiedTokenRequest(type, permissions, expiresInSeconds,
        identityId, resourceType, resourceId, authorId, grantedCapabilities,
        constraints);
  }

  private static String required(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(name + " is required");
    }
    return value;
  }

  public UnifiedTokenType getType() {
    return type;
  }

  public int getPermissions() {
    return permissions;
  }

  public long getExpiresInSeconds() {
    return expiresInSeconds;
  }

  public String getIdentityId() {
    return identityId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  public String getAuthorId() {
    return authorId;
  }

  public List<String> getGrantedCapabilities() {
    return grantedCapabilities;
  }

  public TokenConstraints getConstraints() {
    return constraints;
  }
}
