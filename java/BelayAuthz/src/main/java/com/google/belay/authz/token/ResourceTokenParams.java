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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * What a resource token should grant: the resource, the permissions, who it
 * is for and for how long.
 *
 * <p>
 * {@code authorId} is a hex identifier packed into the fixed author field of
 * the V2 and V3 formats. {@code displayName} is a human readable name of up to
 * 32 UTF-8 bytes and, when present, always produces a V4 token.
 */
public class ResourceTokenParams {

  private final String resourceId;
  private final List<Permission> permissions;
  private final String authorId;
  private final String displayName;
  private final long expiresInSeconds;

  private ResourceTokenParams(Builder b) {
    this.resourceId = b.resourceId;
    this.permissions = Collections.unmodifiableList(
        new ArrayList<Permission>(b.permissions));
    this.authorId = b.authorId;
    this.displayName = b.displayName;
    this.expiresInSeconds = b.expiresInSeconds;
  }

  public static Builder builder(String resourceId) {
    return new Builder(resourceId);
  }

  public String getResourceId() {
    return resourceId;
  }

  public List<Permission> getPermissions() {
    return permissions;
  }

  public String getAuthorId() {
    return authorId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public long getExpiresInSeconds() {
    return expiresInSeconds;
  }

  public static class Builder {

    private final String resourceId;
    private final List<Permission> permissions = new ArrayList<Permission>();
    private String authorId;
    private String displayName;
    private long expiresInSeconds;

    Builder(String resourceId) {
      this.resourceId = resourceId;
    }

    public Builder permissions(Permission... perms) {
      return permissions(Arrays.asList(perms));
    }

    public Builder permissions(Collection<Permission> perms) {
      for (Permission p : perms) {
        if (!permissions.contains(p)) {
          permissions.add(p);
        }
      }
      return this;
    }

    /**
     * Adds permissions by wire name; {@code "write"} is read as
     * {@code "append"}.
     */
    public Builder permissionNames(String... names) {
      return permissions(Permission.fromNames(Arrays.asList(names)));
    }

    public Builder authorId(String authorId) {
      this.authorId = authorId;
      return this;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder expiresInSeconds(long expiresInSeconds) {
      this.expiresInSeconds = expiresInSeconds;
      return this;
    }

    public ResourceTokenParams build() {
      if (resourceId == null || resourceId.isEmpty()) {
        throw new IllegalArgumentException("resourceId is required");
      }
      if (permissions.isEmpty()) {
        throw new IllegalArgumentException(
            "at least one permission is required");
      }
      if (expiresInSeconds < 0) {
        throw new IllegalArgumentException(String.format(
            "expiresInSeconds must not be negative, was %d",
            expiresInSeconds));
      }
      return new ResourceTokenParams(this);
    }
  }
}
