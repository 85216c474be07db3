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

package com.google.belay.authz.identity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Who a caller is, independent of how they authenticate. An identity may
 * hold any number of credentials and capability grants, both of which refer
 * back to it by {@link #getId()}.
 */
public class Identity {

  private final String id;
  private final IdentityType type;
  private final String displayName;
  private final IdentityStatus status;
  private final Instant createdAt;
  private final String createdBy;
  private final Map<String, Object> metadata;
  private final AppConfig appConfig;

  public Identity(String id, IdentityType type, String displayName,
      IdentityStatus status, Instant createdAt, String createdBy,
      Map<String, Object> metadata, AppConfig appConfig) {
    this.id = id;
    this.type = type;
    this.displayName = displayName;
    this.status = status;
    this.createdAt = createdAt;
    this.createdBy = createdBy;
    this.metadata = metadata == null ? null
        : Collections.unmodifiableMap(
            new LinkedHashMap<String, Object>(metadata));
    this.appConfig = appConfig;
  }

  public String getId() {
    return id;
  }

  public IdentityType getType() {
    return type;
  }

  public String getDisplayName() {
    return displayName;
  }

  public IdentityStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** The identity that created this one; may be {@code null}. */
  public String getCreatedBy() {
    return createdBy;
  }

  /** May be {@code null}. */
  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /** Only set for app identities. */
  public AppConfig getAppConfig() {
    return appConfig;
  }

  public boolean isActive() {
    return status == IdentityStatus.ACTIVE;
  }
}
