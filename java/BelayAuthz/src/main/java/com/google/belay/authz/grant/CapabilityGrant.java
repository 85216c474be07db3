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

package com.google.belay.authz.grant;

import java.time.Instant;

/**
 * Gives one identity one capability, optionally limited by a
 * {@link GrantScope} and an expiry. A grant is never edited; it can only be
 * revoked.
 */
public class CapabilityGrant {

  private final String grantId;
  private final String identityId;
  private final String capability;
  private final Instant grantedAt;
  private final String grantedBy;
  private final GrantSource source;
  private final String sourceId;
  private final GrantScope scope;
  private final Instant expiresAt;
  private final Instant revokedAt;
  private final String revokedBy;
  private final String revocationReason;

  CapabilityGrant(String grantId, String identityId, String capability,
      Instant grantedAt, String grantedBy, GrantSource source,
      String sourceId, GrantScope scope, Instant expiresAt, Instant revokedAt,
      String revokedBy, String revocationReason) {
    this.grantId = grantId;
    this.identityId = identityId;
    this.capability = capability;
    this.grantedAt = grantedAt;
    this.grantedBy = grantedBy;
    this.source = source;
    this.sourceId = sourceId;
    this.scope = scope;
    this.expiresAt = expiresAt;
    this.revokedAt = revokedAt;
    this.revokedBy = revokedBy;
    this.revocationReason = revocationReason;
  }

  CapabilityGrant withRevocation(Instant when, String by, String reason) {
    return new CapabilityGrant(grantId, identityId, capability, grantedAt,
        grantedBy, source, sourceId, scope, expiresAt, when, by, reason);
  }

  public String getGrantId() {
    return grantId;
  }

  public String getIdentityId() {
    return identityId;
  }

  public String getCapability() {
    return capability;
  }

  public Instant getGrantedAt() {
    return grantedAt;
  }

  public String getGrantedBy() {
    return grantedBy;
  }

  public GrantSource getSource() {
    return source;
  }

  public String getSourceId() {
    return sourceId;
  }

  /** May be {@code null}, meaning unrestricted. */
  public GrantScope getScope() {
    return scope;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public String getRevokedBy() {
    return revokedBy;
  }

  public String getRevocationReason() {
    return revocationReason;
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }
}
