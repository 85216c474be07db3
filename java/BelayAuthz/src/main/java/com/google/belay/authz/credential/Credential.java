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

package com.google.belay.authz.credential;

import com.google.belay.authz.HideFromClient;

import java.time.Instant;

/**
 * How an identity authenticates. Only the SHA-256 hash of the secret is
 * kept; the secret itself is handed out once by {@link CredentialStore} and
 * cannot be recovered.
 */
public class Credential {

  private final String id;
  private final String identityId;
  private final CredentialType type;
  @HideFromClient
  private final String secretHash;
  private final CredentialStatus status;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final Instant lastUsedAt;
  private final CredentialScope scope;
  private final Instant revokedAt;
  private final String revocationReason;

  Credential(String id, String identityId, CredentialType type,
      String secretHash, CredentialStatus status, Instant createdAt,
      Instant expiresAt, Instant lastUsedAt, CredentialScope scope,
      Instant revokedAt, String revocationReason) {
    this.id = id;
    this.identityId = identityId;
    this.type = type;
    this.secretHash = secretHash;
    this.status = status;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.lastUsedAt = lastUsedAt;
    this.scope = scope;
    this.revokedAt = revokedAt;
    this.revocationReason = revocationReason;
  }

  Credential withStatus(CredentialStatus newStatus) {
    return new Credential(id, identityId, type, secretHash, newStatus,
        createdAt, expiresAt, lastUsedAt, scope, revokedAt, revocationReason);
  }

  Credential withRevocation(Instant when, String reason) {
    return new Credential(id, identityId, type, secretHash,
        CredentialStatus.REVOKED, createdAt, expiresAt, lastUsedAt, scope,
        when, reason);
  }

  Credential withLastUsedAt(Instant when) {
    return new Credential(id, identityId, type, secretHash, status,
        createdAt, expiresAt, when, scope, revokedAt, revocationReason);
  }

  public String getId() {
    return id;
  }

  public String getIdentityId() {
    return identityId;
  }

  public CredentialType getType() {
    return type;
  }

  public String getSecretHash() {
    return secretHash;
  }

  public CredentialStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** May be {@code null} for credentials that never expire. */
  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getLastUsedAt() {
    return lastUsedAt;
  }

  /** May be {@code null} for an unrestricted credential. */
  public CredentialScope getScope() {
    return scope;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public String getRevocationReason() {
    return revocationReason;
  }
}
