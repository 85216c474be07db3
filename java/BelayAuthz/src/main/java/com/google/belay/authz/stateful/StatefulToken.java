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

package com.google.belay.authz.stateful;

import java.time.Instant;

/**
 * A server side token record. Unlike the signed resource tokens, a stateful
 * token is only an opaque id ({@code tk_} followed by 32 hex characters); its
 * meaning lives in the record stored under that id, which is what makes it
 * possible to revoke it or allow it to be used once only.
 *
 * <p>
 * Instances are treated as values: {@link StatefulTokenStore} never changes a
 * token it is given and returns an updated copy instead.
 */
public abstract class StatefulToken {

  private final String id;
  private final TokenAction action;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final String createdBy;
  private final String label;

  private Instant usedAt;
  private String usedBy;
  private boolean revoked;
  private Instant revokedAt;
  private String revokedReason;

  protected StatefulToken(String id, TokenAction action, Instant createdAt,
      Instant expiresAt, String createdBy, String label) {
    this.id = id;
    this.action = action;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    this.createdBy = createdBy;
    this.label = label;
  }

  /**
   * @return a token with the same content, including use and revocation
   *         state, that can be changed without affecting this one
   */
  public abstract StatefulToken copy();

  /** Copies the use and revocation state of {@code other} onto this token. */
  protected void copyStateFrom(StatefulToken other) {
    this.usedAt = other.usedAt;
    this.usedBy = other.usedBy;
    this.revoked = other.revoked;
    this.revokedAt = other.revokedAt;
    this.revokedReason = other.revokedReason;
  }

  public String getId() {
    return id;
  }

  public TokenAction getAction() {
    return action;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  /** A human readable note such as "For Bob"; may be {@code null}. */
  public String getLabel() {
    return label;
  }

  public Instant getUsedAt() {
    return usedAt;
  }

  public String getUsedBy() {
    return usedBy;
  }

  public boolean isRevoked() {
    return revoked;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }

  public String getRevokedReason() {
    return revokedReason;
  }

  void markUsed(Instant usedAt, String usedBy) {
    this.usedAt = usedAt;
    this.usedBy = usedBy;
  }

  void markRevoked(Instant revokedAt, String reason) {
    this.revoked = true;
    this.revokedAt = revokedAt;
    this.revokedReason = reason;
  }
}
