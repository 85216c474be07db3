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

import com.google.belay.authz.codec.ByteCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Random;

/**
 * Issues, verifies, rotates and revokes credentials. Credentials are values:
 * no method changes the credential it is given, and persisting the returned
 * credentials is left to the caller.
 */
public class CredentialStore {

  private static final Logger log =
      LoggerFactory.getLogger(CredentialStore.class);

  public static final String ID_PREFIX = "cred_";

  private static final int ID_BYTES = 16;

  private final Clock clock;
  private final Random random;

  public CredentialStore(Clock clock) {
    this(clock, new SecureRandom());
  }

  public CredentialStore(Clock clock, Random random) {
    if (clock == null || random == null) {
      throw new IllegalArgumentException("clock and random are required");
    }
    this.clock = clock;
    this.random = random;
  }

  /**
   * @param expiresAt
   *          may be {@code null} for a credential that does not expire
   * @param scope
   *          may be {@code null} for an unrestricted credential
   */
  public IssuedCredential createCredential(String identityId,
      CredentialType type, Instant expiresAt, CredentialScope scope) {
    if (identityId == null || identityId.isEmpty()) {
      throw new IllegalArgumentException("identityId is required");
    }
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }

    String secret = SecretHasher.generateSecret(random);
    Credential credential = new Credential(generateId(), identityId, type,
        SecretHasher.hash(secret), CredentialStatus.ACTIVE, clock.instant(),
        expiresAt, null, scope, null, null);
    return new IssuedCredential(credential, secret);
  }

  /**
   * Checks, in order, that the credential is not revoked, not expired, that
   * its scope has not expired, and that the secret matches.
   */
  public CredentialVerification verifyCredential(Credential credential,
      String secret) {
    Instant now = clock.instant();
    if (credential.getStatus() == CredentialStatus.REVOKED) {
      return CredentialVerification.rejected(
          CredentialVerification.Rejection.REVOKED);
    }
    if (credential.getExpiresAt() != null
        && now.isAfter(credential.getExpiresAt())) {
      return CredentialVerification.rejected(
          CredentialVerification.Rejection.EXPIRED);
    }
    CredentialScope scope = credential.getScope();
    if (scope != null && scope.getExpiresAt() != null
        && now.isAfter(scope.getExpiresAt())) {
      return CredentialVerification.rejected(
          CredentialVerification.Rejection.SCOPE_EXPIRED);
    }
    if (!SecretHasher.matches(secret, credential.getSecretHash())) {
      return CredentialVerification.rejected(
          CredentialVerification.Rejection.INVALID_SECRET);
    }
    return CredentialVerification.accepted(credential.getIdentityId());
  }

  /**
   * Issues a replacement with the same identity, type, expiry and scope, and
   * marks the old credential as rotating. The old credential keeps working
   * until it is revoked, so clients have time to switch.
   *
   * @throws IllegalStateException
   *           if the credential has already been revoked
   */
  public CredentialRotation rotateCredential(Credential old) {
    if (old.getStatus() == CredentialStatus.REVOKED) {
      throw new IllegalStateException(String.format(
          "credential %s is revoked and cannot be rotated", old.getId()));
    }
    IssuedCredential replacement = createCredential(old.getIdentityId(),
        old.getType(), old.getExpiresAt(), old.getScope());
    log.info("rotating credential {} of {} to {}", old.getId(),
        old.getIdentityId(), replacement.getCredential().getId());
    return new CredentialRotation(old.withStatus(CredentialStatus.ROTATING),
        replacement.getCredential(), replacement.getSecret());
  }

  /**
   * Revoking an already revoked credential returns it unchanged, keeping the
   * original time and reason.
   */
  public Credential revokeCredential(Credential credential, String reason) {
    if (credential.getStatus() == CredentialStatus.REVOKED) {
      return credential;
    }
    log.info("revoking credential {} of {}: {}", credential.getId(),
        credential.getIdentityId(), reason);
    return credential.withRevocation(clock.instant(), reason);
  }

  /** Records a successful use of the credential now. */
  public Credential markCredentialUsed(Credential credential) {
    return credential.withLastUsedAt(clock.instant());
  }

  public static boolean isValidCredentialId(String id) {
    return id != null && id.startsWith(ID_PREFIX)
        && id.length() == ID_PREFIX.length() + ID_BYTES * 2
        && ByteCodec.isHex(id.substring(ID_PREFIX.length()));
  }

  private String generateId() {
    byte[] bytes = new byte[ID_BYTES];
    random.nextBytes(bytes);
    return ID_PREFIX + ByteCodec.toHex(bytes);
  }
}
