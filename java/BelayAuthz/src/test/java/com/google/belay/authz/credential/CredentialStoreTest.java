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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.belay.authz.codec.Digests;
import com.google.belay.authz.credential.CredentialVerification.Rejection;

import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

public class CredentialStoreTest {

  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private CredentialStore store;

  @Before
  public void setUp() {
    store = storeAt(NOW);
  }

  private static CredentialStore storeAt(Instant now) {
    return new CredentialStore(Clock.fixed(now, ZoneOffset.UTC),
        new Random(7));
  }

  @Test
  public void testCreateCredential() {
    IssuedCredential issued = store.createCredential("id_alice",
        CredentialType.API_KEY, null, null);
    Credential cred = issued.getCredential();

    assertTrue(CredentialStore.isValidCredentialId(cred.getId()));
    assertEquals("id_alice", cred.getIdentityId());
    assertSame(CredentialType.API_KEY, cred.getType());
    assertSame(CredentialStatus.ACTIVE, cred.getStatus());
    assertEquals(NOW, cred.getCreatedAt());
    assertEquals(SecretHasher.SECRET_BYTES * 2, issued.getSecret().length());
    assertEquals(Digests.sha256Hex(issued.getSecret()), cred.getSecretHash());
    assertNotEquals(issued.getSecret(), cred.getSecretHash());
  }

  @Test
  public void testVerifyCredential() {
    IssuedCredential issued = store.createCredential("id_alice",
        CredentialType.API_KEY, null, null);

    CredentialVerification ok =
        store.verifyCredential(issued.getCredential(), issued.getSecret());
    assertTrue(ok.isValid());
    assertEquals("id_alice", ok.getIdentityId());
    assertNull(ok.getReason());

    CredentialVerification bad =
        store.verifyCredential(issued.getCredential(), "guess");
    assertFalse(bad.isValid());
    assertSame(Rejection.INVALID_SECRET, bad.getRejection());
    assertEquals("invalid_secret", bad.getReason());
    assertNull(bad.getIdentityId());
  }

  @Test
  public void testVerifyCredential_expiry() {
    Instant expiresAt = NOW.plus(Duration.ofHours(1));
    IssuedCredential issued = store.createCredential("id_alice",
        CredentialType.BEARER_TOKEN, expiresAt, null);

    assertTrue(storeAt(expiresAt).verifyCredential(issued.getCredential(),
        issued.getSecret()).isValid());
    assertEquals("expired", storeAt(expiresAt.plusSeconds(1))
        .verifyCredential(issued.getCredential(), issued.getSecret())
        .getReason());
  }

  @Test
  public void testVerifyCredential_scopeExpiry() {
    CredentialScope scope = new CredentialScope(null, null, null,
        NOW.plusSeconds(60));
    IssuedCredential issued = store.createCredential("id_alice",
        CredentialType.API_KEY, null, scope);

    assertSame(Rejection.SCOPE_EXPIRED, storeAt(NOW.plusSeconds(61))
        .verifyCredential(issued.getCredential(), issued.getSecret())
        .getRejection());
  }

  @Test
  public void testVerifyCredential_revocationIsCheckedFirst() {
    IssuedCredential issued = store.createCredential("id_alice",
        CredentialType.API_KEY, NOW.plusSeconds(10), null);
    Credential revoked =
        store.revokeCredential(issued.getCredential(), "leaked");

    CredentialVerification result = storeAt(NOW.plusSeconds(20))
        .verifyCredential(revoked, "wrong secret");
    assertSame(Rejection.REVOKED, result.getRejection());
  }

  @Test
  public void testRotateCredential_oldSecretWorksDuringGracePeriod() {
    IssuedCredential issued = store.createCredential("id_bob",
        CredentialType.API_KEY, null, CredentialScope.ofCapabilities("kv:read"));

    CredentialRotation rotation =
        store.rotateCredential(issued.getCredential());
    Credential old = rotation.getOldCredential();
    Credential replacement = rotation.getNewCredential();

    assertSame(CredentialStatus.ROTATING, old.getStatus());
    assertSame(CredentialStatus.ACTIVE, replacement.getStatus());
    assertNotEquals(old.getId(), replacement.getId());
    assertEquals("id_bob", replacement.getIdentityId());
    assertEquals(old.getScope().getCapabilities(),
        replacement.getScope().getCapabilities());

    assertTrue(store.verifyCredential(old, issued.getSecret()).isValid());
    assertTrue(store.verifyCredential(replacement, rotation.getNewSecret())
        .isValid());
    assertFalse(store.verifyCredential(replacement, issued.getSecret())
        .isValid());

    Credential retired = store.revokeCredential(old, "rotation complete");
    assertFalse(store.verifyCredential(retired, issued.getSecret())
        .isValid());
  }

  @Test(expected = IllegalStateException.class)
  public void testRotateCredential_revoked() {
    IssuedCredential issued = store.createCredential("id_bob",
        CredentialType.API_KEY, null, null);
    store.rotateCredential(
        store.revokeCredential(issued.getCredential(), "gone"));
  }

  @Test
  public void testRevokeCredential_isIdempotent() {
    IssuedCredential issued = store.createCredential("id_carol",
        CredentialType.REFRESH_TOKEN, null, null);
    Credential revoked =
        store.revokeCredential(issued.getCredential(), "first");

    assertSame(CredentialStatus.REVOKED, revoked.getStatus());
    assertEquals(NOW, revoked.getRevokedAt());
    assertEquals("first", revoked.getRevocationReason());
    assertSame(CredentialStatus.ACTIVE,
        issued.getCredential().getStatus());

    Credential again = storeAt(NOW.plusSeconds(5)).revokeCredential(revoked,
        "second");
    assertSame(revoked, again);
  }

  @Test
  public void testMarkCredentialUsed() {
    IssuedCredential issued = store.createCredential("id_carol",
        CredentialType.API_KEY, null, null);
    assertNull(issued.getCredential().getLastUsedAt());

    Credential used = storeAt(NOW.plusSeconds(30))
        .markCredentialUsed(issued.getCredential());
    assertEquals(NOW.plusSeconds(30), used.getLastUsedAt());
  }

  @Test
  public void testIsValidCredentialId() {
    assertTrue(CredentialStore.isValidCredentialId(
        "cred_0123456789abcdef0123456789abcdef"));
    assertFalse(CredentialStore.isValidCredentialId("cred_short"));
    assertFalse(CredentialStore.isValidCredentialId(
        "grant_0123456789abcdef0123456789abcdef"));
    assertFalse(CredentialStore.isValidCredentialId(null));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCreateCredential_identityRequired() {
    store.createCredential("", CredentialType.API_KEY, null, null);
  }
}
