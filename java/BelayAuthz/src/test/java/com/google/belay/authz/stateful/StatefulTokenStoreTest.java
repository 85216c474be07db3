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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.belay.authz.kv.KeyValueStore;
import com.google.belay.authz.kv.StorageException;
import com.google.belay.authz.kv.memory.InMemoryKeyValueStore;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Random;

public class StatefulTokenStoreTest {

  private static final Instant NOW = Instant.parse("2025-04-01T00:00:00Z");

  @Rule
  public final JUnitRuleMockery context = new JUnitRuleMockery();

  private InMemoryKeyValueStore kv;
  private StatefulTokenStore tokens;

  @Before
  public void setUp() {
    kv = new InMemoryKeyValueStore();
    tokens = storeAt(kv, NOW);
  }

  private static StatefulTokenStore storeAt(KeyValueStore kv, Instant now) {
    return new StatefulTokenStore(kv, Clock.fixed(now, ZoneOffset.UTC),
        StatefulTokenStore.DEFAULT_EXPIRY, new Random(5));
  }

  @Test
  public void testCreateIdentityClaimToken() {
    IdentityClaimToken token = tokens.createIdentityClaimToken("ident_bob",
        "ident_admin", "for Bob", null);

    assertTrue(StatefulTokenStore.isValidTokenId(token.getId()));
    assertSame(TokenAction.IDENTITY_CLAIM, token.getAction());
    assertEquals("ident_bob", token.getIdentityId());
    assertEquals("ident_admin", token.getCreatedBy());
    assertEquals("for Bob", token.getLabel());
    assertEquals(NOW, token.getCreatedAt());
    assertEquals(NOW.plus(Duration.ofDays(7)), token.getExpiresAt());
    assertSame(TokenStatus.VALID, tokens.getTokenStatus(token));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCreateBlobAccessToken_permissionsRequired() {
    tokens.createBlobAccessToken("ns", "key", Arrays.<String> asList(),
        "ident_admin", null, null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCreateChannelAccessToken_negativeExpiry() {
    tokens.createChannelAccessToken("room", Arrays.asList("read"),
        "ident_admin", null, Duration.ofSeconds(-1));
  }

  @Test
  public void testSaveAndLookup() throws Exception {
    BlobAccessToken token = tokens.createBlobAccessToken("www_app_com",
        "photos/1.png", Arrays.asList("read"), "ident_alice", "holiday",
        Duration.ofHours(1));
    tokens.saveToken(token);
    assertNotNull(kv.get(StatefulTokenStore.getStorageKey(token.getId())));

    TokenLookupResult result = tokens.lookupToken(token.getId());
    assertTrue(result.isValid());
    assertNull(result.getError());

    BlobAccessToken loaded = (BlobAccessToken) result.getToken();
    assertEquals(token.getId(), loaded.getId());
    assertEquals("www_app_com", loaded.getNamespace());
    assertEquals("photos/1.png", loaded.getBlobKey());
    assertEquals(Arrays.asList("read"), loaded.getPermissions());
    assertEquals("holiday", loaded.getLabel());
    assertEquals(token.getExpiresAt(), loaded.getExpiresAt());
  }

  @Test
  public void testLookup_singleUse() throws Exception {
    IdentityClaimToken token = tokens.createIdentityClaimToken("ident_bob",
        "ident_admin", null, null);
    IdentityClaimToken twin = tokens.createIdentityClaimToken("ident_bob",
        "ident_admin", null, null);
    assertNotEquals(token.getId(), twin.getId());
    tokens.saveToken(token);
    tokens.saveToken(twin);

    IdentityClaimToken used = tokens.markTokenUsed(token, "ident_bob");
    assertNull(token.getUsedAt());
    assertEquals(NOW, used.getUsedAt());
    assertEquals("ident_bob", used.getUsedBy());
    tokens.saveToken(used);

    TokenLookupResult again = tokens.lookupToken(token.getId());
    assertFalse(again.isValid());
    assertEquals("Token has already been used", again.getError());
    assertSame(TokenStatus.USED, tokens.getTokenStatus(again.getToken()));

    TokenLookupResult other = tokens.lookupToken(twin.getId());
    assertTrue(other.isValid());
    assertNull(((IdentityClaimToken) other.getToken()).getUsedAt());
    assertEquals("ident_bob",
        ((IdentityClaimToken) other.getToken()).getIdentityId());
  }

  @Test
  public void testLookup_revokedReasonIsReported() throws Exception {
    ChannelAccessToken token = tokens.createChannelAccessToken("room-1",
        Arrays.asList("read", "write"), "ident_alice", null, null);
    tokens.saveToken(tokens.revokeToken(token, "shared by mistake"));

    TokenLookupResult result = tokens.lookupToken(token.getId());
    assertFalse(result.isValid());
    assertEquals("shared by mistake", result.getError());
    assertTrue(result.getToken().isRevoked());
    assertEquals(NOW, result.getToken().getRevokedAt());

    tokens.saveToken(tokens.revokeToken(token, null));
    assertEquals("Token has been revoked",
        tokens.lookupToken(token.getId()).getError());
  }

  @Test
  public void testLookup_expiry() throws Exception {
    ChannelAccessToken token = tokens.createChannelAccessToken("room-1",
        Arrays.asList("read"), "ident_alice", null, Duration.ofMinutes(5));
    tokens.saveToken(token);

    assertTrue(storeAt(kv, NOW.plusSeconds(300)).lookupToken(token.getId())
        .isValid());
    TokenLookupResult late =
        storeAt(kv, NOW.plusSeconds(301)).lookupToken(token.getId());
    assertEquals("Token has expired", late.getError());
    assertSame(TokenStatus.EXPIRED,
        storeAt(kv, NOW.plusSeconds(301)).getTokenStatus(token));
  }

  @Test
  public void testTokenStatus_revokedTakesPrecedence() {
    IdentityClaimToken token = tokens.createIdentityClaimToken("ident_bob",
        "ident_admin", null, Duration.ofSeconds(1));
    IdentityClaimToken both =
        tokens.revokeToken(tokens.markTokenUsed(token, "x"), null);

    StatefulTokenStore later = storeAt(kv, NOW.plusSeconds(10));
    assertSame(TokenStatus.REVOKED, later.getTokenStatus(both));
    assertEquals("Token has expired", later.getTokenInvalidReason(both));
  }

  @Test
  public void testLookup_badIdsAndRecords() throws Exception {
    assertEquals("Invalid token format",
        tokens.lookupToken("not-a-token").getError());
    assertEquals("Token not found", tokens.lookupToken(
        "tk_00000000000000000000000000000000").getError());

    String id = "tk_11111111111111111111111111111111";
    kv.put(StatefulTokenStore.getStorageKey(id), "{\"id\":\"" + id + "\"}");
    TokenLookupResult result = tokens.lookupToken(id);
    assertFalse(result.isValid());
    assertNull(result.getToken());
    assertEquals("Invalid token data", result.getError());
  }

  @Test
  public void testDeserializeToken_unknownAction() {
    assertNull(StatefulTokenStore.deserializeToken("{\"id\":\"tk_1\","
        + "\"action\":\"teleport\",\"createdAt\":\"2025-01-01T00:00:00Z\","
        + "\"expiresAt\":\"2025-01-02T00:00:00Z\"}"));
    assertNull(StatefulTokenStore.deserializeToken("[]"));
  }

  @Test
  public void testSaveToken_writesUnderTokenKey() throws Exception {
    final KeyValueStore mockStore = context.mock(KeyValueStore.class);
    StatefulTokenStore store = storeAt(mockStore, NOW);
    final IdentityClaimToken token = store.createIdentityClaimToken(
        "ident_bob", "ident_admin", null, null);

    context.checking(new Expectations() {
      {
        oneOf(mockStore).put(with(equal("__TOKEN:" + token.getId())),
            with(any(String.class)));
      }
    });
    store.saveToken(token);
  }

  @Test
  public void testLookupToken_storageFailurePropagates() throws Exception {
    final KeyValueStore mockStore = context.mock(KeyValueStore.class);
    final StorageException failure = new StorageException("backend down");
    context.checking(new Expectations() {
      {
        oneOf(mockStore).get(with(any(String.class)));
        will(throwException(failure));
      }
    });

    try {
      storeAt(mockStore, NOW).lookupToken(
          "tk_22222222222222222222222222222222");
      fail("StorageException was expected and not thrown");
    } catch (StorageException e) {
      assertSame(failure, e);
    }
  }

  @Test
  public void testSerializeToken_storedForm() {
    ChannelAccessToken token = tokens.createChannelAccessToken("room-7",
        Arrays.asList("read"), "ident_alice", null, Duration.ofHours(2));
    JsonObject json = JsonParser.parseString(
        StatefulTokenStore.serializeToken(token)).getAsJsonObject();

    assertEquals(token.getId(), json.get("id").getAsString());
    assertEquals("channel:access", json.get("action").getAsString());
    assertEquals("2025-04-01T00:00:00Z", json.get("createdAt").getAsString());
    assertEquals("2025-04-01T02:00:00Z", json.get("expiresAt").getAsString());
    assertFalse(json.has("usedAt"));
    assertFalse(json.has("revoked"));

    JsonObject payload = json.getAsJsonObject("payload");
    assertEquals("room-7", payload.get("channelId").getAsString());
    assertEquals("read",
        payload.getAsJsonArray("permissions").get(0).getAsString());
  }

  @Test
  public void testIsValidTokenId() {
    assertTrue(StatefulTokenStore.isValidTokenId(
        "tk_abcdefabcdefabcdefabcdefabcdefab"));
    assertFalse(StatefulTokenStore.isValidTokenId("tk_abc"));
    assertFalse(StatefulTokenStore.isValidTokenId(
        "xx_abcdefabcdefabcdefabcdefabcdefab"));
    assertFalse(StatefulTokenStore.isValidTokenId(null));
  }
}
