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

package com.google.belay.authz;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.belay.authz.credential.CredentialStore;
import com.google.belay.authz.credential.CredentialType;
import com.google.belay.authz.credential.IssuedCredential;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public class GsonUtilTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  private IssuedCredential newCredential() {
    CredentialStore store =
        new CredentialStore(Clock.fixed(NOW, ZoneOffset.UTC));
    return store.createCredential("id_alice", CredentialType.API_KEY, null,
        null);
  }

  @Test
  public void testClientGson_hidesSecretHash() {
    IssuedCredential issued = newCredential();

    JsonObject full = GsonUtil.getGson()
        .toJsonTree(issued.getCredential()).getAsJsonObject();
    JsonObject client = GsonUtil.getClientGson()
        .toJsonTree(issued.getCredential()).getAsJsonObject();

    assertTrue(full.has("secretHash"));
    assertFalse(client.has("secretHash"));
    assertEquals("id_alice", client.get("identityId").getAsString());
    assertEquals("api_key", client.get("type").getAsString());
    assertEquals("active", client.get("status").getAsString());
    assertEquals("2025-01-01T00:00:00Z",
        client.get("createdAt").getAsString());
  }

  @Test
  public void testInstantAdapter() {
    assertEquals("\"2025-01-01T00:00:00Z\"", GsonUtil.getGson().toJson(NOW));
    assertEquals(NOW, GsonUtil.getGson().fromJson("\"2025-01-01T00:00:00Z\"",
        Instant.class));
  }

  @Test(expected = JsonParseException.class)
  public void testInstantAdapter_rejectsBadTimestamp() {
    GsonUtil.getGson().fromJson("\"yesterday\"", Instant.class);
  }

  @Test
  public void testHtmlIsNotEscaped() {
    assertEquals("\"a=b<c>\"", GsonUtil.getGson().toJson("a=b<c>"));
  }
}
