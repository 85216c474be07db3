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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.belay.authz.codec.ByteCodec;

import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.EnumSet;

public class UnifiedTokenCodecTest {

  private static final long NOW = 1735689600L;
  private static final String SECRET = "unified-secret";

  private UnifiedTokenCodec codec;

  @Before
  public void setUp() {
    codec = new UnifiedTokenCodec(clockAt(NOW));
  }

  private static Clock clockAt(long epochSeconds) {
    return Clock.fixed(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
  }

  @Test
  public void testBearerToken() {
    int perms = UnifiedPermission.toBitmap(UnifiedPermission.READ,
        UnifiedPermission.LIST);
    IssuedToken issued = codec.createToken(
        UnifiedTokenRequest.bearer("id_alice", perms, 3600), SECRET);
    assertEquals(NOW + 3600, issued.getExpiresAt());

    UnifiedToken token = codec.verifyToken(issued.getToken(), SECRET);
    assertTrue(token instanceof BearerToken);
    assertEquals(UnifiedTokenCodec.VERSION, token.getVersion());
    assertSame(UnifiedTokenType.BEARER, token.getType());
    assertEquals("id_alice", ((BearerToken) token).getIdentityId());
    assertEquals(EnumSet.of(UnifiedPermission.READ, UnifiedPermission.LIST),
        token.getPermissions());
    assertFalse(token.hasPermission(UnifiedPermission.WRITE));
    assertEquals(NOW, token.getIssuedAt());
    assertEquals(NOW + 3600, token.getExpiresAt());
  }

  @Test
  public void testResourceToken_withoutConstraints() {
    IssuedToken issued = codec.createToken(UnifiedTokenRequest.resource(
        "kv", "store-1", UnifiedPermission.READ.getBit(), 60), SECRET);

    ResourceAccessToken token =
        (ResourceAccessToken) codec.verifyToken(issued.getToken(), SECRET);
    assertSame(UnifiedTokenType.RESOURCE, token.getType());
    assertEquals("kv", token.getResourceType());
    assertEquals("store-1", token.getResourceId());
    assertEquals("", token.getAuthorId());
    assertNull(token.getConstraints());
  }

  @Test
  public void testShareToken_withConstraints() {
    TokenConstraints constraints = TokenConstraints.builder()
        .maxUses(5)
        .canDelegate(true)
        .maxDelegationDepth(2)
        .build();
    assertFalse(constraints.requiresStateCheck());

    IssuedToken issued = codec.createToken(UnifiedTokenRequest
        .share("blob", "photos/cat.png", "id_bob",
            UnifiedPermission.toBitmap(UnifiedPermission.READ,
                UnifiedPermission.SHARE), 600)
        .withConstraints(constraints), SECRET);

    ResourceAccessToken token =
        (ResourceAccessToken) codec.verifyToken(issued.getToken(), SECRET);
    assertSame(UnifiedTokenType.SHARE, token.getType());
    assertEquals("blob", token.getResourceType());
    assertEquals("photos/cat.png", token.getResourceId());
    assertEquals("id_bob", token.getAuthorId());
    assertTrue(token.hasPermission(UnifiedPermission.SHARE));

    TokenConstraints decoded = token.getConstraints();
    assertEquals(Integer.valueOf(5), decoded.getMaxUses());
    assertTrue(decoded.canDelegate());
    assertEquals(Integer.valueOf(2), decoded.getMaxDelegationDepth());
    assertTrue(decoded.requiresStateCheck());
  }

  @Test
  public void testInvitationToken() {
    IssuedToken issued = codec.createToken(UnifiedTokenRequest.invitation(
        "id_carol", Arrays.asList("kv:read", "blob:write"),
        UnifiedPermission.READ.getBit(), 86400), SECRET);

    InvitationToken token =
        (InvitationToken) codec.verifyToken(issued.getToken(), SECRET);
    assertEquals("id_carol", token.getIdentityId());
    assertEquals(Arrays.asList("kv:read", "blob:write"),
        token.getGrantedCapabilities());
  }

  @Test
  public void testVerifyToken_rejectsForgeryAndExpiry() throws Exception {
    String token = codec.createToken(UnifiedTokenRequest.bearer("id_dave",
        UnifiedPermission.READ.getBit(), 10), SECRET).getToken();

    assertNull(codec.verifyToken(token, "other-secret"));
    assertNotNull(new UnifiedTokenCodec(clockAt(NOW + 10))
        .verifyToken(token, SECRET));
    assertNull(new UnifiedTokenCodec(clockAt(NOW + 11))
        .verifyToken(token, SECRET));

    byte[] bytes = ByteCodec.base64UrlDecode(token);
    bytes[3] ^= UnifiedPermission.ADMIN.getBit();
    assertNull(codec.verifyToken(ByteCodec.base64UrlEncode(bytes), SECRET));
  }

  @Test
  public void testVerifyToken_everyFlippedBitIsRejected() throws Exception {
    int perms = UnifiedPermission.toBitmap(UnifiedPermission.READ,
        UnifiedPermission.WRITE);
    UnifiedTokenRequest[] requests = {
        UnifiedTokenRequest.bearer("id_gina", perms, 600),
        UnifiedTokenRequest.resource("kv", "store-1", perms, 600),
        UnifiedTokenRequest.share("blob", "b1", "id_gina", perms, 600),
        UnifiedTokenRequest.share("blob", "b1", "id_gina", perms, 600)
            .withConstraints(TokenConstraints.builder().maxUses(3).build()),
        UnifiedTokenRequest.share("blob", "b1", "id_gina", perms, 600)
            .withConstraints(TokenConstraints.builder().canDelegate(true)
                .build()),
        UnifiedTokenRequest.resource("channel", "room-2", perms, 600)
            .withConstraints(TokenConstraints.builder().maxUses(7)
                .canDelegate(true).maxDelegationDepth(4).build()),
        UnifiedTokenRequest.invitation("id_gina",
            Arrays.asList("kv:read", "blob:write"), perms, 600),
    };

    for (UnifiedTokenRequest request : requests) {
      String token = codec.createToken(request, SECRET).getToken();
      assertNotNull(codec.verifyToken(token, SECRET));

      byte[] original = ByteCodec.base64UrlDecode(token);
      for (int i = 0; i < original.length; i++) {
        for (int bit = 0; bit < 8; bit++) {
          byte[] tampered = original.clone();
          tampered[i] ^= (byte) (1 << bit);
          assertNull(String.format("%s byte %d bit %d of %d",
              request.getType(), i, bit, original.length),
              codec.verifyToken(ByteCodec.base64UrlEncode(tampered), SECRET));
        }
      }
    }
  }

  @Test
  public void testVerifyToken_shortOrGarbageInput() {
    assertNull(codec.verifyToken(null, SECRET));
    assertNull(codec.verifyToken("AAAA", SECRET));
    assertNull(codec.verifyToken("not base64 at all", SECRET));
  }

  @Test
  public void testParseToken() {
    String token = codec.createToken(UnifiedTokenRequest.resource(
        "channel", "room-9", UnifiedPermission.READ.getBit(), 60), SECRET)
        .getToken();

    ParsedUnifiedToken parsed = codec.parseToken(token);
    assertEquals(1, parsed.getVersion());
    assertSame(UnifiedTokenType.RESOURCE, parsed.getType());
    assertEquals("channel", parsed.getResourceType());
    assertEquals("room-9", parsed.getResourceId());

    String bearer = codec.createToken(UnifiedTokenRequest.bearer("id_erin",
        UnifiedPermission.READ.getBit(), 60), SECRET).getToken();
    ParsedUnifiedToken parsedBearer = codec.parseToken(bearer);
    assertSame(UnifiedTokenType.BEARER, parsedBearer.getType());
    assertNull(parsedBearer.getResourceId());
  }

  @Test
  public void testParseToken_unknownVersion() {
    byte[] bytes = { 0x09, 0x01, 0x00, 0x00 };
    assertNull(codec.parseToken(ByteCodec.base64UrlEncode(bytes)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRequest_constraintsOnBearerToken() {
    UnifiedTokenRequest.bearer("id_frank", 1, 60)
        .withConstraints(TokenConstraints.builder().maxUses(1).build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRequest_permissionsDoNotFit() {
    UnifiedTokenRequest.bearer("id_frank", 0x10000, 60);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testConstraints_maxUsesOutOfRange() {
    TokenConstraints.builder().maxUses(70000).build();
  }

  @Test
  public void testUnknownResourceTypeIsCarriedAsUnknown() {
    String token = codec.createToken(UnifiedTokenRequest.resource("queue",
        "q1", UnifiedPermission.READ.getBit(), 60), SECRET).getToken();
    assertEquals("unknown", ((ResourceAccessToken) codec.verifyToken(token,
        SECRET)).getResourceType());
  }
}
