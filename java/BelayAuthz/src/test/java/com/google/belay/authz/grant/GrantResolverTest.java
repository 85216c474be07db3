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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.google.belay.authz.credential.CredentialScope;
import com.google.belay.authz.token.InvitationToken;

import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;

public class GrantResolverTest {

  private static final Instant NOW = Instant.parse("2025-02-10T10:00:00Z");

  private GrantResolver resolver;

  @Before
  public void setUp() {
    resolver = resolverAt(NOW);
  }

  private static GrantResolver resolverAt(Instant now) {
    return new GrantResolver(Clock.fixed(now, ZoneOffset.UTC), new Random(11));
  }

  private CapabilityGrant grant(String capability, GrantScope scope) {
    return resolver.createGrant("ident_alice", capability, "ident_admin",
        null, null, scope, null);
  }

  @Test
  public void testCreateGrant() {
    CapabilityGrant g = resolver.createGrant("ident_alice", "kv:read",
        "ident_admin");

    assertTrue(g.getGrantId().startsWith(GrantResolver.ID_PREFIX));
    assertEquals("ident_alice", g.getIdentityId());
    assertEquals("kv:read", g.getCapability());
    assertEquals("ident_admin", g.getGrantedBy());
    assertEquals(NOW, g.getGrantedAt());
    assertSame(GrantSource.DIRECT, g.getSource());
    assertNull(g.getScope());
    assertFalse(g.isRevoked());
    assertTrue(resolver.isGrantValid(g));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCreateGrant_capabilityRequired() {
    resolver.createGrant("ident_alice", "", "ident_admin");
  }

  @Test
  public void testRevokeGrant_isIdempotent() {
    CapabilityGrant g = grant("kv:write", null);
    CapabilityGrant revoked = resolver.revokeGrant(g, "ident_admin", "abuse");

    assertTrue(revoked.isRevoked());
    assertEquals(NOW, revoked.getRevokedAt());
    assertEquals("ident_admin", revoked.getRevokedBy());
    assertEquals("abuse", revoked.getRevocationReason());
    assertFalse(resolver.isGrantValid(revoked));
    assertFalse(g.isRevoked());

    assertSame(revoked, resolverAt(NOW.plusSeconds(60)).revokeGrant(revoked,
        "someone-else", "again"));
  }

  @Test
  public void testIsGrantValid_expiry() {
    CapabilityGrant g = resolver.createGrant("ident_alice", "kv:read",
        "ident_admin", GrantSource.SYSTEM, null, null, NOW.plusSeconds(30));

    assertTrue(resolverAt(NOW.plusSeconds(30)).isGrantValid(g));
    assertFalse(resolverAt(NOW.plusSeconds(31)).isGrantValid(g));
  }

  @Test
  public void testResolve_unionOfValidGrants() {
    CapabilityGrant read = grant("kv:read", null);
    CapabilityGrant write = grant("kv:write", null);
    CapabilityGrant revoked = resolver.revokeGrant(grant("kv:admin", null),
        "ident_admin", null);

    EffectivePermissions perms = resolver.resolveEffectivePermissions(
        Arrays.asList(read, write, revoked));

    assertEquals(new LinkedHashSet<String>(Arrays.asList("kv:read",
        "kv:write")), perms.getCapabilities());
    assertTrue(perms.hasCapability("kv:read"));
    assertFalse(perms.hasCapability("kv:admin"));
    assertTrue(perms.canAccessNamespace("anything"));
    assertTrue(perms.canAccessResource("blob", "b1"));
    assertTrue(perms.canAccessKey("any/key"));
  }

  @Test
  public void testResolve_credentialScopeAndClaimsIntersect() {
    List<CapabilityGrant> grants = Arrays.asList(grant("kv:read", null),
        grant("kv:write", null), grant("blob:read", null));

    EffectivePermissions scoped = resolver.resolveEffectivePermissions(
        grants, CredentialScope.ofCapabilities("kv:read", "kv:write",
            "channel:post"), TokenClaims.of("kv:write", "blob:read"));

    assertEquals(Collections.singleton("kv:write"),
        scoped.getCapabilities());
  }

  @Test
  public void testResolve_restrictionWithoutCapabilitiesDoesNotLimit() {
    List<CapabilityGrant> grants = Arrays.asList(grant("kv:read", null));
    EffectivePermissions perms = resolver.resolveEffectivePermissions(grants,
        new CredentialScope(null, Arrays.asList("ns1"), null, null),
        new TokenClaims(null));
    assertTrue(perms.hasCapability("kv:read"));
  }

  @Test
  public void testResolve_addingRestrictionsNeverAddsCapabilities() {
    List<CapabilityGrant> grants = Arrays.asList(grant("kv:read", null),
        grant("kv:write", null));
    EffectivePermissions base = resolver.resolveEffectivePermissions(grants);

    EffectivePermissions narrowed = resolver.resolveEffectivePermissions(
        grants, CredentialScope.ofCapabilities("kv:read", "kv:admin"), null);
    assertTrue(base.getCapabilities().containsAll(
        narrowed.getCapabilities()));
    assertFalse(narrowed.hasCapability("kv:admin"));

    EffectivePermissions narrower = resolver.resolveEffectivePermissions(
        grants, CredentialScope.ofCapabilities("kv:read", "kv:admin"),
        TokenClaims.of("kv:write"));
    assertTrue(narrower.getCapabilities().isEmpty());
  }

  @Test
  public void testResolve_namespacesPerCapability() {
    List<CapabilityGrant> grants = Arrays.asList(
        grant("kv:read", GrantScope.ofNamespaces("ns-a", "ns-b")),
        grant("kv:write", GrantScope.ofNamespaces("ns-a")));

    EffectivePermissions perms = resolver.resolveEffectivePermissions(grants);
    assertEquals(Arrays.asList("ns-a", "ns-b"), perms.getNamespaces());
    assertTrue(perms.canAccessNamespace("ns-b"));
    assertFalse(perms.canAccessNamespace("ns-c"));
    assertTrue(perms.canAccessNamespace("kv:read", "ns-b"));
    assertFalse(perms.canAccessNamespace("kv:write", "ns-b"));
    assertFalse(perms.canAccessNamespace("kv:admin", "ns-a"));
  }

  @Test
  public void testResolve_unscopedGrantLiftsNamespaceLimit() {
    List<CapabilityGrant> grants = Arrays.asList(
        grant("kv:read", GrantScope.ofNamespaces("ns-a")),
        grant("kv:read", null));

    EffectivePermissions perms = resolver.resolveEffectivePermissions(grants);
    assertTrue(perms.canAccessNamespace("kv:read", "ns-z"));
    assertTrue(perms.canAccessNamespace("ns-z"));
  }

  @Test
  public void testResolve_limitsOfDroppedCapabilitiesAreIgnored() {
    List<CapabilityGrant> grants = Arrays.asList(
        grant("kv:read", GrantScope.ofNamespaces("ns-a")),
        grant("kv:admin", GrantScope.ofNamespaces("ns-secret")));

    EffectivePermissions perms = resolver.resolveEffectivePermissions(grants,
        CredentialScope.ofCapabilities("kv:read"), null);
    assertEquals(Arrays.asList("ns-a"), perms.getNamespaces());
    assertFalse(perms.canAccessNamespace("ns-secret"));
  }

  @Test
  public void testResolve_resourcesAndKeyPatterns() {
    GrantScope scope = new GrantScope(null,
        Arrays.asList(new ResourceRef("blob", "b1")),
        Arrays.asList("users/alice/*", "shared"));
    EffectivePermissions perms = resolver.resolveEffectivePermissions(
        Arrays.asList(grant("blob:read", scope)));

    assertTrue(perms.canAccessResource("blob", "b1"));
    assertFalse(perms.canAccessResource("blob", "b2"));
    assertFalse(perms.canAccessResource("kv", "b1"));

    assertTrue(perms.canAccessKey("users/alice/photo"));
    assertTrue(perms.canAccessKey("shared"));
    assertFalse(perms.canAccessKey("shared/extra"));
    assertFalse(perms.canAccessKey("users/bob/photo"));
    assertFalse(perms.canAccessKey(""));
  }

  @Test
  public void testResolve_narrowingNeverLiftsResourceOrKeyLimits() {
    GrantScope scope = new GrantScope(null,
        Arrays.asList(new ResourceRef("blob", "b1")),
        Arrays.asList("users/alice/*"));
    List<CapabilityGrant> grants = Arrays.asList(grant("blob:read", scope),
        grant("blob:write", null));

    EffectivePermissions base = resolver.resolveEffectivePermissions(grants);
    assertFalse(base.canAccessResource("blob", "b2"));
    assertFalse(base.canAccessKey("users/bob/photo"));

    EffectivePermissions scoped = resolver.resolveEffectivePermissions(
        grants, CredentialScope.ofCapabilities("blob:write"), null);
    assertEquals(Collections.singleton("blob:write"),
        scoped.getCapabilities());
    assertTrue(scoped.canAccessResource("blob", "b1"));
    assertFalse(scoped.canAccessResource("blob", "b2"));
    assertFalse(scoped.canAccessKey("users/bob/photo"));

    EffectivePermissions claimed = resolver.resolveEffectivePermissions(
        grants, null, TokenClaims.of("blob:write"));
    assertFalse(claimed.canAccessResource("blob", "b2"));
    assertFalse(claimed.canAccessKey("users/bob/photo"));

    EffectivePermissions none = resolver.resolveEffectivePermissions(grants,
        CredentialScope.ofCapabilities("kv:read"), null);
    assertTrue(none.getCapabilities().isEmpty());
    assertFalse(none.canAccessResource("blob", "b2"));
    assertFalse(none.canAccessKey("users/bob/photo"));
  }

  @Test
  public void testResolve_wildcardKeyPattern() {
    GrantScope scope = new GrantScope(null, null, Arrays.asList("*"));
    EffectivePermissions perms = resolver.resolveEffectivePermissions(
        Arrays.asList(grant("kv:read", scope)));
    assertTrue(perms.canAccessKey("whatever"));
  }

  @Test
  public void testTokenClaims_fromInvitation() {
    InvitationToken invitation = new InvitationToken(1, 1, 0L, 10L,
        "ident_bob", Arrays.asList("kv:read"));
    List<CapabilityGrant> grants = Arrays.asList(grant("kv:read", null),
        grant("kv:write", null));

    EffectivePermissions perms = resolver.resolveEffectivePermissions(grants,
        null, TokenClaims.fromInvitation(invitation));
    assertEquals(Collections.singleton("kv:read"), perms.getCapabilities());
  }

  @Test
  public void testResourceRef_equality() {
    assertEquals(new ResourceRef("blob", "x"), new ResourceRef("blob", "x"));
    assertEquals(new ResourceRef("blob", "x").hashCode(),
        new ResourceRef("blob", "x").hashCode());
    assertFalse(new ResourceRef("blob", "x").equals(
        new ResourceRef("kv", "x")));
  }
}
