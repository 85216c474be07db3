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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Before;
import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

public class IdentityRegistryTest {

  private static final Instant NOW = Instant.parse("2025-06-01T08:30:00Z");

  private IdentityRegistry registry;

  @Before
  public void setUp() {
    registry = new IdentityRegistry(Clock.fixed(NOW, ZoneOffset.UTC),
        new Random(3));
  }

  @Test
  public void testCreateIdentity() {
    Identity id = registry.createIdentity(IdentityType.USER, "Alice");

    assertTrue(IdentityRegistry.isValidIdentityId(id.getId()));
    assertSame(IdentityType.USER, id.getType());
    assertEquals("Alice", id.getDisplayName());
    assertSame(IdentityStatus.ACTIVE, id.getStatus());
    assertTrue(id.isActive());
    assertEquals(NOW, id.getCreatedAt());
    assertNull(id.getCreatedBy());
    assertNull(id.getMetadata());
    assertNull(id.getAppConfig());
  }

  @Test
  public void testCreateIdentity_idsAreUnique() {
    Identity a = registry.createIdentity(IdentityType.SERVICE, "a");
    Identity b = registry.createIdentity(IdentityType.SERVICE, "b");
    assertFalse(a.getId().equals(b.getId()));
  }

  @Test
  public void testCreateIdentity_appNamespaceIsDerivedFromOrigin() {
    AppConfig config = new AppConfig("https://www.example-app.com",
        "caller-chosen", Arrays.asList("kv:read"), true);
    Identity app = registry.createIdentity(IdentityType.APP, "Example",
        "ident_admin", null, config);

    assertEquals("https://www.example-app.com",
        app.getAppConfig().getOrigin());
    assertEquals("www_example-app_com", app.getAppConfig().getNamespace());
    assertEquals(Arrays.asList("kv:read"),
        app.getAppConfig().getGrantedCapabilities());
    assertTrue(app.getAppConfig().hasFrameAccess());
    assertEquals("ident_admin", app.getCreatedBy());
  }

  @Test
  public void testCreateIdentity_appWithoutOrigin() {
    try {
      registry.createIdentity(IdentityType.APP, "Nowhere", null, null,
          new AppConfig("", Collections.<String> emptyList(), false));
      fail("IllegalArgumentException was expected and not thrown");
    } catch (IllegalArgumentException e) {
      assertEquals("origin is required for APP identity", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCreateIdentity_blankDisplayName() {
    registry.createIdentity(IdentityType.USER, "   ");
  }

  @Test
  public void testClaimableIdentity_lifecycle() {
    Identity pending = registry.createClaimableIdentity(IdentityType.AGENT,
        "Helper", "ident_owner", null);
    assertSame(IdentityStatus.PENDING_CLAIM, pending.getStatus());
    assertFalse(pending.isActive());

    Identity active = registry.activateIdentity(pending);
    assertSame(IdentityStatus.ACTIVE, active.getStatus());
    assertEquals(pending.getId(), active.getId());
    assertEquals(pending.getCreatedAt(), active.getCreatedAt());
    assertSame(IdentityStatus.PENDING_CLAIM, pending.getStatus());

    try {
      registry.activateIdentity(active);
      fail("IllegalStateException was expected and not thrown");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testClaimableIdentity_creatorRequired() {
    registry.createClaimableIdentity(IdentityType.AGENT, "Helper", null,
        null);
  }

  @Test
  public void testSuspendAndDelete() {
    Identity id = registry.createIdentity(IdentityType.USER, "Bob");
    Identity suspended = registry.suspendIdentity(id);
    assertSame(IdentityStatus.SUSPENDED, suspended.getStatus());

    Identity deleted = registry.deleteIdentity(suspended);
    assertSame(IdentityStatus.DELETED, deleted.getStatus());

    try {
      registry.suspendIdentity(deleted);
      fail("IllegalStateException was expected and not thrown");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains(id.getId()));
    }
  }

  @Test
  public void testUpdateIdentity_mergesMetadata() {
    Map<String, Object> initial = new LinkedHashMap<String, Object>();
    initial.put("team", "red");
    initial.put("level", 1);
    Identity id = registry.createIdentity(IdentityType.USER, "Carol", null,
        initial, null);

    Identity updated = registry.updateIdentity(id, new IdentityUpdate()
        .displayName("Caroline")
        .metadata("level", 2)
        .metadata("email", "carol@example.com"));

    assertEquals("Caroline", updated.getDisplayName());
    assertSame(IdentityStatus.ACTIVE, updated.getStatus());
    assertEquals("red", updated.getMetadata().get("team"));
    assertEquals(2, updated.getMetadata().get("level"));
    assertEquals("carol@example.com", updated.getMetadata().get("email"));
    assertEquals(1, id.getMetadata().get("level"));
  }

  @Test
  public void testUpdateIdentity_emptyDisplayNameIsIgnored() {
    Identity id = registry.createIdentity(IdentityType.USER, "Dave");
    Identity updated =
        registry.updateIdentity(id, new IdentityUpdate().displayName(""));
    assertEquals("Dave", updated.getDisplayName());
    assertNull(updated.getMetadata());
  }

  @Test
  public void testIsValidIdentityId() {
    assertTrue(IdentityRegistry.isValidIdentityId(
        "ident_00112233445566778899aabbccddeeff"));
    assertFalse(IdentityRegistry.isValidIdentityId(
        "ident_00112233445566778899aabbccddeefg"));
    assertFalse(IdentityRegistry.isValidIdentityId("ident_"));
  }
}
