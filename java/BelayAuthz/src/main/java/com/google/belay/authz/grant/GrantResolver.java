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

import com.google.belay.authz.codec.ByteCodec;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Creates and revokes capability grants and works out what a set of grants
 * allows.
 */
public class GrantResolver {

  public static final String ID_PREFIX = "grant_";

  private static final int ID_BYTES = 16;

  private final Clock clock;
  private final Random random;

  public GrantResolver(Clock clock) {
    this(clock, new SecureRandom());
  }

  public GrantResolver(Clock clock, Random random) {
    if (clock == null || random == null) {
      throw new IllegalArgumentException("clock and random are required");
    }
    this.clock = clock;
    this.random = random;
  }

  /**
   * @param source
   *          defaults to {@link GrantSource#DIRECT} when {@code null}
   * @param sourceId
   *          the invitation or parent grant behind this grant; may be
   *          {@code null}
   * @param scope
   *          may be {@code null} for an unrestricted grant
   * @param expiresAt
   *          may be {@code null} for a grant that does not expire
   */
  public CapabilityGrant createGrant(String identityId, String capability,
      String grantedBy, GrantSource source, String sourceId, GrantScope scope,
      Instant expiresAt) {
    required(identityId, "identityId");
    required(capability, "capability");
    required(grantedBy, "grantedBy");
    return new CapabilityGrant(generateId(), identityId, capability,
        clock.instant(), grantedBy, source == null ? GrantSource.DIRECT
            : source, sourceId, scope, expiresAt, null, null, null);
  }

  public CapabilityGrant createGrant(String identityId, String capability,
      String grantedBy) {
    return createGrant(identityId, capability, grantedBy, null, null, null,
        null);
  }

  /**
   * Revoking an already revoked grant returns it unchanged.
   */
  public CapabilityGrant revokeGrant(CapabilityGrant grant, String revokedBy,
      String reason) {
    if (grant.isRevoked()) {
      return grant;
    }
    return grant.withRevocation(clock.instant(), revokedBy, reason);
  }

  public boolean isGrantValid(CapabilityGrant grant) {
    if (grant.isRevoked()) {
      return false;
    }
    return grant.getExpiresAt() == null
        || !clock.instant().isAfter(grant.getExpiresAt());
  }

  /**
   * Combines the valid grants of an identity into effective permissions.
   * The capabilities are the union over the valid grants, intersected with
   * the credential scope and then with the token claims where those name
   * capabilities. Namespace limits are taken from the grants behind
   * capabilities that survive the intersection. Resource and key limits are
   * collected from every valid grant, so narrowing the capabilities never
   * lifts them.
   *
   * @param credentialScope
   *          may be {@code null}
   * @param tokenClaims
   *          may be {@code null}
   */
  public EffectivePermissions resolveEffectivePermissions(
      Collection<CapabilityGrant> grants,
      CapabilityRestriction credentialScope,
      CapabilityRestriction tokenClaims) {
    List<CapabilityGrant> valid = new ArrayList<CapabilityGrant>();
    Set<String> capabilities = new LinkedHashSet<String>();
    for (CapabilityGrant grant : grants) {
      if (isGrantValid(grant)) {
        valid.add(grant);
        capabilities.add(grant.getCapability());
      }
    }
    restrict(capabilities, credentialScope);
    restrict(capabilities, tokenClaims);

    Map<String, Set<String>> namespacesByCapability =
        new LinkedHashMap<String, Set<String>>();
    Set<String> unrestricted = new HashSet<String>();
    List<ResourceRef> resources = new ArrayList<ResourceRef>();
    List<String> keyPatterns = new ArrayList<String>();

    for (CapabilityGrant grant : valid) {
      GrantScope scope = grant.getScope();
      if (scope != null && scope.getResources() != null) {
        for (ResourceRef r : scope.getResources()) {
          if (!resources.contains(r)) {
            resources.add(r);
          }
        }
      }
      if (scope != null && scope.getKeyPatterns() != null) {
        for (String p : scope.getKeyPatterns()) {
          if (!keyPatterns.contains(p)) {
            keyPatterns.add(p);
          }
        }
      }

      String cap = grant.getCapability();
      if (!capabilities.contains(cap)) {
        continue;
      }
      if (scope == null || scope.getNamespaces() == null) {
        unrestricted.add(cap);
      } else {
        Set<String> ns = namespacesByCapability.get(cap);
        if (ns == null) {
          ns = new LinkedHashSet<String>();
          namespacesByCapability.put(cap, ns);
        }
        ns.addAll(scope.getNamespaces());
      }
    }

    return new EffectivePermissions(capabilities, namespacesByCapability,
        unrestricted, resources, keyPatterns);
  }

  public EffectivePermissions resolveEffectivePermissions(
      Collection<CapabilityGrant> grants) {
    return resolveEffectivePermissions(grants, null, null);
  }

  private static void restrict(Set<String> capabilities,
      CapabilityRestriction restriction) {
    if (restriction != null && restriction.getCapabilities() != null) {
      capabilities.retainAll(new HashSet<String>(
          restriction.getCapabilities()));
    }
  }

  private static void required(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private String generateId() {
    byte[] bytes = new byte[ID_BYTES];
    random.nextBytes(bytes);
    return ID_PREFIX + ByteCodec.toHex(bytes);
  }
}
