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

import com.google.belay.authz.codec.ByteCodec;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Creates identities and moves them through their lifecycle:
 *
 * <pre>
 * createIdentity           -&gt; ACTIVE
 * createClaimableIdentity  -&gt; PENDING_CLAIM -&gt; (activateIdentity) ACTIVE
 * ACTIVE &lt;-&gt; SUSPENDED, any -&gt; DELETED
 * </pre>
 *
 * Identities are values; every operation returns a new instance. Storing
 * them is up to the caller.
 */
public class IdentityRegistry {

  public static final String ID_PREFIX = "ident_";

  private static final int ID_BYTES = 16;

  private final Clock clock;
  private final Random random;

  public IdentityRegistry(Clock clock) {
    this(clock, new SecureRandom());
  }

  public IdentityRegistry(Clock clock, Random random) {
    if (clock == null || random == null) {
      throw new IllegalArgumentException("clock and random are required");
    }
    this.clock = clock;
    this.random = random;
  }

  /**
   * Creates an active identity. For app identities the namespace is derived
   * from {@code appConfig.origin}.
   *
   * @param createdBy
   *          may be {@code null}
   * @param metadata
   *          may be {@code null}
   * @param appConfig
   *          required for {@link IdentityType#APP}, otherwise optional
   * @throws IllegalArgumentException
   *           if the type or display name is missing, or an app identity has
   *           no origin
   */
  public Identity createIdentity(IdentityType type, String displayName,
      String createdBy, Map<String, Object> metadata, AppConfig appConfig) {
    checkTypeAndName(type, displayName);
    if (type == IdentityType.APP && (appConfig == null
        || appConfig.getOrigin() == null || appConfig.getOrigin().isEmpty())) {
      throw new IllegalArgumentException(
          "origin is required for APP identity");
    }

    AppConfig config = appConfig == null ? null
        : appConfig.withNamespace(Namespaces.fromOrigin(appConfig.getOrigin()));
    return new Identity(generateId(), type, displayName,
        IdentityStatus.ACTIVE, clock.instant(), createdBy, metadata, config);
  }

  public Identity createIdentity(IdentityType type, String displayName) {
    return createIdentity(type, displayName, null, null, null);
  }

  /**
   * Creates an identity with no credentials, to be claimed later by whoever
   * receives the matching identity claim token.
   *
   * @throws IllegalArgumentException
   *           if the type, display name or creator is missing
   */
  public Identity createClaimableIdentity(IdentityType type,
      String displayName, String createdBy, Map<String, Object> metadata) {
    checkTypeAndName(type, displayName);
    if (createdBy == null || createdBy.isEmpty()) {
      throw new IllegalArgumentException(
          "createdBy is required for claimable identities");
    }
    return new Identity(generateId(), type, displayName,
        IdentityStatus.PENDING_CLAIM, clock.instant(), createdBy, metadata,
        null);
  }

  /**
   * @throws IllegalStateException
   *           if the identity is not waiting to be claimed
   */
  public Identity activateIdentity(Identity identity) {
    if (identity.getStatus() != IdentityStatus.PENDING_CLAIM) {
      throw new IllegalStateException(String.format(
          "only PENDING_CLAIM identities can be activated, %s is %s",
          identity.getId(), identity.getStatus()));
    }
    return updateIdentity(identity,
        new IdentityUpdate().status(IdentityStatus.ACTIVE));
  }

  /**
   * @throws IllegalStateException
   *           if the identity has been deleted
   */
  public Identity suspendIdentity(Identity identity) {
    if (identity.getStatus() == IdentityStatus.DELETED) {
      throw new IllegalStateException(String.format(
          "identity %s has been deleted", identity.getId()));
    }
    return updateIdentity(identity,
        new IdentityUpdate().status(IdentityStatus.SUSPENDED));
  }

  public Identity deleteIdentity(Identity identity) {
    return updateIdentity(identity,
        new IdentityUpdate().status(IdentityStatus.DELETED));
  }

  /**
   * Applies the fields set in {@code update}. An empty display name counts as
   * unset.
   */
  public Identity updateIdentity(Identity identity, IdentityUpdate update) {
    String displayName = identity.getDisplayName();
    if (update.getDisplayName() != null
        && !update.getDisplayName().isEmpty()) {
      displayName = update.getDisplayName();
    }
    IdentityStatus status = update.getStatus() != null ? update.getStatus()
        : identity.getStatus();

    Map<String, Object> metadata = identity.getMetadata();
    if (update.getMetadata() != null) {
      Map<String, Object> merged = new LinkedHashMap<String, Object>();
      if (metadata != null) {
        merged.putAll(metadata);
      }
      merged.putAll(update.getMetadata());
      metadata = merged;
    }

    return new Identity(identity.getId(), identity.getType(), displayName,
        status, identity.getCreatedAt(), identity.getCreatedBy(), metadata,
        identity.getAppConfig());
  }

  public static boolean isValidIdentityId(String id) {
    return id != null && id.startsWith(ID_PREFIX)
        && id.length() == ID_PREFIX.length() + ID_BYTES * 2
        && ByteCodec.isHex(id.substring(ID_PREFIX.length()));
  }

  private static void checkTypeAndName(IdentityType type,
      String displayName) {
    if (type == null) {
      throw new IllegalArgumentException("type is required");
    }
    if (displayName == null || displayName.trim().isEmpty()) {
      throw new IllegalArgumentException("displayName is required");
    }
  }

  private String generateId() {
    byte[] bytes = new byte[ID_BYTES];
    random.nextBytes(bytes);
    return ID_PREFIX + ByteCodec.toHex(bytes);
  }
}
