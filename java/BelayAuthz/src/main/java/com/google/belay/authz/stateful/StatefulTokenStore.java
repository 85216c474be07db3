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

import com.google.belay.authz.GsonUtil;
import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.kv.KeyValueStore;
import com.google.belay.authz.kv.StorageException;
import com.google.gson.JsonParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Creates, checks and persists {@link StatefulToken} records. The creation
 * and state methods are pure and return new values; only
 * {@link #saveToken} and {@link #lookupToken} touch the
 * {@link KeyValueStore}.
 *
 * <p>
 * Single use is only guaranteed if the caller saves the result of
 * {@link #markTokenUsed} with a compare-and-set in its storage layer; two
 * concurrent lookups may otherwise both see an unused token.
 */
public class StatefulTokenStore {

  private static final Logger log =
      LoggerFactory.getLogger(StatefulTokenStore.class);

  public static final String TOKEN_PREFIX = "tk_";
  public static final String KEY_PREFIX = "__TOKEN:";
  public static final Duration DEFAULT_EXPIRY = Duration.ofDays(7);

  static final String EXPIRED = "Token has expired";
  static final String REVOKED = "Token has been revoked";
  static final String USED = "Token has already been used";
  static final String INVALID_FORMAT = "Invalid token format";
  static final String NOT_FOUND = "Token not found";
  static final String INVALID_DATA = "Invalid token data";

  private static final int ID_BYTES = 16;

  private final KeyValueStore store;
  private final Clock clock;
  private final Duration defaultExpiry;
  private final Random random;

  public StatefulTokenStore(KeyValueStore store, Clock clock) {
    this(store, clock, DEFAULT_EXPIRY);
  }

  public StatefulTokenStore(KeyValueStore store, Clock clock,
      Duration defaultExpiry) {
    this(store, clock, defaultExpiry, new SecureRandom());
  }

  public StatefulTokenStore(KeyValueStore store, Clock clock,
      Duration defaultExpiry, Random random) {
    if (store == null || clock == null || random == null) {
      throw new IllegalArgumentException(
          "store, clock and random are all required");
    }
    if (defaultExpiry == null || defaultExpiry.isNegative()) {
      throw new IllegalArgumentException(
          "default expiry must be zero or positive");
    }
    this.store = store;
    this.clock = clock;
    this.defaultExpiry = defaultExpiry;
    this.random = random;
  }

  public Duration getDefaultExpiry() {
    return defaultExpiry;
  }

  public static boolean isValidTokenId(String tokenId) {
    return tokenId != null && tokenId.startsWith(TOKEN_PREFIX)
        && tokenId.length() == TOKEN_PREFIX.length() + ID_BYTES * 2
        && ByteCodec.isHex(tokenId.substring(TOKEN_PREFIX.length()));
  }

  public static String getStorageKey(String tokenId) {
    return KEY_PREFIX + tokenId;
  }

  /**
   * @param expiresIn
   *          how long the token is valid for, or {@code null} for the default
   */
  public IdentityClaimToken createIdentityClaimToken(String identityId,
      String createdBy, String label, Duration expiresIn) {
    required(identityId, "identityId");
    required(createdBy, "createdBy");
    Instant now = clock.instant();
    return new IdentityClaimToken(generateTokenId(), now,
        expiry(now, expiresIn), createdBy, label, identityId);
  }

  public BlobAccessToken createBlobAccessToken(String namespace,
      String blobKey, List<String> permissions, String createdBy,
      String label, Duration expiresIn) {
    required(namespace, "namespace");
    required(blobKey, "blobKey");
    required(createdBy, "createdBy");
    requiredPermissions(permissions);
    Instant now = clock.instant();
    return new BlobAccessToken(generateTokenId(), now, expiry(now, expiresIn),
        createdBy, label, namespace, blobKey, permissions);
  }

  public ChannelAccessToken createChannelAccessToken(String channelId,
      List<String> permissions, String createdBy, String label,
      Duration expiresIn) {
    required(channelId, "channelId");
    required(createdBy, "createdBy");
    requiredPermissions(permissions);
    Instant now = clock.instant();
    return new ChannelAccessToken(generateTokenId(), now,
        expiry(now, expiresIn), createdBy, label, channelId, permissions);
  }

  public boolean isTokenExpired(StatefulToken token) {
    return token.getExpiresAt().isBefore(clock.instant());
  }

  public boolean isTokenRevoked(StatefulToken token) {
    return token.isRevoked();
  }

  public boolean isTokenUsed(StatefulToken token) {
    return token.getUsedAt() != null;
  }

  public boolean isTokenValid(StatefulToken token) {
    return getTokenInvalidReason(token) == null;
  }

  /**
   * @return why the token cannot be used, or {@code null} if it can
   */
  public String getTokenInvalidReason(StatefulToken token) {
    if (isTokenExpired(token)) {
      return EXPIRED;
    }
    if (isTokenRevoked(token)) {
      String reason = token.getRevokedReason();
      return reason == null || reason.isEmpty() ? REVOKED : reason;
    }
    if (isTokenUsed(token)) {
      return USED;
    }
    return null;
  }

  public TokenStatus getTokenStatus(StatefulToken token) {
    if (isTokenRevoked(token)) {
      return TokenStatus.REVOKED;
    }
    if (isTokenUsed(token)) {
      return TokenStatus.USED;
    }
    if (isTokenExpired(token)) {
      return TokenStatus.EXPIRED;
    }
    return TokenStatus.VALID;
  }

  /**
   * @return a copy of {@code token} recording its use now by {@code usedBy}
   */
  @SuppressWarnings("unchecked")
  public <T extends StatefulToken> T markTokenUsed(T token, String usedBy) {
    T used = (T) token.copy();
    used.markUsed(clock.instant(), usedBy);
    return used;
  }

  /**
   * @param reason
   *          shown to whoever presents the token later; may be {@code null}
   * @return a revoked copy of {@code token}
   */
  @SuppressWarnings("unchecked")
  public <T extends StatefulToken> T revokeToken(T token, String reason) {
    T revoked = (T) token.copy();
    revoked.markRevoked(clock.instant(), reason);
    log.info("revoked {} token {}", token.getAction().getWireName(),
        token.getId());
    return revoked;
  }

  public void saveToken(StatefulToken token) throws StorageException {
    store.put(getStorageKey(token.getId()), serializeToken(token));
  }

  /**
   * Loads a token by id and checks that it can still be used.
   */
  public TokenLookupResult lookupToken(String tokenId)
      throws StorageException {
    if (!isValidTokenId(tokenId)) {
      return TokenLookupResult.error(INVALID_FORMAT);
    }
    String json = store.get(getStorageKey(tokenId));
    if (json == null) {
      return TokenLookupResult.error(NOT_FOUND);
    }
    StatefulToken token = deserializeToken(json);
    if (token == null) {
      return TokenLookupResult.error(INVALID_DATA);
    }
    String reason = getTokenInvalidReason(token);
    if (reason != null) {
      return TokenLookupResult.invalid(token, reason);
    }
    return TokenLookupResult.valid(token);
  }

  public static String serializeToken(StatefulToken token) {
    return GsonUtil.getGson().toJson(token, StatefulToken.class);
  }

  /**
   * @return the token, or {@code null} if the JSON is malformed or lacks
   *         the id, action, creation or expiry time
   */
  public static StatefulToken deserializeToken(String json) {
    try {
      return GsonUtil.getGson().fromJson(json, StatefulToken.class);
    } catch (JsonParseException e) {
      log.debug("unreadable token record: {}", e.getMessage());
      return null;
    }
  }

  private String generateTokenId() {
    byte[] bytes = new byte[ID_BYTES];
    random.nextBytes(bytes);
    return TOKEN_PREFIX + ByteCodec.toHex(bytes);
  }

  private Instant expiry(Instant now, Duration expiresIn) {
    Duration d = expiresIn == null ? defaultExpiry : expiresIn;
    if (d.isNegative()) {
      throw new IllegalArgumentException("expiry must not be negative");
    }
    return now.plus(d);
  }

  private static void required(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static void requiredPermissions(List<String> permissions) {
    if (permissions == null || permissions.isEmpty()) {
      throw new IllegalArgumentException(
          "at least one permission is required");
    }
  }
}
