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

import static com.google.belay.authz.token.TokenRejectedException.Reason.EXPIRED;
import static com.google.belay.authz.token.TokenRejectedException.Reason.MALFORMED;
import static com.google.belay.authz.token.TokenRejectedException.Reason.SIGNATURE_MISMATCH;
import static com.google.belay.authz.token.TokenRejectedException.Reason.UNSUPPORTED_FORMAT;

import com.google.belay.authz.GsonUtil;
import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.ByteReader;
import com.google.belay.authz.codec.ByteWriter;
import com.google.belay.authz.codec.DecodeException;
import com.google.belay.authz.codec.HmacSigner;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Encodes and verifies the unified token envelope, the single format meant to
 * replace the per-resource channel and log tokens:
 *
 * <pre>
 * version(1) type(1) fields... signature(12)
 * </pre>
 *
 * Times are uint32 seconds since 2024-01-01T00:00:00Z and permissions a
 * uint16 bitmap of {@link UnifiedPermission} bits. The fields depend on the
 * type:
 *
 * <pre>
 * BEARER          perm(2) issued(4) expires(4) idLen(1) identityId
 * RESOURCE, SHARE resType(1) idLen(1) resourceId perm(2) issued(4)
 *                 expires(4) authorLen(1) authorId flags(1) values
 * INVITATION      perm(2) issued(4) expires(4) idLen(1) identityId
 *                 capLen(2) JSON array of capabilities
 * </pre>
 */
public class UnifiedTokenCodec {

  private static final Logger log =
      LoggerFactory.getLogger(UnifiedTokenCodec.class);

  public static final int VERSION = 0x01;
  public static final int SIGNATURE_LENGTH = 12;

  static final int HAS_MAX_USES = 0x01;
  static final int CAN_DELEGATE = 0x02;
  static final int HAS_MAX_DEPTH = 0x04;

  /** The shortest possible payload, a bearer token with an empty id. */
  private static final int MIN_PAYLOAD_LENGTH = 10;

  private static final Type CAPABILITY_LIST =
      new TypeToken<List<String>>() {
      }.getType();

  private final Clock clock;

  public UnifiedTokenCodec(Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
    this.clock = clock;
  }

  /**
   * @throws IllegalArgumentException
   *           if a string is too long for its length prefix, or the issue or
   *           expiry time cannot be expressed relative to the token epoch
   */
  public IssuedToken createToken(UnifiedTokenRequest request, String secret) {
    long issuedAt = nowSeconds();
    long expiresAt = issuedAt + request.getExpiresInSeconds();

    ByteWriter w = new ByteWriter();
    w.writeUint8(VERSION).writeUint8(request.getType().getCode());
    switch (request.getType()) {
      case BEARER:
        writeTimes(w.writeUint16(request.getPermissions()), issuedAt,
            expiresAt);
        w.writeShortString(request.getIdentityId());
        break;
      case RESOURCE:
      case SHARE:
        w.writeUint8(
            UnifiedResourceType.fromName(request.getResourceType()).getCode());
        w.writeShortString(request.getResourceId());
        writeTimes(w.writeUint16(request.getPermissions()), issuedAt,
            expiresAt);
        w.writeShortString(request.getAuthorId());
        writeConstraints(w, request.getConstraints());
        break;
      case INVITATION:
        writeTimes(w.writeUint16(request.getPermissions()), issuedAt,
            expiresAt);
        w.writeShortString(request.getIdentityId());
        w.writeLongString(GsonUtil.getGson().toJson(
            request.getGrantedCapabilities(), CAPABILITY_LIST));
        break;
      default:
        throw new IllegalArgumentException(
            "unknown token type " + request.getType());
    }

    byte[] payload = w.toByteArray();
    byte[] sig = HmacSigner.signTruncated(payload, secret, SIGNATURE_LENGTH);
    byte[] token = Arrays.copyOf(payload, payload.length + sig.length);
    System.arraycopy(sig, 0, token, payload.length, sig.length);
    return new IssuedToken(ByteCodec.base64UrlEncode(token), expiresAt);
  }

  /**
   * @return the verified token, or {@code null} if it is malformed, of an
   *         unknown version or type, forged or expired
   */
  public UnifiedToken verifyToken(String token, String secret) {
    if (token == null || token.isEmpty()) {
      return null;
    }
    try {
      byte[] bytes = decodeBase64(token);
      if (bytes.length < MIN_PAYLOAD_LENGTH + SIGNATURE_LENGTH) {
        throw new TokenRejectedException(MALFORMED, String.format(
            "unified token of %d bytes is too short", bytes.length));
      }

      int payloadLength = bytes.length - SIGNATURE_LENGTH;
      byte[] payload = Arrays.copyOf(bytes, payloadLength);
      byte[] sig = Arrays.copyOfRange(bytes, payloadLength, bytes.length);
      if (!HmacSigner.verifyTruncated(payload, sig, secret)) {
        throw new TokenRejectedException(SIGNATURE_MISMATCH,
            "unified token signature mismatch");
      }

      UnifiedToken verified = decodePayload(payload);
      if (verified.getExpiresAt() < nowSeconds()) {
        throw new TokenRejectedException(EXPIRED, String.format(
            "%s token expired at %d", verified.getType(),
            verified.getExpiresAt()));
      }
      return verified;
    } catch (TokenRejectedException e) {
      log.debug("rejected unified token ({}): {}", e.getReason(),
          e.getMessage());
      return null;
    }
  }

  /**
   * Reads the version, type and, for resource and share tokens, the resource
   * without checking the signature.
   *
   * @return the header, or {@code null} if the token is not recognisable
   */
  public ParsedUnifiedToken parseToken(String token) {
    if (token == null || token.isEmpty()) {
      return null;
    }
    try {
      ByteReader r = new ByteReader(decodeBase64(token));
      int version = r.readUint8();
      UnifiedTokenType type = readType(r, version);
      if (!type.isResourceScoped()) {
        return new ParsedUnifiedToken(version, type, null, null);
      }
      String resourceType =
          UnifiedResourceType.fromCode(r.readUint8()).getName();
      return new ParsedUnifiedToken(version, type, resourceType,
          r.readShortString());
    } catch (DecodeException e) {
      log.debug("unparseable unified token: {}", e.getMessage());
      return null;
    } catch (TokenRejectedException e) {
      log.debug("unparseable unified token ({}): {}", e.getReason(),
          e.getMessage());
      return null;
    }
  }

  private UnifiedToken decodePayload(byte[] payload)
      throws TokenRejectedException {
    ByteReader r = new ByteReader(payload);
    try {
      int version = r.readUint8();
      UnifiedTokenType type = readType(r, version);
      switch (type) {
        case BEARER: {
          int perm = r.readUint16();
          long issuedAt = readTime(r);
          long expiresAt = readTime(r);
          return new BearerToken(version, perm, issuedAt, expiresAt,
              r.readShortString());
        }
        case RESOURCE:
        case SHARE: {
          String resourceType =
              UnifiedResourceType.fromCode(r.readUint8()).getName();
          String resourceId = r.readShortString();
          int perm = r.readUint16();
          long issuedAt = readTime(r);
          long expiresAt = readTime(r);
          String authorId = r.readShortString();
          TokenConstraints constraints = r.hasRemaining()
              ? readConstraints(r) : null;
          return new ResourceAccessToken(version, type, perm, issuedAt,
              expiresAt, resourceType, resourceId, authorId, constraints);
        }
        default: {
          int perm = r.readUint16();
          long issuedAt = readTime(r);
          long expiresAt = readTime(r);
          String identityId = r.readShortString();
          return new InvitationToken(version, perm, issuedAt, expiresAt,
              identityId, readCapabilities(r.readLongString()));
        }
      }
    } catch (DecodeException e) {
      throw new TokenRejectedException(MALFORMED, e.getMessage(), e);
    }
  }

  private static UnifiedTokenType readType(ByteReader r, int version)
      throws DecodeException, TokenRejectedException {
    if (version != VERSION) {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT,
          "unknown unified token version " + version);
    }
    int code = r.readUint8();
    UnifiedTokenType type = UnifiedTokenType.fromCode(code);
    if (type == null) {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT,
          "unknown unified token type " + code);
    }
    return type;
  }

  private static void writeTimes(ByteWriter w, long issuedAt,
      long expiresAt) {
    w.writeUint32(relative(issuedAt)).writeUint32(relative(expiresAt));
  }

  private static long relative(long time) {
    long rel = time - TokenEpoch.EPOCH_SECONDS;
    if (rel < 0 || rel > 0xFFFFFFFFL) {
      throw new IllegalArgumentException(String.format(
          "time %d cannot be expressed relative to the token epoch", time));
    }
    return rel;
  }

  private static long readTime(ByteReader r) throws DecodeException {
    return r.readUint32() + TokenEpoch.EPOCH_SECONDS;
  }

  private static void writeConstraints(ByteWriter w, TokenConstraints c) {
    if (c == null) {
      w.writeUint8(0);
      return;
    }
    int flags = 0;
    if (c.getMaxUses() != null) {
      flags |= HAS_MAX_USES;
    }
    if (c.canDelegate()) {
      flags |= CAN_DELEGATE;
    }
    if (c.getMaxDelegationDepth() != null) {
      flags |= HAS_MAX_DEPTH;
    }
    w.writeUint8(flags);
    if (c.getMaxUses() != null) {
      w.writeUint16(c.getMaxUses());
    }
    if (c.getMaxDelegationDepth() != null) {
      w.writeUint8(c.getMaxDelegationDepth());
    }
  }

  private static TokenConstraints readConstraints(ByteReader r)
      throws DecodeException {
    int flags = r.readUint8();
    if (flags == 0) {
      return null;
    }
    TokenConstraints.Builder b = TokenConstraints.builder();
    if ((flags & HAS_MAX_USES) != 0) {
      b.maxUses(r.readUint16()).requiresStateCheck(true);
    }
    if ((flags & CAN_DELEGATE) != 0) {
      b.canDelegate(true);
    }
    if ((flags & HAS_MAX_DEPTH) != 0) {
      b.maxDelegationDepth(r.readUint8());
    }
    return b.build();
  }

  private static List<String> readCapabilities(String json)
      throws TokenRejectedException {
    try {
      List<String> caps = GsonUtil.getGson().fromJson(json, CAPABILITY_LIST);
      if (caps == null) {
        throw new TokenRejectedException(MALFORMED,
            "invitation has no capability list");
      }
      return Collections.unmodifiableList(caps);
    } catch (JsonParseException e) {
      throw new TokenRejectedException(MALFORMED,
          "invitation capabilities are not a JSON array", e);
    }
  }

  private static byte[] decodeBase64(String token)
      throws TokenRejectedException {
    try {
      return ByteCodec.base64UrlDecode(token);
    } catch (DecodeException e) {
      throw new TokenRejectedException(MALFORMED, "token is not base64url",
          e);
    }
  }

  private long nowSeconds() {
    return Math.floorDiv(clock.millis(), 1000L);
  }
}
