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
import static com.google.belay.authz.token.TokenRejectedException.Reason.UNSUPPORTED_FORMAT;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.DecodeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Issues and checks the self-contained tokens that channels and logs hand out
 * to third parties. A token names one resource and is signed with that
 * resource's own secret, so nothing is stored server side; the only way to
 * revoke outstanding tokens is to rotate the secret.
 *
 * <p>
 * Verification is meant to be done in two steps: {@link #parseToken} reads
 * the resource id without checking anything, the caller looks up the secret
 * for that resource, then {@link #verifyToken} checks the signature and the
 * expiry.
 */
public class ResourceTokenCodec {

  private static final Logger log =
      LoggerFactory.getLogger(ResourceTokenCodec.class);

  private final ResourceKind kind;
  private final Clock clock;
  private final Random random;

  public ResourceTokenCodec(ResourceKind kind, Clock clock) {
    this(kind, clock, new SecureRandom());
  }

  public ResourceTokenCodec(ResourceKind kind, Clock clock, Random random) {
    if (kind == null || clock == null || random == null) {
      throw new IllegalArgumentException(
          "kind, clock and random are all required");
    }
    this.kind = kind;
    this.clock = clock;
    this.random = random;
  }

  public static ResourceTokenCodec forChannels(Clock clock) {
    return new ResourceTokenCodec(ResourceKind.CHANNEL, clock);
  }

  public static ResourceTokenCodec forLogs(Clock clock) {
    return new ResourceTokenCodec(ResourceKind.LOG, clock);
  }

  public ResourceKind getKind() {
    return kind;
  }

  /**
   * Picks the most compact channel format able to carry the request: V4 when
   * a display name is given or a permission beyond read and append is asked
   * for, V3 otherwise.
   */
  public static TokenFormat selectFormat(ResourceTokenParams params) {
    if (params.getDisplayName() != null
        && !params.getDisplayName().isEmpty()) {
      return TokenFormat.V4_NAMED;
    }
    for (Permission p : params.getPermissions()) {
      if (!p.isLegacy()) {
        return TokenFormat.V4_NAMED;
      }
    }
    return TokenFormat.V3_SHORT;
  }

  /**
   * Creates a token in the default format for this codec's kind: the result
   * of {@link #selectFormat} for channels, V2 for logs.
   */
  public IssuedToken createToken(ResourceTokenParams params, String secret) {
    TokenFormat format = kind == ResourceKind.LOG ? TokenFormat.V2_COMPACT
        : selectFormat(params);
    return createToken(params, secret, format);
  }

  /**
   * Creates a token in an explicitly chosen format.
   *
   * @throws IllegalArgumentException
   *           if the format is V1, is not accepted by this codec's kind, or
   *           cannot represent the requested author, permissions or expiry
   */
  public IssuedToken createToken(ResourceTokenParams params, String secret,
      TokenFormat format) {
    if (format == TokenFormat.V1_JSON) {
      throw new IllegalArgumentException("V1 tokens can no longer be issued");
    }
    if (!kind.accepts(format)) {
      throw new IllegalArgumentException(String.format(
          "%s tokens cannot use format %s", kind.getName(), format));
    }

    long expiresAt = nowSeconds() + params.getExpiresInSeconds();
    int permissions = Permission.toBitmap(params.getPermissions());
    byte[] token;
    switch (format) {
      case V2_COMPACT:
        token = CompactTokenFormat.encode(params.getResourceId(), permissions,
            hexAuthor(params, format, CompactTokenFormat.AUTHOR_ID_LENGTH),
            expiresAt, secret);
        break;
      case V3_SHORT:
        token = ShortTokenFormat.encode(params.getResourceId(), permissions,
            hexAuthor(params, format, ShortTokenFormat.AUTHOR_ID_LENGTH),
            expiresAt, secret);
        break;
      case V4_NAMED:
        token = NamedTokenFormat.encode(params.getResourceId(), permissions,
            namedAuthor(params), expiresAt, secret);
        break;
      default:
        throw new IllegalArgumentException("unsupported format " + format);
    }

    return new IssuedToken(ByteCodec.base64UrlEncode(token), expiresAt);
  }

  /**
   * Checks the signature and expiry of a token presented by a client.
   *
   * @return the token's content, or {@code null} if the token is malformed,
   *         in a format this kind does not accept, forged or expired
   */
  public VerifiedResourceToken verifyToken(String token, String secret) {
    if (token == null || token.isEmpty()) {
      return null;
    }
    try {
      VerifiedResourceToken verified = decode(token, secret);
      if (verified.getExpiresAt() < nowSeconds()) {
        throw new TokenRejectedException(EXPIRED, String.format(
            "token for %s expired at %d", verified.getResourceId(),
            verified.getExpiresAt()));
      }
      return verified;
    } catch (TokenRejectedException e) {
      log.debug("rejected {} token ({}): {}", kind.getName(), e.getReason(),
          e.getMessage());
      return null;
    }
  }

  /**
   * Reads the format and resource id of a token without checking its
   * signature. The result must not be used for authorization.
   *
   * @return the routing information, or {@code null} if the token is not
   *         recognisable
   */
  public ParsedResourceToken parseToken(String token) {
    if (token == null || token.isEmpty()) {
      return null;
    }
    try {
      if (JsonTokenFormat.matches(token)) {
        return new ParsedResourceToken(TokenFormat.V1_JSON, kind,
            JsonTokenFormat.parseResourceId(token));
      }
      byte[] bytes = decodeBinary(token);
      TokenFormat format = sniff(bytes);
      String resourceId;
      switch (format) {
        case V2_COMPACT:
          resourceId = CompactTokenFormat.parseResourceId(bytes);
          break;
        case V3_SHORT:
          resourceId = ShortTokenFormat.parseResourceId(bytes);
          break;
        default:
          resourceId = NamedTokenFormat.parseResourceId(bytes);
          break;
      }
      return new ParsedResourceToken(format, kind, resourceId);
    } catch (TokenRejectedException e) {
      log.debug("unparseable {} token ({}): {}", kind.getName(),
          e.getReason(), e.getMessage());
      return null;
    }
  }

  private VerifiedResourceToken decode(String token, String secret)
      throws TokenRejectedException {
    if (JsonTokenFormat.matches(token)) {
      checkAccepted(TokenFormat.V1_JSON);
      return JsonTokenFormat.decode(token, secret, kind);
    }

    byte[] bytes = decodeBinary(token);
    TokenFormat format = sniff(bytes);
    switch (format) {
      case V2_COMPACT:
        return CompactTokenFormat.decode(bytes, secret, kind);
      case V3_SHORT:
        return ShortTokenFormat.decode(bytes, secret, kind);
      default:
        return NamedTokenFormat.decode(bytes, secret, kind);
    }
  }

  private static byte[] decodeBinary(String token)
      throws TokenRejectedException {
    try {
      byte[] bytes = ByteCodec.base64UrlDecode(token);
      if (bytes.length == 0) {
        throw new TokenRejectedException(MALFORMED, "empty token");
      }
      return bytes;
    } catch (DecodeException e) {
      throw new TokenRejectedException(MALFORMED, "token is not base64url",
          e);
    }
  }

  /**
   * Identifies a binary format by its first byte and length, then checks
   * that this codec's kind accepts it.
   */
  private TokenFormat sniff(byte[] bytes) throws TokenRejectedException {
    TokenFormat format;
    if ((bytes[0] & 0xFF) == TokenFormat.V4_NAMED.getVersionByte()) {
      if (!NamedTokenFormat.matches(bytes)) {
        throw new TokenRejectedException(MALFORMED, String.format(
            "V4 token has inconsistent length %d", bytes.length));
      }
      format = TokenFormat.V4_NAMED;
    } else if (ShortTokenFormat.matches(bytes)) {
      format = TokenFormat.V3_SHORT;
    } else if (CompactTokenFormat.matches(bytes)) {
      format = TokenFormat.V2_COMPACT;
    } else {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT, String.format(
          "no format with version %d and length %d", bytes[0] & 0xFF,
          bytes.length));
    }
    checkAccepted(format);
    return format;
  }

  private void checkAccepted(TokenFormat format)
      throws TokenRejectedException {
    if (!kind.accepts(format)) {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT, String.format(
          "%s tokens do not accept format %s", kind.getName(), format));
    }
  }

  private String hexAuthor(ResourceTokenParams params, TokenFormat format,
      int byteLength) {
    if (params.getDisplayName() != null
        && !params.getDisplayName().isEmpty()) {
      throw new IllegalArgumentException(String.format(
          "display names cannot be carried by a %s token", format));
    }
    if (params.getAuthorId() != null && !params.getAuthorId().isEmpty()) {
      return params.getAuthorId();
    }
    return randomHex(byteLength);
  }

  private String namedAuthor(ResourceTokenParams params) {
    if (params.getDisplayName() != null
        && !params.getDisplayName().isEmpty()) {
      return params.getDisplayName();
    }
    if (params.getAuthorId() != null && !params.getAuthorId().isEmpty()) {
      return params.getAuthorId();
    }
    return randomHex(ShortTokenFormat.AUTHOR_ID_LENGTH);
  }

  private String randomHex(int byteLength) {
    byte[] bytes = new byte[byteLength];
    random.nextBytes(bytes);
    return ByteCodec.toHex(bytes);
  }

  private long nowSeconds() {
    return Math.floorDiv(clock.millis(), 1000L);
  }
}
