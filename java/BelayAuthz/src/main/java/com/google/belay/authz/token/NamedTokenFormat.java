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

import static com.google.belay.authz.token.TokenRejectedException.Reason.SIGNATURE_MISMATCH;
import static com.google.belay.authz.token.TokenRejectedException.Reason.UNSUPPORTED_FORMAT;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.ByteWriter;
import com.google.belay.authz.codec.HmacSigner;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * V4 layout, 25 to 56 bytes:
 *
 * <pre>
 * version(1) resourceId(6) perm(1) authorIdLen(1) authorId(1..32)
 *     expiresAt(3) signature(12)
 * </pre>
 *
 * Same hour based expiry as V3, but the author is a UTF-8 display name.
 */
final class NamedTokenFormat {

  static final int RESOURCE_ID_LENGTH = 6;
  static final int MAX_AUTHOR_LENGTH = 32;

  /** Everything except the author name: 1 + 6 + 1 + 1 + 3 + 12. */
  private static final int FIXED_LENGTH = 24;
  private static final int AUTHOR_LENGTH_OFFSET = 8;
  private static final int AUTHOR_OFFSET = 9;

  private static final TokenFormat FORMAT = TokenFormat.V4_NAMED;

  private NamedTokenFormat() {
    // purely static class
  }

  /**
   * True if the version byte is V4 and the total length agrees with the
   * author length byte.
   */
  static boolean matches(byte[] bytes) {
    if (bytes.length < FIXED_LENGTH + 1
        || bytes.length > FIXED_LENGTH + MAX_AUTHOR_LENGTH
        || (bytes[0] & 0xFF) != FORMAT.getVersionByte()) {
      return false;
    }
    int authorLength = bytes[AUTHOR_LENGTH_OFFSET] & 0xFF;
    return authorLength >= 1 && authorLength <= MAX_AUTHOR_LENGTH
        && bytes.length == FIXED_LENGTH + authorLength;
  }

  static byte[] encode(String resourceId, int permissions, String authorName,
      long expiresAt, String secret) {
    byte[] author = ByteCodec.utf8(authorName);
    if (author.length == 0) {
      throw new IllegalArgumentException("author name cannot be empty");
    }
    if (author.length > MAX_AUTHOR_LENGTH) {
      throw new IllegalArgumentException(String.format(
          "author name '%s' is too long (max %d bytes UTF-8)", authorName,
          MAX_AUTHOR_LENGTH));
    }
    int hours = TokenEpoch.toHours(expiresAt, FORMAT);

    byte[] payload = new ByteWriter()
        .writeUint8(FORMAT.getVersionByte())
        .writeBytes(ByteCodec.packHexId(resourceId, RESOURCE_ID_LENGTH))
        .writeUint8(permissions)
        .writeUint8(author.length)
        .writeBytes(author)
        .writeUint24(hours)
        .toByteArray();

    byte[] sig = HmacSigner.signTruncated(payload, secret,
        FORMAT.getSignatureLength());
    byte[] token = Arrays.copyOf(payload, payload.length + sig.length);
    System.arraycopy(sig, 0, token, payload.length, sig.length);
    return token;
  }

  static VerifiedResourceToken decode(byte[] bytes, String secret,
      ResourceKind kind) throws TokenRejectedException {
    if (!matches(bytes)) {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT,
          "not a V4 token");
    }

    int payloadLength = bytes.length - FORMAT.getSignatureLength();
    byte[] payload = Arrays.copyOf(bytes, payloadLength);
    byte[] sig = Arrays.copyOfRange(bytes, payloadLength, bytes.length);
    if (!HmacSigner.verifyTruncated(payload, sig, secret)) {
      throw new TokenRejectedException(SIGNATURE_MISMATCH,
          "V4 signature mismatch");
    }

    int authorLength = bytes[AUTHOR_LENGTH_OFFSET] & 0xFF;
    String author = new String(bytes, AUTHOR_OFFSET, authorLength,
        StandardCharsets.UTF_8);
    int hours = ByteCodec.readUint24(bytes, AUTHOR_OFFSET + authorLength);

    return new VerifiedResourceToken(FORMAT, kind, parseResourceId(bytes),
        Permission.fromBitmap(bytes[7] & 0xFF), author,
        TokenEpoch.fromHours(hours));
  }

  static String parseResourceId(byte[] bytes) {
    return ByteCodec.toHex(bytes, 1, RESOURCE_ID_LENGTH);
  }
}
