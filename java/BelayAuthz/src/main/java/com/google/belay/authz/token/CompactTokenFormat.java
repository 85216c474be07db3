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

import static com.google.belay.authz.token.TokenRejectedException.Reason.MALFORMED;
import static com.google.belay.authz.token.TokenRejectedException.Reason.SIGNATURE_MISMATCH;
import static com.google.belay.authz.token.TokenRejectedException.Reason.UNSUPPORTED_FORMAT;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.HmacSigner;

import java.util.Arrays;

/**
 * V2 layout, 34 bytes:
 *
 * <pre>
 * version(1) resourceId(8) perm(1) authorId(4) expiresAt(4) signature(16)
 * </pre>
 *
 * The expiry is absolute unix seconds as a big-endian uint32. Only the read
 * and append bits may be set in the permission byte.
 */
final class CompactTokenFormat {

  static final int RESOURCE_ID_LENGTH = 8;
  static final int AUTHOR_ID_LENGTH = 4;
  static final int PAYLOAD_LENGTH = 18;
  static final int TOKEN_LENGTH = 34;

  static final int PERMISSION_MASK =
      Permission.READ.getBit() | Permission.APPEND.getBit();

  private static final TokenFormat FORMAT = TokenFormat.V2_COMPACT;

  private CompactTokenFormat() {
    // purely static class
  }

  static boolean matches(byte[] bytes) {
    return bytes.length == TOKEN_LENGTH
        && (bytes[0] & 0xFF) == FORMAT.getVersionByte();
  }

  static byte[] encode(String resourceId, int permissions, String authorId,
      long expiresAt, String secret) {
    if ((permissions & ~PERMISSION_MASK) != 0) {
      throw new IllegalArgumentException(String.format(
          "permission bits 0x%02x cannot be carried by a %s token",
          permissions & ~PERMISSION_MASK, FORMAT));
    }
    if (expiresAt < 0 || expiresAt > 0xFFFFFFFFL) {
      throw new IllegalArgumentException(String.format(
          "expiry %d is out of range for a %s token", expiresAt, FORMAT));
    }

    byte[] token = new byte[TOKEN_LENGTH];
    token[0] = (byte) FORMAT.getVersionByte();
    System.arraycopy(ByteCodec.packHexId(resourceId, RESOURCE_ID_LENGTH), 0,
        token, 1, RESOURCE_ID_LENGTH);
    token[9] = (byte) permissions;
    System.arraycopy(ByteCodec.packHexId(authorId, AUTHOR_ID_LENGTH), 0,
        token, 10, AUTHOR_ID_LENGTH);
    ByteCodec.writeUint32(token, 14, expiresAt);

    byte[] payload = Arrays.copyOf(token, PAYLOAD_LENGTH);
    byte[] sig = HmacSigner.signTruncated(payload, secret,
        FORMAT.getSignatureLength());
    System.arraycopy(sig, 0, token, PAYLOAD_LENGTH, sig.length);
    return token;
  }

  static VerifiedResourceToken decode(byte[] bytes, String secret,
      ResourceKind kind) throws TokenRejectedException {
    if (!matches(bytes)) {
      throw new TokenRejectedException(UNSUPPORTED_FORMAT,
          "not a V2 token");
    }

    byte[] payload = Arrays.copyOf(bytes, PAYLOAD_LENGTH);
    byte[] sig = Arrays.copyOfRange(bytes, PAYLOAD_LENGTH, TOKEN_LENGTH);
    if (!HmacSigner.verifyTruncated(payload, sig, secret)) {
      throw new TokenRejectedException(SIGNATURE_MISMATCH,
          "V2 signature mismatch");
    }
    int permissions = bytes[9] & 0xFF;
    if ((permissions & ~PERMISSION_MASK) != 0) {
      throw new TokenRejectedException(MALFORMED, String.format(
          "V2 token carries unsupported permission bits 0x%02x",
          permissions & ~PERMISSION_MASK));
    }

    return new VerifiedResourceToken(FORMAT, kind,
        parseResourceId(bytes), Permission.fromBitmap(permissions),
        ByteCodec.toHex(bytes, 10, AUTHOR_ID_LENGTH),
        ByteCodec.readUint32(bytes, 14));
  }

  static String parseResourceId(byte[] bytes) {
    return ByteCodec.toHex(bytes, 1, RESOURCE_ID_LENGTH);
  }
}
