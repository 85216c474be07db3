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
import com.google.belay.authz.codec.HmacSigner;

import java.util.Arrays;

/**
 * V3 layout, 25 bytes, about 34 characters once encoded:
 *
 * <pre>
 * version(1) resourceId(6) perm(1) authorId(2) expiresAt(3) signature(12)
 * </pre>
 *
 * The expiry is whole hours since {@link TokenEpoch} as a big-endian uint24,
 * so it always rounds down to the hour.
 */
final class ShortTokenFormat {

  static final int RESOURCE_ID_LENGTH = 6;
  static final int AUTHOR_ID_LENGTH = 2;
  static final int PAYLOAD_LENGTH = 13;
  static final int TOKEN_LENGTH = 25;

  private static final TokenFormat FORMAT = TokenFormat.V3_SHORT;

  private ShortTokenFormat() {
    // purely static class
  }

  static boolean matches(byte[] bytes) {
    return bytes.length == TOKEN_LENGTH
        && (bytes[0] & 0xFF) == FORMAT.getVersionByte();
  }

  static byte[] encode(String resourceId, int permissions, String authorId,
      long expiresAt, String secret) {
    int hours = TokenEpoch.toHours(expiresAt, FORMAT);

    byte[] token = new byte[TOKEN_LENGTH];
    token[0] = (byte) FORMAT.getVersionByte();
    System.arraycopy(ByteCodec.packHexId(resourceId, RESOURCE_ID_LENGTH), 0,
        token, 1, RESOURCE_ID_LENGTH);
    token[7] = (byte) permissions;
    System.arraycopy(ByteCodec.packHexId(authorId, AUTHOR_ID_LENGTH), 0,
        token, 8, AUTHOR_ID_LENGTH);
    ByteCodec.writeUint24(token, 10, hours);

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
          "not a V3 token");
    }

    byte[] payload = Arrays.copyOf(bytes, PAYLOAD_LENGTH);
    byte[] sig = Arrays.copyOfRange(bytes, PAYLOAD_LENGTH, TOKEN_LENGTH);
    if (!HmacSigner.verifyTruncated(payload, sig, secret)) {
      throw new TokenRejectedException(SIGNATURE_MISMATCH,
          "V3 signature mismatch");
    }

    return new VerifiedResourceToken(FORMAT, kind,
        parseResourceId(bytes), Permission.fromBitmap(bytes[7] & 0xFF),
        ByteCodec.toHex(bytes, 8, AUTHOR_ID_LENGTH),
        TokenEpoch.fromHours(ByteCodec.readUint24(bytes, 10)));
  }

  static String parseResourceId(byte[] bytes) {
    return ByteCodec.toHex(bytes, 1, RESOURCE_ID_LENGTH);
  }
}
