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

package com.google.belay.authz.codec;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.util.Arrays;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signing with optional truncation, and the constant-time
 * comparisons every signature and secret check must go through.
 */
public final class HmacSigner {

  public static final int FULL_SIGNATURE_LENGTH = 32;

  private static final String ALGORITHM = "HmacSHA256";

  private HmacSigner() {
    // purely static class
  }

  /**
   * Signs {@code payload} with the UTF-8 bytes of {@code secret} as the key.
   *
   * @return the 32 byte HMAC-SHA256 of the payload
   */
  public static byte[] sign(byte[] payload, String secret) {
    if (secret == null) {
      throw new IllegalArgumentException("secret is required");
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(keyBytes(secret), ALGORITHM));
      return mac.doFinal(payload);
    } catch (InvalidKeyException e) {
      throw new IllegalArgumentException("secret cannot be used as an "
          + "HMAC key", e);
    } catch (GeneralSecurityException e) {
      // every JRE is required to provide HmacSHA256
      throw new IllegalStateException(ALGORITHM + " is not available", e);
    }
  }

  /**
   * Signs {@code payload} and keeps only the first {@code length} bytes.
   */
  public static byte[] signTruncated(byte[] payload, String secret,
      int length) {
    if (length <= 0 || length > FULL_SIGNATURE_LENGTH) {
      throw new IllegalArgumentException(String.format(
          "signature length %d is outside 1..%d", length,
          FULL_SIGNATURE_LENGTH));
    }
    return Arrays.copyOf(sign(payload, secret), length);
  }

  /**
   * Recomputes the truncated signature of {@code payload} and compares it to
   * {@code provided} in constant time.
   */
  public static boolean verifyTruncated(byte[] payload, byte[] provided,
      String secret) {
    if (provided == null || provided.length == 0
        || provided.length > FULL_SIGNATURE_LENGTH) {
      return false;
    }
    byte[] expected = signTruncated(payload, secret, provided.length);
    return constantTimeEquals(expected, provided);
  }

  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null || a.length != b.length) {
      return false;
    }
    int result = 0;
    for (int i = 0; i < a.length; i++) {
      result |= a[i] ^ b[i];
    }
    return result == 0;
  }

  public static boolean constantTimeEquals(String a, String b) {
    if (a == null || b == null || a.length() != b.length()) {
      return false;
    }
    int result = 0;
    for (int i = 0; i < a.length(); i++) {
      result |= a.charAt(i) ^ b.charAt(i);
    }
    return result == 0;
  }

  private static byte[] keyBytes(String secret) {
    byte[] key = ByteCodec.utf8(secret);
    // SecretKeySpec refuses an empty key; HMAC pads short keys with zeros,
    // so a single zero byte yields the same MAC as the empty key.
    return key.length == 0 ? new byte[1] : key;
  }
}
