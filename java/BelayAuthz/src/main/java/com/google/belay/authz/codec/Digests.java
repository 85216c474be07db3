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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers for hashing secrets and deriving aliases.
 */
public final class Digests {

  private static final String SHA_256 = "SHA-256";

  private Digests() {
    // purely static class
  }

  public static byte[] sha256(byte[] data) {
    try {
      return MessageDigest.getInstance(SHA_256).digest(data);
    } catch (NoSuchAlgorithmException e) {
      // every JRE is required to provide SHA-256
      throw new IllegalStateException(SHA_256 + " is not available", e);
    }
  }

  /** The lowercase hex SHA-256 of the UTF-8 bytes of {@code text}. */
  public static String sha256Hex(String text) {
    return ByteCodec.toHex(sha256(ByteCodec.utf8(text)));
  }
}
