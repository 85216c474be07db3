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

package com.google.belay.authz.credential;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.Digests;
import com.google.belay.authz.codec.HmacSigner;

import java.util.Random;

/**
 * Generates credential secrets and checks presented secrets against stored
 * hashes.
 */
public final class SecretHasher {

  public static final int SECRET_BYTES = 32;

  private SecretHasher() {
    // purely static class
  }

  /** 64 lowercase hex characters from 32 random bytes. */
  public static String generateSecret(Random random) {
    byte[] bytes = new byte[SECRET_BYTES];
    random.nextBytes(bytes);
    return ByteCodec.toHex(bytes);
  }

  public static String hash(String secret) {
    return Digests.sha256Hex(secret);
  }

  public static boolean matches(String secret, String expectedHash) {
    if (secret == null) {
      return false;
    }
    return HmacSigner.constantTimeEquals(hash(secret), expectedHash);
  }
}
