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

/**
 * The wire formats a resource token may be encoded in. Every format can be
 * recognised from the token text alone: V1 by its JSON prefix, the binary
 * formats by their first byte and decoded length.
 */
public enum TokenFormat {

  /** Base64url JSON with a full length signature. Decode only. */
  V1_JSON(0x01, 32),

  /** 34 bytes: 8 byte resource id, absolute uint32 expiry in seconds. */
  V2_COMPACT(0x02, 16),

  /** 25 bytes: 6 byte resource id, 2 byte author, uint24 expiry in hours. */
  V3_SHORT(0x03, 12),

  /** Variable length: 6 byte resource id, 1..32 byte UTF-8 author name. */
  V4_NAMED(0x04, 12);

  private final int versionByte;
  private final int signatureLength;

  TokenFormat(int versionByte, int signatureLength) {
    this.versionByte = versionByte;
    this.signatureLength = signatureLength;
  }

  public int getVersionByte() {
    return versionByte;
  }

  public int getSignatureLength() {
    return signatureLength;
  }
}
