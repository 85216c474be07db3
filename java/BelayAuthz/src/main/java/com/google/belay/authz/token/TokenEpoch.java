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
 * The fixed epoch, 2024-01-01T00:00:00Z, that compact tokens count from.
 */
final class TokenEpoch {

  static final long EPOCH_SECONDS = 1704067200L;

  static final long SECONDS_PER_HOUR = 3600L;

  static final int MAX_HOURS = 0xFFFFFF;

  private TokenEpoch() {
    // purely static class
  }

  /**
   * Converts an absolute expiry into whole hours since the epoch, rounding
   * down.
   *
   * @throws IllegalArgumentException
   *           if the result does not fit in three bytes
   */
  static int toHours(long expiresAt, TokenFormat format) {
    long hours = Math.floorDiv(expiresAt - EPOCH_SECONDS, SECONDS_PER_HOUR);
    if (hours < 0 || hours > MAX_HOURS) {
      throw new IllegalArgumentException(String.format(
          "expiry %d is out of range for a %s token", expiresAt, format));
    }
    return (int) hours;
  }

  static long fromHours(int hours) {
    return EPOCH_SECONDS + hours * SECONDS_PER_HOUR;
  }
}
