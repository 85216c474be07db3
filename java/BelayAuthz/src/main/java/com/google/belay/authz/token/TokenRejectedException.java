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
 * Internal signal that a presented token is unacceptable. The codecs catch
 * it, log the reason at debug level and report only {@code null} to their
 * callers, so the reason cannot be used as a forgery oracle.
 */
@SuppressWarnings("serial")
class TokenRejectedException extends Exception {

  enum Reason {
    /** The text or bytes do not decode into the expected structure. */
    MALFORMED,

    /** The bytes decode but match no known version and length. */
    UNSUPPORTED_FORMAT,

    /** The signature does not match the payload under the given secret. */
    SIGNATURE_MISMATCH,

    /** The token was genuine but its expiry is in the past. */
    EXPIRED
  }

  private final Reason reason;

  TokenRejectedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  TokenRejectedException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  Reason getReason() {
    return reason;
  }
}
