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

/**
 * Outcome of checking a presented secret against a credential.
 */
public class CredentialVerification {

  /** Why a credential was not accepted, in the order the checks are made. */
  public enum Rejection {
    REVOKED("revoked"),
    EXPIRED("expired"),
    SCOPE_EXPIRED("scope_expired"),
    INVALID_SECRET("invalid_secret");

    private final String code;

    Rejection(String code) {
      this.code = code;
    }

    public String getCode() {
      return code;
    }
  }

  private final String identityId;
  private final Rejection rejection;

  private CredentialVerification(String identityId, Rejection rejection) {
    this.identityId = identityId;
    this.rejection = rejection;
  }

  static CredentialVerification accepted(String identityId) {
    return new CredentialVerification(identityId, null);
  }

  static CredentialVerification rejected(Rejection rejection) {
    return new CredentialVerification(null, rejection);
  }

  public boolean isValid() {
    return rejection == null;
  }

  /** Only set when the credential was accepted. */
  public String getIdentityId() {
    return identityId;
  }

  /** Only set when the credential was rejected. */
  public Rejection getRejection() {
    return rejection;
  }

  public String getReason() {
    return rejection == null ? null : rejection.getCode();
  }
}
