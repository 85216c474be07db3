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
 * Result of {@link CredentialStore#rotateCredential(Credential)}: the old
 * credential, now rotating, and its replacement with the replacement's
 * secret.
 */
public class CredentialRotation {

  private final Credential oldCredential;
  private final Credential newCredential;
  private final String newSecret;

  CredentialRotation(Credential oldCredential, Credential newCredential,
      String newSecret) {
    this.oldCredential = oldCredential;
    this.newCredential = newCredential;
    this.newSecret = newSecret;
  }

  public Credential getOldCredential() {
    return oldCredential;
  }

  public Credential getNewCredential() {
    return newCredential;
  }

  public String getNewSecret() {
    return newSecret;
  }
}
