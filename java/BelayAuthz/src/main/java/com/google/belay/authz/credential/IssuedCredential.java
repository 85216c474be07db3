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
 * A new credential together with its plaintext secret. The secret must be
 * shown to its owner and then discarded.
 */
public class IssuedCredential {

  private final Credential credential;
  private final String secret;

  IssuedCredential(Credential credential, String secret) {
    this.credential = credential;
    this.secret = secret;
  }

  public Credential getCredential() {
    return credential;
  }

  public String getSecret() {
    return secret;
  }
}
