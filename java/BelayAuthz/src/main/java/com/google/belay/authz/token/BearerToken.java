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
 * A token that stands for an identity.
 */
public class BearerToken extends UnifiedToken {

  private final String identityId;

  public BearerToken(int version, int permissions, long issuedAt,
      long expiresAt, String identityId) {
    super(version, UnifiedTokenType.BEARER, permissions, issuedAt, expiresAt);
    this.identityId = identityId;
  }

  public String getIdentityId() {
    return identityId;
  }
}
