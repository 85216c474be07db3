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

package com.google.belay.authz.stateful;

import java.time.Instant;

/**
 * Lets its holder set the credentials of an identity in the pending claim
 * state.
 */
public class IdentityClaimToken extends StatefulToken {

  private final String identityId;

  public IdentityClaimToken(String id, Instant createdAt, Instant expiresAt,
      String createdBy, String label, String identityId) {
    super(id, TokenAction.IDENTITY_CLAIM, createdAt, expiresAt, createdBy,
        label);
    this.identityId = identityId;
  }

  public String getIdentityId() {
    return identityId;
  }

  @Override
  public IdentityClaimToken copy() {
    IdentityClaimToken t = new IdentityClaimToken(getId(), getCreatedAt(),
        getExpiresAt(), getCreatedBy(), getLabel(), identityId);
    t.copyStateFrom(this);
    return t;
  }
}
