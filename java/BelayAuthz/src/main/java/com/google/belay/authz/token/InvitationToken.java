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

import java.util.List;

/**
 * A token inviting its holder to claim an identity, together with the
 * capabilities that identity will be granted.
 */
public class InvitationToken extends UnifiedToken {

  private final String identityId;
  private final List<String> grantedCapabilities;

  public InvitationToken(int version, int permissions, long issuedAt,
      long expiresAt, String identityId, List<String> grantedCapabilities) {
    super(version, UnifiedTokenType.INVITATION, permissions, issuedAt,
        expiresAt);
    this.identityId = identityId;
    this.grantedCapabilities = grantedCapabilities;
  }

  public String getIdentityId() {
    return identityId;
  }

  public List<String> getGrantedCapabilities() {
    return grantedCapabilities;
  }
}
