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

package com.google.belay.authz.grant;

import com.google.belay.authz.token.InvitationToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The capabilities named by the token a request was made with.
 */
public class TokenClaims implements CapabilityRestriction {

  private final List<String> capabilities;

  public TokenClaims(List<String> capabilities) {
    this.capabilities = capabilities == null ? null
        : Collections.unmodifiableList(new ArrayList<String>(capabilities));
  }

  public static TokenClaims of(String... capabilities) {
    List<String> caps = new ArrayList<String>();
    Collections.addAll(caps, capabilities);
    return new TokenClaims(caps);
  }

  public static TokenClaims fromInvitation(InvitationToken invitation) {
    return new TokenClaims(invitation.getGrantedCapabilities());
  }

  @Override
  public List<String> getCapabilities() {
    return capabilities;
  }
}
