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

/**
 * A token id and the gateway it belongs to, as recovered from a compact
 * share URL.
 */
public class ShareLink {

  private final String tokenId;
  private final String gatewayUrl;

  public ShareLink(String tokenId, String gatewayUrl) {
    this.tokenId = tokenId;
    this.gatewayUrl = gatewayUrl;
  }

  public String getTokenId() {
    return tokenId;
  }

  public String getGatewayUrl() {
    return gatewayUrl;
  }
}
