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
 * The outcome of {@link StatefulTokenStore#lookupToken(String)}. When the
 * record exists but cannot be used, both the token and the reason are set.
 */
public class TokenLookupResult {

  private final boolean valid;
  private final StatefulToken token;
  private final String error;

  private TokenLookupResult(boolean valid, StatefulToken token, String error) {
    this.valid = valid;
    this.token = token;
    this.error = error;
  }

  static TokenLookupResult valid(StatefulToken token) {
    return new TokenLookupResult(true, token, null);
  }

  static TokenLookupResult invalid(StatefulToken token, String error) {
    return new TokenLookupResult(false, token, error);
  }

  static TokenLookupResult error(String error) {
    return new TokenLookupResult(false, null, error);
  }

  public boolean isValid() {
    return valid;
  }

  public StatefulToken getToken() {
    return token;
  }

  public String getError() {
    return error;
  }
}
