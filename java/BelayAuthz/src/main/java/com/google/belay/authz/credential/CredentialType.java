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

import com.google.gson.annotations.SerializedName;

/**
 * How a credential is presented.
 */
public enum CredentialType {
  @SerializedName("api_key")
  API_KEY,

  @SerializedName("bearer_token")
  BEARER_TOKEN,

  @SerializedName("refresh_token")
  REFRESH_TOKEN,

  @SerializedName("invitation")
  INVITATION
}
