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

import com.google.gson.annotations.SerializedName;

/**
 * How a capability grant came about.
 */
public enum GrantSource {
  @SerializedName("direct")
  DIRECT,

  /** Through accepting an invitation; the source id names it. */
  @SerializedName("invitation")
  INVITATION,

  /** Passed on by another identity; the source id names the parent grant. */
  @SerializedName("delegation")
  DELEGATION,

  @SerializedName("system")
  SYSTEM
}
