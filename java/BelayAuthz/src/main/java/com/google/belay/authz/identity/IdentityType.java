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

package com.google.belay.authz.identity;

import com.google.gson.annotations.SerializedName;

/**
 * What kind of party an identity represents.
 */
public enum IdentityType {
  @SerializedName("user")
  USER,

  @SerializedName("service")
  SERVICE,

  @SerializedName("agent")
  AGENT,

  /** A web application, bound to one origin and the namespace derived from it. */
  @SerializedName("app")
  APP,

  @SerializedName("anonymous")
  ANONYMOUS
}
