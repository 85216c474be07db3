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

import java.util.EnumSet;
import java.util.Set;

/**
 * The kinds of resource that hand out their own signed tokens. Each kind
 * signs with a per-resource secret and accepts a fixed set of formats.
 */
public enum ResourceKind {

  CHANNEL("channel", EnumSet.allOf(TokenFormat.class)),
  LOG("log", EnumSet.of(TokenFormat.V1_JSON, TokenFormat.V2_COMPACT));

  private final String name;
  private final Set<TokenFormat> formats;

  ResourceKind(String name, Set<TokenFormat> formats) {
    this.name = name;
    this.formats = formats;
  }

  public String getName() {
    return name;
  }

  public boolean accepts(TokenFormat format) {
    return formats.contains(format);
  }
}
