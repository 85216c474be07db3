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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings of an {@link IdentityType#APP} identity. The namespace is always
 * derived from the origin by {@link IdentityRegistry}; any value given by
 * the caller is replaced.
 */
public class AppConfig {

  private final String origin;
  private final String namespace;
  private final List<String> grantedCapabilities;
  private final boolean frameAccess;

  public AppConfig(String origin, List<String> grantedCapabilities,
      boolean frameAccess) {
    this(origin, null, grantedCapabilities, frameAccess);
  }

  public AppConfig(String origin, String namespace,
      List<String> grantedCapabilities, boolean frameAccess) {
    this.origin = origin;
    this.namespace = namespace;
    this.grantedCapabilities = grantedCapabilities == null
        ? Collections.<String> emptyList()
        : Collections.unmodifiableList(
            new ArrayList<String>(grantedCapabilities));
    this.frameAccess = frameAccess;
  }

  AppConfig withNamespace(String namespace) {
    return new AppConfig(origin, namespace, grantedCapabilities, frameAccess);
  }

  public String getOrigin() {
    return origin;
  }

  public String getNamespace() {
    return namespace;
  }

  public List<String> getGrantedCapabilities() {
    return grantedCapabilities;
  }

  /** Whether the app may embed the gateway in a frame. */
  public boolean hasFrameAccess() {
    return frameAccess;
  }
}
