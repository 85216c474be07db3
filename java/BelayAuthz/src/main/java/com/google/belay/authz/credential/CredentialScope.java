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

import com.google.belay.authz.grant.CapabilityRestriction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Limits what a credential can be used for, below what its identity is
 * granted. Every part is optional; an absent part places no limit.
 */
public class CredentialScope implements CapabilityRestriction {

  private final List<String> capabilities;
  private final List<String> namespaces;
  private final List<ResourceScope> resources;
  private final Instant expiresAt;

  public CredentialScope(List<String> capabilities, List<String> namespaces,
      List<ResourceScope> resources, Instant expiresAt) {
    this.capabilities = copyOrNull(capabilities);
    this.namespaces = copyOrNull(namespaces);
    this.resources = copyOrNull(resources);
    this.expiresAt = expiresAt;
  }

  public static CredentialScope ofCapabilities(String... capabilities) {
    List<String> caps = new ArrayList<String>();
    Collections.addAll(caps, capabilities);
    return new CredentialScope(caps, null, null, null);
  }

  private static <T> List<T> copyOrNull(List<T> list) {
    return list == null ? null
        : Collections.unmodifiableList(new ArrayList<T>(list));
  }

  @Override
  public List<String> getCapabilities() {
    return capabilities;
  }

  public List<String> getNamespaces() {
    return namespaces;
  }

  public List<ResourceScope> getResources() {
    return resources;
  }

  /**
   * When the scope stops applying; the credential then fails verification
   * even if it has not expired itself.
   */
  public Instant getExpiresAt() {
    return expiresAt;
  }
}
