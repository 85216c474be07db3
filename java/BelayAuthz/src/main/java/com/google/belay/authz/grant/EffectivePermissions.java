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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What an identity may actually do once its grants, the scope of its
 * credential and the claims of its token have been combined. Built by
 * {@link GrantResolver}; every query is answered from state computed up
 * front.
 */
public class EffectivePermissions {

  private static final String WILDCARD = "*";

  private final Set<String> capabilities;
  private final Map<String, Set<String>> namespacesByCapability;
  private final Set<String> unrestrictedCapabilities;
  private final List<String> namespaces;
  private final List<ResourceRef> resources;
  private final List<String> keyPatterns;

  /**
   * @param namespacesByCapability
   *          the namespaces each restricted capability is limited to
   * @param unrestrictedCapabilities
   *          capabilities with at least one grant that names no namespaces
   */
  EffectivePermissions(Set<String> capabilities,
      Map<String, Set<String>> namespacesByCapability,
      Set<String> unrestrictedCapabilities, List<ResourceRef> resources,
      List<String> keyPatterns) {
    this.capabilities = Collections.unmodifiableSet(capabilities);
    this.namespacesByCapability = namespacesByCapability;
    this.unrestrictedCapabilities = unrestrictedCapabilities;
    this.resources = Collections.unmodifiableList(resources);
    this.keyPatterns = Collections.unmodifiableList(keyPatterns);

    Set<String> all = new LinkedHashSet<String>();
    for (Set<String> ns : namespacesByCapability.values()) {
      all.addAll(ns);
    }
    this.namespaces = Collections.unmodifiableList(new ArrayList<String>(all));
  }

  public Set<String> getCapabilities() {
    return capabilities;
  }

  /**
   * The union of the namespaces named by the grants behind the effective
   * capabilities. Meaningless on its own if some capability is
   * unrestricted; use {@link #canAccessNamespace(String)} instead.
   */
  public List<String> getNamespaces() {
    return namespaces;
  }

  /** An empty list means no resource restriction. */
  public List<ResourceRef> getResources() {
    return resources;
  }

  /** An empty list means no key restriction. */
  public List<String> getKeyPatterns() {
    return keyPatterns;
  }

  public boolean hasCapability(String capability) {
    return capabilities.contains(capability);
  }

  /**
   * True if any effective capability reaches the namespace.
   */
  public boolean canAccessNamespace(String namespace) {
    if (!unrestrictedCapabilities.isEmpty()) {
      return true;
    }
    return namespaces.contains(namespace);
  }

  /**
   * True if this specific capability is effective and reaches the namespace.
   */
  public boolean canAccessNamespace(String capability, String namespace) {
    if (!capabilities.contains(capability)) {
      return false;
    }
    if (unrestrictedCapabilities.contains(capability)) {
      return true;
    }
    Set<String> ns = namespacesByCapability.get(capability);
    return ns != null && ns.contains(namespace);
  }

  public boolean canAccessResource(String type, String id) {
    if (resources.isEmpty()) {
      return true;
    }
    for (ResourceRef r : resources) {
      if (r.matches(type, id)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Matches the key against the collected key patterns: {@code *} covers
   * everything, a pattern ending in {@code *} covers keys with that prefix,
   * anything else must match exactly.
   */
  public boolean canAccessKey(String key) {
    if (keyPatterns.isEmpty()) {
      return true;
    }
    if (key == null || key.isEmpty()) {
      return false;
    }
    for (String pattern : keyPatterns) {
      if (WILDCARD.equals(pattern) || pattern.equals(key)) {
        return true;
      }
      if (pattern.endsWith(WILDCARD)
          && key.startsWith(pattern.substring(0, pattern.length() - 1))) {
        return true;
      }
    }
    return false;
  }
}
