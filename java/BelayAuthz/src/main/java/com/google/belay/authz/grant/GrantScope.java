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
import java.util.List;

/**
 * Where a grant applies. A {@code null} list means no restriction of that
 * kind; in particular a grant without namespaces opens every namespace for
 * its capability.
 */
public class GrantScope {

  private final List<String> namespaces;
  private final List<ResourceRef> resources;
  private final List<String> keyPatterns;

  public GrantScope(List<String> namespaces, List<ResourceRef> resources,
      List<String> keyPatterns) {
    this.namespaces = copyOrNull(namespaces);
    this.resources = copyOrNull(resources);
    this.keyPatterns = copyOrNull(keyPatterns);
  }

  public static GrantScope ofNamespaces(String... namespaces) {
    List<String> ns = new ArrayList<String>();
    Collections.addAll(ns, namespaces);
    return new GrantScope(ns, null, null);
  }

  private static <T> List<T> copyOrNull(List<T> list) {
    return list == null ? null
        : Collections.unmodifiableList(new ArrayList<T>(list));
  }

  public List<String> getNamespaces() {
    return namespaces;
  }

  public List<ResourceRef> getResources() {
    return resources;
  }

  /**
   * Key patterns are exact keys or prefixes ending in {@code *}; a lone
   * {@code *} matches every key.
   */
  public List<String> getKeyPatterns() {
    return keyPatterns;
  }
}
