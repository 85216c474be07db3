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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One resource a scoped credential may touch, with what it may do there.
 */
public class ResourceScope {

  private final String type;
  private final String id;
  private final List<String> permissions;

  public ResourceScope(String type, String id, List<String> permissions) {
    this.type = type;
    this.id = id;
    this.permissions = permissions == null
        ? Collections.<String> emptyList()
        : Collections.unmodifiableList(new ArrayList<String>(permissions));
  }

  public String getType() {
    return type;
  }

  public String getId() {
    return id;
  }

  public List<String> getPermissions() {
    return permissions;
  }
}
