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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Resource-generic permission bits carried in the one byte permission field
 * of channel and log tokens.
 */
public enum Permission {

  READ(0x01, "read"),
  APPEND(0x02, "append"),
  READ_DELETED(0x04, "read:deleted"),
  DELETE_OWN(0x08, "delete:own"),
  DELETE_ANY(0x10, "delete:any");

  /** Name accepted as an alias of {@link #APPEND}, used by old clients. */
  public static final String LEGACY_WRITE = "write";

  private final int bit;
  private final String wireName;

  Permission(int bit, String wireName) {
    this.bit = bit;
    this.wireName = wireName;
  }

  public int getBit() {
    return bit;
  }

  public String getWireName() {
    return wireName;
  }

  /**
   * READ and APPEND are the only bits the V2 and V3 formats were designed
   * for; anything else forces the V4 format.
   */
  public boolean isLegacy() {
    return this == READ || this == APPEND;
  }

  /**
   * @throws IllegalArgumentException
   *           if the name is not a known permission
   */
  public static Permission fromName(String name) {
    if (LEGACY_WRITE.equals(name)) {
      return APPEND;
    }
    for (Permission p : values()) {
      if (p.wireName.equals(name)) {
        return p;
      }
    }
    throw new IllegalArgumentException(String.format(
        "unknown permission '%s'", name));
  }

  public static List<Permission> fromNames(Collection<String> names) {
    List<Permission> out = new ArrayList<Permission>();
    for (String name : names) {
      Permission p = fromName(name);
      if (!out.contains(p)) {
        out.add(p);
      }
    }
    return out;
  }

  public static int toBitmap(Collection<Permission> permissions) {
    int bitmap = 0;
    for (Permission p : permissions) {
      bitmap |= p.bit;
    }
    return bitmap;
  }

  /**
   * Expands a bitmap into permissions in bit order. Unassigned bits are
   * ignored.
   */
  public static List<Permission> fromBitmap(int bitmap) {
    List<Permission> out = new ArrayList<Permission>();
    for (Permission p : values()) {
      if ((bitmap & p.bit) != 0) {
        out.add(p);
      }
    }
    return Collections.unmodifiableList(out);
  }

  public static List<String> toNames(Collection<Permission> permissions) {
    List<String> out = new ArrayList<String>();
    for (Permission p : permissions) {
      out.add(p.wireName);
    }
    return out;
  }
}
