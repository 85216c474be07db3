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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Permission bits of the 16 bit unified token permission field. The low
 * byte holds these common permissions; the high byte is left for
 * resource-specific ones.
 */
public enum UnifiedPermission {

  READ(0x01),
  WRITE(0x02),
  DELETE(0x04),
  LIST(0x08),
  ADMIN(0x10),
  SHARE(0x20),
  DELEGATE(0x40);

  public static final int MAX_BITMAP = 0xFFFF;

  private final int bit;

  UnifiedPermission(int bit) {
    this.bit = bit;
  }

  public int getBit() {
    return bit;
  }

  public boolean isSetIn(int bitmap) {
    return (bitmap & bit) != 0;
  }

  public static int toBitmap(Collection<UnifiedPermission> permissions) {
    int bitmap = 0;
    for (UnifiedPermission p : permissions) {
      bitmap |= p.bit;
    }
    return bitmap;
  }

  public static int toBitmap(UnifiedPermission... permissions) {
    int bitmap = 0;
    for (UnifiedPermission p : permissions) {
      bitmap |= p.bit;
    }
    return bitmap;
  }

  /** Unassigned and resource-specific bits are not represented. */
  public static Set<UnifiedPermission> fromBitmap(int bitmap) {
    Set<UnifiedPermission> out = EnumSet.noneOf(UnifiedPermission.class);
    for (UnifiedPermission p : values()) {
      if (p.isSetIn(bitmap)) {
        out.add(p);
      }
    }
    return out;
  }
}
