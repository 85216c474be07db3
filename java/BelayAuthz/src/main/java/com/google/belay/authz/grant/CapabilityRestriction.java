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

import java.util.List;

/**
 * Something that can narrow the capabilities an identity's grants give it,
 * such as the scope of the credential used or the claims of the token
 * presented.
 */
public interface CapabilityRestriction {

  /**
   * @return the capabilities allowed through, or {@code null} to allow all
   */
  List<String> getCapabilities();
}
