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

import java.util.regex.Pattern;

/**
 * Derives the storage namespace of an app from its origin, for example
 * {@code https://www.example-app.com} becomes {@code www_example-app_com}
 * and {@code http://localhost:5174} becomes {@code localhost_5174}.
 */
public final class Namespaces {

  private static final Pattern SCHEME = Pattern.compile("^https?://");
  private static final Pattern TRAILING_SLASH = Pattern.compile("/$");
  private static final Pattern SEPARATORS = Pattern.compile("[.:]");
  private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9_-]");

  private Namespaces() {
    // purely static class
  }

  public static String fromOrigin(String origin) {
    String ns = SCHEME.matcher(origin).replaceFirst("");
    ns = TRAILING_SLASH.matcher(ns).replaceFirst("");
    ns = SEPARATORS.matcher(ns).replaceAll("_");
    return DISALLOWED.matcher(ns).replaceAll("");
  }
}
