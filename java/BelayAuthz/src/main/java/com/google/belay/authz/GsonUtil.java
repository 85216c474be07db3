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

package com.google.belay.authz;

import com.google.belay.authz.stateful.StatefulToken;
import com.google.belay.authz.stateful.StatefulTokenAdapter;
import com.google.gson.ExclusionStrategy;
import com.google.gson.FieldAttributes;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.time.Instant;

/**
 * Utility class to help with JSON serialization/deserialization using the Gson
 * library, with the adapters for authz specific types installed.
 */
public class GsonUtil {

  private static final Gson GSON = getGsonBuilder().create();

  private static final Gson CLIENT_GSON = getGsonBuilder()
      .setExclusionStrategies(new ExclusionStrategy() {

        @Override
        public boolean shouldSkipField(FieldAttributes attrs) {
          return attrs.getAnnotation(HideFromClient.class) != null;
        }

        @Override
        public boolean shouldSkipClass(Class<?> cls) {
          return false;
        }
      }).create();

  private GsonUtil() {
    // purely static class
  }

  public static GsonBuilder getGsonBuilder() {
    GsonBuilder gb = new GsonBuilder();
    gb.registerTypeAdapter(Instant.class, new InstantAdapter());
    gb.registerTypeHierarchyAdapter(StatefulToken.class,
        new StatefulTokenAdapter());
    // stored and signed JSON must match what other gateway implementations
    // produce, which do not escape '<', '>', '=' and friends
    gb.disableHtmlEscaping();
    return gb;
  }

  /**
   * The instance used for storage records and token payloads. Writes every
   * field.
   */
  public static Gson getGson() {
    return GSON;
  }

  /**
   * The instance used for anything shown to a client. Fields annotated with
   * {@link HideFromClient} are left out.
   */
  public static Gson getClientGson() {
    return CLIENT_GSON;
  }
}
