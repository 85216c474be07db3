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

import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import java.lang.reflect.Type;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Gson adapter writing {@link Instant} values as ISO-8601 strings such as
 * {@code 2024-01-01T00:00:00Z}.
 */
public class InstantAdapter implements JsonSerializer<Instant>,
    JsonDeserializer<Instant> {

  @Override
  public Instant deserialize(JsonElement elem, Type typeOfT,
      JsonDeserializationContext context) throws JsonParseException {
    if (!elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isString()) {
      throw new JsonParseException("timestamp is not a string");
    }
    try {
      return Instant.parse(elem.getAsString());
    } catch (DateTimeParseException e) {
      throw new JsonParseException(String.format(
          "'%s' is not an ISO-8601 timestamp", elem.getAsString()), e);
    }
  }

  @Override
  public JsonElement serialize(Instant instant, Type typeOfSrc,
      JsonSerializationContext context) {
    return new JsonPrimitive(instant.toString());
  }
}
