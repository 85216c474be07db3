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

package com.google.belay.authz.stateful;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gson adapter for the stored form of {@link StatefulToken} records:
 *
 * <pre>
 * {"id": "tk_...", "action": "identity:claim", "createdAt": "...",
 *  "expiresAt": "...", "createdBy": "...", "label": "...",
 *  "usedAt": "...", "usedBy": "...", "revoked": true, "revokedAt": "...",
 *  "revokedReason": "...", "payload": {...}}
 * </pre>
 *
 * The {@code action} member decides which subclass the {@code payload} is
 * read into. Timestamps go through the context so that the registered
 * {@code Instant} adapter is used.
 */
public class StatefulTokenAdapter implements JsonSerializer<StatefulToken>,
    JsonDeserializer<StatefulToken> {

  @Override
  public StatefulToken deserialize(JsonElement elem, Type typeOfT,
      JsonDeserializationContext context) throws JsonParseException {
    if (!elem.isJsonObject()) {
      throw new JsonParseException("token record is not an object");
    }
    JsonObject obj = elem.getAsJsonObject();

    String id = requiredString(obj, "id");
    String actionName = requiredString(obj, "action");
    TokenAction action = TokenAction.fromWireName(actionName);
    if (action == null) {
      throw new JsonParseException(String.format(
          "unknown token action '%s'", actionName));
    }
    Instant createdAt = requiredInstant(obj, "createdAt", context);
    Instant expiresAt = requiredInstant(obj, "expiresAt", context);
    String createdBy = optionalString(obj, "createdBy");
    String label = optionalString(obj, "label");

    JsonObject payload = obj.has("payload") && obj.get("payload").isJsonObject()
        ? obj.getAsJsonObject("payload") : new JsonObject();

    StatefulToken token;
    switch (action) {
      case IDENTITY_CLAIM:
        token = new IdentityClaimToken(id, createdAt, expiresAt, createdBy,
            label, optionalString(payload, "identityId"));
        break;
      case BLOB_ACCESS:
        token = new BlobAccessToken(id, createdAt, expiresAt, createdBy, label,
            optionalString(payload, "namespace"),
            optionalString(payload, "blobKey"),
            stringList(payload, "permissions"));
        break;
      default:
        token = new ChannelAccessToken(id, createdAt, expiresAt, createdBy,
            label, optionalString(payload, "channelId"),
            stringList(payload, "permissions"));
        break;
    }

    Instant usedAt = optionalInstant(obj, "usedAt", context);
    if (usedAt != null) {
      token.markUsed(usedAt, optionalString(obj, "usedBy"));
    }
    JsonElement revoked = obj.get("revoked");
    if (revoked != null && revoked.isJsonPrimitive()
        && revoked.getAsBoolean()) {
      token.markRevoked(optionalInstant(obj, "revokedAt", context),
          optionalString(obj, "revokedReason"));
    }
    return token;
  }

  @Override
  public JsonElement serialize(StatefulToken token, Type typeOfSrc,
      JsonSerializationContext context) {
    JsonObject obj = new JsonObject();
    obj.addProperty("id", token.getId());
    obj.addProperty("action", token.getAction().getWireName());
    obj.add("createdAt", context.serialize(token.getCreatedAt(),
        Instant.class));
    obj.add("expiresAt", context.serialize(token.getExpiresAt(),
        Instant.class));
    addIfPresent(obj, "createdBy", token.getCreatedBy());
    addIfPresent(obj, "label", token.getLabel());
    if (token.getUsedAt() != null) {
      obj.add("usedAt", context.serialize(token.getUsedAt(), Instant.class));
      addIfPresent(obj, "usedBy", token.getUsedBy());
    }
    if (token.isRevoked()) {
      obj.addProperty("revoked", true);
      if (token.getRevokedAt() != null) {
        obj.add("revokedAt", context.serialize(token.getRevokedAt(),
            Instant.class));
      }
      addIfPresent(obj, "revokedReason", token.getRevokedReason());
    }

    JsonObject payload = new JsonObject();
    if (token instanceof IdentityClaimToken) {
      addIfPresent(payload, "identityId",
          ((IdentityClaimToken) token).getIdentityId());
    } else if (token instanceof BlobAccessToken) {
      BlobAccessToken blob = (BlobAccessToken) token;
      addIfPresent(payload, "namespace", blob.getNamespace());
      addIfPresent(payload, "blobKey", blob.getBlobKey());
      payload.add("permissions", toArray(blob.getPermissions()));
    } else if (token instanceof ChannelAccessToken) {
      ChannelAccessToken channel = (ChannelAccessToken) token;
      addIfPresent(payload, "channelId", channel.getChannelId());
      payload.add("permissions", toArray(channel.getPermissions()));
    }
    obj.add("payload", payload);
    return obj;
  }

  private static String requiredString(JsonObject obj, String name) {
    String value = optionalString(obj, name);
    if (value == null || value.isEmpty()) {
      throw new JsonParseException(String.format(
          "token record is missing '%s'", name));
    }
    return value;
  }

  private static String optionalString(JsonObject obj, String name) {
    JsonElement e = obj.get(name);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    if (!e.isJsonPrimitive()) {
      throw new JsonParseException(String.format(
          "'%s' is not a string", name));
    }
    return e.getAsString();
  }

  private static Instant requiredInstant(JsonObject obj, String name,
      JsonDeserializationContext context) {
    Instant value = optionalInstant(obj, name, context);
    if (value == null) {
      throw new JsonParseException(String.format(
          "token record is missing '%s'", name));
    }
    return value;
  }

  private static Instant optionalInstant(JsonObject obj, String name,
      JsonDeserializationContext context) {
    JsonElement e = obj.get(name);
    if (e == null || e.isJsonNull()) {
      return null;
    }
    return context.deserialize(e, Instant.class);
  }

  private static List<String> stringList(JsonObject obj, String name) {
    List<String> out = new ArrayList<String>();
    JsonElement e = obj.get(name);
    if (e == null || e.isJsonNull()) {
      return out;
    }
    if (!e.isJsonArray()) {
      throw new JsonParseException(String.format(
          "'%s' is not an array", name));
    }
    for (JsonElement item : e.getAsJsonArray()) {
      if (!item.isJsonPrimitive()) {
        throw new JsonParseException(String.format(
            "'%s' may only contain strings", name));
      }
      out.add(item.getAsString());
    }
    return out;
  }

  private static void addIfPresent(JsonObject obj, String name, String value) {
    if (value != null) {
      obj.add(name, new JsonPrimitive(value));
    }
  }

  private static JsonArray toArray(List<String> values) {
    JsonArray array = new JsonArray();
    for (String v : values) {
      array.add(v);
    }
    return array;
  }
}
