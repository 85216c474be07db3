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

import static com.google.belay.authz.token.TokenRejectedException.Reason.MALFORMED;
import static com.google.belay.authz.token.TokenRejectedException.Reason.SIGNATURE_MISMATCH;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.DecodeException;
import com.google.belay.authz.codec.HmacSigner;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;

/**
 * The original V1 format: base64url encoded JSON of the form
 *
 * <pre>
 * {"l": resourceId, "g": gateway, "p": ["r", "w"], "a": authorId,
 *  "e": expiresAt, "s": signature}
 * </pre>
 *
 * {@code s} is the base64url of the full HMAC over the compact JSON of the
 * remaining members, in the order they were written. New V1 tokens are never
 * issued.
 */
final class JsonTokenFormat {

  /** Every base64url encoding of a JSON object starts with this. */
  static final String PREFIX = "ey";

  private static final String SIGNATURE = "s";

  private JsonTokenFormat() {
    // purely static class
  }

  static boolean matches(String token) {
    return token.startsWith(PREFIX);
  }

  static VerifiedResourceToken decode(String token, String secret,
      ResourceKind kind) throws TokenRejectedException {
    JsonObject json = parse(token);

    JsonElement sig = json.remove(SIGNATURE);
    if (sig == null || !sig.isJsonPrimitive()) {
      throw new TokenRejectedException(MALFORMED, "V1 token is unsigned");
    }
    String expected = ByteCodec.base64UrlEncode(
        HmacSigner.sign(ByteCodec.utf8(json.toString()), secret));
    if (!HmacSigner.constantTimeEquals(expected, sig.getAsString())) {
      throw new TokenRejectedException(SIGNATURE_MISMATCH,
          "V1 signature mismatch");
    }

    List<Permission> permissions = new ArrayList<Permission>();
    JsonElement p = json.get("p");
    if (p == null || !p.isJsonArray()) {
      throw new TokenRejectedException(MALFORMED,
          "V1 token has no permission list");
    }
    for (JsonElement e : p.getAsJsonArray()) {
      if (!e.isJsonPrimitive()) {
        throw new TokenRejectedException(MALFORMED,
            "V1 token has a malformed permission " + e);
      }
      Permission perm = "r".equals(e.getAsString()) ? Permission.READ
          : Permission.APPEND;
      if (!permissions.contains(perm)) {
        permissions.add(perm);
      }
    }
    return new VerifiedResourceToken(TokenFormat.V1_JSON, kind,
        requireString(json, "l"), permissions, requireString(json, "a"),
        requireLong(json, "e"));
  }

  private static String requireString(JsonObject json, String member)
      throws TokenRejectedException {
    JsonElement e = json.get(member);
    if (e == null || !e.isJsonPrimitive()) {
      throw new TokenRejectedException(MALFORMED, String.format(
          "V1 token member '%s' is missing or not a string", member));
    }
    return e.getAsString();
  }

  private static long requireLong(JsonObject json, String member)
      throws TokenRejectedException {
    JsonElement e = json.get(member);
    if (e == null || !e.isJsonPrimitive()
        || !e.getAsJsonPrimitive().isNumber()) {
      throw new TokenRejectedException(MALFORMED, String.format(
          "V1 token member '%s' is missing or not a number", member));
    }
    try {
      return e.getAsLong();
    } catch (NumberFormatException ex) {
      throw new TokenRejectedException(MALFORMED, String.format(
          "V1 token member '%s' is not an integer", member), ex);
    }
  }

  static String parseResourceId(String token) throws TokenRejectedException {
    JsonElement l = parse(token).get("l");
    if (l == null || !l.isJsonPrimitive()) {
      throw new TokenRejectedException(MALFORMED,
          "V1 token has no resource id");
    }
    return l.getAsString();
  }

  private static JsonObject parse(String token) throws TokenRejectedException {
    try {
      JsonElement root = JsonParser.parseString(
          ByteCodec.base64UrlDecodeToString(token));
      if (!root.isJsonObject()) {
        throw new TokenRejectedException(MALFORMED,
            "V1 token is not a JSON object");
      }
      return root.getAsJsonObject();
    } catch (DecodeException e) {
      throw new TokenRejectedException(MALFORMED, "V1 token is not base64url",
          e);
    } catch (JsonParseException e) {
      throw new TokenRejectedException(MALFORMED, "V1 token is not JSON", e);
    }
  }
}
