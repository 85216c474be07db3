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

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds and parses the URLs used to hand a stateful token to someone else.
 * Two forms exist:
 *
 * <pre>
 * {base}/claim?token={tokenId}&amp;gateway={url-encoded gateway}
 * {base}#{tokenId}@{base64 gateway}
 * </pre>
 *
 * The second keeps the token out of server logs and is short enough for QR
 * codes.
 */
public final class ShareUrls {

  private ShareUrls() {
    // purely static class
  }

  /**
   * @param baseUrl
   *          the application serving the claim page, or {@code null} to use
   *          the gateway itself
   */
  public static String buildShareUrl(String tokenId, String gatewayUrl,
      String baseUrl) {
    String base = baseUrl == null || baseUrl.isEmpty() ? gatewayUrl : baseUrl;
    return String.format("%s/claim?token=%s&gateway=%s", base, tokenId,
        encodeComponent(gatewayUrl));
  }

  public static String buildCompactShareUrl(String tokenId, String gatewayUrl,
      String baseUrl) {
    String encodedGateway = Base64.getEncoder().encodeToString(
        gatewayUrl.getBytes(StandardCharsets.UTF_8));
    return String.format("%s#%s@%s", baseUrl, tokenId, encodedGateway);
  }

  /**
   * @return the token and gateway, or {@code null} if the URL is not
   *         absolute, has no fragment of the form {@code tk_...@base64}, or
   *         the gateway part is not valid base64
   */
  public static ShareLink parseCompactShareUrl(String url) {
    if (url == null) {
      return null;
    }
    String fragment;
    try {
      URI uri = new URI(url);
      if (!uri.isAbsolute()) {
        return null;
      }
      fragment = uri.getRawFragment();
    } catch (URISyntaxException e) {
      return null;
    }
    if (fragment == null || fragment.isEmpty()) {
      return null;
    }

    String[] parts = fragment.split("@", -1);
    if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
      return null;
    }
    String tokenId = parts[0];
    if (!tokenId.startsWith(StatefulTokenStore.TOKEN_PREFIX)) {
      return null;
    }
    try {
      byte[] gateway = Base64.getDecoder().decode(parts[1]);
      return new ShareLink(tokenId, new String(gateway,
          StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * Percent-encodes a query component the way browsers'
   * {@code encodeURIComponent} does, which differs from form encoding in its
   * handling of spaces and of {@code ! ' ( ) ~}.
   */
  static String encodeComponent(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20").replace("%21", "!").replace("%27", "'")
        .replace("%28", "(").replace("%29", ")").replace("%7E", "~");
  }
}
