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

package com.google.belay.authz.config;

import java.time.Duration;

/**
 * Tunable values of the authz core, read from a {@link ConfigSource}:
 *
 * <pre>
 * StatefulTokenExpirySeconds  default lifetime of stateful tokens (7 days)
 * </pre>
 */
public class AuthzSettings {

  public static final String RESOURCE_NAME = "belay-authz.properties";

  public static final String STATEFUL_TOKEN_EXPIRY_PARAM =
      "StatefulTokenExpirySeconds";

  public static final Duration DEFAULT_STATEFUL_TOKEN_EXPIRY =
      Duration.ofDays(7);

  private final Duration statefulTokenExpiry;

  public AuthzSettings(Duration statefulTokenExpiry) {
    this.statefulTokenExpiry = statefulTokenExpiry;
  }

  public static AuthzSettings defaults() {
    return new AuthzSettings(DEFAULT_STATEFUL_TOKEN_EXPIRY);
  }

  /**
   * @throws ConfigurationException
   *           if a parameter is set but is not a valid value
   */
  public static AuthzSettings fromConfig(ConfigSource cfg)
      throws ConfigurationException {
    Duration expiry = DEFAULT_STATEFUL_TOKEN_EXPIRY;
    String raw = cfg.getParameter(STATEFUL_TOKEN_EXPIRY_PARAM);
    if (raw != null && !raw.trim().isEmpty()) {
      long seconds;
      try {
        seconds = Long.parseLong(raw.trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException(String.format(
            "parameter %s of configuration %s is not a number: '%s'",
            STATEFUL_TOKEN_EXPIRY_PARAM, cfg.getName(), raw), e);
      }
      if (seconds <= 0) {
        throw new ConfigurationException(String.format(
            "parameter %s of configuration %s must be positive, was %d",
            STATEFUL_TOKEN_EXPIRY_PARAM, cfg.getName(), seconds));
      }
      expiry = Duration.ofSeconds(seconds);
    }
    return new AuthzSettings(expiry);
  }

  public Duration getStatefulTokenExpiry() {
    return statefulTokenExpiry;
  }
}
