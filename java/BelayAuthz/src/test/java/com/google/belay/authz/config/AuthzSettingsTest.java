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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

public class AuthzSettingsTest {

  private static ConfigSource source(String expiry) {
    Properties props = new Properties();
    if (expiry != null) {
      props.setProperty(AuthzSettings.STATEFUL_TOKEN_EXPIRY_PARAM, expiry);
    }
    return new PropertiesConfigSource("test", props);
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals(Duration.ofDays(7),
        AuthzSettings.fromConfig(source(null)).getStatefulTokenExpiry());
  }

  @Test
  public void testStatefulTokenExpiry() throws Exception {
    assertEquals(Duration.ofSeconds(90),
        AuthzSettings.fromConfig(source(" 90 ")).getStatefulTokenExpiry());
  }

  @Test(expected = ConfigurationException.class)
  public void testStatefulTokenExpiry_notANumber() throws Exception {
    AuthzSettings.fromConfig(source("one week"));
  }

  @Test(expected = ConfigurationException.class)
  public void testStatefulTokenExpiry_notPositive() throws Exception {
    AuthzSettings.fromConfig(source("0"));
  }
}
