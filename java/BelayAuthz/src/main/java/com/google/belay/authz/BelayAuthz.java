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

import com.google.belay.authz.config.AuthzSettings;
import com.google.belay.authz.config.ConfigSource;
import com.google.belay.authz.config.ConfigurationException;
import com.google.belay.authz.config.KeyValueStoreLoader;
import com.google.belay.authz.config.PropertiesConfigSource;
import com.google.belay.authz.credential.CredentialStore;
import com.google.belay.authz.grant.GrantResolver;
import com.google.belay.authz.identity.IdentityRegistry;
import com.google.belay.authz.kv.KeyValueStore;
import com.google.belay.authz.namespace.NamespaceAliases;
import com.google.belay.authz.stateful.StatefulTokenStore;
import com.google.belay.authz.token.ResourceTokenCodec;
import com.google.belay.authz.token.UnifiedTokenCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Holds one instance of every authz component, all sharing the same clock
 * and key-value store.
 */
public class BelayAuthz {

  private static final Logger log = LoggerFactory.getLogger(BelayAuthz.class);

  private final KeyValueStore store;
  private final ResourceTokenCodec channelTokens;
  private final ResourceTokenCodec logTokens;
  private final UnifiedTokenCodec unifiedTokens;
  private final IdentityRegistry identities;
  private final CredentialStore credentials;
  private final GrantResolver grants;
  private final StatefulTokenStore statefulTokens;
  private final NamespaceAliases namespaceAliases;

  public BelayAuthz(KeyValueStore store, Clock clock, AuthzSettings settings) {
    if (store == null || clock == null || settings == null) {
      throw new IllegalArgumentException(
          "store, clock and settings are all required");
    }
    this.store = store;
    this.channelTokens = ResourceTokenCodec.forChannels(clock);
    this.logTokens = ResourceTokenCodec.forLogs(clock);
    this.unifiedTokens = new UnifiedTokenCodec(clock);
    this.identities = new IdentityRegistry(clock);
    this.credentials = new CredentialStore(clock);
    this.grants = new GrantResolver(clock);
    this.statefulTokens = new StatefulTokenStore(store, clock,
        settings.getStatefulTokenExpiry());
    this.namespaceAliases = new NamespaceAliases(store);
  }

  /**
   * Builds every component from a configuration naming the
   * {@link KeyValueStore} implementation to use.
   */
  public static BelayAuthz fromConfig(ConfigSource cfg, Clock clock)
      throws ConfigurationException {
    KeyValueStore store = KeyValueStoreLoader.load(cfg);
    AuthzSettings settings = AuthzSettings.fromConfig(cfg);
    log.info("authz wired from {}: store={}, stateful token expiry={}",
        cfg.getName(), store.getClass().getName(),
        settings.getStatefulTokenExpiry());
    return new BelayAuthz(store, clock, settings);
  }

  /**
   * Reads {@value AuthzSettings#RESOURCE_NAME} from the classpath and uses
   * the system UTC clock.
   */
  public static BelayAuthz fromClasspath() throws ConfigurationException {
    return fromConfig(PropertiesConfigSource.fromClasspath(
        AuthzSettings.RESOURCE_NAME, null), Clock.systemUTC());
  }

  public KeyValueStore getStore() {
    return store;
  }

  public ResourceTokenCodec getChannelTokens() {
    return channelTokens;
  }

  public ResourceTokenCodec getLogTokens() {
    return logTokens;
  }

  public UnifiedTokenCodec getUnifiedTokens() {
    return unifiedTokens;
  }

  public IdentityRegistry getIdentities() {
    return identities;
  }

  public CredentialStore getCredentials() {
    return credentials;
  }

  public GrantResolver getGrants() {
    return grants;
  }

  public StatefulTokenStore getStatefulTokens() {
    return statefulTokens;
  }

  public NamespaceAliases getNamespaceAliases() {
    return namespaceAliases;
  }
}
