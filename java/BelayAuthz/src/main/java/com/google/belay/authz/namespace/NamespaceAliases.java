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

package com.google.belay.authz.namespace;

import com.google.belay.authz.codec.ByteCodec;
import com.google.belay.authz.codec.Digests;
import com.google.belay.authz.kv.KeyValueStore;
import com.google.belay.authz.kv.StorageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Short, stable aliases for the long namespace names derived from app
 * origins, so that URLs stay readable. Both forms keep working: a full
 * namespace resolves to itself, an alias through the mapping stored in the
 * {@link KeyValueStore}:
 *
 * <pre>
 * __NS_ALIAS:{alias}     -&gt; namespace
 * __NS_FULL:{namespace}  -&gt; alias
 * </pre>
 */
public class NamespaceAliases {

  private static final Logger log =
      LoggerFactory.getLogger(NamespaceAliases.class);

  public static final String ALIAS_PREFIX = "__NS_ALIAS:";
  public static final String FULL_PREFIX = "__NS_FULL:";
  public static final int ALIAS_LENGTH = 8;

  private static final String ORIGIN_NAMESPACE_PREFIX = "origin_";
  private static final int MIN_FULL_LENGTH = 40;
  private static final int SUFFIX_LENGTH = 2;

  private final KeyValueStore store;
  private final Random random;

  public NamespaceAliases(KeyValueStore store) {
    this(store, new SecureRandom());
  }

  public NamespaceAliases(KeyValueStore store, Random random) {
    if (store == null || random == null) {
      throw new IllegalArgumentException("store and random are required");
    }
    this.store = store;
    this.random = random;
  }

  /**
   * The last eight characters of the base64url SHA-256 of the namespace.
   */
  public static String generateAlias(String namespace) {
    String hash = ByteCodec.base64UrlEncode(
        Digests.sha256(ByteCodec.utf8(namespace)));
    return hash.substring(hash.length() - ALIAS_LENGTH);
  }

  public static boolean isFullNamespace(String value) {
    return value.startsWith(ORIGIN_NAMESPACE_PREFIX)
        && value.length() > MIN_FULL_LENGTH;
  }

  /**
   * @return the full namespace, or {@code null} if {@code namespaceOrAlias}
   *         is neither a full namespace nor a known alias
   */
  public String resolveNamespace(String namespaceOrAlias)
      throws StorageException {
    if (isFullNamespace(namespaceOrAlias)) {
      return namespaceOrAlias;
    }
    return store.get(ALIAS_PREFIX + namespaceOrAlias);
  }

  /**
   * @return the stored alias, or {@code null} if none was created yet
   */
  public String getAlias(String namespace) throws StorageException {
    return store.get(FULL_PREFIX + namespace);
  }

  /**
   * Returns the existing alias for the namespace, or derives and stores one.
   * If the derived alias already belongs to another namespace a random two
   * character suffix is appended.
   */
  public String getOrCreateAlias(String namespace) throws StorageException {
    String existing = getAlias(namespace);
    if (existing != null) {
      return existing;
    }

    String alias = generateAlias(namespace);
    String owner = store.get(ALIAS_PREFIX + alias);
    if (owner != null && !owner.equals(namespace)) {
      String extended = alias + randomSuffix();
      log.warn("alias {} of {} is taken by {}, using {}", alias, namespace,
          owner, extended);
      alias = extended;
    }

    store.put(ALIAS_PREFIX + alias, namespace);
    store.put(FULL_PREFIX + namespace, alias);
    return alias;
  }

  private String randomSuffix() {
    StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      sb.append(Character.forDigit(random.nextInt(36), 36));
    }
    return sb.toString();
  }
}
