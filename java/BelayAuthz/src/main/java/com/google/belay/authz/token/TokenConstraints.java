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

/**
 * Optional limits carried by resource and share tokens. Only the limits that
 * are set take up space in the encoded token.
 *
 * <p>
 * A token with a use limit cannot be enforced from its bytes alone, so
 * decoding one sets {@link #requiresStateCheck()}; the caller must count uses
 * in its own storage.
 */
public class TokenConstraints {

  public static final int MAX_USES_LIMIT = 0xFFFF;
  public static final int MAX_DEPTH_LIMIT = 0xFF;

  private final Integer maxUses;
  private final boolean canDelegate;
  private final Integer maxDelegationDepth;
  private final boolean requiresStateCheck;

  private TokenConstraints(Integer maxUses, boolean canDelegate,
      Integer maxDelegationDepth, boolean requiresStateCheck) {
    this.maxUses = maxUses;
    this.canDelegate = canDelegate;
    this.maxDelegationDepth = maxDelegationDepth;
    this.requiresStateCheck = requiresStateCheck;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** May be {@code null}, meaning unlimited. */
  public Integer getMaxUses() {
    return maxUses;
  }

  public boolean canDelegate() {
    return canDelegate;
  }

  /** May be {@code null}, meaning unlimited. */
  public Integer getMaxDelegationDepth() {
    return maxDelegationDepth;
  }

  public boolean requiresStateCheck() {
    return requiresStateCheck;
  }

  public boolean isEmpty() {
    return maxUses == null && !canDelegate && maxDelegationDepth == null;
  }

  public static class Builder {

    private Integer maxUses;
    private boolean canDelegate;
    private Integer maxDelegationDepth;
    private boolean requiresStateCheck;

    Builder() {
    }

    public Builder maxUses(int maxUses) {
      this.maxUses = maxUses;
      return this;
    }

    public Builder canDelegate(boolean canDelegate) {
      this.canDelegate = canDelegate;
      return this;
    }

    public Builder maxDelegationDepth(int maxDelegationDepth) {
      this.maxDelegationDepth = maxDelegationDepth;
      return this;
    }

    Builder requiresStateCheck(boolean requiresStateCheck) {
      this.requiresStateCheck = requiresStateCheck;
      return this;
    }

    /**
     * @throws IllegalArgumentException
     *           if a value does not fit its field in the token
     */
    public TokenConstraints build() {
      if (maxUses != null && (maxUses < 0 || maxUses > MAX_USES_LIMIT)) {
        throw new IllegalArgumentException(String.format(
            "maxUses %d is outside 0..%d", maxUses, MAX_USES_LIMIT));
      }
      if (maxDelegationDepth != null
          && (maxDelegationDepth < 0 || maxDelegationDepth > MAX_DEPTH_LIMIT)) {
        throw new IllegalArgumentException(String.format(
            "maxDelegationDepth %d is outside 0..%d", maxDelegationDepth,
            MAX_DEPTH_LIMIT));
      }
      return new TokenConstraints(maxUses, canDelegate, maxDelegationDepth,
          requiresStateCheck);
    }
  }
}
