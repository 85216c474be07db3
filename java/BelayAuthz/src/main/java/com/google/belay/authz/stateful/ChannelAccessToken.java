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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gives access to a channel with the listed permissions.
 */
public class ChannelAccessToken extends StatefulToken {

  private final String channelId;
  private final List<String> permissions;

  public ChannelAccessToken(String id, Instant createdAt, Instant expiresAt,
      String createdBy, String label, String channelId,
      List<String> permissions) {
    super(id, TokenAction.CHANNEL_ACCESS, createdAt, expiresAt, createdBy,
        label);
    this.channelId = channelId;
    this.permissions = Collections.unmodifiableList(
        new ArrayList<String>(permissions));
  }

  public String getChannelId() {
    return channelId;
  }

  /** For example {@code ["read", "append"]}. */
  public List<String> getPermissions() {
    return permissions;
  }

  @Override
  public ChannelAccessToken copy() {
    ChannelAccessToken t = new ChannelAccessToken(getId(), getCreatedAt(),
        getExpiresAt(), getCreatedBy(), getLabel(), channelId, permissions);
    t.copyStateFrom(this);
    return t;
  }
}
