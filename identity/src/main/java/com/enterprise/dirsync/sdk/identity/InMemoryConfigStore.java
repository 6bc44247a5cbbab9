/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.enterprise.dirsync.sdk.identity;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/** Thread-safe {@link ConfigStore} held in memory. */
public class InMemoryConfigStore implements ConfigStore {
  private final ConcurrentMap<String, DirectoryConfig> configs = new ConcurrentHashMap<>();
  private final AtomicReference<String> activeId = new AtomicReference<>();

  @Override
  public Optional<DirectoryConfig> getActiveConfig() {
    String id = activeId.get();
    return id == null ? Optional.empty() : Optional.ofNullable(configs.get(id));
  }

  @Override
  public synchronized DirectoryConfig saveConfig(DirectoryConfig config) {
    checkNotNull(config, "config can not be null");
    String id = config.getId().orElse(UUID.randomUUID().toString());
    DirectoryConfig.Builder builder = config.toBuilder().setId(id);
    DirectoryConfig current = configs.get(id);
    if (current != null) {
      // sync fields of a stored record change only through updateSyncStatus
      builder
          .setSyncStatus(current.getSyncStatus())
          .setLastSyncTime(current.getLastSyncTime().orElse(null));
    }
    DirectoryConfig stored = builder.build();
    configs.put(id, stored);
    activeId.set(id);
    return stored;
  }

  @Override
  public synchronized void updateSyncStatus(
      String configId, SyncStatus status, @Nullable Instant lastSyncTime) throws IOException {
    checkNotNull(status, "status can not be null");
    DirectoryConfig current = configs.get(Strings.nullToEmpty(configId));
    if (current == null) {
      throw new IOException("Unknown configuration " + configId);
    }
    DirectoryConfig.Builder updated = current.toBuilder().setSyncStatus(status);
    if (lastSyncTime != null) {
      updated.setLastSyncTime(lastSyncTime);
    }
    configs.put(configId, updated.build());
  }
}
