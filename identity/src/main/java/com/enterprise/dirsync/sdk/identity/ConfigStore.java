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

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;

/** Persistence of {@link DirectoryConfig} records. */
public interface ConfigStore {

  /** The single active configuration, if any. */
  Optional<DirectoryConfig> getActiveConfig() throws IOException;

  /**
   * Saves {@code config} and makes it the active configuration. A configuration without an id is
   * assigned one. Saving over an existing record keeps its stored sync status and last sync
   * time; those change only through {@link #updateSyncStatus}.
   *
   * @return the stored configuration
   */
  DirectoryConfig saveConfig(DirectoryConfig config) throws IOException;

  /**
   * Records the sync status of a configuration. Only {@link DirectorySyncEngine} calls this.
   *
   * @param configId configuration id
   * @param status new status
   * @param lastSyncTime completion time of a successful pass, or {@code null} to keep the
   *     previous value
   */
  void updateSyncStatus(String configId, SyncStatus status, @Nullable Instant lastSyncTime)
      throws IOException;
}
