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

import com.google.common.base.MoreObjects;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;

/** Snapshot returned by {@link DirectoryAdminService#getStatus()}. */
public final class DirectoryStatus {
  private final boolean configured;
  private final boolean enabled;
  private final boolean syncEnabled;
  private final int syncIntervalSecs;
  private final Instant lastSyncTime;
  private final SyncStatus syncStatus;
  private final int totalUsers;
  private final int activeUsers;

  DirectoryStatus(
      boolean configured,
      boolean enabled,
      boolean syncEnabled,
      int syncIntervalSecs,
      @Nullable Instant lastSyncTime,
      SyncStatus syncStatus,
      int totalUsers,
      int activeUsers) {
    this.configured = configured;
    this.enabled = enabled;
    this.syncEnabled = syncEnabled;
    this.syncIntervalSecs = syncIntervalSecs;
    this.lastSyncTime = lastSyncTime;
    this.syncStatus = syncStatus;
    this.totalUsers = totalUsers;
    this.activeUsers = activeUsers;
  }

  static DirectoryStatus notConfigured() {
    return new DirectoryStatus(false, false, false, 0, null, SyncStatus.IDLE, 0, 0);
  }

  public boolean isConfigured() {
    return configured;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isSyncEnabled() {
    return syncEnabled;
  }

  public int getSyncIntervalSecs() {
    return syncIntervalSecs;
  }

  public Optional<Instant> getLastSyncTime() {
    return Optional.ofNullable(lastSyncTime);
  }

  public SyncStatus getSyncStatus() {
    return syncStatus;
  }

  public int getTotalUsers() {
    return totalUsers;
  }

  public int getActiveUsers() {
    return activeUsers;
  }

  public int getInactiveUsers() {
    return totalUsers - activeUsers;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("configured", configured)
        .add("enabled", enabled)
        .add("syncEnabled", syncEnabled)
        .add("syncIntervalSecs", syncIntervalSecs)
        .add("lastSyncTime", lastSyncTime)
        .add("syncStatus", syncStatus)
        .add("totalUsers", totalUsers)
        .add("activeUsers", activeUsers)
        .toString();
  }
}
