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

import com.google.common.base.MoreObjects;

/**
 * Outcome of {@link DirectorySyncEngine#syncUsers()}.
 *
 * <p>A skipped pass did not run at all, either because sync is not configured or because another
 * pass for the same configuration was in flight. It is never successful.
 */
public final class SyncResult {
  private final boolean success;
  private final boolean skipped;
  private final SyncStats stats;

  private SyncResult(boolean success, boolean skipped, SyncStats stats) {
    this.success = success;
    this.skipped = skipped;
    this.stats = checkNotNull(stats);
  }

  static SyncResult completed(SyncStats stats) {
    return new SyncResult(true, false, stats);
  }

  static SyncResult failed(SyncStats stats) {
    return new SyncResult(false, false, stats);
  }

  static SyncResult skipped() {
    return new SyncResult(false, true, new SyncStats());
  }

  public boolean isSuccess() {
    return success;
  }

  public boolean isSkipped() {
    return skipped;
  }

  public SyncStats getStats() {
    return stats;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("success", success)
        .add("skipped", skipped)
        .add("stats", stats)
        .toString();
  }
}
