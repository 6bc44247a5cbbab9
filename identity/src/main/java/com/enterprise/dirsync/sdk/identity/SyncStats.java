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
import java.util.Objects;

/** Counters of one reconciliation pass. Confined to the thread running the pass. */
public final class SyncStats {
  private int found;
  private int created;
  private int updated;
  private int deactivated;
  private int errors;

  public SyncStats() {}

  public SyncStats(int found, int created, int updated, int deactivated, int errors) {
    this.found = found;
    this.created = created;
    this.updated = updated;
    this.deactivated = deactivated;
    this.errors = errors;
  }

  /** Directory entries enumerated. */
  public int getFound() {
    return found;
  }

  public int getCreated() {
    return created;
  }

  public int getUpdated() {
    return updated;
  }

  /** Records marked stale. */
  public int getDeactivated() {
    return deactivated;
  }

  /** Entries whose upsert or provisioning failed. */
  public int getErrors() {
    return errors;
  }

  void setFound(int found) {
    this.found = found;
  }

  void incrementCreated() {
    created++;
  }

  void incrementUpdated() {
    updated++;
  }

  void setDeactivated(int deactivated) {
    this.deactivated = deactivated;
  }

  void incrementErrors() {
    errors++;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SyncStats)) {
      return false;
    }
    SyncStats other = (SyncStats) obj;
    return found == other.found
        && created == other.created
        && updated == other.updated
        && deactivated == other.deactivated
        && errors == other.errors;
  }

  @Override
  public int hashCode() {
    return Objects.hash(found, created, updated, deactivated, errors);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("found", found)
        .add("created", created)
        .add("updated", updated)
        .add("deactivated", deactivated)
        .add("errors", errors)
        .toString();
  }
}
