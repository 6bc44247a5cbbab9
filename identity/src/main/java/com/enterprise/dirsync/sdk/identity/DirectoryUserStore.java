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
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of {@link DirectoryUser} records.
 *
 * <p>Readers may use any lookup. Mutations are made by {@link DirectorySyncEngine} only.
 */
public interface DirectoryUserStore {

  Optional<DirectoryUser> findById(String userId) throws IOException;

  Optional<DirectoryUser> findByDn(String configId, String dn) throws IOException;

  Optional<DirectoryUser> findByUsername(String configId, String username) throws IOException;

  Optional<DirectoryUser> findByEmail(String configId, String email) throws IOException;

  /**
   * Creates a record and assigns its id.
   *
   * @throws IOException if a record with the same configuration and DN exists
   */
  DirectoryUser create(DirectoryUser user) throws IOException;

  /**
   * Replaces an existing record, matched by id.
   *
   * @throws IOException if the record does not exist or its new DN is taken
   */
  void update(DirectoryUser user) throws IOException;

  List<DirectoryUser> listByConfig(String configId, boolean activeOnly) throws IOException;

  /** @return {@code false} if no such user exists */
  boolean setActive(String userId, boolean active) throws IOException;

  void recordLogin(String userId, Instant loginTime) throws IOException;

  void linkLocalAccount(String userId, String localAccountId) throws IOException;

  /**
   * Marks every active user of {@code configId} whose DN is not in {@code observedDns} inactive
   * and {@link UserSyncStatus#STALE}, stale since {@code now}.
   *
   * @return number of users marked
   */
  int markStale(String configId, Set<String> observedDns, Instant now) throws IOException;

  /**
   * Deletes stale users of {@code configId} that have been stale since before {@code cutoff}.
   *
   * @return number of users deleted
   */
  int purgeStale(String configId, Instant cutoff) throws IOException;
}
