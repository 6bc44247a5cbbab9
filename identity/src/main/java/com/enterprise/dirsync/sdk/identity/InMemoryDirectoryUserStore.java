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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.enterprise.dirsync.sdk.DirectoryException;
import com.enterprise.dirsync.sdk.DirectoryException.ErrorType;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * Thread-safe {@link DirectoryUserStore} held in memory.
 *
 * <p>Lookups read the map directly; writes and compound operations hold the store lock.
 */
public class InMemoryDirectoryUserStore implements DirectoryUserStore {
  private final ConcurrentMap<String, DirectoryUser> users = new ConcurrentHashMap<>();

  @Override
  public Optional<DirectoryUser> findById(String userId) {
    return Optional.ofNullable(users.get(Strings.nullToEmpty(userId)));
  }

  @Override
  public Optional<DirectoryUser> findByDn(String configId, String dn) {
    return findFirst(configId, u -> u.getDn().equals(dn));
  }

  @Override
  public Optional<DirectoryUser> findByUsername(String configId, String username) {
    return findFirst(configId, u -> u.getUsername().equals(username));
  }

  @Override
  public Optional<DirectoryUser> findByEmail(String configId, String email) {
    return findFirst(configId, u -> u.getEmail().equalsIgnoreCase(email));
  }

  private Optional<DirectoryUser> findFirst(String configId, Predicate<DirectoryUser> match) {
    return users.values().stream()
        .filter(u -> u.getConfigId().equals(configId))
        .filter(match)
        .min(Comparator.comparing((DirectoryUser u) -> u.getId().get()));
  }

  @Override
  public synchronized DirectoryUser create(DirectoryUser user) throws IOException {
    checkNotNull(user, "user can not be null");
    checkArgument(!user.getId().isPresent(), "new user can not have an id");
    checkDnAvailable(user, null);
    DirectoryUser stored = user.toBuilder().setId(UUID.randomUUID().toString()).build();
    users.put(stored.getId().get(), stored);
    return stored;
  }

  @Override
  public synchronized void update(DirectoryUser user) throws IOException {
    checkNotNull(user, "user can not be null");
    String id = user.getId().orElseThrow(() -> new IllegalArgumentException("user has no id"));
    require(id);
    checkDnAvailable(user, id);
    users.put(id, user);
  }

  private void checkDnAvailable(DirectoryUser user, String ownId) throws DirectoryException {
    Optional<DirectoryUser> holder = findByDn(user.getConfigId(), user.getDn());
    if (holder.isPresent() && !holder.get().getId().get().equals(ownId)) {
      throw new DirectoryException.Builder()
          .setErrorType(ErrorType.PERSISTENCE_ERROR)
          .setErrorMessage("Duplicate DN " + user.getDn() + " for config " + user.getConfigId())
          .build();
    }
  }

  @Override
  public List<DirectoryUser> listByConfig(String configId, boolean activeOnly) {
    return users.values().stream()
        .filter(u -> u.getConfigId().equals(configId))
        .filter(u -> !activeOnly || u.isActive())
        .sorted(Comparator.comparing(DirectoryUser::getUsername))
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public synchronized boolean setActive(String userId, boolean active) {
    DirectoryUser user = users.get(Strings.nullToEmpty(userId));
    if (user == null) {
      return false;
    }
    users.put(userId, user.toBuilder().setActive(active).build());
    return true;
  }

  @Override
  public synchronized void recordLogin(String userId, Instant loginTime) throws IOException {
    DirectoryUser user = require(userId);
    users.put(userId, user.toBuilder().setLastLoginTime(loginTime).build());
  }

  @Override
  public synchronized void linkLocalAccount(String userId, String localAccountId)
      throws IOException {
    DirectoryUser user = require(userId);
    users.put(userId, user.toBuilder().setLocalAccountId(localAccountId).build());
  }

  @Override
  public synchronized int markStale(String configId, Set<String> observedDns, Instant now) {
    List<DirectoryUser> missing = new ArrayList<>();
    for (DirectoryUser user : users.values()) {
      if (user.getConfigId().equals(configId)
          && user.isActive()
          && !observedDns.contains(user.getDn())) {
        missing.add(user);
      }
    }
    for (DirectoryUser user : missing) {
      users.put(
          user.getId().get(),
          user.toBuilder()
              .setActive(false)
              .setSyncStatus(UserSyncStatus.STALE)
              .setStaleSince(now)
              .build());
    }
    return missing.size();
  }

  @Override
  public synchronized int purgeStale(String configId, Instant cutoff) {
    List<String> expired = new ArrayList<>();
    for (DirectoryUser user : users.values()) {
      if (user.getConfigId().equals(configId)
          && user.getSyncStatus() == UserSyncStatus.STALE
          && user.getStaleSince().map(since -> since.isBefore(cutoff)).orElse(false)) {
        expired.add(user.getId().get());
      }
    }
    expired.forEach(users::remove);
    return expired.size();
  }

  private DirectoryUser require(String userId) throws DirectoryException {
    DirectoryUser user = users.get(Strings.nullToEmpty(userId));
    if (user == null) {
      throw new DirectoryException.Builder()
          .setErrorType(ErrorType.PERSISTENCE_ERROR)
          .setErrorMessage("Unknown directory user " + userId)
          .build();
    }
    return user;
  }
}
