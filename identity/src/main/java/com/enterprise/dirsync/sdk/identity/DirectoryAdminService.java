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

import com.enterprise.dirsync.sdk.InvalidConfigurationException;
import com.google.common.base.Strings;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative operations on directory authentication and sync.
 *
 * <p>Every operation returns an {@link AdminResponse}; none throws. Bind passwords are never
 * returned.
 */
public class DirectoryAdminService {
  private static final Logger logger = Logger.getLogger(DirectoryAdminService.class.getName());

  static final String INVALID_CREDENTIALS = "Invalid credentials";

  private final ConfigStore configStore;
  private final DirectoryUserStore userStore;
  private final LdapAuthenticator authenticator;
  private final DirectorySyncEngine syncEngine;
  private final DirectorySyncScheduler scheduler;
  private final LdapConnectionManager.Factory connectionFactory;

  public DirectoryAdminService(
      ConfigStore configStore,
      DirectoryUserStore userStore,
      LdapAuthenticator authenticator,
      DirectorySyncEngine syncEngine,
      DirectorySyncScheduler scheduler,
      LdapConnectionManager.Factory connectionFactory) {
    this.configStore = checkNotNull(configStore);
    this.userStore = checkNotNull(userStore);
    this.authenticator = checkNotNull(authenticator);
    this.syncEngine = checkNotNull(syncEngine);
    this.scheduler = checkNotNull(scheduler);
    this.connectionFactory = checkNotNull(connectionFactory);
  }

  /**
   * Authenticates a user and records the login. Fails when the user has no linked local account
   * and auto-provisioning is disabled.
   */
  public AdminResponse<DirectoryUser> login(String username, String password) {
    AuthenticationResult result = authenticator.authenticateUser(username, password);
    if (!result.isSuccess()) {
      return AdminResponse.error(INVALID_CREDENTIALS);
    }
    DirectoryUser user;
    try {
      user = syncEngine.recordLogin(result.getProfile().get());
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to record login of " + username, e);
      return AdminResponse.error("Failed to record directory user");
    }
    if (!user.getLocalAccountId().isPresent()) {
      return AdminResponse.error("User account not found or disabled");
    }
    return AdminResponse.ok(user, "Login successful");
  }

  /** Active configuration without its bind password. */
  public AdminResponse<DirectoryConfig> getActiveConfig() {
    try {
      return configStore.getActiveConfig()
          .map(config -> AdminResponse.ok(config.redacted(), "OK"))
          .orElseGet(() -> AdminResponse.<DirectoryConfig>error("Directory not configured"));
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory configuration", e);
      return AdminResponse.error("Unable to read configuration");
    }
  }

  /**
   * Validates and saves {@code config}. Updates the active configuration when one exists,
   * keeping its id and, when {@code config} has none, its bind password. The store keeps the
   * stored sync state.
   */
  public AdminResponse<DirectoryConfig> upsertConfig(DirectoryConfig config) {
    checkNotNull(config, "config can not be null");
    try {
      config.validate();
    } catch (InvalidConfigurationException e) {
      return AdminResponse.error(e.getMessage());
    }
    try {
      Optional<DirectoryConfig> existing = configStore.getActiveConfig();
      DirectoryConfig toSave = config;
      if (existing.isPresent()) {
        DirectoryConfig current = existing.get();
        DirectoryConfig.Builder merged = config.toBuilder().setId(current.getId().orElse(null));
        if (Strings.isNullOrEmpty(config.getBindPassword())) {
          merged.setBindPassword(current.getBindPassword());
        }
        toSave = merged.build();
      } else {
        toSave = config.toBuilder().setId(null).setSyncStatus(SyncStatus.IDLE).build();
      }
      DirectoryConfig saved = configStore.saveConfig(toSave);
      logger.log(Level.INFO, "Saved directory configuration {0}", saved);
      return AdminResponse.ok(
          saved.redacted(),
          existing.isPresent() ? "Configuration updated" : "Configuration created");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to save directory configuration", e);
      return AdminResponse.error("Unable to save configuration");
    }
  }

  /** Binds with the service account of the active configuration. */
  public AdminResponse<Boolean> testConnection() {
    Optional<DirectoryConfig> active;
    try {
      active = configStore.getActiveConfig();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory configuration", e);
      return AdminResponse.error("Unable to read configuration");
    }
    if (!active.isPresent()) {
      return AdminResponse.error("Directory not configured");
    }
    boolean connected = connectionFactory.create(active.get()).testConnection();
    return AdminResponse.ok(
        connected, connected ? "Connection successful" : "Connection failed");
  }

  public AdminResponse<Boolean> forceSync() {
    boolean success = scheduler.forceSync();
    return AdminResponse.ok(success, success ? "Sync completed" : "Sync failed or skipped");
  }

  /**
   * Users of {@code configId}, or of the active configuration when {@code configId} is empty.
   */
  public AdminResponse<List<DirectoryUser>> listUsers(String configId, boolean activeOnly) {
    try {
      String id = configId;
      if (Strings.isNullOrEmpty(id)) {
        Optional<DirectoryConfig> active = configStore.getActiveConfig();
        if (!active.isPresent()) {
          return AdminResponse.error("Directory not configured");
        }
        id = active.get().getId().get();
      }
      return AdminResponse.ok(userStore.listByConfig(id, activeOnly), "OK");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to list directory users", e);
      return AdminResponse.error("Unable to list users");
    }
  }

  public AdminResponse<Boolean> setUserActive(String userId, boolean active) {
    try {
      if (!syncEngine.setUserActive(userId, active)) {
        return AdminResponse.error("User not found");
      }
      return AdminResponse.ok(true, active ? "User enabled" : "User disabled");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to update user " + userId, e);
      return AdminResponse.error("Unable to update user");
    }
  }

  public AdminResponse<Integer> purgeStaleUsers() {
    try {
      int purged = syncEngine.purgeStaleUsers();
      return AdminResponse.ok(purged, "Purged " + purged + " stale users");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to purge stale users", e);
      return AdminResponse.error("Unable to purge stale users");
    }
  }

  public AdminResponse<DirectoryStatus> getStatus() {
    try {
      Optional<DirectoryConfig> active = configStore.getActiveConfig();
      if (!active.isPresent()) {
        return AdminResponse.ok(DirectoryStatus.notConfigured(), "Directory not configured");
      }
      DirectoryConfig config = active.get();
      List<DirectoryUser> users = userStore.listByConfig(config.getId().get(), false);
      int activeUsers = (int) users.stream().filter(DirectoryUser::isActive).count();
      return AdminResponse.ok(
          new DirectoryStatus(
              true,
              config.isEnabled(),
              config.isSyncEnabled(),
              config.getSyncIntervalSecs(),
              config.getLastSyncTime().orElse(null),
              config.getSyncStatus(),
              users.size(),
              activeUsers),
          "OK");
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory status", e);
      return AdminResponse.error("Unable to read status");
    }
  }
}
