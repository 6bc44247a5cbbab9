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

import com.enterprise.dirsync.sdk.DirectoryException;
import com.enterprise.dirsync.sdk.DirectoryException.ErrorType;
import com.enterprise.dirsync.sdk.StatsManager;
import com.enterprise.dirsync.sdk.StatsManager.OperationStats;
import com.google.common.annotations.VisibleForTesting;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SearchResultEntry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Reconciles the {@link DirectoryUserStore} with the directory.
 *
 * <p>A pass enumerates every entry under the search base, creates or updates one record per entry
 * and, once all entries are processed, marks the records of entries no longer present as stale.
 * Records are matched by DN, then username, then email. A failure on one entry is counted and the
 * pass continues; a failure to open the session, enumerate or mark stale records fails the whole
 * pass and leaves the configuration in {@link SyncStatus#ERROR}.
 *
 * <p>At most one pass runs per configuration. A call made while a pass is in flight returns a
 * skipped result immediately.
 *
 * <p>This class is the only writer of the user store and of the configuration sync status.
 */
public class DirectorySyncEngine {
  private static final Logger logger = Logger.getLogger(DirectorySyncEngine.class.getName());
  private static final OperationStats stats = StatsManager.getComponent("SyncEngine");

  static final String FALLBACK_EMAIL_DOMAIN = "@ldap.local";

  private final ConfigStore configStore;
  private final DirectoryUserStore userStore;
  private final LocalAccountProvisioner provisioner;
  private final LdapConnectionManager.Factory connectionFactory;
  private final Clock clock;
  private final ConcurrentMap<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();
  private final Object upsertLock = new Object();

  private DirectorySyncEngine(Builder builder) {
    this.configStore = checkNotNull(builder.configStore, "configStore can not be null");
    this.userStore = checkNotNull(builder.userStore, "userStore can not be null");
    this.provisioner = checkNotNull(builder.provisioner, "provisioner can not be null");
    this.connectionFactory = checkNotNull(builder.connectionFactory);
    this.clock = checkNotNull(builder.clock);
  }

  /**
   * Runs one reconciliation pass for the active configuration.
   *
   * @return the pass outcome; skipped when sync is not enabled or a pass is already running
   */
  public SyncResult syncUsers() {
    Optional<DirectoryConfig> active;
    try {
      active = configStore.getActiveConfig();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory configuration", e);
      stats.logResult("syncUsers", SyncStatus.ERROR.name());
      return SyncResult.failed(new SyncStats());
    }
    if (!active.isPresent() || !active.get().isEnabled() || !active.get().isSyncEnabled()) {
      logger.log(Level.FINE, "Directory sync not enabled; skipping.");
      return SyncResult.skipped();
    }
    DirectoryConfig config = active.get();
    String configId = config.getId().get();
    AtomicBoolean running = inFlight.computeIfAbsent(configId, k -> new AtomicBoolean());
    if (!running.compareAndSet(false, true)) {
      logger.log(Level.INFO, "Skipping sync of {0}. Previous pass is still running.", configId);
      stats.logResult("syncUsers", "SKIPPED");
      return SyncResult.skipped();
    }
    try {
      return runPass(config);
    } finally {
      running.set(false);
    }
  }

  private SyncResult runPass(DirectoryConfig config) {
    String configId = config.getId().get();
    SyncStats syncStats = new SyncStats();
    OperationStats.Event event = stats.event("syncUsers");
    logger.log(Level.INFO, "Beginning directory sync of {0}", config.getName());
    try {
      configStore.updateSyncStatus(configId, SyncStatus.RUNNING, null);
      Filter filter = enumerationFilter(config);
      Set<String> observed = new HashSet<>();
      try (LdapConnectionManager session = connectionFactory.create(config).open()) {
        List<SearchResultEntry> entries =
            session.searchAll(filter, config.getAttributeMapping().attributeNames());
        syncStats.setFound(entries.size());
        for (SearchResultEntry entry : entries) {
          // observed before the upsert so a failed write never stales an existing record
          observed.add(entry.getDN());
          reconcile(config, entry, syncStats, observed);
        }
      }
      Instant now = clock.instant();
      syncStats.setDeactivated(userStore.markStale(configId, observed, now));
      configStore.updateSyncStatus(configId, SyncStatus.COMPLETED, now);
      event.success();
      stats.logResult("syncUsers", SyncStatus.COMPLETED.name());
      logger.log(Level.INFO, "Completed directory sync of {0}: {1}",
          new Object[] {config.getName(), syncStats});
      return SyncResult.completed(syncStats);
    } catch (IOException | RuntimeException e) {
      event.failure();
      stats.logResult("syncUsers", SyncStatus.ERROR.name());
      logger.log(Level.WARNING, "Directory sync of " + config.getName() + " failed", e);
      try {
        configStore.updateSyncStatus(configId, SyncStatus.ERROR, null);
      } catch (IOException statusError) {
        logger.log(Level.WARNING, "Unable to record sync failure", statusError);
      }
      return SyncResult.failed(syncStats);
    }
  }

  private void reconcile(
      DirectoryConfig config, SearchResultEntry entry, SyncStats syncStats, Set<String> observed) {
    UserProfile profile;
    Upsert upsert;
    try {
      profile = UserProfile.fromEntry(entry, config.getAttributeMapping());
      upsert = upsert(config, profile, clock.instant(), observed);
    } catch (IOException | RuntimeException e) {
      syncStats.incrementErrors();
      logger.log(Level.WARNING, "Failed to reconcile " + entry.getDN(), e);
      return;
    }
    if (!upsert.created) {
      syncStats.incrementUpdated();
      return;
    }
    syncStats.incrementCreated();
    if (config.isAutoCreateUser()) {
      try {
        provision(upsert.user);
      } catch (IOException | RuntimeException e) {
        syncStats.incrementErrors();
        logger.log(Level.WARNING, "Failed to provision local account for " + entry.getDN(), e);
      }
    }
  }

  /**
   * Records a successful login: creates or refreshes the user's record, stamps the login time and
   * links a local account when auto-provisioning is enabled.
   *
   * @param profile profile returned by {@link LdapAuthenticator}
   * @return the stored record
   * @throws IOException if there is no active configuration or the store fails
   */
  public DirectoryUser recordLogin(UserProfile profile) throws IOException {
    checkNotNull(profile, "profile can not be null");
    DirectoryConfig config =
        configStore.getActiveConfig().orElseThrow(() -> missingConfig("record login"));
    Instant now = clock.instant();
    DirectoryUser user = upsert(config, profile, now, null).user;
    String userId = user.getId().get();
    userStore.recordLogin(userId, now);
    if (config.isAutoCreateUser() && !user.getLocalAccountId().isPresent()) {
      provision(user);
    }
    stats.register("recordLogin");
    return userStore.findById(userId).orElseThrow(() -> missingUser(userId));
  }

  /**
   * Deletes users of the active configuration that have been stale for longer than its
   * retention window.
   *
   * @return number of users deleted, 0 without an active configuration
   */
  public int purgeStaleUsers() throws IOException {
    Optional<DirectoryConfig> active = configStore.getActiveConfig();
    if (!active.isPresent()) {
      return 0;
    }
    DirectoryConfig config = active.get();
    Instant cutoff = clock.instant().minus(Duration.ofDays(config.getStaleRetentionDays()));
    int purged = userStore.purgeStale(config.getId().get(), cutoff);
    stats.logResult("purgeStaleUsers", purged > 0 ? "PURGED" : "NONE");
    if (purged > 0) {
      logger.log(Level.INFO, "Purged {0} users stale since before {1}",
          new Object[] {purged, cutoff});
    }
    return purged;
  }

  /**
   * Enables or disables a user on behalf of an administrator.
   *
   * @return {@code false} if no such user exists
   */
  public boolean setUserActive(String userId, boolean active) throws IOException {
    boolean updated = userStore.setActive(userId, active);
    if (updated) {
      logger.log(Level.INFO, "User {0} set {1}",
          new Object[] {userId, active ? "active" : "inactive"});
    }
    return updated;
  }

  /**
   * Creates or refreshes the record matching {@code profile}. The DN of a matched record is added
   * to {@code observed} before it is rewritten, so a renamed entry whose update fails keeps its
   * record active.
   */
  private Upsert upsert(
      DirectoryConfig config, UserProfile profile, Instant now, @Nullable Set<String> observed)
      throws IOException {
    String configId = config.getId().get();
    synchronized (upsertLock) {
      Optional<DirectoryUser> existing = findExisting(configId, profile);
      if (existing.isPresent() && observed != null) {
        observed.add(existing.get().getDn());
      }
      if (!existing.isPresent()) {
        DirectoryUser created =
            userStore.create(DirectoryUser.fromProfile(configId, profile, now));
        logger.log(Level.FINE, "Created directory user {0}", profile.getDn());
        return new Upsert(created, true);
      }
      DirectoryUser updated =
          existing.get().toBuilder()
              .applyProfile(profile)
              .setActive(true)
              .setSyncStatus(UserSyncStatus.SYNCED)
              .setLastSyncTime(now)
              .setStaleSince(null)
              .build();
      userStore.update(updated);
      return new Upsert(updated, false);
    }
  }

  private Optional<DirectoryUser> findExisting(String configId, UserProfile profile)
      throws IOException {
    Optional<DirectoryUser> match = userStore.findByDn(configId, profile.getDn());
    if (!match.isPresent() && !profile.getUsername().isEmpty()) {
      match = userStore.findByUsername(configId, profile.getUsername());
    }
    if (!match.isPresent() && !profile.getEmail().isEmpty()) {
      match = userStore.findByEmail(configId, profile.getEmail());
    }
    return match;
  }

  private void provision(DirectoryUser user) throws IOException {
    String userId = user.getId().get();
    Optional<String> accountId =
        user.getEmail().isEmpty()
            ? Optional.empty()
            : provisioner.findAccountIdByEmail(user.getEmail());
    if (!accountId.isPresent()) {
      String email =
          user.getEmail().isEmpty() ? user.getUsername() + FALLBACK_EMAIL_DOMAIN : user.getEmail();
      String nickname = user.getNickname().isEmpty() ? user.getUsername() : user.getNickname();
      accountId = Optional.of(provisioner.createAccount(email, nickname));
    }
    userStore.linkLocalAccount(userId, accountId.get());
  }

  /** Configured filter with username placeholders widened to match every entry. */
  @VisibleForTesting
  static Filter enumerationFilter(DirectoryConfig config) throws DirectoryException {
    String filter =
        config.getSearchFilter()
            .replace(LdapAuthenticator.LEGACY_PLACEHOLDER, "*")
            .replace(LdapAuthenticator.USERNAME_PLACEHOLDER, "*");
    try {
      return Filter.create(filter);
    } catch (LDAPException e) {
      throw new DirectoryException.Builder()
          .setErrorType(ErrorType.QUERY_ERROR)
          .setErrorMessage("Invalid search filter " + config.getSearchFilter())
          .setResultCode(e.getResultCode().intValue())
          .setCause(e)
          .build();
    }
  }

  private static DirectoryException missingConfig(String operation) {
    return new DirectoryException.Builder()
        .setErrorType(ErrorType.PERSISTENCE_ERROR)
        .setErrorMessage("No active directory configuration to " + operation)
        .build();
  }

  private static DirectoryException missingUser(String userId) {
    return new DirectoryException.Builder()
        .setErrorType(ErrorType.PERSISTENCE_ERROR)
        .setErrorMessage("Directory user " + userId + " disappeared")
        .build();
  }

  private static class Upsert {
    private final DirectoryUser user;
    private final boolean created;

    private Upsert(DirectoryUser user, boolean created) {
      this.user = user;
      this.created = created;
    }
  }

  /** Builder for {@link DirectorySyncEngine}. */
  public static class Builder {
    private ConfigStore configStore;
    private DirectoryUserStore userStore;
    private LocalAccountProvisioner provisioner;
    private LdapConnectionManager.Factory connectionFactory =
        LdapConnectionManager.DEFAULT_FACTORY;
    private Clock clock = Clock.systemUTC();

    public Builder setConfigStore(ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    public Builder setUserStore(DirectoryUserStore userStore) {
      this.userStore = userStore;
      return this;
    }

    public Builder setProvisioner(LocalAccountProvisioner provisioner) {
      this.provisioner = provisioner;
      return this;
    }

    public Builder setConnectionFactory(LdapConnectionManager.Factory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DirectorySyncEngine build() {
      return new DirectorySyncEngine(this);
    }
  }
}
