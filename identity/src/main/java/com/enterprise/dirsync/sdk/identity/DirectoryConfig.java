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
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.dirsync.sdk.InvalidConfigurationException;
import com.enterprise.dirsync.sdk.config.Configuration;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Connection, search and synchronization settings of one directory.
 *
 * <p>At most one configuration is active at a time (see {@link ConfigStore#getActiveConfig()}).
 * {@link #toString()} never includes the bind password; use {@link #redacted()} before handing a
 * configuration to code outside the core.
 *
 * <p>Configuration parameters read by {@link #fromConfiguration()}:
 *
 * <ul>
 *   <li>{@value #HOST} - directory server host name. Required.
 *   <li>{@value #PORT} - server port. Defaults to 389, or 636 when {@value #USE_SSL} is set.
 *   <li>{@value #USE_SSL} - connect with LDAPS.
 *   <li>{@value #TRUST_ALL_CERTIFICATES} - skip server certificate validation.
 *   <li>{@value #BIND_DN} and {@value #BIND_PASSWORD} - service account. Empty for anonymous.
 *   <li>{@value #SEARCH_BASE} - base DN of user entries. Required.
 *   <li>{@value #SEARCH_FILTER} - user filter, may contain a {@code {username}} placeholder.
 *   <li>{@value #USER_DN_TEMPLATE} - DN built directly from the username, skipping the search.
 *   <li>{@value #ATTRIBUTE_MAPPING} - {@code field=attribute} overrides, comma separated.
 *   <li>{@value #SYNC_INTERVAL_SECS} - seconds between passes, at least
 *       {@value #MIN_SYNC_INTERVAL_SECS}.
 * </ul>
 */
public final class DirectoryConfig {
  public static final String NAME = "ldap.name";
  public static final String HOST = "ldap.host";
  public static final String PORT = "ldap.port";
  public static final String USE_SSL = "ldap.useSsl";
  public static final String TRUST_ALL_CERTIFICATES = "ldap.trustAllCertificates";
  public static final String TIMEOUT_MILLIS = "ldap.timeoutMillis";
  public static final String BIND_DN = "ldap.bindDn";
  public static final String BIND_PASSWORD = "ldap.bindPassword";
  public static final String SEARCH_BASE = "ldap.searchBase";
  public static final String SEARCH_FILTER = "ldap.searchFilter";
  public static final String USER_DN_TEMPLATE = "ldap.userDnTemplate";
  public static final String ATTRIBUTE_MAPPING = "ldap.attributeMapping";
  public static final String ENABLED = "ldap.enabled";
  public static final String AUTO_CREATE_USER = "ldap.autoCreateUser";
  public static final String SYNC_ENABLED = "ldap.sync.enabled";
  public static final String SYNC_INTERVAL_SECS = "ldap.sync.intervalSecs";
  public static final String PAGE_SIZE = "ldap.sync.pageSize";
  public static final String STALE_RETENTION_DAYS = "ldap.sync.staleRetentionDays";

  public static final int MIN_SYNC_INTERVAL_SECS = 30;
  public static final int DEFAULT_PORT = 389;
  public static final int DEFAULT_SSL_PORT = 636;
  public static final String DEFAULT_SEARCH_FILTER = "(objectClass=person)";

  private final String id;
  private final String name;
  private final String host;
  private final int port;
  private final boolean useSsl;
  private final boolean trustAllCertificates;
  private final int timeoutMillis;
  private final String bindDn;
  private final String bindPassword;
  private final String searchBase;
  private final String searchFilter;
  private final String userDnTemplate;
  private final AttributeMapping attributeMapping;
  private final boolean enabled;
  private final boolean autoCreateUser;
  private final boolean syncEnabled;
  private final int syncIntervalSecs;
  private final int pageSize;
  private final int staleRetentionDays;
  private final SyncStatus syncStatus;
  private final Instant lastSyncTime;

  private DirectoryConfig(Builder builder) {
    this.id = builder.id;
    this.name = Strings.nullToEmpty(builder.name);
    this.host = Strings.nullToEmpty(builder.host);
    this.port = builder.port;
    this.useSsl = builder.useSsl;
    this.trustAllCertificates = builder.trustAllCertificates;
    this.timeoutMillis = builder.timeoutMillis;
    this.bindDn = Strings.nullToEmpty(builder.bindDn);
    this.bindPassword = Strings.nullToEmpty(builder.bindPassword);
    this.searchBase = Strings.nullToEmpty(builder.searchBase);
    this.searchFilter = Strings.nullToEmpty(builder.searchFilter);
    this.userDnTemplate = Strings.nullToEmpty(builder.userDnTemplate);
    this.attributeMapping = checkNotNull(builder.attributeMapping);
    this.enabled = builder.enabled;
    this.autoCreateUser = builder.autoCreateUser;
    this.syncEnabled = builder.syncEnabled;
    this.syncIntervalSecs = builder.syncIntervalSecs;
    this.pageSize = builder.pageSize;
    this.staleRetentionDays = builder.staleRetentionDays;
    this.syncStatus = checkNotNull(builder.syncStatus);
    this.lastSyncTime = builder.lastSyncTime;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds the configuration from the loaded {@link Configuration}.
   *
   * @throws InvalidConfigurationException if a value is missing or invalid
   */
  public static DirectoryConfig fromConfiguration() {
    checkState(Configuration.isInitialized(), "configuration not initialized");
    boolean useSsl = Configuration.getBoolean(USE_SSL, false).get();
    DirectoryConfig config =
        builder()
            .setName(Configuration.getString(NAME, "default").get())
            .setHost(Configuration.getString(HOST, null).get())
            .setPort(
                Configuration.getInteger(PORT, useSsl ? DEFAULT_SSL_PORT : DEFAULT_PORT).get())
            .setUseSsl(useSsl)
            .setTrustAllCertificates(
                Configuration.getBoolean(TRUST_ALL_CERTIFICATES, false).get())
            .setTimeoutMillis(Configuration.getInteger(TIMEOUT_MILLIS, 10000).get())
            .setBindDn(Configuration.getString(BIND_DN, "").get())
            .setBindPassword(Configuration.getString(BIND_PASSWORD, "").get())
            .setSearchBase(Configuration.getString(SEARCH_BASE, null).get())
            .setSearchFilter(Configuration.getString(SEARCH_FILTER, DEFAULT_SEARCH_FILTER).get())
            .setUserDnTemplate(Configuration.getString(USER_DN_TEMPLATE, "").get())
            .setAttributeMapping(
                AttributeMapping.withOverrides(Configuration.getMap(ATTRIBUTE_MAPPING).get()))
            .setEnabled(Configuration.getBoolean(ENABLED, true).get())
            .setAutoCreateUser(Configuration.getBoolean(AUTO_CREATE_USER, false).get())
            .setSyncEnabled(Configuration.getBoolean(SYNC_ENABLED, false).get())
            .setSyncIntervalSecs(
                Configuration.getValidatedInteger(
                        SYNC_INTERVAL_SECS,
                        MIN_SYNC_INTERVAL_SECS,
                        v -> v >= MIN_SYNC_INTERVAL_SECS,
                        "must be at least " + MIN_SYNC_INTERVAL_SECS + " seconds")
                    .get())
            .setPageSize(Configuration.getInteger(PAGE_SIZE, 500).get())
            .setStaleRetentionDays(Configuration.getInteger(STALE_RETENTION_DAYS, 30).get())
            .build();
    config.validate();
    return config;
  }

  /**
   * Checks the values an administrator must supply.
   *
   * @throws InvalidConfigurationException listing every problem found
   */
  public void validate() {
    List<String> problems = new ArrayList<>();
    if (name.isEmpty()) {
      problems.add("name is required");
    }
    if (host.isEmpty()) {
      problems.add("server host is required");
    }
    if (port < 1 || port > 65535) {
      problems.add("server port " + port + " is out of range");
    }
    if (searchBase.isEmpty()) {
      problems.add("search base is required");
    }
    if (syncIntervalSecs < MIN_SYNC_INTERVAL_SECS) {
      problems.add(
          "sync interval must be at least " + MIN_SYNC_INTERVAL_SECS + " seconds");
    }
    if (timeoutMillis <= 0) {
      problems.add("timeout must be positive");
    }
    if (pageSize < 0 || staleRetentionDays < 0) {
      problems.add("page size and stale retention can not be negative");
    }
    Configuration.checkConfiguration(
        problems.isEmpty(), "Invalid directory configuration: %s", Joiner.on("; ").join(problems));
  }

  /** Store assigned identifier, empty until the configuration is saved. */
  public Optional<String> getId() {
    return Optional.ofNullable(id);
  }

  public String getName() {
    return name;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public boolean isUseSsl() {
    return useSsl;
  }

  public boolean isTrustAllCertificates() {
    return trustAllCertificates;
  }

  /** Connect and response timeout. */
  public int getTimeoutMillis() {
    return timeoutMillis;
  }

  public String getBindDn() {
    return bindDn;
  }

  public String getBindPassword() {
    return bindPassword;
  }

  public String getSearchBase() {
    return searchBase;
  }

  public String getSearchFilter() {
    return searchFilter;
  }

  public String getUserDnTemplate() {
    return userDnTemplate;
  }

  public AttributeMapping getAttributeMapping() {
    return attributeMapping;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isAutoCreateUser() {
    return autoCreateUser;
  }

  public boolean isSyncEnabled() {
    return syncEnabled;
  }

  /** Configured interval. May be below the minimum when set outside {@link #validate()}. */
  public int getSyncIntervalSecs() {
    return syncIntervalSecs;
  }

  /** Page size of the simple paged results control, 0 to disable paging. */
  public int getPageSize() {
    return pageSize;
  }

  public int getStaleRetentionDays() {
    return staleRetentionDays;
  }

  public SyncStatus getSyncStatus() {
    return syncStatus;
  }

  public Optional<Instant> getLastSyncTime() {
    return Optional.ofNullable(lastSyncTime);
  }

  /** Returns a copy without the bind password. */
  public DirectoryConfig redacted() {
    return toBuilder().setBindPassword("").build();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DirectoryConfig)) {
      return false;
    }
    DirectoryConfig other = (DirectoryConfig) obj;
    return Objects.equals(id, other.id)
        && name.equals(other.name)
        && host.equals(other.host)
        && port == other.port
        && useSsl == other.useSsl
        && trustAllCertificates == other.trustAllCertificates
        && timeoutMillis == other.timeoutMillis
        && bindDn.equals(other.bindDn)
        && bindPassword.equals(other.bindPassword)
        && searchBase.equals(other.searchBase)
        && searchFilter.equals(other.searchFilter)
        && userDnTemplate.equals(other.userDnTemplate)
        && attributeMapping.equals(other.attributeMapping)
        && enabled == other.enabled
        && autoCreateUser == other.autoCreateUser
        && syncEnabled == other.syncEnabled
        && syncIntervalSecs == other.syncIntervalSecs
        && pageSize == other.pageSize
        && staleRetentionDays == other.staleRetentionDays
        && syncStatus == other.syncStatus
        && Objects.equals(lastSyncTime, other.lastSyncTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, name, host, port, useSsl, trustAllCertificates, timeoutMillis, bindDn, bindPassword,
        searchBase, searchFilter, userDnTemplate, attributeMapping, enabled, autoCreateUser,
        syncEnabled, syncIntervalSecs, pageSize, staleRetentionDays, syncStatus, lastSyncTime);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .add("server", (useSsl ? "ldaps://" : "ldap://") + host + ":" + port)
        .add("bindDn", bindDn)
        .add("searchBase", searchBase)
        .add("searchFilter", searchFilter)
        .add("userDnTemplate", userDnTemplate)
        .add("attributeMapping", attributeMapping)
        .add("enabled", enabled)
        .add("autoCreateUser", autoCreateUser)
        .add("syncEnabled", syncEnabled)
        .add("syncIntervalSecs", syncIntervalSecs)
        .add("syncStatus", syncStatus)
        .add("lastSyncTime", lastSyncTime)
        .toString();
  }

  /** Builder for {@link DirectoryConfig}. */
  public static class Builder {
    private String id;
    private String name = "";
    private String host = "";
    private int port = DEFAULT_PORT;
    private boolean useSsl;
    private boolean trustAllCertificates;
    private int timeoutMillis = 10000;
    private String bindDn = "";
    private String bindPassword = "";
    private String searchBase = "";
    private String searchFilter = DEFAULT_SEARCH_FILTER;
    private String userDnTemplate = "";
    private AttributeMapping attributeMapping = AttributeMapping.defaults();
    private boolean enabled = true;
    private boolean autoCreateUser;
    private boolean syncEnabled;
    private int syncIntervalSecs = MIN_SYNC_INTERVAL_SECS;
    private int pageSize = 500;
    private int staleRetentionDays = 30;
    private SyncStatus syncStatus = SyncStatus.IDLE;
    private Instant lastSyncTime;

    private Builder() {}

    private Builder(DirectoryConfig config) {
      this.id = config.id;
      this.name = config.name;
      this.host = config.host;
      this.port = config.port;
      this.useSsl = config.useSsl;
      this.trustAllCertificates = config.trustAllCertificates;
      this.timeoutMillis = config.timeoutMillis;
      this.bindDn = config.bindDn;
      this.bindPassword = config.bindPassword;
      this.searchBase = config.searchBase;
      this.searchFilter = config.searchFilter;
      this.userDnTemplate = config.userDnTemplate;
      this.attributeMapping = config.attributeMapping;
      this.enabled = config.enabled;
      this.autoCreateUser = config.autoCreateUser;
      this.syncEnabled = config.syncEnabled;
      this.syncIntervalSecs = config.syncIntervalSecs;
      this.pageSize = config.pageSize;
      this.staleRetentionDays = config.staleRetentionDays;
      this.syncStatus = config.syncStatus;
      this.lastSyncTime = config.lastSyncTime;
    }

    public Builder setId(@Nullable String id) {
      this.id = id;
      return this;
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setHost(String host) {
      this.host = host;
      return this;
    }

    public Builder setPort(int port) {
      this.port = port;
      return this;
    }

    public Builder setUseSsl(boolean useSsl) {
      this.useSsl = useSsl;
      return this;
    }

    public Builder setTrustAllCertificates(boolean trustAllCertificates) {
      this.trustAllCertificates = trustAllCertificates;
      return this;
    }

    public Builder setTimeoutMillis(int timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
      return this;
    }

    public Builder setBindDn(String bindDn) {
      this.bindDn = bindDn;
      return this;
    }

    public Builder setBindPassword(String bindPassword) {
      this.bindPassword = bindPassword;
      return this;
    }

    public Builder setSearchBase(String searchBase) {
      this.searchBase = searchBase;
      return this;
    }

    public Builder setSearchFilter(String searchFilter) {
      this.searchFilter = searchFilter;
      return this;
    }

    public Builder setUserDnTemplate(String userDnTemplate) {
      this.userDnTemplate = userDnTemplate;
      return this;
    }

    public Builder setAttributeMapping(AttributeMapping attributeMapping) {
      this.attributeMapping = checkNotNull(attributeMapping);
      return this;
    }

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setAutoCreateUser(boolean autoCreateUser) {
      this.autoCreateUser = autoCreateUser;
      return this;
    }

    public Builder setSyncEnabled(boolean syncEnabled) {
      this.syncEnabled = syncEnabled;
      return this;
    }

    public Builder setSyncIntervalSecs(int syncIntervalSecs) {
      this.syncIntervalSecs = syncIntervalSecs;
      return this;
    }

    public Builder setPageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder setStaleRetentionDays(int staleRetentionDays) {
      this.staleRetentionDays = staleRetentionDays;
      return this;
    }

    public Builder setSyncStatus(SyncStatus syncStatus) {
      this.syncStatus = checkNotNull(syncStatus);
      return this;
    }

    public Builder setLastSyncTime(@Nullable Instant lastSyncTime) {
      this.lastSyncTime = lastSyncTime;
      return this;
    }

    public DirectoryConfig build() {
      return new DirectoryConfig(this);
    }
  }
}
