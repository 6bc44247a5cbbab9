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
import com.enterprise.dirsync.sdk.StatsManager;
import com.enterprise.dirsync.sdk.StatsManager.OperationStats;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.RDN;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Verifies user credentials with a two-phase bind.
 *
 * <ol>
 *   <li>A service account (or anonymous) session resolves the user's DN, either from the DN
 *       template or with a search under the search base.
 *   <li>A second, independent session binds as that DN with the supplied password. This bind is
 *       the only password check.
 *   <li>A new service session reads the entry and builds the {@link UserProfile}.
 * </ol>
 *
 * <p>Every failure collapses to {@link AuthenticationResult#failure()}, so an unknown user can not
 * be told apart from a wrong password. Passwords are never logged.
 */
public class LdapAuthenticator {
  private static final Logger logger = Logger.getLogger(LdapAuthenticator.class.getName());
  private static final OperationStats stats = StatsManager.getComponent("Authenticator");

  static final String USERNAME_PLACEHOLDER = "{username}";
  static final String LEGACY_PLACEHOLDER = "{}";

  private final ConfigStore configStore;
  private final LdapConnectionManager.Factory connectionFactory;

  public LdapAuthenticator(ConfigStore configStore) {
    this(configStore, LdapConnectionManager.DEFAULT_FACTORY);
  }

  public LdapAuthenticator(
      ConfigStore configStore, LdapConnectionManager.Factory connectionFactory) {
    this.configStore = checkNotNull(configStore, "configStore can not be null");
    this.connectionFactory = checkNotNull(connectionFactory, "connectionFactory can not be null");
  }

  /**
   * Authenticates {@code username} with {@code password} against the active configuration.
   *
   * <p>Fails without contacting the directory when no enabled configuration exists or either
   * argument is blank.
   */
  public AuthenticationResult authenticateUser(String username, String password) {
    if (Strings.isNullOrEmpty(username) || Strings.isNullOrEmpty(password)) {
      logger.log(Level.FINE, "Rejected login with blank username or password.");
      stats.logResult("authenticate", "REJECTED");
      return AuthenticationResult.failure();
    }
    Optional<DirectoryConfig> active;
    try {
      active = configStore.getActiveConfig();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory configuration", e);
      stats.logResult("authenticate", "REJECTED");
      return AuthenticationResult.failure();
    }
    if (!active.isPresent() || !active.get().isEnabled()) {
      logger.log(Level.FINE, "Directory login not enabled; rejecting {0}", username);
      stats.logResult("authenticate", "REJECTED");
      return AuthenticationResult.failure();
    }
    StatsManager.OperationStats.Event event = stats.event("authenticate");
    try {
      Optional<UserProfile> profile = authenticate(active.get(), username, password);
      event.end(profile.isPresent());
      return profile.map(AuthenticationResult::success).orElse(AuthenticationResult.failure());
    } catch (IOException | LDAPException | RuntimeException e) {
      event.failure();
      logger.log(Level.WARNING, "Directory error while authenticating " + username, e);
      return AuthenticationResult.failure();
    }
  }

  private Optional<UserProfile> authenticate(
      DirectoryConfig config, String username, String password)
      throws IOException, LDAPException {
    String userDn;
    try (LdapConnectionManager service = connectionFactory.create(config).open()) {
      Optional<String> resolved = resolveUserDn(service, config, username);
      if (!resolved.isPresent()) {
        logger.log(Level.INFO, "User {0} not found in directory", username);
        return Optional.empty();
      }
      userDn = resolved.get();
    }

    try (LdapConnectionManager user = connectionFactory.create(config)) {
      if (!user.connect(userDn, password)) {
        logger.log(Level.INFO, "Credentials rejected for {0}", username);
        return Optional.empty();
      }
    }

    AttributeMapping mapping = config.getAttributeMapping();
    try (LdapConnectionManager service = connectionFactory.create(config).open()) {
      SearchResultEntry entry =
          service.getEntry(userDn, mapping.attributeNames().toArray(new String[0]));
      if (entry == null) {
        logger.log(Level.WARNING, "Entry {0} vanished after a successful bind", userDn);
        return Optional.empty();
      }
      logger.log(Level.INFO, "Authenticated {0} as {1}", new Object[] {username, userDn});
      return Optional.of(UserProfile.fromEntry(entry, mapping));
    }
  }

  /**
   * DN of {@code username}: the DN template when configured, otherwise the first entry matching
   * {@link #buildUserFilter}.
   */
  @VisibleForTesting
  Optional<String> resolveUserDn(
      LdapConnectionManager session, DirectoryConfig config, String username)
      throws DirectoryException, LDAPException {
    String template = config.getUserDnTemplate();
    if (!template.isEmpty()) {
      return Optional.of(template.replace(USERNAME_PLACEHOLDER, escapeDnValue(username)));
    }
    List<SearchResultEntry> entries =
        session.search(
            config.getSearchBase(),
            SearchScope.SUB,
            buildUserFilter(config, username),
            SearchRequest.NO_ATTRIBUTES);
    return entries.stream().findFirst().map(SearchResultEntry::getDN);
  }

  /**
   * Filter locating {@code username}. The deprecated {@value #LEGACY_PLACEHOLDER} placeholder
   * takes precedence over {@value #USERNAME_PLACEHOLDER}; a filter with neither is replaced by an
   * equality match on the mapped username attribute. Substituted values are escaped.
   */
  @VisibleForTesting
  static Filter buildUserFilter(DirectoryConfig config, String username) throws LDAPException {
    String filter = config.getSearchFilter();
    String value = Filter.encodeValue(username);
    if (filter.contains(LEGACY_PLACEHOLDER)) {
      logger.log(
          Level.WARNING,
          "Search filter placeholder {0} is deprecated; use {1}",
          new Object[] {LEGACY_PLACEHOLDER, USERNAME_PLACEHOLDER});
      return Filter.create(
          filter.replace(LEGACY_PLACEHOLDER, value).replace(USERNAME_PLACEHOLDER, value));
    }
    if (filter.contains(USERNAME_PLACEHOLDER)) {
      return Filter.create(filter.replace(USERNAME_PLACEHOLDER, value));
    }
    return Filter.createEqualityFilter(
        config.getAttributeMapping().get(AttributeMapping.USERNAME), username);
  }

  /** Escapes {@code value} for use as an RDN attribute value. */
  @VisibleForTesting
  static String escapeDnValue(String value) {
    String rdn = new RDN("x", value).toString();
    return rdn.substring(rdn.indexOf('=') + 1);
  }
}
