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
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.unboundid.asn1.ASN1OctetString;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import com.unboundid.ldap.sdk.ServerSet;
import com.unboundid.ldap.sdk.SimpleBindRequest;
import com.unboundid.ldap.sdk.SingleServerSet;
import com.unboundid.ldap.sdk.controls.SimplePagedResultsControl;
import com.unboundid.util.ssl.HostNameSSLSocketVerifier;
import com.unboundid.util.ssl.JVMDefaultTrustManager;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;
import java.io.Closeable;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Owns one session with the directory server of a {@link DirectoryConfig}.
 *
 * <p>Not thread-safe; every operation that needs a session creates its own manager and closes it
 * when done:
 *
 * <pre>{@code
 * try (LdapConnectionManager session = factory.create(config).open()) {
 *   List<SearchResultEntry> entries = session.searchAll(filter, attributes);
 * }
 * }</pre>
 */
public class LdapConnectionManager implements Closeable {
  private static final Logger logger = Logger.getLogger(LdapConnectionManager.class.getName());

  /** Creates unconnected managers. Replaced in tests to observe or prevent network calls. */
  @FunctionalInterface
  public interface Factory {
    LdapConnectionManager create(DirectoryConfig config);
  }

  public static final Factory DEFAULT_FACTORY = LdapConnectionManager::new;

  private final DirectoryConfig config;
  private ServerSet serverSet;
  private LDAPConnection connection;
  private ResultCode lastResultCode;

  public LdapConnectionManager(DirectoryConfig config) {
    this.config = checkNotNull(config, "config can not be null");
  }

  /**
   * Binds with the service account of the configuration, or anonymously if it has none.
   *
   * @return {@code true} if the session is bound
   */
  public boolean connect() {
    return connect(null, null);
  }

  /**
   * Binds as {@code bindDn}. A {@code null} DN falls back to the service account and an empty
   * service account to an anonymous bind. Any open session is closed first.
   *
   * @param bindDn identity to bind as
   * @param secret password of {@code bindDn}
   * @return {@code true} if the session is bound; failures are logged, never thrown
   */
  public boolean connect(@Nullable String bindDn, @Nullable String secret) {
    disconnect();
    String dn = bindDn == null ? config.getBindDn() : bindDn;
    String password = bindDn == null ? config.getBindPassword() : Strings.nullToEmpty(secret);
    LDAPConnection conn = null;
    try {
      conn = getServerSet().getConnection();
      if (dn.isEmpty()) {
        conn.bind(new SimpleBindRequest());
      } else {
        conn.bind(new SimpleBindRequest(dn, password));
      }
      connection = conn;
      lastResultCode = ResultCode.SUCCESS;
      logger.log(Level.FINE, "Bound to {0} as [{1}]", new Object[] {describeServer(), dn});
      return true;
    } catch (LDAPException e) {
      lastResultCode = e.getResultCode();
      logger.log(
          Level.WARNING,
          "Bind to {0} as [{1}] failed: {2} {3}",
          new Object[] {describeServer(), dn, e.getResultCode(), e.getDiagnosticMessage()});
      if (conn != null) {
        conn.close();
      }
      return false;
    } catch (GeneralSecurityException e) {
      lastResultCode = ResultCode.LOCAL_ERROR;
      logger.log(Level.WARNING, "Unable to set up TLS for " + describeServer(), e);
      return false;
    }
  }

  /**
   * Binds with the service account.
   *
   * @return this manager, bound
   * @throws DirectoryException if the bind fails
   */
  public LdapConnectionManager open() throws DirectoryException {
    return open(null, null);
  }

  /**
   * Binds as {@code bindDn}, see {@link #connect(String, String)}.
   *
   * @return this manager, bound
   * @throws DirectoryException with {@link ErrorType#CREDENTIAL_ERROR} if the server rejected the
   *     credentials, {@link ErrorType#CONNECTION_ERROR} otherwise
   */
  public LdapConnectionManager open(@Nullable String bindDn, @Nullable String secret)
      throws DirectoryException {
    if (connect(bindDn, secret)) {
      return this;
    }
    throw new DirectoryException.Builder()
        .setErrorType(
            lastResultCode == ResultCode.INVALID_CREDENTIALS
                ? ErrorType.CREDENTIAL_ERROR
                : ErrorType.CONNECTION_ERROR)
        .setErrorMessage("Unable to bind to " + describeServer())
        .setResultCode(lastResultCode.intValue())
        .build();
  }

  public boolean isConnected() {
    return connection != null && connection.isConnected();
  }

  /** Result code of the latest bind attempt. */
  public Optional<ResultCode> getLastResultCode() {
    return Optional.ofNullable(lastResultCode);
  }

  /** Unbinds and closes the session. Safe to call repeatedly. */
  public void disconnect() {
    if (connection != null) {
      connection.close();
      connection = null;
    }
  }

  @Override
  public void close() {
    disconnect();
  }

  /**
   * Single search request without paging.
   *
   * @throws DirectoryException if the search fails
   */
  public List<SearchResultEntry> search(
      String base, SearchScope scope, Filter filter, String... attributes)
      throws DirectoryException {
    LDAPConnection conn = requireConnection();
    try {
      return conn.search(new SearchRequest(base, scope, filter, attributes)).getSearchEntries();
    } catch (LDAPException e) {
      throw queryError("Search under " + base + " failed", e);
    }
  }

  /**
   * Subtree search under {@code base}, retrieving all pages with the simple paged results
   * control.
   *
   * @throws DirectoryException if any page fails
   */
  public List<SearchResultEntry> searchPaged(
      String base, Filter filter, int pageSize, String... attributes) throws DirectoryException {
    LDAPConnection conn = requireConnection();
    ImmutableList.Builder<SearchResultEntry> entries = ImmutableList.builder();
    ASN1OctetString cookie = null;
    int pages = 0;
    try {
      do {
        SearchRequest request = new SearchRequest(base, SearchScope.SUB, filter, attributes);
        request.setControls(new SimplePagedResultsControl(pageSize, cookie));
        SearchResult result = conn.search(request);
        entries.addAll(result.getSearchEntries());
        pages++;
        SimplePagedResultsControl response = SimplePagedResultsControl.get(result);
        cookie =
            (response != null && response.moreResultsToReturn()) ? response.getCookie() : null;
      } while (cookie != null);
    } catch (LDAPException e) {
      throw queryError("Paged search under " + base + " failed after " + pages + " pages", e);
    }
    return entries.build();
  }

  /**
   * Enumerates the entries under the configured search base, paging when the configuration has a
   * positive page size.
   */
  public List<SearchResultEntry> searchAll(Filter filter, List<String> attributes)
      throws DirectoryException {
    String[] attrs = attributes.toArray(new String[0]);
    if (config.getPageSize() > 0) {
      return searchPaged(config.getSearchBase(), filter, config.getPageSize(), attrs);
    }
    return search(config.getSearchBase(), SearchScope.SUB, filter, attrs);
  }

  /**
   * Reads one entry with a base scope search.
   *
   * @return the entry, or {@code null} if it does not exist
   * @throws DirectoryException if the read fails
   */
  @Nullable
  public SearchResultEntry getEntry(String dn, String... attributes) throws DirectoryException {
    LDAPConnection conn = requireConnection();
    try {
      return conn.getEntry(dn, attributes);
    } catch (LDAPException e) {
      throw queryError("Read of " + dn + " failed", e);
    }
  }

  /**
   * Opens and closes a service account session.
   *
   * @return {@code true} if the bind succeeded
   */
  public boolean testConnection() {
    try {
      return connect();
    } finally {
      disconnect();
    }
  }

  private LDAPConnection requireConnection() throws DirectoryException {
    if (connection == null) {
      throw new DirectoryException.Builder()
          .setErrorType(ErrorType.CONNECTION_ERROR)
          .setErrorMessage("Not connected to " + describeServer())
          .build();
    }
    return connection;
  }

  private static DirectoryException queryError(String message, LDAPException e) {
    return new DirectoryException.Builder()
        .setErrorType(ErrorType.QUERY_ERROR)
        .setErrorMessage(message + ": " + e.getResultCode())
        .setResultCode(e.getResultCode().intValue())
        .setCause(e)
        .build();
  }

  private ServerSet getServerSet() throws GeneralSecurityException {
    if (serverSet == null) {
      serverSet = createServerSet(config);
    }
    return serverSet;
  }

  @VisibleForTesting
  static ServerSet createServerSet(DirectoryConfig config) throws GeneralSecurityException {
    LDAPConnectionOptions options = new LDAPConnectionOptions();
    options.setConnectTimeoutMillis(config.getTimeoutMillis());
    options.setResponseTimeoutMillis(config.getTimeoutMillis());
    if (!config.isUseSsl()) {
      return new SingleServerSet(config.getHost(), config.getPort(), options);
    }
    SSLUtil sslUtil;
    if (config.isTrustAllCertificates()) {
      sslUtil = new SSLUtil(new TrustAllTrustManager());
    } else {
      sslUtil = new SSLUtil(JVMDefaultTrustManager.getInstance());
      options.setSSLSocketVerifier(new HostNameSSLSocketVerifier(true));
    }
    return new SingleServerSet(
        config.getHost(), config.getPort(), sslUtil.createSSLSocketFactory(), options);
  }

  private String describeServer() {
    return (config.isUseSsl() ? "ldaps://" : "ldap://") + config.getHost() + ":" + config.getPort();
  }
}
