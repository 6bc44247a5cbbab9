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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.enterprise.dirsync.sdk.DirectoryException;
import com.enterprise.dirsync.sdk.DirectoryException.ErrorType;
import com.google.common.collect.ImmutableList;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LdapConnectionManager}. */
@RunWith(JUnit4.class)
public class LdapConnectionManagerTest {
  @Rule public InMemoryDirectoryRule directory = new InMemoryDirectoryRule();
  @Rule public ExpectedException thrown = ExpectedException.none();

  private static final Filter PERSON = Filter.createEqualityFilter("objectClass", "person");

  @Test
  public void connect_serviceAccount() {
    LdapConnectionManager manager = new LdapConnectionManager(directory.configBuilder().build());
    assertTrue(manager.connect());
    assertTrue(manager.isConnected());
    assertEquals(Optional.of(ResultCode.SUCCESS), manager.getLastResultCode());
    manager.disconnect();
  }

  @Test
  public void connect_anonymousWithoutServiceAccount() {
    DirectoryConfig config = directory.configBuilder().setBindDn("").setBindPassword("").build();
    try (LdapConnectionManager manager = new LdapConnectionManager(config)) {
      assertTrue(manager.connect());
    }
  }

  @Test
  public void connect_wrongPassword() {
    DirectoryConfig config = directory.configBuilder().setBindPassword("wrong").build();
    LdapConnectionManager manager = new LdapConnectionManager(config);
    assertFalse(manager.connect());
    assertFalse(manager.isConnected());
    assertEquals(Optional.of(ResultCode.INVALID_CREDENTIALS), manager.getLastResultCode());
  }

  @Test
  public void connect_asUser() {
    try (LdapConnectionManager manager =
        new LdapConnectionManager(directory.configBuilder().build())) {
      assertTrue(manager.connect("uid=alice," + InMemoryDirectoryRule.PEOPLE_DN, "alice-secret"));
      assertFalse(manager.connect("uid=alice," + InMemoryDirectoryRule.PEOPLE_DN, "bob-secret"));
    }
  }

  @Test
  public void open_wrongPassword_credentialError() throws Exception {
    DirectoryConfig config = directory.configBuilder().setBindPassword("wrong").build();
    try {
      new LdapConnectionManager(config).open();
      fail("expected DirectoryException");
    } catch (DirectoryException e) {
      assertEquals(ErrorType.CREDENTIAL_ERROR, e.getErrorType());
      assertEquals(Optional.of(ResultCode.INVALID_CREDENTIALS.intValue()), e.getResultCode());
    }
  }

  @Test
  public void open_unreachableServer_connectionError() throws Exception {
    DirectoryConfig config =
        directory.configBuilder().setPort(1).setTimeoutMillis(1000).build();
    try {
      new LdapConnectionManager(config).open();
      fail("expected DirectoryException");
    } catch (DirectoryException e) {
      assertEquals(ErrorType.CONNECTION_ERROR, e.getErrorType());
      assertThat(e.getMessage(), containsString("ldap://localhost:1"));
    }
  }

  @Test
  public void open_returnsSameManager() throws Exception {
    LdapConnectionManager manager = new LdapConnectionManager(directory.configBuilder().build());
    try (LdapConnectionManager opened = manager.open()) {
      assertSame(manager, opened);
    }
  }

  @Test
  public void disconnect_repeated() throws Exception {
    LdapConnectionManager manager = new LdapConnectionManager(directory.configBuilder().build());
    manager.disconnect();
    manager.open();
    manager.disconnect();
    manager.disconnect();
    manager.close();
    assertFalse(manager.isConnected());
  }

  @Test
  public void search_notConnected() throws Exception {
    thrown.expect(DirectoryException.class);
    thrown.expectMessage("Not connected");
    new LdapConnectionManager(directory.configBuilder().build())
        .search(InMemoryDirectoryRule.PEOPLE_DN, SearchScope.SUB, PERSON, "uid");
  }

  @Test
  public void search_invalidBase_queryError() throws Exception {
    try (LdapConnectionManager manager =
        new LdapConnectionManager(directory.configBuilder().build()).open()) {
      manager.search("ou=missing,dc=example,dc=com", SearchScope.SUB, PERSON, "uid");
      fail("expected DirectoryException");
    } catch (DirectoryException e) {
      assertEquals(ErrorType.QUERY_ERROR, e.getErrorType());
      assertEquals(Optional.of(ResultCode.NO_SUCH_OBJECT.intValue()), e.getResultCode());
    }
  }

  @Test
  public void searchPaged_collectsEveryPage() throws Exception {
    try (LdapConnectionManager manager =
        new LdapConnectionManager(directory.configBuilder().build()).open()) {
      int before = directory.getSearchCount();
      List<SearchResultEntry> entries =
          manager.searchPaged(InMemoryDirectoryRule.PEOPLE_DN, PERSON, 1, "uid");
      assertEquals(ImmutableList.of("alice", "bob", "carol"), usernames(entries));
      assertTrue(directory.getSearchCount() - before >= 3);
    }
  }

  @Test
  public void searchAll_withoutPaging() throws Exception {
    DirectoryConfig config = directory.configBuilder().setPageSize(0).build();
    try (LdapConnectionManager manager = new LdapConnectionManager(config).open()) {
      int before = directory.getSearchCount();
      List<SearchResultEntry> entries = manager.searchAll(PERSON, ImmutableList.of("uid"));
      assertEquals(ImmutableList.of("alice", "bob", "carol"), usernames(entries));
      assertEquals(1, directory.getSearchCount() - before);
    }
  }

  @Test
  public void getEntry() throws Exception {
    try (LdapConnectionManager manager =
        new LdapConnectionManager(directory.configBuilder().build()).open()) {
      SearchResultEntry entry =
          manager.getEntry("uid=bob," + InMemoryDirectoryRule.PEOPLE_DN, "mail");
      assertEquals("bob@example.com", entry.getAttributeValue("mail"));
      assertNull(manager.getEntry("uid=nobody," + InMemoryDirectoryRule.PEOPLE_DN, "mail"));
    }
  }

  @Test
  public void testConnection() {
    assertTrue(new LdapConnectionManager(directory.configBuilder().build()).testConnection());
    assertFalse(
        new LdapConnectionManager(directory.configBuilder().setBindPassword("wrong").build())
            .testConnection());
  }

  private static List<String> usernames(List<SearchResultEntry> entries) {
    return entries.stream()
        .map(e -> e.getAttributeValue("uid"))
        .sorted()
        .collect(Collectors.toList());
  }
}
