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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.enterprise.dirsync.sdk.DirectoryException;
import com.enterprise.dirsync.sdk.DirectoryException.ErrorType;
import com.enterprise.dirsync.sdk.StatsManager;
import com.enterprise.dirsync.sdk.StatsManager.ResetStatsRule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.unboundid.ldap.sdk.Filter;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DirectorySyncEngine}. */
@RunWith(JUnit4.class)
public class DirectorySyncEngineTest {
  @Rule public InMemoryDirectoryRule directory = new InMemoryDirectoryRule();
  @Rule public ResetStatsRule resetStats = new ResetStatsRule();

  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
  private static final String ALICE_DN = "uid=alice," + InMemoryDirectoryRule.PEOPLE_DN;
  private static final String BOB_DN = "uid=bob," + InMemoryDirectoryRule.PEOPLE_DN;

  private final FakeClock clock = new FakeClock(START);
  private InMemoryConfigStore configStore;
  private InMemoryDirectoryUserStore userStore;
  private InMemoryLocalAccountProvisioner provisioner;
  private ExecutorService executor;

  @Before
  public void setUp() {
    configStore = new InMemoryConfigStore();
    userStore = new InMemoryDirectoryUserStore();
    provisioner = new InMemoryLocalAccountProvisioner();
    executor = Executors.newSingleThreadExecutor();
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  private DirectorySyncEngine.Builder engineBuilder() {
    return new DirectorySyncEngine.Builder()
        .setConfigStore(configStore)
        .setUserStore(userStore)
        .setProvisioner(provisioner)
        .setClock(clock);
  }

  private String saveConfig(DirectoryConfig.Builder config) throws IOException {
    return configStore.saveConfig(config.build()).getId().get();
  }

  @Test
  public void syncUsers_createsRecords() throws Exception {
    String configId = saveConfig(directory.configBuilder());

    SyncResult result = engineBuilder().build().syncUsers();

    assertTrue(result.isSuccess());
    assertFalse(result.isSkipped());
    assertEquals(new SyncStats(3, 3, 0, 0, 0), result.getStats());
    List<DirectoryUser> users = userStore.listByConfig(configId, true);
    assertEquals(3, users.size());
    DirectoryUser alice = userStore.findByDn(configId, ALICE_DN).get();
    assertEquals("alice", alice.getUsername());
    assertEquals("alice@example.com", alice.getEmail());
    assertEquals("Alice A.", alice.getNickname());
    assertEquals(UserSyncStatus.SYNCED, alice.getSyncStatus());
    assertEquals(Optional.of(START), alice.getLastSyncTime());
    assertEquals(Optional.empty(), alice.getLocalAccountId());
    assertEquals("", userStore.findByDn(configId, BOB_DN).get().getNickname());

    DirectoryConfig config = configStore.getActiveConfig().get();
    assertEquals(SyncStatus.COMPLETED, config.getSyncStatus());
    assertEquals(Optional.of(START), config.getLastSyncTime());
    assertEquals(1, StatsManager.getComponent("SyncEngine").getSuccessCount("syncUsers"));
  }

  @Test
  public void syncUsers_secondPassUpdatesInPlace() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    DirectoryUser before = userStore.findByDn(configId, ALICE_DN).get();
    clock.advance(Duration.ofMinutes(5));

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(3, 0, 3, 0, 0), result.getStats());
    DirectoryUser after = userStore.findByDn(configId, ALICE_DN).get();
    assertEquals(before.getId(), after.getId());
    assertEquals(Optional.of(START.plus(Duration.ofMinutes(5))), after.getLastSyncTime());
    assertEquals(before.toBuilder().setLastSyncTime(null).build(),
        after.toBuilder().setLastSyncTime(null).build());
    assertEquals(3, userStore.listByConfig(configId, false).size());
  }

  @Test
  public void syncUsers_pageSizeZeroUsesSingleSearch() throws Exception {
    saveConfig(directory.configBuilder().setPageSize(0));
    assertEquals(3, engineBuilder().build().syncUsers().getStats().getCreated());
  }

  @Test
  public void syncUsers_missingEntryMarkedStale() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    directory.deleteUser("bob");
    clock.advance(Duration.ofHours(1));

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(2, 0, 2, 1, 0), result.getStats());
    DirectoryUser bob = userStore.findByDn(configId, BOB_DN).get();
    assertFalse(bob.isActive());
    assertEquals(UserSyncStatus.STALE, bob.getSyncStatus());
    assertEquals(Optional.of(START.plus(Duration.ofHours(1))), bob.getStaleSince());
    assertTrue(userStore.findByDn(configId, ALICE_DN).get().isActive());
    assertEquals(2, userStore.listByConfig(configId, true).size());
  }

  @Test
  public void syncUsers_staleUserReturns() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    directory.deleteUser("bob");
    engine.syncUsers();
    String bobId = userStore.findByDn(configId, BOB_DN).get().getId().get();
    directory.addUser("bob", "Bob Brown", "bob@example.com");

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(3, 0, 3, 0, 0), result.getStats());
    DirectoryUser bob = userStore.findById(bobId).get();
    assertTrue(bob.isActive());
    assertEquals(UserSyncStatus.SYNCED, bob.getSyncStatus());
    assertEquals(Optional.empty(), bob.getStaleSince());
  }

  @Test
  public void syncUsers_renamedEntryMatchedByEmail() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    String aliceId = userStore.findByDn(configId, ALICE_DN).get().getId().get();
    directory.renameUser("alice", "alice2");

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(3, 0, 3, 0, 0), result.getStats());
    DirectoryUser alice = userStore.findById(aliceId).get();
    assertEquals("uid=alice2," + InMemoryDirectoryRule.PEOPLE_DN, alice.getDn());
    assertEquals("alice2", alice.getUsername());
    assertTrue(alice.isActive());
    assertEquals(3, userStore.listByConfig(configId, false).size());
  }

  @Test
  public void syncUsers_movedEntryMatchedByUsername() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    String carolId = userStore.findByUsername(configId, "carol").get().getId().get();
    directory.deleteUser("carol");
    directory.addUser("carol", "Carol Clark", "carol.clark@example.com");

    engine.syncUsers();

    DirectoryUser carol = userStore.findById(carolId).get();
    assertEquals("carol.clark@example.com", carol.getEmail());
    assertEquals(3, userStore.listByConfig(configId, false).size());
  }

  @Test
  public void syncUsers_entryFailureCountedAndPassContinues() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    userStore = spy(new InMemoryDirectoryUserStore());
    doThrow(new IOException("disk full"))
        .when(userStore)
        .create(argThat(user -> user != null && "bob".equals(user.getUsername())));

    SyncResult result = engineBuilder().build().syncUsers();

    assertTrue(result.isSuccess());
    assertEquals(new SyncStats(3, 2, 0, 0, 1), result.getStats());
    assertEquals(Optional.empty(), userStore.findByDn(configId, BOB_DN));
    assertEquals(SyncStatus.COMPLETED, configStore.getActiveConfig().get().getSyncStatus());
  }

  @Test
  public void syncUsers_failedUpdateDoesNotStaleRecord() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    userStore = spy(new InMemoryDirectoryUserStore());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    doThrow(new IOException("disk full"))
        .when(userStore)
        .update(argThat(user -> user != null && "bob".equals(user.getUsername())));

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(3, 0, 2, 0, 1), result.getStats());
    assertTrue(userStore.findByDn(configId, BOB_DN).get().isActive());
  }

  @Test
  public void syncUsers_failedUpdateOfRenamedEntryDoesNotStaleRecord() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    userStore = spy(new InMemoryDirectoryUserStore());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    directory.renameUser("alice", "alice2");
    doThrow(new IOException("disk full"))
        .when(userStore)
        .update(argThat(user -> user != null && "alice2".equals(user.getUsername())));

    SyncResult result = engine.syncUsers();

    assertEquals(new SyncStats(3, 0, 2, 0, 1), result.getStats());
    DirectoryUser alice = userStore.findByDn(configId, ALICE_DN).get();
    assertTrue(alice.isActive());
    assertEquals(Optional.empty(), alice.getStaleSince());
  }

  @Test
  public void syncUsers_enumerationFailureLeavesStoreUntouched() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    engineBuilder().build().syncUsers();
    LdapConnectionManager session = mock(LdapConnectionManager.class);
    when(session.open()).thenReturn(session);
    when(session.searchAll(any(Filter.class), any()))
        .thenThrow(
            new DirectoryException.Builder()
                .setErrorType(ErrorType.QUERY_ERROR)
                .setErrorMessage("size limit exceeded")
                .build());

    SyncResult result = engineBuilder().setConnectionFactory(config -> session).build().syncUsers();

    assertFalse(result.isSuccess());
    assertFalse(result.isSkipped());
    assertEquals(3, userStore.listByConfig(configId, true).size());
    DirectoryConfig config = configStore.getActiveConfig().get();
    assertEquals(SyncStatus.ERROR, config.getSyncStatus());
    assertEquals(Optional.of(START), config.getLastSyncTime());
    verify(session).close();
  }

  @Test
  public void syncUsers_bindFailure() throws Exception {
    saveConfig(directory.configBuilder().setBindPassword("wrong"));
    SyncResult result = engineBuilder().build().syncUsers();
    assertFalse(result.isSuccess());
    assertEquals(SyncStatus.ERROR, configStore.getActiveConfig().get().getSyncStatus());
    assertEquals(1, StatsManager.getComponent("SyncEngine").getFailureCount("syncUsers"));
  }

  @Test
  public void syncUsers_invalidFilter() throws Exception {
    saveConfig(directory.configBuilder().setSearchFilter("(objectClass=person"));
    LdapConnectionManager.Factory factory = mock(LdapConnectionManager.Factory.class);
    assertFalse(engineBuilder().setConnectionFactory(factory).build().syncUsers().isSuccess());
    assertEquals(SyncStatus.ERROR, configStore.getActiveConfig().get().getSyncStatus());
    verifyNoInteractions(factory);
  }

  @Test
  public void syncUsers_disabledNeverContactsDirectory() throws Exception {
    saveConfig(directory.configBuilder().setSyncEnabled(false));
    LdapConnectionManager.Factory factory = mock(LdapConnectionManager.Factory.class);

    SyncResult result = engineBuilder().setConnectionFactory(factory).build().syncUsers();

    assertTrue(result.isSkipped());
    assertFalse(result.isSuccess());
    verifyNoInteractions(factory);
    assertEquals(SyncStatus.IDLE, configStore.getActiveConfig().get().getSyncStatus());
  }

  @Test
  public void syncUsers_notConfigured() {
    assertTrue(engineBuilder().build().syncUsers().isSkipped());
  }

  @Test
  public void syncUsers_concurrentCallSkipped() throws Exception {
    saveConfig(directory.configBuilder());
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    LdapConnectionManager session = mock(LdapConnectionManager.class);
    when(session.open()).thenReturn(session);
    when(session.searchAll(any(Filter.class), any()))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await();
              return ImmutableList.of();
            });
    DirectorySyncEngine engine = engineBuilder().setConnectionFactory(config -> session).build();

    Future<SyncResult> first = executor.submit(engine::syncUsers);
    assertTrue(entered.await(10, TimeUnit.SECONDS));
    SyncResult second = engine.syncUsers();
    release.countDown();

    assertTrue(second.isSkipped());
    assertTrue(first.get(10, TimeUnit.SECONDS).isSuccess());
    assertEquals(
        1, StatsManager.getComponent("SyncEngine").getLogResultCounter("syncUsers", "SKIPPED"));
    // guard released after the pass
    assertTrue(engine.syncUsers().isSuccess());
  }

  @Test
  public void syncUsers_provisionsNewUsers() throws Exception {
    String configId = saveConfig(directory.configBuilder().setAutoCreateUser(true));
    String existingAccount = provisioner.createAccount("ALICE@example.com", "alice");

    SyncResult result = engineBuilder().build().syncUsers();

    assertEquals(new SyncStats(3, 3, 0, 0, 0), result.getStats());
    assertEquals(
        Optional.of(existingAccount),
        userStore.findByDn(configId, ALICE_DN).get().getLocalAccountId());
    assertEquals(
        provisioner.findAccountIdByEmail("bob@example.com"),
        userStore.findByDn(configId, BOB_DN).get().getLocalAccountId());
    assertTrue(userStore.findByDn(configId, BOB_DN).get().getLocalAccountId().isPresent());
  }

  @Test
  public void syncUsers_provisionFallbacks() throws Exception {
    saveConfig(directory.configBuilder().setAutoCreateUser(true));
    directory.addUser("dave", "Dave Doe", null);
    LocalAccountProvisioner mockProvisioner = mock(LocalAccountProvisioner.class);
    when(mockProvisioner.findAccountIdByEmail(anyString())).thenReturn(Optional.empty());
    when(mockProvisioner.createAccount(anyString(), anyString())).thenReturn("account-1");

    engineBuilder().setProvisioner(mockProvisioner).build().syncUsers();

    verify(mockProvisioner).createAccount("dave@ldap.local", "dave");
    verify(mockProvisioner).createAccount("alice@example.com", "Alice A.");
    verify(mockProvisioner).createAccount("bob@example.com", "bob");
  }

  @Test
  public void syncUsers_provisionOnlyOnCreate() throws Exception {
    saveConfig(directory.configBuilder().setAutoCreateUser(true));
    LocalAccountProvisioner mockProvisioner = mock(LocalAccountProvisioner.class);
    when(mockProvisioner.findAccountIdByEmail(anyString())).thenReturn(Optional.empty());
    when(mockProvisioner.createAccount(anyString(), anyString())).thenReturn("account-1");
    DirectorySyncEngine engine = engineBuilder().setProvisioner(mockProvisioner).build();
    engine.syncUsers();

    LocalAccountProvisioner second = mock(LocalAccountProvisioner.class);
    engineBuilder().setProvisioner(second).build().syncUsers();

    verifyNoInteractions(second);
  }

  @Test
  public void syncUsers_provisionFailureCounted() throws Exception {
    String configId = saveConfig(directory.configBuilder().setAutoCreateUser(true));
    LocalAccountProvisioner failing = mock(LocalAccountProvisioner.class);
    when(failing.findAccountIdByEmail(anyString())).thenReturn(Optional.empty());
    when(failing.createAccount(anyString(), anyString()))
        .thenThrow(new IllegalStateException("account service down"));

    SyncResult result = engineBuilder().setProvisioner(failing).build().syncUsers();

    assertTrue(result.isSuccess());
    assertEquals(new SyncStats(3, 3, 0, 0, 3), result.getStats());
    assertEquals(3, userStore.listByConfig(configId, true).size());
  }

  @Test
  public void enumerationFilter_widensPlaceholders() throws Exception {
    assertEquals(
        Filter.create("(&(objectClass=person)(uid=*))"),
        DirectorySyncEngine.enumerationFilter(
            directory.configBuilder()
                .setSearchFilter("(&(objectClass=person)(uid={username}))")
                .build()));
    assertEquals(
        Filter.create("(uid=*)"),
        DirectorySyncEngine.enumerationFilter(
            directory.configBuilder().setSearchFilter("(uid={})").build()));
  }

  @Test
  public void syncUsers_placeholderFilterEnumeratesEveryone() throws Exception {
    saveConfig(directory.configBuilder().setSearchFilter("(uid={username})"));
    assertEquals(3, engineBuilder().build().syncUsers().getStats().getFound());
  }

  @Test
  public void recordLogin_createsAndStampsLogin() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    UserProfile profile = profile(ALICE_DN, "alice", "alice@example.com");

    DirectoryUser user = engineBuilder().build().recordLogin(profile);

    assertEquals(Optional.of(START), user.getLastLoginTime());
    assertEquals(Optional.empty(), user.getLocalAccountId());
    assertEquals(user, userStore.findByDn(configId, ALICE_DN).get());
    assertEquals(1, StatsManager.getComponent("SyncEngine").getRegisteredCount("recordLogin"));
  }

  @Test
  public void recordLogin_linksAccountWhenAutoCreate() throws Exception {
    saveConfig(directory.configBuilder().setAutoCreateUser(true));
    DirectorySyncEngine engine = engineBuilder().build();

    DirectoryUser first = engine.recordLogin(profile(ALICE_DN, "alice", "alice@example.com"));
    clock.advance(Duration.ofMinutes(1));
    DirectoryUser second = engine.recordLogin(profile(ALICE_DN, "alice", "alice@example.com"));

    assertTrue(first.getLocalAccountId().isPresent());
    assertEquals(first.getId(), second.getId());
    assertEquals(first.getLocalAccountId(), second.getLocalAccountId());
    assertEquals(Optional.of(START.plus(Duration.ofMinutes(1))), second.getLastLoginTime());
  }

  @Test
  public void recordLogin_reactivatesStaleUser() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    directory.deleteUser("bob");
    engine.syncUsers();

    DirectoryUser bob = engine.recordLogin(profile(BOB_DN, "bob", "bob@example.com"));

    assertTrue(bob.isActive());
    assertEquals(UserSyncStatus.SYNCED, bob.getSyncStatus());
    assertEquals(3, userStore.listByConfig(configId, true).size());
  }

  @Test(expected = DirectoryException.class)
  public void recordLogin_notConfigured() throws Exception {
    engineBuilder().build().recordLogin(profile(ALICE_DN, "alice", "alice@example.com"));
  }

  @Test
  public void purgeStaleUsers_honorsRetention() throws Exception {
    String configId = saveConfig(directory.configBuilder().setStaleRetentionDays(30));
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    directory.deleteUser("bob");
    engine.syncUsers();

    clock.advance(Duration.ofDays(29));
    assertEquals(0, engine.purgeStaleUsers());
    assertTrue(userStore.findByDn(configId, BOB_DN).isPresent());

    clock.advance(Duration.ofDays(2));
    assertEquals(1, engine.purgeStaleUsers());
    assertEquals(Optional.empty(), userStore.findByDn(configId, BOB_DN));
    assertEquals(2, userStore.listByConfig(configId, false).size());
  }

  @Test
  public void purgeStaleUsers_notConfigured() throws Exception {
    assertEquals(0, engineBuilder().build().purgeStaleUsers());
  }

  @Test
  public void setUserActive_onlyFlipsFlag() throws Exception {
    String configId = saveConfig(directory.configBuilder());
    DirectorySyncEngine engine = engineBuilder().build();
    engine.syncUsers();
    DirectoryUser alice = userStore.findByDn(configId, ALICE_DN).get();

    assertTrue(engine.setUserActive(alice.getId().get(), false));

    DirectoryUser disabled = userStore.findById(alice.getId().get()).get();
    assertFalse(disabled.isActive());
    assertEquals(UserSyncStatus.SYNCED, disabled.getSyncStatus());
    assertEquals(Optional.empty(), disabled.getStaleSince());
    assertFalse(engine.setUserActive("no-such-user", true));
  }

  @Test
  public void syncUsers_mappingOverride() throws Exception {
    String configId =
        saveConfig(
            directory.configBuilder()
                .setAttributeMapping(
                    AttributeMapping.withOverrides(ImmutableMap.of("nickname", "cn"))));
    engineBuilder().build().syncUsers();
    assertEquals("Bob Brown", userStore.findByDn(configId, BOB_DN).get().getNickname());
  }

  @Test
  public void syncUsers_userStoreNeverWrittenWhenSkipped() throws Exception {
    saveConfig(directory.configBuilder().setEnabled(false));
    DirectoryUserStore store = mock(DirectoryUserStore.class);
    new DirectorySyncEngine.Builder()
        .setConfigStore(configStore)
        .setUserStore(store)
        .setProvisioner(provisioner)
        .build()
        .syncUsers();
    verify(store, never()).markStale(anyString(), any(), any());
  }

  private static UserProfile profile(String dn, String username, String email) {
    return new UserProfile(dn, username, email, "", "", "", ImmutableMap.of());
  }
}
