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

import com.enterprise.dirsync.sdk.ExceptionHandler;
import com.enterprise.dirsync.sdk.ExponentialBackoffExceptionHandler;
import com.enterprise.dirsync.sdk.StartupException;
import com.enterprise.dirsync.sdk.StatsManager;
import com.enterprise.dirsync.sdk.config.Configuration;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractIdleService;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process entry point. Builds every component once, starts the scheduler when the active
 * configuration has sync enabled and stops it on shutdown.
 *
 * <pre>{@code
 * java -jar directory-sync-identity.jar -Dconfig=directory-sync.properties
 * }</pre>
 *
 * <p>The initial configuration is read from the properties file (see {@link DirectoryConfig})
 * unless the config store already holds an active one.
 */
public class DirectorySyncApplication extends AbstractIdleService {
  private static final Logger logger = Logger.getLogger(DirectorySyncApplication.class.getName());

  static final ExceptionHandler DEFAULT_EXCEPTION_HANDLER =
      new ExponentialBackoffExceptionHandler(10, 5, TimeUnit.SECONDS);

  private final ConfigStore configStore;
  private final DirectoryUserStore userStore;
  private final LocalAccountProvisioner provisioner;
  private final LdapConnectionManager.Factory connectionFactory;
  private final Clock clock;
  private final DirectorySyncScheduler.Builder schedulerBuilder;
  private final ApplicationHelper helper;

  private DirectorySyncScheduler scheduler;
  private DirectoryAdminService adminService;

  private DirectorySyncApplication(Builder builder) {
    this.configStore = checkNotNull(builder.configStore);
    this.userStore = checkNotNull(builder.userStore);
    this.provisioner = checkNotNull(builder.provisioner);
    this.connectionFactory = checkNotNull(builder.connectionFactory);
    this.clock = checkNotNull(builder.clock);
    this.schedulerBuilder = checkNotNull(builder.schedulerBuilder);
    this.helper = checkNotNull(builder.helper);
  }

  public static void main(String[] args) throws InterruptedException {
    DirectorySyncApplication application = new Builder(args).build();
    application.helper
        .getRuntimeInstance()
        .addShutdownHook(
            application.helper.createShutdownHookThread(
                () -> application.stopAsync().awaitTerminated()));
    application.startAsync().awaitRunning();
  }

  @Override
  protected void startUp() throws Exception {
    DirectoryConfig config = bootstrapConfig();
    LdapAuthenticator authenticator = new LdapAuthenticator(configStore, connectionFactory);
    DirectorySyncEngine engine =
        new DirectorySyncEngine.Builder()
            .setConfigStore(configStore)
            .setUserStore(userStore)
            .setProvisioner(provisioner)
            .setConnectionFactory(connectionFactory)
            .setClock(clock)
            .build();
    scheduler =
        schedulerBuilder.setSyncEngine(engine).setConfigStore(configStore).setClock(clock).build();
    adminService =
        new DirectoryAdminService(
            configStore, userStore, authenticator, engine, scheduler, connectionFactory);
    // started regardless; each tick skips while sync is disabled
    scheduler.start();
    if (!config.isEnabled() || !config.isSyncEnabled()) {
      logger.log(Level.INFO, "Directory sync disabled; scheduler idle until it is enabled.");
    }
  }

  @Override
  protected void shutDown() throws Exception {
    if (scheduler != null) {
      scheduler.stop();
    }
    logger.info(StatsManager.getInstance().printStats());
  }

  /** Returns the active configuration, storing the one from properties if there is none. */
  private DirectoryConfig bootstrapConfig() throws InterruptedException {
    ExceptionHandler exceptionHandler = helper.getDefaultExceptionHandler();
    for (int tries = 1; ; tries++) {
      try {
        Optional<DirectoryConfig> active = configStore.getActiveConfig();
        if (active.isPresent()) {
          return active.get();
        }
        DirectoryConfig stored = configStore.saveConfig(DirectoryConfig.fromConfiguration());
        logger.log(Level.CONFIG, "Loaded directory configuration {0}", stored);
        return stored;
      } catch (StartupException e) {
        throw e;
      } catch (IOException e) {
        logger.log(Level.WARNING, "Failed to initialize directory configuration", e);
        if (!exceptionHandler.handleException(e, tries)) {
          throw new StartupException("Failed to initialize directory configuration", e);
        }
      }
    }
  }

  /** Available once the service is running. */
  public DirectoryAdminService getAdminService() {
    checkState(adminService != null, "application not started");
    return adminService;
  }

  @VisibleForTesting
  DirectorySyncScheduler getScheduler() {
    checkState(scheduler != null, "application not started");
    return scheduler;
  }

  /** Factory and runtime hooks, replaced in tests. */
  @VisibleForTesting
  static class ApplicationHelper {
    Thread createShutdownHookThread(Runnable task) {
      return new Thread(task, "directory-sync-shutdown");
    }

    Runtime getRuntimeInstance() {
      return Runtime.getRuntime();
    }

    ExceptionHandler getDefaultExceptionHandler() {
      return DEFAULT_EXCEPTION_HANDLER;
    }
  }

  /** Builder for {@link DirectorySyncApplication}. */
  public static class Builder {
    private final String[] args;
    private ConfigStore configStore = new InMemoryConfigStore();
    private DirectoryUserStore userStore = new InMemoryDirectoryUserStore();
    private LocalAccountProvisioner provisioner = new InMemoryLocalAccountProvisioner();
    private LdapConnectionManager.Factory connectionFactory =
        LdapConnectionManager.DEFAULT_FACTORY;
    private Clock clock = Clock.systemUTC();
    private DirectorySyncScheduler.ExecutionStrategy executionStrategy;
    private ApplicationHelper helper = new ApplicationHelper();
    private DirectorySyncScheduler.Builder schedulerBuilder;

    /** @param args command line arguments, {@code -Dkey=value} overrides included */
    public Builder(String[] args) {
      this.args = checkNotNull(args);
    }

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

    public Builder setExecutionStrategy(
        DirectorySyncScheduler.ExecutionStrategy executionStrategy) {
      this.executionStrategy = executionStrategy;
      return this;
    }

    @VisibleForTesting
    Builder setHelper(ApplicationHelper helper) {
      this.helper = helper;
      return this;
    }

    /**
     * Loads the configuration when not yet initialized and creates the application.
     *
     * @throws StartupException if the configuration can not be loaded
     */
    public DirectorySyncApplication build() {
      try {
        if (!Configuration.isInitialized()) {
          Configuration.initConfig(args);
        }
      } catch (IOException e) {
        throw new StartupException("failed to load configuration", e);
      }
      schedulerBuilder = DirectorySyncScheduler.Builder.fromConfiguration();
      if (executionStrategy != null) {
        schedulerBuilder.setExecutionStrategy(executionStrategy);
      }
      return new DirectorySyncApplication(this);
    }
  }
}
