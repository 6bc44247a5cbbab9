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
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.dirsync.sdk.StatsManager;
import com.enterprise.dirsync.sdk.StatsManager.OperationStats;
import com.enterprise.dirsync.sdk.config.Configuration;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when {@link DirectorySyncEngine#syncUsers()} runs.
 *
 * <p>Every tick reads the active configuration and triggers a pass when sync is enabled and at
 * least {@code max(syncInterval, 30s)} has passed since the previous attempt. The attempt time is
 * recorded before the pass starts, so a failing pass is not retried before the next interval. A
 * tick that throws is followed by the error backoff instead of the tick interval.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #TICK_INTERVAL_SECS} - seconds between ticks, default 10.
 *   <li>{@value #ERROR_BACKOFF_SECS} - seconds to wait after a failed tick, default 30.
 *   <li>{@value #PURGE_STALE_USERS} - purge expired stale users after each successful pass.
 * </ul>
 */
public class DirectorySyncScheduler {
  private static final Logger logger = Logger.getLogger(DirectorySyncScheduler.class.getName());
  private static final OperationStats stats = StatsManager.getComponent("Scheduler");

  public static final String TICK_INTERVAL_SECS = "schedule.tickIntervalSecs";
  public static final String ERROR_BACKOFF_SECS = "schedule.errorBackoffSecs";
  public static final String PURGE_STALE_USERS = "schedule.purgeStaleUsers";

  static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(10);
  static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(30);
  static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

  private final DirectorySyncEngine syncEngine;
  private final ConfigStore configStore;
  private final Clock clock;
  private final Duration tickInterval;
  private final Duration errorBackoff;
  private final Duration stopTimeout;
  private final boolean purgeStaleUsers;
  private final ExecutionStrategy executionStrategy;
  private final ConcurrentMap<String, Instant> lastAttempts = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean();

  private DirectorySyncScheduler(Builder builder) {
    this.syncEngine = checkNotNull(builder.syncEngine, "syncEngine can not be null");
    this.configStore = checkNotNull(builder.configStore, "configStore can not be null");
    this.clock = checkNotNull(builder.clock);
    this.tickInterval = checkNotNull(builder.tickInterval);
    this.errorBackoff = checkNotNull(builder.errorBackoff);
    this.stopTimeout = checkNotNull(builder.stopTimeout);
    this.purgeStaleUsers = builder.purgeStaleUsers;
    this.executionStrategy = checkNotNull(builder.executionStrategy);
    checkArgument(!tickInterval.isNegative() && !tickInterval.isZero(),
        "tick interval must be positive");
  }

  /** Starts ticking. Has no effect if already started. */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      logger.log(Level.FINE, "Scheduler already started.");
      return;
    }
    logger.log(Level.INFO, "Starting directory sync scheduler, ticking every {0}", tickInterval);
    executionStrategy.start(this);
  }

  /**
   * Stops ticking. Waits up to the stop timeout for a running pass, which is never aborted. Has
   * no effect if not started.
   */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    logger.log(Level.INFO, "Stopping directory sync scheduler.");
    executionStrategy.stop(stopTimeout);
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Runs a pass now, outside the timer. A successful pass counts as the latest attempt of the
   * active configuration.
   *
   * @return {@code true} if the pass ran and succeeded
   */
  public boolean forceSync() {
    Optional<DirectoryConfig> active;
    try {
      active = configStore.getActiveConfig();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to read directory configuration", e);
      return false;
    }
    stats.register("forceSync");
    SyncResult result = syncEngine.syncUsers();
    if (result.isSuccess() && active.isPresent()) {
      lastAttempts.put(active.get().getId().get(), clock.instant());
    }
    logger.log(Level.INFO, "Forced sync finished: {0}", result);
    return result.isSuccess();
  }

  /** Time of the latest attempt for {@code configId}. */
  public Optional<Instant> getLastAttempt(String configId) {
    return Optional.ofNullable(lastAttempts.get(configId));
  }

  /**
   * Evaluates the schedule once and runs a pass when one is due.
   *
   * @return {@code true} if a pass was started
   * @throws IOException if the configuration can not be read
   */
  @VisibleForTesting
  boolean tick() throws IOException {
    Optional<DirectoryConfig> active = configStore.getActiveConfig();
    if (!active.isPresent() || !active.get().isEnabled() || !active.get().isSyncEnabled()) {
      return false;
    }
    DirectoryConfig config = active.get();
    String configId = config.getId().get();
    Instant now = clock.instant();
    Instant last = lastAttempts.get(configId);
    long intervalSecs =
        Math.max(config.getSyncIntervalSecs(), DirectoryConfig.MIN_SYNC_INTERVAL_SECS);
    if (last != null && Duration.between(last, now).getSeconds() < intervalSecs) {
      return false;
    }
    lastAttempts.put(configId, now);
    stats.register("scheduledSync");
    SyncResult result = syncEngine.syncUsers();
    if (result.isSuccess() && purgeStaleUsers) {
      syncEngine.purgeStaleUsers();
    }
    return true;
  }

  /** Runs {@link #tick()} and returns the delay before the next one. */
  @VisibleForTesting
  Duration runTick() {
    try {
      tick();
      return tickInterval;
    } catch (Exception e) {
      stats.register("tickFailure");
      logger.log(Level.WARNING, "Directory sync tick failed; backing off " + errorBackoff, e);
      return errorBackoff;
    }
  }

  /** How ticks are driven. The tick logic is shared by every strategy. */
  public abstract static class ExecutionStrategy {

    ExecutionStrategy() {}

    /** A worker thread owned by the scheduler that sleeps between ticks. */
    public static ExecutionStrategy dedicatedThread() {
      return new DedicatedThread();
    }

    /**
     * A task re-scheduled after each tick on {@code executor}. The executor is owned by the
     * caller and is not shut down by {@link DirectorySyncScheduler#stop()}.
     */
    public static ExecutionStrategy sharedExecutor(ScheduledExecutorService executor) {
      return new SharedExecutor(executor);
    }

    abstract void start(DirectorySyncScheduler scheduler);

    abstract void stop(Duration timeout);
  }

  private static class DedicatedThread extends ExecutionStrategy {
    private Thread worker;
    private CountDownLatch stopSignal;

    @Override
    synchronized void start(DirectorySyncScheduler scheduler) {
      CountDownLatch signal = new CountDownLatch(1);
      stopSignal = signal;
      // non-daemon so the process stays up while the scheduler runs
      worker =
          new ThreadFactoryBuilder()
              .setDaemon(false)
              .setNameFormat("directory-sync-scheduler")
              .build()
              .newThread(() -> loop(scheduler, signal));
      worker.start();
    }

    private static void loop(DirectorySyncScheduler scheduler, CountDownLatch stopSignal) {
      try {
        while (stopSignal.getCount() > 0) {
          Duration delay = scheduler.runTick();
          if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
            break;
          }
        }
      } catch (InterruptedException e) {
        logger.log(Level.WARNING, "Scheduler thread interrupted.", e);
        Thread.currentThread().interrupt();
      }
    }

    @Override
    synchronized void stop(Duration timeout) {
      stopSignal.countDown();
      try {
        worker.join(timeout.toMillis());
      } catch (InterruptedException e) {
        logger.log(Level.WARNING, "Interrupted while waiting for scheduler thread.", e);
        Thread.currentThread().interrupt();
      }
      if (worker.isAlive()) {
        logger.log(Level.WARNING, "Sync still running after {0}; leaving it to finish.", timeout);
      }
      worker = null;
    }
  }

  private static class SharedExecutor extends ExecutionStrategy {
    private final ScheduledExecutorService executor;
    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile boolean active;
    private ScheduledFuture<?> pending;

    private SharedExecutor(ScheduledExecutorService executor) {
      this.executor = checkNotNull(executor, "executor can not be null");
    }

    @Override
    synchronized void start(DirectorySyncScheduler scheduler) {
      active = true;
      schedule(scheduler, Duration.ZERO);
    }

    private synchronized void schedule(DirectorySyncScheduler scheduler, Duration delay) {
      if (active) {
        pending =
            executor.schedule(
                () -> runOnce(scheduler), delay.toMillis(), TimeUnit.MILLISECONDS);
      }
    }

    private void runOnce(DirectorySyncScheduler scheduler) {
      Duration next;
      tickLock.lock();
      try {
        if (!active) {
          return;
        }
        next = scheduler.runTick();
      } finally {
        tickLock.unlock();
      }
      schedule(scheduler, next);
    }

    @Override
    void stop(Duration timeout) {
      synchronized (this) {
        active = false;
        checkState(pending != null, "not started");
        pending.cancel(false);
      }
      try {
        if (tickLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          tickLock.unlock();
        } else {
          logger.log(Level.WARNING, "Sync still running after {0}; leaving it to finish.",
              timeout);
        }
      } catch (InterruptedException e) {
        logger.log(Level.WARNING, "Interrupted while waiting for running tick.", e);
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DirectorySyncScheduler}. */
  public static class Builder {
    private DirectorySyncEngine syncEngine;
    private ConfigStore configStore;
    private Clock clock = Clock.systemUTC();
    private Duration tickInterval = DEFAULT_TICK_INTERVAL;
    private Duration errorBackoff = DEFAULT_ERROR_BACKOFF;
    private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
    private boolean purgeStaleUsers;
    private ExecutionStrategy executionStrategy = ExecutionStrategy.dedicatedThread();

    /** Builder with tick settings read from {@link Configuration}. */
    public static Builder fromConfiguration() {
      checkState(Configuration.isInitialized(), "configuration not initialized");
      return new Builder()
          .setTickInterval(
              Duration.ofSeconds(
                  Configuration.getValidatedInteger(
                          TICK_INTERVAL_SECS, 10, v -> v > 0, "must be positive")
                      .get()))
          .setErrorBackoff(
              Duration.ofSeconds(
                  Configuration.getValidatedInteger(
                          ERROR_BACKOFF_SECS, 30, v -> v >= 0, "can not be negative")
                      .get()))
          .setPurgeStaleUsers(Configuration.getBoolean(PURGE_STALE_USERS, false).get());
    }

    public Builder setSyncEngine(DirectorySyncEngine syncEngine) {
      this.syncEngine = syncEngine;
      return this;
    }

    public Builder setConfigStore(ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder setTickInterval(Duration tickInterval) {
      this.tickInterval = tickInterval;
      return this;
    }

    public Builder setErrorBackoff(Duration errorBackoff) {
      this.errorBackoff = errorBackoff;
      return this;
    }

    public Builder setStopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    public Builder setPurgeStaleUsers(boolean purgeStaleUsers) {
      this.purgeStaleUsers = purgeStaleUsers;
      return this;
    }

    public Builder setExecutionStrategy(ExecutionStrategy executionStrategy) {
      this.executionStrategy = executionStrategy;
      return this;
    }

    public DirectorySyncScheduler build() {
      return new DirectorySyncScheduler(this);
    }
  }
}
