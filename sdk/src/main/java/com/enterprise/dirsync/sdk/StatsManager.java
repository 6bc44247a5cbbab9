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
package com.enterprise.dirsync.sdk;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Multiset;
import java.util.List;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Process wide operation counters, grouped by component.
 *
 * <pre>
 *   /:component/:operation            - registered count
 *   /:component/:event                - success, failure and latency buckets
 *   /:component/:operation/:result    - counts per logged result
 * </pre>
 *
 * <p>For example {@code Authenticator/authenticate} counts successful and failed logins and
 * {@code SyncEngine/syncUsers} records {@code COMPLETED} or {@code ERROR} per pass.
 */
public class StatsManager {

  // upper bounds, in milliseconds, of the latency buckets
  private static final NavigableSet<Long> LATENCY_BUCKETS =
      ImmutableSortedSet.of(
          10L, 50L, 100L, 500L, 1000L, 5000L, 10000L, 30000L, 60000L, 300000L);

  private final ConcurrentMap<String, OperationStats> stats = new ConcurrentHashMap<>();
  private volatile boolean running = true;

  private static class InstanceHolder {
    private static final StatsManager instance = new StatsManager();
  }

  private StatsManager() {}

  public static StatsManager getInstance() {
    return InstanceHolder.instance;
  }

  public static List<String> getComponentNames() {
    return getInstance().stats.keySet().stream().sorted().collect(Collectors.toList());
  }

  /**
   * Returns the {@link OperationStats} of {@code component}, creating it on first use.
   *
   * @param component name space of the statistics
   */
  public static OperationStats getComponent(String component) {
    return getInstance().stats.computeIfAbsent(component, key -> new OperationStats());
  }

  /** Stops recording. Values recorded so far are kept. */
  public void stop() {
    running = false;
  }

  public void resume() {
    running = true;
  }

  public boolean isRunning() {
    return running;
  }

  /** Renders all components for the log. */
  public String printStats() {
    StringBuilder sb = new StringBuilder();
    sb.append("Stats(active:").append(running).append("):\n");
    stats.keySet().stream().sorted().forEach(
        component -> {
          sb.append("  Component: ").append(component).append('\n');
          stats.get(component).printStats(sb);
        });
    return sb.toString();
  }

  /** Counters of one component. */
  public static class OperationStats {
    private final Multiset<String> registered = ConcurrentHashMultiset.create();
    private final Multiset<String> successes = ConcurrentHashMultiset.create();
    private final Multiset<String> failures = ConcurrentHashMultiset.create();
    private final ConcurrentMap<String, Multiset<String>> results = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Multiset<Long>> latency = new ConcurrentHashMap<>();

    private OperationStats() {}

    /** Starts timing {@code operation}; call {@link Event#success} or {@link Event#failure}. */
    public Event event(String operation) {
      return new Event(operation).start();
    }

    public void register(String operation) {
      if (getInstance().running) {
        registered.add(operation);
      }
    }

    public void logResult(String operation, String result) {
      if (getInstance().running) {
        results.computeIfAbsent(operation, op -> ConcurrentHashMultiset.create()).add(result);
      }
    }

    public int getSuccessCount(String operation) {
      return successes.count(operation);
    }

    public int getFailureCount(String operation) {
      return failures.count(operation);
    }

    public int getRegisteredCount(String operation) {
      return registered.count(operation);
    }

    public int getLogResultCounter(String operation, String result) {
      Multiset<String> counts = results.get(operation);
      return counts == null ? 0 : counts.count(result);
    }

    @VisibleForTesting
    int getLatencyCount(String operation, long bucket) {
      Multiset<Long> counts = latency.get(operation);
      return counts == null ? 0 : counts.count(bucket);
    }

    void clear() {
      registered.clear();
      successes.clear();
      failures.clear();
      results.clear();
      latency.clear();
    }

    private void printStats(StringBuilder sb) {
      append(sb, "Registered", registered);
      append(sb, "Succeeded", successes);
      append(sb, "Failed", failures);
      results.forEach(
          (op, counts) -> append(sb, "Results of " + op, counts));
      latency.forEach(
          (op, counts) -> append(sb, "Latency (ms, upper bound) of " + op, counts));
    }

    private static <T> void append(StringBuilder sb, String title, Multiset<T> counts) {
      if (counts.isEmpty()) {
        return;
      }
      sb.append("\t").append(title).append(":\n");
      for (Multiset.Entry<T> entry : counts.entrySet()) {
        sb.append("\t\t")
            .append(entry.getElement())
            .append(" : ")
            .append(entry.getCount())
            .append('\n');
      }
    }

    /** One timed execution of an operation. */
    public class Event {
      private final String operation;
      private final Stopwatch watch = Stopwatch.createUnstarted();

      private Event(String operation) {
        this.operation = operation;
      }

      private Event start() {
        watch.start();
        return this;
      }

      public void success() {
        end(true);
      }

      public void failure() {
        end(false);
      }

      /**
       * Records the outcome. Only the first call counts.
       *
       * @param success outcome of the operation
       */
      public void end(boolean success) {
        if (!watch.isRunning()) {
          return;
        }
        watch.stop();
        if (!getInstance().running) {
          return;
        }
        if (success) {
          successes.add(operation);
          long elapsed = watch.elapsed(TimeUnit.MILLISECONDS);
          Long bucket = LATENCY_BUCKETS.ceiling(elapsed);
          latency
              .computeIfAbsent(operation, op -> ConcurrentHashMultiset.create())
              .add(bucket == null ? Long.MAX_VALUE : bucket);
        } else {
          failures.add(operation);
        }
      }
    }
  }

  private static void resetStatsManager() {
    // components may be held in static fields; clear values instead of dropping them
    getInstance().stats.values().forEach(OperationStats::clear);
    getInstance().running = true;
  }

  /** {@link TestRule} that clears all recorded statistics before each test. */
  public static class ResetStatsRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetStatsManager();
      return base;
    }
  }
}
