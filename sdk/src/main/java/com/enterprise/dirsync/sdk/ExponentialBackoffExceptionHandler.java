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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExceptionHandler} that waits {@code ntries * initialDelay} before each retry, up to a
 * maximum number of tries.
 */
public class ExponentialBackoffExceptionHandler implements ExceptionHandler {

  /** Blocks the calling thread. */
  @VisibleForTesting
  interface Sleeper {
    void sleep(TimeUnit unit, long duration) throws InterruptedException;
  }

  private final int maximumTries;
  private final long initialDelay;
  private final TimeUnit delayUnit;
  private final Sleeper sleeper;

  /**
   * @param maximumTries attempts allowed before giving up
   * @param initialDelay delay after the first failure
   * @param delayUnit unit of {@code initialDelay}
   */
  public ExponentialBackoffExceptionHandler(
      int maximumTries, long initialDelay, TimeUnit delayUnit) {
    this(maximumTries, initialDelay, delayUnit, (unit, duration) -> unit.sleep(duration));
  }

  @VisibleForTesting
  ExponentialBackoffExceptionHandler(
      int maximumTries, long initialDelay, TimeUnit delayUnit, Sleeper sleeper) {
    checkArgument(maximumTries >= 0, "maximumTries can not be negative");
    checkArgument(initialDelay >= 0, "initialDelay can not be negative");
    this.maximumTries = maximumTries;
    this.initialDelay = initialDelay;
    this.delayUnit = checkNotNull(delayUnit);
    this.sleeper = checkNotNull(sleeper);
  }

  @Override
  public boolean handleException(Exception ex, int ntries) throws InterruptedException {
    if (ex instanceof StartupException || ntries > maximumTries) {
      return false;
    }
    sleeper.sleep(delayUnit, initialDelay * ntries);
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(maximumTries, initialDelay, delayUnit);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof ExponentialBackoffExceptionHandler)) {
      return false;
    }
    ExponentialBackoffExceptionHandler other = (ExponentialBackoffExceptionHandler) obj;
    return maximumTries == other.maximumTries
        && initialDelay == other.initialDelay
        && delayUnit == other.delayUnit;
  }
}
