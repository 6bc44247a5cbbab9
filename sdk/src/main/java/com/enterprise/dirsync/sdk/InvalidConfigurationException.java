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

/**
 * Thrown for invalid directory or scheduling configuration, for example a sync interval below the
 * minimum or a missing search base.
 *
 * <p>Like every {@link StartupException}, it is never retried.
 */
public class InvalidConfigurationException extends StartupException {

  public InvalidConfigurationException() {
    super();
  }

  public InvalidConfigurationException(String message) {
    super(message);
  }

  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvalidConfigurationException(Throwable cause) {
    super(cause);
  }
}
