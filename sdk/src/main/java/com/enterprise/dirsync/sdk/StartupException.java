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
 * Unrecoverable start-up failure, such as a fatal configuration error.
 *
 * <p>Start-up retry logic rethrows this type instead of backing off.
 */
public class StartupException extends RuntimeException {

  public StartupException() {
    super();
  }

  /** @param message detail message */
  public StartupException(String message) {
    super(message);
  }

  /**
   * @param message detail message
   * @param cause failure cause
   */
  public StartupException(String message, Throwable cause) {
    super(message, cause);
  }

  /** @param cause failure cause, whose message is copied when present */
  public StartupException(Throwable cause) {
    super(cause);
  }
}
