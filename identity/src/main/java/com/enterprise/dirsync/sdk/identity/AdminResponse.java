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

import com.google.common.base.MoreObjects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Reply of a {@link DirectoryAdminService} operation: outcome, a message for the administrator
 * and, on success, the data.
 */
public final class AdminResponse<T> {
  private final boolean success;
  private final String message;
  private final T data;

  private AdminResponse(boolean success, String message, @Nullable T data) {
    this.success = success;
    this.message = message;
    this.data = data;
  }

  static <T> AdminResponse<T> ok(T data, String message) {
    return new AdminResponse<>(true, message, data);
  }

  static <T> AdminResponse<T> error(String message) {
    return new AdminResponse<>(false, message, null);
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMessage() {
    return message;
  }

  public Optional<T> getData() {
    return Optional.ofNullable(data);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("success", success)
        .add("message", message)
        .add("data", data)
        .toString();
  }
}
