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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.Optional;

/**
 * Failure talking to the directory server or to the local stores that mirror it.
 *
 * <p>Messages never include bind secrets or user passwords.
 */
public class DirectoryException extends IOException {

  /** Broad category of a directory failure. */
  public enum ErrorType {
    /** Server unreachable, TLS negotiation failed or the session was dropped. */
    CONNECTION_ERROR,
    /** Bind rejected. */
    CREDENTIAL_ERROR,
    /** Search or entry read failed. */
    QUERY_ERROR,
    /** Config or user store failed. */
    PERSISTENCE_ERROR
  }

  private final ErrorType errorType;
  private final Optional<Integer> resultCode;

  private DirectoryException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.resultCode = builder.resultCode;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  /** Numeric LDAP result code reported by the server, if any. */
  public Optional<Integer> getResultCode() {
    return resultCode;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("DirectoryException[")
        .append(errorType)
        .append(": ")
        .append(getMessage());
    resultCode.ifPresent(code -> sb.append(", resultCode=").append(code));
    sb.append(']');
    if (getCause() != null) {
      sb.append(", cause=").append(getCause());
    }
    return sb.toString();
  }

  /** Builder for {@link DirectoryException}. */
  public static class Builder {
    private String message;
    private Throwable cause;
    private ErrorType errorType;
    private Optional<Integer> resultCode = Optional.empty();

    public Builder setErrorMessage(String message) {
      this.message = message;
      return this;
    }

    public Builder setErrorType(ErrorType errorType) {
      this.errorType = errorType;
      return this;
    }

    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder setResultCode(int resultCode) {
      this.resultCode = Optional.of(resultCode);
      return this;
    }

    public DirectoryException build() {
      checkNotNull(errorType, "errorType can not be null");
      return new DirectoryException(this);
    }
  }
}
