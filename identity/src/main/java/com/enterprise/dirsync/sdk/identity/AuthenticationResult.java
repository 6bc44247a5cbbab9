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

import java.util.Optional;

/** Result of {@link LdapAuthenticator#authenticateUser}. Carries a profile only on success. */
public final class AuthenticationResult {
  private static final AuthenticationResult FAILED = new AuthenticationResult(null);

  private final UserProfile profile;

  private AuthenticationResult(UserProfile profile) {
    this.profile = profile;
  }

  static AuthenticationResult success(UserProfile profile) {
    return new AuthenticationResult(profile);
  }

  static AuthenticationResult failure() {
    return FAILED;
  }

  public boolean isSuccess() {
    return profile != null;
  }

  public Optional<UserProfile> getProfile() {
    return Optional.ofNullable(profile);
  }

  @Override
  public String toString() {
    return isSuccess() ? "AuthenticationResult{success, dn=" + profile.getDn() + "}"
        : "AuthenticationResult{failure}";
  }
}
