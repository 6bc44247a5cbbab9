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

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/** {@link LocalAccountProvisioner} keeping accounts in memory, keyed by email address. */
public class InMemoryLocalAccountProvisioner implements LocalAccountProvisioner {
  private static final Logger logger =
      Logger.getLogger(InMemoryLocalAccountProvisioner.class.getName());

  private final ConcurrentMap<String, String> accountsByEmail = new ConcurrentHashMap<>();

  @Override
  public Optional<String> findAccountIdByEmail(String email) {
    return Optional.ofNullable(accountsByEmail.get(Ascii.toLowerCase(Strings.nullToEmpty(email))));
  }

  @Override
  public String createAccount(String email, String nickname) {
    checkArgument(!Strings.isNullOrEmpty(email), "email can not be null or empty");
    String id =
        accountsByEmail.computeIfAbsent(
            Ascii.toLowerCase(email), k -> UUID.randomUUID().toString());
    logger.log(Level.FINE, "Local account {0} for {1} ({2})", new Object[] {id, email, nickname});
    return id;
  }
}
