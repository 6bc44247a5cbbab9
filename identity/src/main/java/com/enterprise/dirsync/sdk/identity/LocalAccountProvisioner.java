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

import java.io.IOException;
import java.util.Optional;

/**
 * Hook into the local account system, called when a configuration has auto-provisioning enabled.
 */
public interface LocalAccountProvisioner {

  /** Finds an existing local account by email address. */
  Optional<String> findAccountIdByEmail(String email) throws IOException;

  /**
   * Creates a local account that authenticates through the directory.
   *
   * @return the new account id
   */
  String createAccount(String email, String nickname) throws IOException;
}
