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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import com.enterprise.dirsync.sdk.DirectoryException.ErrorType;
import java.net.ConnectException;
import java.util.Optional;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

/** Tests for {@link DirectoryException}. */
public class DirectoryExceptionTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Test
  public void build_allFields() {
    ConnectException cause = new ConnectException("refused");
    DirectoryException e =
        new DirectoryException.Builder()
            .setErrorType(ErrorType.CONNECTION_ERROR)
            .setErrorMessage("unable to reach ldap.example.com:636")
            .setResultCode(91)
            .setCause(cause)
            .build();
    assertEquals(ErrorType.CONNECTION_ERROR, e.getErrorType());
    assertEquals(Optional.of(91), e.getResultCode());
    assertSame(cause, e.getCause());
    assertThat(e.toString(), containsString("CONNECTION_ERROR"));
    assertThat(e.toString(), containsString("resultCode=91"));
  }

  @Test
  public void build_withoutResultCode() {
    DirectoryException e =
        new DirectoryException.Builder()
            .setErrorType(ErrorType.QUERY_ERROR)
            .setErrorMessage("search failed")
            .build();
    assertFalse(e.getResultCode().isPresent());
    assertThat(e.toString(), not(containsString("resultCode")));
  }

  @Test
  public void build_missingErrorType_throwsException() {
    thrown.expect(NullPointerException.class);
    new DirectoryException.Builder().setErrorMessage("no type").build();
  }
}
