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

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AttributeMapping}. */
@RunWith(JUnit4.class)
public class AttributeMappingTest {
  @Rule public ExpectedException thrown = ExpectedException.none();

  @Test
  public void defaults() {
    AttributeMapping mapping = AttributeMapping.defaults();
    assertEquals("uid", mapping.get(AttributeMapping.USERNAME));
    assertEquals("mail", mapping.get(AttributeMapping.EMAIL));
    assertEquals("displayName", mapping.get(AttributeMapping.NICKNAME));
    assertEquals("givenName", mapping.get(AttributeMapping.FIRST_NAME));
    assertEquals("sn", mapping.get(AttributeMapping.LAST_NAME));
  }

  @Test
  public void withOverrides_keepsUnmappedDefaults() {
    AttributeMapping mapping =
        AttributeMapping.withOverrides(
            ImmutableMap.of("username", " sAMAccountName ", "email", "", "department", "ou"));
    assertEquals("sAMAccountName", mapping.get(AttributeMapping.USERNAME));
    assertEquals("mail", mapping.get(AttributeMapping.EMAIL));
    assertEquals("ou", mapping.get("department"));
  }

  @Test
  public void withOverrides_emptyIsDefault() {
    assertEquals(AttributeMapping.defaults(), AttributeMapping.withOverrides(ImmutableMap.of()));
  }

  @Test
  public void attributeNames_unique() {
    AttributeMapping mapping =
        AttributeMapping.withOverrides(ImmutableMap.of("nickname", "cn", "last_name", "uid"));
    assertEquals(
        ImmutableList.of("uid", "mail", "cn", "givenName"), mapping.attributeNames());
  }

  @Test
  public void attributeNames_includeCommonName() {
    assertEquals(
        ImmutableList.of("uid", "mail", "displayName", "givenName", "sn", "cn"),
        AttributeMapping.defaults().attributeNames());
  }

  @Test
  public void get_unknownField() {
    thrown.expect(IllegalArgumentException.class);
    AttributeMapping.defaults().get("department");
  }
}
