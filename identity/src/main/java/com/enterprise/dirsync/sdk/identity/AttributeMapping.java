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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps logical user fields to directory attribute names.
 *
 * <p>Unmapped fields use the inetOrgPerson defaults: {@code username=uid}, {@code email=mail},
 * {@code nickname=displayName}, {@code first_name=givenName} and {@code last_name=sn}.
 */
public final class AttributeMapping {
  public static final String USERNAME = "username";
  public static final String EMAIL = "email";
  public static final String NICKNAME = "nickname";
  public static final String FIRST_NAME = "first_name";
  public static final String LAST_NAME = "last_name";

  private static final ImmutableMap<String, String> DEFAULTS =
      ImmutableMap.<String, String>builder()
          .put(USERNAME, "uid")
          .put(EMAIL, "mail")
          .put(NICKNAME, "displayName")
          .put(FIRST_NAME, "givenName")
          .put(LAST_NAME, "sn")
          .build();

  private static final AttributeMapping DEFAULT_MAPPING = new AttributeMapping(DEFAULTS);

  private final ImmutableMap<String, String> mapping;

  private AttributeMapping(Map<String, String> mapping) {
    this.mapping = ImmutableMap.copyOf(mapping);
  }

  public static AttributeMapping defaults() {
    return DEFAULT_MAPPING;
  }

  /**
   * Returns the default mapping with {@code overrides} applied. Blank attribute names are
   * ignored.
   *
   * @param overrides logical field to attribute name
   */
  public static AttributeMapping withOverrides(Map<String, String> overrides) {
    checkNotNull(overrides, "overrides can not be null");
    Map<String, String> merged = new LinkedHashMap<>(DEFAULTS);
    overrides.forEach(
        (field, attribute) -> {
          checkArgument(!Strings.isNullOrEmpty(field), "field can not be null or empty");
          if (!Strings.isNullOrEmpty(attribute)) {
            merged.put(field, attribute.trim());
          }
        });
    return new AttributeMapping(merged);
  }

  /**
   * Attribute name for {@code field}, falling back to the default mapping.
   *
   * @throws IllegalArgumentException if the field has no mapping at all
   */
  public String get(String field) {
    String attribute = mapping.get(field);
    checkArgument(attribute != null, "no attribute mapped for field %s", field);
    return attribute;
  }

  /** Attribute names to request from the directory, without duplicates. */
  public ImmutableList<String> attributeNames() {
    return ImmutableSet.<String>builder().addAll(mapping.values()).add("cn").build().asList();
  }

  public ImmutableMap<String, String> asMap() {
    return mapping;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AttributeMapping)) {
      return false;
    }
    return mapping.equals(((AttributeMapping) obj).mapping);
  }

  @Override
  public int hashCode() {
    return Objects.hash(mapping);
  }

  @Override
  public String toString() {
    return mapping.toString();
  }
}
