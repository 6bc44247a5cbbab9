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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.unboundid.ldap.sdk.Attribute;
import com.unboundid.ldap.sdk.Entry;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized view of one directory entry.
 *
 * <p>Multi-valued attributes resolve to their first value and absent attributes to the empty
 * string.
 */
public final class UserProfile {
  private final String dn;
  private final String username;
  private final String email;
  private final String nickname;
  private final String firstName;
  private final String lastName;
  private final ImmutableMap<String, String> attributes;

  public UserProfile(
      String dn,
      String username,
      String email,
      String nickname,
      String firstName,
      String lastName,
      Map<String, String> attributes) {
    this.dn = checkNotNull(dn, "dn can not be null");
    this.username = Strings.nullToEmpty(username);
    this.email = Strings.nullToEmpty(email);
    this.nickname = Strings.nullToEmpty(nickname);
    this.firstName = Strings.nullToEmpty(firstName);
    this.lastName = Strings.nullToEmpty(lastName);
    this.attributes = ImmutableMap.copyOf(attributes);
  }

  /**
   * Builds a profile from {@code entry} using {@code mapping}.
   *
   * @param entry directory entry
   * @param mapping logical field to attribute name
   */
  public static UserProfile fromEntry(Entry entry, AttributeMapping mapping) {
    ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();
    for (Attribute attribute : entry.getAttributes()) {
      attributes.put(attribute.getName(), Strings.nullToEmpty(attribute.getValue()));
    }
    return new UserProfile(
        entry.getDN(),
        firstValue(entry, mapping.get(AttributeMapping.USERNAME)),
        firstValue(entry, mapping.get(AttributeMapping.EMAIL)),
        firstValue(entry, mapping.get(AttributeMapping.NICKNAME)),
        firstValue(entry, mapping.get(AttributeMapping.FIRST_NAME)),
        firstValue(entry, mapping.get(AttributeMapping.LAST_NAME)),
        attributes.build());
  }

  private static String firstValue(Entry entry, String attributeName) {
    // first value of a multi-valued attribute
    return Strings.nullToEmpty(entry.getAttributeValue(attributeName));
  }

  public String getDn() {
    return dn;
  }

  public String getUsername() {
    return username;
  }

  public String getEmail() {
    return email;
  }

  public String getNickname() {
    return nickname;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  /** Every attribute returned with the entry. */
  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof UserProfile)) {
      return false;
    }
    UserProfile other = (UserProfile) obj;
    return dn.equals(other.dn)
        && username.equals(other.username)
        && email.equals(other.email)
        && nickname.equals(other.nickname)
        && firstName.equals(other.firstName)
        && lastName.equals(other.lastName)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dn, username, email, nickname, firstName, lastName, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("dn", dn)
        .add("username", username)
        .add("email", email)
        .add("nickname", nickname)
        .toString();
  }
}
