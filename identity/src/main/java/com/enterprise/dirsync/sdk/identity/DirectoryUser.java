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

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Local mirror of one directory entry, scoped to a {@link DirectoryConfig}.
 *
 * <p>The DN is unique per configuration. Records are never removed by a sync pass; entries no
 * longer found in the directory are marked {@link UserSyncStatus#STALE} and purged once the
 * retention window has passed.
 */
public final class DirectoryUser {
  private final String id;
  private final String configId;
  private final String dn;
  private final String username;
  private final String email;
  private final String nickname;
  private final String firstName;
  private final String lastName;
  private final ImmutableMap<String, String> attributes;
  private final boolean active;
  private final UserSyncStatus syncStatus;
  private final Instant lastSyncTime;
  private final Instant staleSince;
  private final Instant lastLoginTime;
  private final String localAccountId;

  private DirectoryUser(Builder builder) {
    checkArgument(!Strings.isNullOrEmpty(builder.configId), "configId can not be null or empty");
    checkArgument(!Strings.isNullOrEmpty(builder.dn), "dn can not be null or empty");
    this.id = builder.id;
    this.configId = builder.configId;
    this.dn = builder.dn;
    this.username = Strings.nullToEmpty(builder.username);
    this.email = Strings.nullToEmpty(builder.email);
    this.nickname = Strings.nullToEmpty(builder.nickname);
    this.firstName = Strings.nullToEmpty(builder.firstName);
    this.lastName = Strings.nullToEmpty(builder.lastName);
    this.attributes = ImmutableMap.copyOf(builder.attributes);
    this.active = builder.active;
    this.syncStatus = checkNotNull(builder.syncStatus);
    this.lastSyncTime = builder.lastSyncTime;
    this.staleSince = builder.staleSince;
    this.lastLoginTime = builder.lastLoginTime;
    this.localAccountId = builder.localAccountId;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** New, active record for {@code profile} observed at {@code now}. */
  static DirectoryUser fromProfile(String configId, UserProfile profile, Instant now) {
    return builder()
        .setConfigId(configId)
        .applyProfile(profile)
        .setActive(true)
        .setSyncStatus(UserSyncStatus.SYNCED)
        .setLastSyncTime(now)
        .build();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Store assigned identifier, empty until the record is created. */
  public Optional<String> getId() {
    return Optional.ofNullable(id);
  }

  public String getConfigId() {
    return configId;
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

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  public boolean isActive() {
    return active;
  }

  public UserSyncStatus getSyncStatus() {
    return syncStatus;
  }

  public Optional<Instant> getLastSyncTime() {
    return Optional.ofNullable(lastSyncTime);
  }

  public Optional<Instant> getStaleSince() {
    return Optional.ofNullable(staleSince);
  }

  public Optional<Instant> getLastLoginTime() {
    return Optional.ofNullable(lastLoginTime);
  }

  /** Identifier of the linked local account. The account itself is not owned by this record. */
  public Optional<String> getLocalAccountId() {
    return Optional.ofNullable(localAccountId);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DirectoryUser)) {
      return false;
    }
    DirectoryUser other = (DirectoryUser) obj;
    return Objects.equals(id, other.id)
        && configId.equals(other.configId)
        && dn.equals(other.dn)
        && username.equals(other.username)
        && email.equals(other.email)
        && nickname.equals(other.nickname)
        && firstName.equals(other.firstName)
        && lastName.equals(other.lastName)
        && attributes.equals(other.attributes)
        && active == other.active
        && syncStatus == other.syncStatus
        && Objects.equals(lastSyncTime, other.lastSyncTime)
        && Objects.equals(staleSince, other.staleSince)
        && Objects.equals(lastLoginTime, other.lastLoginTime)
        && Objects.equals(localAccountId, other.localAccountId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, configId, dn, username, email, nickname, firstName, lastName, attributes, active,
        syncStatus, lastSyncTime, staleSince, lastLoginTime, localAccountId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("configId", configId)
        .add("dn", dn)
        .add("username", username)
        .add("email", email)
        .add("active", active)
        .add("syncStatus", syncStatus)
        .add("staleSince", staleSince)
        .add("localAccountId", localAccountId)
        .toString();
  }

  /** Builder for {@link DirectoryUser}. */
  public static class Builder {
    private String id;
    private String configId;
    private String dn;
    private String username = "";
    private String email = "";
    private String nickname = "";
    private String firstName = "";
    private String lastName = "";
    private Map<String, String> attributes = ImmutableMap.of();
    private boolean active = true;
    private UserSyncStatus syncStatus = UserSyncStatus.SYNCED;
    private Instant lastSyncTime;
    private Instant staleSince;
    private Instant lastLoginTime;
    private String localAccountId;

    private Builder() {}

    private Builder(DirectoryUser user) {
      this.id = user.id;
      this.configId = user.configId;
      this.dn = user.dn;
      this.username = user.username;
      this.email = user.email;
      this.nickname = user.nickname;
      this.firstName = user.firstName;
      this.lastName = user.lastName;
      this.attributes = user.attributes;
      this.active = user.active;
      this.syncStatus = user.syncStatus;
      this.lastSyncTime = user.lastSyncTime;
      this.staleSince = user.staleSince;
      this.lastLoginTime = user.lastLoginTime;
      this.localAccountId = user.localAccountId;
    }

    /** Copies the DN, names, email and attributes of {@code profile}. */
    public Builder applyProfile(UserProfile profile) {
      return setDn(profile.getDn())
          .setUsername(profile.getUsername())
          .setEmail(profile.getEmail())
          .setNickname(profile.getNickname())
          .setFirstName(profile.getFirstName())
          .setLastName(profile.getLastName())
          .setAttributes(profile.getAttributes());
    }

    public Builder setId(@Nullable String id) {
      this.id = id;
      return this;
    }

    public Builder setConfigId(String configId) {
      this.configId = configId;
      return this;
    }

    public Builder setDn(String dn) {
      this.dn = dn;
      return this;
    }

    public Builder setUsername(String username) {
      this.username = username;
      return this;
    }

    public Builder setEmail(String email) {
      this.email = email;
      return this;
    }

    public Builder setNickname(String nickname) {
      this.nickname = nickname;
      return this;
    }

    public Builder setFirstName(String firstName) {
      this.firstName = firstName;
      return this;
    }

    public Builder setLastName(String lastName) {
      this.lastName = lastName;
      return this;
    }

    public Builder setAttributes(Map<String, String> attributes) {
      this.attributes = checkNotNull(attributes);
      return this;
    }

    public Builder setActive(boolean active) {
      this.active = active;
      return this;
    }

    public Builder setSyncStatus(UserSyncStatus syncStatus) {
      this.syncStatus = syncStatus;
      return this;
    }

    public Builder setLastSyncTime(@Nullable Instant lastSyncTime) {
      this.lastSyncTime = lastSyncTime;
      return this;
    }

    public Builder setStaleSince(@Nullable Instant staleSince) {
      this.staleSince = staleSince;
      return this;
    }

    public Builder setLastLoginTime(@Nullable Instant lastLoginTime) {
      this.lastLoginTime = lastLoginTime;
      return this;
    }

    public Builder setLocalAccountId(@Nullable String localAccountId) {
      this.localAccountId = localAccountId;
      return this;
    }

    public DirectoryUser build() {
      return new DirectoryUser(this);
    }
  }
}
