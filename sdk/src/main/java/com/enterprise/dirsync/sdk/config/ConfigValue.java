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
package com.enterprise.dirsync.sdk.config;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.enterprise.dirsync.sdk.InvalidConfigurationException;
import com.enterprise.dirsync.sdk.config.Configuration.Parser;
import com.google.common.base.Strings;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Holder for a single {@link Configuration} value.
 *
 * <p>Instances come from the {@link Configuration} factory methods. {@link #get} is only valid
 * after {@link Configuration#initConfig} has loaded the properties.
 */
public class ConfigValue<T> {
  private final String configKey;
  private final T defaultValue;
  private final ConfigValue<T> fallback;
  private final Parser<T> parser;
  private final Predicate<T> validator;
  private final String requirement;
  private final AtomicBoolean initialized = new AtomicBoolean();
  private T configuredValue;

  private ConfigValue(Builder<T> builder) {
    configKey = builder.configKey;
    defaultValue = builder.defaultValue;
    fallback = builder.fallback;
    parser = builder.parser;
    validator = builder.validator;
    requirement = builder.requirement;
  }

  /**
   * Gets the configured value.
   *
   * @return configured value
   * @throws IllegalStateException if the configuration is not initialized
   */
  public T get() {
    checkState(initialized.get(), "Config Key %s not initialized", configKey);
    return configuredValue;
  }

  public T getDefault() {
    return defaultValue;
  }

  public boolean isInitialized() {
    return initialized.get();
  }

  synchronized void initialize(String value) {
    if (initialized.get()) {
      return;
    }
    if (!Strings.isNullOrEmpty(value)) {
      T parsed;
      try {
        parsed = parser.parse(value);
      } catch (InvalidConfigurationException e) {
        throw new InvalidConfigurationException(
            String.format(
                "Failed to parse configured value [%s] for ConfigKey [%s]", value, configKey),
            e);
      }
      if (validator != null && !validator.test(parsed)) {
        throw new InvalidConfigurationException(
            String.format(
                "Invalid value [%s] for ConfigKey [%s]: %s", value, configKey, requirement));
      }
      configuredValue = parsed;
    } else if (fallback != null) {
      configuredValue = fallback.get();
    } else {
      if (defaultValue == null) {
        throw new InvalidConfigurationException(
            String.format("Required Config Key %s not initialized", configKey));
      }
      configuredValue = defaultValue;
    }
  }

  String getConfigKey() {
    return configKey;
  }

  synchronized void freeze() {
    initialized.set(true);
  }

  synchronized void reset() {
    configuredValue = null;
    initialized.set(false);
  }

  static final class Builder<T> {
    private String configKey;
    private T defaultValue;
    private ConfigValue<T> fallback;
    private Parser<T> parser;
    private Predicate<T> validator;
    private String requirement;

    Builder<T> setConfigKey(String configKey) {
      this.configKey = configKey;
      return this;
    }

    Builder<T> setDefaultValue(T defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    Builder<T> setFallback(ConfigValue<T> fallback) {
      this.fallback = checkNotNull(fallback);
      this.parser = fallback.parser;
      this.validator = fallback.validator;
      this.requirement = fallback.requirement;
      return this;
    }

    Builder<T> setParser(Parser<T> parser) {
      this.parser = parser;
      return this;
    }

    Builder<T> setValidator(Predicate<T> validator, String requirement) {
      this.validator = checkNotNull(validator);
      this.requirement = requirement;
      return this;
    }

    ConfigValue<T> build() {
      checkArgument(!Strings.isNullOrEmpty(configKey), "configKey can not be empty or null");
      checkNotNull(parser, "parser can not be null.");
      checkArgument(defaultValue == null || fallback == null,
          "both defaultValue && fallback can not be set together");
      return new ConfigValue<T>(this);
    }
  }
}
