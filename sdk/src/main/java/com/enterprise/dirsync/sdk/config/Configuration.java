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
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;

/**
 * Static factory for directory sync configuration values.
 *
 * <p>Values are declared through the factory methods before or after {@link #initConfig} runs.
 * Values declared early are held and initialized once the properties are loaded; values declared
 * afterwards are initialized immediately. Configured strings are trimmed before parsing.
 *
 * <pre>{@code
 * ConfigValue<String> host = Configuration.getString("ldap.host", null);
 * ConfigValue<Integer> interval =
 *     Configuration.getValidatedInteger(
 *         "ldap.sync.intervalSecs", 30, v -> v >= 30, "must be at least 30 seconds");
 * }</pre>
 *
 * <p>Use {@link ResetConfigRule} and {@link SetupConfigRule} in unit tests.
 */
public class Configuration {
  private static final Logger logger = Logger.getLogger(Configuration.class.getName());
  private static final String DEFAULT_CONFIG_FILE = "directory-sync.properties";
  private static final String ARGS_KEY = "-D";
  private static final String ARGS_CONFIGFILE = "config";
  @SuppressWarnings("rawtypes")
  private static final List<ConfigValue> configurations = new ArrayList<>();
  private static final AtomicBoolean initialized = new AtomicBoolean();
  private static Properties loadedConfig;

  /**
   * Initializes the configuration from the properties file named by {@code -Dconfig=<path>}
   * (default {@value #DEFAULT_CONFIG_FILE}). Any {@code -Dkey=value} argument overrides the same
   * key from the file.
   *
   * @param args command line arguments
   * @throws IOException if the configuration file exists but can not be read
   */
  public static void initConfig(String[] args) throws IOException {
    checkNotNull(args, "arguments can not be null");
    Properties overrides = parseArgs(args);
    File configFile = new File(overrides.getProperty(ARGS_CONFIGFILE, DEFAULT_CONFIG_FILE));
    Properties configured = new Properties();
    if (configFile.exists()) {
      try (FileInputStream in = new FileInputStream(configFile)) {
        configured.load(in);
      }
    } else {
      logger.log(Level.CONFIG, "Configuration file {0} not found; using arguments only.",
          configFile);
    }
    configured.putAll(overrides);
    initConfig(configured);
  }

  /**
   * Initializes the configuration from the supplied {@link Properties}. Reloading with identical
   * values is ignored; reloading with different values fails.
   *
   * @param config properties to load
   */
  @SuppressWarnings("rawtypes")
  public static synchronized void initConfig(Properties config) {
    checkNotNull(config, "config can not be null");
    if (initialized.get()) {
      Map<String, String> loadedMap = flatten(loadedConfig);
      Map<String, String> newMap = flatten(config);
      if (loadedMap.equals(newMap)) {
        logger.log(Level.CONFIG, "Attempt to reload config with same values; ignoring.");
        return;
      }
      logger.log(Level.CONFIG, "Keys present in only one config: {0}",
          Sets.symmetricDifference(loadedMap.keySet(), newMap.keySet()));
      checkState(false, "Attempt to reload config with different properties.");
    }
    loadedConfig = config;
    synchronized (configurations) {
      try {
        for (ConfigValue value : configurations) {
          initializeConfigValue(value);
        }
        initialized.set(true);
      } finally {
        if (initialized.get()) {
          configurations.forEach(v -> v.freeze());
        } else {
          configurations.forEach(v -> v.reset());
          loadedConfig = null;
        }
      }
    }
  }

  private static Map<String, String> flatten(Properties p) {
    return p.stringPropertyNames()
        .stream()
        .collect(ImmutableMap.toImmutableMap(name -> name, name -> p.getProperty(name)));
  }

  /**
   * Returns a copy of all loaded properties.
   *
   * @return configuration properties
   */
  public static Properties getConfig() {
    checkState(initialized.get(), "configuration not initialized yet");
    Properties copy = new Properties();
    copy.putAll(loadedConfig);
    return copy;
  }

  /** Returns {@code true} once {@link #initConfig} has completed. */
  public static boolean isInitialized() {
    return initialized.get();
  }

  /** Parses a configured string into a typed value. */
  public interface Parser<T> {
    /**
     * Parses input String to required type.
     *
     * @param value to parse
     * @return converted value
     * @throws InvalidConfigurationException if parsing fails
     */
    T parse(String value) throws InvalidConfigurationException;
  }

  private Configuration() {
    throw new AssertionError();
  }

  /** Accepts only "true" and "false", ignoring case. */
  public static final Parser<Boolean> BOOLEAN_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        if ("true".equalsIgnoreCase(value)) {
          return true;
        }
        if ("false".equalsIgnoreCase(value)) {
          return false;
        }
        throw new InvalidConfigurationException(
            String.format("Invalid value [%s] for boolean configuration property", value));
      };

  public static final Parser<Integer> INTEGER_PARSER =
      value -> {
        checkArgument(!Strings.isNullOrEmpty(value), "value to parse can not be null or empty.");
        try {
          return Integer.parseInt(value);
        } catch (NumberFormatException e) {
          throw new InvalidConfigurationException(e);
        }
      };

  public static final Parser<String> STRING_PARSER =
      value -> {
        checkNotNull(value, "value to parse can not be null.");
        return value;
      };

  /**
   * Parses {@code key=value} pairs separated by commas, for example
   * {@code "username=sAMAccountName, email=userPrincipalName"}.
   */
  public static final Parser<Map<String, String>> MAP_PARSER =
      value -> {
        checkNotNull(value, "value to parse can not be null.");
        try {
          return ImmutableMap.copyOf(
              Splitter.on(',')
                  .trimResults()
                  .omitEmptyStrings()
                  .withKeyValueSeparator(Splitter.on('=').trimResults())
                  .split(value));
        } catch (IllegalArgumentException e) {
          throw new InvalidConfigurationException(
              String.format("Invalid key=value list [%s]", value), e);
        }
      };

  public static ConfigValue<Boolean> getBoolean(String configKey, Boolean defaultValue) {
    return register(
        new ConfigValue.Builder<Boolean>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(BOOLEAN_PARSER)
            .build());
  }

  public static ConfigValue<String> getString(String configKey, String defaultValue) {
    return register(
        new ConfigValue.Builder<String>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(STRING_PARSER)
            .build());
  }

  public static ConfigValue<Integer> getInteger(String configKey, Integer defaultValue) {
    return register(
        new ConfigValue.Builder<Integer>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(INTEGER_PARSER)
            .build());
  }

  /**
   * Integer value that must satisfy {@code validator}. A configured value that fails the check is
   * rejected with an {@link InvalidConfigurationException} carrying {@code requirement}.
   *
   * @param configKey configuration key
   * @param defaultValue value used when the key is absent
   * @param validator check applied to the configured value
   * @param requirement human readable description of the check
   */
  public static ConfigValue<Integer> getValidatedInteger(
      String configKey, Integer defaultValue, Predicate<Integer> validator, String requirement) {
    return register(
        new ConfigValue.Builder<Integer>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(INTEGER_PARSER)
            .setValidator(validator, requirement)
            .build());
  }

  /**
   * Map value parsed with {@link #MAP_PARSER}; absent keys produce an empty map.
   *
   * @param configKey configuration key
   */
  public static ConfigValue<Map<String, String>> getMap(String configKey) {
    return register(
        new ConfigValue.Builder<Map<String, String>>()
            .setConfigKey(configKey)
            .setDefaultValue(ImmutableMap.of())
            .setParser(MAP_PARSER)
            .build());
  }

  /**
   * Value that falls back to another {@link ConfigValue} when its own key is not configured.
   *
   * @param configKey configuration key
   * @param fallback value used when {@code configKey} is absent
   */
  public static <T> ConfigValue<T> getOverriden(String configKey, ConfigValue<T> fallback) {
    return register(
        new ConfigValue.Builder<T>().setConfigKey(configKey).setFallback(fallback).build());
  }

  /** Custom typed value. */
  public static <T> ConfigValue<T> getValue(String configKey, T defaultValue, Parser<T> parser) {
    return register(
        new ConfigValue.Builder<T>()
            .setConfigKey(configKey)
            .setDefaultValue(defaultValue)
            .setParser(parser)
            .build());
  }

  private static <T> ConfigValue<T> register(ConfigValue<T> value) {
    checkNotNull(value);
    if (initialized.get()) {
      initializeConfigValue(value);
    } else {
      synchronized (configurations) {
        configurations.add(value);
      }
    }
    return value;
  }

  @SuppressWarnings("rawtypes")
  private static void initializeConfigValue(ConfigValue value) {
    checkState(loadedConfig != null, "loadedConfig not initialized yet");
    String configured =
        Optional.ofNullable(loadedConfig.getProperty(value.getConfigKey()))
            .map(String::trim)
            .orElse(null);
    value.initialize(configured);
    value.freeze();
  }

  /**
   * Throws {@link InvalidConfigurationException} when {@code condition} is false.
   *
   * @param condition the valid condition to test
   * @param errorFormat message format
   * @param errorArgs message arguments
   */
  public static void checkConfiguration(
      boolean condition, String errorFormat, Object... errorArgs) {
    if (!condition) {
      throw new InvalidConfigurationException(String.format(errorFormat, errorArgs));
    }
  }

  private static Properties parseArgs(String[] args) {
    Properties props = new Properties();
    for (String arg : args) {
      if (arg.startsWith(ARGS_KEY)) {
        String[] parts = arg.substring(ARGS_KEY.length()).split("=", 2);
        if (parts.length == 2) {
          props.setProperty(parts[0].trim(), parts[1].trim());
        }
      }
    }
    return props;
  }

  private static synchronized void resetConfiguration() {
    synchronized (configurations) {
      configurations.clear();
    }
    initialized.set(false);
    loadedConfig = null;
  }

  /** {@link TestRule} that resets the static {@link Configuration} before each test. */
  public static class ResetConfigRule implements TestRule {
    @Override
    public Statement apply(Statement base, Description description) {
      resetConfiguration();
      return base;
    }
  }

  /**
   * {@link TestRule} for initializing {@link Configuration} inside a test.
   *
   * <pre>
   * {@code @Rule public ResetConfigRule resetConfig = new ResetConfigRule(); }
   * {@code @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized(); }
   * </pre>
   */
  public static class SetupConfigRule implements TestRule {
    private SetupConfigRule() {}

    @Override
    public Statement apply(Statement base, Description description) {
      return base;
    }

    public static SetupConfigRule uninitialized() {
      return new SetupConfigRule();
    }

    public void initConfig(Properties properties) {
      Set<String> names = properties.stringPropertyNames();
      if (properties.size() != names.size()) {
        throw new IllegalArgumentException("Non-string properties found in config: "
            + Sets.difference(properties.keySet(), names));
      }
      Configuration.initConfig(properties);
    }
  }
}
