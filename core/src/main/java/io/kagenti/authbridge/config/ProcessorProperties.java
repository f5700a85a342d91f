/*
 * Copyright 2025 Google LLC
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

package io.kagenti.authbridge.config;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import javax.annotation.Nullable;
import org.ini4j.Wini;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves processor settings from an optional INI file, then environment variables, then system
 * properties.
 *
 * <p>Keys are dotted lower-case names ({@code token.url}); the environment lookup uses the
 * upper-case, underscore form ({@code TOKEN_URL}). The INI file is looked up on the classpath first
 * and then on the filesystem; a missing file is not an error.
 */
public final class ProcessorProperties {

  private static final Logger logger = LoggerFactory.getLogger(ProcessorProperties.class);

  /** Environment variable naming the INI file to load. */
  public static final String CONFIG_FILE_ENV = "AUTHBRIDGE_CONFIG_FILE";

  /** Environment variable naming the INI section to read. */
  public static final String CONFIG_SECTION_ENV = "AUTHBRIDGE_ENV";

  static final String DEFAULT_CONFIG_FILE = "authbridge.ini";
  static final String DEFAULT_SECTION = "production";

  @Nullable private final Wini ini;
  private final String section;
  private final Map<String, String> environment;
  private final Properties systemProperties;

  private ProcessorProperties(
      @Nullable Wini ini,
      String section,
      Map<String, String> environment,
      Properties systemProperties) {
    this.ini = ini;
    this.section = section;
    this.environment = ImmutableMap.copyOf(environment);
    this.systemProperties = systemProperties;
  }

  /**
   * Loads properties for the running process, honouring {@value #CONFIG_FILE_ENV} and {@value
   * #CONFIG_SECTION_ENV}.
   */
  public static ProcessorProperties fromEnvironment() {
    Map<String, String> env = System.getenv();
    String file = env.getOrDefault(CONFIG_FILE_ENV, DEFAULT_CONFIG_FILE);
    String section = env.getOrDefault(CONFIG_SECTION_ENV, DEFAULT_SECTION);
    return new ProcessorProperties(loadIni(file), section, env, System.getProperties());
  }

  /**
   * Loads properties from the given INI file and section, with environment and system-property
   * fallback.
   *
   * @param filePath path to the INI file (classpath resource or filesystem path)
   * @param section section name inside the INI file
   */
  public static ProcessorProperties load(String filePath, String section) {
    return new ProcessorProperties(
        loadIni(filePath), section, System.getenv(), System.getProperties());
  }

  /** Creates properties backed only by the given variables. Intended for tests and embedding. */
  public static ProcessorProperties of(Map<String, String> variables) {
    return new ProcessorProperties(null, DEFAULT_SECTION, variables, new Properties());
  }

  @Nullable
  private static Wini loadIni(String filePath) {
    String resourcePath = filePath.startsWith("/") ? filePath.substring(1) : filePath;
    try (InputStream classpathStream =
        ProcessorProperties.class.getClassLoader().getResourceAsStream(resourcePath)) {
      if (classpathStream != null) {
        Wini wini = new Wini(classpathStream);
        logger.info("Loaded properties from classpath resource: {}", resourcePath);
        return wini;
      }
    } catch (IOException ex) {
      logger.debug("Failed to load {} from classpath: {}", resourcePath, ex.getMessage());
    }

    File configFile = new File(filePath);
    if (configFile.isFile()) {
      try {
        Wini wini = new Wini(configFile);
        logger.info("Loaded properties from filesystem: {}", filePath);
        return wini;
      } catch (IOException ex) {
        logger.warn("Failed to load properties from {}: {}", filePath, ex.getMessage());
      }
    }
    logger.debug("No properties file at {}; using environment variables only", filePath);
    return null;
  }

  /**
   * Looks a property up in the INI file, then the environment, then system properties.
   *
   * @param key dotted property key, for example {@code token.url}
   * @return the trimmed value, or empty when unset or blank
   */
  public Optional<String> get(String key) {
    if (ini != null) {
      String value = ini.get(section, key);
      if (!Strings.isNullOrEmpty(value) && !value.trim().isEmpty()) {
        return Optional.of(value.trim());
      }
    }

    String envValue = environment.get(toEnvKey(key));
    if (envValue != null && !envValue.trim().isEmpty()) {
      return Optional.of(envValue.trim());
    }

    String sysValue = systemProperties.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return Optional.of(sysValue.trim());
    }
    return Optional.empty();
  }

  public String get(String key, String defaultValue) {
    return get(key).orElse(defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    Optional<String> value = get(key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Property '" + key + "' must be an integer but was '" + value.get() + "'", e);
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return get(key).map(v -> v.equalsIgnoreCase("true")).orElse(defaultValue);
  }

  static String toEnvKey(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }
}
