/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.config;

import com.luisppb16.dbfactory.util.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

/**
 * Loads the test database settings. System properties win over {@code db-factory.properties} on
 * the classpath, which wins over the built-in defaults.
 */
@Slf4j
@UtilityClass
public class DatabaseConfigLoader {

  public static final String RESOURCE = "/db-factory.properties";

  static final String URL_KEY = "dbfactory.connection.url";
  static final String USER_KEY = "dbfactory.connection.user";
  static final String PASSWORD_KEY = "dbfactory.connection.password";
  static final String ROLLBACK_KEY = "dbfactory.rollback";

  private static final String DEFAULT_URL = "jdbc:h2:mem:dbfactory";
  private static final String DEFAULT_USER = "sa";
  private static final boolean DEFAULT_ROLLBACK = true;

  @NotNull
  public static DatabaseConfig load() {
    return load(readResource(RESOURCE), System.getProperties());
  }

  @NotNull
  static DatabaseConfig load(@NotNull final Properties file, @NotNull final Properties overrides) {
    Objects.requireNonNull(file, "File properties cannot be null");
    Objects.requireNonNull(overrides, "Override properties cannot be null");

    final DatabaseConfig config =
        DatabaseConfig.builder()
            .url(value(URL_KEY, file, overrides, DEFAULT_URL))
            .user(value(USER_KEY, file, overrides, DEFAULT_USER))
            .password(value(PASSWORD_KEY, file, overrides, ""))
            .rollbackOnClose(
                Boolean.parseBoolean(
                    value(ROLLBACK_KEY, file, overrides, String.valueOf(DEFAULT_ROLLBACK))))
            .build();

    log.debug("Configuration loaded: {}", config);
    return config;
  }

  static Properties readResource(final String resource) {
    final Properties properties = new Properties();
    try (InputStream in = DatabaseConfigLoader.class.getResourceAsStream(resource)) {
      if (in == null) {
        log.info("{} not found on the classpath, using defaults.", resource);
        return properties;
      }
      properties.load(in);
      return properties;
    } catch (final IOException e) {
      log.error("Could not read {}", resource, e);
      throw new ConfigurationException("Could not read " + resource, e);
    }
  }

  private static String value(
      final String key, final Properties file, final Properties overrides, final String fallback) {
    final String override = overrides.getProperty(key);
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    final String fromFile = file.getProperty(key);
    if (fromFile != null && !fromFile.isBlank()) {
      return fromFile.trim();
    }
    return fallback;
  }
}
