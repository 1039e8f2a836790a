/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DatabaseConfigLoaderTest {

  private static Properties props(String... pairs) {
    Properties properties = new Properties();
    for (int i = 0; i < pairs.length; i += 2) {
      properties.setProperty(pairs[i], pairs[i + 1]);
    }
    return properties;
  }

  @Test
  @DisplayName("Falls back to an in-memory H2 database")
  void defaults() {
    DatabaseConfig config = DatabaseConfigLoader.load(new Properties(), new Properties());

    assertThat(config.url()).isEqualTo("jdbc:h2:mem:dbfactory");
    assertThat(config.user()).isEqualTo("sa");
    assertThat(config.password()).isEmpty();
    assertThat(config.rollbackOnClose()).isTrue();
  }

  @Test
  @DisplayName("Reads values from the properties file")
  void fileValues() {
    Properties file =
        props(
            DatabaseConfigLoader.URL_KEY, "jdbc:h2:mem:other",
            DatabaseConfigLoader.USER_KEY, "tester",
            DatabaseConfigLoader.PASSWORD_KEY, "secret",
            DatabaseConfigLoader.ROLLBACK_KEY, "false");

    DatabaseConfig config = DatabaseConfigLoader.load(file, new Properties());

    assertThat(config.url()).isEqualTo("jdbc:h2:mem:other");
    assertThat(config.user()).isEqualTo("tester");
    assertThat(config.password()).isEqualTo("secret");
    assertThat(config.rollbackOnClose()).isFalse();
  }

  @Test
  @DisplayName("System properties win over the file")
  void overridesWin() {
    Properties file = props(DatabaseConfigLoader.URL_KEY, "jdbc:h2:mem:file");
    Properties overrides = props(DatabaseConfigLoader.URL_KEY, "  jdbc:h2:mem:override  ");

    assertThat(DatabaseConfigLoader.load(file, overrides).url())
        .isEqualTo("jdbc:h2:mem:override");
  }

  @Test
  @DisplayName("Blank values are treated as absent")
  void blanksIgnored() {
    Properties file = props(DatabaseConfigLoader.USER_KEY, "tester");
    Properties overrides =
        props(DatabaseConfigLoader.USER_KEY, "   ", DatabaseConfigLoader.URL_KEY, "");

    DatabaseConfig config = DatabaseConfigLoader.load(file, overrides);

    assertThat(config.user()).isEqualTo("tester");
    assertThat(config.url()).isEqualTo("jdbc:h2:mem:dbfactory");
  }

  @Test
  @DisplayName("Test resource is found on the classpath")
  void readsTestResource() {
    Properties properties = DatabaseConfigLoader.readResource(DatabaseConfigLoader.RESOURCE);

    assertThat(properties.getProperty(DatabaseConfigLoader.URL_KEY))
        .isEqualTo("jdbc:h2:mem:dbfactory-tests");
  }

  @Test
  @DisplayName("Missing resource yields empty properties")
  void missingResource() {
    assertThat(DatabaseConfigLoader.readResource("/does-not-exist.properties")).isEmpty();
  }

  @Test
  @DisplayName("Password is masked in toString")
  void masksPassword() {
    DatabaseConfig config =
        DatabaseConfig.builder().url("jdbc:h2:mem:x").user("sa").password("secret").build();

    assertThat(config.toString()).contains("****").doesNotContain("secret");
  }

  @Test
  @DisplayName("Url is required, user and password default to empty")
  void recordValidation() {
    assertThatThrownBy(() -> DatabaseConfig.builder().build())
        .isInstanceOf(NullPointerException.class);

    DatabaseConfig config = DatabaseConfig.builder().url("jdbc:h2:mem:x").build();
    assertThat(config.user()).isEmpty();
    assertThat(config.password()).isEmpty();
  }
}
