/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.db;

import com.luisppb16.dbfactory.config.DatabaseConfig;
import com.luisppb16.dbfactory.config.DatabaseConfigLoader;
import com.luisppb16.dbfactory.jdbc.SqlGenerator;
import com.luisppb16.dbfactory.schema.SchemaDsl;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * A connection running inside a test transaction.
 *
 * <p>Auto-commit is switched off on open, so every factory insert made through
 * {@link #connection()} is undone by {@link #close()} when {@code rollbackOnClose} is set. Note
 * that most databases commit implicitly on DDL, so create the schema before inserting.
 *
 * <pre>{@code
 * try (TestDatabase db = TestDatabase.open()) {
 *   db.create(schema);
 *   City city = new CityFactory().insert(db.connection());
 * }
 * }</pre>
 */
@Slf4j
public final class TestDatabase implements AutoCloseable {

  private final DatabaseConfig config;
  private final Connection connection;

  private TestDatabase(final DatabaseConfig config, final Connection connection) {
    this.config = config;
    this.connection = connection;
  }

  public static TestDatabase open() throws SQLException {
    return open(DatabaseConfigLoader.load());
  }

  public static TestDatabase open(final DatabaseConfig config) throws SQLException {
    Objects.requireNonNull(config, "Database configuration cannot be null");
    final Connection connection =
        DriverManager.getConnection(config.url(), config.user(), config.password());
    try {
      connection.setAutoCommit(false);
    } catch (final SQLException e) {
      connection.close();
      throw e;
    }
    log.info("Opened test database {}", config.url());
    return new TestDatabase(config, connection);
  }

  public Connection connection() {
    return connection;
  }

  public void execute(final String sql) throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      stmt.execute(sql);
    }
  }

  public void create(final SchemaDsl.Schema schema) throws SQLException {
    Objects.requireNonNull(schema, "Schema cannot be null");
    for (final SchemaDsl.Table table : schema.tables()) {
      execute(SchemaDsl.createTable(table));
    }
    log.debug("Created {} tables", schema.tables().size());
  }

  public long count(final String table) throws SQLException {
    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery(SqlGenerator.countRows(table))) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  @Override
  public void close() throws SQLException {
    try {
      if (config.rollbackOnClose()) {
        connection.rollback();
        log.info("Rolled back test transaction on {}", config.url());
      } else {
        connection.commit();
      }
    } finally {
      connection.close();
    }
  }
}
