/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.jdbc;

import com.luisppb16.dbfactory.factory.Factory;
import com.luisppb16.dbfactory.factory.FactoryInsertException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for factories that insert through plain JDBC.
 *
 * <p>A subclass names its table, turns its fields into a {@link Row} and maps the persisted row
 * back to its model:
 *
 * <pre>{@code
 * public final class CityFactory extends JdbcFactory<City, Long> {
 *   private String name = "Copenhagen";
 *   private Association<Country, Long, Connection> country =
 *       Association.defaultOf(CountryFactory::new);
 *
 *   protected Row toRow(Connection connection) {
 *     Map<String, Object> values = new LinkedHashMap<>();
 *     values.put("name", name);
 *     values.put("country_id", country.insertReturningId(connection));
 *     return new Row(values);
 *   }
 *   ...
 * }
 * }</pre>
 *
 * <p>Associations are resolved inside {@link #toRow(Connection)}, before this row is written, so
 * parents always land first.
 */
@Slf4j
public abstract class JdbcFactory<M, I> implements Factory<M, I, Connection> {

  private static final String DEFAULT_KEY_COLUMN = "id";

  protected abstract String table();

  /** Column values to insert. Resolves this factory's associations against {@code connection}. */
  protected abstract Row toRow(Connection connection);

  protected abstract M map(ResultSet rs) throws SQLException;

  @Override
  public abstract JdbcFactory<M, I> copy();

  protected String keyColumn() {
    return DEFAULT_KEY_COLUMN;
  }

  @Override
  public M insert(final Connection connection) {
    Objects.requireNonNull(connection, "Connection cannot be null");
    final Row row = toRow(connection);
    try {
      return JdbcInserter.insert(connection, table(), keyColumn(), row, this::map);
    } catch (final SQLException e) {
      log.debug("Insert into {} failed: {}", table(), e.getMessage());
      throw new FactoryInsertException("Could not insert into " + table(), e);
    }
  }
}
