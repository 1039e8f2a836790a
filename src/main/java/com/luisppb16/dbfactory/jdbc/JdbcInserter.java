/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes one row and reads it back as a model.
 *
 * <p>The key is taken from the row itself when the key column was supplied explicitly, otherwise
 * the driver is asked to return that one column as the generated key. Other generated columns of
 * the table never stand in for it. The persisted row is then selected by that key, so defaults
 * and generated columns filled in by the database are part of the returned model.
 */
@Slf4j
@UtilityClass
public class JdbcInserter {

  public static <M> M insert(
      final Connection connection,
      final String table,
      final String keyColumn,
      final Row row,
      final RowMapper<M> mapper)
      throws SQLException {
    Objects.requireNonNull(connection, "Connection cannot be null");
    Objects.requireNonNull(row, "Row cannot be null");
    Objects.requireNonNull(mapper, "Row mapper cannot be null");
    Objects.requireNonNull(keyColumn, "Key column cannot be null");

    final List<String> columns = new ArrayList<>(row.values().keySet());
    final String sql = SqlGenerator.insert(table, columns);
    final Object key;

    try (PreparedStatement ps = connection.prepareStatement(sql, new String[] {keyColumn})) {
      bind(ps, row.values());
      ps.executeUpdate();
      key = readKey(ps, row, keyColumn);
    }

    if (key == null) {
      throw new SQLException(
          "No value for key column " + keyColumn + " after insert into " + table);
    }
    log.debug("Inserted into {} with {} = {}", table, keyColumn, key);

    try (PreparedStatement ps =
        connection.prepareStatement(SqlGenerator.selectByKey(table, keyColumn))) {
      ps.setObject(1, key);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException(
              "Row inserted into " + table + " not found by " + keyColumn + " = " + key);
        }
        return mapper.map(rs);
      }
    }
  }

  private static void bind(final PreparedStatement ps, final Map<String, Object> values)
      throws SQLException {
    int index = 1;
    for (final Object value : values.values()) {
      ps.setObject(index++, value);
    }
  }

  private static Object readKey(final PreparedStatement ps, final Row row, final String keyColumn)
      throws SQLException {
    final Object supplied = row.value(keyColumn);
    if (supplied != null) {
      return supplied;
    }
    try (ResultSet keys = ps.getGeneratedKeys()) {
      return keys != null && keys.next() ? keys.getObject(1) : null;
    }
  }
}
