/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.jdbc;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

@UtilityClass
public class SqlGenerator {

  private static final Pattern UNQUOTED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final Set<String> RESERVED_KEYWORDS =
      Set.of(
          "select", "from", "where", "group", "order", "limit", "offset", "insert", "update",
          "delete", "user", "table");

  public static String insert(final String table, final Collection<String> columns) {
    Objects.requireNonNull(table, "Table name cannot be null");
    Objects.requireNonNull(columns, "Column list cannot be null");

    if (columns.isEmpty()) {
      return "INSERT INTO ".concat(quote(table)).concat(" DEFAULT VALUES");
    }

    final String columnList =
        columns.stream().map(SqlGenerator::quote).collect(Collectors.joining(", "));
    final String placeholders =
        columns.stream().map(c -> "?").collect(Collectors.joining(", "));

    return "INSERT INTO "
        .concat(quote(table))
        .concat(" (")
        .concat(columnList)
        .concat(") VALUES (")
        .concat(placeholders)
        .concat(")");
  }

  public static String selectByKey(final String table, final String keyColumn) {
    Objects.requireNonNull(table, "Table name cannot be null");
    Objects.requireNonNull(keyColumn, "Key column cannot be null");
    return "SELECT * FROM ".concat(quote(table)).concat(" WHERE ").concat(quote(keyColumn))
        .concat(" = ?");
  }

  public static String countRows(final String table) {
    Objects.requireNonNull(table, "Table name cannot be null");
    return "SELECT COUNT(*) FROM ".concat(quote(table));
  }

  static String quote(final String identifier) {
    if (!needsQuoting(identifier)) {
      return identifier;
    }
    return "\"".concat(identifier.replace("\"", "\"\"")).concat("\"");
  }

  private static boolean needsQuoting(final String identifier) {
    if (!UNQUOTED.matcher(identifier).matches()) {
      return true;
    }
    return RESERVED_KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT));
  }
}
