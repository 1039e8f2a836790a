/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.schema;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.experimental.UtilityClass;

/**
 * Small DSL for the tables a factory test needs.
 *
 * <pre>{@code
 * Schema schema = schema(
 *     table("countries", identity("id"), notNull("name", SqlType.VARCHAR)),
 *     table("cities", identity("id"), notNull("name", SqlType.VARCHAR),
 *         fk("country_id", SqlType.BIGINT, "countries", "id")));
 * }</pre>
 */
@UtilityClass
public class SchemaDsl {

  public static Schema schema(Table... tables) {
    return new Schema(List.of(tables));
  }

  public static Table table(String name, Column... columns) {
    return new Table(name, List.of(columns));
  }

  /** Generated {@code BIGINT} primary key. */
  public static Column identity(String name) {
    return Column.builder().name(name).type(SqlType.BIGINT).primaryKey(true).identity(true).build();
  }

  public static Column pk(String name, SqlType type) {
    return Column.builder().name(name).type(type).primaryKey(true).build();
  }

  public static Column column(String name, SqlType type) {
    return Column.builder().name(name).type(type).build();
  }

  public static Column notNull(String name, SqlType type) {
    return Column.builder().name(name).type(type).notNull(true).build();
  }

  public static Column unique(String name, SqlType type) {
    return Column.builder().name(name).type(type).notNull(true).unique(true).build();
  }

  public static Column fk(String name, SqlType type, String refTable, String refColumn) {
    return Column.builder()
        .name(name)
        .type(type)
        .notNull(true)
        .foreignKey(new ForeignKeyReference(refTable, refColumn))
        .build();
  }

  public static Column nullableFk(String name, SqlType type, String refTable, String refColumn) {
    return Column.builder()
        .name(name)
        .type(type)
        .foreignKey(new ForeignKeyReference(refTable, refColumn))
        .build();
  }

  public static String toSql(Schema schema) {
    return schema.tables().stream().map(SchemaDsl::tableSql).collect(Collectors.joining());
  }

  private static String tableSql(Table table) {
    return createTable(table) + ";\n\n";
  }

  /** Single {@code CREATE TABLE} statement, without a trailing semicolon. */
  public static String createTable(Table table) {
    String cols =
        table.columns().stream().map(SchemaDsl::columnSql).collect(Collectors.joining(",\n"));
    return "CREATE TABLE " + table.name() + " (\n" + cols + "\n)";
  }

  private static String columnSql(Column column) {
    StringBuilder sql =
        new StringBuilder("  ").append(column.name()).append(' ').append(column.type().toSql());

    if (column.identity()) {
      sql.append(" GENERATED BY DEFAULT AS IDENTITY");
    }
    if (column.primaryKey()) {
      sql.append(" PRIMARY KEY");
    } else if (column.notNull()) {
      sql.append(" NOT NULL");
    }
    if (column.unique()) {
      sql.append(" UNIQUE");
    }
    if (column.isForeignKey()) {
      ForeignKeyReference fk = column.foreignKey();
      sql.append(" REFERENCES ").append(fk.table()).append('(').append(fk.column()).append(')');
    }
    return sql.toString();
  }

  /** Column types the DSL can render. Keys and foreign keys are {@link #BIGINT}. */
  public enum SqlType {
    INT("INT"),
    BIGINT("BIGINT"),
    VARCHAR("VARCHAR(255)"),
    DECIMAL("DECIMAL(10, 2)"),
    TIMESTAMP("TIMESTAMP"),
    BOOLEAN("BOOLEAN");

    private final String sql;

    SqlType(String sql) {
      this.sql = sql;
    }

    public String toSql() {
      return sql;
    }
  }

  public record Schema(List<Table> tables) {
    public Schema {
      Objects.requireNonNull(tables, "The list of tables cannot be null.");
      tables = List.copyOf(tables);
    }
  }

  public record Table(String name, List<Column> columns) {
    public Table {
      Objects.requireNonNull(name, "The table name cannot be null.");
      Objects.requireNonNull(columns, "The list of columns cannot be null.");
      columns = List.copyOf(columns);
    }
  }

  @Builder(toBuilder = true)
  public record Column(
      String name,
      SqlType type,
      boolean primaryKey,
      boolean identity,
      boolean notNull,
      boolean unique,
      ForeignKeyReference foreignKey) {
    public Column {
      Objects.requireNonNull(name, "The column name cannot be null.");
      Objects.requireNonNull(type, "The SQL type cannot be null.");
    }

    public boolean isForeignKey() {
      return foreignKey != null;
    }
  }

  public record ForeignKeyReference(String table, String column) {
    public ForeignKeyReference {
      Objects.requireNonNull(table, "The referenced table name cannot be null.");
      Objects.requireNonNull(column, "The referenced column name cannot be null.");
    }
  }
}
