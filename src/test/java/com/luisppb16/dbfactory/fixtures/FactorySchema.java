/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.fixtures;

import com.luisppb16.dbfactory.config.DatabaseConfig;
import com.luisppb16.dbfactory.db.TestDatabase;
import com.luisppb16.dbfactory.generator.Sequence;
import com.luisppb16.dbfactory.schema.SchemaDsl;
import com.luisppb16.dbfactory.schema.SchemaDsl.SqlType;
import java.sql.SQLException;
import lombok.experimental.UtilityClass;

/** Tables behind the fixture factories, and a fresh in-memory database holding them. */
@UtilityClass
public class FactorySchema {

  public static final SchemaDsl.Schema SCHEMA =
      SchemaDsl.schema(
          SchemaDsl.table(
              "countries", SchemaDsl.identity("id"), SchemaDsl.notNull("name", SqlType.VARCHAR)),
          SchemaDsl.table(
              "cities",
              SchemaDsl.identity("id"),
              SchemaDsl.notNull("name", SqlType.VARCHAR),
              SchemaDsl.fk("country_id", SqlType.BIGINT, "countries", "id")),
          SchemaDsl.table(
              "districts",
              SchemaDsl.identity("id"),
              SchemaDsl.notNull("name", SqlType.VARCHAR),
              SchemaDsl.fk("city_id", SqlType.BIGINT, "cities", "id")),
          SchemaDsl.table(
              "users",
              SchemaDsl.identity("id"),
              SchemaDsl.notNull("name", SqlType.VARCHAR),
              SchemaDsl.unique("email", SqlType.VARCHAR),
              SchemaDsl.nullableFk("country_id", SqlType.BIGINT, "countries", "id"),
              SchemaDsl.nullableFk("home_city_id", SqlType.BIGINT, "cities", "id")));

  public static TestDatabase openFreshDatabase() throws SQLException {
    final DatabaseConfig config =
        DatabaseConfig.builder()
            .url(Sequence.sequence(n -> "jdbc:h2:mem:factories-" + n))
            .user("sa")
            .password("")
            .rollbackOnClose(true)
            .build();
    final TestDatabase db = TestDatabase.open(config);
    db.create(SCHEMA);
    return db;
  }
}
