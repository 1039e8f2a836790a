/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.factory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Connection stand-in that keeps rows in a list and can be told to reject a table. */
final class InMemoryStore {

  private final List<StoredRecord> rows = new ArrayList<>();
  private final Set<String> failingTables = new HashSet<>();
  private long nextId = 1;

  StoredRecord insert(String table, String name, Long parentId) {
    if (failingTables.contains(table)) {
      throw new FactoryInsertException("Could not insert into " + table);
    }
    StoredRecord row = new StoredRecord(nextId++, table, name, parentId);
    rows.add(row);
    return row;
  }

  void failOn(String table) {
    failingTables.add(table);
  }

  List<StoredRecord> rows() {
    return List.copyOf(rows);
  }

  List<String> insertOrder() {
    return rows.stream().map(StoredRecord::table).toList();
  }

  long count(String table) {
    return rows.stream().filter(r -> r.table().equals(table)).count();
  }
}
