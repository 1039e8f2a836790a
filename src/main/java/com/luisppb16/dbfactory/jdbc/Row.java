/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Column values of one row to insert, in column order. Values may be null. */
public record Row(Map<String, Object> values) {

  public Row {
    Objects.requireNonNull(values, "Row values cannot be null");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Object value(final String column) {
    return values.entrySet().stream()
        .filter(e -> e.getKey().equalsIgnoreCase(column))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst()
        .orElse(null);
  }
}
