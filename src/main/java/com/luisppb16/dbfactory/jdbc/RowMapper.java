/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Reads the current row of a result set into a model. */
@FunctionalInterface
public interface RowMapper<M> {

  M map(ResultSet rs) throws SQLException;
}
