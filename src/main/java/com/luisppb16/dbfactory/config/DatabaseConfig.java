/*
 *  Copyright (c) 2025 Luis Pepe (@LuisPPB16).
 *  All rights reserved.
 */

package com.luisppb16.dbfactory.config;

import java.util.Objects;
import lombok.Builder;

@Builder(toBuilder = true)
public record DatabaseConfig(String url, String user, String password, boolean rollbackOnClose) {

  public DatabaseConfig {
    Objects.requireNonNull(url, "JDBC url cannot be null.");
    user = Objects.requireNonNullElse(user, "");
    password = Objects.requireNonNullElse(password, "");
  }

  @Override
  public String toString() {
    return "DatabaseConfig[url=%s, user=%s, password=%s, rollbackOnClose=%s]"
        .formatted(url, user, password.isEmpty() ? "" : "****", rollbackOnClose);
  }
}
