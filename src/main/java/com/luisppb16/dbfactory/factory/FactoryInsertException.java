/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.dbfactory.factory;

/**
 * Thrown when a factory cannot be persisted. A failed insert is a broken test setup, so this is
 * unchecked and travels up through every nested association unchanged.
 */
public class FactoryInsertException extends RuntimeException {

  public FactoryInsertException(String message, Throwable cause) {
    super(message, cause);
  }

  public FactoryInsertException(String message) {
    super(message);
  }
}
