/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

/**
 * SQLState codes raised by the protocol core itself. Errors reported by the server carry
 * the server's own code instead.
 */
public enum PSQLState {

  CONNECTION_DOES_NOT_EXIST("08003"),
  CONNECTION_FAILURE("08006"),
  PROTOCOL_VIOLATION("08P01"),

  DATA_ERROR("22000"),
  INVALID_PARAMETER_VALUE("22023"),

  INVALID_SQL_STATEMENT_NAME("26000"),

  OBJECT_NOT_IN_STATE("55000"),

  IO_ERROR("58030");

  private final String state;

  PSQLState(String state) {
    this.state = state;
  }

  public String getState() {
    return state;
  }
}
