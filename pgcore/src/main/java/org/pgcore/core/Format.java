/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

/**
 * Wire format of parameter or result values.
 */
public enum Format {
  /**
   * Let the executor choose: text for the simple query path, binary otherwise.
   */
  DEFAULT(-1),
  TEXT(0),
  BINARY(1);

  private final int code;

  Format(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }
}
