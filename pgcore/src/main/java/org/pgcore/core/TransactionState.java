/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

/**
 * Transaction status reported by ReadyForQuery.
 */
public enum TransactionState {
  IDLE('I'),
  OPEN('T'),
  FAILED('E');

  private final char indicator;

  TransactionState(char indicator) {
    this.indicator = indicator;
  }

  public char getIndicator() {
    return indicator;
  }

  /**
   * @param indicator the status byte of ReadyForQuery
   * @return the matching state or null if the byte is not a known indicator
   */
  public static TransactionState fromIndicator(int indicator) {
    for (TransactionState state : values()) {
      if (state.indicator == indicator) {
        return state;
      }
    }
    return null;
  }
}
