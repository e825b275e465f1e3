/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of one statement: its columns and rows when it returned any, and its
 * CommandComplete tag.
 */
public class Result {
  private final List<Field> fields;
  private final List<Object[]> rows;
  private final String commandTag;

  public Result(List<Field> fields, List<Object[]> rows, String commandTag) {
    this.fields = fields == null ? null : Collections.unmodifiableList(fields);
    this.rows = rows == null ? null : Collections.unmodifiableList(rows);
    this.commandTag = commandTag;
  }

  /**
   * @return column descriptions, or null when the statement returned no row set
   */
  public List<Field> getFields() {
    return fields;
  }

  /**
   * @return rows in arrival order, or null when the statement returned no row set
   */
  public List<Object[]> getRows() {
    return rows;
  }

  public String getCommandTag() {
    return commandTag;
  }

  /**
   * Parses the trailing count of the command tag, as in {@code INSERT 0 5} or {@code UPDATE 3}.
   *
   * @return the count or -1 when the tag carries none
   */
  public long getRecordsAffected() {
    if (commandTag == null) {
      return -1;
    }
    int space = commandTag.lastIndexOf(' ');
    if (space < 0) {
      return -1;
    }
    try {
      return Long.parseLong(commandTag.substring(space + 1));
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  @Override
  public String toString() {
    return "Result{tag=" + commandTag + ", fields=" + fields + ", rows="
        + (rows == null ? "null" : String.valueOf(rows.size())) + '}';
  }
}
