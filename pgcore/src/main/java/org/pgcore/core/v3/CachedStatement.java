/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.v3;

import org.pgcore.core.Field;
import org.pgcore.core.Format;
import org.pgcore.core.types.TypeConverter;

import java.util.List;

/**
 * Stores what is known about one cached statement: its server side name, whether it is
 * prepared and how often it ran, and the row description the server returned for it.
 */
public class CachedStatement {
  public final StatementKey key;
  private final int slot;
  private final String name;
  private boolean prepared;
  private int executeCount;
  private boolean described;
  private Format describedFormat;
  private List<Field> fields;
  private TypeConverter[] converters;

  CachedStatement(StatementKey key, int slot) {
    this.key = key;
    this.slot = slot;
    this.name = statementName(slot);
    // the execution that created the entry
    this.executeCount = 1;
  }

  /**
   * @param slot cache slot
   * @return the fixed width server side statement name for the slot
   */
  public static String statementName(int slot) {
    return String.format("_pgcore_%03d", slot);
  }

  public int getSlot() {
    return slot;
  }

  public String getName() {
    return name;
  }

  public boolean isPrepared() {
    return prepared;
  }

  void setPrepared(boolean prepared) {
    this.prepared = prepared;
  }

  void increaseExecuteCount() {
    if (executeCount < Integer.MAX_VALUE) {
      executeCount++;
    }
  }

  /**
   * @return successful unprepared executions so far, counting the one that created the entry
   */
  public int getExecuteCount() {
    return executeCount;
  }

  /**
   * Remembers the row description of the prepared statement, so later executions can skip the
   * Describe round trip.
   *
   * @param format result format the description was obtained for
   * @param fields column descriptions, null when the statement returns no rows
   * @param converters per column converters matching {@code fields}
   */
  void setDescription(Format format, List<Field> fields, TypeConverter[] converters) {
    this.described = true;
    this.describedFormat = format;
    this.fields = fields;
    this.converters = converters;
  }

  /**
   * @param format requested result format
   * @return whether a prepared execution with this format can reuse the stored description
   */
  public boolean isDescribedFor(Format format) {
    return prepared && described && describedFormat == format;
  }

  public List<Field> getFields() {
    return fields;
  }

  public TypeConverter[] getConverters() {
    return converters;
  }

  /**
   * Forgets the server side state, after the statement was closed or found missing.
   */
  void reset() {
    prepared = false;
    executeCount = 0;
    described = false;
    describedFormat = null;
    fields = null;
    converters = null;
  }

  @Override
  public String toString() {
    return "CachedStatement{"
        + "name=" + name
        + ", prepared=" + prepared
        + ", executeCount=" + executeCount
        + ", key=" + key
        + '}';
  }
}
