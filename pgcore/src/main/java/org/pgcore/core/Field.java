/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

/**
 * One column of a RowDescription.
 */
public class Field {
  private final String columnLabel;
  private final int tableOid;
  private final int positionInTable;
  private final int oid;
  private final int length;
  private final int mod;
  private final Format format;

  public Field(String columnLabel, int tableOid, int positionInTable, int oid, int length, int mod,
      Format format) {
    this.columnLabel = columnLabel;
    this.tableOid = tableOid;
    this.positionInTable = positionInTable;
    this.oid = oid;
    this.length = length;
    this.mod = mod;
    this.format = format;
  }

  public String getColumnLabel() {
    return columnLabel;
  }

  /**
   * @return OID of the source table, 0 when the column is not a plain table column
   */
  public int getTableOid() {
    return tableOid;
  }

  public int getPositionInTable() {
    return positionInTable;
  }

  public int getOid() {
    return oid;
  }

  /**
   * @return the type size, negative for variable width types
   */
  public int getLength() {
    return length;
  }

  public int getMod() {
    return mod;
  }

  public Format getFormat() {
    return format;
  }

  @Override
  public String toString() {
    return "Field(" + columnLabel + "," + Oid.toString(oid) + "," + length + ","
        + (format == Format.BINARY ? 'B' : 'T') + ")";
  }
}
