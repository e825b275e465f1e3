/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.core.Format;
import org.pgcore.core.Oid;

/**
 * One encoded Bind parameter: the type OID sent in Parse, the wire format and the value bytes
 * ({@code null} for SQL NULL). Lives only while one request is being built.
 */
public final class ParameterInfo {
  private final int oid;
  private final Format format;
  private final byte[] value;

  public ParameterInfo(int oid, Format format, byte[] value) {
    this.oid = oid;
    this.format = format;
    this.value = value;
  }

  public int getOid() {
    return oid;
  }

  public Format getFormat() {
    return format;
  }

  public byte[] getValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public String toString() {
    return Oid.toString(oid) + "/" + format + (value == null ? " NULL" : " " + value.length + " bytes");
  }
}
