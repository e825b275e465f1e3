/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

import java.io.Serializable;
import java.util.Objects;

/**
 * A value of a type without a dedicated Java representation, kept as its type name and text.
 * Also used for json and jsonb results.
 */
public class PGobject implements SqlTextValue, Serializable, Cloneable {

  private static final long serialVersionUID = 1L;

  protected String type;
  protected String value;

  public PGobject() {
  }

  public PGobject(String type, String value) {
    this.type = type;
    this.value = value;
  }

  public final void setType(String type) {
    this.type = type;
  }

  public final String getType() {
    return type;
  }

  public void setValue(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  @Override
  public String toSqlText() {
    return value;
  }

  /**
   * Resolves {@link #getType()} against the well-known type names, so a {@code PGobject}
   * typed {@code "jsonb"} binds as jsonb.
   */
  @Override
  public int getSqlOid() {
    if (type == null) {
      return Oid.UNSPECIFIED;
    }
    Integer oid = Oid.forTypeName(type);
    return oid == null ? Oid.UNSPECIFIED : oid;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PGobject)) {
      return false;
    }
    PGobject other = (PGobject) obj;
    return Objects.equals(type, other.type) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public Object clone() throws CloneNotSupportedException {
    return super.clone();
  }

  @Override
  public String toString() {
    return value;
  }
}
