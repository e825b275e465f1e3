/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

/**
 * A value that knows its own PostgreSQL text representation. Such values are bound as text
 * parameters using {@link #getSqlOid()} as the parameter type.
 */
public interface SqlTextValue {

  String toSqlText();

  /**
   * @return the OID to declare for the parameter; {@link Oid#UNSPECIFIED} lets the server infer it
   */
  default int getSqlOid() {
    return Oid.UNSPECIFIED;
  }
}
