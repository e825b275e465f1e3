/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.v3;

import java.util.Arrays;

/**
 * Statement cache key: the SQL text together with the type OIDs its parameters were bound with,
 * so the same text bound with different types is a different statement.
 */
public final class StatementKey {
  private final String sql;
  private final int[] parameterOids;

  public StatementKey(String sql, int[] parameterOids) {
    this.sql = sql;
    this.parameterOids = parameterOids.clone();
  }

  public String getSql() {
    return sql;
  }

  public int[] getParameterOids() {
    return parameterOids.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StatementKey)) {
      return false;
    }
    StatementKey that = (StatementKey) o;
    return sql.equals(that.sql) && Arrays.equals(parameterOids, that.parameterOids);
  }

  @Override
  public int hashCode() {
    return 31 * sql.hashCode() + Arrays.hashCode(parameterOids);
  }

  @Override
  public String toString() {
    return "StatementKey{sql=" + sql + ", oids=" + Arrays.toString(parameterOids) + '}';
  }
}
