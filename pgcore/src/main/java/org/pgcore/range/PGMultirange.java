/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.util.SqlTextValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered set of ranges of one range type, as returned for multirange columns.
 *
 * @param <R> the range class
 */
public class PGMultirange<R extends PGRange<?>> implements SqlTextValue {

  private final int oid;
  private final List<R> ranges;

  public PGMultirange(int oid, List<R> ranges) {
    this.oid = oid;
    this.ranges = Collections.unmodifiableList(new ArrayList<R>(ranges));
  }

  public List<R> getRanges() {
    return ranges;
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  @Override
  public String toSqlText() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < ranges.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(ranges.get(i).toSqlText());
    }
    return sb.append('}').toString();
  }

  @Override
  public int getSqlOid() {
    return oid;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PGMultirange)) {
      return false;
    }
    PGMultirange<?> other = (PGMultirange<?>) o;
    return oid == other.oid && ranges.equals(other.ranges);
  }

  @Override
  public int hashCode() {
    return 31 * oid + ranges.hashCode();
  }

  @Override
  public String toString() {
    return toSqlText();
  }
}
