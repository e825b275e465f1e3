/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

/**
 * An int4range. Discrete, so always held in <code>[)</code> form.
 */
public class PGInt4Range extends PGRange<Integer> {

  private static final PGInt4Range EMPTY = new PGInt4Range();

  private PGInt4Range() {
  }

  public PGInt4Range(Integer lower, Integer upper) {
    this(lower, upper, "[)");
  }

  public PGInt4Range(Integer lower, Integer upper, String bounds) {
    super(lower, upper, bounds, v -> Math.addExact(v, 1));
  }

  public static PGInt4Range empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.INT4RANGE;
  }
}
