/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

/**
 * An int8range. Discrete, so always held in <code>[)</code> form.
 */
public class PGInt8Range extends PGRange<Long> {

  private static final PGInt8Range EMPTY = new PGInt8Range();

  private PGInt8Range() {
  }

  public PGInt8Range(Long lower, Long upper) {
    this(lower, upper, "[)");
  }

  public PGInt8Range(Long lower, Long upper, String bounds) {
    super(lower, upper, bounds, v -> Math.addExact(v, 1L));
  }

  public static PGInt8Range empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.INT8RANGE;
  }
}
