/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

import java.math.BigDecimal;

/**
 * A numrange.
 */
public class PGNumRange extends PGRange<BigDecimal> {

  private static final PGNumRange EMPTY = new PGNumRange();

  private PGNumRange() {
  }

  public PGNumRange(BigDecimal lower, BigDecimal upper) {
    this(lower, upper, "[)");
  }

  public PGNumRange(BigDecimal lower, BigDecimal upper, String bounds) {
    super(lower, upper, bounds, null);
  }

  public static PGNumRange empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.NUMRANGE;
  }
}
