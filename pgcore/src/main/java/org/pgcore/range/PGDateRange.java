/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

import java.time.LocalDate;

/**
 * A daterange. Discrete, so always held in <code>[)</code> form.
 */
public class PGDateRange extends PGRange<LocalDate> {

  private static final PGDateRange EMPTY = new PGDateRange();

  private PGDateRange() {
  }

  public PGDateRange(LocalDate lower, LocalDate upper) {
    this(lower, upper, "[)");
  }

  public PGDateRange(LocalDate lower, LocalDate upper, String bounds) {
    super(lower, upper, bounds, v -> v.plusDays(1));
  }

  public static PGDateRange empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.DATERANGE;
  }
}
