/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

import java.time.LocalDateTime;

/**
 * A tsrange.
 */
public class PGTimestampRange extends PGRange<LocalDateTime> {

  private static final PGTimestampRange EMPTY = new PGTimestampRange();

  private PGTimestampRange() {
  }

  public PGTimestampRange(LocalDateTime lower, LocalDateTime upper) {
    this(lower, upper, "[)");
  }

  public PGTimestampRange(LocalDateTime lower, LocalDateTime upper, String bounds) {
    super(lower, upper, bounds, null);
  }

  public static PGTimestampRange empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.TSRANGE;
  }
}
