/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;

import java.time.OffsetDateTime;

/**
 * A tstzrange. Bounds compare by instant.
 */
public class PGTimestampTZRange extends PGRange<OffsetDateTime> {

  private static final PGTimestampTZRange EMPTY = new PGTimestampTZRange();

  private PGTimestampTZRange() {
  }

  public PGTimestampTZRange(OffsetDateTime lower, OffsetDateTime upper) {
    this(lower, upper, "[)");
  }

  public PGTimestampTZRange(OffsetDateTime lower, OffsetDateTime upper, String bounds) {
    super(lower, upper, bounds, null);
  }

  public static PGTimestampTZRange empty() {
    return EMPTY;
  }

  @Override
  public int getSqlOid() {
    return Oid.TSTZRANGE;
  }
}
