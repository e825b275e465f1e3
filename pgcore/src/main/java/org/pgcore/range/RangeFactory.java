/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.core.Oid;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * Builds range values from decoded bounds. Used by the range converters, which decode the
 * bounds with the element converter first.
 */
public abstract class RangeFactory {

  public static final RangeFactory INT4 = new RangeFactory(Oid.INT4RANGE, Integer.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGInt4Range.empty() : new PGInt4Range((Integer) lower, (Integer) upper, bounds);
    }
  };

  public static final RangeFactory INT8 = new RangeFactory(Oid.INT8RANGE, Long.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGInt8Range.empty() : new PGInt8Range((Long) lower, (Long) upper, bounds);
    }
  };

  public static final RangeFactory NUMERIC = new RangeFactory(Oid.NUMRANGE, BigDecimal.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGNumRange.empty()
          : new PGNumRange((BigDecimal) lower, (BigDecimal) upper, bounds);
    }
  };

  public static final RangeFactory DATE = new RangeFactory(Oid.DATERANGE, LocalDate.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGDateRange.empty()
          : new PGDateRange((LocalDate) lower, (LocalDate) upper, bounds);
    }
  };

  public static final RangeFactory TIMESTAMP = new RangeFactory(Oid.TSRANGE, LocalDateTime.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGTimestampRange.empty()
          : new PGTimestampRange((LocalDateTime) lower, (LocalDateTime) upper, bounds);
    }
  };

  public static final RangeFactory TIMESTAMPTZ = new RangeFactory(Oid.TSTZRANGE, OffsetDateTime.class) {
    @Override
    protected PGRange<?> build(Object lower, Object upper, String bounds) {
      return bounds == null ? PGTimestampTZRange.empty()
          : new PGTimestampTZRange((OffsetDateTime) lower, (OffsetDateTime) upper, bounds);
    }
  };

  private final int rangeOid;
  private final Class<?> elementClass;

  protected RangeFactory(int rangeOid, Class<?> elementClass) {
    this.rangeOid = rangeOid;
    this.elementClass = elementClass;
  }

  public int getRangeOid() {
    return rangeOid;
  }

  /**
   * @param lower decoded lower bound, null when unbounded
   * @param upper decoded upper bound, null when unbounded
   * @param bounds bound characters such as {@code "[)"}, or null for the empty range
   * @return the range
   * @throws PSQLException if a bound has the wrong type or the bounds are out of order
   */
  public PGRange<?> create(Object lower, Object upper, String bounds) throws PSQLException {
    checkBound(lower);
    checkBound(upper);
    try {
      return build(lower, upper, bounds);
    } catch (RuntimeException e) {
      throw new PSQLException(GT.tr("Invalid {0} value: {1}", Oid.toString(rangeOid), e.getMessage()),
          PSQLState.DATA_ERROR, e);
    }
  }

  private void checkBound(Object bound) throws PSQLException {
    if (bound != null && !elementClass.isInstance(bound)) {
      // infinity and out of range dates decode to strings
      throw new PSQLException(GT.tr("Unsupported {0} bound: {1}", Oid.toString(rangeOid), bound),
          PSQLState.DATA_ERROR);
    }
  }

  protected abstract PGRange<?> build(Object lower, Object upper, String bounds);
}
