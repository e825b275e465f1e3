/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

import java.io.Serializable;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * An interval value as stored by the server: months, days and microseconds are kept apart
 * because their lengths are calendar dependent.
 */
public class PGInterval implements SqlTextValue, Serializable {

  private static final long serialVersionUID = 1L;

  private static final long MICROS_PER_SECOND = 1000000L;

  private final int months;
  private final int days;
  private final long microseconds;

  public PGInterval(int months, int days, long microseconds) {
    this.months = months;
    this.days = days;
    this.microseconds = microseconds;
  }

  public static PGInterval of(Duration duration) {
    long seconds = duration.getSeconds();
    long days = seconds / 86400;
    long micros = (seconds % 86400) * MICROS_PER_SECOND + duration.getNano() / 1000;
    return new PGInterval(0, Math.toIntExact(days), micros);
  }

  public int getMonths() {
    return months;
  }

  public int getDays() {
    return days;
  }

  public long getMicroseconds() {
    return microseconds;
  }

  /**
   * @return the interval as a duration, counting a day as 24 hours
   * @throws ArithmeticException if months are set, since a month has no fixed length
   */
  public Duration toDuration() {
    if (months != 0) {
      throw new ArithmeticException(GT.tr("Interval with {0} months has no fixed duration", months));
    }
    return Duration.ofDays(days).plus(microseconds, ChronoUnit.MICROS);
  }

  @Override
  public String toSqlText() {
    return months + " mons " + days + " days " + microseconds + " microseconds";
  }

  @Override
  public int getSqlOid() {
    return Oid.INTERVAL;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PGInterval)) {
      return false;
    }
    PGInterval other = (PGInterval) o;
    return months == other.months && days == other.days && microseconds == other.microseconds;
  }

  @Override
  public int hashCode() {
    return (31 * months + days) * 31 + Long.hashCode(microseconds);
  }

  @Override
  public String toString() {
    return "PGInterval{months=" + months + ", days=" + days + ", microseconds=" + microseconds + '}';
  }
}
