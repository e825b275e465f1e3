/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.PGInterval;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

public class DateTimeConvertersTest {

  private static final DecodeContext ISO = DecodeContext.of(true, null);
  private static final DecodeContext NOT_ISO = DecodeContext.of(false, null);

  private static Object text(TypeConverter converter, DecodeContext ctx, String value) throws SQLException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return converter.decode(ctx, bytes, 0, bytes.length);
  }

  private static Object int4(TypeConverter converter, int value) throws SQLException {
    byte[] bytes = new byte[4];
    ByteConverter.int4(bytes, 0, value);
    return converter.decode(ISO, bytes, 0, 4);
  }

  private static Object int8(TypeConverter converter, DecodeContext ctx, long value) throws SQLException {
    byte[] bytes = new byte[8];
    ByteConverter.int8(bytes, 0, value);
    return converter.decode(ctx, bytes, 0, 8);
  }

  @Test
  public void dateText() throws Exception {
    assertEquals(LocalDate.of(2024, 2, 29), text(DateTimeConverters.DATE_TEXT, ISO, "2024-02-29"));
    assertEquals("infinity", text(DateTimeConverters.DATE_TEXT, ISO, "infinity"));
    assertEquals("2024-02-29", text(DateTimeConverters.DATE_TEXT, NOT_ISO, "2024-02-29"));
  }

  @Test
  public void dateBinary() throws Exception {
    assertEquals(LocalDate.of(2000, 1, 1), int4(DateTimeConverters.DATE_BINARY, 0));
    assertEquals(LocalDate.of(1999, 12, 31), int4(DateTimeConverters.DATE_BINARY, -1));
    assertEquals("infinity", int4(DateTimeConverters.DATE_BINARY, Integer.MAX_VALUE));
    assertEquals("-infinity", int4(DateTimeConverters.DATE_BINARY, Integer.MIN_VALUE));
  }

  @Test
  public void dateBeforeYearOneIsBc() throws Exception {
    int days = (int) (LocalDate.of(0, 12, 31).toEpochDay() - LocalDate.of(2000, 1, 1).toEpochDay());
    assertEquals("0001-12-31 BC", int4(DateTimeConverters.DATE_BINARY, days));
  }

  @Test
  public void timeText() throws Exception {
    assertEquals(LocalTime.of(12, 34, 56, 789000000), text(DateTimeConverters.TIME_TEXT, ISO, "12:34:56.789"));
    assertEquals(DateTimeConverters.HOUR24, text(DateTimeConverters.TIME_TEXT, ISO, "24:00:00"));
    assertDataError(DateTimeConverters.TIME_TEXT, "24:00:01");
    assertDataError(DateTimeConverters.TIME_TEXT, "12:34");
    assertDataError(DateTimeConverters.TIME_TEXT, "25:00:00");
  }

  @Test
  public void timeBinary() throws Exception {
    long micros = DateTimeConverters.toPgMicros(LocalTime.of(1, 2, 3, 4000));
    assertEquals(LocalTime.of(1, 2, 3, 4000), int8(DateTimeConverters.TIME_BINARY, ISO, micros));
    assertEquals(DateTimeConverters.HOUR24,
        int8(DateTimeConverters.TIME_BINARY, ISO, DateTimeConverters.USECS_PER_DAY));
    assertEquals(LocalTime.MIDNIGHT, int8(DateTimeConverters.TIME_BINARY, ISO, 0));
    assertEquals(DateTimeConverters.USECS_PER_DAY, DateTimeConverters.toPgMicros(DateTimeConverters.HOUR24));
    try {
      int8(DateTimeConverters.TIME_BINARY, ISO, DateTimeConverters.USECS_PER_DAY + 1);
      fail("time past 24:00 must be rejected");
    } catch (PSQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  @Test
  public void timetz() throws Exception {
    assertEquals(OffsetTime.of(10, 0, 0, 0, ZoneOffset.ofHoursMinutes(5, 30)),
        text(DateTimeConverters.TIMETZ_TEXT, ISO, "10:00:00+05:30"));

    byte[] bytes = new byte[12];
    ByteConverter.int8(bytes, 0, 10 * DateTimeConverters.USECS_PER_HOUR);
    // seconds west of UTC
    ByteConverter.int4(bytes, 8, -3600);
    assertEquals(OffsetTime.of(10, 0, 0, 0, ZoneOffset.ofHours(1)),
        DateTimeConverters.TIMETZ_BINARY.decode(ISO, bytes, 0, 12));
  }

  @Test
  public void timestampText() throws Exception {
    assertEquals(LocalDateTime.of(2024, 2, 29, 12, 34, 56, 500000000),
        text(DateTimeConverters.TIMESTAMP_TEXT, ISO, "2024-02-29 12:34:56.5"));
    assertEquals("2024-02-29 12:34:56 BC", text(DateTimeConverters.TIMESTAMP_TEXT, ISO, "2024-02-29 12:34:56 BC"));
    assertEquals("02/29/2024 12:34:56", text(DateTimeConverters.TIMESTAMP_TEXT, NOT_ISO, "02/29/2024 12:34:56"));
  }

  @Test
  public void timestampBinary() throws Exception {
    assertEquals(LocalDateTime.of(2000, 1, 1, 0, 0, 1),
        int8(DateTimeConverters.TIMESTAMP_BINARY, ISO, DateTimeConverters.USECS_PER_SEC));
    assertEquals(LocalDateTime.of(1999, 12, 31, 23, 59, 59),
        int8(DateTimeConverters.TIMESTAMP_BINARY, ISO, -DateTimeConverters.USECS_PER_SEC));
    assertEquals("infinity", int8(DateTimeConverters.TIMESTAMP_BINARY, ISO, Long.MAX_VALUE));
    assertEquals("-infinity", int8(DateTimeConverters.TIMESTAMP_BINARY, ISO, Long.MIN_VALUE));
  }

  @Test
  public void timestamptzText() throws Exception {
    assertEquals(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(-8)),
        text(DateTimeConverters.TIMESTAMPTZ_TEXT, ISO, "2024-01-02 03:04:05-08"));
    DecodeContext utc = DecodeContext.of(true, ZoneOffset.UTC);
    assertEquals(OffsetDateTime.of(2024, 1, 2, 11, 4, 5, 0, ZoneOffset.UTC),
        text(DateTimeConverters.TIMESTAMPTZ_TEXT, utc, "2024-01-02 03:04:05-08"));
  }

  @Test
  public void timestamptzBinaryUsesSessionZone() throws Exception {
    assertEquals(OffsetDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC),
        int8(DateTimeConverters.TIMESTAMPTZ_BINARY, ISO, 0));
    DecodeContext plusTwo = DecodeContext.of(true, ZoneId.of("+02:00"));
    assertEquals(OffsetDateTime.of(2000, 1, 1, 2, 0, 0, 0, ZoneOffset.ofHours(2)),
        int8(DateTimeConverters.TIMESTAMPTZ_BINARY, plusTwo, 0));
  }

  @Test
  public void intervalText() throws Exception {
    PGInterval expected = new PGInterval(14, -3,
        4 * DateTimeConverters.USECS_PER_HOUR + 5 * DateTimeConverters.USECS_PER_MINUTE + 6500000);
    assertEquals(expected, text(DateTimeConverters.INTERVAL_TEXT, ISO, "1 year 2 mons -3 days 04:05:06.5"));
    assertEquals(new PGInterval(0, 0, -DateTimeConverters.USECS_PER_HOUR),
        text(DateTimeConverters.INTERVAL_TEXT, ISO, "-01:00:00"));
    assertEquals(new PGInterval(0, 0, 0), text(DateTimeConverters.INTERVAL_TEXT, ISO, "00:00:00"));
    assertDataError(DateTimeConverters.INTERVAL_TEXT, "3 fortnights");
  }

  @Test
  public void intervalTextInOtherStylesStaysText() throws Exception {
    DecodeContext iso8601 = new DecodeContext() {
      @Override
      public boolean isIsoDates() {
        return true;
      }

      @Override
      public ZoneId getTimeZone() {
        return null;
      }

      @Override
      public String getIntervalStyle() {
        return "iso_8601";
      }
    };
    assertEquals("P1Y2M", text(DateTimeConverters.INTERVAL_TEXT, iso8601, "P1Y2M"));
  }

  @Test
  public void intervalBinary() throws Exception {
    byte[] bytes = new byte[16];
    ByteConverter.int8(bytes, 0, 1500000);
    ByteConverter.int4(bytes, 8, 2);
    ByteConverter.int4(bytes, 12, -1);
    assertEquals(new PGInterval(-1, 2, 1500000), DateTimeConverters.INTERVAL_BINARY.decode(ISO, bytes, 0, 16));
  }

  @Test
  public void wireHelpers() {
    assertEquals(1, DateTimeConverters.toPgDays(LocalDate.of(2000, 1, 2)));
    assertEquals(DateTimeConverters.USECS_PER_SEC,
        DateTimeConverters.toPgMicros(Instant.parse("2000-01-01T00:00:01Z")));
    assertEquals(-DateTimeConverters.USECS_PER_DAY,
        DateTimeConverters.toPgMicros(LocalDateTime.of(1999, 12, 31, 0, 0)));
    assertTrue(DateTimeConverters.isTimeTzOffsetSupported(ZoneOffset.ofHours(15)));
    assertFalse(DateTimeConverters.isTimeTzOffsetSupported(ZoneOffset.ofHours(-18)));
  }

  private static void assertDataError(TypeConverter converter, String value) {
    try {
      text(converter, ISO, value);
      fail("'" + value + "' must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
