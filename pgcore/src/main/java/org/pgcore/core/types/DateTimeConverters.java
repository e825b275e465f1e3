/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.pgcore.core.types.ConverterSupport.checkLength;
import static org.pgcore.core.types.ConverterSupport.invalid;
import static org.pgcore.core.types.ConverterSupport.utf8;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.PGInterval;
import org.pgcore.util.PSQLException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converters for date, time, timetz, timestamp, timestamptz and interval.
 *
 * <p>Binary values count from 2000-01-01 00:00:00: days for date, microseconds for the
 * timestamps. The largest and smallest values stand for {@code infinity} and {@code -infinity}
 * and decode to those strings. Values outside years 1 to 9999 also decode to the server's ISO
 * text, with a {@code BC} suffix where needed, so they survive a round trip as text.</p>
 */
public final class DateTimeConverters {

  public static final long USECS_PER_SEC = 1000000L;
  public static final long USECS_PER_MINUTE = 60 * USECS_PER_SEC;
  public static final long USECS_PER_HOUR = 60 * USECS_PER_MINUTE;
  public static final long USECS_PER_DAY = 24 * USECS_PER_HOUR;

  /**
   * Stands for the server time {@code 24:00:00}. It is one nanosecond short of midnight, which
   * no server time can be as those only carry microseconds, and encodes back to
   * {@code 24:00:00}.
   */
  public static final LocalTime HOUR24 = LocalTime.MAX;

  static final LocalDate PG_EPOCH_DATE = LocalDate.of(2000, 1, 1);
  static final long PG_EPOCH_DAY = PG_EPOCH_DATE.toEpochDay();
  static final long PG_EPOCH_SECONDS = PG_EPOCH_DAY * 86400L;

  private static final int MIN_YEAR = 1;
  private static final int MAX_YEAR = 9999;
  private static final int MAX_TZ_OFFSET_SECS = 16 * 60 * 60;

  private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern TIME = Pattern.compile("(\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?");
  private static final Pattern TIMETZ = Pattern.compile(
      "(\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?([-+])(\\d{2})(?::(\\d{2})(?::(\\d{2}))?)?");
  private static final Pattern TIMESTAMP = Pattern.compile(
      "(\\d{4})-(\\d{2})-(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?");
  private static final Pattern TIMESTAMPTZ = Pattern.compile(
      "(\\d{4})-(\\d{2})-(\\d{2}) (\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?"
          + "([-+])(\\d{2})(?::(\\d{2})(?::(\\d{2}))?)?");
  private static final Pattern INTERVAL_TIME = Pattern.compile("(\\d{2,}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,6}))?");

  private DateTimeConverters() {
  }

  // ---- date ----

  public static final TypeConverter DATE_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    if (!ctx.isIsoDates() || !DATE.matcher(text).matches()) {
      return text;
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeException e) {
      throw invalid("date", text, e);
    }
  };

  public static final TypeConverter DATE_BINARY = (ctx, buf, off, len) -> {
    checkLength("date", len, 4);
    int days = ByteConverter.int4(buf, off);
    if (days == Integer.MAX_VALUE) {
      return "infinity";
    }
    if (days == Integer.MIN_VALUE) {
      return "-infinity";
    }
    LocalDate date = PG_EPOCH_DATE.plusDays(days);
    if (inNativeRange(date)) {
      return date;
    }
    return formatDate(date) + bcSuffix(date);
  };

  // ---- time ----

  /**
   * Decodes the text form of {@code time}; {@code 24:00:00} decodes to {@link #HOUR24}.
   */
  public static final TypeConverter TIME_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    Matcher m = TIME.matcher(text);
    if (!m.matches()) {
      throw invalid("time", text);
    }
    try {
      return localTime(m, 1, 2, 3, 4);
    } catch (DateTimeException e) {
      throw invalid("time", text, e);
    }
  };

  public static final TypeConverter TIME_BINARY = (ctx, buf, off, len) -> {
    checkLength("time", len, 8);
    return timeFromMicros(ByteConverter.int8(buf, off));
  };

  public static final TypeConverter TIMETZ_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    Matcher m = TIMETZ.matcher(text);
    if (!m.matches()) {
      throw invalid("timetz", text);
    }
    try {
      return OffsetTime.of(localTime(m, 1, 2, 3, 4), offset(m, 5));
    } catch (DateTimeException e) {
      throw invalid("timetz", text, e);
    }
  };

  public static final TypeConverter TIMETZ_BINARY = (ctx, buf, off, len) -> {
    checkLength("timetz", len, 12);
    LocalTime time = timeFromMicros(ByteConverter.int8(buf, off));
    // the wire carries seconds west of UTC
    int zoneSeconds = ByteConverter.int4(buf, off + 8);
    try {
      return OffsetTime.of(time, ZoneOffset.ofTotalSeconds(-zoneSeconds));
    } catch (DateTimeException e) {
      throw invalid("timetz", zoneSeconds, e);
    }
  };

  // ---- timestamp ----

  public static final TypeConverter TIMESTAMP_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    if (!ctx.isIsoDates()) {
      return text;
    }
    Matcher m = TIMESTAMP.matcher(text);
    if (!m.matches()) {
      return text;
    }
    try {
      return LocalDateTime.of(localDate(m), localTime(m, 4, 5, 6, 7));
    } catch (DateTimeException e) {
      return text;
    }
  };

  public static final TypeConverter TIMESTAMP_BINARY = (ctx, buf, off, len) -> {
    checkLength("timestamp", len, 8);
    long micros = ByteConverter.int8(buf, off);
    if (micros == Long.MAX_VALUE) {
      return "infinity";
    }
    if (micros == Long.MIN_VALUE) {
      return "-infinity";
    }
    LocalDateTime value = timestampFromMicros(micros);
    if (inNativeRange(value.toLocalDate())) {
      return value;
    }
    return formatTimestamp(value, "");
  };

  public static final TypeConverter TIMESTAMPTZ_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    if (!ctx.isIsoDates()) {
      return text;
    }
    Matcher m = TIMESTAMPTZ.matcher(text);
    if (!m.matches()) {
      return text;
    }
    try {
      OffsetDateTime value = OffsetDateTime.of(localDate(m), localTime(m, 4, 5, 6, 7), offset(m, 8));
      ZoneId zone = ctx.getTimeZone();
      return zone == null ? value : value.atZoneSameInstant(zone).toOffsetDateTime();
    } catch (DateTimeException e) {
      return text;
    }
  };

  public static final TypeConverter TIMESTAMPTZ_BINARY = (ctx, buf, off, len) -> {
    checkLength("timestamptz", len, 8);
    long micros = ByteConverter.int8(buf, off);
    if (micros == Long.MAX_VALUE) {
      return "infinity";
    }
    if (micros == Long.MIN_VALUE) {
      return "-infinity";
    }
    LocalDateTime utc = timestampFromMicros(micros);
    ZoneId zone = ctx.getTimeZone();
    if (zone != null) {
      try {
        OffsetDateTime zoned = utc.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone).toOffsetDateTime();
        if (inNativeRange(zoned.toLocalDate())) {
          return zoned;
        }
      } catch (DateTimeException e) {
        // keep the UTC value
      }
    }
    if (inNativeRange(utc.toLocalDate())) {
      return utc.atOffset(ZoneOffset.UTC);
    }
    return formatTimestamp(utc, "+00");
  };

  // ---- interval ----

  public static final TypeConverter INTERVAL_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    if (!"postgres".equals(ctx.getIntervalStyle())) {
      return text;
    }
    return parseInterval(text);
  };

  public static final TypeConverter INTERVAL_BINARY = (ctx, buf, off, len) -> {
    checkLength("interval", len, 16);
    long micros = ByteConverter.int8(buf, off);
    int days = ByteConverter.int4(buf, off + 8);
    int months = ByteConverter.int4(buf, off + 12);
    return new PGInterval(months, days, micros);
  };

  /**
   * Parses the {@code postgres} IntervalStyle output, such as
   * {@code 1 year 2 mons -3 days 04:05:06.5}.
   *
   * @param text the interval text
   * @return the interval
   * @throws PSQLException on malformed input
   */
  static PGInterval parseInterval(String text) throws PSQLException {
    String[] parts = text.trim().isEmpty() ? new String[0] : text.trim().split(" ");
    long micros = 0;
    int pairs = parts.length / 2;
    try {
      if (parts.length % 2 == 1) {
        String time = parts[parts.length - 1];
        int sign = 1;
        if (time.startsWith("-")) {
          sign = -1;
          time = time.substring(1);
        } else if (time.startsWith("+")) {
          time = time.substring(1);
        }
        Matcher m = INTERVAL_TIME.matcher(time);
        if (!m.matches()) {
          throw invalid("interval", text);
        }
        micros = Long.parseLong(m.group(1)) * USECS_PER_HOUR
            + Integer.parseInt(m.group(2)) * USECS_PER_MINUTE
            + Integer.parseInt(m.group(3)) * USECS_PER_SEC
            + fraction(m.group(4));
        micros *= sign;
      }
      int months = 0;
      int days = 0;
      for (int i = 0; i < pairs; i++) {
        int amount = Integer.parseInt(parts[2 * i]);
        String unit = parts[2 * i + 1].toLowerCase(Locale.ROOT);
        if (unit.startsWith("y")) {
          months = Math.addExact(months, Math.multiplyExact(amount, 12));
        } else if (unit.startsWith("mo")) {
          months = Math.addExact(months, amount);
        } else if (unit.startsWith("d")) {
          days = Math.addExact(days, amount);
        } else {
          throw invalid("interval", text);
        }
      }
      return new PGInterval(months, days, micros);
    } catch (NumberFormatException | ArithmeticException e) {
      throw invalid("interval", text, e);
    }
  }

  // ---- helpers, shared with parameter encoding ----

  public static int toPgDays(LocalDate date) {
    return Math.toIntExact(date.toEpochDay() - PG_EPOCH_DAY);
  }

  /**
   * @param time a time of day, {@link #HOUR24} for {@code 24:00:00}
   * @return microseconds since midnight
   */
  public static long toPgMicros(LocalTime time) {
    if (HOUR24.equals(time)) {
      return USECS_PER_DAY;
    }
    return time.toNanoOfDay() / 1000;
  }

  /**
   * @param value a local timestamp
   * @return microseconds since 2000-01-01 00:00:00
   * @throws ArithmeticException if the value does not fit 64 bits
   */
  public static long toPgMicros(LocalDateTime value) {
    long days = value.toLocalDate().toEpochDay() - PG_EPOCH_DAY;
    return Math.addExact(Math.multiplyExact(days, USECS_PER_DAY), value.toLocalTime().toNanoOfDay() / 1000);
  }

  public static long toPgMicros(Instant instant) {
    long seconds = instant.getEpochSecond() - PG_EPOCH_SECONDS;
    return Math.addExact(Math.multiplyExact(seconds, USECS_PER_SEC), instant.getNano() / 1000);
  }

  /**
   * @param offset a UTC offset
   * @return whether the server's timetz accepts it
   */
  public static boolean isTimeTzOffsetSupported(ZoneOffset offset) {
    return Math.abs(offset.getTotalSeconds()) < MAX_TZ_OFFSET_SECS;
  }

  static LocalTime timeFromMicros(long micros) throws PSQLException {
    if (micros < 0 || micros > USECS_PER_DAY) {
      throw invalid("time", micros);
    }
    if (micros == USECS_PER_DAY) {
      return HOUR24;
    }
    return LocalTime.ofNanoOfDay(micros * 1000);
  }

  static LocalDateTime timestampFromMicros(long micros) {
    long days = Math.floorDiv(micros, USECS_PER_DAY);
    long timeOfDay = Math.floorMod(micros, USECS_PER_DAY);
    return LocalDateTime.of(PG_EPOCH_DATE.plusDays(days), LocalTime.ofNanoOfDay(timeOfDay * 1000));
  }

  private static boolean inNativeRange(LocalDate date) {
    return date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR;
  }

  private static String bcSuffix(LocalDate date) {
    return date.getYear() < 1 ? " BC" : "";
  }

  private static String formatDate(LocalDate date) {
    // there is no year zero: year 0 is 1 BC
    int year = date.getYear() < 1 ? 1 - date.getYear() : date.getYear();
    return String.format(Locale.ROOT, "%04d-%02d-%02d", year, date.getMonthValue(), date.getDayOfMonth());
  }

  private static String formatTimestamp(LocalDateTime value, String zone) {
    StringBuilder sb = new StringBuilder(formatDate(value.toLocalDate()));
    LocalTime time = value.toLocalTime();
    sb.append(String.format(Locale.ROOT, " %02d:%02d:%02d", time.getHour(), time.getMinute(), time.getSecond()));
    int micros = time.getNano() / 1000;
    if (micros != 0) {
      String digits = String.format(Locale.ROOT, "%06d", micros);
      int end = digits.length();
      while (digits.charAt(end - 1) == '0') {
        end--;
      }
      sb.append('.').append(digits, 0, end);
    }
    return sb.append(zone).append(bcSuffix(value.toLocalDate())).toString();
  }

  private static LocalDate localDate(Matcher m) {
    return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
  }

  private static LocalTime localTime(Matcher m, int hourGroup, int minuteGroup, int secondGroup,
      int fractionGroup) {
    int hour = Integer.parseInt(m.group(hourGroup));
    if (hour == 24 && Integer.parseInt(m.group(minuteGroup)) == 0 && Integer.parseInt(m.group(secondGroup)) == 0
        && fraction(m.group(fractionGroup)) == 0) {
      return HOUR24;
    }
    return LocalTime.of(hour, Integer.parseInt(m.group(minuteGroup)), Integer.parseInt(m.group(secondGroup)),
        (int) fraction(m.group(fractionGroup)) * 1000);
  }

  private static long fraction(String digits) {
    if (digits == null) {
      return 0;
    }
    long value = Long.parseLong(digits);
    for (int i = digits.length(); i < 6; i++) {
      value *= 10;
    }
    return value;
  }

  private static ZoneOffset offset(Matcher m, int signGroup) {
    int seconds = Integer.parseInt(m.group(signGroup + 1)) * 3600;
    if (m.group(signGroup + 2) != null) {
      seconds += Integer.parseInt(m.group(signGroup + 2)) * 60;
    }
    if (m.group(signGroup + 3) != null) {
      seconds += Integer.parseInt(m.group(signGroup + 3));
    }
    return ZoneOffset.ofTotalSeconds("-".equals(m.group(signGroup)) ? -seconds : seconds);
  }
}
