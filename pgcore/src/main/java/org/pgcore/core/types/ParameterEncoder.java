/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.core.Format;
import org.pgcore.core.Oid;
import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.PGArray;
import org.pgcore.util.PGInterval;
import org.pgcore.util.SqlTextValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Turns native parameter values into {@link ParameterInfo}s. The value's kind is resolved once
 * by {@link Kind#of(Object)}; values without a dedicated encoding are sent as text through
 * {@link SqlTextValue} or {@code toString()}.
 */
public final class ParameterEncoder {

  private static Log LOGGER = Logger.getLogger(ParameterEncoder.class.getName());

  /**
   * The native parameter types with a dedicated encoding.
   */
  public enum Kind {
    NULL,
    STRING,
    BOOLEAN,
    INTEGER,
    LONG,
    BIG_INTEGER,
    FLOATING,
    DECIMAL,
    DATE,
    TIME,
    TIMETZ,
    TIMESTAMP,
    TIMESTAMPTZ,
    DURATION,
    INTERVAL,
    UUID,
    BYTES,
    INET_ADDRESS,
    LIST,
    OBJECT_ARRAY,
    SQL_TEXT,
    OTHER;

    public static Kind of(Object value) {
      if (value == null) {
        return NULL;
      }
      if (value instanceof String) {
        return STRING;
      }
      if (value instanceof Boolean) {
        return BOOLEAN;
      }
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return INTEGER;
      }
      if (value instanceof Long) {
        return LONG;
      }
      if (value instanceof BigInteger) {
        return BIG_INTEGER;
      }
      if (value instanceof Double || value instanceof Float) {
        return FLOATING;
      }
      if (value instanceof BigDecimal) {
        return DECIMAL;
      }
      if (value instanceof LocalDate) {
        return DATE;
      }
      if (value instanceof LocalTime) {
        return TIME;
      }
      if (value instanceof OffsetTime) {
        return TIMETZ;
      }
      if (value instanceof LocalDateTime) {
        return TIMESTAMP;
      }
      if (value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof Instant) {
        return TIMESTAMPTZ;
      }
      if (value instanceof Duration) {
        return DURATION;
      }
      if (value instanceof PGInterval) {
        return INTERVAL;
      }
      if (value instanceof UUID) {
        return UUID;
      }
      if (value instanceof byte[]) {
        return BYTES;
      }
      if (value instanceof InetAddress) {
        return INET_ADDRESS;
      }
      if (value instanceof List) {
        return LIST;
      }
      if (value instanceof Object[]) {
        return OBJECT_ARRAY;
      }
      if (value instanceof SqlTextValue) {
        return SQL_TEXT;
      }
      return OTHER;
    }
  }

  private ParameterEncoder() {
  }

  public static ParameterInfo[] encodeAll(Object[] values) {
    if (values == null) {
      return new ParameterInfo[0];
    }
    ParameterInfo[] params = new ParameterInfo[values.length];
    for (int i = 0; i < values.length; i++) {
      params[i] = encode(values[i]);
    }
    return params;
  }

  /**
   * @param params encoded parameters
   * @return the OIDs in parameter order, the type part of a statement cache key
   */
  public static int[] typeOids(ParameterInfo[] params) {
    int[] oids = new int[params.length];
    for (int i = 0; i < params.length; i++) {
      oids[i] = params[i].getOid();
    }
    return oids;
  }

  public static ParameterInfo encode(Object value) {
    switch (Kind.of(value)) {
      case NULL:
        return new ParameterInfo(Oid.UNSPECIFIED, Format.TEXT, null);
      case STRING:
        // unspecified lets the server infer the type from context, as with a literal
        return text(Oid.UNSPECIFIED, (String) value);
      case BOOLEAN:
        return new ParameterInfo(Oid.BOOL, Format.BINARY, new byte[] {(byte) (((Boolean) value) ? 1 : 0)});
      case INTEGER:
        return int4(((Number) value).intValue());
      case LONG:
        return encodeLong((Long) value);
      case BIG_INTEGER:
        return encodeBigInteger((BigInteger) value);
      case FLOATING: {
        byte[] bytes = new byte[8];
        ByteConverter.float8(bytes, 0, ((Number) value).doubleValue());
        return new ParameterInfo(Oid.FLOAT8, Format.BINARY, bytes);
      }
      case DECIMAL: {
        BigDecimal decimal = (BigDecimal) value;
        byte[] bytes = NumericCodec.encode(decimal);
        if (bytes == null) {
          LOGGER.debug("numeric parameter out of binary range, sending as text");
          return text(Oid.NUMERIC, decimal.toString());
        }
        return new ParameterInfo(Oid.NUMERIC, Format.BINARY, bytes);
      }
      case DATE:
        return encodeDate((LocalDate) value);
      case TIME: {
        byte[] bytes = new byte[8];
        ByteConverter.int8(bytes, 0, DateTimeConverters.toPgMicros((LocalTime) value));
        return new ParameterInfo(Oid.TIME, Format.BINARY, bytes);
      }
      case TIMETZ:
        return encodeTimeTz((OffsetTime) value);
      case TIMESTAMP:
        return encodeTimestamp((LocalDateTime) value);
      case TIMESTAMPTZ:
        return encodeTimestampTz(value);
      case DURATION:
        return encodeDuration((Duration) value);
      case INTERVAL:
        return interval((PGInterval) value);
      case UUID: {
        UUID uuid = (UUID) value;
        byte[] bytes = new byte[16];
        ByteConverter.int8(bytes, 0, uuid.getMostSignificantBits());
        ByteConverter.int8(bytes, 8, uuid.getLeastSignificantBits());
        return new ParameterInfo(Oid.UUID, Format.BINARY, bytes);
      }
      case BYTES:
        return new ParameterInfo(Oid.BYTEA, Format.BINARY, (byte[]) value);
      case INET_ADDRESS:
        return text(Oid.INET, hostAddress((InetAddress) value));
      case LIST:
        return text(Oid.UNSPECIFIED, PGArray.toLiteral((List<?>) value));
      case OBJECT_ARRAY:
        return text(Oid.UNSPECIFIED, PGArray.toLiteral(Arrays.asList((Object[]) value)));
      case SQL_TEXT: {
        SqlTextValue sqlValue = (SqlTextValue) value;
        return text(sqlValue.getSqlOid(), sqlValue.toSqlText());
      }
      default:
        return text(Oid.UNSPECIFIED, value.toString());
    }
  }

  private static ParameterInfo text(int oid, String value) {
    return new ParameterInfo(oid, Format.TEXT, value.getBytes(StandardCharsets.UTF_8));
  }

  private static ParameterInfo int4(int value) {
    byte[] bytes = new byte[4];
    ByteConverter.int4(bytes, 0, value);
    return new ParameterInfo(Oid.INT4, Format.BINARY, bytes);
  }

  private static ParameterInfo int8(long value) {
    byte[] bytes = new byte[8];
    ByteConverter.int8(bytes, 0, value);
    return new ParameterInfo(Oid.INT8, Format.BINARY, bytes);
  }

  private static ParameterInfo encodeLong(long value) {
    if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      return int4((int) value);
    }
    return int8(value);
  }

  private static ParameterInfo encodeBigInteger(BigInteger value) {
    if (value.bitLength() < 64) {
      return encodeLong(value.longValue());
    }
    return text(Oid.UNSPECIFIED, value.toString());
  }

  private static ParameterInfo encodeDate(LocalDate date) {
    try {
      byte[] bytes = new byte[4];
      ByteConverter.int4(bytes, 0, DateTimeConverters.toPgDays(date));
      return new ParameterInfo(Oid.DATE, Format.BINARY, bytes);
    } catch (ArithmeticException e) {
      return text(Oid.DATE, date.toString());
    }
  }

  private static ParameterInfo encodeTimeTz(OffsetTime time) {
    if (!DateTimeConverters.isTimeTzOffsetSupported(time.getOffset())) {
      return text(Oid.TIMETZ, time.toString());
    }
    byte[] bytes = new byte[12];
    ByteConverter.int8(bytes, 0, DateTimeConverters.toPgMicros(time.toLocalTime()));
    // the server counts the zone offset in seconds west of UTC
    ByteConverter.int4(bytes, 8, -time.getOffset().getTotalSeconds());
    return new ParameterInfo(Oid.TIMETZ, Format.BINARY, bytes);
  }

  private static ParameterInfo encodeTimestamp(LocalDateTime value) {
    try {
      byte[] bytes = new byte[8];
      ByteConverter.int8(bytes, 0, DateTimeConverters.toPgMicros(value));
      return new ParameterInfo(Oid.TIMESTAMP, Format.BINARY, bytes);
    } catch (ArithmeticException e) {
      return text(Oid.TIMESTAMP, value.toString());
    }
  }

  private static ParameterInfo encodeTimestampTz(Object value) {
    Instant instant;
    if (value instanceof OffsetDateTime) {
      instant = ((OffsetDateTime) value).toInstant();
    } else if (value instanceof ZonedDateTime) {
      instant = ((ZonedDateTime) value).toInstant();
    } else {
      instant = (Instant) value;
    }
    try {
      byte[] bytes = new byte[8];
      ByteConverter.int8(bytes, 0, DateTimeConverters.toPgMicros(instant));
      return new ParameterInfo(Oid.TIMESTAMPTZ, Format.BINARY, bytes);
    } catch (ArithmeticException e) {
      return text(Oid.TIMESTAMPTZ, instant.toString());
    }
  }

  private static ParameterInfo encodeDuration(Duration duration) {
    try {
      return interval(PGInterval.of(duration));
    } catch (ArithmeticException e) {
      // the server reads ISO 8601 durations as interval input
      return text(Oid.INTERVAL, duration.toString());
    }
  }

  private static ParameterInfo interval(PGInterval interval) {
    byte[] bytes = new byte[16];
    ByteConverter.int8(bytes, 0, interval.getMicroseconds());
    ByteConverter.int4(bytes, 8, interval.getDays());
    ByteConverter.int4(bytes, 12, interval.getMonths());
    return new ParameterInfo(Oid.INTERVAL, Format.BINARY, bytes);
  }

  private static String hostAddress(InetAddress address) {
    String text = address.getHostAddress();
    if (address instanceof Inet6Address) {
      int scope = text.indexOf('%');
      if (scope >= 0) {
        text = text.substring(0, scope);
      }
    }
    return text;
  }
}
