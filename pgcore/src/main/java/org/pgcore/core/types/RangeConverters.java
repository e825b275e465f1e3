/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.range.PGRange;
import org.pgcore.range.RangeFactory;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.sql.SQLException;

/**
 * Range converters, generic over the converter of the element type.
 */
public final class RangeConverters {

  static final int RANGE_EMPTY = 0x01;
  static final int RANGE_LB_INC = 0x02;
  static final int RANGE_UB_INC = 0x04;
  static final int RANGE_LB_INF = 0x08;
  static final int RANGE_UB_INF = 0x10;

  private RangeConverters() {
  }

  public static TypeConverter text(final TypeConverter element, final RangeFactory factory) {
    return (ctx, buf, off, len) -> {
      TextCursor cursor = new TextCursor("range", buf, off, len);
      PGRange<?> range = parseText(ctx, cursor, element, factory);
      if (!cursor.atEnd()) {
        throw cursor.error("trailing data");
      }
      return range;
    };
  }

  /**
   * Parses {@code empty} or {@code [lower,upper)} style text at the cursor, leaving the cursor
   * behind the closing bracket. Bounds are quoted or bare; a missing bound is unbounded.
   */
  static PGRange<?> parseText(DecodeContext ctx, TextCursor cursor, TypeConverter element,
      RangeFactory factory) throws SQLException {
    int first = cursor.peek();
    if (first == 'e') {
      int start = cursor.pos;
      if (cursor.end - start < 5 || cursor.buf[start + 1] != 'm' || cursor.buf[start + 2] != 'p'
          || cursor.buf[start + 3] != 't' || cursor.buf[start + 4] != 'y') {
        throw cursor.error("expected 'empty'");
      }
      cursor.pos += 5;
      return factory.create(null, null, null);
    }
    if (first != '[' && first != '(') {
      throw cursor.error("expected '[' or '('");
    }
    cursor.pos++;
    Object lower = null;
    if (cursor.peek() != ',') {
      lower = readBound(ctx, cursor, element, ",");
    }
    cursor.expect(',');
    Object upper = null;
    int c = cursor.peek();
    if (c != ']' && c != ')') {
      upper = readBound(ctx, cursor, element, "])");
    }
    int last = cursor.peek();
    if (last != ']' && last != ')') {
      throw cursor.error("expected ']' or ')'");
    }
    cursor.pos++;
    String bounds = new String(new char[] {(char) first, (char) last});
    return factory.create(lower, upper, bounds);
  }

  private static Object readBound(DecodeContext ctx, TextCursor cursor, TypeConverter element,
      String terminators) throws SQLException {
    if (cursor.peek() == '"') {
      byte[] text = cursor.readQuoted(true);
      return element.decode(ctx, text, 0, text.length);
    }
    int start = cursor.scanUntil(terminators);
    return element.decode(ctx, cursor.buf, start, cursor.pos - start);
  }

  public static TypeConverter binary(final TypeConverter element, final RangeFactory factory) {
    return (ctx, buf, off, len) -> decodeBinary(ctx, buf, off, len, element, factory);
  }

  /**
   * Binary form: one flag byte, then length prefixed lower and upper bounds for the bounds that
   * are finite.
   */
  static PGRange<?> decodeBinary(DecodeContext ctx, byte[] buf, int off, int len, TypeConverter element,
      RangeFactory factory) throws SQLException {
    if (len < 1) {
      throw invalid("missing flags");
    }
    int flags = buf[off] & 0xFF;
    int pos = off + 1;
    int end = off + len;
    if ((flags & RANGE_EMPTY) != 0) {
      if (len != 1) {
        throw invalid("data after empty range");
      }
      return factory.create(null, null, null);
    }
    Object lower = null;
    if ((flags & RANGE_LB_INF) == 0) {
      int[] cursor = {pos};
      lower = readBinaryBound(ctx, buf, cursor, end, element);
      pos = cursor[0];
    }
    Object upper = null;
    if ((flags & RANGE_UB_INF) == 0) {
      int[] cursor = {pos};
      upper = readBinaryBound(ctx, buf, cursor, end, element);
      pos = cursor[0];
    }
    if (pos != end) {
      throw invalid("trailing data");
    }
    String bounds = ((flags & RANGE_LB_INC) != 0 ? "[" : "(") + ((flags & RANGE_UB_INC) != 0 ? "]" : ")");
    return factory.create(lower, upper, bounds);
  }

  private static Object readBinaryBound(DecodeContext ctx, byte[] buf, int[] cursor, int end,
      TypeConverter element) throws SQLException {
    if (end - cursor[0] < 4) {
      throw invalid("bound truncated");
    }
    int boundLen = ByteConverter.int4(buf, cursor[0]);
    cursor[0] += 4;
    if (boundLen < 0 || boundLen > end - cursor[0]) {
      throw invalid(GT.tr("bound length {0}", boundLen));
    }
    Object value = element.decode(ctx, buf, cursor[0], boundLen);
    cursor[0] += boundLen;
    return value;
  }

  private static PSQLException invalid(String detail) {
    return new PSQLException(GT.tr("Invalid range value: {0}", detail), PSQLState.DATA_ERROR);
  }
}
