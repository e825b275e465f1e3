/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.range.PGMultirange;
import org.pgcore.range.PGRange;
import org.pgcore.range.RangeFactory;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.util.ArrayList;
import java.util.List;

/**
 * Multirange converters. Text form is <code>{range,range}</code>, binary form is a range count
 * followed by length prefixed binary ranges.
 */
public final class MultirangeConverters {

  private MultirangeConverters() {
  }

  public static TypeConverter text(final int multirangeOid, final TypeConverter element,
      final RangeFactory factory) {
    return (ctx, buf, off, len) -> {
      TextCursor cursor = new TextCursor("multirange", buf, off, len);
      cursor.expect('{');
      List<PGRange<?>> ranges = new ArrayList<PGRange<?>>();
      if (cursor.peek() == '}') {
        cursor.pos++;
      } else {
        while (true) {
          cursor.skipWhitespace();
          ranges.add(RangeConverters.parseText(ctx, cursor, element, factory));
          cursor.skipWhitespace();
          int c = cursor.peek();
          cursor.pos++;
          if (c == '}') {
            break;
          }
          if (c != ',') {
            throw cursor.error("expected ',' or '}'");
          }
        }
      }
      if (!cursor.atEnd()) {
        throw cursor.error("trailing data");
      }
      return new PGMultirange<PGRange<?>>(multirangeOid, ranges);
    };
  }

  public static TypeConverter binary(final int multirangeOid, final TypeConverter element,
      final RangeFactory factory) {
    return (ctx, buf, off, len) -> {
      if (len < 4) {
        throw invalid("missing range count");
      }
      long count = ByteConverter.uint4(buf, off);
      int pos = off + 4;
      int end = off + len;
      List<PGRange<?>> ranges = new ArrayList<PGRange<?>>();
      for (long i = 0; i < count; i++) {
        if (end - pos < 4) {
          throw invalid("range truncated");
        }
        int rangeLen = ByteConverter.int4(buf, pos);
        pos += 4;
        if (rangeLen < 0 || rangeLen > end - pos) {
          throw invalid(GT.tr("range length {0}", rangeLen));
        }
        ranges.add(RangeConverters.decodeBinary(ctx, buf, pos, rangeLen, element, factory));
        pos += rangeLen;
      }
      if (pos != end) {
        throw invalid("trailing data");
      }
      return new PGMultirange<PGRange<?>>(multirangeOid, ranges);
    };
  }

  private static PSQLException invalid(String detail) {
    return new PSQLException(GT.tr("Invalid multirange value: {0}", detail), PSQLState.DATA_ERROR);
  }
}
