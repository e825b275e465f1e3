/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.core.Oid;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Array converters, generic over the converter of the element type. Arrays decode to
 * {@link List}s; each extra dimension is a further level of nested lists. SQL NULL elements
 * are null list entries.
 */
public final class ArrayConverters {

  public static final int MAX_DIMENSIONS = 6;

  private ArrayConverters() {
  }

  /**
   * @param element converter for the text form of one element
   * @param delimiter element delimiter, a comma for all types but box
   * @return a converter for the text form of the array
   */
  public static TypeConverter text(final TypeConverter element, final char delimiter) {
    return (ctx, buf, off, len) -> {
      TextCursor cursor = new TextCursor("array", buf, off, len);
      // skip an optional dimension decoration such as [0:1]=
      while (!cursor.atEnd() && cursor.peek() != '{') {
        cursor.pos++;
      }
      if (cursor.atEnd()) {
        throw cursor.error("missing '{'");
      }
      List<Object> values = parseText(ctx, cursor, element, delimiter, 1);
      if (!cursor.atEnd()) {
        throw cursor.error("trailing data");
      }
      return values;
    };
  }

  private static List<Object> parseText(DecodeContext ctx, TextCursor cursor, TypeConverter element,
      char delimiter, int depth) throws SQLException {
    if (depth > MAX_DIMENSIONS) {
      throw cursor.error("too many dimensions");
    }
    cursor.expect('{');
    List<Object> values = new ArrayList<Object>();
    while (true) {
      int c = cursor.peek();
      if (c == '{') {
        values.add(parseText(ctx, cursor, element, delimiter, depth + 1));
      } else if (c == '"') {
        byte[] text = cursor.readQuoted(true);
        values.add(element.decode(ctx, text, 0, text.length));
      } else if (c != '}') {
        int start = cursor.scanUntil(delimiter + "}");
        int length = cursor.pos - start;
        if (length == 4 && cursor.buf[start] == 'N' && cursor.buf[start + 1] == 'U'
            && cursor.buf[start + 2] == 'L' && cursor.buf[start + 3] == 'L') {
          values.add(null);
        } else {
          values.add(element.decode(ctx, cursor.buf, start, length));
        }
      }
      c = cursor.peek();
      cursor.pos++;
      if (c == '}') {
        return values;
      }
      if (c != delimiter) {
        throw cursor.error("expected delimiter");
      }
    }
  }

  /**
   * @param elementOid element type OID the array header must carry
   * @param element converter for the binary form of one element
   * @return a converter for the binary form of the array
   */
  public static TypeConverter binary(final int elementOid, final TypeConverter element) {
    return (ctx, buf, off, len) -> {
      if (len < 12) {
        throw invalid("header too short");
      }
      int ndims = ByteConverter.int4(buf, off);
      int flags = ByteConverter.int4(buf, off + 4);
      int itemOid = ByteConverter.int4(buf, off + 8);
      if (ndims < 0 || ndims > MAX_DIMENSIONS) {
        throw invalid(GT.tr("{0} dimensions", ndims));
      }
      if ((flags & 1) != flags) {
        throw invalid(GT.tr("flags {0}", flags));
      }
      if (itemOid != elementOid) {
        throw invalid(GT.tr("element type {0}, expected {1}", Oid.toString(itemOid), Oid.toString(elementOid)));
      }
      if (len < 12 + 8 * ndims) {
        throw invalid("dimensions truncated");
      }
      if (ndims == 0) {
        return new ArrayList<Object>();
      }
      int[] dims = new int[ndims];
      int pos = off + 12;
      for (int i = 0; i < ndims; i++) {
        dims[i] = ByteConverter.int4(buf, pos);
        if (dims[i] <= 0) {
          throw invalid(GT.tr("dimension size {0}", dims[i]));
        }
        // lower bound is not represented in the result
        pos += 8;
      }
      int[] cursor = {pos};
      List<Object> values = readBinary(ctx, buf, cursor, off + len, dims, 0, element);
      if (cursor[0] != off + len) {
        throw invalid("trailing data");
      }
      return values;
    };
  }

  private static List<Object> readBinary(DecodeContext ctx, byte[] buf, int[] cursor, int end, int[] dims,
      int dim, TypeConverter element) throws SQLException {
    List<Object> values = new ArrayList<Object>(Math.min(dims[dim], 1024));
    for (int i = 0; i < dims[dim]; i++) {
      if (dim + 1 < dims.length) {
        values.add(readBinary(ctx, buf, cursor, end, dims, dim + 1, element));
        continue;
      }
      if (end - cursor[0] < 4) {
        throw invalid("element truncated");
      }
      int itemLen = ByteConverter.int4(buf, cursor[0]);
      cursor[0] += 4;
      if (itemLen == -1) {
        values.add(null);
        continue;
      }
      if (itemLen < 0 || itemLen > end - cursor[0]) {
        throw invalid(GT.tr("element length {0}", itemLen));
      }
      values.add(element.decode(ctx, buf, cursor[0], itemLen));
      cursor[0] += itemLen;
    }
    return values;
  }

  private static PSQLException invalid(String detail) {
    return new PSQLException(GT.tr("Invalid array value: {0}", detail), PSQLState.DATA_ERROR);
  }
}
