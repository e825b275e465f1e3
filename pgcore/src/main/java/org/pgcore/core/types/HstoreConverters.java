/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.pgcore.core.types.ConverterSupport.utf8;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converters for the hstore extension type. The type has no fixed OID, so these are registered
 * per connection once the OID has been looked up.
 */
public final class HstoreConverters {

  public static final TypeConverter TEXT = (ctx, buf, off, len) -> {
    TextCursor cursor = new TextCursor("hstore", buf, off, len);
    Map<String, String> map = new LinkedHashMap<String, String>();
    cursor.skipWhitespace();
    while (!cursor.atEnd()) {
      byte[] key = cursor.readQuoted(false);
      cursor.skipWhitespace();
      cursor.expect('=');
      cursor.expect('>');
      cursor.skipWhitespace();
      String value;
      if (cursor.peek() == '"') {
        byte[] raw = cursor.readQuoted(false);
        value = utf8(raw, 0, raw.length);
      } else {
        int start = cursor.pos;
        while (!cursor.atEnd() && cursor.buf[cursor.pos] != ',') {
          cursor.pos++;
        }
        String bare = utf8(cursor.buf, start, cursor.pos - start).trim();
        if (!"NULL".equals(bare)) {
          throw cursor.error("expected quoted value or NULL");
        }
        value = null;
      }
      map.put(utf8(key, 0, key.length), value);
      cursor.skipWhitespace();
      if (!cursor.atEnd()) {
        cursor.expect(',');
        cursor.skipWhitespace();
      }
    }
    return map;
  };

  public static final TypeConverter BINARY = (ctx, buf, off, len) -> {
    if (len < 4) {
      throw invalid("missing pair count");
    }
    int count = ByteConverter.int4(buf, off);
    if (count < 0) {
      throw invalid(GT.tr("pair count {0}", count));
    }
    int[] cursor = {off + 4};
    int end = off + len;
    Map<String, String> map = new LinkedHashMap<String, String>();
    for (int i = 0; i < count; i++) {
      String key = readString(buf, cursor, end);
      if (key == null) {
        throw invalid("null key");
      }
      map.put(key, readString(buf, cursor, end));
    }
    if (cursor[0] != end) {
      throw invalid("trailing data");
    }
    return map;
  };

  public static final ConverterPair PAIR = new ConverterPair(TEXT, BINARY);

  private HstoreConverters() {
  }

  private static String readString(byte[] buf, int[] cursor, int end) throws PSQLException {
    if (end - cursor[0] < 4) {
      throw invalid("entry truncated");
    }
    int length = ByteConverter.int4(buf, cursor[0]);
    cursor[0] += 4;
    if (length == -1) {
      return null;
    }
    if (length < 0 || length > end - cursor[0]) {
      throw invalid(GT.tr("entry length {0}", length));
    }
    String value = utf8(buf, cursor[0], length);
    cursor[0] += length;
    return value;
  }

  private static PSQLException invalid(String detail) {
    return new PSQLException(GT.tr("Invalid hstore value: {0}", detail), PSQLState.DATA_ERROR);
  }
}
