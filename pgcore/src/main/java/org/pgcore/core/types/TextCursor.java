/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.io.ByteArrayOutputStream;

/**
 * Cursor over the text form of a composite value (array, range, multirange, hstore).
 * Structural characters are all ASCII, so scanning works on the UTF-8 bytes directly.
 */
final class TextCursor {
  final byte[] buf;
  final int end;
  int pos;
  private final String typeName;

  TextCursor(String typeName, byte[] buf, int offset, int length) {
    this.typeName = typeName;
    this.buf = buf;
    this.pos = offset;
    this.end = offset + length;
  }

  boolean atEnd() {
    return pos >= end;
  }

  /**
   * @return the current byte
   * @throws PSQLException at the end of input
   */
  int peek() throws PSQLException {
    if (pos >= end) {
      throw error("unexpected end of input");
    }
    return buf[pos];
  }

  void expect(char c) throws PSQLException {
    if (peek() != c) {
      throw error("expected '" + c + "'");
    }
    pos++;
  }

  void skipWhitespace() {
    while (pos < end && (buf[pos] == ' ' || buf[pos] == '\t' || buf[pos] == '\n' || buf[pos] == '\r')) {
      pos++;
    }
  }

  /**
   * Reads a double quoted string starting at the opening quote. A backslash escapes the next
   * byte; with {@code doubledQuotes} a pair of quotes also stands for one quote.
   *
   * @param doubledQuotes whether {@code ""} inside the string is an escaped quote
   * @return the unescaped content
   * @throws PSQLException if the closing quote is missing
   */
  byte[] readQuoted(boolean doubledQuotes) throws PSQLException {
    expect('"');
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    while (pos < end) {
      byte b = buf[pos++];
      if (b == '\\') {
        if (pos >= end) {
          break;
        }
        out.write(buf[pos++]);
      } else if (b == '"') {
        if (doubledQuotes && pos < end && buf[pos] == '"') {
          out.write('"');
          pos++;
        } else {
          return out.toByteArray();
        }
      } else {
        out.write(b);
      }
    }
    throw error("unterminated quoted string");
  }

  /**
   * Advances to the first of the given terminators without consuming it.
   *
   * @param terminators bytes that end the token
   * @return start of the token
   * @throws PSQLException if no terminator follows
   */
  int scanUntil(String terminators) throws PSQLException {
    int start = pos;
    while (pos < end) {
      if (terminators.indexOf(buf[pos]) >= 0) {
        return start;
      }
      pos++;
    }
    throw error("unterminated element");
  }

  PSQLException error(String detail) {
    return new PSQLException(GT.tr("Invalid {0} value: {1} at offset {2}", typeName, detail, pos),
        PSQLState.DATA_ERROR);
  }
}
