/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.pgcore.core.types.ConverterSupport.checkLength;
import static org.pgcore.core.types.ConverterSupport.checkMinLength;
import static org.pgcore.core.types.ConverterSupport.invalid;
import static org.pgcore.core.types.ConverterSupport.utf8;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PGobject;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Converters for character, binary string, uuid and json types.
 */
public final class TextConverters {

  private TextConverters() {
  }

  /**
   * Used for text in both formats, the binary form of text is its UTF-8 bytes.
   */
  public static final TypeConverter TEXT = (ctx, buf, off, len) -> utf8(buf, off, len);

  public static final TypeConverter BYTES = (ctx, buf, off, len) -> Arrays.copyOfRange(buf, off, off + len);

  public static final TypeConverter BYTEA_TEXT = (ctx, buf, off, len) -> decodeBytea(buf, off, len);

  public static final TypeConverter UUID_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    try {
      return UUID.fromString(text);
    } catch (IllegalArgumentException e) {
      throw invalid("uuid", text, e);
    }
  };

  public static final TypeConverter UUID_BINARY = (ctx, buf, off, len) -> {
    checkLength("uuid", len, 16);
    return new UUID(ByteConverter.int8(buf, off), ByteConverter.int8(buf, off + 8));
  };

  public static final TypeConverter JSON = (ctx, buf, off, len) -> new PGobject("json", utf8(buf, off, len));

  public static final TypeConverter JSONB_TEXT = (ctx, buf, off, len) -> new PGobject("jsonb", utf8(buf, off, len));

  public static final TypeConverter JSONB_BINARY = (ctx, buf, off, len) -> {
    checkMinLength("jsonb", len, 1);
    if (buf[off] != 1) {
      throw new PSQLException(GT.tr("Unsupported jsonb version number {0}", buf[off]), PSQLState.DATA_ERROR);
    }
    return new PGobject("jsonb", utf8(buf, off + 1, len - 1));
  };

  /**
   * int2vector in text form: space separated integers.
   */
  public static final TypeConverter INT2VECTOR_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    List<Integer> values = new ArrayList<Integer>();
    try {
      for (String part : splitVector(text)) {
        values.add(Integer.valueOf(part));
      }
    } catch (NumberFormatException e) {
      throw invalid("int2vector", text, e);
    }
    return values;
  };

  /**
   * oidvector in text form: space separated unsigned integers.
   */
  public static final TypeConverter OIDVECTOR_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    List<Long> values = new ArrayList<Long>();
    try {
      for (String part : splitVector(text)) {
        values.add(Long.valueOf(part));
      }
    } catch (NumberFormatException e) {
      throw invalid("oidvector", text, e);
    }
    return values;
  };

  private static String[] splitVector(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? new String[0] : trimmed.split(" +");
  }

  /**
   * Decodes the text form of bytea, either hex ({@code \x} followed by hex digit pairs) or the
   * escape format, where {@code \\} is a backslash and a backslash followed by three octal digits
   * is one byte.
   *
   * @param buf source array
   * @param off first byte
   * @param len number of bytes
   * @return the decoded bytes
   * @throws PSQLException on an invalid escape or hex digit
   */
  public static byte[] decodeBytea(byte[] buf, int off, int len) throws PSQLException {
    if (len >= 2 && buf[off] == '\\' && buf[off + 1] == 'x') {
      return decodeHex(buf, off + 2, len - 2);
    }
    byte[] out = new byte[len];
    int count = 0;
    int end = off + len;
    int i = off;
    while (i < end) {
      byte b = buf[i];
      if (b != '\\') {
        out[count++] = b;
        i++;
        continue;
      }
      if (i + 1 < end && buf[i + 1] == '\\') {
        out[count++] = '\\';
        i += 2;
        continue;
      }
      if (i + 3 < end && isOctal(buf[i + 1], '3') && isOctal(buf[i + 2], '7') && isOctal(buf[i + 3], '7')) {
        out[count++] = (byte) (((buf[i + 1] - '0') << 6) | ((buf[i + 2] - '0') << 3) | (buf[i + 3] - '0'));
        i += 4;
        continue;
      }
      throw invalid("bytea", utf8(buf, off, len));
    }
    return count == len ? out : Arrays.copyOf(out, count);
  }

  private static boolean isOctal(byte b, char max) {
    return b >= '0' && b <= max;
  }

  private static byte[] decodeHex(byte[] buf, int off, int len) throws PSQLException {
    if ((len & 1) != 0) {
      throw invalid("bytea", "odd number of hex digits");
    }
    byte[] out = new byte[len / 2];
    for (int i = 0; i < out.length; i++) {
      int hi = Character.digit(buf[off + 2 * i], 16);
      int lo = Character.digit(buf[off + 2 * i + 1], 16);
      if (hi < 0 || lo < 0) {
        throw invalid("bytea", utf8(buf, off, len));
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return out;
  }
}
