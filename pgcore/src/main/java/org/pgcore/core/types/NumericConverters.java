/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.pgcore.core.types.ConverterSupport.checkLength;
import static org.pgcore.core.types.ConverterSupport.invalid;
import static org.pgcore.core.types.ConverterSupport.utf8;

import org.pgcore.util.ByteConverter;

import java.math.BigDecimal;

/**
 * Converters for bool and the numeric types.
 */
public final class NumericConverters {

  private NumericConverters() {
  }

  public static final TypeConverter BOOL_TEXT = (ctx, buf, off, len) -> {
    if (len == 1) {
      if (buf[off] == 't') {
        return Boolean.TRUE;
      }
      if (buf[off] == 'f') {
        return Boolean.FALSE;
      }
    }
    throw invalid("bool", utf8(buf, off, len));
  };

  public static final TypeConverter BOOL_BINARY = (ctx, buf, off, len) -> {
    checkLength("bool", len, 1);
    if (buf[off] == 1) {
      return Boolean.TRUE;
    }
    if (buf[off] == 0) {
      return Boolean.FALSE;
    }
    throw invalid("bool", buf[off]);
  };

  public static final TypeConverter INT_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    try {
      return Integer.valueOf(text);
    } catch (NumberFormatException e) {
      throw invalid("integer", text, e);
    }
  };

  public static final TypeConverter LONG_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    try {
      return Long.valueOf(text);
    } catch (NumberFormatException e) {
      throw invalid("bigint", text, e);
    }
  };

  public static final TypeConverter INT2_BINARY = (ctx, buf, off, len) -> {
    checkLength("int2", len, 2);
    return (int) ByteConverter.int2(buf, off);
  };

  public static final TypeConverter INT4_BINARY = (ctx, buf, off, len) -> {
    checkLength("int4", len, 4);
    return ByteConverter.int4(buf, off);
  };

  public static final TypeConverter INT8_BINARY = (ctx, buf, off, len) -> {
    checkLength("int8", len, 8);
    return ByteConverter.int8(buf, off);
  };

  /**
   * oid, xid and cid are unsigned 32 bit values, decoded as Long.
   */
  public static final TypeConverter UINT4_BINARY = (ctx, buf, off, len) -> {
    checkLength("oid", len, 4);
    return ByteConverter.uint4(buf, off);
  };

  public static final TypeConverter FLOAT_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    try {
      return Float.valueOf(text);
    } catch (NumberFormatException e) {
      throw invalid("real", text, e);
    }
  };

  public static final TypeConverter DOUBLE_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    try {
      return Double.valueOf(text);
    } catch (NumberFormatException e) {
      throw invalid("double precision", text, e);
    }
  };

  public static final TypeConverter FLOAT4_BINARY = (ctx, buf, off, len) -> {
    checkLength("float4", len, 4);
    return ByteConverter.float4(buf, off);
  };

  public static final TypeConverter FLOAT8_BINARY = (ctx, buf, off, len) -> {
    checkLength("float8", len, 8);
    return ByteConverter.float8(buf, off);
  };

  public static final TypeConverter NUMERIC_TEXT = (ctx, buf, off, len) -> {
    String text = utf8(buf, off, len);
    switch (text) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        try {
          return new BigDecimal(text);
        } catch (NumberFormatException e) {
          throw invalid("numeric", text, e);
        }
    }
  };

  public static final TypeConverter NUMERIC_BINARY = (ctx, buf, off, len) -> NumericCodec.decode(buf, off, len);
}
