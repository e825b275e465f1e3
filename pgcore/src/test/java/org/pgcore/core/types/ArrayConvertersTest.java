/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.core.Oid;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

public class ArrayConvertersTest {

  private static final DecodeContext CTX = DecodeContext.of(true, null);

  private static final TypeConverter INT_ARRAY_TEXT = ArrayConverters.text(NumericConverters.INT_TEXT, ',');
  private static final TypeConverter TEXT_ARRAY_TEXT = ArrayConverters.text(TextConverters.TEXT, ',');
  private static final TypeConverter INT_ARRAY_BINARY = ArrayConverters.binary(Oid.INT4, NumericConverters.INT4_BINARY);

  private static Object text(TypeConverter converter, String value) throws SQLException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return converter.decode(CTX, bytes, 0, bytes.length);
  }

  /**
   * Binary array of int4 with the given dimensions; a null entry in values is SQL NULL.
   */
  private static byte[] int4Array(int elementOid, int[] dims, Integer... values) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeInt(out, dims.length);
    writeInt(out, 0);
    writeInt(out, elementOid);
    for (int dim : dims) {
      writeInt(out, dim);
      writeInt(out, 1);
    }
    for (Integer value : values) {
      if (value == null) {
        writeInt(out, -1);
      } else {
        writeInt(out, 4);
        writeInt(out, value);
      }
    }
    return out.toByteArray();
  }

  private static void writeInt(ByteArrayOutputStream out, int value) {
    byte[] b = new byte[4];
    ByteConverter.int4(b, 0, value);
    out.write(b, 0, 4);
  }

  @Test
  public void textOneDimension() throws Exception {
    assertEquals(Arrays.asList(1, 2, 3), text(INT_ARRAY_TEXT, "{1,2,3}"));
    assertEquals(Arrays.asList(null, 1), text(INT_ARRAY_TEXT, "{NULL,1}"));
    assertTrue(((List<?>) text(INT_ARRAY_TEXT, "{}")).isEmpty());
  }

  @Test
  public void textNested() throws Exception {
    assertEquals(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3, 4)), text(INT_ARRAY_TEXT, "{{1,2},{3,4}}"));
    assertEquals(Arrays.asList(1, 2, Arrays.asList(3, 4)), text(INT_ARRAY_TEXT, "{1,2,{3,4}}"));
  }

  @Test
  public void textQuotedElements() throws Exception {
    assertEquals(Arrays.asList("a\"b", "c\"d", null, "NULL", "x,y"),
        text(TEXT_ARRAY_TEXT, "{\"a\"\"b\",\"c\\\"d\",NULL,\"NULL\",\"x,y\"}"));
  }

  @Test
  public void textDimensionDecoration() throws Exception {
    assertEquals(Arrays.asList(1, 2), text(INT_ARRAY_TEXT, "[0:1]={1,2}"));
  }

  @Test
  public void textBoxDelimiter() throws Exception {
    TypeConverter boxes = ArrayConverters.text(TextConverters.TEXT, ';');
    assertEquals(Arrays.asList("(1,1),(0,0)", "(2,2),(1,1)"), text(boxes, "{(1,1),(0,0);(2,2),(1,1)}"));
  }

  @Test
  public void textErrors() {
    assertDataError(INT_ARRAY_TEXT, "1,2");
    assertDataError(INT_ARRAY_TEXT, "{1,2");
    assertDataError(INT_ARRAY_TEXT, "{1,2}x");
    assertDataError(INT_ARRAY_TEXT, "{1,x}");
    assertDataError(TEXT_ARRAY_TEXT, "{\"abc}");
    assertDataError(INT_ARRAY_TEXT, "{{{{{{{1}}}}}}}");
  }

  @Test
  public void binaryOneDimension() throws Exception {
    byte[] bytes = int4Array(Oid.INT4, new int[] {3}, 1, null, -5);
    assertEquals(Arrays.asList(1, null, -5), INT_ARRAY_BINARY.decode(CTX, bytes, 0, bytes.length));
  }

  @Test
  public void binaryTwoDimensions() throws Exception {
    byte[] bytes = int4Array(Oid.INT4, new int[] {2, 3}, 1, 2, 3, 4, 5, 6);
    assertEquals(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4, 5, 6)),
        INT_ARRAY_BINARY.decode(CTX, bytes, 0, bytes.length));
  }

  @Test
  public void binaryEmpty() throws Exception {
    byte[] bytes = int4Array(Oid.INT4, new int[0]);
    assertTrue(((List<?>) INT_ARRAY_BINARY.decode(CTX, bytes, 0, bytes.length)).isEmpty());
  }

  @Test
  public void binaryElementTypeMustMatch() {
    assertBinaryError(int4Array(Oid.INT8, new int[] {1}, 1));
  }

  @Test
  public void binaryErrors() {
    byte[] good = int4Array(Oid.INT4, new int[] {2}, 1, 2);
    assertBinaryError(Arrays.copyOf(good, good.length - 1));
    assertBinaryError(Arrays.copyOf(good, good.length + 4));
    assertBinaryError(Arrays.copyOf(good, 8));
    assertBinaryError(int4Array(Oid.INT4, new int[] {1, 1, 1, 1, 1, 1, 1}, 1));
    assertBinaryError(int4Array(Oid.INT4, new int[] {0}));
  }

  @Test
  public void registryArraysUseElementConverters() throws Exception {
    TypeConverter converter = TypeRegistry.get(Oid.INT4_ARRAY).getText();
    assertEquals(Arrays.asList(7, 8), text(converter, "{7,8}"));
  }

  private static void assertBinaryError(byte[] bytes) {
    try {
      INT_ARRAY_BINARY.decode(CTX, bytes, 0, bytes.length);
      fail("malformed array must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  private static void assertDataError(TypeConverter converter, String value) {
    try {
      text(converter, value);
      fail("'" + value + "' must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
