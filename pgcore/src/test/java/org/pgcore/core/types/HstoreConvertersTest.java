/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

public class HstoreConvertersTest {

  private static final DecodeContext CTX = DecodeContext.of(true, null);

  @SuppressWarnings("unchecked")
  private static Map<String, String> text(String value) throws SQLException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return (Map<String, String>) HstoreConverters.TEXT.decode(CTX, bytes, 0, bytes.length);
  }

  private static void writeString(ByteArrayOutputStream out, String value) {
    byte[] len = new byte[4];
    if (value == null) {
      ByteConverter.int4(len, 0, -1);
      out.write(len, 0, 4);
      return;
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    ByteConverter.int4(len, 0, bytes.length);
    out.write(len, 0, 4);
    out.write(bytes, 0, bytes.length);
  }

  private static byte[] binary(String... keysAndValues) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] count = new byte[4];
    ByteConverter.int4(count, 0, keysAndValues.length / 2);
    out.write(count, 0, 4);
    for (String s : keysAndValues) {
      writeString(out, s);
    }
    return out.toByteArray();
  }

  @Test
  public void textPairs() throws Exception {
    Map<String, String> map = text("\"a\"=>\"1\", \"b c\"=>NULL, \"q\\\"x\"=>\"\\\\\"");
    assertEquals(Arrays.asList("a", "b c", "q\"x"), new ArrayList<String>(map.keySet()));
    assertEquals("1", map.get("a"));
    assertTrue(map.containsKey("b c"));
    assertNull(map.get("b c"));
    assertEquals("\\", map.get("q\"x"));
  }

  @Test
  public void emptyText() throws Exception {
    assertTrue(text("").isEmpty());
  }

  @Test
  public void textErrors() {
    assertTextError("\"a\"=\"1\"");
    assertTextError("\"a\"=>bare");
    assertTextError("\"a\"=>\"1\" \"b\"=>\"2\"");
  }

  @Test
  @SuppressWarnings("unchecked")
  public void binaryPairs() throws Exception {
    byte[] bytes = binary("k1", "v1", "k2", null);
    Map<String, String> map = (Map<String, String>) HstoreConverters.BINARY.decode(CTX, bytes, 0, bytes.length);
    assertEquals(2, map.size());
    assertEquals("v1", map.get("k1"));
    assertNull(map.get("k2"));
  }

  @Test
  public void binaryNullKey() {
    byte[] bytes = binary(null, "v");
    try {
      HstoreConverters.BINARY.decode(CTX, bytes, 0, bytes.length);
      fail("null key must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  @Test
  public void binaryTrailingData() {
    byte[] bytes = binary("k", "v");
    try {
      HstoreConverters.BINARY.decode(CTX, Arrays.copyOf(bytes, bytes.length + 1), 0, bytes.length + 1);
      fail("trailing byte must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  @Test
  public void pairSelectsByFormat() {
    assertSame(HstoreConverters.TEXT, HstoreConverters.PAIR.getText());
    assertSame(HstoreConverters.BINARY, HstoreConverters.PAIR.getBinary());
  }

  private static void assertTextError(String value) {
    try {
      text(value);
      fail("'" + value + "' must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
