/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.range.PGInt4Range;
import org.pgcore.range.PGNumRange;
import org.pgcore.range.PGRange;
import org.pgcore.range.RangeFactory;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Arrays;

public class RangeConvertersTest {

  private static final DecodeContext CTX = DecodeContext.of(true, null);

  private static final TypeConverter INT4_TEXT = RangeConverters.text(NumericConverters.INT_TEXT, RangeFactory.INT4);
  private static final TypeConverter INT4_BINARY =
      RangeConverters.binary(NumericConverters.INT4_BINARY, RangeFactory.INT4);
  private static final TypeConverter NUM_TEXT =
      RangeConverters.text(NumericConverters.NUMERIC_TEXT, RangeFactory.NUMERIC);

  private static Object text(TypeConverter converter, String value) throws SQLException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return converter.decode(CTX, bytes, 0, bytes.length);
  }

  /**
   * Binary range of int4 bounds; a null bound is left out of the data.
   */
  static byte[] int4Range(int flags, Integer lower, Integer upper) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(flags);
    for (Integer bound : new Integer[] {lower, upper}) {
      if (bound != null) {
        byte[] b = new byte[8];
        ByteConverter.int4(b, 0, 4);
        ByteConverter.int4(b, 4, bound);
        out.write(b, 0, 8);
      }
    }
    return out.toByteArray();
  }

  @Test
  public void textBounds() throws Exception {
    assertEquals(new PGInt4Range(1, 10), text(INT4_TEXT, "[1,10)"));
    assertEquals(new PGInt4Range(2, 11), text(INT4_TEXT, "(1,10]"));
    assertEquals(PGInt4Range.empty(), text(INT4_TEXT, "empty"));
  }

  @Test
  public void textUnbounded() throws Exception {
    PGRange<?> range = (PGRange<?>) text(INT4_TEXT, "[,5)");
    assertTrue(range.isLowerInfinite());
    assertEquals(5, range.getUpper());

    PGRange<?> all = (PGRange<?>) text(INT4_TEXT, "(,)");
    assertFalse(all.isEmpty());
    assertNull(all.getLower());
    assertNull(all.getUpper());
  }

  @Test
  public void textQuotedBounds() throws Exception {
    assertEquals(new PGNumRange(new BigDecimal("1.5"), new BigDecimal("2.5"), "[]"),
        text(NUM_TEXT, "[\"1.5\",\"2.5\"]"));
  }

  @Test
  public void textErrors() {
    assertTextError("[5,1)");
    assertTextError("[1,2)x");
    assertTextError("emptyx");
    assertTextError("emp");
    assertTextError("{1,2)");
    assertTextError("[1,2");
    assertTextError("[1;2)");
  }

  @Test
  public void binaryBounds() throws Exception {
    byte[] bytes = int4Range(RangeConverters.RANGE_LB_INC, 3, 7);
    assertEquals(new PGInt4Range(3, 7), INT4_BINARY.decode(CTX, bytes, 0, bytes.length));

    byte[] halfOpen = int4Range(RangeConverters.RANGE_LB_INC | RangeConverters.RANGE_UB_INF, 3, null);
    PGRange<?> range = (PGRange<?>) INT4_BINARY.decode(CTX, halfOpen, 0, halfOpen.length);
    assertEquals(3, range.getLower());
    assertTrue(range.isUpperInfinite());
  }

  @Test
  public void binaryBothInfinite() throws Exception {
    byte[] bytes = int4Range(RangeConverters.RANGE_LB_INF | RangeConverters.RANGE_UB_INF, null, null);
    PGRange<?> range = (PGRange<?>) INT4_BINARY.decode(CTX, bytes, 0, bytes.length);
    assertFalse(range.isEmpty());
    assertNull(range.getLower());
    assertNull(range.getUpper());
  }

  @Test
  public void binaryEmpty() throws Exception {
    byte[] bytes = {RangeConverters.RANGE_EMPTY};
    assertEquals(PGInt4Range.empty(), INT4_BINARY.decode(CTX, bytes, 0, 1));
  }

  @Test
  public void binaryErrors() {
    assertBinaryError(new byte[0]);
    assertBinaryError(new byte[] {RangeConverters.RANGE_EMPTY, 0});
    byte[] good = int4Range(RangeConverters.RANGE_LB_INC, 3, 7);
    assertBinaryError(Arrays.copyOf(good, good.length - 1));
    assertBinaryError(Arrays.copyOf(good, good.length + 1));
    assertBinaryError(int4Range(RangeConverters.RANGE_LB_INC, 7, 3));
  }

  private static void assertTextError(String value) {
    try {
      text(INT4_TEXT, value);
      fail("'" + value + "' must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  private static void assertBinaryError(byte[] bytes) {
    try {
      INT4_BINARY.decode(CTX, bytes, 0, bytes.length);
      fail("malformed range must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
