/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.core.Oid;
import org.pgcore.range.PGInt4Range;
import org.pgcore.range.PGMultirange;
import org.pgcore.range.PGRange;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Arrays;

public class MultirangeConvertersTest {

  private static final DecodeContext CTX = DecodeContext.of(true, null);

  private static Object text(String value) throws SQLException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return TypeRegistry.get(Oid.INT4MULTIRANGE).getText().decode(CTX, bytes, 0, bytes.length);
  }

  private static Object binary(byte[] bytes) throws SQLException {
    return TypeRegistry.get(Oid.INT4MULTIRANGE).getBinary().decode(CTX, bytes, 0, bytes.length);
  }

  private static byte[] multirange(byte[]... ranges) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] b = new byte[4];
    ByteConverter.int4(b, 0, ranges.length);
    out.write(b, 0, 4);
    for (byte[] range : ranges) {
      ByteConverter.int4(b, 0, range.length);
      out.write(b, 0, 4);
      out.write(range, 0, range.length);
    }
    return out.toByteArray();
  }

  private static PGMultirange<PGRange<?>> expected(PGRange<?>... ranges) {
    return new PGMultirange<PGRange<?>>(Oid.INT4MULTIRANGE, Arrays.asList(ranges));
  }

  @Test
  public void textRanges() throws Exception {
    assertEquals(expected(new PGInt4Range(1, 3), new PGInt4Range(5, 8)), text("{[1,3), [5,7]}"));
    assertEquals(expected(new PGInt4Range(null, 0)), text("{(,0)}"));
    assertEquals(2, ((PGMultirange<?>) text("{[1,2), [4,6)}")).getRanges().size());
  }

  @Test
  public void textEmpty() throws Exception {
    assertTrue(((PGMultirange<?>) text("{}")).isEmpty());
  }

  @Test
  public void textErrors() {
    assertDataError("[1,3)");
    assertDataError("{[1,3)");
    assertDataError("{[1,3);[4,5)}");
    assertDataError("{[1,3)}x");
  }

  @Test
  public void binaryRanges() throws Exception {
    byte[] bytes = multirange(
        RangeConvertersTest.int4Range(RangeConverters.RANGE_LB_INC, 1, 3),
        RangeConvertersTest.int4Range(RangeConverters.RANGE_LB_INC | RangeConverters.RANGE_UB_INF, 10, null));
    assertEquals(expected(new PGInt4Range(1, 3), new PGInt4Range(10, null)), binary(bytes));
    assertTrue(((PGMultirange<?>) binary(multirange())).isEmpty());
  }

  @Test
  public void binaryErrors() {
    byte[] good = multirange(RangeConvertersTest.int4Range(RangeConverters.RANGE_LB_INC, 1, 3));
    assertBinaryError(Arrays.copyOf(good, 2));
    assertBinaryError(Arrays.copyOf(good, good.length - 1));
    assertBinaryError(Arrays.copyOf(good, good.length + 1));
  }

  private static void assertDataError(String value) {
    try {
      text(value);
      fail("'" + value + "' must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  private static void assertBinaryError(byte[] bytes) {
    try {
      binary(bytes);
      fail("malformed multirange must be rejected");
    } catch (SQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
