/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.core.Oid;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;

public class PGRangeTest {

  @Test
  public void discreteRangesAreCanonical() {
    PGInt4Range range = new PGInt4Range(1, 10, "(]");
    assertEquals(Integer.valueOf(2), range.getLower());
    assertEquals(Integer.valueOf(11), range.getUpper());
    assertEquals("[)", range.getBounds());
    assertEquals(new PGInt4Range(2, 11), range);
    assertEquals("[2,11)", range.toSqlText());
  }

  @Test
  public void dateRangeCanonical() {
    PGDateRange range = new PGDateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31), "[]");
    assertEquals(LocalDate.of(2024, 2, 1), range.getUpper());
    assertFalse(range.isUpperInclusive());
  }

  @Test
  public void continuousRangesKeepBounds() {
    PGNumRange range = new PGNumRange(new BigDecimal("1.5"), new BigDecimal("2.5"), "(]");
    assertEquals("(]", range.getBounds());
    assertFalse(range.contains(new BigDecimal("1.5")));
    assertTrue(range.contains(new BigDecimal("2.5")));
    assertTrue(range.contains(new BigDecimal("2")));
  }

  @Test
  public void equalBoundsAreEmptyUnlessBothInclusive() {
    assertTrue(new PGNumRange(BigDecimal.ONE, BigDecimal.ONE, "[)").isEmpty());
    assertFalse(new PGNumRange(BigDecimal.ONE, BigDecimal.ONE, "[]").isEmpty());
    assertTrue(new PGInt4Range(5, 5).isEmpty());
    assertEquals(PGInt4Range.empty(), new PGInt4Range(5, 5));
    // [5,5] canonicalizes to [5,6), which is not empty
    assertFalse(new PGInt4Range(5, 5, "[]").isEmpty());
  }

  @Test
  public void emptyRange() {
    PGInt4Range empty = PGInt4Range.empty();
    assertTrue(empty.isEmpty());
    assertNull(empty.getBounds());
    assertFalse(empty.isLowerInfinite());
    assertFalse(empty.contains(1));
    assertEquals("empty", empty.toSqlText());
  }

  @Test
  public void unboundedRange() {
    PGInt8Range range = new PGInt8Range(null, 100L, "[)");
    assertTrue(range.isLowerInfinite());
    assertFalse(range.isLowerInclusive());
    assertTrue(range.contains(Long.MIN_VALUE));
    assertFalse(range.contains(100L));
    assertEquals("(,100)", range.toSqlText());
  }

  @Test(expected = IllegalArgumentException.class)
  public void lowerAboveUpper() {
    new PGInt4Range(10, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void invalidBoundCharacters() {
    new PGInt4Range(1, 2, "{)");
  }

  @Test
  public void boundTextIsQuotedWhenNeeded() {
    PGNumRange range = new PGNumRange(new BigDecimal("-1"), null, "[)");
    assertEquals("[-1,)", range.toSqlText());
    assertEquals(Oid.NUMRANGE, range.getSqlOid());
  }

  @Test
  public void equalityIsPerRangeType() {
    assertNotEquals(new PGInt4Range(1, 2), new PGInt8Range(1L, 2L));
  }

  @Test
  public void factoryChecksElementType() throws Exception {
    assertEquals(new PGInt4Range(1, 3), RangeFactory.INT4.create(1, 3, "[)"));
    assertEquals(PGInt4Range.empty(), RangeFactory.INT4.create(null, null, null));
    try {
      RangeFactory.INT4.create(1L, 3L, "[)");
      fail("Long bounds are not int4range bounds");
    } catch (PSQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
    try {
      RangeFactory.DATE.create("infinity", null, "[)");
      fail("infinite dates cannot be range bounds");
    } catch (PSQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  @Test
  public void factoryReportsOrderAsDataError() {
    try {
      RangeFactory.INT4.create(3, 1, "[)");
      fail("bounds out of order must be rejected");
    } catch (PSQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }

  @Test
  public void multirangeText() {
    PGMultirange<PGInt4Range> multirange = new PGMultirange<PGInt4Range>(Oid.INT4MULTIRANGE,
        Arrays.asList(new PGInt4Range(1, 3), new PGInt4Range(5, null)));
    assertEquals("{[1,3),[5,)}", multirange.toSqlText());
    assertEquals(Oid.INT4MULTIRANGE, multirange.getSqlOid());
    assertTrue(new PGMultirange<PGInt4Range>(Oid.INT4MULTIRANGE, Arrays.<PGInt4Range>asList()).isEmpty());
  }
}
