/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import static org.junit.Assert.assertEquals;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Locale;

public class GTTest {

  private Locale saved;

  @Before
  public void setUp() {
    saved = Locale.getDefault();
    Locale.setDefault(Locale.GERMANY);
  }

  @After
  public void tearDown() {
    Locale.setDefault(saved);
  }

  @Test
  public void integersAreNotGrouped() {
    assertEquals("Invalid length 70000 at offset 1234",
        GT.tr("Invalid length {0} at offset {1}", 70000, 1234L));
    assertEquals("oid 4294967295", GT.tr("oid {0}", 4294967295L));
    assertEquals("byte -1, short 32767", GT.tr("byte {0}, short {1}", (byte) -1, (short) 32767));
  }

  @Test
  public void otherArgumentsAreFormatted() {
    assertEquals("no arguments {0}", GT.tr("no arguments {0}"));
    assertEquals("name 'x'", GT.tr("name ''{0}''", "x"));
    assertEquals("null value null", GT.tr("null value {0}", (Object) null));
  }
}
