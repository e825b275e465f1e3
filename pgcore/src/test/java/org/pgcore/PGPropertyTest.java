/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.util.Properties;

public class PGPropertyTest {

  /**
   * Test that we can get and set all default values and all choices (if any).
   */
  @Test
  public void testGetSetAllProperties() {
    Properties properties = new Properties();
    for (PGProperty property : PGProperty.values()) {
      String value = property.get(properties);
      assertEquals(property.getDefaultValue(), value);

      property.set(properties, value);
      assertEquals(value, property.get(properties));

      if (property.getChoices() != null && property.getChoices().length > 0) {
        for (String choice : property.getChoices()) {
          property.set(properties, choice);
          assertEquals(choice, property.get(properties));
        }
      }
    }
  }

  /**
   * Test that the enum constant is common with the underlying property name.
   */
  @Test
  public void testEnumConstantNaming() {
    for (PGProperty property : PGProperty.values()) {
      String enumName = property.name().replaceAll("_", "");
      assertEquals("Naming of the enum constant [" + property.name()
          + "] should follow the naming of its underlying property [" + property.getName()
          + "] in PGProperty", property.getName().toLowerCase(), enumName.toLowerCase());
    }
  }

  @Test
  public void testIntegerValues() throws Exception {
    Properties properties = new Properties();
    assertEquals(5, PGProperty.PREPARE_THRESHOLD.getInt(properties));
    PGProperty.PREPARE_THRESHOLD.set(properties, 0);
    assertEquals(0, PGProperty.PREPARE_THRESHOLD.getInt(properties));
    assertTrue(PGProperty.PREPARE_THRESHOLD.isPresent(properties));
    PGProperty.PREPARE_THRESHOLD.set(properties, null);
    assertFalse(PGProperty.PREPARE_THRESHOLD.isPresent(properties));
  }

  @Test
  public void testNonIntegerValue() {
    Properties properties = new Properties();
    PGProperty.RECEIVE_BUFFER_SIZE.set(properties, "big");
    try {
      PGProperty.RECEIVE_BUFFER_SIZE.getInt(properties);
      fail("a non-numeric value must be rejected");
    } catch (PSQLException e) {
      assertEquals(PSQLState.INVALID_PARAMETER_VALUE.getState(), e.getSQLState());
    }
  }

  @Test
  public void testForName() {
    assertSame(PGProperty.USER, PGProperty.forName("user"));
    assertTrue(PGProperty.USER.isRequired());
    assertNull(PGProperty.forName("nope"));
  }

  /**
   * Every property must be documented.
   */
  @Test
  public void testDescriptions() {
    for (PGProperty property : PGProperty.values()) {
      assertFalse(property.getName(), property.getDescription() == null || property.getDescription().isEmpty());
    }
  }
}
