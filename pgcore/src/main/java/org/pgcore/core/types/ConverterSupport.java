/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.nio.charset.StandardCharsets;

/**
 * Shared checks for the converter classes.
 */
final class ConverterSupport {

  private ConverterSupport() {
  }

  static String utf8(byte[] buf, int offset, int length) {
    return new String(buf, offset, length, StandardCharsets.UTF_8);
  }

  static PSQLException invalid(String typeName, Object value) {
    return new PSQLException(GT.tr("Invalid {0} value: {1}", typeName, value), PSQLState.DATA_ERROR);
  }

  static PSQLException invalid(String typeName, Object value, Throwable cause) {
    return new PSQLException(GT.tr("Invalid {0} value: {1}", typeName, value), PSQLState.DATA_ERROR, cause);
  }

  static void checkLength(String typeName, int length, int expected) throws PSQLException {
    if (length != expected) {
      throw new PSQLException(
          GT.tr("Invalid length for binary {0} value: expected {1} bytes, got {2}", typeName, expected, length),
          PSQLState.DATA_ERROR);
    }
  }

  static void checkMinLength(String typeName, int length, int minimum) throws PSQLException {
    if (length < minimum) {
      throw new PSQLException(
          GT.tr("Invalid length for binary {0} value: at least {1} bytes needed, got {2}", typeName, minimum,
              length),
          PSQLState.DATA_ERROR);
    }
  }
}
