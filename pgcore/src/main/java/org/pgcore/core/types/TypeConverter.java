/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import java.sql.SQLException;

/**
 * Decodes one column value of a given type and wire format into a Java value.
 * Implementations must be pure: no I/O and no state shared across calls.
 */
public interface TypeConverter {

  /**
   * @param context session settings that affect decoding
   * @param buf array holding the value
   * @param offset first byte of the value
   * @param length value length in bytes
   * @return the decoded value, never null
   * @throws SQLException if the bytes do not form a valid value of the type
   */
  Object decode(DecodeContext context, byte[] buf, int offset, int length) throws SQLException;
}
