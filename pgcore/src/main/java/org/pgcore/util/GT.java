/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import java.text.MessageFormat;

/**
 * Formats user visible messages. Arguments follow {@link MessageFormat} rules, so a
 * literal single quote has to be written as two quotes. Integral arguments such as offsets,
 * lengths and OIDs are printed as plain digits, without locale grouping.
 */
public class GT {

  private GT() {
  }

  public static String tr(String message, Object... args) {
    if (args == null || args.length == 0) {
      return message;
    }
    Object[] plain = args.clone();
    for (int i = 0; i < plain.length; i++) {
      Object arg = plain[i];
      if (arg instanceof Integer || arg instanceof Long || arg instanceof Short || arg instanceof Byte) {
        plain[i] = String.valueOf(arg);
      }
    }
    return MessageFormat.format(message, plain);
  }
}
