/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import java.time.ZoneId;

/**
 * Session state reported by the server that changes how values decode.
 */
public interface DecodeContext {

  /**
   * @return true when DateStyle starts with {@code ISO,}; text dates are parsed only then
   */
  boolean isIsoDates();

  /**
   * @return the session time zone, or null when unknown or not representable
   */
  ZoneId getTimeZone();

  /**
   * @return the IntervalStyle parameter, {@code postgres} by default
   */
  String getIntervalStyle();

  static DecodeContext of(final boolean isoDates, final ZoneId timeZone) {
    return new DecodeContext() {
      @Override
      public boolean isIsoDates() {
        return isoDates;
      }

      @Override
      public ZoneId getTimeZone() {
        return timeZone;
      }

      @Override
      public String getIntervalStyle() {
        return "postgres";
      }
    };
  }
}
