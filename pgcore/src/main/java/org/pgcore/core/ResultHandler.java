/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import java.sql.SQLException;
import java.util.List;

/**
 * Receives the outcome of each request cycle, once per ReadyForQuery, or immediately for a
 * FATAL or PANIC error.
 */
public interface ResultHandler {

  void handleResult(List<Result> results);

  void handleError(SQLException error);
}
