/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import java.sql.SQLWarning;

public interface NoticeListener {
  void noticeReceived(SQLWarning warn);
}
