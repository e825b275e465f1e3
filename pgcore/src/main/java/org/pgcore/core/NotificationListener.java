/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

public interface NotificationListener {
  void notificationReceived(Notification notification);
}
