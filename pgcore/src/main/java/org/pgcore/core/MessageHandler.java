/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import java.sql.SQLException;

/**
 * Consumes complete backend messages cut out of the byte stream by {@link MessageFramer}.
 */
public interface MessageHandler {

  /**
   * Handles one message. The handler must consume the whole body; bytes left unread are
   * reported as a protocol violation by the caller.
   *
   * @param tag the message type byte
   * @param body reader positioned at the first body byte, limited to the body length
   * @throws SQLException if the message is malformed or the handler fails
   */
  void handleMessage(char tag, MessageReader body) throws SQLException;
}
