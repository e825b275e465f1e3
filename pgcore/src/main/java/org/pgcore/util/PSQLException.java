/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import java.sql.SQLException;

public class PSQLException extends SQLException {

  private final ServerErrorMessage serverError;

  public PSQLException(String msg, PSQLState state, Throwable cause) {
    super(msg, state == null ? null : state.getState(), cause);
    this.serverError = null;
  }

  public PSQLException(String msg, PSQLState state) {
    this(msg, state, null);
  }

  public PSQLException(ServerErrorMessage serverError) {
    super(serverError.toString(), serverError.getSQLState());
    this.serverError = serverError;
  }

  /**
   * @return the parsed ErrorResponse when this exception was reported by the server, otherwise null
   */
  public ServerErrorMessage getServerErrorMessage() {
    return serverError;
  }

  public boolean isProtocolViolation() {
    return PSQLState.PROTOCOL_VIOLATION.getState().equals(getSQLState());
  }
}
