/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.log.Log;
import org.pgcore.log.Logger;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Fields of an ErrorResponse or NoticeResponse. The body is a sequence of one byte field
 * codes, each followed by a NUL terminated UTF-8 string, ended by a zero code.
 */
public class ServerErrorMessage implements Serializable {

  private static final long serialVersionUID = 1L;

  private static Log LOGGER = Logger.getLogger(ServerErrorMessage.class.getName());

  private static final char SEVERITY_LOCALIZED = 'S';
  private static final char SEVERITY = 'V';
  private static final char SQLSTATE = 'C';
  private static final char MESSAGE = 'M';
  private static final char DETAIL = 'D';
  private static final char HINT = 'H';
  private static final char POSITION = 'P';
  private static final char INTERNAL_POSITION = 'p';
  private static final char INTERNAL_QUERY = 'q';
  private static final char WHERE = 'W';
  private static final char SCHEMA = 's';
  private static final char TABLE = 't';
  private static final char COLUMN = 'c';
  private static final char DATATYPE = 'd';
  private static final char CONSTRAINT = 'n';
  private static final char FILE = 'F';
  private static final char LINE = 'L';
  private static final char ROUTINE = 'R';

  private final Map<Character, String> parts = new HashMap<Character, String>();

  public ServerErrorMessage(byte[] body, int offset, int length) {
    int pos = offset;
    int end = offset + length;
    while (pos < end) {
      char code = (char) (body[pos] & 0xFF);
      pos++;
      if (code == '\0') {
        break;
      }
      int start = pos;
      while (pos < end && body[pos] != 0) {
        pos++;
      }
      parts.put(code, new String(body, start, pos - start, StandardCharsets.UTF_8));
      pos++;
    }
  }

  public ServerErrorMessage(byte[] body) {
    this(body, 0, body.length);
  }

  public ServerErrorMessage(String serverError) {
    this(serverError.getBytes(StandardCharsets.UTF_8));
  }

  public String getSQLState() {
    return parts.get(SQLSTATE);
  }

  /**
   * @return the non-localized severity when the server sent one, the localized one otherwise
   */
  public String getSeverity() {
    String severity = parts.get(SEVERITY);
    return severity != null ? severity : parts.get(SEVERITY_LOCALIZED);
  }

  public boolean isFatal() {
    String severity = getSeverity();
    return "FATAL".equals(severity) || "PANIC".equals(severity);
  }

  public String getMessage() {
    return parts.get(MESSAGE);
  }

  public String getDetail() {
    return parts.get(DETAIL);
  }

  public String getHint() {
    return parts.get(HINT);
  }

  public int getPosition() {
    return getIntegerPart(POSITION);
  }

  public int getInternalPosition() {
    return getIntegerPart(INTERNAL_POSITION);
  }

  public String getInternalQuery() {
    return parts.get(INTERNAL_QUERY);
  }

  public String getWhere() {
    return parts.get(WHERE);
  }

  public String getSchema() {
    return parts.get(SCHEMA);
  }

  public String getTable() {
    return parts.get(TABLE);
  }

  public String getColumn() {
    return parts.get(COLUMN);
  }

  public String getDatatype() {
    return parts.get(DATATYPE);
  }

  public String getConstraint() {
    return parts.get(CONSTRAINT);
  }

  public String getFile() {
    return parts.get(FILE);
  }

  public int getLine() {
    return getIntegerPart(LINE);
  }

  public String getRoutine() {
    return parts.get(ROUTINE);
  }

  public Map<Character, String> getParts() {
    return Collections.unmodifiableMap(parts);
  }

  private int getIntegerPart(char code) {
    String s = parts.get(code);
    if (s == null) {
      return 0;
    }
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring non-numeric error field " + code + ": " + s);
      return 0;
    }
  }

  @Override
  public String toString() {
    // SEVERITY: Message, then the optional fields one per line
    StringBuilder sb = new StringBuilder();
    String severity = parts.get(SEVERITY_LOCALIZED);
    if (severity == null) {
      severity = parts.get(SEVERITY);
    }
    if (severity != null) {
      sb.append(severity).append(": ");
    }
    String message = parts.get(MESSAGE);
    if (message != null) {
      sb.append(message);
    }
    appendPart(sb, "Detail: {0}", parts.get(DETAIL));
    appendPart(sb, "Hint: {0}", parts.get(HINT));
    appendPart(sb, "Position: {0}", parts.get(POSITION));
    appendPart(sb, "Where: {0}", parts.get(WHERE));
    if (LOGGER.isDebugEnabled()) {
      appendPart(sb, "Internal Query: {0}", parts.get(INTERNAL_QUERY));
      appendPart(sb, "Internal Position: {0}", parts.get(INTERNAL_POSITION));
      String file = parts.get(FILE);
      if (file != null) {
        sb.append("\n  ").append(GT.tr("Location: File: {0}, Routine: {1}, Line: {2}",
            file, parts.get(ROUTINE), parts.get(LINE)));
      }
      appendPart(sb, "Server SQLState: {0}", parts.get(SQLSTATE));
    }
    return sb.toString();
  }

  private static void appendPart(StringBuilder sb, String format, String value) {
    if (value != null) {
      sb.append("\n  ").append(GT.tr(format, value));
    }
  }
}
