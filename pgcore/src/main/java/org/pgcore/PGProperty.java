/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore;

import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.util.Properties;

/**
 * All connection parameters understood by the protocol core, each with its name, default value
 * and description.
 */
public enum PGProperty {

  /**
   * Number of executions of the same statement and parameter types before it is prepared on the
   * server. Zero disables the statement cache and server side prepared statements.
   */
  PREPARE_THRESHOLD("prepareThreshold", "5",
      "Statement executions before switching to server side prepared statements, 0 disables"),

  /**
   * Maximum number of entries in the per connection statement cache.
   */
  PREPARED_STATEMENT_CACHE_QUERIES("preparedStatementCacheQueries", "100",
      "Number of statements cached per connection"),

  /**
   * Size of the standing receive buffer. Messages with longer bodies get a buffer of their own.
   */
  RECEIVE_BUFFER_SIZE("receiveBufferSize", "16384", "Receive buffer size in bytes"),

  LOGGER("logger", "JdkLogger", "Logger implementation: JdkLogger, Slf4JLogger or a class name",
      false, "JdkLogger", "Slf4JLogger"),

  USER("user", null, "Username to connect to the database as.", true),

  PG_DBNAME("PGDBNAME", null, "Database name to connect to"),

  APPLICATION_NAME("ApplicationName", "pgcore", "Name of the Application"),

  TIMEZONE("timezone", null, "Session time zone sent in the startup message");

  private final String name;
  private final String defaultValue;
  private final boolean required;
  private final String description;
  private final String[] choices;

  PGProperty(String name, String defaultValue, String description) {
    this(name, defaultValue, description, false);
  }

  PGProperty(String name, String defaultValue, String description, boolean required) {
    this(name, defaultValue, description, required, (String[]) null);
  }

  PGProperty(String name, String defaultValue, String description, boolean required,
      String... choices) {
    this.name = name;
    this.defaultValue = defaultValue;
    this.required = required;
    this.description = description;
    this.choices = choices;
  }

  public String getName() {
    return name;
  }

  public String getDefaultValue() {
    return defaultValue;
  }

  public boolean isRequired() {
    return required;
  }

  public String getDescription() {
    return description;
  }

  public String[] getChoices() {
    return choices;
  }

  /**
   * Returns the value of the connection parameter from the given {@link Properties} or the
   * default value.
   *
   * @param properties properties to take actual value from
   * @return evaluated value for this connection parameter
   */
  public String get(Properties properties) {
    return properties.getProperty(name, defaultValue);
  }

  public void set(Properties properties, String value) {
    if (value == null) {
      properties.remove(name);
    } else {
      properties.setProperty(name, value);
    }
  }

  public void set(Properties properties, int value) {
    properties.setProperty(name, Integer.toString(value));
  }

  /**
   * Returns the value of the connection parameter as int.
   *
   * @param properties properties to take actual value from
   * @return evaluated value for this connection parameter converted to int
   * @throws PSQLException if it cannot be converted to int.
   */
  public int getInt(Properties properties) throws PSQLException {
    String value = get(properties);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException nfe) {
      throw new PSQLException(GT.tr("{0} parameter value must be an integer but was: {1}",
          getName(), value), PSQLState.INVALID_PARAMETER_VALUE, nfe);
    }
  }

  /**
   * Test whether this property is present in the given {@link Properties}.
   *
   * @param properties set of properties to check current in
   * @return true if the parameter is specified in the given properties
   */
  public boolean isPresent(Properties properties) {
    return properties.getProperty(name) != null;
  }

  /**
   * @param name property name
   * @return the matching property or null
   */
  public static PGProperty forName(String name) {
    for (PGProperty property : values()) {
      if (property.getName().equals(name)) {
        return property;
      }
    }
    return null;
  }
}
