/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.v3;

import org.pgcore.core.Format;
import org.pgcore.core.types.ParameterInfo;
import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Builds frontend messages into one contiguous byte array, ready to be written to the socket.
 * Every length field is computed up front and checked against the signed 32 bit limit of the
 * protocol before anything is appended.
 */
public class MessageBuilder {

  private static Log LOGGER = Logger.getLogger(MessageBuilder.class.getName());

  public static final int PROTOCOL_VERSION_3 = 3 << 16;
  public static final int CANCEL_REQUEST_CODE = 80877102;
  public static final int SSL_REQUEST_CODE = 80877103;
  public static final int MAX_PARAMETERS = 65535;

  private static final long MAX_MESSAGE_LENGTH = Integer.MAX_VALUE;

  private byte[] buf;
  private int pos;

  public MessageBuilder() {
    this(256);
  }

  public MessageBuilder(int initialCapacity) {
    buf = new byte[Math.max(16, initialCapacity)];
  }

  /**
   * @return the messages built so far
   */
  public byte[] toByteArray() {
    return Arrays.copyOf(buf, pos);
  }

  public int size() {
    return pos;
  }

  public boolean isEmpty() {
    return pos == 0;
  }

  /**
   * Simple Query. May hold several statements separated by semicolons.
   *
   * @param sql query text
   * @return this builder
   * @throws PSQLException if the text contains a NUL or is too long
   */
  public MessageBuilder query(String sql) throws PSQLException {
    byte[] sqlUtf8 = encodeSql(sql);
    begin('Q', checkLength(4L + sqlUtf8.length + 1, "SQL statement too long"));
    writeCString(sqlUtf8);
    return this;
  }

  /**
   * @param statementName server side name, empty for the unnamed statement
   * @param sql statement text
   * @param parameterOids declared parameter types, 0 leaves the type to the server
   * @return this builder
   * @throws PSQLException on too many parameters or an oversized statement
   */
  public MessageBuilder parse(String statementName, String sql, int[] parameterOids) throws PSQLException {
    checkParameterCount(parameterOids.length);
    byte[] name = encodeName(statementName);
    byte[] sqlUtf8 = encodeSql(sql);
    // Total size = 4 (size field)
    // + N + 1 (statement name, zero-terminated)
    // + N + 1 (query, zero terminated)
    // + 2 (parameter count) + N * 4 (parameter types)
    long length = 4L + name.length + 1 + sqlUtf8.length + 1 + 2 + 4L * parameterOids.length;
    begin('P', checkLength(length, "SQL statement too long"));
    writeCString(name);
    writeCString(sqlUtf8);
    writeInt2(parameterOids.length);
    for (int oid : parameterOids) {
      writeInt4(oid);
    }
    return this;
  }

  /**
   * @param portalName destination portal, empty for the unnamed portal
   * @param statementName source statement, empty for the unnamed statement
   * @param params encoded parameters
   * @param resultFormat format for every result column
   * @return this builder
   * @throws PSQLException on too many parameters or an oversized message
   */
  public MessageBuilder bind(String portalName, String statementName, ParameterInfo[] params,
      Format resultFormat) throws PSQLException {
    checkParameterCount(params.length);
    if (resultFormat == Format.DEFAULT) {
      throw new PSQLException(GT.tr("Bind needs an explicit result format"), PSQLState.INVALID_PARAMETER_VALUE);
    }
    byte[] portal = encodeName(portalName);
    byte[] statement = encodeName(statementName);
    // Total size = 4 (size field) + N + 1 (destination portal)
    // + N + 1 (statement name)
    // + 2 (param format code count) + N * 2 (format codes)
    // + 2 (param value count) + N (encoded param value size)
    // + 2 (result format code count) + 2 (result format)
    long length = 4L + portal.length + 1 + statement.length + 1 + 2 + 2L * params.length + 2 + 2 + 2;
    for (ParameterInfo param : params) {
      length += 4;
      if (!param.isNull()) {
        length += param.getValue().length;
      }
    }
    begin('B', checkLength(length, "Message too long"));
    writeCString(portal);
    writeCString(statement);
    writeInt2(params.length);
    for (ParameterInfo param : params) {
      writeInt2(param.getFormat() == Format.BINARY ? 1 : 0);
    }
    writeInt2(params.length);
    for (ParameterInfo param : params) {
      if (param.isNull()) {
        writeInt4(-1); // Magic size of -1 means NULL
      } else {
        writeInt4(param.getValue().length);
        write(param.getValue());
      }
    }
    writeInt2(1);
    writeInt2(resultFormat.getCode());
    return this;
  }

  public MessageBuilder describePortal(String portalName) throws PSQLException {
    return describe('P', portalName);
  }

  public MessageBuilder describeStatement(String statementName) throws PSQLException {
    return describe('S', statementName);
  }

  /**
   * @param portalName portal to run
   * @param maxRows row limit, 0 for all rows
   * @return this builder
   * @throws PSQLException if the name is invalid
   */
  public MessageBuilder execute(String portalName, int maxRows) throws PSQLException {
    byte[] portal = encodeName(portalName);
    begin('E', checkLength(4L + portal.length + 1 + 4, "Message too long"));
    writeCString(portal);
    writeInt4(maxRows);
    return this;
  }

  public MessageBuilder closeStatement(String statementName) throws PSQLException {
    return close('S', statementName);
  }

  public MessageBuilder closePortal(String portalName) throws PSQLException {
    return close('P', portalName);
  }

  public MessageBuilder sync() {
    begin('S', 4);
    return this;
  }

  public MessageBuilder flush() {
    begin('H', 4);
    return this;
  }

  public MessageBuilder terminate() {
    begin('X', 4);
    return this;
  }

  public MessageBuilder copyData(byte[] data, int offset, int length) throws PSQLException {
    begin('d', checkLength(4L + length, "Message too long"));
    ensure(length);
    System.arraycopy(data, offset, buf, pos, length);
    pos += length;
    return this;
  }

  public MessageBuilder copyDone() {
    begin('c', 4);
    return this;
  }

  public MessageBuilder copyFail(String message) throws PSQLException {
    byte[] text = encodeName(message);
    begin('f', checkLength(4L + text.length + 1, "Message too long"));
    writeCString(text);
    return this;
  }

  /**
   * Startup message for protocol 3.0. It has no type byte.
   *
   * @param parameters startup parameters such as {@code user} and {@code database}
   * @return this builder
   * @throws PSQLException if a name or value contains a NUL
   */
  public MessageBuilder startup(Map<String, String> parameters) throws PSQLException {
    byte[][] encoded = new byte[parameters.size() * 2][];
    long length = 4 + 4 + 1;
    int i = 0;
    for (Map.Entry<String, String> entry : parameters.entrySet()) {
      encoded[i] = encodeName(entry.getKey());
      encoded[i + 1] = encodeName(entry.getValue());
      length += encoded[i].length + 1 + encoded[i + 1].length + 1;
      i += 2;
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" FE=> StartupPacket(" + parameters.keySet() + ")");
    }
    writeInt4(checkLength(length, "Message too long"));
    writeInt4(PROTOCOL_VERSION_3);
    for (byte[] part : encoded) {
      writeCString(part);
    }
    writeByte(0);
    return this;
  }

  public MessageBuilder cancelRequest(int processId, int secretKey) {
    writeInt4(16);
    writeInt4(CANCEL_REQUEST_CODE);
    writeInt4(processId);
    writeInt4(secretKey);
    return this;
  }

  public MessageBuilder sslRequest() {
    writeInt4(8);
    writeInt4(SSL_REQUEST_CODE);
    return this;
  }

  private MessageBuilder describe(char kind, String name) throws PSQLException {
    byte[] encoded = encodeName(name);
    begin('D', checkLength(4L + 1 + encoded.length + 1, "Message too long"));
    writeByte(kind);
    writeCString(encoded);
    return this;
  }

  private MessageBuilder close(char kind, String name) throws PSQLException {
    byte[] encoded = encodeName(name);
    begin('C', checkLength(4L + 1 + encoded.length + 1, "Message too long"));
    writeByte(kind);
    writeCString(encoded);
    return this;
  }

  private static void checkParameterCount(int count) throws PSQLException {
    if (count > MAX_PARAMETERS) {
      throw new PSQLException(GT.tr("Too many parameters: {0}, at most {1} are supported", count, MAX_PARAMETERS),
          PSQLState.INVALID_PARAMETER_VALUE);
    }
  }

  private int checkLength(long length, String message) throws PSQLException {
    // one more byte for the type
    if (length > MAX_MESSAGE_LENGTH || pos + 1 + length > MAX_MESSAGE_LENGTH) {
      throw new PSQLException(GT.tr("{0}: {1} bytes", message, length), PSQLState.INVALID_PARAMETER_VALUE);
    }
    return (int) length;
  }

  private static byte[] encodeSql(String sql) throws PSQLException {
    if (sql.indexOf('\0') >= 0) {
      throw new PSQLException(GT.tr("SQL statement contains a NUL character"), PSQLState.INVALID_PARAMETER_VALUE);
    }
    return sql.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] encodeName(String name) throws PSQLException {
    if (name == null) {
      return new byte[0];
    }
    if (name.indexOf('\0') >= 0) {
      throw new PSQLException(GT.tr("Identifier {0} contains a NUL character", name.replace('\0', ' ')),
          PSQLState.INVALID_PARAMETER_VALUE);
    }
    return name.getBytes(StandardCharsets.UTF_8);
  }

  private void begin(char tag, int length) {
    writeByte(tag);
    writeInt4(length);
  }

  private void ensure(int extra) {
    if (buf.length - pos < extra) {
      int capacity = buf.length;
      while (capacity - pos < extra) {
        capacity = capacity > (Integer.MAX_VALUE - 8) / 2 ? Integer.MAX_VALUE - 8 : capacity * 2;
        if (capacity == Integer.MAX_VALUE - 8) {
          break;
        }
      }
      buf = Arrays.copyOf(buf, capacity);
    }
  }

  private void writeByte(int value) {
    ensure(1);
    buf[pos++] = (byte) value;
  }

  private void writeInt2(int value) {
    ensure(2);
    ByteConverter.int2(buf, pos, value);
    pos += 2;
  }

  private void writeInt4(int value) {
    ensure(4);
    ByteConverter.int4(buf, pos, value);
    pos += 4;
  }

  private void write(byte[] value) {
    ensure(value.length);
    System.arraycopy(value, 0, buf, pos, value.length);
    pos += value.length;
  }

  private void writeCString(byte[] value) {
    write(value);
    writeByte(0);
  }
}
