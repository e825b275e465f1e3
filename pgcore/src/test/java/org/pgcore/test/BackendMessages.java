/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Builds backend protocol messages byte for byte, so tests can play the server's side.
 */
public final class BackendMessages {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private char tag;
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  private BackendMessages() {
  }

  /**
   * Starts a message.
   *
   * @param tag message type
   * @return builder for the body
   */
  public static BackendMessages message(char tag) {
    BackendMessages m = new BackendMessages();
    m.tag = tag;
    return m;
  }

  public BackendMessages int1(int value) {
    body.write(value);
    return this;
  }

  public BackendMessages int2(int value) {
    body.write(value >>> 8);
    body.write(value);
    return this;
  }

  public BackendMessages int4(int value) {
    body.write(value >>> 24);
    body.write(value >>> 16);
    body.write(value >>> 8);
    body.write(value);
    return this;
  }

  public BackendMessages int8(long value) {
    int4((int) (value >>> 32));
    return int4((int) value);
  }

  public BackendMessages bytes(byte[] value) {
    body.write(value, 0, value.length);
    return this;
  }

  public BackendMessages string(String value) {
    bytes(value.getBytes(StandardCharsets.UTF_8));
    body.write(0);
    return this;
  }

  /**
   * @return tag, length and body
   */
  public byte[] build() {
    byte[] payload = body.toByteArray();
    out.reset();
    out.write(tag);
    int length = payload.length + 4;
    out.write(length >>> 24);
    out.write(length >>> 16);
    out.write(length >>> 8);
    out.write(length);
    out.write(payload, 0, payload.length);
    return out.toByteArray();
  }

  // ---- common messages ----

  public static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream all = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      all.write(part, 0, part.length);
    }
    return all.toByteArray();
  }

  public static byte[] parseComplete() {
    return message('1').build();
  }

  public static byte[] bindComplete() {
    return message('2').build();
  }

  public static byte[] closeComplete() {
    return message('3').build();
  }

  public static byte[] noData() {
    return message('n').build();
  }

  public static byte[] readyForQuery(char status) {
    return message('Z').int1(status).build();
  }

  public static byte[] commandComplete(String status) {
    return message('C').string(status).build();
  }

  public static byte[] parameterStatus(String name, String value) {
    return message('S').string(name).string(value).build();
  }

  /**
   * RowDescription where every column is given as name, type OID and format code.
   *
   * @param columns triples of (String name, Integer oid, Integer format)
   * @return the message
   */
  public static byte[] rowDescription(Object... columns) {
    BackendMessages m = message('T').int2(columns.length / 3);
    for (int i = 0; i < columns.length; i += 3) {
      m.string((String) columns[i])
          .int4(0)
          .int2(0)
          .int4((Integer) columns[i + 1])
          .int2(-1)
          .int4(-1)
          .int2((Integer) columns[i + 2]);
    }
    return m.build();
  }

  /**
   * @param values column values, null for SQL NULL
   * @return a DataRow message
   */
  public static byte[] dataRow(byte[]... values) {
    BackendMessages m = message('D').int2(values.length);
    for (byte[] value : values) {
      if (value == null) {
        m.int4(-1);
      } else {
        m.int4(value.length).bytes(value);
      }
    }
    return m.build();
  }

  public static byte[] text(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  public static byte[] int4Value(int value) {
    return new byte[] {(byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
  }

  public static byte[] errorResponse(String severity, String sqlState, String text) {
    return fields('E', severity, sqlState, text);
  }

  public static byte[] noticeResponse(String severity, String sqlState, String text) {
    return fields('N', severity, sqlState, text);
  }

  private static byte[] fields(char tag, String severity, String sqlState, String text) {
    BackendMessages m = message(tag);
    m.int1('S').string(severity);
    m.int1('V').string(severity);
    m.int1('C').string(sqlState);
    m.int1('M').string(text);
    m.int1(0);
    return m.build();
  }
}
