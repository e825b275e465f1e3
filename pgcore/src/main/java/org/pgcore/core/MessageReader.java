/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.nio.charset.StandardCharsets;

/**
 * Bounds checked cursor over one message body. Every read past the limit raises a protocol
 * violation instead of touching bytes of the next message.
 */
public class MessageReader {
  private final byte[] buffer;
  private final int limit;
  private int pos;

  public MessageReader(byte[] buffer, int offset, int length) {
    this.buffer = buffer;
    this.pos = offset;
    this.limit = offset + length;
  }

  public byte[] getBuffer() {
    return buffer;
  }

  public int position() {
    return pos;
  }

  public int remaining() {
    return limit - pos;
  }

  private void require(int count, String what) throws PSQLException {
    if (count < 0 || limit - pos < count) {
      throw new PSQLException(
          GT.tr("Unexpected end of message reading {0}: {1} bytes needed, {2} left", what, count, limit - pos),
          PSQLState.PROTOCOL_VIOLATION);
    }
  }

  public int readByte() throws PSQLException {
    require(1, "byte");
    return buffer[pos++] & 0xFF;
  }

  public short readInt2() throws PSQLException {
    require(2, "int16");
    short value = ByteConverter.int2(buffer, pos);
    pos += 2;
    return value;
  }

  public int readUInt2() throws PSQLException {
    require(2, "uint16");
    int value = ByteConverter.uint2(buffer, pos);
    pos += 2;
    return value;
  }

  public int readInt4() throws PSQLException {
    require(4, "int32");
    int value = ByteConverter.int4(buffer, pos);
    pos += 4;
    return value;
  }

  public long readInt8() throws PSQLException {
    require(8, "int64");
    long value = ByteConverter.int8(buffer, pos);
    pos += 8;
    return value;
  }

  /**
   * Reads a NUL terminated UTF-8 string and steps over the terminator.
   *
   * @return the decoded string
   * @throws PSQLException if no terminator is found before the end of the message
   */
  public String readString() throws PSQLException {
    int end = pos;
    while (end < limit && buffer[end] != 0) {
      end++;
    }
    if (end >= limit) {
      throw new PSQLException(GT.tr("Missing string terminator in message"), PSQLState.PROTOCOL_VIOLATION);
    }
    String value = new String(buffer, pos, end - pos, StandardCharsets.UTF_8);
    pos = end + 1;
    return value;
  }

  public byte[] readBytes(int count) throws PSQLException {
    require(count, "bytes");
    byte[] value = new byte[count];
    System.arraycopy(buffer, pos, value, 0, count);
    pos += count;
    return value;
  }

  public void skip(int count) throws PSQLException {
    require(count, "bytes");
    pos += count;
  }

  /**
   * @param messageName used in the error text
   * @throws PSQLException if unread bytes remain
   */
  public void checkEnd(String messageName) throws PSQLException {
    if (pos != limit) {
      throw new PSQLException(GT.tr("Extraneous data in {0} message: {1} bytes left", messageName, limit - pos),
          PSQLState.PROTOCOL_VIOLATION);
    }
  }
}
