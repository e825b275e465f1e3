/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.nio.ByteBuffer;
import java.sql.SQLException;

/**
 * Incremental decoder that cuts a backend byte stream into messages.
 *
 * <p>The transport asks for a region with {@link #getBuffer()}, fills some bytes of it and reports
 * the count with {@link #bufferUpdated(int)}. Each complete message is dispatched to the
 * {@link MessageHandler} before the call returns. Messages whose body fits the standing buffer are
 * decoded in place; a larger body gets its own array, sized exactly to the body, for the time it
 * takes to receive it.</p>
 *
 * <p>Not thread safe. The region returned by {@link #getBuffer()} belongs to the framer again once
 * {@link #bufferUpdated(int)} is called.</p>
 */
public class MessageFramer {

  private static Log LOGGER = Logger.getLogger(MessageFramer.class.getName());

  public static final int DEFAULT_BUFFER_SIZE = 0x4000;

  private static final int HEADER_SIZE = 5;

  private enum State {
    AWAITING_HEADER,
    AWAITING_BODY
  }

  private enum BufferMode {
    STANDING,
    OVERFLOW
  }

  private final MessageHandler handler;
  private final byte[] standing;
  private byte[] overflow;

  private State state = State.AWAITING_HEADER;
  private BufferMode mode = BufferMode.STANDING;
  // valid bytes at the front of the active buffer
  private int bytesRead;
  private char tag;
  private int bodyLength;
  private boolean broken;

  public MessageFramer(MessageHandler handler) {
    this(handler, DEFAULT_BUFFER_SIZE);
  }

  public MessageFramer(MessageHandler handler, int bufferSize) {
    if (bufferSize < HEADER_SIZE) {
      throw new IllegalArgumentException(GT.tr("Buffer size {0} is smaller than a message header", bufferSize));
    }
    this.handler = handler;
    this.standing = new byte[bufferSize];
  }

  /**
   * @return the writable region the next received bytes must go to; never empty
   */
  public ByteBuffer getBuffer() {
    if (mode == BufferMode.OVERFLOW) {
      return ByteBuffer.wrap(overflow, bytesRead, overflow.length - bytesRead);
    }
    return ByteBuffer.wrap(standing, bytesRead, standing.length - bytesRead);
  }

  /**
   * Signals that {@code count} bytes were written at the start of the region last returned by
   * {@link #getBuffer()}, and dispatches every message they complete.
   *
   * @param count number of bytes written
   * @throws SQLException a protocol violation or a handler failure; the stream cannot be resumed
   */
  public void bufferUpdated(int count) throws SQLException {
    if (broken) {
      throw new PSQLException(GT.tr("Message stream is unusable after an earlier protocol error"),
          PSQLState.PROTOCOL_VIOLATION);
    }
    int capacity = mode == BufferMode.OVERFLOW ? overflow.length : standing.length;
    if (count < 0 || count > capacity - bytesRead) {
      throw new IllegalArgumentException(GT.tr("Invalid byte count {0}", count));
    }
    bytesRead += count;
    try {
      if (mode == BufferMode.OVERFLOW) {
        drainOverflow();
      } else {
        drainStanding();
      }
    } catch (SQLException | RuntimeException e) {
      broken = true;
      throw e;
    }
  }

  /**
   * Pushes bytes through the framer as if they had been received, for callers holding their data
   * in an array rather than reading into {@link #getBuffer()}.
   *
   * @param data source array
   * @param offset first byte to feed
   * @param length number of bytes to feed
   * @throws SQLException as for {@link #bufferUpdated(int)}
   */
  public void feed(byte[] data, int offset, int length) throws SQLException {
    int pos = offset;
    int end = offset + length;
    while (pos < end) {
      ByteBuffer region = getBuffer();
      int chunk = Math.min(region.remaining(), end - pos);
      region.put(data, pos, chunk);
      pos += chunk;
      bufferUpdated(chunk);
    }
  }

  public void feed(byte[] data) throws SQLException {
    feed(data, 0, data.length);
  }

  public boolean isBroken() {
    return broken;
  }

  private void drainOverflow() throws SQLException {
    if (bytesRead < bodyLength) {
      return;
    }
    byte[] body = overflow;
    // back to the standing buffer before dispatch so a failing handler leaves no stale overflow
    overflow = null;
    mode = BufferMode.STANDING;
    state = State.AWAITING_HEADER;
    bytesRead = 0;
    dispatch(body, 0, bodyLength);
  }

  private void drainStanding() throws SQLException {
    int start = 0;
    while (true) {
      int available = bytesRead - start;
      if (state == State.AWAITING_HEADER) {
        if (available < HEADER_SIZE) {
          break;
        }
        tag = (char) (standing[start] & 0xFF);
        int length = ByteConverter.int4(standing, start + 1);
        if (length < 4) {
          throw new PSQLException(GT.tr("Negative message length {0} for message ''{1}''", length - 4, tag),
              PSQLState.PROTOCOL_VIOLATION);
        }
        bodyLength = length - 4;
        start += HEADER_SIZE;
        state = State.AWAITING_BODY;
        if (bodyLength > standing.length) {
          enterOverflow(start);
          return;
        }
      } else {
        if (available < bodyLength) {
          break;
        }
        int bodyStart = start;
        start += bodyLength;
        state = State.AWAITING_HEADER;
        dispatch(standing, bodyStart, bodyLength);
      }
    }
    compact(start);
  }

  private void enterOverflow(int start) {
    int trailing = bytesRead - start;
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" <=BE large message '" + tag + "' of " + bodyLength + " bytes");
    }
    overflow = new byte[bodyLength];
    System.arraycopy(standing, start, overflow, 0, trailing);
    mode = BufferMode.OVERFLOW;
    bytesRead = trailing;
  }

  private void compact(int start) {
    int trailing = bytesRead - start;
    if (start > 0 && trailing > 0) {
      System.arraycopy(standing, start, standing, 0, trailing);
    }
    bytesRead = trailing;
  }

  private void dispatch(byte[] buffer, int offset, int length) throws SQLException {
    MessageReader body = new MessageReader(buffer, offset, length);
    handler.handleMessage(tag, body);
    body.checkEnd("'" + tag + "'");
  }
}
