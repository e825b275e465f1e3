/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

/**
 * An asynchronous NOTIFY delivered by the server.
 */
public class Notification {
  private final int pid;
  private final String channel;
  private final String payload;

  public Notification(int pid, String channel, String payload) {
    this.pid = pid;
    this.channel = channel;
    this.payload = payload;
  }

  /**
   * @return process id of the notifying backend
   */
  public int getPid() {
    return pid;
  }

  public String getChannel() {
    return channel;
  }

  public String getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return "Notification(" + pid + ", " + channel + ", " + payload + ")";
  }
}
