/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

import java.io.Serializable;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Objects;

/**
 * An inet value: a host address with an optional netmask length.
 */
public class PGInet implements SqlTextValue, Serializable {

  private static final long serialVersionUID = 1L;

  protected final InetAddress address;
  protected final int prefixLength;

  public PGInet(InetAddress address) {
    this(address, maxPrefix(address));
  }

  public PGInet(InetAddress address, int prefixLength) {
    if (address == null) {
      throw new IllegalArgumentException("address is null");
    }
    if (prefixLength < 0 || prefixLength > maxPrefix(address)) {
      throw new IllegalArgumentException(
          GT.tr("Invalid prefix length {0} for {1}", prefixLength, address.getHostAddress()));
    }
    this.address = address;
    this.prefixLength = prefixLength;
  }

  public static int maxPrefix(InetAddress address) {
    return address instanceof Inet4Address ? 32 : 128;
  }

  public InetAddress getAddress() {
    return address;
  }

  public int getPrefixLength() {
    return prefixLength;
  }

  @Override
  public String toSqlText() {
    if (prefixLength == maxPrefix(address)) {
      return address.getHostAddress();
    }
    return address.getHostAddress() + "/" + prefixLength;
  }

  @Override
  public int getSqlOid() {
    return Oid.INET;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    PGInet other = (PGInet) o;
    return prefixLength == other.prefixLength && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, prefixLength);
  }

  @Override
  public String toString() {
    return toSqlText();
  }
}
