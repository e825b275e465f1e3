/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

import java.net.InetAddress;

/**
 * A cidr value: a network address whose host bits are zero. Always printed with its prefix.
 */
public class PGCidr extends PGInet {

  private static final long serialVersionUID = 1L;

  public PGCidr(InetAddress network, int prefixLength) {
    super(network, prefixLength);
    byte[] bytes = network.getAddress();
    for (int bit = prefixLength; bit < bytes.length * 8; bit++) {
      if ((bytes[bit / 8] & (0x80 >>> (bit % 8))) != 0) {
        throw new IllegalArgumentException(
            GT.tr("Invalid cidr value {0}/{1}: bits set to right of mask", network.getHostAddress(),
                prefixLength));
      }
    }
  }

  @Override
  public String toSqlText() {
    return address.getHostAddress() + "/" + prefixLength;
  }

  @Override
  public int getSqlOid() {
    return Oid.CIDR;
  }
}
