/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.pgcore.core.types.ConverterSupport.checkLength;
import static org.pgcore.core.types.ConverterSupport.checkMinLength;
import static org.pgcore.core.types.ConverterSupport.invalid;
import static org.pgcore.core.types.ConverterSupport.utf8;

import org.pgcore.util.GT;
import org.pgcore.util.PGCidr;
import org.pgcore.util.PGInet;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * Converters for inet and cidr.
 *
 * <p>Binary layout: family, prefix length, cidr flag and address length, one byte each, followed
 * by the address. The family is 2 for IPv4 and 3 for IPv6.</p>
 */
public final class NetworkConverters {

  public static final int PGSQL_AF_INET = 2;
  public static final int PGSQL_AF_INET6 = PGSQL_AF_INET + 1;

  private NetworkConverters() {
  }

  public static final TypeConverter INET_TEXT = (ctx, buf, off, len) -> parse(utf8(buf, off, len), false);

  public static final TypeConverter CIDR_TEXT = (ctx, buf, off, len) -> parse(utf8(buf, off, len), true);

  public static final TypeConverter INET_BINARY = (ctx, buf, off, len) -> decodeBinary(buf, off, len, false);

  public static final TypeConverter CIDR_BINARY = (ctx, buf, off, len) -> decodeBinary(buf, off, len, true);

  static PGInet decodeBinary(byte[] buf, int off, int len, boolean cidr) throws PSQLException {
    String typeName = cidr ? "cidr" : "inet";
    checkMinLength(typeName, len, 4);
    int family = buf[off] & 0xFF;
    int prefix = buf[off + 1] & 0xFF;
    int isCidr = buf[off + 2];
    int size = buf[off + 3] & 0xFF;
    if (isCidr != (cidr ? 1 : 0)) {
      throw new PSQLException(GT.tr("Wrong value {0} for cidr flag of {1} value", isCidr, typeName),
          PSQLState.DATA_ERROR);
    }
    if (family == PGSQL_AF_INET) {
      if (size != 4) {
        throw invalid(typeName, "address size " + size);
      }
      checkLength(typeName, len, 8);
    } else if (family == PGSQL_AF_INET6) {
      if (size != 16) {
        throw invalid(typeName, "address size " + size);
      }
      checkLength(typeName, len, 20);
    } else {
      throw invalid(typeName, "address family " + family);
    }
    byte[] addr = Arrays.copyOfRange(buf, off + 4, off + 4 + size);
    try {
      InetAddress address = family == PGSQL_AF_INET6
          ? Inet6Address.getByAddress(null, addr, null)
          : InetAddress.getByAddress(addr);
      return create(address, prefix, cidr, typeName);
    } catch (UnknownHostException e) {
      throw invalid(typeName, Arrays.toString(addr), e);
    }
  }

  /**
   * Parses {@code address[/prefix]}. Only numeric addresses are accepted, no name lookup happens.
   *
   * @param text the value
   * @param cidr whether a network value is expected
   * @return the value
   * @throws PSQLException on malformed input
   */
  static PGInet parse(String text, boolean cidr) throws PSQLException {
    String typeName = cidr ? "cidr" : "inet";
    int slash = text.indexOf('/');
    String host = slash < 0 ? text : text.substring(0, slash);
    if (host.isEmpty()) {
      throw invalid(typeName, text);
    }
    for (int i = 0; i < host.length(); i++) {
      char c = host.charAt(i);
      if (!(c == '.' || c == ':' || Character.digit(c, 16) >= 0)) {
        throw invalid(typeName, text);
      }
    }
    InetAddress address;
    try {
      address = InetAddress.getByName(host);
      if (host.indexOf(':') >= 0 && address instanceof Inet4Address) {
        // IPv4-mapped IPv6 literal, keep it an IPv6 value
        byte[] mapped = new byte[16];
        mapped[10] = (byte) 0xFF;
        mapped[11] = (byte) 0xFF;
        System.arraycopy(address.getAddress(), 0, mapped, 12, 4);
        address = Inet6Address.getByAddress(null, mapped, null);
      }
    } catch (UnknownHostException e) {
      throw invalid(typeName, text, e);
    }
    int prefix;
    try {
      prefix = slash < 0 ? PGInet.maxPrefix(address) : Integer.parseInt(text.substring(slash + 1));
    } catch (NumberFormatException e) {
      throw invalid(typeName, text, e);
    }
    return create(address, prefix, cidr, typeName);
  }

  private static PGInet create(InetAddress address, int prefix, boolean cidr, String typeName)
      throws PSQLException {
    try {
      return cidr ? new PGCidr(address, prefix) : new PGInet(address, prefix);
    } catch (IllegalArgumentException e) {
      throw new PSQLException(GT.tr("Invalid {0} value: {1}", typeName, e.getMessage()), PSQLState.DATA_ERROR, e);
    }
  }
}
