/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.pgcore.util.PGCidr;
import org.pgcore.util.PGInet;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import org.junit.Test;

import java.net.Inet6Address;
import java.net.InetAddress;

public class NetworkConvertersTest {

  private static final DecodeContext CTX = DecodeContext.of(true, null);

  @Test
  public void inetText() throws Exception {
    PGInet inet = NetworkConverters.parse("192.168.1.5/24", false);
    assertEquals(InetAddress.getByName("192.168.1.5"), inet.getAddress());
    assertEquals(24, inet.getPrefixLength());
    assertEquals("192.168.1.5/24", inet.toSqlText());

    PGInet host = NetworkConverters.parse("10.0.0.1", false);
    assertEquals(32, host.getPrefixLength());
    assertEquals("10.0.0.1", host.toSqlText());
  }

  @Test
  public void inetTextIpv6() throws Exception {
    PGInet inet = NetworkConverters.parse("::1", false);
    assertEquals(InetAddress.getByName("::1"), inet.getAddress());
    assertEquals(128, inet.getPrefixLength());
  }

  @Test
  public void mappedIpv4StaysIpv6() throws Exception {
    PGInet inet = NetworkConverters.parse("::ffff:1.2.3.4", false);
    assertThat(inet.getAddress(), instanceOf(Inet6Address.class));
    assertEquals(128, inet.getPrefixLength());
  }

  @Test
  public void cidrText() throws Exception {
    PGInet cidr = NetworkConverters.parse("10.1.0.0/16", true);
    assertThat(cidr, instanceOf(PGCidr.class));
    assertEquals("10.1.0.0/16", cidr.toSqlText());
  }

  @Test
  public void cidrWithHostBitsIsRejected() {
    assertDataError("10.1.0.1/16", true);
  }

  @Test
  public void malformedText() {
    assertDataError("host.example", false);
    assertDataError("10.0.0.1/33", false);
    assertDataError("10.0.0.1/x", false);
    assertDataError("/8", false);
  }

  @Test
  public void inetBinary() throws Exception {
    byte[] bytes = {2, 24, 0, 4, (byte) 192, (byte) 168, 1, 5};
    Object value = NetworkConverters.INET_BINARY.decode(CTX, bytes, 0, bytes.length);
    assertEquals(NetworkConverters.parse("192.168.1.5/24", false), value);
  }

  @Test
  public void cidrBinaryIpv6() throws Exception {
    byte[] bytes = new byte[20];
    bytes[0] = 3;
    bytes[1] = 32;
    bytes[2] = 1;
    bytes[3] = 16;
    bytes[4] = 0x20;
    bytes[5] = 0x01;
    bytes[6] = 0x0d;
    bytes[7] = (byte) 0xb8;
    Object value = NetworkConverters.CIDR_BINARY.decode(CTX, bytes, 0, bytes.length);
    assertEquals(new PGCidr(InetAddress.getByName("2001:db8::"), 32), value);
  }

  @Test
  public void binaryFlagMustMatchType() {
    byte[] bytes = {2, 32, 1, 4, 10, 0, 0, 1};
    try {
      NetworkConverters.INET_BINARY.decode(CTX, bytes, 0, bytes.length);
      fail("cidr flag on an inet value must be rejected");
    } catch (Exception e) {
      assertThat(e, instanceOf(PSQLException.class));
      assertEquals(PSQLState.DATA_ERROR.getState(), ((PSQLException) e).getSQLState());
    }
  }

  @Test
  public void binaryAddressSizeMustMatchFamily() {
    byte[] bytes = {2, 32, 0, 16, 10, 0, 0, 1};
    try {
      NetworkConverters.INET_BINARY.decode(CTX, bytes, 0, bytes.length);
      fail("IPv4 family with 16 address bytes must be rejected");
    } catch (Exception e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), ((PSQLException) e).getSQLState());
    }
  }

  private static void assertDataError(String text, boolean cidr) {
    try {
      NetworkConverters.parse(text, cidr);
      fail("'" + text + "' must be rejected");
    } catch (PSQLException e) {
      assertEquals(PSQLState.DATA_ERROR.getState(), e.getSQLState());
    }
  }
}
