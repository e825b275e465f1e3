/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

/**
 * Big-endian reads and writes of fixed width values in byte arrays, the byte order of
 * every integer on the wire.
 */
public class ByteConverter {

  private ByteConverter() {
    // prevent instantiation of static helper class
  }

  public static long int8(byte[] bytes, int idx) {
    return ((long) (bytes[idx] & 255) << 56)
        | ((long) (bytes[idx + 1] & 255) << 48)
        | ((long) (bytes[idx + 2] & 255) << 40)
        | ((long) (bytes[idx + 3] & 255) << 32)
        | ((long) (bytes[idx + 4] & 255) << 24)
        | ((long) (bytes[idx + 5] & 255) << 16)
        | ((long) (bytes[idx + 6] & 255) << 8)
        | (bytes[idx + 7] & 255);
  }

  public static int int4(byte[] bytes, int idx) {
    return ((bytes[idx] & 255) << 24)
        | ((bytes[idx + 1] & 255) << 16)
        | ((bytes[idx + 2] & 255) << 8)
        | (bytes[idx + 3] & 255);
  }

  /**
   * Parses an unsigned 32 bit value, such as an OID.
   *
   * @param bytes the source array
   * @param idx start of the value
   * @return the value widened to long
   */
  public static long uint4(byte[] bytes, int idx) {
    return int4(bytes, idx) & 0xFFFFFFFFL;
  }

  public static short int2(byte[] bytes, int idx) {
    return (short) (((bytes[idx] & 255) << 8) | (bytes[idx + 1] & 255));
  }

  public static int uint2(byte[] bytes, int idx) {
    return ((bytes[idx] & 255) << 8) | (bytes[idx + 1] & 255);
  }

  public static float float4(byte[] bytes, int idx) {
    return Float.intBitsToFloat(int4(bytes, idx));
  }

  public static double float8(byte[] bytes, int idx) {
    return Double.longBitsToDouble(int8(bytes, idx));
  }

  public static void int8(byte[] target, int idx, long value) {
    target[idx] = (byte) (value >>> 56);
    target[idx + 1] = (byte) (value >>> 48);
    target[idx + 2] = (byte) (value >>> 40);
    target[idx + 3] = (byte) (value >>> 32);
    target[idx + 4] = (byte) (value >>> 24);
    target[idx + 5] = (byte) (value >>> 16);
    target[idx + 6] = (byte) (value >>> 8);
    target[idx + 7] = (byte) value;
  }

  public static void int4(byte[] target, int idx, int value) {
    target[idx] = (byte) (value >>> 24);
    target[idx + 1] = (byte) (value >>> 16);
    target[idx + 2] = (byte) (value >>> 8);
    target[idx + 3] = (byte) value;
  }

  /**
   * Encodes a 16 bit value. Both signed shorts and unsigned values up to 65535 are accepted;
   * only the low two bytes of {@code value} are written.
   *
   * @param target the target array
   * @param idx start of the value
   * @param value the value to encode
   */
  public static void int2(byte[] target, int idx, int value) {
    target[idx] = (byte) (value >>> 8);
    target[idx + 1] = (byte) value;
  }

  public static void float4(byte[] target, int idx, float value) {
    int4(target, idx, Float.floatToRawIntBits(value));
  }

  public static void float8(byte[] target, int idx, double value) {
    int8(target, idx, Double.doubleToRawLongBits(value));
  }
}
