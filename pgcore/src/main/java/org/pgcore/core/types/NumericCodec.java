/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.util.ByteConverter;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Binary form of numeric: {@code ndigits, weight, sign, dscale} as 16 bit values followed by
 * {@code ndigits} base 10000 digits, most significant first. The value is
 * {@code sum(digit[i] * 10000^(weight - i))}, shown with {@code dscale} decimal places.
 */
public class NumericCodec {

  public static final int NUMERIC_POS = 0x0000;
  public static final int NUMERIC_NEG = 0x4000;
  public static final int NUMERIC_NAN = 0xC000;
  public static final int NUMERIC_PINF = 0xD000;
  public static final int NUMERIC_NINF = 0xF000;

  private static final int NUMERIC_DSCALE_MAX = 0x3FFF;
  private static final int NBASE = 10000;
  private static final int DEC_DIGITS = 4;
  private static final int HEADER_SIZE = 8;
  private static final BigInteger BI_NBASE = BigInteger.valueOf(NBASE);
  private static final int[] TEN_POWERS = {1, 10, 100, 1000, 10000};

  private NumericCodec() {
  }

  /**
   * Decodes a binary numeric.
   *
   * @param bytes source array
   * @param pos first byte of the value
   * @param numBytes value length, checked against the digit count of the header
   * @return a {@link BigDecimal}, or {@link Double#NaN} / {@link Double#POSITIVE_INFINITY} /
   *         {@link Double#NEGATIVE_INFINITY} for the special values
   * @throws PSQLException if the header, the length or a digit is invalid
   */
  public static Number decode(byte[] bytes, int pos, int numBytes) throws PSQLException {
    ConverterSupport.checkMinLength("numeric", numBytes, HEADER_SIZE);
    int ndigits = ByteConverter.uint2(bytes, pos);
    int weight = ByteConverter.int2(bytes, pos + 2);
    int sign = ByteConverter.uint2(bytes, pos + 4);
    int dscale = ByteConverter.uint2(bytes, pos + 6);
    ConverterSupport.checkLength("numeric", numBytes, HEADER_SIZE + ndigits * 2);

    switch (sign) {
      case NUMERIC_POS:
      case NUMERIC_NEG:
        break;
      case NUMERIC_NAN:
        return Double.NaN;
      case NUMERIC_PINF:
        return Double.POSITIVE_INFINITY;
      case NUMERIC_NINF:
        return Double.NEGATIVE_INFINITY;
      default:
        throw new PSQLException(GT.tr("Invalid sign 0x{0} in numeric value", Integer.toHexString(sign)),
            PSQLState.DATA_ERROR);
    }
    if (dscale > NUMERIC_DSCALE_MAX) {
      throw new PSQLException(GT.tr("Invalid scale {0} in numeric value", dscale), PSQLState.DATA_ERROR);
    }
    if (ndigits == 0) {
      return BigDecimal.ZERO.setScale(dscale);
    }

    // accumulate in a long while it cannot overflow, 4 groups are 16 decimal digits
    long unscaledLong = 0;
    BigInteger unscaled = null;
    int idx = pos + HEADER_SIZE;
    for (int i = 0; i < ndigits; i++, idx += 2) {
      int digit = ByteConverter.uint2(bytes, idx);
      if (digit >= NBASE) {
        throw new PSQLException(GT.tr("Invalid digit {0} in numeric value", digit), PSQLState.DATA_ERROR);
      }
      if (unscaled == null && i < 4) {
        unscaledLong = unscaledLong * NBASE + digit;
      } else {
        if (unscaled == null) {
          unscaled = BigInteger.valueOf(unscaledLong);
        }
        unscaled = unscaled.multiply(BI_NBASE).add(BigInteger.valueOf(digit));
      }
    }
    if (unscaled == null) {
      unscaled = BigInteger.valueOf(unscaledLong);
    }
    if (sign == NUMERIC_NEG) {
      unscaled = unscaled.negate();
    }
    int exponent = (weight + 1 - ndigits) * DEC_DIGITS;
    // digits past dscale can only be zero padding of the last group
    return new BigDecimal(unscaled, -exponent).setScale(dscale, RoundingMode.DOWN);
  }

  /**
   * Encodes a decimal in binary numeric form.
   *
   * @param value the value
   * @return the encoded bytes, or null when the scale or weight does not fit the binary form and
   *         the value has to be sent as text
   */
  public static byte[] encode(BigDecimal value) {
    int exponent = -value.scale();
    if (exponent < -NUMERIC_DSCALE_MAX) {
      return null;
    }
    int dscale = exponent > 0 ? 0 : -exponent;
    int sign = value.signum() < 0 ? NUMERIC_NEG : NUMERIC_POS;
    if (value.signum() == 0) {
      return header(0, 0, NUMERIC_POS, dscale);
    }

    String digits = value.unscaledValue().abs().toString();
    int intDigits = digits.length() + exponent;
    int groupsBefore = Math.floorDiv(intDigits, DEC_DIGITS);
    int partial = Math.floorMod(intDigits, DEC_DIGITS);
    int weight = groupsBefore + (partial != 0 ? 1 : 0) - 1;
    if (weight > Short.MAX_VALUE || weight < Short.MIN_VALUE) {
      return null;
    }

    // leading zeros so the decimal point falls on a group boundary
    int fill = partial != 0 ? DEC_DIGITS - partial : 0;
    int ndigits = (fill + digits.length() + DEC_DIGITS - 1) / DEC_DIGITS;
    if (ndigits > 0xFFFF) {
      return null;
    }
    byte[] out = header(ndigits, weight, sign, dscale);
    int group = 0;
    int inGroup = fill;
    int idx = HEADER_SIZE;
    for (int i = 0; i < digits.length(); i++) {
      group = group * 10 + (digits.charAt(i) - '0');
      inGroup++;
      if (inGroup == DEC_DIGITS) {
        ByteConverter.int2(out, idx, group);
        idx += 2;
        group = 0;
        inGroup = 0;
      }
    }
    if (inGroup > 0) {
      ByteConverter.int2(out, idx, group * TEN_POWERS[DEC_DIGITS - inGroup]);
    }
    return out;
  }

  /**
   * Encodes NaN or an infinity, the values {@link BigDecimal} cannot hold.
   *
   * @param value NaN or an infinite double
   * @return the 8 byte encoding
   * @throws IllegalArgumentException for finite values
   */
  public static byte[] encodeSpecial(double value) {
    if (Double.isNaN(value)) {
      return header(0, 0, NUMERIC_NAN, 0);
    }
    if (value == Double.POSITIVE_INFINITY) {
      return header(0, 0, NUMERIC_PINF, 0);
    }
    if (value == Double.NEGATIVE_INFINITY) {
      return header(0, 0, NUMERIC_NINF, 0);
    }
    throw new IllegalArgumentException(GT.tr("{0} is a finite value", value));
  }

  private static byte[] header(int ndigits, int weight, int sign, int dscale) {
    byte[] out = new byte[HEADER_SIZE + ndigits * 2];
    ByteConverter.int2(out, 0, ndigits);
    ByteConverter.int2(out, 2, weight);
    ByteConverter.int2(out, 4, sign);
    ByteConverter.int2(out, 6, dscale);
    return out;
  }
}
