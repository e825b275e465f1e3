/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.range;

import org.pgcore.util.GT;
import org.pgcore.util.SqlTextValue;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A range value with optional lower and upper bounds. A null bound is infinite.
 *
 * <p>Instances are normalized on construction: an infinite bound is always exclusive, discrete
 * types are put in {@code [)} form, and bounds that enclose no value collapse to the empty range.
 * A lower bound above the upper bound is rejected.</p>
 *
 * @param <T> the element type
 */
public abstract class PGRange<T extends Comparable<? super T>> implements SqlTextValue {

  private final T lower;
  private final T upper;
  private final boolean lowerInclusive;
  private final boolean upperInclusive;
  private final boolean empty;

  /**
   * Creates the empty range.
   */
  protected PGRange() {
    this.lower = null;
    this.upper = null;
    this.lowerInclusive = false;
    this.upperInclusive = false;
    this.empty = true;
  }

  /**
   * @param lower lower bound, null for unbounded
   * @param upper upper bound, null for unbounded
   * @param bounds two characters, {@code [} or {@code (} followed by {@code ]} or {@code )}
   * @param successor the next value for discrete types, null for continuous ones
   * @throws IllegalArgumentException on invalid bounds or lower greater than upper
   */
  protected PGRange(T lower, T upper, String bounds, UnaryOperator<T> successor) {
    if (bounds == null || bounds.length() != 2
        || "[(".indexOf(bounds.charAt(0)) < 0 || "])".indexOf(bounds.charAt(1)) < 0) {
      throw new IllegalArgumentException(GT.tr("Invalid range bounds: {0}", bounds));
    }
    boolean lowerInc = lower != null && bounds.charAt(0) == '[';
    boolean upperInc = upper != null && bounds.charAt(1) == ']';
    if (lower != null && upper != null && lower.compareTo(upper) > 0) {
      throw new IllegalArgumentException(
          GT.tr("Range lower bound must be less than or equal to range upper bound"));
    }
    if (successor != null) {
      if (lower != null && !lowerInc) {
        lower = successor.apply(lower);
        lowerInc = true;
      }
      if (upper != null && upperInc) {
        upper = successor.apply(upper);
        upperInc = false;
      }
    }
    boolean isEmpty = false;
    if (lower != null && upper != null) {
      int cmp = lower.compareTo(upper);
      isEmpty = cmp > 0 || (cmp == 0 && !(lowerInc && upperInc));
    }
    if (isEmpty) {
      this.lower = null;
      this.upper = null;
      this.lowerInclusive = false;
      this.upperInclusive = false;
    } else {
      this.lower = lower;
      this.upper = upper;
      this.lowerInclusive = lowerInc;
      this.upperInclusive = upperInc;
    }
    this.empty = isEmpty;
  }

  public T getLower() {
    return lower;
  }

  public T getUpper() {
    return upper;
  }

  public boolean isEmpty() {
    return empty;
  }

  public boolean isLowerInclusive() {
    return lowerInclusive;
  }

  public boolean isUpperInclusive() {
    return upperInclusive;
  }

  public boolean isLowerInfinite() {
    return !empty && lower == null;
  }

  public boolean isUpperInfinite() {
    return !empty && upper == null;
  }

  /**
   * @return the bounds in {@code [)} notation, null for the empty range
   */
  public String getBounds() {
    if (empty) {
      return null;
    }
    return (lowerInclusive ? "[" : "(") + (upperInclusive ? "]" : ")");
  }

  public boolean contains(T value) {
    if (empty || value == null) {
      return false;
    }
    if (lower != null) {
      int cmp = value.compareTo(lower);
      if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
        return false;
      }
    }
    if (upper != null) {
      int cmp = value.compareTo(upper);
      if (cmp > 0 || (cmp == 0 && !upperInclusive)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Text of one bound as accepted by the server's range input, unquoted.
   *
   * @param bound a non-null bound
   * @return its text
   */
  protected String boundText(T bound) {
    return bound.toString();
  }

  @Override
  public String toSqlText() {
    if (empty) {
      return "empty";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(lowerInclusive ? '[' : '(');
    if (lower != null) {
      appendBound(sb, boundText(lower));
    }
    sb.append(',');
    if (upper != null) {
      appendBound(sb, boundText(upper));
    }
    sb.append(upperInclusive ? ']' : ')');
    return sb.toString();
  }

  private static void appendBound(StringBuilder sb, String text) {
    boolean quote = text.isEmpty();
    for (int i = 0; i < text.length() && !quote; i++) {
      char c = text.charAt(i);
      quote = c == '"' || c == '\\' || c == ',' || c == '(' || c == ')' || c == '[' || c == ']'
          || Character.isWhitespace(c);
    }
    if (!quote) {
      sb.append(text);
      return;
    }
    sb.append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    sb.append('"');
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || o.getClass() != getClass()) {
      return false;
    }
    PGRange<?> other = (PGRange<?>) o;
    return empty == other.empty
        && lowerInclusive == other.lowerInclusive
        && upperInclusive == other.upperInclusive
        && Objects.equals(lower, other.lower)
        && Objects.equals(upper, other.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lower, upper, lowerInclusive, upperInclusive, empty);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + toSqlText();
  }
}
