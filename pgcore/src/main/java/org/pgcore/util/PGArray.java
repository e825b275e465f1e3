/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.util;

import org.pgcore.core.Oid;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An array parameter with an explicit array type OID. Nested lists become nested dimensions.
 */
public class PGArray implements SqlTextValue {

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final int arrayOid;
  private final List<?> elements;

  public PGArray(int arrayOid, List<?> elements) {
    this.arrayOid = arrayOid;
    this.elements = Collections.unmodifiableList(elements);
  }

  public PGArray(int arrayOid, Object... elements) {
    this(arrayOid, Arrays.asList(elements));
  }

  public List<?> getElements() {
    return elements;
  }

  @Override
  public String toSqlText() {
    return toLiteral(elements);
  }

  @Override
  public int getSqlOid() {
    return arrayOid;
  }

  /**
   * Writes an array literal such as <code>{1,NULL,"a b"}</code>.
   *
   * @param elements the elements, nested lists or object arrays for further dimensions
   * @return the literal
   */
  public static String toLiteral(List<?> elements) {
    StringBuilder sb = new StringBuilder();
    appendList(sb, elements);
    return sb.toString();
  }

  private static void appendList(StringBuilder sb, List<?> elements) {
    sb.append('{');
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      appendElement(sb, elements.get(i));
    }
    sb.append('}');
  }

  private static void appendElement(StringBuilder sb, Object element) {
    if (element == null) {
      sb.append("NULL");
    } else if (element instanceof List) {
      appendList(sb, (List<?>) element);
    } else if (element instanceof Object[]) {
      appendList(sb, Arrays.asList((Object[]) element));
    } else {
      appendQuoted(sb, elementText(element));
    }
  }

  static String elementText(Object element) {
    if (element instanceof SqlTextValue) {
      return ((SqlTextValue) element).toSqlText();
    }
    if (element instanceof Boolean) {
      return ((Boolean) element) ? "t" : "f";
    }
    if (element instanceof byte[]) {
      byte[] bytes = (byte[]) element;
      char[] out = new char[2 + bytes.length * 2];
      out[0] = '\\';
      out[1] = 'x';
      for (int i = 0; i < bytes.length; i++) {
        out[2 + i * 2] = HEX[(bytes[i] >> 4) & 0xF];
        out[3 + i * 2] = HEX[bytes[i] & 0xF];
      }
      return new String(out);
    }
    return element.toString();
  }

  private static void appendQuoted(StringBuilder sb, String text) {
    if (!needsQuotes(text)) {
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

  private static boolean needsQuotes(String text) {
    if (text.isEmpty() || text.equalsIgnoreCase("NULL")) {
      return true;
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '{' || c == '}' || c == ',' || c == '"' || c == '\\' || Character.isWhitespace(c)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PGArray)) {
      return false;
    }
    PGArray other = (PGArray) o;
    return arrayOid == other.arrayOid && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(arrayOid, elements);
  }

  @Override
  public String toString() {
    return toSqlText();
  }
}
