/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.core.Format;

/**
 * The text and binary converter of one type.
 */
public final class ConverterPair {
  private final TypeConverter text;
  private final TypeConverter binary;

  public ConverterPair(TypeConverter text, TypeConverter binary) {
    this.text = text;
    this.binary = binary;
  }

  public TypeConverter getText() {
    return text;
  }

  public TypeConverter getBinary() {
    return binary;
  }

  public TypeConverter get(Format format) {
    return format == Format.BINARY ? binary : text;
  }
}
