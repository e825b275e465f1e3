/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.types;

import org.pgcore.core.Format;
import org.pgcore.core.Oid;
import org.pgcore.range.RangeFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Static table of the built-in converters, keyed by type OID. Types without an entry decode as
 * text in text format and as raw bytes in binary format.
 */
public final class TypeRegistry {

  public static final ConverterPair FALLBACK = new ConverterPair(TextConverters.TEXT, TextConverters.BYTES);

  private static final Map<Integer, ConverterPair> CONVERTERS = new HashMap<Integer, ConverterPair>(160);

  static {
    ConverterPair text = new ConverterPair(TextConverters.TEXT, TextConverters.TEXT);
    ConverterPair int4 = new ConverterPair(NumericConverters.INT_TEXT, NumericConverters.INT4_BINARY);
    ConverterPair uint4 = new ConverterPair(NumericConverters.LONG_TEXT, NumericConverters.UINT4_BINARY);

    register(Oid.BOOL, Oid.BOOL_ARRAY, new ConverterPair(NumericConverters.BOOL_TEXT, NumericConverters.BOOL_BINARY));
    register(Oid.BYTEA, Oid.BYTEA_ARRAY, new ConverterPair(TextConverters.BYTEA_TEXT, TextConverters.BYTES));
    register(Oid.CHAR, Oid.CHAR_ARRAY, text);
    register(Oid.NAME, Oid.NAME_ARRAY, text);
    register(Oid.TEXT, Oid.TEXT_ARRAY, text);
    register(Oid.VARCHAR, Oid.VARCHAR_ARRAY, text);
    register(Oid.BPCHAR, Oid.BPCHAR_ARRAY, text);
    register(Oid.XML, Oid.XML_ARRAY, text);
    register(Oid.REGPROC, Oid.REGPROC_ARRAY, text);
    register(Oid.MONEY, Oid.MONEY_ARRAY, new ConverterPair(TextConverters.TEXT, TextConverters.BYTES));
    CONVERTERS.put(Oid.UNKNOWN, text);

    register(Oid.INT2, Oid.INT2_ARRAY, new ConverterPair(NumericConverters.INT_TEXT, NumericConverters.INT2_BINARY));
    register(Oid.INT4, Oid.INT4_ARRAY, int4);
    register(Oid.INT8, Oid.INT8_ARRAY, new ConverterPair(NumericConverters.LONG_TEXT, NumericConverters.INT8_BINARY));
    register(Oid.OID, Oid.OID_ARRAY, uint4);
    register(Oid.XID, Oid.XID_ARRAY, uint4);
    register(Oid.CID, Oid.CID_ARRAY, uint4);
    register(Oid.FLOAT4, Oid.FLOAT4_ARRAY,
        new ConverterPair(NumericConverters.FLOAT_TEXT, NumericConverters.FLOAT4_BINARY));
    register(Oid.FLOAT8, Oid.FLOAT8_ARRAY,
        new ConverterPair(NumericConverters.DOUBLE_TEXT, NumericConverters.FLOAT8_BINARY));
    register(Oid.NUMERIC, Oid.NUMERIC_ARRAY,
        new ConverterPair(NumericConverters.NUMERIC_TEXT, NumericConverters.NUMERIC_BINARY));

    register(Oid.UUID, Oid.UUID_ARRAY, new ConverterPair(TextConverters.UUID_TEXT, TextConverters.UUID_BINARY));
    register(Oid.JSON, Oid.JSON_ARRAY, new ConverterPair(TextConverters.JSON, TextConverters.JSON));
    register(Oid.JSONB, Oid.JSONB_ARRAY, new ConverterPair(TextConverters.JSONB_TEXT, TextConverters.JSONB_BINARY));

    register(Oid.DATE, Oid.DATE_ARRAY,
        new ConverterPair(DateTimeConverters.DATE_TEXT, DateTimeConverters.DATE_BINARY));
    register(Oid.TIME, Oid.TIME_ARRAY,
        new ConverterPair(DateTimeConverters.TIME_TEXT, DateTimeConverters.TIME_BINARY));
    register(Oid.TIMETZ, Oid.TIMETZ_ARRAY,
        new ConverterPair(DateTimeConverters.TIMETZ_TEXT, DateTimeConverters.TIMETZ_BINARY));
    register(Oid.TIMESTAMP, Oid.TIMESTAMP_ARRAY,
        new ConverterPair(DateTimeConverters.TIMESTAMP_TEXT, DateTimeConverters.TIMESTAMP_BINARY));
    register(Oid.TIMESTAMPTZ, Oid.TIMESTAMPTZ_ARRAY,
        new ConverterPair(DateTimeConverters.TIMESTAMPTZ_TEXT, DateTimeConverters.TIMESTAMPTZ_BINARY));
    register(Oid.INTERVAL, Oid.INTERVAL_ARRAY,
        new ConverterPair(DateTimeConverters.INTERVAL_TEXT, DateTimeConverters.INTERVAL_BINARY));

    register(Oid.INET, Oid.INET_ARRAY,
        new ConverterPair(NetworkConverters.INET_TEXT, NetworkConverters.INET_BINARY));
    register(Oid.CIDR, Oid.CIDR_ARRAY,
        new ConverterPair(NetworkConverters.CIDR_TEXT, NetworkConverters.CIDR_BINARY));

    // vectors are one dimensional arrays on the wire in binary format
    register(Oid.INT2VECTOR, Oid.INT2VECTOR_ARRAY, new ConverterPair(TextConverters.INT2VECTOR_TEXT,
        ArrayConverters.binary(Oid.INT2, NumericConverters.INT2_BINARY)));
    register(Oid.OIDVECTOR, Oid.OIDVECTOR_ARRAY, new ConverterPair(TextConverters.OIDVECTOR_TEXT,
        ArrayConverters.binary(Oid.OID, NumericConverters.UINT4_BINARY)));

    registerRange(Oid.INT4RANGE_ARRAY, Oid.INT4MULTIRANGE, Oid.INT4MULTIRANGE_ARRAY, RangeFactory.INT4, Oid.INT4);
    registerRange(Oid.INT8RANGE_ARRAY, Oid.INT8MULTIRANGE, Oid.INT8MULTIRANGE_ARRAY, RangeFactory.INT8, Oid.INT8);
    registerRange(Oid.NUMRANGE_ARRAY, Oid.NUMMULTIRANGE, Oid.NUMMULTIRANGE_ARRAY, RangeFactory.NUMERIC,
        Oid.NUMERIC);
    registerRange(Oid.DATERANGE_ARRAY, Oid.DATEMULTIRANGE, Oid.DATEMULTIRANGE_ARRAY, RangeFactory.DATE, Oid.DATE);
    registerRange(Oid.TSRANGE_ARRAY, Oid.TSMULTIRANGE, Oid.TSMULTIRANGE_ARRAY, RangeFactory.TIMESTAMP,
        Oid.TIMESTAMP);
    registerRange(Oid.TSTZRANGE_ARRAY, Oid.TSTZMULTIRANGE, Oid.TSTZMULTIRANGE_ARRAY, RangeFactory.TIMESTAMPTZ,
        Oid.TIMESTAMPTZ);
  }

  private TypeRegistry() {
  }

  private static void register(int oid, int arrayOid, ConverterPair pair) {
    CONVERTERS.put(oid, pair);
    CONVERTERS.put(arrayOid, arrayOf(oid, pair));
  }

  private static void registerRange(int rangeArrayOid, int multirangeOid, int multirangeArrayOid,
      RangeFactory factory, int elementOid) {
    ConverterPair element = CONVERTERS.get(elementOid);
    int rangeOid = factory.getRangeOid();
    ConverterPair range = new ConverterPair(RangeConverters.text(element.getText(), factory),
        RangeConverters.binary(element.getBinary(), factory));
    ConverterPair multirange = new ConverterPair(
        MultirangeConverters.text(multirangeOid, element.getText(), factory),
        MultirangeConverters.binary(multirangeOid, element.getBinary(), factory));
    CONVERTERS.put(rangeOid, range);
    CONVERTERS.put(rangeArrayOid, arrayOf(rangeOid, range));
    CONVERTERS.put(multirangeOid, multirange);
    CONVERTERS.put(multirangeArrayOid, arrayOf(multirangeOid, multirange));
  }

  /**
   * Builds the array converters for an element type.
   *
   * @param elementOid OID of the element type
   * @param element converters of the element type
   * @return converters for the array type
   */
  public static ConverterPair arrayOf(int elementOid, ConverterPair element) {
    return new ConverterPair(ArrayConverters.text(element.getText(), ','),
        ArrayConverters.binary(elementOid, element.getBinary()));
  }

  /**
   * @param oid type OID
   * @return the registered converters, or {@link #FALLBACK} for unknown types
   */
  public static ConverterPair get(int oid) {
    ConverterPair pair = CONVERTERS.get(oid);
    return pair != null ? pair : FALLBACK;
  }

  public static boolean isKnown(int oid) {
    return CONVERTERS.containsKey(oid);
  }

  public static TypeConverter get(int oid, Format format) {
    return get(oid).get(format);
  }
}
