/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.lang.reflect.Field;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provides constants for well-known backend OIDs for the types the codecs know about.
 */
public class Oid {

  private static Log LOGGER = Logger.getLogger(Oid.class.getName());

  public static final int UNSPECIFIED = 0;
  public static final int BOOL = 16;
  public static final int BOOL_ARRAY = 1000;
  public static final int BYTEA = 17;
  public static final int BYTEA_ARRAY = 1001;
  public static final int CHAR = 18;
  public static final int CHAR_ARRAY = 1002;
  public static final int NAME = 19;
  public static final int NAME_ARRAY = 1003;
  public static final int INT8 = 20;
  public static final int INT8_ARRAY = 1016;
  public static final int INT2 = 21;
  public static final int INT2_ARRAY = 1005;
  public static final int INT2VECTOR = 22;
  public static final int INT2VECTOR_ARRAY = 1006;
  public static final int INT4 = 23;
  public static final int INT4_ARRAY = 1007;
  public static final int REGPROC = 24;
  public static final int REGPROC_ARRAY = 1008;
  public static final int TEXT = 25;
  public static final int TEXT_ARRAY = 1009;
  public static final int OID = 26;
  public static final int OID_ARRAY = 1028;
  public static final int TID = 27;
  public static final int TID_ARRAY = 1010;
  public static final int XID = 28;
  public static final int XID_ARRAY = 1011;
  public static final int CID = 29;
  public static final int CID_ARRAY = 1012;
  public static final int OIDVECTOR = 30;
  public static final int OIDVECTOR_ARRAY = 1013;
  public static final int JSON = 114;
  public static final int JSON_ARRAY = 199;
  public static final int XML = 142;
  public static final int XML_ARRAY = 143;
  public static final int POINT = 600;
  public static final int POINT_ARRAY = 1017;
  public static final int CIDR = 650;
  public static final int CIDR_ARRAY = 651;
  public static final int FLOAT4 = 700;
  public static final int FLOAT4_ARRAY = 1021;
  public static final int FLOAT8 = 701;
  public static final int FLOAT8_ARRAY = 1022;
  public static final int UNKNOWN = 705;
  public static final int MONEY = 790;
  public static final int MONEY_ARRAY = 791;
  public static final int INET = 869;
  public static final int INET_ARRAY = 1041;
  public static final int BPCHAR = 1042;
  public static final int BPCHAR_ARRAY = 1014;
  public static final int VARCHAR = 1043;
  public static final int VARCHAR_ARRAY = 1015;
  public static final int DATE = 1082;
  public static final int DATE_ARRAY = 1182;
  public static final int TIME = 1083;
  public static final int TIME_ARRAY = 1183;
  public static final int TIMESTAMP = 1114;
  public static final int TIMESTAMP_ARRAY = 1115;
  public static final int TIMESTAMPTZ = 1184;
  public static final int TIMESTAMPTZ_ARRAY = 1185;
  public static final int INTERVAL = 1186;
  public static final int INTERVAL_ARRAY = 1187;
  public static final int TIMETZ = 1266;
  public static final int TIMETZ_ARRAY = 1270;
  public static final int NUMERIC = 1700;
  public static final int NUMERIC_ARRAY = 1231;
  public static final int VOID = 2278;
  public static final int UUID = 2950;
  public static final int UUID_ARRAY = 2951;
  public static final int JSONB = 3802;
  public static final int JSONB_ARRAY = 3807;

  public static final int INT4RANGE = 3904;
  public static final int INT4RANGE_ARRAY = 3905;
  public static final int NUMRANGE = 3906;
  public static final int NUMRANGE_ARRAY = 3907;
  public static final int TSRANGE = 3908;
  public static final int TSRANGE_ARRAY = 3909;
  public static final int TSTZRANGE = 3910;
  public static final int TSTZRANGE_ARRAY = 3911;
  public static final int DATERANGE = 3912;
  public static final int DATERANGE_ARRAY = 3913;
  public static final int INT8RANGE = 3926;
  public static final int INT8RANGE_ARRAY = 3927;

  public static final int INT4MULTIRANGE = 4451;
  public static final int NUMMULTIRANGE = 4532;
  public static final int TSMULTIRANGE = 4533;
  public static final int TSTZMULTIRANGE = 4534;
  public static final int DATEMULTIRANGE = 4535;
  public static final int INT8MULTIRANGE = 4536;
  public static final int INT4MULTIRANGE_ARRAY = 6150;
  public static final int NUMMULTIRANGE_ARRAY = 6151;
  public static final int TSMULTIRANGE_ARRAY = 6152;
  public static final int TSTZMULTIRANGE_ARRAY = 6153;
  public static final int DATEMULTIRANGE_ARRAY = 6155;
  public static final int INT8MULTIRANGE_ARRAY = 6157;

  private static final Map<Integer, String> OID_TO_NAME = new HashMap<Integer, String>(200);
  private static final Map<String, Integer> NAME_TO_OID = new HashMap<String, Integer>(200);
  private static final Map<String, Integer> TYPE_NAME_TO_OID = new HashMap<String, Integer>();

  static {
    for (Field field : Oid.class.getFields()) {
      try {
        int oid = field.getInt(null);
        String name = field.getName().toUpperCase(Locale.ROOT);
        OID_TO_NAME.put(oid, name);
        NAME_TO_OID.put(name, oid);
      } catch (IllegalAccessException e) {
        LOGGER.debug("Skipping OID constant " + field.getName(), e);
      }
    }
    // server side spellings that differ from the constant names
    TYPE_NAME_TO_OID.put("int2", INT2);
    TYPE_NAME_TO_OID.put("int4", INT4);
    TYPE_NAME_TO_OID.put("int8", INT8);
    TYPE_NAME_TO_OID.put("float4", FLOAT4);
    TYPE_NAME_TO_OID.put("float8", FLOAT8);
    TYPE_NAME_TO_OID.put("bool", BOOL);
    TYPE_NAME_TO_OID.put("json", JSON);
    TYPE_NAME_TO_OID.put("jsonb", JSONB);
    TYPE_NAME_TO_OID.put("xml", XML);
    TYPE_NAME_TO_OID.put("text", TEXT);
    TYPE_NAME_TO_OID.put("varchar", VARCHAR);
    TYPE_NAME_TO_OID.put("bpchar", BPCHAR);
    TYPE_NAME_TO_OID.put("uuid", UUID);
    TYPE_NAME_TO_OID.put("inet", INET);
    TYPE_NAME_TO_OID.put("cidr", CIDR);
    TYPE_NAME_TO_OID.put("money", MONEY);
    TYPE_NAME_TO_OID.put("interval", INTERVAL);
    TYPE_NAME_TO_OID.put("numeric", NUMERIC);
    TYPE_NAME_TO_OID.put("point", POINT);
  }

  private Oid() {
  }

  /**
   * Returns the name of the oid as string.
   *
   * @param oid The oid to convert to name.
   * @return The name of the oid or {@code "<unknown:oid>"} if oid no constant for oid value has
   *         been defined.
   */
  public static String toString(int oid) {
    String name = OID_TO_NAME.get(oid);
    if (name == null) {
      name = "<unknown:" + oid + ">";
    }
    return name;
  }

  /**
   * Resolves a constant name ({@code "INT4_ARRAY"}) or an unsigned decimal number.
   *
   * @param oid constant name or number
   * @return the OID as a (possibly negative) int
   * @throws PSQLException if neither form matches
   */
  public static int valueOf(String oid) throws PSQLException {
    if (oid.length() > 0 && !Character.isDigit(oid.charAt(0))) {
      Integer id = NAME_TO_OID.get(oid);
      if (id == null) {
        id = NAME_TO_OID.get(oid.toUpperCase(Locale.ROOT));
      }
      if (id != null) {
        return id;
      }
    } else {
      try {
        // OID are unsigned 32bit integers, so Integer.parseInt is not enough
        long value = Long.parseLong(oid);
        if (value <= 0xFFFFFFFFL) {
          return (int) value;
        }
      } catch (NumberFormatException ex) {
        LOGGER.debug("Not a numeric oid: " + oid);
      }
    }
    throw new PSQLException(GT.tr("oid type {0} not known and not a number", oid),
        PSQLState.INVALID_PARAMETER_VALUE);
  }

  /**
   * Looks up a server type name such as {@code "jsonb"} or {@code "int4range"}.
   *
   * @param typeName the type name, case insensitive
   * @return the OID or null when unknown
   */
  public static Integer forTypeName(String typeName) {
    String lower = typeName.toLowerCase(Locale.ROOT);
    Integer oid = TYPE_NAME_TO_OID.get(lower);
    if (oid == null) {
      oid = NAME_TO_OID.get(typeName.toUpperCase(Locale.ROOT));
    }
    return oid;
  }
}
