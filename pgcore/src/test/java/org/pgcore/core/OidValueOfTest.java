/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core;

import org.pgcore.util.PSQLException;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;

@RunWith(Parameterized.class)
public class OidValueOfTest {
    @Parameterized.Parameter(0)
    public int expected;
    @Parameterized.Parameter(1)
    public String value;

    public static Object[][] types = new Object[][]{
            {0, "UNSPECIFIED"},
            {21, "INT2"},
            {1005, "INT2_ARRAY"},
            {23, "INT4"},
            {1007, "INT4_ARRAY"},
            {20, "INT8"},
            {1016, "INT8_ARRAY"},
            {25, "TEXT"},
            {1009, "TEXT_ARRAY"},
            {1700, "NUMERIC"},
            {1231, "NUMERIC_ARRAY"},
            {700, "FLOAT4"},
            {701, "FLOAT8"},
            {16, "BOOL"},
            {1082, "DATE"},
            {1083, "TIME"},
            {1266, "TIMETZ"},
            {1114, "TIMESTAMP"},
            {1184, "TIMESTAMPTZ"},
            {1186, "INTERVAL"},
            {17, "BYTEA"},
            {1043, "VARCHAR"},
            {26, "OID"},
            {869, "INET"},
            {650, "CIDR"},
            {2950, "UUID"},
            {114, "JSON"},
            {3802, "JSONB"},
            {3807, "JSONB_ARRAY"},
            {3904, "INT4RANGE"},
            {3926, "INT8RANGE"},
            {4451, "INT4MULTIRANGE"},
            {6157, "INT8MULTIRANGE_ARRAY"},
            {3904, "int4range"},
            {1700, "1700"},
            {-1, "4294967295"},
    };

    @Parameterized.Parameters(name = "expected={0}, value={1}")
    public static Iterable<Object[]> data() {
        return Arrays.asList(types);
    }

    @Test
    public void run() throws PSQLException {
        Assert.assertEquals(expected, Oid.valueOf(value));
    }
}
