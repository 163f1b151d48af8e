/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.values;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.docvalue.DocValueTestBase;
import io.docvalue.JsonParseException;

import org.junit.Test;

/**
 * Tests JSON input and output of values
 */
public class JsonTest extends DocValueTestBase {

    @Test
    public void testParseTypes() {
        MapValue map = map("{'i': 5, 'd': 1.5, 'e': 2e3, 'b': true, " +
                           "'n': null, 's': 'x', 'a': [1, 'y'], 'm': {}, " +
                           "'big': 123456789012345678901234567890}");
        assertEquals(new IntegerValue(5), map.get("i"));
        assertEquals(new DoubleValue(1.5), map.get("d"));
        assertEquals(new DoubleValue(2000), map.get("e"));
        assertEquals(BooleanValue.TRUE, map.get("b"));
        assertTrue(map.get("n").isNull());
        assertEquals(new StringValue("x"), map.get("s"));
        assertEquals(new ArrayValue().add(1).add("y"), map.get("a"));
        assertEquals(new MapValue(), map.get("m"));
        assertEquals(FieldValue.Type.DOUBLE, map.get("big").getType());

        assertEquals(new IntegerValue(Long.MIN_VALUE),
                     FieldValue.fromJson("-9223372036854775808"));
        assertEquals(new StringValue("top"),
                     FieldValue.fromJson("\"top\""));
    }

    @Test
    public void testFieldOrderKept() {
        MapValue map = map("{'z': 1, 'a': 2, 'm': 3}");
        assertEquals("[z, a, m]", map.getNames().toString());
        assertEquals("{\"z\":1,\"a\":2,\"m\":3}", map.toJson());
        assertEquals(map.toJson(), map.toString());
    }

    @Test
    public void testDuplicateFieldOverwrites() {
        MapValue map = map("{'a': 1, 'b': 2, 'a': 3}");
        assertEquals("{\"a\":3,\"b\":2}", map.toJson());
    }

    @Test
    public void testRender() {
        MapValue map = new MapValue()
            .put("s", "a\"b\n")
            .put("r", new ReferenceValue("coll/doc"))
            .put("g", new GeoPointValue(1.5, 2))
            .put("t", new TimestampValue(0, 0))
            .put("n", NullValue.getInstance())
            .put("arr", new ArrayValue())
            .put("m", new MapValue());
        assertEquals("{\"s\":\"a\\\"b\\n\",\"r\":\"coll/doc\"," +
                     "\"g\":{\"latitude\":1.5,\"longitude\":2.0}," +
                     "\"t\":\"1970-01-01T00:00:00Z\",\"n\":null," +
                     "\"arr\":[],\"m\":{}}",
                     map.toJson());
    }

    @Test
    public void testRoundTrip() {
        String json = "{\"a\":[1,2.5,\"s\",null,true],\"b\":{\"c\":{}}}";
        FieldValue value = FieldValue.fromJson(json);
        assertEquals(json, value.toJson());
        assertEquals(value, FieldValue.fromJson(value.toJson()));
        assertEquals(value,
                     FieldValue.fromJson("{ \"b\" : {\"c\": {}},\n" +
                                         "  \"a\" : [1, 2.5, \"s\", null, true] }"));
        assertNotEquals(FieldValue.fromJson("{\"x\": 1}"),
                        FieldValue.fromJson("{\"x\": 1.0}"));
    }

    @Test
    public void testNonFiniteDoubles() {
        MapValue map = new MapValue()
            .put("n", Double.NaN)
            .put("p", Double.POSITIVE_INFINITY)
            .put("m", Double.NEGATIVE_INFINITY);
        String json = map.toJson();
        assertEquals("{\"n\":NaN,\"p\":Infinity,\"m\":-Infinity}", json);
        assertEquals(map, FieldValue.fromJson(json));
        assertEquals(new DoubleValue(Double.NaN), FieldValue.fromJson("NaN"));
        assertEquals(new ArrayValue().add(Double.NEGATIVE_INFINITY),
                     FieldValue.fromJson("[-Infinity]"));
    }

    @Test
    public void testParseErrors() {
        assertParseError("{\"a\": 1");
        assertParseError("{\"a\" 1}");
        assertParseError("[1, 2");
        assertParseError("");
        assertParseError("{\"a\": tru}");
        assertParseError("{\"a\": 'x'}");
        assertParseError("{\"a\": 1 /* one */}");
        assertParseError("{} {}");
        assertParseError("[1] x");

        try {
            FieldValue.fromJson("{\n\"a\": @}");
            fail("Expected JsonParseException");
        } catch (JsonParseException jpe) {
            assertEquals(2, jpe.getLine());
            assertTrue(jpe.getColumn() > 0);
            assertTrue(jpe.toString().contains("line 2"));
        }
    }

    private static void assertParseError(final String json) {
        expectThrows(JsonParseException.class, new Runnable() {
            @Override
            public void run() {
                FieldValue.fromJson(json);
            }
        });
    }
}
