/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.values;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

import io.docvalue.DocValueTestBase;

import org.junit.Test;

/**
 * Tests the FieldValue types
 */
public class ValueTest extends DocValueTestBase {

    @Test
    public void testTypes() {
        assertEquals(FieldValue.Type.NULL, NullValue.getInstance().getType());
        assertEquals(FieldValue.Type.BOOLEAN,
                     BooleanValue.TRUE.getType());
        assertEquals(FieldValue.Type.INTEGER, new IntegerValue(1).getType());
        assertEquals(FieldValue.Type.DOUBLE, new DoubleValue(1).getType());
        assertEquals(FieldValue.Type.TIMESTAMP,
                     new TimestampValue(0, 0).getType());
        assertEquals(FieldValue.Type.STRING, new StringValue("s").getType());
        assertEquals(FieldValue.Type.BINARY,
                     new BinaryValue(new byte[0]).getType());
        assertEquals(FieldValue.Type.REFERENCE,
                     new ReferenceValue("c/d").getType());
        assertEquals(FieldValue.Type.GEO_POINT,
                     new GeoPointValue(1, 2).getType());
        assertEquals(FieldValue.Type.ARRAY, new ArrayValue().getType());
        assertEquals(FieldValue.Type.MAP, new MapValue().getType());

        assertTrue(new MapValue().isMap());
        assertFalse(new MapValue().isAtomic());
        assertTrue(new StringValue("s").isAtomic());
        assertTrue(NullValue.getInstance().isNull());
    }

    @Test(expected = ClassCastException.class)
    public void testBadCast() {
        new StringValue("s").asMap();
    }

    @Test(expected = ClassCastException.class)
    public void testBadAccessor() {
        new IntegerValue(1).getString();
    }

    @Test
    public void testIntegerNeverEqualsDouble() {
        assertNotEquals(new IntegerValue(1), new DoubleValue(1.0));
        assertNotEquals(new DoubleValue(1.0), new IntegerValue(1));
        assertEquals(new DoubleValue(Double.NaN), new DoubleValue(Double.NaN));
        assertNotEquals(new DoubleValue(0.0), new DoubleValue(-0.0));
    }

    @Test
    public void testMapEntries() {
        MapValue map = new MapValue()
            .put("a", 1)
            .put("b", "two")
            .put("c", true);
        assertEquals(3, map.size());
        assertEquals(FieldValue.Type.STRING, map.get("b").getType());
        assertNull(map.get("z"));
        assertTrue(map.contains("c"));
        assertFalse(map.contains("z"));

        /* overwrite keeps the position */
        map.put("a", 1.5);
        assertEquals(new DoubleValue(1.5), map.get("a"));
        Iterator<Map.Entry<String, FieldValue>> iter = map.iterator();
        assertEquals("a", iter.next().getKey());

        assertEquals(new StringValue("two"), map.remove("b"));
        assertNull(map.remove("b"));
        assertEquals("[a, c]", map.getNames().toString());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testMapIteratorIsReadOnly() {
        MapValue map = new MapValue().put("a", 1);
        map.iterator().next().setValue(new IntegerValue(2));
    }

    @Test
    public void testMapEqualityIgnoresOrder() {
        MapValue m1 = new MapValue().put("a", 1).put("b", 2);
        MapValue m2 = new MapValue().put("b", 2).put("a", 1);
        assertEquals(m1, m2);
        assertEquals(m1.hashCode(), m2.hashCode());
        assertEquals(m1.canonicalId(), m2.canonicalId());

        m2.put("c", 3);
        assertNotEquals(m1, m2);
        m1.put("c", "3");
        assertNotEquals(m1, m2);
    }

    @Test
    public void testArrayEqualityUsesOrder() {
        ArrayValue a1 = new ArrayValue().add(1).add(2);
        ArrayValue a2 = new ArrayValue().add(2).add(1);
        assertNotEquals(a1, a2);
        a2.set(0, new IntegerValue(1));
        a2.set(1, new IntegerValue(2));
        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());
    }

    @Test
    public void testDeepCopy() {
        MapValue inner = new MapValue().put("x", 1);
        ArrayValue array = new ArrayValue().add(inner);
        MapValue outer = new MapValue().put("arr", array).put("s", "str");

        MapValue copy = outer.copy();
        assertEquals(outer, copy);
        assertNotSame(outer.get("arr"), copy.get("arr"));
        assertNotSame(inner, copy.get("arr").asArray().get(0));
        /* atomic values may be shared */
        assertSame(outer.get("s"), copy.get("s"));

        inner.put("y", 2);
        array.add(3);
        assertEquals(1, copy.get("arr").asArray().get(0).asMap().size());
        assertEquals(1, copy.get("arr").asArray().size());
    }

    @Test
    public void testCanonicalId() {
        MapValue map = new MapValue()
            .put("b", 1)
            .put("a", new MapValue().put("d", true).put("c", "x"))
            .put("e", new ArrayValue().add(1.5).add(NullValue.getInstance()))
            .put("f", new byte[] {1, (byte) 0xab})
            .put("g", new TimestampValue(5, 7))
            .put("h", new ReferenceValue("coll/doc"))
            .put("i", new GeoPointValue(1.5, -2.0));
        assertEquals("{a:{c:x,d:true},b:1,e:[1.5,null],f:01AB," +
                     "g:time(5,7),h:coll/doc,i:geo(1.5,-2.0)}",
                     map.canonicalId());
        assertEquals("{}", new MapValue().canonicalId());
        assertEquals("[]", new ArrayValue().canonicalId());
    }

    @Test
    public void testTimestamp() {
        TimestampValue ts = new TimestampValue(1500L);
        assertEquals(1, ts.getSeconds());
        assertEquals(500000000, ts.getNanos());
        assertEquals("1970-01-01T00:00:01.500Z", ts.toIsoString());
        assertEquals("\"1970-01-01T00:00:01.500Z\"", ts.toJson());
        assertEquals(Instant.ofEpochSecond(1, 500000000), ts.toInstant());
        assertEquals(ts, new TimestampValue(ts.toInstant()));
        assertEquals(ts, new TimestampValue(1, 500000000));
        assertNotEquals(ts, new TimestampValue(1, 500000001));

        /* before the Epoch */
        TimestampValue before = new TimestampValue(-1L);
        assertEquals(-1, before.getSeconds());
        assertEquals(999000000, before.getNanos());

        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(0, 1000000000);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(0, -1);
            }
        });
    }

    @Test
    public void testTimestampRange() {
        TimestampValue min = new TimestampValue(TimestampValue.MIN_SECONDS, 0);
        assertEquals("0001-01-01T00:00:00Z", min.toIsoString());
        TimestampValue max =
            new TimestampValue(TimestampValue.MAX_SECONDS, 999999999);
        assertEquals("9999-12-31T23:59:59.999999999Z", max.toIsoString());
        assertEquals("\"9999-12-31T23:59:59.999999999Z\"", max.toJson());

        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(Long.MAX_VALUE, 0);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(TimestampValue.MAX_SECONDS + 1, 0);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(TimestampValue.MIN_SECONDS - 1, 999999999);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(Long.MIN_VALUE);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new TimestampValue(Instant.MAX);
            }
        });
    }

    @Test
    public void testGeoPoint() {
        GeoPointValue geo = new GeoPointValue(-90, 180);
        assertEquals(-90.0, geo.getLatitude(), 0);
        assertEquals(180.0, geo.getLongitude(), 0);
        assertEquals(geo, new GeoPointValue(-90, 180));

        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new GeoPointValue(90.5, 0);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new GeoPointValue(0, -180.5);
            }
        });
        expectThrows(IllegalArgumentException.class, new Runnable() {
            @Override
            public void run() {
                new GeoPointValue(Double.NaN, 0);
            }
        });
    }

    @Test
    public void testBinary() {
        byte[] bytes = new byte[] {1, 2, 3};
        BinaryValue bin = new BinaryValue(bytes);
        bytes[0] = 9;
        assertArrayEquals(new byte[] {1, 2, 3}, bin.getValue());
        assertEquals("\"AQID\"", bin.toJson());
        assertEquals("AQID", bin.toBase64());
        assertEquals(bin, new BinaryValue("AQID"));

        /* callers get their own copy */
        bin.getValue()[1] = 9;
        bin.getBinary()[2] = 9;
        assertArrayEquals(new byte[] {1, 2, 3}, bin.getValue());
        assertSame(bin, bin.copy());
    }

    @Test
    public void testNullArguments() {
        expectThrows(NullPointerException.class, new Runnable() {
            @Override
            public void run() {
                new MapValue().put(null, 1);
            }
        });
        expectThrows(NullPointerException.class, new Runnable() {
            @Override
            public void run() {
                new ArrayValue().add((FieldValue) null);
            }
        });
    }
}
