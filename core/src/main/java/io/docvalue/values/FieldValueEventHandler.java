/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.values;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Receives a value as a sequence of events, one per atomic value plus
 * start/end events around maps, map entries and array elements. The
 * static {@link #generate} methods walk a value and send its events, so
 * a renderer only implements the events it cares about.
 * <p>
 * The map {"a": 1, "b": []} produces:
 * <pre>
 *   startMap(2)
 *   startMapField("a")
 *   integerValue(1)
 *   endMapField("a")
 *   startMapField("b")
 *   startArray(0)
 *   endArray(0)
 *   endMapField("b")
 *   endMap(2)
 * </pre>
 * Array elements have no start event; each element is followed by
 * endArrayField(index).
 */
public interface FieldValueEventHandler {

    /**
     * Start a MapValue.
     * @param size the number of entries in the map
     */
    default void startMap(int size) {}

    /**
     * Start an ArrayValue.
     * @param size the number of entries in the array
     */
    default void startArray(int size) {}

    /**
     * End a MapValue. The size is the same as for the start event.
     * @param size the number of entries in the map
     */
    default void endMap(int size) {}

    /**
     * End an ArrayValue.
     * @param size the number of entries in the array
     */
    default void endArray(int size) {}

    /**
     * Start an entry of a map. The entry value event follows.
     * @param key the key of the entry
     */
    default void startMapField(String key) {}

    /**
     * End an entry of a map.
     * @param key the key of the entry
     */
    default void endMapField(String key) {}

    /**
     * End an element of an array. Array elements have no start event;
     * this one lets a handler write separators.
     * @param index the index of the element
     */
    default void endArrayField(int index) {}

    default void booleanValue(boolean value) {}

    default void binaryValue(byte[] byteArray) {}

    default void stringValue(String value) {}

    default void integerValue(long value) {}

    default void doubleValue(double value) {}

    default void timestampValue(TimestampValue timestamp) {}

    /**
     * A document reference.
     * @param path the slash separated path of the referenced document
     */
    default void referenceValue(String path) {}

    default void geoPointValue(double latitude, double longitude) {}

    default void nullValue() {}

    /**
     * Sends the events for a value to the handler. Map entries are visited
     * in entry order.
     *
     * @param value the value
     * @param handler the handler
     */
    public static void generate(FieldValue value,
                                FieldValueEventHandler handler) {
        generate(value, handler, false);
    }

    /**
     * Sends the events for a value to the handler.
     *
     * @param value the value
     * @param handler the handler
     * @param sortKeys if true map entries, at every level, are visited in
     * key order rather than entry order
     */
    public static void generate(FieldValue value,
                                FieldValueEventHandler handler,
                                boolean sortKeys) {

        FieldValue.Type type = value.getType();
        switch (type) {
            case MAP:
                generateForMap(value.asMap(), handler, sortKeys);
                break;
            case ARRAY:
                generateForArray(value.asArray(), handler, sortKeys);
                break;
            case STRING:
                handler.stringValue(value.getString());
                break;
            case INTEGER:
                handler.integerValue(value.getLong());
                break;
            case DOUBLE:
                handler.doubleValue(value.getDouble());
                break;
            case BOOLEAN:
                handler.booleanValue(value.getBoolean());
                break;
            case NULL:
                handler.nullValue();
                break;
            case TIMESTAMP:
                handler.timestampValue(value.asTimestamp());
                break;
            case BINARY:
                handler.binaryValue(value.getBinary());
                break;
            case REFERENCE:
                handler.referenceValue(value.asReference().getPath());
                break;
            case GEO_POINT:
                GeoPointValue point = value.asGeoPoint();
                handler.geoPointValue(point.getLatitude(),
                                      point.getLongitude());
                break;
            default:
                throw new IllegalStateException(
                    "FieldValueEventHandler: unknown type " + type);
        }
    }

    /**
     * Sends the events for a map, its entries included.
     *
     * @param map the map
     * @param handler the handler
     * @param sortKeys if true visit entries in key order
     */
    public static void generateForMap(MapValue map,
                                      FieldValueEventHandler handler,
                                      boolean sortKeys) {

        handler.startMap(map.size());
        if (sortKeys) {
            List<String> names = map.getNames();
            Collections.sort(names);
            for (String name : names) {
                handler.startMapField(name);
                generate(map.get(name), handler, true);
                handler.endMapField(name);
            }
        } else {
            for (Map.Entry<String, FieldValue> entry : map) {
                handler.startMapField(entry.getKey());
                generate(entry.getValue(), handler, false);
                handler.endMapField(entry.getKey());
            }
        }
        handler.endMap(map.size());
    }

    /**
     * Sends the events for an array, its elements included.
     *
     * @param array the array
     * @param handler the handler
     * @param sortKeys if true visit entries of nested maps in key order
     */
    public static void generateForArray(ArrayValue array,
                                        FieldValueEventHandler handler,
                                        boolean sortKeys) {

        handler.startArray(array.size());
        for (int i = 0; i < array.size(); i++) {
            generate(array.get(i), handler, sortKeys);
            handler.endArrayField(i);
        }
        handler.endArray(array.size());
    }
}
