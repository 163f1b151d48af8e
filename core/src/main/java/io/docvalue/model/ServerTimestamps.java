/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.model;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.Map;

import io.docvalue.values.FieldValue;
import io.docvalue.values.MapValue;
import io.docvalue.values.TimestampValue;

/**
 * Functions for the pending server timestamp sentinel. A field written with
 * a server timestamp holds a small map until the server assigns the real
 * time:
 * <pre>
 *   {
 *     "__type__" : "server_timestamp",
 *     "__local_write_time__" : timestamp of the local write,
 *     "__previous_value__" : value before the write (optional)
 *   }
 * </pre>
 */
public final class ServerTimestamps {

    public static final String TYPE_KEY = "__type__";
    public static final String SERVER_TIMESTAMP_SENTINEL = "server_timestamp";
    public static final String LOCAL_WRITE_TIME_KEY = "__local_write_time__";
    public static final String PREVIOUS_VALUE_KEY = "__previous_value__";

    /* a sentinel has the type entry plus at most two companions */
    private static final int MAX_SENTINEL_ENTRIES = 3;

    private ServerTimestamps() {
    }

    /**
     * Returns true if the value is a pending server timestamp. The check
     * rejects anything that is not a map of at most three entries, then
     * looks for the type entry.
     *
     * @param value the value to test
     * @return true if the value is a server timestamp sentinel
     */
    public static boolean isServerTimestamp(FieldValue value) {
        if (value == null || !value.isMap()) {
            return false;
        }
        MapValue map = value.asMap();
        if (map.size() > MAX_SENTINEL_ENTRIES) {
            return false;
        }
        for (Map.Entry<String, FieldValue> entry : map) {
            if (TYPE_KEY.equals(entry.getKey())) {
                FieldValue type = entry.getValue();
                return type.isString() &&
                    SERVER_TIMESTAMP_SENTINEL.equals(type.getString());
            }
        }
        return false;
    }

    /**
     * Returns the local write time held by a server timestamp sentinel. The
     * caller must have checked the value with {@link #isServerTimestamp}.
     *
     * @param value a server timestamp sentinel
     * @return the local write time
     *
     * @throws IllegalStateException if the value has no local write time
     */
    public static FieldValue getLocalWriteTime(FieldValue value) {
        FieldValue time = findEntry(value, LOCAL_WRITE_TIME_KEY);
        if (time == null) {
            throw new IllegalStateException("LocalWriteTime not found");
        }
        return time;
    }

    /**
     * Returns the value the field held before the server timestamp was
     * written, or null if none was recorded. The caller must have checked
     * the value with {@link #isServerTimestamp}.
     *
     * @param value a server timestamp sentinel
     * @return the previous value or null
     */
    public static FieldValue getPreviousValue(FieldValue value) {
        return findEntry(value, PREVIOUS_VALUE_KEY);
    }

    /**
     * Creates a server timestamp sentinel. If the previous value is itself
     * a sentinel its own previous value is recorded instead, so sentinels
     * never nest.
     *
     * @param localWriteTime the time of the local write
     * @param previousValue the value the field held before, or null
     * @return the sentinel
     */
    public static MapValue create(TimestampValue localWriteTime,
                                  FieldValue previousValue) {
        requireNonNull(localWriteTime,
                       "ServerTimestamps.create: localWriteTime must be " +
                       "non-null");
        MapValue sentinel = new MapValue(MAX_SENTINEL_ENTRIES);
        sentinel.put(TYPE_KEY, SERVER_TIMESTAMP_SENTINEL);
        sentinel.put(LOCAL_WRITE_TIME_KEY, localWriteTime);

        FieldValue previous = previousValue;
        if (previous != null && isServerTimestamp(previous)) {
            previous = getPreviousValue(previous);
        }
        if (previous != null) {
            sentinel.put(PREVIOUS_VALUE_KEY, previous.copy());
        }
        return sentinel;
    }

    private static FieldValue findEntry(FieldValue value, String key) {
        requireNonNull(value, "ServerTimestamps: value must be non-null");
        if (!value.isMap()) {
            return null;
        }
        for (Map.Entry<String, FieldValue> entry : value.asMap()) {
            if (key.equals(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
