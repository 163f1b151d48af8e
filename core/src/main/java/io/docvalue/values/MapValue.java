/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A map from string keys to values; a document root is always a MapValue.
 * <p>
 * Entries are kept in a sequence, in insertion order, with no duplicate
 * keys. A new key appends an entry, an existing key has its value
 * replaced in place, and removing an entry shifts the later entries down
 * keeping their relative order. Lookup is a linear scan of the entries at
 * this level.
 * <p>
 * Entry order is deterministic but not significant: maps holding the same
 * keys with equal values are equal whatever their order.
 * <p>
 * Values are stored as given. A container must not be held by two
 * containers at once; see {@link FieldValue#copy}.
 */
public class MapValue extends FieldValue
    implements Iterable<Map.Entry<String, FieldValue>> {

    private final List<Entry> entries;

    public MapValue() {
        entries = new ArrayList<Entry>();
    }

    /**
     * @param capacity the initial capacity
     */
    public MapValue(int capacity) {
        entries = new ArrayList<Entry>(capacity);
    }

    @Override
    public Type getType() {
        return Type.MAP;
    }

    /**
     * Returns a read-only iterator over the entries in entry order. The
     * entries do not support setValue; use {@link #put}.
     */
    @Override
    public Iterator<Map.Entry<String, FieldValue>> iterator() {
        return Collections.<Map.Entry<String, FieldValue>>
            unmodifiableList(entries).iterator();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @param name the key
     * @return the live value for the key, or null if there is none
     */
    public FieldValue get(String name) {
        requireNonNull(name, "MapValue.get: name must be non-null");
        int index = indexOf(name);
        return (index < 0 ? null : entries.get(index).value);
    }

    public boolean contains(String name) {
        requireNonNull(name, "MapValue.contains: name must be non-null");
        return indexOf(name) >= 0;
    }

    /**
     * Sets the value for a key. An existing entry keeps its position;
     * otherwise a new entry is appended.
     *
     * @param name the key
     * @param value the value
     * @return this
     */
    public MapValue put(String name, FieldValue value) {
        requireNonNull(name, "MapValue.put: name must be non-null");
        requireNonNull(value, "MapValue.put: value must be non-null");
        int index = indexOf(name);
        if (index < 0) {
            entries.add(new Entry(name, value));
        } else {
            entries.get(index).value = value;
        }
        return this;
    }

    public MapValue put(String name, long value) {
        return put(name, new IntegerValue(value));
    }

    public MapValue put(String name, double value) {
        return put(name, new DoubleValue(value));
    }

    public MapValue put(String name, String value) {
        return put(name, new StringValue(value));
    }

    public MapValue put(String name, boolean value) {
        return put(name, BooleanValue.valueOf(value));
    }

    public MapValue put(String name, byte[] value) {
        return put(name, new BinaryValue(value));
    }

    /**
     * Removes the entry for a key, if present.
     *
     * @param name the key
     * @return the removed value, or null if there was none
     */
    public FieldValue remove(String name) {
        requireNonNull(name, "MapValue.remove: name must be non-null");
        int index = indexOf(name);
        return (index < 0 ? null : entries.remove(index).value);
    }

    /**
     * @return a new list of the keys, in entry order
     */
    public List<String> getNames() {
        List<String> names = new ArrayList<String>(entries.size());
        for (Entry e : entries) {
            names.add(e.key);
        }
        return names;
    }

    private int indexOf(String name) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).key.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public MapValue copy() {
        MapValue copy = new MapValue(entries.size());
        for (Entry e : entries) {
            copy.entries.add(new Entry(e.key, e.value.copy()));
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof MapValue)) {
            return false;
        }
        MapValue otherMap = (MapValue) other;
        if (size() != otherMap.size()) {
            return false;
        }
        for (Entry e : entries) {
            if (!e.value.equals(otherMap.get(e.key))) {
                return false;
            }
        }
        return true;
    }

    /* summed, so the hash does not depend on entry order */
    @Override
    public int hashCode() {
        int h = 0;
        for (Entry e : entries) {
            h += e.hashCode();
        }
        return h;
    }

    private static final class Entry
        implements Map.Entry<String, FieldValue> {

        private final String key;
        private FieldValue value;

        Entry(String key, FieldValue value) {
            this.key = key;
            this.value = value;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public FieldValue getValue() {
            return value;
        }

        @Override
        public FieldValue setValue(FieldValue newValue) {
            throw new UnsupportedOperationException(
                "MapValue entries are modified using MapValue.put");
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Map.Entry)) {
                return false;
            }
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) other;
            return key.equals(e.getKey()) && value.equals(e.getValue());
        }

        @Override
        public int hashCode() {
            return key.hashCode() ^ value.hashCode();
        }

        @Override
        public String toString() {
            return key + "=" + value;
        }
    }
}
