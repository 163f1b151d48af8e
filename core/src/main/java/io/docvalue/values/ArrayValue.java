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

/**
 * An ordered list of values, indexed from zero. Arrays are leaves for
 * field paths: a path addresses map entries only and never descends into
 * an array.
 * <p>
 * Values are stored as given. A container must not be held by two
 * containers at once; see {@link FieldValue#copy}.
 */
public class ArrayValue extends FieldValue implements Iterable<FieldValue> {

    private final List<FieldValue> elements = new ArrayList<FieldValue>();

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    public int size() {
        return elements.size();
    }

    /**
     * @param index the index
     * @return the live element at the index
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public FieldValue get(int index) {
        return elements.get(index);
    }

    /**
     * Appends a value.
     *
     * @param value the value
     * @return this
     */
    public ArrayValue add(FieldValue value) {
        requireNonNull(value, "ArrayValue.add: value must be non-null");
        elements.add(value);
        return this;
    }

    public ArrayValue add(long value) {
        return add(new IntegerValue(value));
    }

    public ArrayValue add(double value) {
        return add(new DoubleValue(value));
    }

    public ArrayValue add(String value) {
        return add(new StringValue(value));
    }

    public ArrayValue add(boolean value) {
        return add(BooleanValue.valueOf(value));
    }

    /**
     * Replaces the element at the index.
     *
     * @param index the index
     * @param value the new value
     * @return the replaced element
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public FieldValue set(int index, FieldValue value) {
        requireNonNull(value, "ArrayValue.set: value must be non-null");
        return elements.set(index, value);
    }

    /**
     * Returns a read-only iterator over the elements.
     */
    @Override
    public Iterator<FieldValue> iterator() {
        return Collections.unmodifiableList(elements).iterator();
    }

    @Override
    public ArrayValue copy() {
        ArrayValue copy = new ArrayValue();
        for (FieldValue element : elements) {
            copy.elements.add(element.copy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ArrayValue &&
            elements.equals(((ArrayValue) other).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
