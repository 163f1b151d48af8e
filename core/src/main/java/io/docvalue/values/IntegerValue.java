/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * A signed 64-bit integer. An IntegerValue never equals a
 * {@link DoubleValue}, whatever the numbers.
 */
public final class IntegerValue extends FieldValue {

    private final long value;

    public IntegerValue(long value) {
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.INTEGER;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof IntegerValue &&
            ((IntegerValue) other).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }
}
