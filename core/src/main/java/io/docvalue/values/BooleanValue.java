/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * A true or false value. There are exactly two instances, {@link #TRUE}
 * and {@link #FALSE}.
 */
public final class BooleanValue extends FieldValue {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    private final boolean value;

    private BooleanValue(boolean value) {
        this.value = value;
    }

    /**
     * @param value the boolean
     * @return {@link #TRUE} or {@link #FALSE}
     */
    public static BooleanValue valueOf(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Type getType() {
        return Type.BOOLEAN;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BooleanValue &&
            ((BooleanValue) other).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
