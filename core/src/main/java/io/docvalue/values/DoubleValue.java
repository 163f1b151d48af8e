/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * A double precision number. Equality follows {@link Double#equals}: NaN
 * equals NaN, and 0.0 and -0.0 differ.
 */
public final class DoubleValue extends FieldValue {

    private final double value;

    public DoubleValue(double value) {
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.DOUBLE;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof DoubleValue &&
            Double.doubleToLongBits(((DoubleValue) other).value) ==
            Double.doubleToLongBits(value);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
