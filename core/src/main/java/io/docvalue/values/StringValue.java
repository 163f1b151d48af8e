/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

/**
 * A string value.
 */
public final class StringValue extends FieldValue {

    private final String value;

    public StringValue(String value) {
        requireNonNull(value, "StringValue: value must be non-null");
        this.value = value;
    }

    @Override
    public Type getType() {
        return Type.STRING;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StringValue &&
            value.equals(((StringValue) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
