/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.Arrays;

import com.fasterxml.jackson.core.Base64Variants;

/**
 * A byte array value. The bytes are copied on construction and on every
 * read, so a BinaryValue is immutable like the other atomic values. JSON
 * has no binary type; the JSON form is a Base64 string.
 */
public final class BinaryValue extends FieldValue {

    private final byte[] value;

    /**
     * @param value the bytes, copied
     */
    public BinaryValue(byte[] value) {
        requireNonNull(value, "BinaryValue: value must be non-null");
        this.value = value.clone();
    }

    /**
     * @param base64 the bytes in Base64
     * @throws IllegalArgumentException if the string is not valid Base64
     */
    public BinaryValue(String base64) {
        requireNonNull(base64, "BinaryValue: base64 must be non-null");
        this.value = Base64Variants.getDefaultVariant().decode(base64);
    }

    @Override
    public Type getType() {
        return Type.BINARY;
    }

    /**
     * @return a copy of the bytes
     */
    public byte[] getValue() {
        return value.clone();
    }

    /**
     * @return the bytes in Base64
     */
    public String toBase64() {
        return encodeBase64(value);
    }

    static String encodeBase64(byte[] bytes) {
        return Base64Variants.getDefaultVariant().encode(bytes);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BinaryValue &&
            Arrays.equals(value, ((BinaryValue) other).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }
}
