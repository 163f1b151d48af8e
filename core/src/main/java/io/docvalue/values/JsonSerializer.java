/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import com.fasterxml.jackson.core.io.CharTypes;

/**
 * Renders a value as compact JSON. Types JSON lacks are written as a
 * string (timestamps in ISO 8601, binary in Base64, references as their
 * path) or, for geo points, as a latitude/longitude object. Non-finite
 * doubles are written as the bare tokens NaN, Infinity and -Infinity.
 */
final class JsonSerializer extends TextSerializer {

    @Override
    protected void appendKey(String key) {
        appendQuoted(key);
    }

    @Override
    public void stringValue(String value) {
        appendQuoted(value);
    }

    @Override
    public void binaryValue(byte[] byteArray) {
        appendQuoted(BinaryValue.encodeBase64(byteArray));
    }

    @Override
    public void timestampValue(TimestampValue timestamp) {
        appendQuoted(timestamp.toIsoString());
    }

    @Override
    public void referenceValue(String path) {
        appendQuoted(path);
    }

    @Override
    public void geoPointValue(double latitude, double longitude) {
        sb.append("{\"latitude\":").append(latitude)
            .append(",\"longitude\":").append(longitude).append('}');
    }

    private void appendQuoted(String s) {
        sb.append('"');
        CharTypes.appendQuoted(sb, s);
        sb.append('"');
    }
}
