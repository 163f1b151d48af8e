/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * Renders the canonical id of a value: map keys in sorted order (the
 * caller generates events with sorted keys), strings and keys unquoted,
 * binary as upper case hex, timestamps as time(seconds,nanos) and geo
 * points as geo(latitude,longitude).
 */
final class CanonicalIdSerializer extends TextSerializer {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    @Override
    protected void appendKey(String key) {
        sb.append(key);
    }

    @Override
    public void stringValue(String value) {
        sb.append(value);
    }

    @Override
    public void binaryValue(byte[] byteArray) {
        for (byte b : byteArray) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
    }

    @Override
    public void timestampValue(TimestampValue timestamp) {
        sb.append("time(").append(timestamp.getSeconds()).append(',')
            .append(timestamp.getNanos()).append(')');
    }

    @Override
    public void referenceValue(String path) {
        sb.append(path);
    }

    @Override
    public void geoPointValue(double latitude, double longitude) {
        sb.append("geo(").append(latitude).append(',')
            .append(longitude).append(')');
    }
}
