/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

/**
 * Writes the structure of a value (braces, brackets, key separators and
 * commas) into a string. Subclasses decide how keys and atomic values are
 * spelled.
 */
abstract class TextSerializer implements FieldValueEventHandler {

    protected final StringBuilder sb = new StringBuilder();

    /**
     * Appends a map key, without the separator that follows it.
     */
    protected abstract void appendKey(String key);

    @Override
    public void startMap(int size) {
        sb.append('{');
    }

    @Override
    public void endMap(int size) {
        dropTrailingComma(size);
        sb.append('}');
    }

    @Override
    public void startArray(int size) {
        sb.append('[');
    }

    @Override
    public void endArray(int size) {
        dropTrailingComma(size);
        sb.append(']');
    }

    @Override
    public void startMapField(String key) {
        appendKey(key);
        sb.append(':');
    }

    @Override
    public void endMapField(String key) {
        sb.append(',');
    }

    @Override
    public void endArrayField(int index) {
        sb.append(',');
    }

    @Override
    public void nullValue() {
        sb.append("null");
    }

    @Override
    public void booleanValue(boolean value) {
        sb.append(value);
    }

    @Override
    public void integerValue(long value) {
        sb.append(value);
    }

    @Override
    public void doubleValue(double value) {
        sb.append(value);
    }

    /* every element of a non-empty container is followed by a comma */
    private void dropTrailingComma(int size) {
        if (size > 0) {
            sb.setLength(sb.length() - 1);
        }
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
