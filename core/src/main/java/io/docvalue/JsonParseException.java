/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue;

import com.fasterxml.jackson.core.JsonLocation;

/**
 * Thrown when JSON input cannot be turned into a value. The line and
 * column of the failure are reported when the parser knows them.
 */
public class JsonParseException extends DocValueException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    /**
     * @hidden
     * @param msg the exception message
     * @param location the location of the failure, may be null
     */
    public JsonParseException(String msg, JsonLocation location) {
        super(msg);
        if (location == null || location == JsonLocation.NA) {
            line = -1;
            column = -1;
        } else {
            line = location.getLineNr();
            column = location.getColumnNr();
        }
    }

    /**
     * @return the line of the failure, 1-based, or -1 if unknown
     */
    public int getLine() {
        return line;
    }

    /**
     * @return the column of the failure, 1-based, or -1 if unknown
     */
    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        if (line < 0) {
            return getMessage();
        }
        return getMessage() + " at line " + line + ", column " + column;
    }
}
