/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue;

/**
 * A base exception for the exceptions defined by this library. The library
 * throws Java exceptions such as {@link IllegalArgumentException} directly
 * for precondition violations.
 */
public class DocValueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public DocValueException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     *
     * @param msg the message
     * @param cause the cause
     */
    public DocValueException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
