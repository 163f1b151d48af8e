/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.util;

import java.util.Objects;

/**
 * @hidden
 * Argument checks shared by the value and model classes.
 */
public class CheckNull {

    public static void requireNonNull(Object value, String message) {
        Objects.requireNonNull(value, message);
    }
}
