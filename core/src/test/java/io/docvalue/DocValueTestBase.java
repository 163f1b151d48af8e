/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue;

import static org.junit.Assert.fail;

import io.docvalue.model.FieldPath;
import io.docvalue.model.ObjectValue;
import io.docvalue.values.FieldValue;
import io.docvalue.values.MapValue;

/**
 * A common base for tests, with small helpers to build documents and
 * paths.
 */
public class DocValueTestBase {

    /*
     * Builds a path from a dot-separated string
     */
    protected static FieldPath path(String dotted) {
        return FieldPath.fromDotSeparated(dotted);
    }

    /*
     * Builds a map from JSON. Single quotes are accepted to keep test
     * strings readable.
     */
    protected static MapValue map(String json) {
        return FieldValue.fromJson(json.replace('\'', '"')).asMap();
    }

    protected static ObjectValue doc(String json) {
        return new ObjectValue(map(json));
    }

    /*
     * Runs the operation and fails unless it throws the expected exception
     */
    protected static void expectThrows(Class<? extends Throwable> expected,
                                       Runnable op) {
        try {
            op.run();
        } catch (Throwable t) {
            if (!expected.isInstance(t)) {
                throw new AssertionError("Expected " +
                                         expected.getSimpleName() +
                                         ", got " + t, t);
            }
            return;
        }
        fail("Expected " + expected.getSimpleName());
    }
}
