/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

/**
 * A {@link FieldValue} instance representing a reference to another
 * document. The reference is held as the slash-separated path of the
 * target document, for example "rooms/eros/messages/1". The path is not
 * interpreted.
 */
public class ReferenceValue extends FieldValue {

    private final String path;

    /**
     * Creates a new instance
     *
     * @param path the path of the referenced document
     */
    public ReferenceValue(String path) {
        super();
        requireNonNull(path, "ReferenceValue: path must be non-null");
        this.path = path;
    }

    @Override
    public Type getType() {
        return Type.REFERENCE;
    }

    /**
     * Returns the path of the referenced document
     *
     * @return the path
     */
    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ReferenceValue) {
            return path.equals(((ReferenceValue)other).path);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }
}
