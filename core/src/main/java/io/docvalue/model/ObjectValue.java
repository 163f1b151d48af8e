/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.model;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

import io.docvalue.util.LogUtil;
import io.docvalue.values.FieldValue;
import io.docvalue.values.MapValue;

/**
 * A structured document: a tree of {@link FieldValue}s rooted at a
 * {@link MapValue}, read and modified one field at a time using
 * {@link FieldPath}s.
 * <p>
 * Values are copied on the way in ({@link #set}) and on the way out
 * ({@link #get}), so the tree never shares a mutable container with a
 * caller. Each map level is searched linearly; the cost of a path
 * operation is bounded by the path length times the number of entries at
 * each level visited.
 * <p>
 * Calling {@link #set} or {@link #delete} with an empty path is a
 * programming error and throws {@link IllegalArgumentException} before
 * anything is modified. A path that does not resolve is not an error:
 * {@link #get} returns null and {@link #delete} does nothing.
 * <p>
 * Instances are not thread-safe. Concurrent reads are safe; reads
 * concurrent with a modification are not.
 */
public class ObjectValue {

    private static final Logger logger =
        Logger.getLogger(ObjectValue.class.getName());

    private final MapValue root;

    /**
     * Creates an empty document.
     */
    public ObjectValue() {
        root = new MapValue();
    }

    /**
     * Creates a document holding a copy of the given map.
     *
     * @param value the document contents
     *
     * @throws IllegalArgumentException if the value is not a MapValue
     */
    public ObjectValue(FieldValue value) {
        requireNonNull(value, "ObjectValue: value must be non-null");
        if (!value.isMap()) {
            throw new IllegalArgumentException(
                "ObjectValue must be backed by a MapValue, found " +
                value.getType());
        }
        root = value.asMap().copy();
    }

    /**
     * Creates a document from a JSON object.
     *
     * @param json the JSON text, which must be an object
     * @return the document
     *
     * @throws IllegalArgumentException if the JSON is not an object
     * @throws io.docvalue.JsonParseException if the JSON is invalid
     */
    public static ObjectValue fromJson(String json) {
        return new ObjectValue(FieldValue.fromJson(json));
    }

    /**
     * Returns a copy of the value at the given path, or null if there is
     * none. The empty path returns the whole document.
     *
     * @param path the path to search
     * @return the value at the path or null if it doesn't exist
     */
    public FieldValue get(FieldPath path) {
        requireNonNull(path, "ObjectValue.get: path must be non-null");
        FieldValue value = find(path);
        return (value == null ? null : value.copy());
    }

    /*
     * Returns the live value at the path, or null.
     */
    private FieldValue find(FieldPath path) {
        FieldValue nested = root;
        for (String segment : path) {
            if (!nested.isMap()) {
                return null;
            }
            nested = nested.asMap().get(segment);
            if (nested == null) {
                return null;
            }
        }
        return nested;
    }

    /**
     * Sets the field at the given path to a copy of the value. Missing
     * parent maps are created. A parent that exists but is not a map is
     * replaced by a new map holding only the new field.
     *
     * @param path the field path, must be non-empty
     * @param value the value to set
     *
     * @throws IllegalArgumentException if the path is empty
     */
    public void set(FieldPath path, FieldValue value) {
        requireNonNull(path, "ObjectValue.set: path must be non-null");
        requireNonNull(value, "ObjectValue.set: value must be non-null");
        checkNotEmpty(path, "set");

        FieldValue copy = value.copy();
        MapValue parent = root;
        for (String segment : path.popLast()) {
            FieldValue entry = parent.get(segment);
            if (entry != null && entry.isMap()) {
                parent = entry.asMap();
                continue;
            }
            if (entry != null && LogUtil.isFineEnabled(logger)) {
                LogUtil.logFine(logger, "Replacing " + entry.getType() +
                                " field '" + segment + "' with a map to set " +
                                path.canonicalString());
            }
            MapValue child = new MapValue();
            parent.put(segment, child);
            parent = child;
        }
        parent.put(path.lastSegment(), copy);
    }

    /**
     * Removes the field at the given path. If there is no field at the
     * path nothing is changed. Parent maps left empty are kept.
     *
     * @param path the field path, must be non-empty
     *
     * @throws IllegalArgumentException if the path is empty
     */
    public void delete(FieldPath path) {
        requireNonNull(path, "ObjectValue.delete: path must be non-null");
        checkNotEmpty(path, "delete");

        MapValue parent = root;
        for (String segment : path.popLast()) {
            FieldValue entry = parent.get(segment);
            if (entry == null || !entry.isMap()) {
                return;
            }
            parent = entry.asMap();
        }
        parent.remove(path.lastSegment());
    }

    /**
     * Sets the fields in the mask to their values in data. A field in the
     * mask that is missing from data is deleted. Fields outside the mask
     * are not modified. Paths are applied in mask order.
     *
     * @param mask the fields to modify
     * @param data the document supplying the new values
     *
     * @throws IllegalArgumentException if the mask holds the empty path
     */
    public void setAll(FieldMask mask, ObjectValue data) {
        requireNonNull(mask, "ObjectValue.setAll: mask must be non-null");
        requireNonNull(data, "ObjectValue.setAll: data must be non-null");

        int set = 0;
        int deleted = 0;
        for (FieldPath path : mask) {
            FieldValue value = data.find(path);
            if (value != null) {
                set(path, value);
                set++;
            } else {
                delete(path);
                deleted++;
            }
        }
        if (LogUtil.isFineEnabled(logger)) {
            LogUtil.logFine(logger, "setAll: " + set + " set, " + deleted +
                            " deleted for " + mask);
        }
    }

    /**
     * Returns the paths of the leaf fields of this document. A nested map
     * with no entries is reported as a leaf so that it is preserved.
     *
     * @return the mask
     */
    public FieldMask toFieldMask() {
        return extractFieldMask(root);
    }

    private static FieldMask extractFieldMask(MapValue map) {
        TreeSet<FieldPath> fields = new TreeSet<FieldPath>();
        for (Map.Entry<String, FieldValue> entry : map) {
            FieldPath currentPath = FieldPath.of(entry.getKey());
            FieldValue value = entry.getValue();
            if (value.isMap()) {
                FieldMask nestedMask = extractFieldMask(value.asMap());
                if (nestedMask.isEmpty()) {
                    fields.add(currentPath);
                } else {
                    for (FieldPath nestedPath : nestedMask) {
                        fields.add(currentPath.append(nestedPath));
                    }
                }
            } else {
                fields.add(currentPath);
            }
        }
        return FieldMask.fromCollection(fields);
    }

    /**
     * Returns an independent copy of this document.
     *
     * @return the copy
     */
    public ObjectValue copy() {
        return new ObjectValue(root);
    }

    /**
     * Returns the document as JSON.
     *
     * @return the JSON string
     */
    public String toJson() {
        return root.toJson();
    }

    private static void checkNotEmpty(FieldPath path, String op) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException(
                "Cannot " + op + " field for empty path on ObjectValue");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof ObjectValue) {
            return root.equals(((ObjectValue) other).root);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    /**
     * Returns the canonical string of the document.
     */
    @Override
    public String toString() {
        return root.canonicalId();
    }
}
