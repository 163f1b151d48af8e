/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.model;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An immutable set of {@link FieldPath}s describing which fields an update
 * affects. Duplicate paths collapse on construction and iteration follows
 * {@link FieldPath#compareTo} order.
 * <p>
 * A mask may hold both a path and one of its prefixes; no relationship
 * between the member paths is required.
 */
public final class FieldMask implements Iterable<FieldPath> {

    /**
     * The mask with no paths.
     */
    public static final FieldMask EMPTY =
        new FieldMask(Collections.<FieldPath>emptySortedSet());

    private final SortedSet<FieldPath> paths;

    private FieldMask(SortedSet<FieldPath> paths) {
        this.paths = paths;
    }

    /**
     * Creates a mask from the paths given.
     *
     * @param paths the paths
     * @return the mask
     */
    public static FieldMask of(FieldPath... paths) {
        requireNonNull(paths, "FieldMask.of: paths must be non-null");
        TreeSet<FieldPath> set = new TreeSet<FieldPath>();
        for (FieldPath path : paths) {
            requireNonNull(path, "FieldMask.of: path must be non-null");
            set.add(path);
        }
        return new FieldMask(Collections.unmodifiableSortedSet(set));
    }

    /**
     * Creates a mask from a collection of paths. The collection is copied.
     *
     * @param paths the paths
     * @return the mask
     */
    public static FieldMask fromCollection(Collection<FieldPath> paths) {
        requireNonNull(paths,
                       "FieldMask.fromCollection: paths must be non-null");
        return of(paths.toArray(new FieldPath[paths.size()]));
    }

    /**
     * @return the number of paths
     */
    public int size() {
        return paths.size();
    }

    /**
     * @return true if the mask has no paths
     */
    public boolean isEmpty() {
        return paths.isEmpty();
    }

    /**
     * Returns true if the path is a member of this mask. Only exact
     * membership is checked.
     *
     * @param path the path
     * @return true if present
     */
    public boolean contains(FieldPath path) {
        requireNonNull(path, "FieldMask.contains: path must be non-null");
        return paths.contains(path);
    }

    /**
     * Returns an iterator over the paths in canonical order.
     */
    @Override
    public Iterator<FieldPath> iterator() {
        return paths.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof FieldMask) {
            return paths.equals(((FieldMask) other).paths);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return paths.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FieldMask{");
        boolean first = true;
        for (FieldPath path : paths) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(path.canonicalString());
            first = false;
        }
        return sb.append("}").toString();
    }
}
