/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package io.docvalue.model;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An immutable path to a field within a document, expressed as an ordered
 * sequence of field names (segments). Segments are raw field names; no
 * escaping or syntax validation is applied to them.
 * <p>
 * Paths are compared segment by segment using {@link String#compareTo},
 * a path sorting before any longer path that it is a prefix of. This is the
 * order used by {@link FieldMask}.
 */
public final class FieldPath implements Comparable<FieldPath>,
                                        Iterable<String> {

    /**
     * The path with no segments. It addresses the document root.
     */
    public static final FieldPath EMPTY =
        new FieldPath(Collections.<String>emptyList());

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = segments;
    }

    /**
     * Creates a path from the segments given.
     *
     * @param segments the segments, in order
     * @return the path
     */
    public static FieldPath of(String... segments) {
        requireNonNull(segments, "FieldPath.of: segments must be non-null");
        return fromSegments(Arrays.asList(segments));
    }

    /**
     * Creates a path from a list of segments. The list is copied.
     *
     * @param segments the segments, in order
     * @return the path
     */
    public static FieldPath fromSegments(List<String> segments) {
        requireNonNull(segments,
                       "FieldPath.fromSegments: segments must be non-null");
        if (segments.isEmpty()) {
            return EMPTY;
        }
        List<String> copy = new ArrayList<String>(segments.size());
        for (String segment : segments) {
            requireNonNull(segment,
                           "FieldPath.fromSegments: segment must be non-null");
            copy.add(segment);
        }
        return new FieldPath(Collections.unmodifiableList(copy));
    }

    /**
     * A convenience method that splits a "." separated path into segments.
     * Segments that contain a "." cannot be expressed this way; use
     * {@link #of} for those.
     *
     * @param path the dot-separated path
     * @return the path
     */
    public static FieldPath fromDotSeparated(String path) {
        requireNonNull(path,
                       "FieldPath.fromDotSeparated: path must be non-null");
        if (path.isEmpty()) {
            return EMPTY;
        }
        return fromSegments(Arrays.asList(path.split("\\.", -1)));
    }

    /**
     * @return the number of segments
     */
    public int size() {
        return segments.size();
    }

    /**
     * @return true if the path has no segments
     */
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * Returns the segment at the given index.
     *
     * @param index the zero-based index
     * @return the segment
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public String getSegment(int index) {
        return segments.get(index);
    }

    /**
     * @return the first segment
     * @throws IllegalStateException if the path is empty
     */
    public String firstSegment() {
        checkNotEmpty("firstSegment");
        return segments.get(0);
    }

    /**
     * @return the last segment
     * @throws IllegalStateException if the path is empty
     */
    public String lastSegment() {
        checkNotEmpty("lastSegment");
        return segments.get(segments.size() - 1);
    }

    /**
     * Returns the path made of all segments but the last.
     *
     * @return the parent path
     * @throws IllegalStateException if the path is empty
     */
    public FieldPath popLast() {
        checkNotEmpty("popLast");
        return sub(0, segments.size() - 1);
    }

    /**
     * Returns the path made of all segments but the first.
     *
     * @return the path
     * @throws IllegalStateException if the path is empty
     */
    public FieldPath popFirst() {
        checkNotEmpty("popFirst");
        return sub(1, segments.size());
    }

    /**
     * Returns a new path with the segment appended.
     *
     * @param segment the segment
     * @return the new path
     */
    public FieldPath append(String segment) {
        requireNonNull(segment, "FieldPath.append: segment must be non-null");
        List<String> list = new ArrayList<String>(segments.size() + 1);
        list.addAll(segments);
        list.add(segment);
        return new FieldPath(Collections.unmodifiableList(list));
    }

    /**
     * Returns a new path with all the segments of the given path appended.
     *
     * @param path the path to append
     * @return the new path
     */
    public FieldPath append(FieldPath path) {
        requireNonNull(path, "FieldPath.append: path must be non-null");
        if (path.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return path;
        }
        List<String> list =
            new ArrayList<String>(segments.size() + path.size());
        list.addAll(segments);
        list.addAll(path.segments);
        return new FieldPath(Collections.unmodifiableList(list));
    }

    /**
     * Returns true if this path is a prefix of, or equal to, the other
     * path.
     *
     * @param other the other path
     * @return true if this is a prefix of other
     */
    public boolean isPrefixOf(FieldPath other) {
        requireNonNull(other, "FieldPath.isPrefixOf: other must be non-null");
        if (size() > other.size()) {
            return false;
        }
        for (int i = 0; i < size(); i++) {
            if (!segments.get(i).equals(other.segments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the canonical string of the path. Segments are joined by ".";
     * a segment that is not a simple identifier (a letter or underscore
     * followed by letters, digits or underscores) is quoted with back
     * quotes, with back quotes and backslashes inside it escaped by a
     * backslash.
     *
     * @return the canonical string
     */
    public String canonicalString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            appendSegment(sb, segments.get(i));
        }
        return sb.toString();
    }

    private static void appendSegment(StringBuilder sb, String segment) {
        if (isIdentifier(segment)) {
            sb.append(segment);
            return;
        }
        sb.append('`');
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '\\' || c == '`') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('`');
    }

    private static boolean isIdentifier(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') || c == '_';
            if (!letter && (i == 0 || c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }

    private FieldPath sub(int from, int to) {
        if (from == to) {
            return EMPTY;
        }
        return new FieldPath(segments.subList(from, to));
    }

    private void checkNotEmpty(String op) {
        if (segments.isEmpty()) {
            throw new IllegalStateException(
                "FieldPath." + op + ": path is empty");
        }
    }

    @Override
    public Iterator<String> iterator() {
        return segments.iterator();
    }

    @Override
    public int compareTo(FieldPath other) {
        int n = Math.min(size(), other.size());
        for (int i = 0; i < n; i++) {
            int cmp = segments.get(i).compareTo(other.segments.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(size(), other.size());
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof FieldPath) {
            return segments.equals(((FieldPath) other).segments);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return canonicalString();
    }
}
