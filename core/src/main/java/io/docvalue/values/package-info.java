/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * The classes in this package represent the data held in a document. All
 * data classes in this package are instances of
 * {@link io.docvalue.values.FieldValue}. A document is mapped to a
 * {@link io.docvalue.values.MapValue}, which is an ordered collection of
 * {@link io.docvalue.values.FieldValue} instances, keyed by a string.
 * <table>
 *   <caption>The value types</caption>
 *   <tr><th>Type</th><th>Class</th></tr>
 *   <tr><td>NULL</td><td>{@link io.docvalue.values.NullValue}</td></tr>
 *   <tr><td>BOOLEAN</td>
 *       <td>{@link io.docvalue.values.BooleanValue}</td></tr>
 *   <tr><td>INTEGER</td>
 *       <td>{@link io.docvalue.values.IntegerValue}</td></tr>
 *   <tr><td>DOUBLE</td>
 *       <td>{@link io.docvalue.values.DoubleValue}</td></tr>
 *   <tr><td>TIMESTAMP</td>
 *       <td>{@link io.docvalue.values.TimestampValue}</td></tr>
 *   <tr><td>STRING</td><td>{@link io.docvalue.values.StringValue}</td></tr>
 *   <tr><td>BINARY</td><td>{@link io.docvalue.values.BinaryValue}</td></tr>
 *   <tr><td>REFERENCE</td>
 *       <td>{@link io.docvalue.values.ReferenceValue}</td></tr>
 *   <tr><td>GEO_POINT</td>
 *       <td>{@link io.docvalue.values.GeoPointValue}</td></tr>
 *   <tr><td>ARRAY</td><td>{@link io.docvalue.values.ArrayValue}</td></tr>
 *   <tr><td>MAP</td><td>{@link io.docvalue.values.MapValue}</td></tr>
 * </table>
 * <p>
 * JSON has no TIMESTAMP, BINARY, REFERENCE or GEO_POINT type. When written
 * as JSON these become an ISO 8601 string, a Base64 string, the reference
 * path string and a {"latitude", "longitude"} object respectively, and they
 * read back as those JSON types.
 */
package io.docvalue.values;
