/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

/**
 * Field-level access to documents. {@link io.docvalue.model.ObjectValue}
 * reads, sets and deletes fields addressed by
 * {@link io.docvalue.model.FieldPath}, applies sparse updates restricted
 * to a {@link io.docvalue.model.FieldMask}, and reports the mask of the
 * fields it holds. {@link io.docvalue.model.ServerTimestamps} recognizes
 * the pending server timestamp sentinel.
 */
package io.docvalue.model;
