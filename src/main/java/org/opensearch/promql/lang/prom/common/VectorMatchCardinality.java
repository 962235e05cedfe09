/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

/**
 * Cardinality of a vector-to-vector binary operation, which decides how output labels are projected.
 */
public enum VectorMatchCardinality {
    /** Each left series matches at most one right series. */
    ONE_TO_ONE,
    /** {@code group_left}: many left series share one right series. */
    MANY_TO_ONE,
    /** {@code group_right}: one left series is shared by many right series. */
    ONE_TO_MANY,
    /** Set operators. */
    MANY_TO_MANY
}
