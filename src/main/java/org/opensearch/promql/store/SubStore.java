/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

/**
 * The two sub-stores a selector is resolved against.
 */
public enum SubStore {
    /** Gauge-like metrics. */
    GAUGE,

    /** Counter-like (monotonic sum) metrics. */
    SUM
}
