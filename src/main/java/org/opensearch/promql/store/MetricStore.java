/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to raw metric rows.
 *
 * <p>Implementations must be safe for concurrent use: the engine issues the queries of both
 * sub-stores, and of independent selectors, at the same time. A failed fetch completes the
 * returned future exceptionally, preferably with a {@link org.opensearch.promql.exception.MetricStoreException}.</p>
 */
@FunctionalInterface
public interface MetricStore {

    /**
     * Fetch the rows of one sub-store accepted by a predicate.
     *
     * @param subStore the sub-store to read
     * @param predicate metric name, label matchers and time window of the fetch
     * @return the matching rows, in any order
     */
    CompletableFuture<List<MetricRow>> query(SubStore subStore, SelectorPredicate predicate);
}
