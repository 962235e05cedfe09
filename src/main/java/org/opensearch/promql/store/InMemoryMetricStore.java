/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link MetricStore} holding its rows in memory. Queries complete immediately.
 */
public class InMemoryMetricStore implements MetricStore {
    private final Map<SubStore, List<MetricRow>> rows = new EnumMap<>(SubStore.class);

    public InMemoryMetricStore() {
        for (SubStore subStore : SubStore.values()) {
            rows.put(subStore, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Add a row to a sub-store.
     *
     * @param subStore the sub-store
     * @param row the row
     * @return this store
     */
    public InMemoryMetricStore add(SubStore subStore, MetricRow row) {
        rows.get(subStore).add(row);
        return this;
    }

    /**
     * Add rows to a sub-store.
     *
     * @param subStore the sub-store
     * @param newRows the rows
     * @return this store
     */
    public InMemoryMetricStore addAll(SubStore subStore, List<MetricRow> newRows) {
        rows.get(subStore).addAll(newRows);
        return this;
    }

    @Override
    public CompletableFuture<List<MetricRow>> query(SubStore subStore, SelectorPredicate predicate) {
        List<MetricRow> matching = new ArrayList<>();
        for (MetricRow row : rows.get(subStore)) {
            if (predicate.test(row)) {
                matching.add(row);
            }
        }
        return CompletableFuture.completedFuture(matching);
    }
}
