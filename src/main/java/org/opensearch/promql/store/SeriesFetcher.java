/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.LabelConstants;
import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.MetricSelector;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves a selector into time series by querying both sub-stores concurrently and merging
 * their rows.
 *
 * <p>Rows are grouped by label set into series sorted by timestamp. Rows of the same series and
 * timestamp collapse into one sample, the {@link SubStore#GAUGE} row winning. The result is sorted
 * by label set.</p>
 *
 * <p>A sub-store whose fetch fails is treated as empty and logged, unless the fetcher is strict,
 * in which case the failure completes the returned future.</p>
 */
public class SeriesFetcher {
    private static final Logger logger = LogManager.getLogger(SeriesFetcher.class);

    private final MetricStore store;
    private final Executor executor;
    private final boolean strict;

    /**
     * Constructor for SeriesFetcher.
     * @param store the store to read
     * @param executor executor running the merge
     * @param strict whether sub-store failures fail the fetch
     */
    public SeriesFetcher(MetricStore store, Executor executor, boolean strict) {
        this.store = store;
        this.executor = executor;
        this.strict = strict;
    }

    /**
     * Fetch the series of a selector over a closed time window.
     *
     * @param selector the selector
     * @param startMs window start, inclusive
     * @param endMs window end, inclusive
     * @return the series, each sorted by timestamp
     */
    public CompletableFuture<List<TimeSeries>> fetch(MetricSelector selector, long startMs, long endMs) {
        SelectorPredicate predicate = new SelectorPredicate(selector, startMs, endMs);
        CompletableFuture<List<MetricRow>> gauge = query(SubStore.GAUGE, predicate);
        CompletableFuture<List<MetricRow>> sum = query(SubStore.SUM, predicate);
        return gauge.thenCombineAsync(sum, (gaugeRows, sumRows) -> {
            List<TimeSeries> series = group(gaugeRows, sumRows);
            if (logger.isDebugEnabled()) {
                logger.debug("Fetched {} rows into {} series for {}", gaugeRows.size() + sumRows.size(), series.size(), predicate);
            }
            return series;
        }, executor);
    }

    private CompletableFuture<List<MetricRow>> query(SubStore subStore, SelectorPredicate predicate) {
        CompletableFuture<List<MetricRow>> future;
        try {
            future = store.query(subStore, predicate);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (strict) {
            return future;
        }
        return future.exceptionally(e -> {
            logger.warn(new ParameterizedMessage("Fetch from sub-store [{}] failed for {}, treating it as empty", subStore, predicate), e);
            return List.of();
        });
    }

    /**
     * Merge rows of both sub-stores into series.
     *
     * @param gaugeRows rows of the gauge sub-store
     * @param sumRows rows of the sum sub-store
     * @return series sorted by label set
     */
    static List<TimeSeries> group(List<MetricRow> gaugeRows, List<MetricRow> sumRows) {
        Map<Labels, TreeMap<Long, Double>> samplesByLabels = new HashMap<>();
        for (List<MetricRow> rows : List.of(gaugeRows, sumRows)) {
            for (MetricRow row : rows) {
                samplesByLabels.computeIfAbsent(buildLabels(row), k -> new TreeMap<>()).putIfAbsent(row.getTimestampMs(), row.getValue());
            }
        }

        List<TimeSeries> result = new ArrayList<>(samplesByLabels.size());
        for (Map.Entry<Labels, TreeMap<Long, Double>> entry : samplesByLabels.entrySet()) {
            List<Sample> samples = new ArrayList<>(entry.getValue().size());
            for (Map.Entry<Long, Double> point : entry.getValue().entrySet()) {
                samples.add(new FloatSample(point.getKey(), point.getValue()));
            }
            result.add(new TimeSeries(samples, entry.getKey()));
        }
        result.sort(Comparator.comparing((TimeSeries series) -> series.getLabels().toKeyValueString()));
        return result;
    }

    /**
     * Labels of the series a row belongs to: {@code __name__}, {@code service_name} when the
     * resource name is set, and every attribute with a non-empty value.
     *
     * @param row the row
     * @return the labels
     */
    public static Labels buildLabels(MetricRow row) {
        Map<String, String> labels = new HashMap<>();
        for (Map.Entry<String, String> attribute : row.getAttributes().entrySet()) {
            if (attribute.getValue() != null && attribute.getValue().isEmpty() == false) {
                labels.put(attribute.getKey(), attribute.getValue());
            }
        }
        if (row.getResourceName().isEmpty() == false) {
            labels.put(LabelConstants.SERVICE_NAME, row.getResourceName());
        }
        labels.put(LabelConstants.METRIC_NAME, row.getMetricName());
        return MapLabels.fromMap(labels);
    }
}
