/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.AggregationType;
import org.opensearch.promql.lang.prom.common.GroupingModifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@code topk} and {@code bottomk}: keeps the k members of each group with the largest
 * (or smallest) latest value. Selected series keep their own labels and samples.
 *
 * <p>The latest value of a series is the value of its last sample, 0 for a series without
 * samples. Ties keep input order and NaN always ranks last.</p>
 */
public class TopKStage extends AbstractGroupingStage {
    private final boolean top;
    private final int k;

    /**
     * Constructor for TopKStage.
     * @param type {@link AggregationType#TOPK} or {@link AggregationType#BOTTOMK}
     * @param modifier {@code by}, {@code without} or null
     * @param groupingLabels label names of the grouping clause
     * @param k number of series to keep per group, truncated to an integer
     */
    public TopKStage(AggregationType type, GroupingModifier modifier, List<String> groupingLabels, double k) {
        super(modifier, groupingLabels);
        if (type.selectsSeries() == false) {
            throw new IllegalArgumentException(type + " does not select series");
        }
        this.top = type == AggregationType.TOPK;
        this.k = (int) k;
    }

    @Override
    public String getName() {
        return top ? "topk" : "bottomk";
    }

    @Override
    protected List<TimeSeries> processGroup(List<TimeSeries> groupSeries, Labels groupLabels) {
        if (k <= 0) {
            return List.of();
        }
        Comparator<Double> byValue = top ? Comparator.reverseOrder() : Comparator.naturalOrder();
        Comparator<TimeSeries> order = Comparator.comparing((TimeSeries s) -> Double.isNaN(latestValue(s)))
            .thenComparing(TopKStage::latestValue, byValue);

        List<TimeSeries> sorted = new ArrayList<>(groupSeries);
        sorted.sort(order);
        return new ArrayList<>(sorted.subList(0, Math.min(k, sorted.size())));
    }

    private static double latestValue(TimeSeries series) {
        Sample last = series.getLastSample();
        return last != null ? last.getValue() : 0.0;
    }
}
