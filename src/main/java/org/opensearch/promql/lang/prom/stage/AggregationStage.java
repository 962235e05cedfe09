/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.AggregationType;
import org.opensearch.promql.lang.prom.common.GroupingModifier;
import org.opensearch.promql.lang.prom.function.RangeFunctions;
import org.opensearch.promql.query.stage.StepGrid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces each group of series to one series, step by step.
 *
 * <p>At every grid timestamp the values of the group members present at that step are
 * combined with the aggregation operator. Steps where no member has a value are omitted,
 * and a group without any output step produces no series. The output labels are the group key.</p>
 *
 * <p>{@code topk} and {@code bottomk} select series instead of reducing values and are
 * handled by {@link TopKStage}.</p>
 */
public class AggregationStage extends AbstractGroupingStage {

    /** Scale applied before comparing values in {@code count_values}. */
    static final double COUNT_VALUES_SCALE = 1e6;

    private final AggregationType type;
    private final double parameter;
    private final StepGrid grid;

    /**
     * Constructor for AggregationStage.
     * @param type the aggregation operator
     * @param modifier {@code by}, {@code without} or null
     * @param groupingLabels label names of the grouping clause
     * @param parameter the quantile for {@code quantile}, otherwise ignored and may be null
     * @param grid the evaluation steps
     */
    public AggregationStage(AggregationType type, GroupingModifier modifier, List<String> groupingLabels, Double parameter, StepGrid grid) {
        super(modifier, groupingLabels);
        if (type.selectsSeries()) {
            throw new IllegalArgumentException(type + " selects series, use TopKStage");
        }
        this.type = type;
        this.parameter = parameter != null ? parameter : Double.NaN;
        this.grid = grid;
    }

    @Override
    public String getName() {
        return type.toString();
    }

    @Override
    protected List<TimeSeries> processGroup(List<TimeSeries> groupSeries, Labels groupLabels) {
        List<Sample[]> snapped = new ArrayList<>(groupSeries.size());
        for (TimeSeries series : groupSeries) {
            snapped.add(grid.snap(series));
        }

        long[] timestamps = grid.getTimestamps();
        List<Sample> output = new ArrayList<>();
        double[] values = new double[groupSeries.size()];
        for (int step = 0; step < timestamps.length; step++) {
            int count = 0;
            for (Sample[] member : snapped) {
                if (member[step] != null) {
                    values[count++] = member[step].getValue();
                }
            }
            if (count > 0) {
                output.add(new FloatSample(timestamps[step], reduce(Arrays.copyOf(values, count))));
            }
        }

        if (output.isEmpty()) {
            return List.of();
        }
        return List.of(new TimeSeries(output, groupLabels));
    }

    /**
     * Combine the values of one step.
     *
     * @param values at least one value
     * @return the aggregated value
     */
    double reduce(double[] values) {
        switch (type) {
            case SUM:
                return sum(values);
            case AVG:
                return sum(values) / values.length;
            case MIN:
                return extreme(values, true);
            case MAX:
                return extreme(values, false);
            case COUNT:
                return values.length;
            case GROUP:
                return 1.0;
            case STDVAR:
                return RangeFunctions.populationVariance(values);
            case STDDEV:
                return Math.sqrt(RangeFunctions.populationVariance(values));
            case QUANTILE:
                Arrays.sort(values);
                return RangeFunctions.quantileSorted(values, parameter);
            case COUNT_VALUES:
                Set<Long> distinct = new HashSet<>();
                for (double v : values) {
                    distinct.add((long) (v * COUNT_VALUES_SCALE));
                }
                return distinct.size();
            default:
                throw new IllegalStateException("Unexpected aggregation: " + type);
        }
    }

    private static double sum(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }

    // NaN only wins when every value is NaN
    private static double extreme(double[] values, boolean min) {
        double result = Double.NaN;
        for (double v : values) {
            if (Double.isNaN(v)) {
                continue;
            }
            if (Double.isNaN(result) || (min ? v < result : v > result)) {
                result = v;
            }
        }
        return result;
    }
}
