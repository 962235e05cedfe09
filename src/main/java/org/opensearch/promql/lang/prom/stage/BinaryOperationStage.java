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
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;
import org.opensearch.promql.query.stage.StepGrid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arithmetic and comparison operators between two operands.
 *
 * <ul>
 *   <li>scalar op scalar: one label-free series with a value at every step both sides have</li>
 *   <li>vector op scalar: the operator is applied to each sample of each vector series; a step the
 *       scalar does not cover uses NaN</li>
 *   <li>vector op vector: each left series is paired with every right series of the same signature,
 *       values are combined at the grid steps both sides have</li>
 * </ul>
 *
 * <p>Comparisons filter out the steps where they do not hold and keep the left value, unless the
 * {@code bool} modifier turns them into 0/1. Series left without samples are dropped.</p>
 */
public class BinaryOperationStage extends AbstractVectorMatchingStage {
    private final StepGrid grid;

    /**
     * Constructor for BinaryOperationStage.
     * @param operator an arithmetic or comparison operator
     * @param modifier matching options, null for none
     * @param grid the evaluation steps
     */
    public BinaryOperationStage(BinaryOperatorType operator, BinaryModifier modifier, StepGrid grid) {
        super(operator, modifier);
        if (operator.isSetOperator()) {
            throw new IllegalArgumentException("Set operator " + operator + " is handled by SetOperationStage");
        }
        this.grid = grid;
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> left, List<TimeSeries> right) {
        if (isScalar(left) && isScalar(right)) {
            return processScalars(left.get(0), right.get(0));
        }
        if (isScalar(right)) {
            return processVectorScalar(left, right.get(0), false);
        }
        if (isScalar(left)) {
            return processVectorScalar(right, left.get(0), true);
        }
        return processVectors(left, right);
    }

    private List<TimeSeries> processScalars(TimeSeries left, TimeSeries right) {
        List<Sample> samples = combine(grid.snap(left), grid.snap(right));
        List<TimeSeries> result = new ArrayList<>(1);
        result.add(new TimeSeries(samples, MapLabels.emptyLabels()));
        return result;
    }

    private List<TimeSeries> processVectorScalar(List<TimeSeries> vector, TimeSeries scalar, boolean scalarOnLeft) {
        Sample[] scalarValues = grid.snap(scalar);
        List<TimeSeries> result = new ArrayList<>(vector.size());
        for (TimeSeries series : vector) {
            List<Sample> samples = new ArrayList<>(series.getSamples().size());
            for (Sample sample : series.getSamples()) {
                int index = grid.indexOf(sample.getTimestamp());
                double s = index >= 0 && scalarValues[index] != null ? scalarValues[index].getValue() : Double.NaN;
                double v = sample.getValue();
                Double value = scalarOnLeft ? apply(s, v) : apply(v, s);
                if (value != null) {
                    samples.add(new FloatSample(sample.getTimestamp(), value));
                }
            }
            if (samples.isEmpty() == false) {
                result.add(series.withSamples(samples));
            }
        }
        return result;
    }

    private List<TimeSeries> processVectors(List<TimeSeries> left, List<TimeSeries> right) {
        Map<Labels, List<TimeSeries>> rightBySignature = new LinkedHashMap<>();
        for (TimeSeries series : right) {
            rightBySignature.computeIfAbsent(signature(series.getLabels()), k -> new ArrayList<>()).add(series);
        }

        List<TimeSeries> result = new ArrayList<>();
        for (TimeSeries leftSeries : left) {
            List<TimeSeries> matches = rightBySignature.get(signature(leftSeries.getLabels()));
            if (matches == null) {
                continue;
            }
            Sample[] leftSamples = grid.snap(leftSeries);
            for (TimeSeries rightSeries : matches) {
                List<Sample> samples = combine(leftSamples, grid.snap(rightSeries));
                if (samples.isEmpty() == false) {
                    result.add(new TimeSeries(samples, outputLabels(leftSeries.getLabels(), rightSeries.getLabels())));
                }
            }
        }
        return result;
    }

    private List<Sample> combine(Sample[] left, Sample[] right) {
        long[] timestamps = grid.getTimestamps();
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < timestamps.length; i++) {
            if (left[i] == null || right[i] == null) {
                continue;
            }
            Double value = apply(left[i].getValue(), right[i].getValue());
            if (value != null) {
                samples.add(new FloatSample(timestamps[i], value));
            }
        }
        return samples;
    }

    /**
     * Labels of a vector-vector result.
     *
     * @param left labels of the left series
     * @param right labels of the matched right series
     * @return the output labels for the modifier's cardinality
     */
    Labels outputLabels(Labels left, Labels right) {
        switch (modifier.getCardinality()) {
            case MANY_TO_ONE:
                return copyLabels(left, right, modifier.getIncludeLabels());
            case ONE_TO_MANY:
                return copyLabels(right, left, modifier.getIncludeLabels());
            case MANY_TO_MANY:
                return left;
            default:
                if (modifier.isOn()) {
                    return left.keepOnly(modifier.getMatchingLabels());
                }
                if (modifier.getMatchingLabels().isEmpty() == false) {
                    return left.without(modifier.getMatchingLabels());
                }
                return left;
        }
    }

    private static Labels copyLabels(Labels target, Labels source, List<String> names) {
        Labels labels = target;
        for (String name : names) {
            if (source.has(name)) {
                labels = labels.withLabel(name, source.get(name));
            }
        }
        return labels;
    }

    /**
     * Apply the operator to one pair of values.
     *
     * @param l left value
     * @param r right value
     * @return the result, or null if a comparison filters the pair out
     */
    Double apply(double l, double r) {
        switch (operator) {
            case ADD:
                return l + r;
            case SUB:
                return l - r;
            case MUL:
                return l * r;
            case DIV:
                return r == 0.0 ? Double.NaN : l / r;
            case MOD:
                return r == 0.0 ? Double.NaN : l % r;
            case POW:
                return Math.pow(l, r);
            case EQL:
                return compare(l == r, l);
            case NEQ:
                return compare(l != r, l);
            case GTR:
                return compare(l > r, l);
            case LSS:
                return compare(l < r, l);
            case GTE:
                return compare(l >= r, l);
            case LTE:
                return compare(l <= r, l);
            default:
                throw new IllegalStateException("Unexpected operator: " + operator);
        }
    }

    private Double compare(boolean holds, double value) {
        if (modifier.isReturnBool()) {
            return holds ? 1.0 : 0.0;
        }
        return holds ? value : null;
    }
}
