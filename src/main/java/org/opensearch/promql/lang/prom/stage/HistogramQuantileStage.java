/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.LabelConstants;
import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.query.stage.StepGrid;
import org.opensearch.promql.query.stage.UnaryPipelineStage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code histogram_quantile(phi, buckets)} over cumulative bucket series.
 *
 * <p>Bucket series are grouped by their labels without {@code le} and {@code __name__}. At each
 * step the buckets of a group are sorted by upper bound, the rank {@code phi * total} is located
 * and the value is interpolated linearly inside the bucket that reaches it, starting from 0 for
 * the first bucket. Steps where the total count is 0 are skipped. Series without a parseable
 * {@code le} label are ignored.</p>
 */
public class HistogramQuantileStage implements UnaryPipelineStage {
    private final double phi;
    private final StepGrid grid;

    /**
     * Constructor for HistogramQuantileStage.
     * @param phi the quantile
     * @param grid the evaluation steps
     */
    public HistogramQuantileStage(double phi, StepGrid grid) {
        this.phi = phi;
        this.grid = grid;
    }

    @Override
    public String getName() {
        return "histogram_quantile";
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        Map<Labels, List<Bucket>> groups = new LinkedHashMap<>();
        for (TimeSeries series : input) {
            Double upperBound = parseUpperBound(series.getLabels().get(LabelConstants.BUCKET_UPPER_BOUND));
            if (upperBound == null) {
                continue;
            }
            Labels groupLabels = series.getLabels().without(List.of(LabelConstants.BUCKET_UPPER_BOUND, LabelConstants.METRIC_NAME));
            groups.computeIfAbsent(groupLabels, k -> new ArrayList<>()).add(new Bucket(upperBound, grid.snap(series)));
        }

        List<TimeSeries> result = new ArrayList<>(groups.size());
        long[] timestamps = grid.getTimestamps();
        for (Map.Entry<Labels, List<Bucket>> entry : groups.entrySet()) {
            List<Bucket> buckets = entry.getValue();
            buckets.sort(Comparator.comparingDouble(Bucket::upperBound));

            List<Sample> output = new ArrayList<>();
            for (int step = 0; step < timestamps.length; step++) {
                List<double[]> points = new ArrayList<>(buckets.size());
                for (Bucket bucket : buckets) {
                    Sample sample = bucket.samples()[step];
                    if (sample != null) {
                        points.add(new double[] { bucket.upperBound(), sample.getValue() });
                    }
                }
                if (points.isEmpty()) {
                    continue;
                }
                double total = points.get(points.size() - 1)[1];
                if (total == 0.0 || Double.isNaN(total)) {
                    continue;
                }
                output.add(new FloatSample(timestamps[step], quantile(phi, points)));
            }
            if (output.isEmpty() == false) {
                result.add(new TimeSeries(output, entry.getKey()));
            }
        }
        return result;
    }

    /**
     * Interpolated quantile of one step.
     *
     * @param phi the quantile
     * @param points {@code (upperBound, cumulativeCount)} pairs sorted by upper bound, the last holding the total
     * @return the estimated value
     */
    static double quantile(double phi, List<double[]> points) {
        if (phi < 0) {
            return Double.NEGATIVE_INFINITY;
        }
        if (phi > 1) {
            return Double.POSITIVE_INFINITY;
        }
        double target = phi * points.get(points.size() - 1)[1];

        double previousBound = 0.0;
        double previousCount = 0.0;
        for (double[] point : points) {
            double bound = point[0];
            double count = point[1];
            if (count >= target) {
                if (Double.isInfinite(bound)) {
                    // the rank falls in the +Inf bucket
                    return previousBound;
                }
                double bucketCount = count - previousCount;
                if (bucketCount <= 0) {
                    return previousBound;
                }
                return previousBound + (bound - previousBound) * (target - previousCount) / bucketCount;
            }
            previousBound = bound;
            previousCount = count;
        }
        return Double.NaN;
    }

    private static Double parseUpperBound(String le) {
        if (le.isEmpty()) {
            return null;
        }
        if (LabelConstants.POSITIVE_INFINITY.equals(le)) {
            return Double.POSITIVE_INFINITY;
        }
        try {
            return Double.parseDouble(le);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Bucket(double upperBound, Sample[] samples) {
    }
}
