/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.MatcherType;
import org.opensearch.promql.lang.prom.promql.parser.nodes.FunctionCallNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.InstantVectorSelectorNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.LabelMatcherNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.PromASTNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RangeVectorSelectorNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility functions for PromQL tests.
 */
public class PromTestUtils {

    /** Timestamps in seconds of the 12 point counter fixture. */
    public static final long[] FIXTURE_TIMESTAMPS = { 5, 15, 24, 36, 49, 60, 78, 80, 97, 115, 120, 130 };

    /** Values of the 12 point counter fixture. */
    public static final double[] FIXTURE_VALUES = { 123, 34, 44, 21, 54, 34, 99, 12, 44, 32, 34, 34 };

    /**
     * Build samples from timestamps in seconds.
     *
     * @param seconds timestamps in seconds
     * @param values values, same length
     * @return samples with millisecond timestamps
     */
    public static List<Sample> samples(long[] seconds, double[] values) {
        List<Sample> samples = new ArrayList<>(seconds.length);
        for (int i = 0; i < seconds.length; i++) {
            samples.add(new FloatSample(seconds[i] * 1000L, values[i]));
        }
        return samples;
    }

    /**
     * Build samples from {@code {seconds, value}} pairs.
     *
     * @param points the pairs
     * @return samples with millisecond timestamps
     */
    public static List<Sample> points(double[]... points) {
        List<Sample> samples = new ArrayList<>(points.length);
        for (double[] point : points) {
            samples.add(new FloatSample((long) (point[0] * 1000), point[1]));
        }
        return samples;
    }

    /**
     * @return the samples of the 12 point counter fixture
     */
    public static List<Sample> fixture() {
        return samples(FIXTURE_TIMESTAMPS, FIXTURE_VALUES);
    }

    /**
     * Build a series.
     *
     * @param samples the samples
     * @param labels alternating label names and values
     * @return the series
     */
    public static TimeSeries series(List<Sample> samples, String... labels) {
        return new TimeSeries(samples, MapLabels.fromStrings(labels));
    }

    public static InstantVectorSelectorNode selector(String metricName, LabelMatcherNode... matchers) {
        InstantVectorSelectorNode node = new InstantVectorSelectorNode(metricName);
        for (LabelMatcherNode matcher : matchers) {
            node.addMatcher(matcher);
        }
        return node;
    }

    public static RangeVectorSelectorNode matrix(String metricName, long rangeMs, LabelMatcherNode... matchers) {
        RangeVectorSelectorNode node = new RangeVectorSelectorNode(metricName, rangeMs);
        for (LabelMatcherNode matcher : matchers) {
            node.addMatcher(matcher);
        }
        return node;
    }

    public static LabelMatcherNode matcher(String name, MatcherType type, String value) {
        return new LabelMatcherNode(name, type, value);
    }

    public static FunctionCallNode call(String functionName, PromASTNode... arguments) {
        FunctionCallNode node = new FunctionCallNode(functionName);
        for (PromASTNode argument : arguments) {
            node.addArgument(argument);
        }
        return node;
    }
}
