/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.FunctionType;
import org.opensearch.promql.lang.prom.function.RangeFunctions;
import org.opensearch.promql.query.stage.StepGrid;
import org.opensearch.promql.query.stage.UnaryPipelineStage;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Applies a range function over a sliding window at every step of the grid.
 *
 * <p>Input series are raw, unaligned matrix selector results. For step {@code t} the window is
 * every sample with a timestamp in {@code [t - range, t]}. Series without any output point are
 * dropped; labels are kept unchanged.</p>
 */
public class RangeFunctionStage implements UnaryPipelineStage {
    private final FunctionType functionType;
    private final double parameter;
    private final long rangeMs;
    private final StepGrid grid;

    /**
     * Constructor for RangeFunctionStage.
     * @param functionType a range function
     * @param parameter the quantile of quantile_over_time or the offset in seconds of predict_linear
     * @param rangeMs the window length in milliseconds
     * @param grid the output timestamps
     */
    public RangeFunctionStage(FunctionType functionType, double parameter, long rangeMs, StepGrid grid) {
        if (functionType.requiresRangeVector() == false) {
            throw new IllegalArgumentException("Not a range function: " + functionType);
        }
        this.functionType = functionType;
        this.parameter = parameter;
        this.rangeMs = rangeMs;
        this.grid = grid;
    }

    @Override
    public String getName() {
        return functionType.getName();
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        List<TimeSeries> result = new ArrayList<>(input.size());
        for (TimeSeries series : input) {
            List<Sample> samples = series.getSamples();
            List<Sample> output = new ArrayList<>(grid.size());
            for (long t : grid.getTimestamps()) {
                OptionalDouble value = RangeFunctions.apply(functionType, StepGrid.window(samples, t - rangeMs, t), parameter);
                if (value.isPresent()) {
                    output.add(new FloatSample(t, value.getAsDouble()));
                }
            }
            if (output.isEmpty() == false) {
                result.add(series.withSamples(output));
            }
        }
        return result;
    }
}
