/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.query.stage;

import org.opensearch.promql.core.model.TimeSeries;

import java.util.List;

/**
 * Interface for unary pipeline stages that operate on a single time series input.
 *
 * <h2>Common Unary Operations:</h2>
 * <ul>
 *   <li><strong>Windowing:</strong> rate, increase, avg_over_time</li>
 *   <li><strong>Aggregation:</strong> sum, avg, topk</li>
 *   <li><strong>Transformation:</strong> abs, clamp, negation, histogram_quantile</li>
 * </ul>
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * // Per-second rate over 5 minute windows at every step of the grid
 * UnaryPipelineStage rateStage = new RangeFunctionStage(FunctionType.RATE, 0.0, 300_000L, grid);
 * List<TimeSeries> rates = rateStage.process(rawSeries);
 * }</pre>
 */
public interface UnaryPipelineStage extends PipelineStage {

    /**
     * Process a single time series input and return the transformed time series.
     *
     * @param input The input time series to process
     * @return The transformed time series
     */
    List<TimeSeries> process(List<TimeSeries> input);
}
