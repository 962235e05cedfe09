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
 * Interface for pipeline stages combining two inputs, such as arithmetic between two vectors.
 */
public interface BinaryPipelineStage extends PipelineStage {

    /**
     * Combine the left and right operands.
     *
     * @param left The left operand time series
     * @param right The right operand time series
     * @return The result time series
     */
    List<TimeSeries> process(List<TimeSeries> left, List<TimeSeries> right);
}
