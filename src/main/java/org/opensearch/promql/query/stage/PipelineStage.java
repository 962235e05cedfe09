/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.query.stage;

/**
 * Interface for pipeline stages that process time series.
 *
 * <p>A stage is one step of evaluating a PromQL plan: it turns the series produced by its
 * child plans into new series. Stages are created per evaluation and hold no state across calls,
 * so the same stage may be applied to the same input repeatedly with identical results.</p>
 *
 * @see UnaryPipelineStage
 * @see BinaryPipelineStage
 */
public interface PipelineStage {
    /**
     * Get the name of this pipeline stage.
     *
     * @return The stage name
     */
    String getName();
}
