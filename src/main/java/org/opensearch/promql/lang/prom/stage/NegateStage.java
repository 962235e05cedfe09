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
import org.opensearch.promql.query.stage.UnaryPipelineStage;

import java.util.ArrayList;
import java.util.List;

/**
 * Unary minus: negates every sample value.
 */
public class NegateStage implements UnaryPipelineStage {

    @Override
    public String getName() {
        return "negate";
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        List<TimeSeries> result = new ArrayList<>(input.size());
        for (TimeSeries series : input) {
            List<Sample> negated = new ArrayList<>(series.getSamples().size());
            for (Sample sample : series.getSamples()) {
                negated.add(new FloatSample(sample.getTimestamp(), -sample.getValue()));
            }
            result.add(series.withSamples(negated));
        }
        return result;
    }
}
