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
import org.opensearch.promql.lang.prom.function.ScalarFunctions;
import org.opensearch.promql.query.stage.UnaryPipelineStage;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Applies a math function to every sample of every series. Labels are unchanged.
 *
 * <p>{@code timestamp()} replaces each value with its sample timestamp in seconds.
 * {@code clamp(v, min, max)} with {@code min > max} produces no series.</p>
 */
public class ScalarFunctionStage implements UnaryPipelineStage {
    private final FunctionType functionType;
    private final List<Double> arguments;

    /**
     * Constructor for ScalarFunctionStage.
     * @param functionType a pointwise function
     * @param arguments the numeric arguments of the call
     */
    public ScalarFunctionStage(FunctionType functionType, List<Double> arguments) {
        this.functionType = functionType;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public String getName() {
        return functionType.getName();
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        if (functionType == FunctionType.CLAMP && arguments.get(0) > arguments.get(1)) {
            return new ArrayList<>();
        }
        DoubleUnaryOperator operator = functionType == FunctionType.TIMESTAMP ? null : ScalarFunctions.operator(functionType, arguments);

        List<TimeSeries> result = new ArrayList<>(input.size());
        for (TimeSeries series : input) {
            List<Sample> output = new ArrayList<>(series.getSamples().size());
            for (Sample sample : series.getSamples()) {
                double value = operator == null ? sample.getTimestampSeconds() : operator.applyAsDouble(sample.getValue());
                output.add(new FloatSample(sample.getTimestamp(), value));
            }
            result.add(series.withSamples(output));
        }
        return result;
    }
}
