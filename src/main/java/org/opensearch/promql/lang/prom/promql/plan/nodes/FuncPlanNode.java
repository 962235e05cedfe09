/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

import org.opensearch.promql.lang.prom.common.FunctionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan node representing a PromQL function call.
 *
 * <p>The series argument, if any, is the single child. Numeric arguments are kept in call order
 * without the series argument, so {@code quantile_over_time(0.9, x[5m])} and
 * {@code clamp_min(x, 0.9)} both carry {@code [0.9]}.
 *
 * <p>Examples:
 * <ul>
 *   <li>rate(http_requests_total[5m])</li>
 *   <li>clamp(cpu_usage, 0, 1)</li>
 *   <li>histogram_quantile(0.95, request_duration_bucket)</li>
 * </ul>
 */
public class FuncPlanNode extends PromPlanNode {
    /**
     * The function type.
     */
    private final FunctionType functionType;

    /**
     * Numeric literal arguments, in call order.
     */
    private final List<Double> arguments;

    /**
     * Constructor for FuncPlanNode.
     * @param id unique identifier for this node
     * @param functionType the function type
     * @param arguments numeric literal arguments
     */
    public FuncPlanNode(int id, FunctionType functionType, List<Double> arguments) {
        super(id);
        this.functionType = functionType;
        this.arguments = arguments != null ? new ArrayList<>(arguments) : new ArrayList<>();
    }

    /**
     * Gets the function type.
     * @return the function type
     */
    public FunctionType getFunctionType() {
        return functionType;
    }

    /**
     * Gets the numeric arguments.
     * @return the list of arguments
     */
    public List<Double> getArguments() {
        return arguments;
    }

    /**
     * Gets a numeric argument by position.
     * @param index position among the numeric arguments
     * @param defaultValue value returned when the optional argument is absent
     * @return the argument value
     */
    public double getArgument(int index, double defaultValue) {
        return index < arguments.size() ? arguments.get(index) : defaultValue;
    }

    /**
     * @return the series argument plan, or null for functions without one
     */
    public PromPlanNode getSeriesArgument() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Function[" + functionType.getName() + "]";
    }
}
