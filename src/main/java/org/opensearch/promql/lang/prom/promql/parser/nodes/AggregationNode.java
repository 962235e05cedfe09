/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import org.opensearch.promql.lang.prom.common.GroupingModifier;

import java.util.List;

/**
 * An aggregation operator over an instant vector, e.g. {@code sum by (job) (x)} or {@code topk(3, x)}.
 *
 * <p>The aggregated expression is the single child. The leading parameter of {@code topk},
 * {@code bottomk}, {@code quantile} and {@code count_values} is held apart from the children,
 * so it is not visited as a series operand.</p>
 */
public class AggregationNode extends PromASTNode {
    /** Operator name as written, resolved by the plan converter. */
    private final String aggregationType;

    /** {@code by}, {@code without}, or null when the clause is absent. */
    private final GroupingModifier groupingModifier;

    private final List<String> groupingLabels;

    private PromASTNode parameter;

    /**
     * @param aggregationType the operator name, e.g. {@code sum}
     * @param groupingModifier the grouping clause kind, or null for a single group
     * @param groupingLabels labels of the clause, may be null
     */
    public AggregationNode(String aggregationType, GroupingModifier groupingModifier, List<String> groupingLabels) {
        super();
        this.aggregationType = aggregationType;
        this.groupingModifier = groupingModifier;
        this.groupingLabels = groupingLabels != null ? List.copyOf(groupingLabels) : List.of();
    }

    public String getAggregationType() {
        return aggregationType;
    }

    public GroupingModifier getGroupingModifier() {
        return groupingModifier;
    }

    public List<String> getGroupingLabels() {
        return groupingLabels;
    }

    public void setExpression(PromASTNode expression) {
        addChild(expression);
    }

    /**
     * @return the aggregated expression, or null if none was set
     */
    public PromASTNode getExpression() {
        return childAt(0);
    }

    public void setParameter(PromASTNode parameter) {
        this.parameter = parameter;
    }

    /**
     * @return the leading parameter, or null if the call has none
     */
    public PromASTNode getParameter() {
        return parameter;
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
