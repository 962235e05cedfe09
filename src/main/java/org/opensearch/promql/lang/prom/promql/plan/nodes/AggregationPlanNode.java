/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

import org.opensearch.promql.lang.prom.common.AggregationType;
import org.opensearch.promql.lang.prom.common.GroupingModifier;

import java.util.List;

/**
 * Plan node representing an aggregation operation.
 */
public class AggregationPlanNode extends PromPlanNode {
    private final AggregationType aggregationType;
    private final GroupingModifier groupingModifier;
    private final List<String> groupingLabels;
    private final Double parameter;

    /**
     * Constructor for AggregationPlanNode.
     * @param id unique identifier for this node
     * @param aggregationType the aggregation operator
     * @param groupingModifier BY, WITHOUT, or null for no grouping
     * @param groupingLabels labels named by the grouping modifier
     * @param parameter numeric parameter of quantile/topk/bottomk, null otherwise
     */
    public AggregationPlanNode(
        int id,
        AggregationType aggregationType,
        GroupingModifier groupingModifier,
        List<String> groupingLabels,
        Double parameter
    ) {
        super(id);
        this.aggregationType = aggregationType;
        this.groupingModifier = groupingModifier;
        this.groupingLabels = groupingLabels != null ? List.copyOf(groupingLabels) : List.of();
        this.parameter = parameter;
    }

    public AggregationType getAggregationType() {
        return aggregationType;
    }

    public GroupingModifier getGroupingModifier() {
        return groupingModifier;
    }

    public List<String> getGroupingLabels() {
        return groupingLabels;
    }

    public Double getParameter() {
        return parameter;
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Aggregation[" + aggregationType + "]";
    }
}
