/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

import org.opensearch.promql.core.model.MetricSelector;

/**
 * Plan node representing a fetch operation (vector or matrix selector).
 */
public class FetchPlanNode extends PromPlanNode {
    private final MetricSelector selector;
    private final Long rangeMs;  // null for instant vector, non-null for range vector

    /**
     * Constructor for FetchPlanNode.
     * @param id unique identifier for this node
     * @param selector the metric name and label matchers
     * @param rangeMs the matrix range in milliseconds, or null for an instant vector
     */
    public FetchPlanNode(int id, MetricSelector selector, Long rangeMs) {
        super(id);
        this.selector = selector;
        this.rangeMs = rangeMs;
    }

    public MetricSelector getSelector() {
        return selector;
    }

    public Long getRangeMs() {
        return rangeMs;
    }

    public boolean isRangeVector() {
        return rangeMs != null;
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return isRangeVector() ? "Fetch[" + selector + "[" + rangeMs + "ms]]" : "Fetch[" + selector + "]";
    }
}
