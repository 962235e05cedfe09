/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import org.opensearch.promql.lang.prom.promql.plan.nodes.AggregationPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.BinaryPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FetchPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FuncPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.NegatePlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanVisitor;
import org.opensearch.promql.lang.prom.promql.plan.nodes.ScalarPlanNode;

/**
 * Computes the look-back of a range query: the largest range vector duration in the plan.
 *
 * <p>Leaves without a range (instant selectors, number literals, functions without a series
 * argument) contribute the default look-back, so the result is never below it unless every leaf
 * is a range vector.</p>
 */
public class LookbackExtractor extends PromPlanVisitor<Long> {
    private final long defaultLookbackMs;

    /**
     * Constructor for LookbackExtractor.
     * @param defaultLookbackMs look-back of leaves without a range
     */
    public LookbackExtractor(long defaultLookbackMs) {
        this.defaultLookbackMs = defaultLookbackMs;
    }

    @Override
    public Long visit(FetchPlanNode node) {
        return node.isRangeVector() ? node.getRangeMs() : defaultLookbackMs;
    }

    @Override
    public Long visit(FuncPlanNode node) {
        PromPlanNode series = node.getSeriesArgument();
        return series != null ? process(series) : defaultLookbackMs;
    }

    @Override
    public Long visit(AggregationPlanNode node) {
        return process(node.getChildren().get(0));
    }

    @Override
    public Long visit(BinaryPlanNode node) {
        return Math.max(process(node.getLeft()), process(node.getRight()));
    }

    @Override
    public Long visit(NegatePlanNode node) {
        return process(node.getChildren().get(0));
    }

    @Override
    public Long visit(ScalarPlanNode node) {
        return defaultLookbackMs;
    }
}
