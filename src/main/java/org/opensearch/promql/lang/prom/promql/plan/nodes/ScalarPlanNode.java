/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

/**
 * Plan node producing a constant scalar at every step.
 */
public class ScalarPlanNode extends PromPlanNode {
    private final double value;

    public ScalarPlanNode(int id, double value) {
        super(id);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Scalar[" + value + "]";
    }
}
