/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

/**
 * Plan node negating every sample of its single child.
 */
public class NegatePlanNode extends PromPlanNode {

    public NegatePlanNode(int id) {
        super(id);
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Negate";
    }
}
