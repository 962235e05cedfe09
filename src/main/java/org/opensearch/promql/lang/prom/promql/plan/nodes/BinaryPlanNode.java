/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;

/**
 * Plan node combining two child plans with a binary operator. Child 0 is the left operand.
 */
public class BinaryPlanNode extends PromPlanNode {
    private final BinaryOperatorType operator;
    private final BinaryModifier modifier;

    public BinaryPlanNode(int id, BinaryOperatorType operator, BinaryModifier modifier) {
        super(id);
        this.operator = operator;
        this.modifier = modifier;
    }

    public BinaryOperatorType getOperator() {
        return operator;
    }

    public BinaryModifier getModifier() {
        return modifier;
    }

    public PromPlanNode getLeft() {
        return children.get(0);
    }

    public PromPlanNode getRight() {
        return children.get(1);
    }

    @Override
    public <T> T accept(PromPlanVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String getExplainName() {
        return "Binary[" + operator + "]";
    }
}
