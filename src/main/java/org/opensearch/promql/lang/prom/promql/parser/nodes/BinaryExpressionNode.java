/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;

/**
 * Represents a binary operation in PromQL.
 * Examples: errors / requests, cpu > bool 0.9, a * on(job) group_left(team) b
 */
public class BinaryExpressionNode extends PromASTNode {
    private final BinaryOperatorType operator;
    private final BinaryModifier modifier;

    /**
     * Constructor for BinaryExpressionNode.
     * @param operator the operator
     * @param modifier vector matching options, or null for none
     * @param left the left operand
     * @param right the right operand
     */
    public BinaryExpressionNode(BinaryOperatorType operator, BinaryModifier modifier, PromASTNode left, PromASTNode right) {
        super();
        this.operator = operator;
        this.modifier = modifier != null ? modifier : BinaryModifier.none();
        addChild(left);
        addChild(right);
    }

    public BinaryOperatorType getOperator() {
        return operator;
    }

    public BinaryModifier getModifier() {
        return modifier;
    }

    public PromASTNode getLeft() {
        return childAt(0);
    }

    public PromASTNode getRight() {
        return childAt(1);
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
