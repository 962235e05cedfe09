/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Represents a unary sign applied to an expression, e.g. {@code -rate(x[5m])}.
 */
public class UnaryExpressionNode extends PromASTNode {
    private final boolean negative;

    /**
     * Constructor for UnaryExpressionNode.
     * @param negative true for {@code -}, false for {@code +}
     * @param expression the operand
     */
    public UnaryExpressionNode(boolean negative, PromASTNode expression) {
        super();
        this.negative = negative;
        addChild(expression);
    }

    public boolean isNegative() {
        return negative;
    }

    public PromASTNode getExpression() {
        return childAt(0);
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
