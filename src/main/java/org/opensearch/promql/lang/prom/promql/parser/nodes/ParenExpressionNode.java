/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Represents a parenthesized expression.
 */
public class ParenExpressionNode extends PromASTNode {

    public ParenExpressionNode(PromASTNode expression) {
        super();
        addChild(expression);
    }

    public PromASTNode getExpression() {
        return childAt(0);
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
