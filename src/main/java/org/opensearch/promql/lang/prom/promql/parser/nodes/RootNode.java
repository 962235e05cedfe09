/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Top level node of the PromQL AST. Holds exactly one expression child.
 */
public class RootNode extends PromASTNode {

    /**
     * Constructor for RootNode.
     */
    public RootNode() {
        super();
    }

    /**
     * Constructor for RootNode wrapping an expression.
     * @param expression the query expression
     */
    public RootNode(PromASTNode expression) {
        super();
        addChild(expression);
    }

    /**
     * Gets the query expression.
     * @return the expression, or null if the root is empty
     */
    public PromASTNode getExpression() {
        return childAt(0);
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
