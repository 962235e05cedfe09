/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Represents a subquery such as {@code rate(x[5m])[1h:1m]}.
 */
public class SubqueryNode extends PromASTNode {
    private final long rangeMs;
    private final long stepMs;

    /**
     * Constructor for SubqueryNode.
     * @param expression the inner expression
     * @param rangeMs the subquery range in milliseconds
     * @param stepMs the subquery resolution in milliseconds, 0 for the default
     */
    public SubqueryNode(PromASTNode expression, long rangeMs, long stepMs) {
        super();
        this.rangeMs = rangeMs;
        this.stepMs = stepMs;
        addChild(expression);
    }

    public PromASTNode getExpression() {
        return childAt(0);
    }

    public long getRangeMs() {
        return rangeMs;
    }

    public long getStepMs() {
        return stepMs;
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
