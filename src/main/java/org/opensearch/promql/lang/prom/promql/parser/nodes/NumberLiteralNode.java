/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Represents a numeric literal such as {@code 0.95} or {@code Inf}.
 */
public class NumberLiteralNode extends PromASTNode {
    private final double value;

    public NumberLiteralNode(double value) {
        super();
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
