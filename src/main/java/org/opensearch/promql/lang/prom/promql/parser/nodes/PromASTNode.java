/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the parsed PromQL expression tree handed to the engine.
 *
 * <p>Operands are stored as ordered children; subclasses expose them under their own names
 * ({@code getLeft()}, {@code getExpression()}, ...) and return null for a missing operand, which
 * the plan converter reports as an invalid query. Dispatch goes through {@link PromASTVisitor}.</p>
 */
public abstract class PromASTNode {
    protected final List<PromASTNode> children = new ArrayList<>();

    protected PromASTNode() {}

    public void addChild(PromASTNode child) {
        children.add(child);
    }

    /**
     * @return operands in source order; empty for leaves
     */
    public List<PromASTNode> getChildren() {
        return children;
    }

    /**
     * @param index operand position
     * @return the operand, or null if the node has fewer children
     */
    protected PromASTNode childAt(int index) {
        return index < children.size() ? children.get(index) : null;
    }

    public abstract <T> T accept(PromASTVisitor<T> visitor);
}
