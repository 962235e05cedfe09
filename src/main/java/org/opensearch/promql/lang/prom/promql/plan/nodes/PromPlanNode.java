/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan.nodes;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the executable plan produced by {@link org.opensearch.promql.lang.prom.promql.plan.PromASTConverter}.
 *
 * <p>Ids are unique within one plan and assigned in conversion order. Children are the series
 * inputs of the node; numeric parameters are held as fields of the concrete node.</p>
 */
public abstract class PromPlanNode {
    private final int id;

    protected final List<PromPlanNode> children = new ArrayList<>();

    protected PromPlanNode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public void addChild(PromPlanNode child) {
        children.add(child);
    }

    public List<PromPlanNode> getChildren() {
        return children;
    }

    public abstract <T> T accept(PromPlanVisitor<T> visitor);

    /**
     * @return a one-line description of this node, e.g. {@code Function[rate]}
     */
    public abstract String getExplainName();

    /**
     * Render the plan rooted at this node, one node per line, children indented by two spaces.
     *
     * @return the rendered tree, each line terminated by {@code \n}
     */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        appendExplain(sb, 0);
        return sb.toString();
    }

    private void appendExplain(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(getExplainName()).append('\n');
        for (PromPlanNode child : children) {
            child.appendExplain(sb, depth + 1);
        }
    }
}
