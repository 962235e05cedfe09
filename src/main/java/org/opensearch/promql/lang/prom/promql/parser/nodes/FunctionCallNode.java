/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import java.util.List;

/**
 * A call such as {@code rate(http_requests_total[5m])} or {@code clamp(x, 0, 1)}.
 * The name is resolved against the supported functions by the plan converter, not here.
 */
public class FunctionCallNode extends PromASTNode {
    private final String functionName;

    public FunctionCallNode(String functionName) {
        super();
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void addArgument(PromASTNode argument) {
        addChild(argument);
    }

    /**
     * @return arguments in call order
     */
    public List<PromASTNode> getArguments() {
        return getChildren();
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
