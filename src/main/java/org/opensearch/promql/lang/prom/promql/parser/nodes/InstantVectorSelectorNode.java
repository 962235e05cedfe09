/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Selector evaluated at each step against the latest sample inside the look-back window,
 * e.g. {@code http_requests_total{job="api"}}.
 */
public class InstantVectorSelectorNode extends VectorSelectorNode {

    public InstantVectorSelectorNode(String metricName) {
        super(metricName);
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
