/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Selector returning every raw sample inside a trailing window, e.g. {@code http_requests_total[5m]}.
 * Only valid as the argument of a range function or as the root of an instant query.
 */
public class RangeVectorSelectorNode extends VectorSelectorNode {
    /** Window length in milliseconds. */
    private final long rangeMs;

    public RangeVectorSelectorNode(String metricName, long rangeMs) {
        super(metricName);
        this.rangeMs = rangeMs;
    }

    public long getRangeMs() {
        return rangeMs;
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return super.toString() + "[" + rangeMs + "ms]";
    }
}
