/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import org.opensearch.promql.core.model.LabelMatcher;
import org.opensearch.promql.core.model.MetricSelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared part of instant and range selectors: an optional metric name plus label matchers.
 *
 * <p>Matchers are kept in their own list rather than as children, so a selector is a leaf of the
 * expression tree.</p>
 */
public abstract class VectorSelectorNode extends PromASTNode {
    /** Metric name written before the braces, or null for {@code {job="api"}}. */
    private final String metricName;

    private final List<LabelMatcherNode> matchers = new ArrayList<>();

    protected VectorSelectorNode(String metricName) {
        super();
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }

    public void addMatcher(LabelMatcherNode matcher) {
        matchers.add(matcher);
    }

    public List<LabelMatcherNode> getMatchers() {
        return matchers;
    }

    /**
     * Compile the name and matchers into the selector handed to the store.
     *
     * @return the selector
     * @throws org.opensearch.promql.exception.InvalidArgumentException if a regex matcher is invalid
     */
    public MetricSelector toMetricSelector() {
        List<LabelMatcher> compiled = new ArrayList<>(matchers.size());
        for (LabelMatcherNode matcher : matchers) {
            compiled.add(matcher.toLabelMatcher());
        }
        return new MetricSelector(metricName, compiled);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(metricName != null ? metricName : "");
        sb.append('{');
        for (int i = 0; i < matchers.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(matchers.get(i));
        }
        return sb.append('}').toString();
    }
}
