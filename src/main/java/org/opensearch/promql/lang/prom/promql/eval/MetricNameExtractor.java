/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import org.opensearch.promql.lang.prom.promql.parser.nodes.LabelMatcherNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.PromASTNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.VectorSelectorNode;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Collects the metric names a query refers to, e.g. to route it or to check access before
 * evaluation.
 */
public final class MetricNameExtractor {

    private MetricNameExtractor() {}

    /**
     * Extract the metric names of every selector in a tree.
     *
     * <p>A selector names its metric either before the braces or with an equality matcher on
     * {@code __name__}. Selectors without a fixed name contribute nothing.</p>
     *
     * @param node the root of the tree
     * @return distinct names, sorted
     */
    public static List<String> extract(PromASTNode node) {
        TreeSet<String> names = new TreeSet<>();
        collect(node, names);
        return new ArrayList<>(names);
    }

    private static void collect(PromASTNode node, TreeSet<String> names) {
        if (node == null) {
            return;
        }
        if (node instanceof VectorSelectorNode selector) {
            String metricName = selector.getMetricName();
            if (metricName != null && metricName.isEmpty() == false) {
                names.add(metricName);
            }
            for (LabelMatcherNode matcher : selector.getMatchers()) {
                if (matcher.isMetricNameEquality()) {
                    names.add(matcher.getValue());
                }
            }
        }
        for (PromASTNode child : node.getChildren()) {
            collect(child, names);
        }
    }
}
