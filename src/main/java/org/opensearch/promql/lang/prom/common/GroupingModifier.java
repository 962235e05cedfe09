/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

import org.opensearch.promql.core.model.LabelConstants;

import java.util.Collection;

/**
 * How an aggregation's label list selects the labels of each output group.
 */
public enum GroupingModifier {
    /** {@code by (...)}: the group keeps the listed labels only. */
    BY {
        @Override
        public boolean keepsLabel(String labelName, Collection<String> groupingLabels) {
            return groupingLabels.contains(labelName);
        }
    },

    /** {@code without (...)}: the group drops the listed labels and the metric name. */
    WITHOUT {
        @Override
        public boolean keepsLabel(String labelName, Collection<String> groupingLabels) {
            return LabelConstants.METRIC_NAME.equals(labelName) == false && groupingLabels.contains(labelName) == false;
        }
    };

    /**
     * @param labelName a label of a member series
     * @param groupingLabels the label list of the clause
     * @return true if the label becomes part of the group key
     */
    public abstract boolean keepsLabel(String labelName, Collection<String> groupingLabels);
}
