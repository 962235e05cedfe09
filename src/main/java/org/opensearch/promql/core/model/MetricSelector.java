/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A metric name plus an ordered list of label matchers. An empty or null metric name selects any metric.
 */
public final class MetricSelector {
    private final String metricName;
    private final List<LabelMatcher> matchers;

    public MetricSelector(String metricName, List<LabelMatcher> matchers) {
        this.metricName = metricName != null ? metricName : LabelConstants.EMPTY_STRING;
        this.matchers = matchers != null ? List.copyOf(matchers) : List.of();
    }

    /**
     * @return the metric name, or the empty string for any metric
     */
    public String getMetricName() {
        return metricName;
    }

    /**
     * @return true if the selector constrains the metric name
     */
    public boolean hasMetricName() {
        return metricName.isEmpty() == false;
    }

    public List<LabelMatcher> getMatchers() {
        return matchers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricSelector that = (MetricSelector) o;
        return metricName.equals(that.metricName) && matchers.equals(that.matchers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, matchers);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(metricName);
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
