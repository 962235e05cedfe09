/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One raw data point as returned by a {@link MetricStore}.
 */
public final class MetricRow {
    private final String metricName;
    private final String resourceName;
    private final Map<String, String> attributes;
    private final long timestampMs;
    private final double value;

    /**
     * Constructor for MetricRow.
     * @param metricName the metric name
     * @param resourceName the emitting service, may be empty
     * @param attributes attribute name/value pairs
     * @param timestampMs timestamp in epoch milliseconds
     * @param value the value
     */
    public MetricRow(String metricName, String resourceName, Map<String, String> attributes, long timestampMs, double value) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.resourceName = resourceName != null ? resourceName : "";
        this.attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
        this.timestampMs = timestampMs;
        this.value = value;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getResourceName() {
        return resourceName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public long getTimestampMs() {
        return timestampMs;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricRow that = (MetricRow) o;
        return timestampMs == that.timestampMs
            && Double.compare(that.value, value) == 0
            && metricName.equals(that.metricName)
            && resourceName.equals(that.resourceName)
            && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, resourceName, attributes, timestampMs, value);
    }

    @Override
    public String toString() {
        return "MetricRow{"
            + "metricName='"
            + metricName
            + '\''
            + ", resourceName='"
            + resourceName
            + '\''
            + ", attributes="
            + attributes
            + ", timestampMs="
            + timestampMs
            + ", value="
            + value
            + '}';
    }
}
