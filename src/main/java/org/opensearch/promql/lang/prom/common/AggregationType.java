/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

import java.util.Locale;

/**
 * Supported PromQL aggregation operators.
 */
public enum AggregationType {
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    STDDEV,
    STDVAR,
    QUANTILE,
    GROUP,
    COUNT_VALUES,
    TOPK,
    BOTTOMK;

    /**
     * Parse aggregation type from string.
     */
    public static AggregationType fromString(String type) {
        try {
            return valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation type: " + type);
        }
    }

    /**
     * Whether the operator takes a leading parameter, e.g. {@code topk(3, ...)}.
     * @return true if a parameter is mandatory
     */
    public boolean requiresParameter() {
        return this == QUANTILE || this == TOPK || this == BOTTOMK || this == COUNT_VALUES;
    }

    /**
     * Whether the parameter is a label name string rather than a number.
     * @return true for count_values
     */
    public boolean hasStringParameter() {
        return this == COUNT_VALUES;
    }

    /**
     * Whether the operator selects whole member series instead of reducing values per step.
     * @return true for topk and bottomk
     */
    public boolean selectsSeries() {
        return this == TOPK || this == BOTTOMK;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
