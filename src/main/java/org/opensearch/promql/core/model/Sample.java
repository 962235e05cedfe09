/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

/**
 * Represents a single data point in a time series.
 *
 * A sample consists of a timestamp in epoch milliseconds and a value.
 */
public interface Sample {
    /**
     * Get the timestamp of the sample.
     *
     * @return the timestamp in milliseconds
     */
    long getTimestamp();

    /**
     * Get the value of this sample.
     *
     * @return the value as a double
     */
    double getValue();

    /**
     * Get the timestamp in seconds, the unit PromQL computes rates and regressions in.
     *
     * @return the timestamp in seconds
     */
    default double getTimestampSeconds() {
        return getTimestamp() / 1000.0;
    }
}
