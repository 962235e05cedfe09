/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import java.util.Objects;

/**
 * A sample implementation that stores floating-point values.
 */
public class FloatSample implements Sample {

    private final long timestamp;
    private final double value;

    /**
     * Constructs a new FloatSample with the specified timestamp and value.
     *
     * @param timestamp the timestamp of the sample in milliseconds
     * @param value the floating-point value
     */
    public FloatSample(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    @Override
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FloatSample that = (FloatSample) o;
        return timestamp == that.timestamp && Double.compare(that.value, value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "FloatSample{" + "timestamp=" + timestamp + ", value=" + value + '}';
    }
}
