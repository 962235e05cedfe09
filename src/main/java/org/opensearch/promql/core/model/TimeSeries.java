/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A labelled, timestamp-ordered sequence of samples.
 *
 * <p>Samples are sorted ascending by timestamp and no two samples share a timestamp.
 * Raw series fetched from a store keep their original timestamps; series produced by
 * evaluation carry one sample per step of the query grid at most.</p>
 *
 * <p>A series with an empty label set is a <em>scalar</em>: binary operators apply it
 * to every series of the other operand instead of matching it by labels.</p>
 */
public class TimeSeries {

    private final List<Sample> samples;
    private final Labels labels;

    /**
     * Constructor for creating a TimeSeries.
     *
     * @param samples samples sorted ascending by timestamp
     * @param labels labels identifying this series
     */
    public TimeSeries(List<Sample> samples, Labels labels) {
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * Get the list of samples in this time series.
     *
     * @return unmodifiable list of samples
     */
    public List<Sample> getSamples() {
        return samples;
    }

    /**
     * Get the labels associated with this time series.
     *
     * @return Labels object containing key-value pairs
     */
    public Labels getLabels() {
        return labels;
    }

    /**
     * Get labels as a Map.
     *
     * @return Map view of labels
     */
    public Map<String, String> getLabelsMap() {
        return labels.toMapView();
    }

    /**
     * @return true if this series has no labels and therefore acts as a scalar
     */
    public boolean isScalar() {
        return labels.isEmpty();
    }

    /**
     * @return the most recent sample, or null if the series is empty
     */
    public Sample getLastSample() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1);
    }

    /**
     * Create a series with the same labels and different samples.
     *
     * @param newSamples the replacement samples
     * @return the new series
     */
    public TimeSeries withSamples(List<Sample> newSamples) {
        return new TimeSeries(newSamples, labels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSeries that = (TimeSeries) o;
        return Objects.equals(samples, that.samples) && Objects.equals(labels, that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(samples, labels);
    }

    @Override
    public String toString() {
        return "TimeSeries{" + "samples=" + samples + ", labels=" + labels + '}';
    }
}
