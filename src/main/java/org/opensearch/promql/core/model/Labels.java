/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import java.util.Collection;
import java.util.Map;

/**
 * An immutable set of label name/value pairs identifying a time series.
 *
 * <p>Iteration order is deterministic so that two label sets with the same pairs
 * compare equal and render identically.</p>
 */
public interface Labels {

    /**
     * Get the value of a label.
     *
     * @param name the label name
     * @return the label value, or the empty string if the label is absent
     */
    String get(String name);

    /**
     * Check whether a label is present.
     *
     * @param name the label name
     * @return true if the label exists
     */
    boolean has(String name);

    /**
     * @return true if there are no labels
     */
    boolean isEmpty();

    /**
     * @return the number of labels
     */
    int size();

    /**
     * Get an unmodifiable, ordered map view of the labels.
     *
     * @return map of label name to value
     */
    Map<String, String> toMapView();

    /**
     * Render the labels as {@code name:value} pairs separated by spaces.
     *
     * @return the key-value string
     */
    String toKeyValueString();

    /**
     * Create a copy that keeps only the given label names.
     *
     * @param names label names to keep
     * @return the projected labels
     */
    Labels keepOnly(Collection<String> names);

    /**
     * Create a copy without the given label names.
     *
     * @param names label names to drop
     * @return the remaining labels
     */
    Labels without(Collection<String> names);

    /**
     * Create a copy with one label added or replaced.
     *
     * @param name the label name
     * @param value the label value
     * @return the new labels
     */
    Labels withLabel(String name, String value);

    /**
     * Hash that is stable across JVMs, used as the identity of a label set.
     *
     * @return a 64-bit hash of all pairs
     */
    long stableHash();
}
