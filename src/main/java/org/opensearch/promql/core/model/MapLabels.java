/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import org.opensearch.common.hash.MurmurHash3;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * MapLabels implements Labels using a sorted map for storage.
 */
public class MapLabels implements Labels {
    private static final MapLabels EMPTY = new MapLabels(new TreeMap<>());

    private final SortedMap<String, String> labels;
    private long hash = Long.MIN_VALUE;

    private MapLabels(SortedMap<String, String> labels) {
        this.labels = labels;
    }

    /**
     * Create labels from a map. The map is copied.
     *
     * @param labels label name to value
     * @return the labels
     */
    public static MapLabels fromMap(Map<String, String> labels) {
        return new MapLabels(new TreeMap<>(labels));
    }

    /**
     * Create labels from alternating name/value strings.
     *
     * @param labels name1, value1, name2, value2, ...
     * @return the labels
     */
    public static MapLabels fromStrings(String... labels) {
        if (labels.length % 2 != 0) {
            throw new IllegalArgumentException("Labels must be in pairs");
        }
        TreeMap<String, String> labelMap = new TreeMap<>();
        for (int i = 0; i < labels.length; i += 2) {
            labelMap.put(labels[i], labels[i + 1]);
        }
        return new MapLabels(labelMap);
    }

    public static MapLabels emptyLabels() {
        return EMPTY;
    }

    @Override
    public String toKeyValueString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            sb.append(entry.getKey());
            sb.append(LabelConstants.LABEL_DELIMITER);
            sb.append(entry.getValue());
            sb.append(LabelConstants.SPACE_SEPARATOR);
        }
        if (sb.length() > 0) {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    @Override
    public Map<String, String> toMapView() {
        return Collections.unmodifiableSortedMap(labels);
    }

    @Override
    public boolean isEmpty() {
        return labels.isEmpty();
    }

    @Override
    public int size() {
        return labels.size();
    }

    @Override
    public String get(String name) {
        return labels.getOrDefault(name, LabelConstants.EMPTY_STRING);
    }

    @Override
    public boolean has(String name) {
        return labels.containsKey(name);
    }

    @Override
    public Labels keepOnly(Collection<String> names) {
        TreeMap<String, String> kept = new TreeMap<>();
        for (String name : names) {
            String value = labels.get(name);
            if (value != null) {
                kept.put(name, value);
            }
        }
        return new MapLabels(kept);
    }

    @Override
    public Labels without(Collection<String> names) {
        TreeMap<String, String> kept = new TreeMap<>(labels);
        kept.keySet().removeAll(names);
        return new MapLabels(kept);
    }

    @Override
    public Labels withLabel(String name, String value) {
        TreeMap<String, String> copy = new TreeMap<>(labels);
        copy.put(name, value);
        return new MapLabels(copy);
    }

    @Override
    public long stableHash() {
        if (hash != Long.MIN_VALUE) {
            return hash;
        }

        // combine logic from boost::hash_combine
        long combinedHash = 0;
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            combinedHash = combine(combinedHash, entry.getKey());
            combinedHash = combine(combinedHash, entry.getValue());
        }
        hash = combinedHash;
        return combinedHash;
    }

    private static long combine(long combinedHash, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        long valueHash = MurmurHash3.hash128(bytes, 0, bytes.length, 0, new MurmurHash3.Hash128()).h1;
        return combinedHash ^ (valueHash + 0x9e3779b97f4a7c15L + (combinedHash << 6) + (combinedHash >> 2));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MapLabels)) return false;
        MapLabels other = (MapLabels) o;
        return labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(stableHash());
    }

    @Override
    public String toString() {
        return toKeyValueString();
    }
}
