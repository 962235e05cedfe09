/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

import java.util.List;

/**
 * Vector matching options of a binary operation: {@code on}/{@code ignoring} labels,
 * {@code group_left}/{@code group_right} cardinality with its extra labels, and the {@code bool} flag.
 */
public final class BinaryModifier {

    private static final BinaryModifier NONE = new BinaryModifier(VectorMatchCardinality.ONE_TO_ONE, List.of(), false, List.of(), false);

    private final VectorMatchCardinality cardinality;
    private final List<String> matchingLabels;
    private final boolean on;
    private final List<String> includeLabels;
    private final boolean returnBool;

    /**
     * Constructor for BinaryModifier.
     * @param cardinality the match cardinality
     * @param matchingLabels labels listed in {@code on(...)} or {@code ignoring(...)}
     * @param on true if {@code matchingLabels} came from {@code on}, false for {@code ignoring}
     * @param includeLabels extra labels copied from the "one" side for {@code group_left}/{@code group_right}
     * @param returnBool true if comparisons return 0/1 instead of filtering
     */
    public BinaryModifier(
        VectorMatchCardinality cardinality,
        List<String> matchingLabels,
        boolean on,
        List<String> includeLabels,
        boolean returnBool
    ) {
        this.cardinality = cardinality != null ? cardinality : VectorMatchCardinality.ONE_TO_ONE;
        this.matchingLabels = matchingLabels != null ? List.copyOf(matchingLabels) : List.of();
        this.on = on;
        this.includeLabels = includeLabels != null ? List.copyOf(includeLabels) : List.of();
        this.returnBool = returnBool;
    }

    /**
     * @return the modifier of an operation written without any matching clause
     */
    public static BinaryModifier none() {
        return NONE;
    }

    /**
     * @param labels labels to match on
     * @return a one-to-one modifier using {@code on(labels)}
     */
    public static BinaryModifier on(String... labels) {
        return new BinaryModifier(VectorMatchCardinality.ONE_TO_ONE, List.of(labels), true, List.of(), false);
    }

    /**
     * @param labels labels to ignore while matching
     * @return a one-to-one modifier using {@code ignoring(labels)}
     */
    public static BinaryModifier ignoring(String... labels) {
        return new BinaryModifier(VectorMatchCardinality.ONE_TO_ONE, List.of(labels), false, List.of(), false);
    }

    /**
     * @return a copy of this modifier with the {@code bool} flag set
     */
    public BinaryModifier withReturnBool() {
        return new BinaryModifier(cardinality, matchingLabels, on, includeLabels, true);
    }

    /**
     * @param newCardinality the cardinality
     * @param labels extra labels to copy from the "one" side
     * @return a copy of this modifier with the given grouping
     */
    public BinaryModifier withGrouping(VectorMatchCardinality newCardinality, String... labels) {
        return new BinaryModifier(newCardinality, matchingLabels, on, List.of(labels), returnBool);
    }

    public VectorMatchCardinality getCardinality() {
        return cardinality;
    }

    public List<String> getMatchingLabels() {
        return matchingLabels;
    }

    public boolean isOn() {
        return on;
    }

    public List<String> getIncludeLabels() {
        return includeLabels;
    }

    public boolean isReturnBool() {
        return returnBool;
    }

    @Override
    public String toString() {
        return "BinaryModifier{"
            + "cardinality="
            + cardinality
            + ", matchingLabels="
            + matchingLabels
            + ", on="
            + on
            + ", includeLabels="
            + includeLabels
            + ", returnBool="
            + returnBool
            + '}';
    }
}
