/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

/**
 * Constants used for label parsing and formatting.
 */
public final class LabelConstants {

    private LabelConstants() {
        // Utility class
    }

    /* empty string*/
    public static final String EMPTY_STRING = "";

    /**
     * Space separator character.
     */
    public static final char SPACE_SEPARATOR = ' ';

    /**
     * Label delimiter used to delimit label name and value.
     */
    public static final char LABEL_DELIMITER = ':';

    /** Reserved label carrying the metric name. */
    public static final String METRIC_NAME = "__name__";

    /** Label carrying the resource (service) name of a series. */
    public static final String SERVICE_NAME = "service_name";

    /** Alias of {@link #SERVICE_NAME} accepted in label matchers. */
    public static final String JOB = "job";

    /** Histogram bucket upper bound label. */
    public static final String BUCKET_UPPER_BOUND = "le";

    /** Bucket bound value denoting positive infinity. */
    public static final String POSITIVE_INFINITY = "+Inf";
}
