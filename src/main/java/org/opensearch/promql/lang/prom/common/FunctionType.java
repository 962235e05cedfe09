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
 * PromQL function types supported by the evaluator.
 *
 * <p>Based on the official Prometheus function list:
 * https://prometheus.io/docs/prometheus/latest/querying/functions/
 *
 * <p>Functions fall in two categories:
 * <ul>
 *   <li>{@link Category#RANGE}: consume the raw samples of a matrix selector in a sliding window
 *       and produce at most one value per step (rate, *_over_time, deriv, ...)</li>
 *   <li>{@link Category#SCALAR}: apply pointwise to every sample of an instant vector
 *       (abs, clamp, trigonometry, ...), plus histogram_quantile</li>
 * </ul>
 *
 * <p>Each function also declares its accepted argument count and the position of its series
 * argument; every other argument is a numeric literal.
 */
public enum FunctionType {
    // Rate/Counter functions
    RATE("rate", Category.RANGE),
    IRATE("irate", Category.RANGE),
    INCREASE("increase", Category.RANGE),
    DELTA("delta", Category.RANGE),
    IDELTA("idelta", Category.RANGE),

    // Aggregation over time functions
    SUM_OVER_TIME("sum_over_time", Category.RANGE),
    AVG_OVER_TIME("avg_over_time", Category.RANGE),
    MIN_OVER_TIME("min_over_time", Category.RANGE),
    MAX_OVER_TIME("max_over_time", Category.RANGE),
    COUNT_OVER_TIME("count_over_time", Category.RANGE),
    STDDEV_OVER_TIME("stddev_over_time", Category.RANGE),
    STDVAR_OVER_TIME("stdvar_over_time", Category.RANGE),
    QUANTILE_OVER_TIME("quantile_over_time", Category.RANGE, 2, 2, 1),
    LAST_OVER_TIME("last_over_time", Category.RANGE),
    FIRST_OVER_TIME("first_over_time", Category.RANGE),
    PRESENT_OVER_TIME("present_over_time", Category.RANGE),
    ABSENT_OVER_TIME("absent_over_time", Category.RANGE),

    // Regression and counting
    DERIV("deriv", Category.RANGE),
    PREDICT_LINEAR("predict_linear", Category.RANGE, 2, 2, 0),
    CHANGES("changes", Category.RANGE),
    RESETS("resets", Category.RANGE),

    // Math functions
    ABS("abs", Category.SCALAR),
    CEIL("ceil", Category.SCALAR),
    FLOOR("floor", Category.SCALAR),
    ROUND("round", Category.SCALAR, 1, 2, 0),
    SQRT("sqrt", Category.SCALAR),
    EXP("exp", Category.SCALAR),
    LN("ln", Category.SCALAR),
    LOG2("log2", Category.SCALAR),
    LOG10("log10", Category.SCALAR),
    SGN("sgn", Category.SCALAR),
    CLAMP("clamp", Category.SCALAR, 3, 3, 0),
    CLAMP_MAX("clamp_max", Category.SCALAR, 2, 2, 0),
    CLAMP_MIN("clamp_min", Category.SCALAR, 2, 2, 0),

    // Trigonometric functions
    ACOS("acos", Category.SCALAR),
    ACOSH("acosh", Category.SCALAR),
    ASIN("asin", Category.SCALAR),
    ASINH("asinh", Category.SCALAR),
    ATAN("atan", Category.SCALAR),
    ATANH("atanh", Category.SCALAR),
    COS("cos", Category.SCALAR),
    COSH("cosh", Category.SCALAR),
    SIN("sin", Category.SCALAR),
    SINH("sinh", Category.SCALAR),
    TAN("tan", Category.SCALAR),
    TANH("tanh", Category.SCALAR),
    DEG("deg", Category.SCALAR),
    RAD("rad", Category.SCALAR),
    PI("pi", Category.SCALAR, 0, 0, -1),

    // Other functions
    TIMESTAMP("timestamp", Category.SCALAR),
    HISTOGRAM_QUANTILE("histogram_quantile", Category.SCALAR, 2, 2, 1);

    /**
     * How a function consumes its series argument.
     */
    public enum Category {
        RANGE,
        SCALAR
    }

    private final String name;
    private final Category category;
    private final int minArguments;
    private final int maxArguments;
    private final int seriesArgumentIndex;

    FunctionType(String name, Category category) {
        this(name, category, 1, 1, 0);
    }

    FunctionType(String name, Category category, int minArguments, int maxArguments, int seriesArgumentIndex) {
        this.name = name;
        this.category = category;
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
        this.seriesArgumentIndex = seriesArgumentIndex;
    }

    /**
     * Gets the function name.
     * @return the function name
     */
    public String getName() {
        return name;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Checks if this function requires a range vector as input.
     * @return true if the function requires a range vector
     */
    public boolean requiresRangeVector() {
        return category == Category.RANGE;
    }

    /**
     * @return the smallest accepted number of arguments
     */
    public int getMinArguments() {
        return minArguments;
    }

    /**
     * @return the largest accepted number of arguments
     */
    public int getMaxArguments() {
        return maxArguments;
    }

    /**
     * Gets the position of the vector or matrix argument; all other arguments are numeric literals.
     * @return the argument index, or -1 if the function takes no series
     */
    public int getSeriesArgumentIndex() {
        return seriesArgumentIndex;
    }

    /**
     * Parse function type from string.
     * @param name the function name
     * @return the corresponding function type
     */
    public static FunctionType fromString(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        for (FunctionType type : values()) {
            if (type.name.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown function: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
