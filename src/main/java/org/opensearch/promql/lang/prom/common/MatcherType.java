/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

/**
 * The four selector matcher operators. Regex operators are anchored at both ends when evaluated.
 */
public enum MatcherType {
    EQUAL("=", false, false),
    NOT_EQUAL("!=", false, true),
    REGEX_MATCH("=~", true, false),
    REGEX_NOT_MATCH("!~", true, true);

    private final String operator;
    private final boolean regex;
    private final boolean negative;

    MatcherType(String operator, boolean regex, boolean negative) {
        this.operator = operator;
        this.regex = regex;
        this.negative = negative;
    }

    /**
     * @return the operator as written in a selector
     */
    public String getOperator() {
        return operator;
    }

    public boolean isRegex() {
        return regex;
    }

    /**
     * @return true for the operators that select series whose label does not match the value
     */
    public boolean isNegative() {
        return negative;
    }
}
