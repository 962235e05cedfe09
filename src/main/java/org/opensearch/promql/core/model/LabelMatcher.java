/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.core.model;

import com.google.re2j.Pattern;
import org.opensearch.promql.lang.prom.common.MatcherType;

import java.util.Objects;

/**
 * A {@code (name, operator, value)} condition on one label of a series.
 *
 * <p>Regex matchers are fully anchored, so {@code job=~"api"} does not match {@code "api-gateway"}.
 * The pattern is compiled once, when the matcher is created.</p>
 */
public final class LabelMatcher {
    private final String labelName;
    private final MatcherType matcherType;
    private final String value;
    private final Pattern pattern;

    /**
     * Constructor for LabelMatcher.
     * @param labelName the label name
     * @param matcherType the matcher type
     * @param value the literal value or regex
     * @throws com.google.re2j.PatternSyntaxException if a regex matcher carries an invalid pattern
     */
    public LabelMatcher(String labelName, MatcherType matcherType, String value) {
        this.labelName = Objects.requireNonNull(labelName, "labelName must not be null");
        this.matcherType = Objects.requireNonNull(matcherType, "matcherType must not be null");
        this.value = value != null ? value : LabelConstants.EMPTY_STRING;
        this.pattern = matcherType.isRegex() ? Pattern.compile(this.value) : null;
    }

    public String getLabelName() {
        return labelName;
    }

    public MatcherType getMatcherType() {
        return matcherType;
    }

    public String getValue() {
        return value;
    }

    /**
     * Test a label value. An absent label is passed in as the empty string.
     *
     * @param labelValue the value of {@link #getLabelName()} on the candidate series
     * @return true if the series satisfies this matcher
     */
    public boolean matches(String labelValue) {
        return switch (matcherType) {
            case EQUAL -> value.equals(labelValue);
            case NOT_EQUAL -> value.equals(labelValue) == false;
            case REGEX_MATCH -> pattern.matcher(labelValue).matches();
            case REGEX_NOT_MATCH -> pattern.matcher(labelValue).matches() == false;
        };
    }

    /**
     * @return true if a series without this label satisfies the matcher
     */
    public boolean matchesEmpty() {
        return matches(LabelConstants.EMPTY_STRING);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LabelMatcher that = (LabelMatcher) o;
        return labelName.equals(that.labelName) && matcherType == that.matcherType && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labelName, matcherType, value);
    }

    @Override
    public String toString() {
        return labelName + matcherType.getOperator() + "\"" + value + "\"";
    }
}
