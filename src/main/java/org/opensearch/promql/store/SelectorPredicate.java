/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.QueryBuilder;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.promql.core.model.LabelConstants;
import org.opensearch.promql.core.model.LabelMatcher;
import org.opensearch.promql.core.model.MetricSelector;

import java.util.Objects;

/**
 * Store-side filter of a selector fetch: metric name, label matchers and the closed time window
 * {@code [startMs, endMs]}.
 *
 * <p>Matchers address store columns: {@code __name__} the metric name, {@code service_name} and
 * {@code job} the resource name, any other label the attribute of that name. A missing attribute
 * has the empty value.</p>
 */
public final class SelectorPredicate {

    /** Document field holding the metric name. */
    public static final String METRIC_NAME_FIELD = "metric_name";

    /** Document field holding the resource name. */
    public static final String RESOURCE_NAME_FIELD = "resource_name";

    /** Prefix of the document fields holding attributes. */
    public static final String ATTRIBUTES_FIELD_PREFIX = "attributes.";

    /** Document field holding the sample timestamp in epoch milliseconds. */
    public static final String TIMESTAMP_FIELD = "timestamp";

    private final MetricSelector selector;
    private final long startMs;
    private final long endMs;

    /**
     * Constructor for SelectorPredicate.
     * @param selector the selector to resolve
     * @param startMs window start, inclusive
     * @param endMs window end, inclusive
     */
    public SelectorPredicate(MetricSelector selector, long startMs, long endMs) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.startMs = startMs;
        this.endMs = endMs;
    }

    public MetricSelector getSelector() {
        return selector;
    }

    public long getStartMs() {
        return startMs;
    }

    public long getEndMs() {
        return endMs;
    }

    /**
     * Evaluate the predicate against a row.
     *
     * @param row the row
     * @return true if the row belongs to the fetch
     */
    public boolean test(MetricRow row) {
        if (row.getTimestampMs() < startMs || row.getTimestampMs() > endMs) {
            return false;
        }
        if (selector.hasMetricName() && selector.getMetricName().equals(row.getMetricName()) == false) {
            return false;
        }
        for (LabelMatcher matcher : selector.getMatchers()) {
            if (matcher.matches(columnValue(row, matcher.getLabelName())) == false) {
                return false;
            }
        }
        return true;
    }

    /**
     * Render the predicate as an OpenSearch query over documents holding one row each.
     *
     * <p>Positive matchers become filters and negative matchers {@code must_not} clauses. Regex
     * matchers use {@code regexp} queries, which are anchored like the matchers. A matcher on the
     * empty value tests the presence of the field instead of its value, and a regex that matches
     * the empty string also decides on documents without the field, as {@link #test(MetricRow)} does.</p>
     *
     * @return the query
     */
    public QueryBuilder toQueryBuilder() {
        BoolQueryBuilder boolQuery = QueryBuilders.boolQuery();
        boolQuery.filter(QueryBuilders.rangeQuery(TIMESTAMP_FIELD).gte(startMs).lte(endMs));

        if (selector.hasMetricName()) {
            boolQuery.filter(QueryBuilders.termQuery(METRIC_NAME_FIELD, selector.getMetricName()));
        }

        for (LabelMatcher matcher : selector.getMatchers()) {
            String field = fieldName(matcher.getLabelName());
            if (matcher.getMatcherType().isRegex() == false && matcher.getValue().isEmpty()) {
                // {l=""} selects rows without the label, {l!=""} rows with it
                if (matcher.getMatcherType().isNegative()) {
                    boolQuery.filter(QueryBuilders.existsQuery(field));
                } else {
                    boolQuery.mustNot(QueryBuilders.existsQuery(field));
                }
                continue;
            }

            QueryBuilder matcherQuery = matcher.getMatcherType().isRegex()
                ? QueryBuilders.regexpQuery(field, matcher.getValue())
                : QueryBuilders.termQuery(field, matcher.getValue());
            boolean negative = matcher.getMatcherType().isNegative();
            boolean patternMatchesEmpty = matcher.getMatcherType().isRegex() && matcher.matchesEmpty() != negative;
            if (patternMatchesEmpty && negative == false) {
                // rows without the field have the empty value and match too
                boolQuery.filter(
                    QueryBuilders.boolQuery()
                        .should(matcherQuery)
                        .should(QueryBuilders.boolQuery().mustNot(QueryBuilders.existsQuery(field)))
                        .minimumShouldMatch(1)
                );
            } else if (patternMatchesEmpty) {
                boolQuery.filter(QueryBuilders.existsQuery(field));
                boolQuery.mustNot(matcherQuery);
            } else if (negative) {
                boolQuery.mustNot(matcherQuery);
            } else {
                boolQuery.filter(matcherQuery);
            }
        }
        return boolQuery;
    }

    /**
     * Document field addressed by a label name.
     *
     * @param labelName the label name of a matcher
     * @return the field name
     */
    static String fieldName(String labelName) {
        switch (labelName) {
            case LabelConstants.METRIC_NAME:
                return METRIC_NAME_FIELD;
            case LabelConstants.SERVICE_NAME:
            case LabelConstants.JOB:
                return RESOURCE_NAME_FIELD;
            default:
                return ATTRIBUTES_FIELD_PREFIX + labelName;
        }
    }

    private static String columnValue(MetricRow row, String labelName) {
        switch (labelName) {
            case LabelConstants.METRIC_NAME:
                return row.getMetricName();
            case LabelConstants.SERVICE_NAME:
            case LabelConstants.JOB:
                return row.getResourceName();
            default:
                return row.getAttributes().getOrDefault(labelName, LabelConstants.EMPTY_STRING);
        }
    }

    @Override
    public String toString() {
        return selector + "[" + startMs + ".." + endMs + "]";
    }
}
