/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.store;

import org.opensearch.index.query.BoolQueryBuilder;
import org.opensearch.index.query.QueryBuilders;
import org.opensearch.promql.core.model.LabelMatcher;
import org.opensearch.promql.core.model.MetricSelector;
import org.opensearch.promql.lang.prom.common.MatcherType;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.Map;

public class SelectorPredicateTests extends OpenSearchTestCase {

    private static final long START = 1_000L;
    private static final long END = 2_000L;

    private static SelectorPredicate predicate(String metricName, LabelMatcher... matchers) {
        return new SelectorPredicate(new MetricSelector(metricName, List.of(matchers)), START, END);
    }

    private static MetricRow row(String metricName, String resourceName, Map<String, String> attributes, long timestampMs) {
        return new MetricRow(metricName, resourceName, attributes, timestampMs, 1.0);
    }

    public void testTimeWindowIsClosed() {
        SelectorPredicate predicate = predicate("up");
        assertTrue(predicate.test(row("up", "api", Map.of(), START)));
        assertTrue(predicate.test(row("up", "api", Map.of(), END)));
        assertFalse(predicate.test(row("up", "api", Map.of(), START - 1)));
        assertFalse(predicate.test(row("up", "api", Map.of(), END + 1)));
    }

    public void testMetricName() {
        assertFalse(predicate("up").test(row("down", "api", Map.of(), START)));
        assertTrue(predicate("").test(row("down", "api", Map.of(), START)));
    }

    public void testMatchersAddressColumns() {
        MetricRow row = row("http_requests_total", "checkout", Map.of("method", "GET"), START);

        assertTrue(predicate("", new LabelMatcher("__name__", MatcherType.REGEX_MATCH, "http_.*")).test(row));
        assertTrue(predicate("http_requests_total", new LabelMatcher("job", MatcherType.EQUAL, "checkout")).test(row));
        assertTrue(predicate("http_requests_total", new LabelMatcher("service_name", MatcherType.EQUAL, "checkout")).test(row));
        assertTrue(predicate("http_requests_total", new LabelMatcher("method", MatcherType.NOT_EQUAL, "POST")).test(row));
        assertFalse(predicate("http_requests_total", new LabelMatcher("method", MatcherType.REGEX_NOT_MATCH, "G.*")).test(row));
    }

    public void testRegexIsAnchored() {
        MetricRow row = row("up", "checkout", Map.of(), START);
        assertFalse(predicate("up", new LabelMatcher("job", MatcherType.REGEX_MATCH, "check")).test(row));
        assertTrue(predicate("up", new LabelMatcher("job", MatcherType.REGEX_MATCH, "check.*")).test(row));
    }

    public void testMissingAttributeIsEmpty() {
        MetricRow row = row("up", "api", Map.of(), START);
        assertTrue(predicate("up", new LabelMatcher("zone", MatcherType.EQUAL, "")).test(row));
        assertFalse(predicate("up", new LabelMatcher("zone", MatcherType.NOT_EQUAL, "")).test(row));
        assertFalse(predicate("up", new LabelMatcher("zone", MatcherType.EQUAL, "eu")).test(row));
    }

    public void testFieldName() {
        assertEquals(SelectorPredicate.METRIC_NAME_FIELD, SelectorPredicate.fieldName("__name__"));
        assertEquals(SelectorPredicate.RESOURCE_NAME_FIELD, SelectorPredicate.fieldName("job"));
        assertEquals(SelectorPredicate.RESOURCE_NAME_FIELD, SelectorPredicate.fieldName("service_name"));
        assertEquals("attributes.method", SelectorPredicate.fieldName("method"));
    }

    public void testToQueryBuilder() {
        SelectorPredicate predicate = predicate(
            "http_requests_total",
            new LabelMatcher("job", MatcherType.EQUAL, "checkout"),
            new LabelMatcher("method", MatcherType.REGEX_MATCH, "GET|POST"),
            new LabelMatcher("status", MatcherType.NOT_EQUAL, "500"),
            new LabelMatcher("path", MatcherType.REGEX_NOT_MATCH, "/internal.*")
        );

        BoolQueryBuilder query = (BoolQueryBuilder) predicate.toQueryBuilder();

        assertEquals(
            List.of(
                QueryBuilders.rangeQuery("timestamp").gte(START).lte(END),
                QueryBuilders.termQuery("metric_name", "http_requests_total"),
                QueryBuilders.termQuery("resource_name", "checkout"),
                QueryBuilders.regexpQuery("attributes.method", "GET|POST")
            ),
            query.filter()
        );
        assertEquals(
            List.of(QueryBuilders.termQuery("attributes.status", "500"), QueryBuilders.regexpQuery("attributes.path", "/internal.*")),
            query.mustNot()
        );
        assertTrue(query.must().isEmpty());
        assertTrue(query.should().isEmpty());
    }

    public void testEmptyValueMatchersTestFieldPresence() {
        SelectorPredicate predicate = predicate(
            "up",
            new LabelMatcher("zone", MatcherType.EQUAL, ""),
            new LabelMatcher("region", MatcherType.NOT_EQUAL, "")
        );

        BoolQueryBuilder query = (BoolQueryBuilder) predicate.toQueryBuilder();

        assertEquals(List.of(QueryBuilders.existsQuery("attributes.zone")), query.mustNot());
        assertTrue(query.filter().contains(QueryBuilders.existsQuery("attributes.region")));
    }

    public void testRegexMatchingEmptyAcceptsMissingField() {
        SelectorPredicate predicate = predicate("up", new LabelMatcher("env", MatcherType.REGEX_MATCH, "prod|"));
        assertTrue(predicate.test(row("up", "api", Map.of(), START)));
        assertTrue(predicate.test(row("up", "api", Map.of("env", "prod"), START)));
        assertFalse(predicate.test(row("up", "api", Map.of("env", "dev"), START)));

        BoolQueryBuilder query = (BoolQueryBuilder) predicate.toQueryBuilder();

        BoolQueryBuilder regexOrMissing = QueryBuilders.boolQuery()
            .should(QueryBuilders.regexpQuery("attributes.env", "prod|"))
            .should(QueryBuilders.boolQuery().mustNot(QueryBuilders.existsQuery("attributes.env")))
            .minimumShouldMatch(1);
        assertEquals(
            List.of(
                QueryBuilders.rangeQuery("timestamp").gte(START).lte(END),
                QueryBuilders.termQuery("metric_name", "up"),
                regexOrMissing
            ),
            query.filter()
        );
        assertTrue(query.mustNot().isEmpty());
    }

    public void testNegatedRegexMatchingEmptyRejectsMissingField() {
        SelectorPredicate predicate = predicate("up", new LabelMatcher("env", MatcherType.REGEX_NOT_MATCH, "prod|"));
        assertFalse(predicate.test(row("up", "api", Map.of(), START)));
        assertFalse(predicate.test(row("up", "api", Map.of("env", "prod"), START)));
        assertTrue(predicate.test(row("up", "api", Map.of("env", "dev"), START)));

        BoolQueryBuilder query = (BoolQueryBuilder) predicate.toQueryBuilder();

        assertTrue(query.filter().contains(QueryBuilders.existsQuery("attributes.env")));
        assertEquals(List.of(QueryBuilders.regexpQuery("attributes.env", "prod|")), query.mustNot());
    }

    public void testNoMetricName() {
        BoolQueryBuilder query = (BoolQueryBuilder) predicate("", new LabelMatcher("__name__", MatcherType.REGEX_MATCH, "up|down"))
            .toQueryBuilder();

        assertEquals(
            List.of(QueryBuilders.rangeQuery("timestamp").gte(START).lte(END), QueryBuilders.regexpQuery("metric_name", "up|down")),
            query.filter()
        );
    }
}
