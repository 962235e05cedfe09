/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.plan;

import org.opensearch.promql.exception.InvalidArgumentException;
import org.opensearch.promql.exception.UnsupportedExpressionException;
import org.opensearch.promql.lang.prom.common.AggregationType;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;
import org.opensearch.promql.lang.prom.common.FunctionType;
import org.opensearch.promql.lang.prom.common.GroupingModifier;
import org.opensearch.promql.lang.prom.common.MatcherType;
import org.opensearch.promql.lang.prom.promql.parser.nodes.AggregationNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.BinaryExpressionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.ExtensionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.NumberLiteralNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.ParenExpressionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.PromASTNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RootNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.StringLiteralNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.SubqueryNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.UnaryExpressionNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.AggregationPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FetchPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FuncPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.ScalarPlanNode;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.opensearch.promql.lang.prom.PromTestUtils.call;
import static org.opensearch.promql.lang.prom.PromTestUtils.matcher;
import static org.opensearch.promql.lang.prom.PromTestUtils.matrix;
import static org.opensearch.promql.lang.prom.PromTestUtils.selector;

public class PromASTConverterTests extends OpenSearchTestCase {

    private static PromPlanNode plan(PromASTNode expression) {
        return new PromASTConverter().buildPlan(new RootNode(expression));
    }

    private static AggregationNode aggregation(String type, PromASTNode parameter, PromASTNode expression) {
        AggregationNode node = new AggregationNode(type, GroupingModifier.BY, List.of("job"));
        node.setParameter(parameter);
        node.setExpression(expression);
        return node;
    }

    public void testSelector() {
        PromPlanNode plan = plan(selector("http_requests_total", matcher("job", MatcherType.EQUAL, "api")));

        assertTrue(plan instanceof FetchPlanNode);
        FetchPlanNode fetch = (FetchPlanNode) plan;
        assertFalse(fetch.isRangeVector());
        assertEquals("http_requests_total", fetch.getSelector().getMetricName());
        assertEquals(1, fetch.getSelector().getMatchers().size());
    }

    public void testRangeFunctionPlan() {
        PromPlanNode plan = plan(
            aggregation("sum", null, call("rate", matrix("http_requests_total", 300_000L, matcher("job", MatcherType.REGEX_MATCH, "api.*"))))
        );

        assertEquals(
            "Aggregation[sum]\n  Function[rate]\n    Fetch[http_requests_total{job=~\"api.*\"}[300000ms]]\n",
            plan.explain()
        );
        assertEquals(List.of("job"), ((AggregationPlanNode) plan).getGroupingLabels());
    }

    public void testNumericArgumentsAreCollected() {
        PromPlanNode plan = plan(
            call(
                "histogram_quantile",
                new NumberLiteralNode(0.9),
                call("rate", matrix("latency_bucket", 60_000L))
            )
        );

        FuncPlanNode func = (FuncPlanNode) plan;
        assertEquals(FunctionType.HISTOGRAM_QUANTILE, func.getFunctionType());
        assertEquals(List.of(0.9), func.getArguments());
        assertEquals("Function[rate]", func.getSeriesArgument().getExplainName());
    }

    public void testNegativeAndParenthesizedNumbers() {
        PromPlanNode plan = plan(
            call(
                "clamp",
                selector("temperature"),
                new UnaryExpressionNode(true, new NumberLiteralNode(5)),
                new ParenExpressionNode(new NumberLiteralNode(10))
            )
        );

        assertEquals(List.of(-5.0, 10.0), ((FuncPlanNode) plan).getArguments());
    }

    public void testUnaryMinusAndParens() {
        assertEquals("Negate\n  Scalar[2.0]\n", plan(new UnaryExpressionNode(true, new NumberLiteralNode(2))).explain());
        assertTrue(plan(new UnaryExpressionNode(false, new NumberLiteralNode(2))) instanceof ScalarPlanNode);
        assertTrue(plan(new ParenExpressionNode(selector("up"))) instanceof FetchPlanNode);
    }

    public void testAggregationParameter() {
        AggregationPlanNode topk = (AggregationPlanNode) plan(aggregation("topk", new NumberLiteralNode(3), selector("up")));
        assertEquals(AggregationType.TOPK, topk.getAggregationType());
        assertEquals(3.0, topk.getParameter(), 0.0);

        AggregationPlanNode countValues = (AggregationPlanNode) plan(aggregation("count_values", new StringLiteralNode("value"), selector("up")));
        assertNull(countValues.getParameter());
    }

    public void testBinaryExpression() {
        PromPlanNode plan = plan(new BinaryExpressionNode(BinaryOperatorType.DIV, null, selector("errors"), selector("requests")));
        assertEquals("Binary[/]\n  Fetch[errors{}]\n  Fetch[requests{}]\n", plan.explain());
    }

    public void testUnknownFunction() {
        expectThrows(UnsupportedExpressionException.class, () -> plan(call("label_replace", selector("up"))));
    }

    public void testUnknownAggregation() {
        expectThrows(UnsupportedExpressionException.class, () -> plan(aggregation("limitk", new NumberLiteralNode(1), selector("up"))));
    }

    public void testWrongArity() {
        InvalidArgumentException e = expectThrows(InvalidArgumentException.class, () -> plan(call("abs")));
        assertTrue(e.getMessage(), e.getMessage().contains("abs()"));
        expectThrows(InvalidArgumentException.class, () -> plan(call("clamp", selector("up"), new NumberLiteralNode(1))));
    }

    public void testRangeFunctionRequiresMatrix() {
        expectThrows(InvalidArgumentException.class, () -> plan(call("rate", selector("http_requests_total"))));
    }

    public void testRangeVectorOnlyAllowedAsMatrixArgument() {
        PromASTNode m = matrix("m", 60_000L);

        expectThrows(InvalidArgumentException.class, () -> plan(call("abs", matrix("m", 60_000L))));
        expectThrows(InvalidArgumentException.class, () -> plan(new UnaryExpressionNode(true, matrix("m", 60_000L))));
        expectThrows(InvalidArgumentException.class, () -> plan(aggregation("sum", null, matrix("m", 60_000L))));
        expectThrows(
            InvalidArgumentException.class,
            () -> plan(new BinaryExpressionNode(BinaryOperatorType.MUL, null, m, new NumberLiteralNode(2)))
        );
        expectThrows(
            InvalidArgumentException.class,
            () -> plan(new BinaryExpressionNode(BinaryOperatorType.ADD, null, selector("a"), new ParenExpressionNode(matrix("b", 60_000L))))
        );
        InvalidArgumentException e = expectThrows(
            InvalidArgumentException.class,
            () -> plan(call("histogram_quantile", new NumberLiteralNode(0.9), matrix("latency_bucket", 60_000L)))
        );
        assertEquals(
            "histogram_quantile() argument 2 must be an instant vector or scalar, got range vector [latency_bucket{}[60000ms]]",
            e.getMessage()
        );

        assertTrue(plan(new ParenExpressionNode(matrix("m", 60_000L))) instanceof FetchPlanNode);
    }

    public void testNumericArgumentMustBeLiteral() {
        expectThrows(InvalidArgumentException.class, () -> plan(call("round", selector("up"), selector("step"))));
    }

    public void testAggregationParameterRules() {
        expectThrows(InvalidArgumentException.class, () -> plan(aggregation("topk", null, selector("up"))));
        expectThrows(InvalidArgumentException.class, () -> plan(aggregation("sum", new NumberLiteralNode(1), selector("up"))));
        expectThrows(InvalidArgumentException.class, () -> plan(aggregation("count_values", new NumberLiteralNode(1), selector("up"))));
        expectThrows(InvalidArgumentException.class, () -> plan(aggregation("sum", null, null)));
    }

    public void testBoolOnlyOnComparisons() {
        BinaryModifier bool = BinaryModifier.none().withReturnBool();
        expectThrows(
            InvalidArgumentException.class,
            () -> plan(new BinaryExpressionNode(BinaryOperatorType.ADD, bool, selector("a"), selector("b")))
        );
        assertNotNull(plan(new BinaryExpressionNode(BinaryOperatorType.GTR, bool, selector("a"), selector("b"))));
    }

    public void testNonPositiveRange() {
        InvalidArgumentException e = expectThrows(
            InvalidArgumentException.class,
            () -> plan(call("rate", matrix("http_requests_total", 0L, matcher("job", MatcherType.EQUAL, "api"))))
        );
        assertEquals("range of [http_requests_total{job=\"api\"}[0ms]] must be positive", e.getMessage());
    }

    public void testInvalidRegex() {
        expectThrows(InvalidArgumentException.class, () -> plan(selector("up", matcher("job", MatcherType.REGEX_MATCH, "api("))));
    }

    public void testUnsupportedConstructs() {
        expectThrows(UnsupportedExpressionException.class, () -> plan(new StringLiteralNode("text")));
        expectThrows(UnsupportedExpressionException.class, () -> plan(new SubqueryNode(selector("up"), 300_000L, 60_000L)));
        expectThrows(UnsupportedExpressionException.class, () -> plan(new ExtensionNode("@ modifier")));
        expectThrows(UnsupportedExpressionException.class, () -> new PromASTConverter().buildPlan(new RootNode()));
    }
}
