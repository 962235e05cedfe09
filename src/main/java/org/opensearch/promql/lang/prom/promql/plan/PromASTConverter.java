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
import org.opensearch.promql.lang.prom.common.FunctionType;
import org.opensearch.promql.lang.prom.promql.parser.nodes.AggregationNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.BinaryExpressionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.ExtensionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.FunctionCallNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.InstantVectorSelectorNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.LabelMatcherNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.NumberLiteralNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.ParenExpressionNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.PromASTNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.PromASTVisitor;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RangeVectorSelectorNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RootNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.StringLiteralNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.SubqueryNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.UnaryExpressionNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.AggregationPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.BinaryPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FetchPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FuncPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.NegatePlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.ScalarPlanNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts PromQL AST to a logical plan.
 *
 * <p>Every check that can fail a query without looking at data happens here: unsupported node kinds,
 * unknown functions and operators, argument counts and positions, and invalid regex matchers. A plan
 * returned by {@link #buildPlan(RootNode)} is therefore always executable.</p>
 *
 * <p>Instances are cheap and not thread-safe; use one per query.</p>
 */
public class PromASTConverter implements PromASTVisitor<PromPlanNode> {
    private final AtomicInteger idGenerator = new AtomicInteger(0);

    /**
     * Build a plan from the AST root.
     * @param astRoot the root AST node
     * @return the root plan node
     * @throws UnsupportedExpressionException if the AST uses a construct the evaluator does not implement
     * @throws InvalidArgumentException if a function or operator receives invalid arguments
     */
    public PromPlanNode buildPlan(RootNode astRoot) {
        if (astRoot == null || astRoot.getExpression() == null) {
            throw new UnsupportedExpressionException("AST root cannot be null or empty");
        }
        return astRoot.accept(this);
    }

    @Override
    public PromPlanNode visit(RootNode node) {
        return convertNode(node.getExpression());
    }

    @Override
    public PromPlanNode visit(InstantVectorSelectorNode node) {
        return new FetchPlanNode(generateId(), node.toMetricSelector(), null);
    }

    @Override
    public PromPlanNode visit(RangeVectorSelectorNode node) {
        if (node.getRangeMs() <= 0) {
            throw new InvalidArgumentException("range of [{}] must be positive", node);
        }
        return new FetchPlanNode(generateId(), node.toMetricSelector(), node.getRangeMs());
    }

    @Override
    public PromPlanNode visit(FunctionCallNode node) {
        FunctionType funcType;
        try {
            funcType = FunctionType.fromString(node.getFunctionName());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedExpressionException("Function {}() is not supported", node.getFunctionName());
        }

        List<PromASTNode> args = node.getArguments();
        if (args.size() < funcType.getMinArguments() || args.size() > funcType.getMaxArguments()) {
            throw new InvalidArgumentException(
                "{}() expects {} argument(s), got {}",
                funcType.getName(),
                describeArity(funcType),
                args.size()
            );
        }

        List<Double> numericArgs = new ArrayList<>();
        PromPlanNode seriesArg = null;
        for (int i = 0; i < args.size(); i++) {
            PromASTNode arg = args.get(i);
            if (i == funcType.getSeriesArgumentIndex()) {
                seriesArg = funcType.requiresRangeVector()
                    ? convertMatrixArgument(funcType, arg)
                    : convertInstantOperand(arg, funcType.getName() + "() argument " + (i + 1));
            } else {
                numericArgs.add(extractNumber(arg, funcType.getName() + "() argument " + (i + 1)));
            }
        }

        FuncPlanNode funcPlanNode = new FuncPlanNode(generateId(), funcType, numericArgs);
        if (seriesArg != null) {
            funcPlanNode.addChild(seriesArg);
        }
        return funcPlanNode;
    }

    @Override
    public PromPlanNode visit(AggregationNode node) {
        AggregationType aggType;
        try {
            aggType = AggregationType.fromString(node.getAggregationType());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedExpressionException("Aggregation {} is not supported", node.getAggregationType());
        }
        if (node.getExpression() == null) {
            throw new InvalidArgumentException("{}() requires an expression to aggregate", aggType);
        }

        Double parameter = null;
        PromASTNode paramNode = node.getParameter();
        if (aggType.requiresParameter()) {
            if (paramNode == null) {
                throw new InvalidArgumentException("{}() requires a parameter", aggType);
            }
            if (aggType.hasStringParameter()) {
                if (unwrapParens(paramNode) instanceof StringLiteralNode == false) {
                    throw new InvalidArgumentException("{}() parameter must be a label name string", aggType);
                }
            } else {
                parameter = extractNumber(paramNode, aggType + "() parameter");
            }
        } else if (paramNode != null) {
            throw new InvalidArgumentException("{}() does not take a parameter", aggType);
        }

        AggregationPlanNode aggPlanNode = new AggregationPlanNode(
            generateId(),
            aggType,
            node.getGroupingModifier(),
            node.getGroupingLabels(),
            parameter
        );
        aggPlanNode.addChild(convertInstantOperand(node.getExpression(), aggType + "() expression"));
        return aggPlanNode;
    }

    @Override
    public PromPlanNode visit(LabelMatcherNode node) {
        throw new UnsupportedExpressionException("label matcher [{}] is not an expression", node.getLabelName());
    }

    @Override
    public PromPlanNode visit(BinaryExpressionNode node) {
        BinaryModifier modifier = node.getModifier();
        if (modifier.isReturnBool() && node.getOperator().isComparison() == false) {
            throw new InvalidArgumentException("bool modifier can only be used on comparison operators, got [{}]", node.getOperator());
        }
        if (node.getLeft() == null || node.getRight() == null) {
            throw new InvalidArgumentException("binary operator [{}] requires two operands", node.getOperator());
        }
        BinaryPlanNode binaryPlanNode = new BinaryPlanNode(generateId(), node.getOperator(), modifier);
        binaryPlanNode.addChild(convertInstantOperand(node.getLeft(), "left operand of [" + node.getOperator() + "]"));
        binaryPlanNode.addChild(convertInstantOperand(node.getRight(), "right operand of [" + node.getOperator() + "]"));
        return binaryPlanNode;
    }

    @Override
    public PromPlanNode visit(UnaryExpressionNode node) {
        PromPlanNode child = convertInstantOperand(node.getExpression(), "operand of unary " + (node.isNegative() ? "-" : "+"));
        if (node.isNegative() == false) {
            return child;
        }
        NegatePlanNode negatePlanNode = new NegatePlanNode(generateId());
        negatePlanNode.addChild(child);
        return negatePlanNode;
    }

    @Override
    public PromPlanNode visit(ParenExpressionNode node) {
        return convertNode(node.getExpression());
    }

    @Override
    public PromPlanNode visit(NumberLiteralNode node) {
        return new ScalarPlanNode(generateId(), node.getValue());
    }

    @Override
    public PromPlanNode visit(StringLiteralNode node) {
        throw new UnsupportedExpressionException("string literals are not supported as expressions");
    }

    @Override
    public PromPlanNode visit(SubqueryNode node) {
        throw new UnsupportedExpressionException("subqueries are not supported");
    }

    @Override
    public PromPlanNode visit(ExtensionNode node) {
        throw new UnsupportedExpressionException("expression [{}] is not supported", node.getName());
    }

    private PromPlanNode convertNode(PromASTNode node) {
        if (node == null) {
            throw new InvalidArgumentException("missing expression");
        }
        return node.accept(this);
    }

    /**
     * Converts an operand that is evaluated step by step. Range vectors are only valid as the
     * matrix argument of a range function or as the whole expression of an instant query.
     */
    private PromPlanNode convertInstantOperand(PromASTNode node, String what) {
        PromASTNode unwrapped = unwrapParens(node);
        if (unwrapped instanceof RangeVectorSelectorNode) {
            throw new InvalidArgumentException("{} must be an instant vector or scalar, got range vector [{}]", what, unwrapped);
        }
        return convertNode(node);
    }

    private PromPlanNode convertMatrixArgument(FunctionType funcType, PromASTNode arg) {
        PromASTNode unwrapped = unwrapParens(arg);
        if (unwrapped instanceof RangeVectorSelectorNode == false) {
            throw new InvalidArgumentException("{}() expects a range vector argument", funcType.getName());
        }
        return convertNode(unwrapped);
    }

    /**
     * Extracts a numeric literal, accepting parentheses and unary signs around it.
     */
    private static double extractNumber(PromASTNode node, String what) {
        PromASTNode current = node;
        double sign = 1.0;
        while (true) {
            if (current instanceof ParenExpressionNode paren) {
                current = paren.getExpression();
            } else if (current instanceof UnaryExpressionNode unary) {
                if (unary.isNegative()) {
                    sign = -sign;
                }
                current = unary.getExpression();
            } else if (current instanceof NumberLiteralNode number) {
                return sign * number.getValue();
            } else {
                throw new InvalidArgumentException("{} must be a number literal", what);
            }
        }
    }

    private static PromASTNode unwrapParens(PromASTNode node) {
        PromASTNode current = node;
        while (current instanceof ParenExpressionNode paren) {
            current = paren.getExpression();
        }
        return current;
    }

    private static String describeArity(FunctionType funcType) {
        if (funcType.getMinArguments() == funcType.getMaxArguments()) {
            return Integer.toString(funcType.getMinArguments());
        }
        return funcType.getMinArguments() + " to " + funcType.getMaxArguments();
    }

    private int generateId() {
        return idGenerator.getAndIncrement();
    }
}
