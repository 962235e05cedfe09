/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

/**
 * Visitor interface for PromQL AST nodes.
 * @param <T> the return type of the visitor methods
 */
public interface PromASTVisitor<T> {
    /**
     * Visits a root node.
     * @param node the root node to visit
     * @return the result of visiting this node
     */
    T visit(RootNode node);

    /**
     * Visits an instant vector selector node.
     * @param node the instant vector selector node to visit
     * @return the result of visiting this node
     */
    T visit(InstantVectorSelectorNode node);

    /**
     * Visits a range vector selector node.
     * @param node the range vector selector node to visit
     * @return the result of visiting this node
     */
    T visit(RangeVectorSelectorNode node);

    /**
     * Visits a function call node.
     * @param node the function call node to visit
     * @return the result of visiting this node
     */
    T visit(FunctionCallNode node);

    /**
     * Visits an aggregation node.
     * @param node the aggregation node to visit
     * @return the result of visiting this node
     */
    T visit(AggregationNode node);

    /**
     * Visits a label matcher node.
     * @param node the label matcher node to visit
     * @return the result of visiting this node
     */
    T visit(LabelMatcherNode node);

    /**
     * Visits a binary expression node.
     * @param node the binary expression node to visit
     * @return the result of visiting this node
     */
    T visit(BinaryExpressionNode node);

    /**
     * Visits a unary expression node.
     * @param node the unary expression node to visit
     * @return the result of visiting this node
     */
    T visit(UnaryExpressionNode node);

    /**
     * Visits a parenthesized expression node.
     * @param node the parenthesized expression node to visit
     * @return the result of visiting this node
     */
    T visit(ParenExpressionNode node);

    /**
     * Visits a number literal node.
     * @param node the number literal node to visit
     * @return the result of visiting this node
     */
    T visit(NumberLiteralNode node);

    /**
     * Visits a string literal node.
     * @param node the string literal node to visit
     * @return the result of visiting this node
     */
    T visit(StringLiteralNode node);

    /**
     * Visits a subquery node.
     * @param node the subquery node to visit
     * @return the result of visiting this node
     */
    T visit(SubqueryNode node);

    /**
     * Visits an extension node.
     * @param node the extension node to visit
     * @return the result of visiting this node
     */
    T visit(ExtensionNode node);
}
