/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

/**
 * PromQL binary operators.
 */
public enum BinaryOperatorType {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^"),
    EQL("=="),
    NEQ("!="),
    GTR(">"),
    LSS("<"),
    GTE(">="),
    LTE("<="),
    AND("and"),
    OR("or"),
    UNLESS("unless");

    private final String operator;

    BinaryOperatorType(String operator) {
        this.operator = operator;
    }

    /**
     * Gets the operator token.
     * @return the operator as written in a query
     */
    public String getOperator() {
        return operator;
    }

    /**
     * @return true for {@code == != > < >= <=}
     */
    public boolean isComparison() {
        return switch (this) {
            case EQL, NEQ, GTR, LSS, GTE, LTE -> true;
            default -> false;
        };
    }

    /**
     * @return true for {@code and or unless}
     */
    public boolean isSetOperator() {
        return this == AND || this == OR || this == UNLESS;
    }

    /**
     * Parse an operator token.
     * @param operator the operator token
     * @return the corresponding operator type
     */
    public static BinaryOperatorType fromOperator(String operator) {
        for (BinaryOperatorType type : values()) {
            if (type.operator.equals(operator)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + operator);
    }

    @Override
    public String toString() {
        return operator;
    }
}
