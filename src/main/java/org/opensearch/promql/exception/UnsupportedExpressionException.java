/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.exception;

import org.opensearch.core.rest.RestStatus;

/**
 * Thrown when an expression contains a node, function or operator the evaluator does not implement,
 * such as string literals, subqueries or unknown function names.
 */
public class UnsupportedExpressionException extends PromQLException {

    public UnsupportedExpressionException(String msg, Object... args) {
        super(msg, args);
    }

    public UnsupportedExpressionException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
