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
 * Thrown when a function, aggregation or query window receives arguments of the wrong
 * number, kind or position.
 */
public class InvalidArgumentException extends PromQLException {

    public InvalidArgumentException(String msg, Object... args) {
        super(msg, args);
    }

    public InvalidArgumentException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
