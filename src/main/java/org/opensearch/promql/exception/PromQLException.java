/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.exception;

import org.opensearch.OpenSearchException;

/**
 * Base class of all failures raised while evaluating a PromQL expression.
 */
public abstract class PromQLException extends OpenSearchException {

    protected PromQLException(String msg, Object... args) {
        super(msg, args);
    }

    protected PromQLException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
