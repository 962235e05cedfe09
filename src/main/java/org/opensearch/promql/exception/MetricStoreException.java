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
 * Thrown by {@link org.opensearch.promql.store.MetricStore} implementations when a fetch fails.
 */
public class MetricStoreException extends PromQLException {

    public MetricStoreException(String msg, Object... args) {
        super(msg, args);
    }

    public MetricStoreException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }

    @Override
    public RestStatus status() {
        return RestStatus.INTERNAL_SERVER_ERROR;
    }
}
