/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

import org.opensearch.test.OpenSearchTestCase;

public class BinaryOperatorTypeTests extends OpenSearchTestCase {

    public void testFromOperator() {
        for (BinaryOperatorType type : BinaryOperatorType.values()) {
            assertSame(type, BinaryOperatorType.fromOperator(type.getOperator()));
        }
        expectThrows(IllegalArgumentException.class, () -> BinaryOperatorType.fromOperator("atan2"));
    }

    public void testClassification() {
        assertTrue(BinaryOperatorType.GTE.isComparison());
        assertFalse(BinaryOperatorType.GTE.isSetOperator());
        assertTrue(BinaryOperatorType.UNLESS.isSetOperator());
        assertFalse(BinaryOperatorType.POW.isComparison());
        assertFalse(BinaryOperatorType.POW.isSetOperator());
    }
}
