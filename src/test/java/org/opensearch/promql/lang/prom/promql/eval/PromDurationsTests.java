/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import org.opensearch.promql.exception.InvalidArgumentException;
import org.opensearch.test.OpenSearchTestCase;

public class PromDurationsTests extends OpenSearchTestCase {

    public void testUnits() {
        assertEquals(250L, PromDurations.parse("250ms"));
        assertEquals(30_000L, PromDurations.parse("30s"));
        assertEquals(300_000L, PromDurations.parse("5m"));
        assertEquals(3_600_000L, PromDurations.parse("1h"));
        assertEquals(86_400_000L, PromDurations.parse("1d"));
        assertEquals(7 * 86_400_000L, PromDurations.parse("1w"));
        assertEquals(365 * 86_400_000L, PromDurations.parse("1y"));
    }

    public void testCompoundDurations() {
        assertEquals(5_400_000L, PromDurations.parse("1h30m"));
        assertEquals(90_500L, PromDurations.parse("1m30s500ms"));
    }

    public void testSeconds() {
        assertEquals(15_000L, PromDurations.parse("15"));
        assertEquals(1_500L, PromDurations.parse("1.5"));
        assertEquals(0L, PromDurations.parse("0"));
        assertEquals(60_000L, PromDurations.parse(" 60 "));
    }

    public void testInvalid() {
        for (String invalid : new String[] { "", "  ", "5x", "m", "-1", "1.5m", "NaN", "Infinity", "1h-5m" }) {
            expectThrows(InvalidArgumentException.class, () -> PromDurations.parse(invalid));
        }
        expectThrows(InvalidArgumentException.class, () -> PromDurations.parse(null));
        expectThrows(InvalidArgumentException.class, () -> PromDurations.parse("999999999999999y"));
    }
}
