/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.common;

import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class GroupingModifierTests extends OpenSearchTestCase {

    public void testBy() {
        List<String> labels = List.of("job");
        assertTrue(GroupingModifier.BY.keepsLabel("job", labels));
        assertFalse(GroupingModifier.BY.keepsLabel("instance", labels));
        assertTrue(GroupingModifier.BY.keepsLabel("__name__", List.of("__name__")));
    }

    public void testWithoutAlsoDropsMetricName() {
        List<String> labels = List.of("instance");
        assertTrue(GroupingModifier.WITHOUT.keepsLabel("job", labels));
        assertFalse(GroupingModifier.WITHOUT.keepsLabel("instance", labels));
        assertFalse(GroupingModifier.WITHOUT.keepsLabel("__name__", List.of()));
    }
}
