/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.opensearch.promql.lang.prom.PromTestUtils.points;
import static org.opensearch.promql.lang.prom.PromTestUtils.series;

public class SetOperationStageTests extends OpenSearchTestCase {

    private final TimeSeries left1 = series(points(new double[] { 10, 1 }), "__name__", "up", "instance", "1");
    private final TimeSeries left2 = series(points(new double[] { 10, 2 }), "__name__", "up", "instance", "2");
    private final TimeSeries right2 = series(points(new double[] { 10, 20 }), "__name__", "ready", "instance", "2");
    private final TimeSeries right3 = series(points(new double[] { 10, 30 }), "__name__", "ready", "instance", "3");

    private List<TimeSeries> process(BinaryOperatorType operator, BinaryModifier modifier) {
        return new SetOperationStage(operator, modifier).process(List.of(left1, left2), List.of(right2, right3));
    }

    public void testAnd() {
        assertEquals(List.of(left2), process(BinaryOperatorType.AND, null));
    }

    public void testUnless() {
        assertEquals(List.of(left1), process(BinaryOperatorType.UNLESS, null));
    }

    public void testOr() {
        assertEquals(List.of(left1, left2, right3), process(BinaryOperatorType.OR, null));
    }

    public void testOnEmptyLabelListMatchesEverything() {
        assertEquals(List.of(left1, left2), process(BinaryOperatorType.AND, BinaryModifier.on()));
        assertTrue(process(BinaryOperatorType.UNLESS, BinaryModifier.on()).isEmpty());
    }

    public void testIgnoring() {
        assertEquals(List.of(left1, left2), process(BinaryOperatorType.AND, BinaryModifier.ignoring("instance")));
    }

    public void testEmptyOperands() {
        SetOperationStage or = new SetOperationStage(BinaryOperatorType.OR, null);
        assertEquals(List.of(right2), or.process(List.of(), List.of(right2)));
        SetOperationStage and = new SetOperationStage(BinaryOperatorType.AND, null);
        assertTrue(and.process(List.of(left1), List.of()).isEmpty());
    }

    public void testRejectsArithmetic() {
        expectThrows(IllegalArgumentException.class, () -> new SetOperationStage(BinaryOperatorType.ADD, null));
    }
}
