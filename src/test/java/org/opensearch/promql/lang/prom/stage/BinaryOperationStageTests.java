/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;
import org.opensearch.promql.lang.prom.common.VectorMatchCardinality;
import org.opensearch.promql.query.stage.StepGrid;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.opensearch.promql.lang.prom.PromTestUtils.points;
import static org.opensearch.promql.lang.prom.PromTestUtils.series;

public class BinaryOperationStageTests extends OpenSearchTestCase {

    private final StepGrid grid = StepGrid.range(10_000L, 20_000L, 10_000L, 0L);

    private final TimeSeries cpu = series(
        points(new double[] { 10, 2 }, new double[] { 20, 4 }),
        "__name__",
        "cpu",
        "job",
        "api",
        "instance",
        "a"
    );

    private BinaryOperationStage stage(BinaryOperatorType operator) {
        return new BinaryOperationStage(operator, null, grid);
    }

    private BinaryOperationStage stage(BinaryOperatorType operator, BinaryModifier modifier) {
        return new BinaryOperationStage(operator, modifier, grid);
    }

    public void testScalarScalar() {
        List<TimeSeries> result = stage(BinaryOperatorType.ADD).process(List.of(grid.constant(2)), List.of(grid.constant(3)));

        assertEquals(1, result.size());
        assertTrue(result.get(0).isScalar());
        assertEquals(List.of(new FloatSample(10_000L, 5.0), new FloatSample(20_000L, 5.0)), result.get(0).getSamples());
    }

    public void testScalarComparisonWithoutMatchesStillReturnsOneSeries() {
        List<TimeSeries> result = stage(BinaryOperatorType.GTR).process(List.of(grid.constant(1)), List.of(grid.constant(3)));

        assertEquals(1, result.size());
        assertTrue(result.get(0).getSamples().isEmpty());
    }

    public void testVectorScalar() {
        List<TimeSeries> result = stage(BinaryOperatorType.MUL).process(List.of(cpu), List.of(grid.constant(10)));

        assertEquals(1, result.size());
        assertEquals(cpu.getLabels(), result.get(0).getLabels());
        assertEquals(List.of(new FloatSample(10_000L, 20.0), new FloatSample(20_000L, 40.0)), result.get(0).getSamples());
    }

    public void testScalarVectorKeepsOperandOrder() {
        List<TimeSeries> result = stage(BinaryOperatorType.SUB).process(List.of(grid.constant(10)), List.of(cpu));

        assertEquals(List.of(new FloatSample(10_000L, 8.0), new FloatSample(20_000L, 6.0)), result.get(0).getSamples());
    }

    public void testDivisionByZero() {
        List<TimeSeries> divided = stage(BinaryOperatorType.DIV).process(List.of(cpu), List.of(grid.constant(0)));
        assertTrue(Double.isNaN(divided.get(0).getLastSample().getValue()));

        List<TimeSeries> modulo = stage(BinaryOperatorType.MOD).process(List.of(cpu), List.of(grid.constant(0)));
        assertTrue(Double.isNaN(modulo.get(0).getLastSample().getValue()));
    }

    public void testComparisonFiltersAndKeepsLeftValue() {
        List<TimeSeries> result = stage(BinaryOperatorType.GTR).process(List.of(cpu), List.of(grid.constant(3)));

        assertEquals(List.of(new FloatSample(20_000L, 4.0)), result.get(0).getSamples());

        List<TimeSeries> none = stage(BinaryOperatorType.GTR).process(List.of(cpu), List.of(grid.constant(100)));
        assertTrue(none.isEmpty());
    }

    public void testBoolComparison() {
        BinaryOperationStage stage = stage(BinaryOperatorType.GTR, BinaryModifier.none().withReturnBool());

        List<TimeSeries> result = stage.process(List.of(cpu), List.of(grid.constant(3)));

        assertEquals(List.of(new FloatSample(10_000L, 0.0), new FloatSample(20_000L, 1.0)), result.get(0).getSamples());
    }

    public void testVectorVectorOneToOne() {
        TimeSeries limit = series(points(new double[] { 10, 8 }, new double[] { 20, 8 }), "__name__", "limit", "job", "api", "instance", "a");
        TimeSeries unmatched = series(points(new double[] { 10, 8 }), "__name__", "limit", "job", "db", "instance", "b");

        List<TimeSeries> result = stage(BinaryOperatorType.DIV).process(List.of(cpu), List.of(limit, unmatched));

        assertEquals(1, result.size());
        assertEquals(cpu.getLabels(), result.get(0).getLabels());
        assertEquals(List.of(new FloatSample(10_000L, 0.25), new FloatSample(20_000L, 0.5)), result.get(0).getSamples());
    }

    public void testVectorVectorOnlyCombinesSharedSteps() {
        TimeSeries partial = series(points(new double[] { 20, 1 }), "__name__", "limit", "job", "api", "instance", "a");

        List<TimeSeries> result = stage(BinaryOperatorType.ADD).process(List.of(cpu), List.of(partial));

        assertEquals(List.of(new FloatSample(20_000L, 5.0)), result.get(0).getSamples());
    }

    public void testOnKeepsOnlyMatchingLabels() {
        TimeSeries total = series(points(new double[] { 10, 1 }, new double[] { 20, 1 }), "__name__", "total", "job", "api", "zone", "eu");

        List<TimeSeries> result = stage(BinaryOperatorType.ADD, BinaryModifier.on("job")).process(List.of(cpu), List.of(total));

        assertEquals(1, result.size());
        assertEquals(MapLabels.fromStrings("job", "api"), result.get(0).getLabels());
        assertEquals(5.0, result.get(0).getLastSample().getValue(), 0.0);
    }

    public void testIgnoringDropsIgnoredLabels() {
        TimeSeries other = series(points(new double[] { 10, 1 }, new double[] { 20, 1 }), "__name__", "other", "job", "api", "instance", "b");

        List<TimeSeries> result = stage(BinaryOperatorType.SUB, BinaryModifier.ignoring("instance")).process(List.of(cpu), List.of(other));

        assertEquals(1, result.size());
        assertEquals(MapLabels.fromStrings("__name__", "cpu", "job", "api"), result.get(0).getLabels());
        assertEquals(3.0, result.get(0).getLastSample().getValue(), 0.0);
    }

    public void testGroupLeftCopiesIncludedLabels() {
        TimeSeries cpuB = series(points(new double[] { 10, 6 }, new double[] { 20, 6 }), "__name__", "cpu", "job", "api", "instance", "b");
        TimeSeries owner = series(points(new double[] { 10, 1 }, new double[] { 20, 1 }), "__name__", "owner", "job", "api", "team", "core");
        BinaryModifier modifier = BinaryModifier.on("job").withGrouping(VectorMatchCardinality.MANY_TO_ONE, "team");

        List<TimeSeries> result = stage(BinaryOperatorType.MUL, modifier).process(List.of(cpu, cpuB), List.of(owner));

        assertEquals(2, result.size());
        assertEquals(cpu.getLabels().withLabel("team", "core"), result.get(0).getLabels());
        assertEquals(cpuB.getLabels().withLabel("team", "core"), result.get(1).getLabels());
        assertEquals(6.0, result.get(1).getLastSample().getValue(), 0.0);
    }

    public void testGroupRightCopiesFromLeft() {
        TimeSeries owner = series(points(new double[] { 10, 1 }, new double[] { 20, 1 }), "__name__", "owner", "job", "api", "team", "core");
        BinaryModifier modifier = BinaryModifier.on("job").withGrouping(VectorMatchCardinality.ONE_TO_MANY, "team");

        List<TimeSeries> result = stage(BinaryOperatorType.MUL, modifier).process(List.of(owner), List.of(cpu));

        assertEquals(1, result.size());
        assertEquals(cpu.getLabels().withLabel("team", "core"), result.get(0).getLabels());
    }

    public void testOutputLabels() {
        MapLabels left = MapLabels.fromStrings("__name__", "a", "job", "api", "instance", "1");
        MapLabels right = MapLabels.fromStrings("__name__", "b", "job", "api", "team", "core");

        assertEquals(left, stage(BinaryOperatorType.ADD).outputLabels(left, right));
        assertEquals(MapLabels.fromStrings("job", "api"), stage(BinaryOperatorType.ADD, BinaryModifier.on("job")).outputLabels(left, right));
        assertEquals(
            MapLabels.fromStrings("__name__", "a", "job", "api"),
            stage(BinaryOperatorType.ADD, BinaryModifier.ignoring("instance")).outputLabels(left, right)
        );
    }

    public void testApply() {
        assertEquals(8.0, stage(BinaryOperatorType.POW).apply(2, 3), 0.0);
        assertEquals(1.0, stage(BinaryOperatorType.MOD).apply(7, 3), 0.0);
        assertEquals(2.0, stage(BinaryOperatorType.EQL).apply(2, 2), 0.0);
        assertNull(stage(BinaryOperatorType.NEQ).apply(2, 2));
        assertEquals(1.0, stage(BinaryOperatorType.LTE, BinaryModifier.none().withReturnBool()).apply(2, 2), 0.0);
        assertEquals(0.0, stage(BinaryOperatorType.LSS, BinaryModifier.none().withReturnBool()).apply(2, 2), 0.0);
        assertEquals(3.0, stage(BinaryOperatorType.GTE).apply(3, 2), 0.0);
    }

    public void testRejectsSetOperators() {
        expectThrows(IllegalArgumentException.class, () -> stage(BinaryOperatorType.AND));
    }

    public void testName() {
        assertEquals("+", stage(BinaryOperatorType.ADD).getName());
    }
}
