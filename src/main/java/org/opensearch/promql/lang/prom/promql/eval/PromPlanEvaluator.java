/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.FunctionType;
import org.opensearch.promql.lang.prom.promql.plan.nodes.AggregationPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.BinaryPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FetchPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FuncPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.NegatePlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanVisitor;
import org.opensearch.promql.lang.prom.promql.plan.nodes.ScalarPlanNode;
import org.opensearch.promql.lang.prom.stage.AggregationStage;
import org.opensearch.promql.lang.prom.stage.BinaryOperationStage;
import org.opensearch.promql.lang.prom.stage.HistogramQuantileStage;
import org.opensearch.promql.lang.prom.stage.NegateStage;
import org.opensearch.promql.lang.prom.stage.RangeFunctionStage;
import org.opensearch.promql.lang.prom.stage.ScalarFunctionStage;
import org.opensearch.promql.lang.prom.stage.SetOperationStage;
import org.opensearch.promql.lang.prom.stage.TopKStage;
import org.opensearch.promql.query.stage.BinaryPipelineStage;
import org.opensearch.promql.query.stage.StepGrid;
import org.opensearch.promql.query.stage.UnaryPipelineStage;
import org.opensearch.promql.store.SeriesFetcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Evaluates a plan over a step grid.
 *
 * <p>Every node maps to a future of its series. Selectors resolve through the {@link SeriesFetcher};
 * other nodes apply a pipeline stage to the result of their children once it is available. The two
 * operands of a binary node are evaluated independently and combined when both complete. Stage work
 * runs on the given executor.</p>
 *
 * <p>A fresh evaluator is created per query.</p>
 */
public class PromPlanEvaluator extends PromPlanVisitor<CompletableFuture<List<TimeSeries>>> {
    private final SeriesFetcher fetcher;
    private final StepGrid grid;
    private final Executor executor;

    /**
     * Constructor for PromPlanEvaluator.
     * @param fetcher resolves selectors
     * @param grid the evaluation steps
     * @param executor runs pipeline stages
     */
    public PromPlanEvaluator(SeriesFetcher fetcher, StepGrid grid, Executor executor) {
        this.fetcher = fetcher;
        this.grid = grid;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(FetchPlanNode node) {
        if (node.isRangeVector()) {
            // raw samples, widened so the first step sees a full window
            return fetcher.fetch(node.getSelector(), grid.getStart() - node.getRangeMs(), grid.getEnd());
        }
        return fetcher.fetch(node.getSelector(), grid.getFetchStart(), grid.getEnd()).thenApplyAsync(this::align, executor);
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(FuncPlanNode node) {
        FunctionType type = node.getFunctionType();
        if (type == FunctionType.PI) {
            return CompletableFuture.completedFuture(List.of(grid.constant(Math.PI)));
        }

        UnaryPipelineStage stage;
        if (type.requiresRangeVector()) {
            FetchPlanNode matrix = (FetchPlanNode) node.getSeriesArgument();
            stage = new RangeFunctionStage(type, node.getArgument(0, Double.NaN), matrix.getRangeMs(), grid);
        } else if (type == FunctionType.HISTOGRAM_QUANTILE) {
            stage = new HistogramQuantileStage(node.getArgument(0, Double.NaN), grid);
        } else {
            stage = new ScalarFunctionStage(type, node.getArguments());
        }
        return apply(process(node.getSeriesArgument()), stage);
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(AggregationPlanNode node) {
        UnaryPipelineStage stage;
        if (node.getAggregationType().selectsSeries()) {
            stage = new TopKStage(node.getAggregationType(), node.getGroupingModifier(), node.getGroupingLabels(), node.getParameter());
        } else {
            stage = new AggregationStage(
                node.getAggregationType(),
                node.getGroupingModifier(),
                node.getGroupingLabels(),
                node.getParameter(),
                grid
            );
        }
        return apply(process(node.getChildren().get(0)), stage);
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(BinaryPlanNode node) {
        BinaryPipelineStage stage = node.getOperator().isSetOperator()
            ? new SetOperationStage(node.getOperator(), node.getModifier())
            : new BinaryOperationStage(node.getOperator(), node.getModifier(), grid);

        CompletableFuture<List<TimeSeries>> left = process(node.getLeft());
        CompletableFuture<List<TimeSeries>> right = process(node.getRight());
        return left.thenCombineAsync(right, stage::process, executor);
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(NegatePlanNode node) {
        return apply(process(node.getChildren().get(0)), new NegateStage());
    }

    @Override
    public CompletableFuture<List<TimeSeries>> visit(ScalarPlanNode node) {
        return CompletableFuture.completedFuture(List.of(grid.constant(node.getValue())));
    }

    private CompletableFuture<List<TimeSeries>> apply(CompletableFuture<List<TimeSeries>> input, UnaryPipelineStage stage) {
        return input.thenApplyAsync(stage::process, executor);
    }

    private List<TimeSeries> align(List<TimeSeries> raw) {
        List<TimeSeries> aligned = new ArrayList<>(raw.size());
        for (TimeSeries series : raw) {
            TimeSeries onGrid = grid.alignSelector(series);
            if (onGrid.getSamples().isEmpty() == false) {
                aligned.add(onGrid);
            }
        }
        return aligned;
    }
}
