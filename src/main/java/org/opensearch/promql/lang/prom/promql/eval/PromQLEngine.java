/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.core.action.ActionListener;
import org.opensearch.promql.PromQLSettings;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.exception.InvalidArgumentException;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RootNode;
import org.opensearch.promql.lang.prom.promql.plan.PromASTConverter;
import org.opensearch.promql.lang.prom.promql.plan.nodes.FetchPlanNode;
import org.opensearch.promql.lang.prom.promql.plan.nodes.PromPlanNode;
import org.opensearch.promql.query.result.QueryResult;
import org.opensearch.promql.query.stage.StepGrid;
import org.opensearch.promql.store.MetricStore;
import org.opensearch.promql.store.SeriesFetcher;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for evaluating parsed PromQL expressions against a {@link MetricStore}.
 *
 * <p>Validation of the expression and of the query window happens synchronously: an
 * {@link org.opensearch.promql.exception.UnsupportedExpressionException} or
 * {@link InvalidArgumentException} is thrown before any store access. The evaluation itself is
 * asynchronous; its continuations run on the engine executor.</p>
 *
 * <p>The engine holds no per-query state and can serve concurrent queries.</p>
 */
public class PromQLEngine {
    private static final Logger logger = LogManager.getLogger(PromQLEngine.class);

    private final MetricStore store;
    private final Executor executor;
    private final PromQLSettings settings;

    /**
     * Constructor for PromQLEngine.
     * @param store the store selectors are resolved against
     * @param executor runs evaluation work
     * @param settings engine settings
     */
    public PromQLEngine(MetricStore store, Executor executor, PromQLSettings settings) {
        this.store = store;
        this.executor = executor;
        this.settings = settings;
    }

    /**
     * Evaluate an instant query with the default look-back.
     *
     * @param query the parsed expression
     * @param evalTimeMs evaluation time in epoch milliseconds
     * @return the result vector
     */
    public CompletableFuture<QueryResult> evaluateInstant(RootNode query, long evalTimeMs) {
        return evaluateInstant(query, evalTimeMs, settings.defaultLookback());
    }

    /**
     * Evaluate an instant query.
     *
     * @param query the parsed expression
     * @param evalTimeMs evaluation time in epoch milliseconds
     * @param lookback how far back a selector looks for the latest sample
     * @return the result vector, or the raw samples when the expression is a range vector
     */
    public CompletableFuture<QueryResult> evaluateInstant(RootNode query, long evalTimeMs, TimeValue lookback) {
        PromPlanNode plan = new PromASTConverter().buildPlan(query);
        StepGrid grid = StepGrid.instant(evalTimeMs, lookback.millis());
        logger.debug("Evaluating instant query at {} with look-back {}", evalTimeMs, lookback);

        boolean rawMatrix = isRangeVector(plan);
        return evaluate(plan, grid).thenApply(series -> rawMatrix ? QueryResult.matrix(series) : QueryResult.vector(series));
    }

    /**
     * Evaluate a range query.
     *
     * @param query the parsed expression
     * @param startMs first step in epoch milliseconds
     * @param endMs last possible step in epoch milliseconds
     * @param stepMs distance between steps in milliseconds
     * @return the result matrix
     * @throws InvalidArgumentException if the window or step is invalid, or the expression is a range vector
     */
    public CompletableFuture<QueryResult> evaluateRange(RootNode query, long startMs, long endMs, long stepMs) {
        PromPlanNode plan = new PromASTConverter().buildPlan(query);
        if (isRangeVector(plan)) {
            throw new InvalidArgumentException("a range query requires an instant vector or scalar expression, got a range vector");
        }
        StepGrid grid = rangeGrid(plan, startMs, endMs, stepMs);
        logger.debug(
            "Evaluating range query [{}..{}] with step {}ms: {} steps, look-back {}ms",
            startMs,
            endMs,
            stepMs,
            grid.size(),
            grid.getLookbackMs()
        );
        return evaluate(plan, grid).thenApply(QueryResult::matrix);
    }

    /**
     * Evaluate a range query with a step given as a duration string such as {@code 30s} or {@code 15}.
     *
     * @param query the parsed expression
     * @param startMs first step in epoch milliseconds
     * @param endMs last possible step in epoch milliseconds
     * @param step distance between steps
     * @return the result matrix
     */
    public CompletableFuture<QueryResult> evaluateRange(RootNode query, long startMs, long endMs, String step) {
        return evaluateRange(query, startMs, endMs, PromDurations.parse(step));
    }

    /**
     * Evaluate an instant query with the default look-back, notifying a listener.
     *
     * @param query the parsed expression
     * @param evalTimeMs evaluation time in epoch milliseconds
     * @param listener receives the result or the failure
     */
    public void evaluateInstant(RootNode query, long evalTimeMs, ActionListener<QueryResult> listener) {
        try {
            whenComplete(evaluateInstant(query, evalTimeMs), listener);
        } catch (Exception e) {
            listener.onFailure(e);
        }
    }

    /**
     * Evaluate a range query, notifying a listener.
     *
     * @param query the parsed expression
     * @param startMs first step in epoch milliseconds
     * @param endMs last possible step in epoch milliseconds
     * @param stepMs distance between steps in milliseconds
     * @param listener receives the result or the failure
     */
    public void evaluateRange(RootNode query, long startMs, long endMs, long stepMs, ActionListener<QueryResult> listener) {
        try {
            whenComplete(evaluateRange(query, startMs, endMs, stepMs), listener);
        } catch (Exception e) {
            listener.onFailure(e);
        }
    }

    private StepGrid rangeGrid(PromPlanNode plan, long startMs, long endMs, long stepMs) {
        if (stepMs <= 0) {
            throw new InvalidArgumentException("step must be positive, got {}ms", stepMs);
        }
        if (endMs < startMs) {
            throw new InvalidArgumentException("end [{}] must not be before start [{}]", endMs, startMs);
        }
        long steps = StepGrid.stepCount(startMs, endMs, stepMs);
        if (steps > settings.maxSteps()) {
            throw new InvalidArgumentException("query would produce {} steps, the maximum is {}", steps, settings.maxSteps());
        }
        long lookbackMs = new LookbackExtractor(settings.defaultLookback().millis()).process(plan);
        return StepGrid.range(startMs, endMs, stepMs, lookbackMs);
    }

    private CompletableFuture<List<TimeSeries>> evaluate(PromPlanNode plan, StepGrid grid) {
        if (logger.isTraceEnabled()) {
            logger.trace("Plan:\n{}", plan.explain());
        }
        SeriesFetcher fetcher = new SeriesFetcher(store, executor, settings.strictStore());
        return new PromPlanEvaluator(fetcher, grid, executor).process(plan);
    }

    private static boolean isRangeVector(PromPlanNode plan) {
        return plan instanceof FetchPlanNode fetch && fetch.isRangeVector();
    }

    private static void whenComplete(CompletableFuture<QueryResult> future, ActionListener<QueryResult> listener) {
        future.whenComplete((result, e) -> {
            if (e != null) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                listener.onFailure(cause instanceof Exception exception ? exception : new RuntimeException(cause));
            } else {
                listener.onResponse(result);
            }
        });
    }
}
