/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.common.util.concurrent.OpenSearchExecutors;
import org.opensearch.plugins.Plugin;
import org.opensearch.promql.lang.prom.promql.eval.PromQLEngine;
import org.opensearch.promql.store.MetricStore;
import org.opensearch.threadpool.ExecutorBuilder;
import org.opensearch.threadpool.FixedExecutorBuilder;
import org.opensearch.threadpool.ThreadPool;

import java.util.List;

/**
 * Plugin registering the PromQL engine settings and its evaluation thread pool. Embedding code
 * builds engines on that pool with {@link #createEngine(MetricStore, ThreadPool, Settings)}.
 */
public class PromQLPlugin extends Plugin {
    private static final Logger logger = LogManager.getLogger(PromQLPlugin.class);

    /** Name of the thread pool running query evaluation. */
    public static final String EVALUATION_THREAD_POOL_NAME = "promql_evaluation";

    /** Queue size of the evaluation thread pool. */
    static final int EVALUATION_QUEUE_SIZE = 1000;

    /**
     * Look-back of instant queries when the caller gives none, and of range queries without a range vector.
     */
    public static final Setting<TimeValue> DEFAULT_LOOKBACK = Setting.timeSetting(
        "promql.query.default_lookback",
        TimeValue.timeValueMinutes(5),
        TimeValue.timeValueMillis(1),
        Setting.Property.NodeScope
    );

    /**
     * Maximum number of steps of a range query.
     */
    public static final Setting<Integer> MAX_STEPS = Setting.intSetting("promql.query.max_steps", 11000, 1, Setting.Property.NodeScope);

    /**
     * Whether a failed sub-store fetch fails the query instead of being treated as empty.
     */
    public static final Setting<Boolean> STORE_STRICT = Setting.boolSetting("promql.store.strict", false, Setting.Property.NodeScope);

    /**
     * Size of the evaluation thread pool, half the allocated processors by default.
     */
    public static final Setting<Integer> EVALUATION_POOL_SIZE = new Setting<>(
        "promql.evaluation.pool_size",
        s -> Integer.toString(defaultPoolSize(s)),
        s -> Setting.parseInt(s, 1, "promql.evaluation.pool_size"),
        Setting.Property.NodeScope
    );

    /**
     * Default constructor
     */
    public PromQLPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return List.of(DEFAULT_LOOKBACK, MAX_STEPS, STORE_STRICT, EVALUATION_POOL_SIZE);
    }

    @Override
    public List<ExecutorBuilder<?>> getExecutorBuilders(Settings settings) {
        int poolSize = EVALUATION_POOL_SIZE.get(settings);
        logger.info("Registering thread pool [{}] with size {}", EVALUATION_THREAD_POOL_NAME, poolSize);
        return List.of(new FixedExecutorBuilder(settings, EVALUATION_THREAD_POOL_NAME, poolSize, EVALUATION_QUEUE_SIZE, ""));
    }

    /**
     * Build an engine whose evaluation runs on the {@value #EVALUATION_THREAD_POOL_NAME} pool of a node.
     *
     * @param store the store selectors are resolved against
     * @param threadPool the node thread pool, built with {@link #getExecutorBuilders(Settings)}
     * @param settings node settings
     * @return the engine
     */
    public static PromQLEngine createEngine(MetricStore store, ThreadPool threadPool, Settings settings) {
        return new PromQLEngine(store, threadPool.executor(EVALUATION_THREAD_POOL_NAME), PromQLSettings.fromSettings(settings));
    }

    static int defaultPoolSize(Settings settings) {
        return Math.max(1, OpenSearchExecutors.allocatedProcessors(settings) / 2);
    }
}
