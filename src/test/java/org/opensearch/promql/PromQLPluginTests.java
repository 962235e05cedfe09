/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql;

import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;
import org.opensearch.promql.exception.InvalidArgumentException;
import org.opensearch.promql.lang.prom.promql.eval.PromQLEngine;
import org.opensearch.promql.lang.prom.promql.parser.nodes.InstantVectorSelectorNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.NumberLiteralNode;
import org.opensearch.promql.lang.prom.promql.parser.nodes.RootNode;
import org.opensearch.promql.query.result.QueryResult;
import org.opensearch.promql.store.InMemoryMetricStore;
import org.opensearch.promql.store.MetricRow;
import org.opensearch.promql.store.SubStore;
import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.threadpool.ExecutorBuilder;
import org.opensearch.threadpool.TestThreadPool;
import org.opensearch.threadpool.ThreadPool;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Tests for PromQLPlugin settings and thread pool registration.
 */
public class PromQLPluginTests extends OpenSearchTestCase {

    /**
     * Test that every setting is registered.
     */
    public void testSettingsAreRegistered() {
        List<?> settings = new PromQLPlugin().getSettings();

        assertEquals(4, settings.size());
        assertTrue(settings.contains(PromQLPlugin.DEFAULT_LOOKBACK));
        assertTrue(settings.contains(PromQLPlugin.MAX_STEPS));
        assertTrue(settings.contains(PromQLPlugin.STORE_STRICT));
        assertTrue(settings.contains(PromQLPlugin.EVALUATION_POOL_SIZE));
    }

    /**
     * Test setting default values when using empty settings.
     */
    public void testDefaults() {
        PromQLSettings defaults = PromQLSettings.defaults();

        assertEquals("Default look-back should be 5 minutes", TimeValue.timeValueMinutes(5), defaults.defaultLookback());
        assertEquals("Default max steps should be 11000", 11000, defaults.maxSteps());
        assertFalse("Store should be lenient by default", defaults.strictStore());
    }

    /**
     * Test reading configured values.
     */
    public void testFromSettings() {
        Settings settings = Settings.builder()
            .put(PromQLPlugin.DEFAULT_LOOKBACK.getKey(), "1m")
            .put(PromQLPlugin.MAX_STEPS.getKey(), 500)
            .put(PromQLPlugin.STORE_STRICT.getKey(), true)
            .build();

        assertEquals(new PromQLSettings(TimeValue.timeValueMinutes(1), 500, true), PromQLSettings.fromSettings(settings));
    }

    /**
     * Test that out of range values are rejected.
     */
    public void testInvalidValues() {
        Settings zeroSteps = Settings.builder().put(PromQLPlugin.MAX_STEPS.getKey(), 0).build();
        expectThrows(IllegalArgumentException.class, () -> PromQLSettings.fromSettings(zeroSteps));

        Settings zeroPool = Settings.builder().put(PromQLPlugin.EVALUATION_POOL_SIZE.getKey(), 0).build();
        expectThrows(IllegalArgumentException.class, () -> PromQLPlugin.EVALUATION_POOL_SIZE.get(zeroPool));
    }

    /**
     * Test the default pool size derived from allocated processors.
     */
    public void testDefaultPoolSize() {
        Settings singleProcessor = Settings.builder().put("node.processors", 1).build();

        assertEquals(1, PromQLPlugin.defaultPoolSize(singleProcessor));
        assertEquals(1, (int) PromQLPlugin.EVALUATION_POOL_SIZE.get(singleProcessor));
        assertTrue(PromQLPlugin.EVALUATION_POOL_SIZE.get(Settings.EMPTY) >= 1);
    }

    /**
     * Test that the evaluation thread pool is built from the settings.
     */
    public void testEvaluationThreadPool() throws Exception {
        Settings settings = Settings.builder().put(PromQLPlugin.EVALUATION_POOL_SIZE.getKey(), 3).build();
        List<ExecutorBuilder<?>> builders = new PromQLPlugin().getExecutorBuilders(settings);
        assertEquals(1, builders.size());

        ThreadPool threadPool = new TestThreadPool(getTestName(), builders.toArray(new ExecutorBuilder<?>[0]));
        try {
            ThreadPool.Info info = threadPool.info(PromQLPlugin.EVALUATION_THREAD_POOL_NAME);
            assertNotNull(info);
            assertEquals(ThreadPool.ThreadPoolType.FIXED, info.getThreadPoolType());
            assertEquals(3, info.getMax());
            assertEquals(PromQLPlugin.EVALUATION_QUEUE_SIZE, info.getQueueSize().singles());
        } finally {
            ThreadPool.terminate(threadPool, 10, TimeUnit.SECONDS);
        }
    }

    /**
     * Test that engines built by the plugin evaluate on the evaluation pool with the node settings.
     */
    public void testCreateEngine() throws Exception {
        Settings settings = Settings.builder()
            .put(PromQLPlugin.EVALUATION_POOL_SIZE.getKey(), 2)
            .put(PromQLPlugin.MAX_STEPS.getKey(), 2)
            .build();
        InMemoryMetricStore store = new InMemoryMetricStore().add(
            SubStore.GAUGE,
            new MetricRow("temperature", "", Map.of("room", "a"), 60_000L, 21.5)
        );

        List<ExecutorBuilder<?>> builders = new PromQLPlugin().getExecutorBuilders(settings);
        ThreadPool threadPool = new TestThreadPool(getTestName(), builders.toArray(new ExecutorBuilder<?>[0]));
        try {
            PromQLEngine engine = PromQLPlugin.createEngine(store, threadPool, settings);

            QueryResult result = engine.evaluateInstant(new RootNode(new InstantVectorSelectorNode("temperature")), 60_000L)
                .get(10, TimeUnit.SECONDS);
            assertEquals("Selector should return the stored sample", 1, result.getSeries().size());
            assertEquals(21.5, result.getSeries().get(0).getLastSample().getValue(), 0.0);

            // three steps exceed the configured maximum of two
            expectThrows(
                InvalidArgumentException.class,
                () -> engine.evaluateRange(new RootNode(new NumberLiteralNode(1)), 0L, 120_000L, 60_000L)
            );
        } finally {
            ThreadPool.terminate(threadPool, 10, TimeUnit.SECONDS);
        }
    }
}
