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

/**
 * Snapshot of the engine settings.
 *
 * @param defaultLookback look-back of instant queries, and of range queries without a range vector
 * @param maxSteps maximum number of steps of a range query
 * @param strictStore whether sub-store failures fail the query
 */
public record PromQLSettings(TimeValue defaultLookback, int maxSteps, boolean strictStore) {

    /**
     * Read the settings.
     *
     * @param settings node settings
     * @return the snapshot
     */
    public static PromQLSettings fromSettings(Settings settings) {
        return new PromQLSettings(
            PromQLPlugin.DEFAULT_LOOKBACK.get(settings),
            PromQLPlugin.MAX_STEPS.get(settings),
            PromQLPlugin.STORE_STRICT.get(settings)
        );
    }

    /**
     * @return the snapshot of empty settings
     */
    public static PromQLSettings defaults() {
        return fromSettings(Settings.EMPTY);
    }
}
