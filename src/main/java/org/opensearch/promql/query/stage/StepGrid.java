/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.query.stage;

import org.opensearch.promql.core.model.FloatSample;
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The output timestamps of a query and the rules for snapping samples onto them.
 *
 * <p>An instant query has a single timestamp {@code T}; a selector takes the last sample in
 * {@code [T - lookback, T]}. A range query has the timestamps {@code start, start + step, ...}
 * up to and including {@code end}; a selector takes the last sample within half a step on either
 * side of each timestamp. Grids with fewer than two timestamps use a fixed
 * {@value #SINGLE_STEP_TOLERANCE_MS}ms tolerance instead of half a step.</p>
 *
 * <p>All timestamps are epoch milliseconds.</p>
 */
public final class StepGrid {

    /** Matching tolerance when the grid has fewer than two timestamps. */
    public static final long SINGLE_STEP_TOLERANCE_MS = 5_000L;

    private final long[] timestamps;
    private final long step;
    private final long lookbackMs;
    private final boolean instant;

    private StepGrid(long[] timestamps, long step, long lookbackMs, boolean instant) {
        this.timestamps = timestamps;
        this.step = step;
        this.lookbackMs = lookbackMs;
        this.instant = instant;
    }

    /**
     * Grid of an instant query.
     *
     * @param evalTime the evaluation timestamp
     * @param lookbackMs how far back a selector searches for the latest sample
     * @return the grid
     */
    public static StepGrid instant(long evalTime, long lookbackMs) {
        return new StepGrid(new long[] { evalTime }, 0L, lookbackMs, true);
    }

    /**
     * Grid of a range query.
     *
     * @param start first timestamp
     * @param end last timestamp, inclusive when it falls on the grid
     * @param step distance between timestamps, positive
     * @param lookbackMs how far before {@code start} selectors fetch data
     * @return the grid
     * @throws IllegalArgumentException if {@code step <= 0} or {@code end < start}
     */
    public static StepGrid range(long start, long end, long step, long lookbackMs) {
        if (step <= 0) {
            throw new IllegalArgumentException("Step must be positive, got: " + step);
        }
        if (end < start) {
            throw new IllegalArgumentException("End must not be before start, got start=" + start + ", end=" + end);
        }
        int count = Math.toIntExact(stepCount(start, end, step));
        long[] timestamps = new long[count];
        for (int i = 0; i < count; i++) {
            timestamps[i] = start + i * step;
        }
        return new StepGrid(timestamps, step, lookbackMs, false);
    }

    /**
     * Number of timestamps a range grid would have.
     */
    public static long stepCount(long start, long end, long step) {
        return (end - start) / step + 1;
    }

    public long[] getTimestamps() {
        return timestamps;
    }

    public int size() {
        return timestamps.length;
    }

    public long getStart() {
        return timestamps[0];
    }

    public long getEnd() {
        return timestamps[timestamps.length - 1];
    }

    public long getStep() {
        return step;
    }

    public long getLookbackMs() {
        return lookbackMs;
    }

    public boolean isInstant() {
        return instant;
    }

    /**
     * @return the earliest timestamp a plain selector needs from the store
     */
    public long getFetchStart() {
        return getStart() - lookbackMs;
    }

    /**
     * Tolerance used to pair already evaluated series with grid timestamps.
     *
     * @return half the step, or {@value #SINGLE_STEP_TOLERANCE_MS}ms for grids with fewer than two timestamps
     */
    public long matchTolerance() {
        return timestamps.length < 2 ? SINGLE_STEP_TOLERANCE_MS : step / 2;
    }

    /**
     * Align a raw selector series onto the grid, keeping the timestamps of the grid.
     *
     * @param raw the raw series
     * @return a series with at most one sample per grid timestamp
     */
    public TimeSeries alignSelector(TimeSeries raw) {
        List<Sample> samples = raw.getSamples();
        List<Sample> aligned = new ArrayList<>(Math.min(samples.size(), timestamps.length));
        for (long t : timestamps) {
            Sample sample = instant ? latestIn(samples, t - lookbackMs, t) : latestIn(samples, t - matchTolerance(), t + matchTolerance());
            if (sample != null) {
                aligned.add(new FloatSample(t, sample.getValue()));
            }
        }
        return raw.withSamples(aligned);
    }

    /**
     * Snap a series onto the grid with the {@link #matchTolerance()} rule.
     *
     * @param series the series
     * @return one entry per grid timestamp, null where the series has no sample in tolerance
     */
    public Sample[] snap(TimeSeries series) {
        Sample[] snapped = new Sample[timestamps.length];
        long tolerance = matchTolerance();
        List<Sample> samples = series.getSamples();
        for (int i = 0; i < timestamps.length; i++) {
            snapped[i] = latestIn(samples, timestamps[i] - tolerance, timestamps[i] + tolerance);
        }
        return snapped;
    }

    /**
     * Position of a timestamp on the grid.
     *
     * @param timestamp the timestamp
     * @return its index, or a negative value if it is not a grid timestamp
     */
    public int indexOf(long timestamp) {
        return Arrays.binarySearch(timestamps, timestamp);
    }

    /**
     * A scalar series holding {@code value} at every grid timestamp.
     *
     * @param value the constant
     * @return a series with empty labels
     */
    public TimeSeries constant(double value) {
        List<Sample> samples = new ArrayList<>(timestamps.length);
        for (long t : timestamps) {
            samples.add(new FloatSample(t, value));
        }
        return new TimeSeries(samples, MapLabels.emptyLabels());
    }

    /**
     * Latest sample with a timestamp in {@code [from, to]}.
     *
     * @param samples samples sorted by timestamp
     * @param from lower bound, inclusive
     * @param to upper bound, inclusive
     * @return the sample, or null if none falls in the interval
     */
    public static Sample latestIn(List<Sample> samples, long from, long to) {
        int index = upperBound(samples, to) - 1;
        if (index < 0) {
            return null;
        }
        Sample sample = samples.get(index);
        return sample.getTimestamp() >= from ? sample : null;
    }

    /**
     * Samples with a timestamp in {@code [from, to]}.
     *
     * @param samples samples sorted by timestamp
     * @param from lower bound, inclusive
     * @param to upper bound, inclusive
     * @return a view of the samples in the interval
     */
    public static List<Sample> window(List<Sample> samples, long from, long to) {
        int lo = upperBound(samples, from - 1);
        int hi = upperBound(samples, to);
        return lo >= hi ? List.of() : samples.subList(lo, hi);
    }

    /**
     * Index of the first sample with a timestamp greater than {@code timestamp}.
     */
    private static int upperBound(List<Sample> samples, long timestamp) {
        int lo = 0;
        int hi = samples.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (samples.get(mid).getTimestamp() <= timestamp) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
