/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.function;

import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.lang.prom.common.FunctionType;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Numeric kernels of the PromQL range functions.
 *
 * <p>Every kernel receives the raw samples of one series inside one sliding window, ordered by
 * timestamp, and returns at most one value. An empty {@link OptionalDouble} means the series has
 * no output point at that step; it is never a substitute for zero. Rates, derivatives and
 * {@code predict_linear} offsets use seconds.</p>
 *
 * <p>Counter resets: when a counter decreases, the decrease is treated as a restart from zero and
 * the new value itself is counted as the increase for that interval.</p>
 */
public final class RangeFunctions {

    /** Two values closer than this are considered equal by {@code changes} and {@code deriv}. */
    public static final double EPSILON = Math.ulp(1.0);

    private RangeFunctions() {}

    /**
     * Evaluate a range function over one window.
     *
     * @param type a {@link FunctionType.Category#RANGE} function
     * @param window samples in the window, ordered by timestamp
     * @param parameter the numeric argument of {@code quantile_over_time} (the quantile) or
     *                  {@code predict_linear} (the offset in seconds); ignored otherwise
     * @return the value, or empty if the window has no output point
     */
    public static OptionalDouble apply(FunctionType type, List<Sample> window, double parameter) {
        return switch (type) {
            case RATE -> rate(window);
            case IRATE -> irate(window);
            case INCREASE -> increase(window);
            case DELTA -> delta(window);
            case IDELTA -> idelta(window);
            case SUM_OVER_TIME -> sumOverTime(window);
            case AVG_OVER_TIME -> avgOverTime(window);
            case MIN_OVER_TIME -> minOverTime(window);
            case MAX_OVER_TIME -> maxOverTime(window);
            case COUNT_OVER_TIME -> countOverTime(window);
            case STDDEV_OVER_TIME -> stddevOverTime(window);
            case STDVAR_OVER_TIME -> stdvarOverTime(window);
            case QUANTILE_OVER_TIME -> quantileOverTime(window, parameter);
            case LAST_OVER_TIME -> lastOverTime(window);
            case FIRST_OVER_TIME -> firstOverTime(window);
            case PRESENT_OVER_TIME -> window.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(1.0);
            case ABSENT_OVER_TIME -> window.isEmpty() ? OptionalDouble.of(1.0) : OptionalDouble.empty();
            case DERIV -> deriv(window);
            case PREDICT_LINEAR -> predictLinear(window, parameter);
            case CHANGES -> changes(window);
            case RESETS -> resets(window);
            default -> throw new IllegalArgumentException("Not a range function: " + type);
        };
    }

    /**
     * Per-second average rate of increase, adjusted for counter resets.
     * Requires at least two samples spanning a positive duration.
     */
    public static OptionalDouble rate(List<Sample> window) {
        if (window.size() < 2) {
            return OptionalDouble.empty();
        }
        double dt = window.get(window.size() - 1).getTimestampSeconds() - window.get(0).getTimestampSeconds();
        if (dt <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(counterIncrease(window) / dt);
    }

    /**
     * Per-second rate computed from the last two samples only.
     */
    public static OptionalDouble irate(List<Sample> window) {
        if (window.size() < 2) {
            return OptionalDouble.empty();
        }
        Sample previous = window.get(window.size() - 2);
        Sample last = window.get(window.size() - 1);
        double dt = last.getTimestampSeconds() - previous.getTimestampSeconds();
        if (dt <= 0) {
            return OptionalDouble.empty();
        }
        double diff = last.getValue() - previous.getValue();
        double increase = diff >= 0 ? diff : last.getValue();
        return OptionalDouble.of(increase / dt);
    }

    /**
     * Total increase over the window, equal to {@code rate * (last.t - first.t)}.
     */
    public static OptionalDouble increase(List<Sample> window) {
        if (window.size() < 2) {
            return OptionalDouble.empty();
        }
        double dt = window.get(window.size() - 1).getTimestampSeconds() - window.get(0).getTimestampSeconds();
        if (dt <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(counterIncrease(window));
    }

    public static OptionalDouble delta(List<Sample> window) {
        if (window.size() < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(window.get(window.size() - 1).getValue() - window.get(0).getValue());
    }

    public static OptionalDouble idelta(List<Sample> window) {
        if (window.size() < 2) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(window.get(window.size() - 1).getValue() - window.get(window.size() - 2).getValue());
    }

    public static OptionalDouble sumOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (Sample sample : window) {
            sum += sample.getValue();
        }
        return OptionalDouble.of(sum);
    }

    public static OptionalDouble avgOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sumOverTime(window).getAsDouble() / window.size());
    }

    public static OptionalDouble minOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        double min = Double.POSITIVE_INFINITY;
        for (Sample sample : window) {
            min = Math.min(min, sample.getValue());
        }
        return OptionalDouble.of(min);
    }

    public static OptionalDouble maxOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        double max = Double.NEGATIVE_INFINITY;
        for (Sample sample : window) {
            max = Math.max(max, sample.getValue());
        }
        return OptionalDouble.of(max);
    }

    public static OptionalDouble countOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(window.size());
    }

    /** Population standard deviation of the window values. */
    public static OptionalDouble stddevOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(populationVariance(values(window))));
    }

    /** Population variance of the window values. */
    public static OptionalDouble stdvarOverTime(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(populationVariance(values(window)));
    }

    public static OptionalDouble quantileOverTime(List<Sample> window, double q) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        double[] sorted = values(window);
        Arrays.sort(sorted);
        return OptionalDouble.of(quantileSorted(sorted, q));
    }

    public static OptionalDouble lastOverTime(List<Sample> window) {
        return window.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(window.get(window.size() - 1).getValue());
    }

    public static OptionalDouble firstOverTime(List<Sample> window) {
        return window.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(window.get(0).getValue());
    }

    /**
     * Slope, per second, of the least-squares line through the window.
     */
    public static OptionalDouble deriv(List<Sample> window) {
        double[] line = linearRegression(window);
        return line == null ? OptionalDouble.empty() : OptionalDouble.of(line[0]);
    }

    /**
     * Value of the least-squares line {@code offsetSeconds} after the last sample of the window.
     */
    public static OptionalDouble predictLinear(List<Sample> window, double offsetSeconds) {
        double[] line = linearRegression(window);
        if (line == null) {
            return OptionalDouble.empty();
        }
        double origin = window.get(0).getTimestampSeconds();
        double x = window.get(window.size() - 1).getTimestampSeconds() - origin + offsetSeconds;
        return OptionalDouble.of(line[0] * x + line[1]);
    }

    /**
     * Number of adjacent pairs whose values differ.
     */
    public static OptionalDouble changes(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        int changes = 0;
        for (int i = 1; i < window.size(); i++) {
            if (Math.abs(window.get(i).getValue() - window.get(i - 1).getValue()) > EPSILON) {
                changes++;
            }
        }
        return OptionalDouble.of(changes);
    }

    /**
     * Number of adjacent pairs where the value decreased.
     */
    public static OptionalDouble resets(List<Sample> window) {
        if (window.isEmpty()) {
            return OptionalDouble.empty();
        }
        int resets = 0;
        for (int i = 1; i < window.size(); i++) {
            if (window.get(i).getValue() < window.get(i - 1).getValue()) {
                resets++;
            }
        }
        return OptionalDouble.of(resets);
    }

    /**
     * Linear-interpolation quantile of ascending values.
     *
     * <p>For {@code n} values the rank is {@code q * (n - 1)}; the result interpolates between the
     * values at the floor and ceiling of the rank. {@code q} is clamped to [0, 1].</p>
     *
     * @param sorted values sorted ascending
     * @param q the quantile
     * @return the quantile, or NaN if there are no values
     */
    public static double quantileSorted(double[] sorted, double q) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double clamped = Math.max(0.0, Math.min(1.0, q));
        double rank = clamped * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Population variance, {@code Σ(v - mean)² / n}.
     *
     * @param values the values
     * @return the variance, or NaN if there are no values
     */
    public static double populationVariance(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double mean = 0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double squares = 0;
        for (double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return squares / values.length;
    }

    private static double counterIncrease(List<Sample> window) {
        double increase = 0;
        for (int i = 1; i < window.size(); i++) {
            double current = window.get(i).getValue();
            double diff = current - window.get(i - 1).getValue();
            increase += diff >= 0 ? diff : current;
        }
        return increase;
    }

    /**
     * Ordinary least squares over (seconds since first sample, value).
     *
     * @return {@code [slope, intercept]} with the intercept at the first sample, or null if fewer
     *         than two samples or all samples share a timestamp
     */
    private static double[] linearRegression(List<Sample> window) {
        if (window.size() < 2) {
            return null;
        }
        double origin = window.get(0).getTimestampSeconds();
        double n = window.size();
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (Sample sample : window) {
            double x = sample.getTimestampSeconds() - origin;
            double y = sample.getValue();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumXX += x * x;
        }
        double denominator = n * sumXX - sumX * sumX;
        if (Math.abs(denominator) < EPSILON) {
            return null;
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new double[] { slope, intercept };
    }

    private static double[] values(List<Sample> window) {
        double[] values = new double[window.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = window.get(i).getValue();
        }
        return values;
    }
}
