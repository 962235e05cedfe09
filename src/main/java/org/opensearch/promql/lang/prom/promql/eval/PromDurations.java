/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.eval;

import com.google.re2j.Matcher;
import com.google.re2j.Pattern;
import org.opensearch.promql.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Parses PromQL duration strings such as {@code 30s}, {@code 1h30m} or a bare number of seconds.
 */
public final class PromDurations {

    private static final Pattern DURATION = Pattern.compile("(?:[0-9]+(?:ms|s|m|h|d|w|y))+");
    private static final Pattern DURATION_PART = Pattern.compile("([0-9]+)(ms|s|m|h|d|w|y)");

    private static final long SECOND_MS = 1000L;
    private static final long MINUTE_MS = 60 * SECOND_MS;
    private static final long HOUR_MS = 60 * MINUTE_MS;
    private static final long DAY_MS = 24 * HOUR_MS;

    private PromDurations() {}

    /**
     * Parse a duration.
     *
     * @param duration unit groups ({@code ms s m h d w y}, a year being 365 days) or a float number of seconds
     * @return the duration in milliseconds
     * @throws InvalidArgumentException if the string is not a valid duration
     */
    public static long parse(String duration) {
        if (duration == null || duration.isBlank()) {
            throw new InvalidArgumentException("Empty duration");
        }
        String trimmed = duration.trim();
        if (DURATION.matcher(trimmed).matches()) {
            long total = 0;
            Matcher matcher = DURATION_PART.matcher(trimmed);
            while (matcher.find()) {
                try {
                    total = Math.addExact(total, Math.multiplyExact(Long.parseLong(matcher.group(1)), unitMs(matcher.group(2))));
                } catch (ArithmeticException | NumberFormatException e) {
                    throw new InvalidArgumentException("Duration [{}] is out of range", duration);
                }
            }
            return total;
        }

        double seconds;
        try {
            seconds = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid duration [{}]", duration);
        }
        if (Double.isFinite(seconds) == false || seconds < 0) {
            throw new InvalidArgumentException("Invalid duration [{}]", duration);
        }
        return Math.round(seconds * SECOND_MS);
    }

    private static long unitMs(String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "ms":
                return 1L;
            case "s":
                return SECOND_MS;
            case "m":
                return MINUTE_MS;
            case "h":
                return HOUR_MS;
            case "d":
                return DAY_MS;
            case "w":
                return 7 * DAY_MS;
            case "y":
                return 365 * DAY_MS;
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
    }
}
