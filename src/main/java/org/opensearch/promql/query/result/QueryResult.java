/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.query.result;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.promql.core.model.Sample;
import org.opensearch.promql.core.model.TimeSeries;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a query, rendered in the shape of the Prometheus HTTP API:
 *
 * <pre>
 * {"status":"success","data":{"resultType":"vector","result":[{"metric":{...},"value":[ts,"v"]}]}}
 * </pre>
 *
 * Matrices carry {@code "values"} instead of {@code "value"}. Timestamps are written in seconds and
 * values as strings. Series without samples are not part of the result.
 */
public final class QueryResult implements ToXContentObject {

    private static final String FIELD_STATUS = "status";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_RESULT_TYPE = "resultType";
    private static final String FIELD_RESULT = "result";
    private static final String FIELD_METRIC = "metric";
    private static final String FIELD_VALUE = "value";
    private static final String FIELD_VALUES = "values";

    private static final String STATUS_SUCCESS = "success";

    /**
     * Kind of result.
     */
    public enum ResultType {
        /** One sample per series, evaluated at a single instant. */
        VECTOR,
        /** A sequence of samples per series. */
        MATRIX;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final ResultType resultType;
    private final List<TimeSeries> series;

    private QueryResult(ResultType resultType, List<TimeSeries> series) {
        this.resultType = resultType;
        List<TimeSeries> nonEmpty = new ArrayList<>(series.size());
        for (TimeSeries s : series) {
            if (s.getSamples().isEmpty() == false) {
                nonEmpty.add(s);
            }
        }
        this.series = List.copyOf(nonEmpty);
    }

    /**
     * @param series the result series, each holding the sample of the evaluation instant
     * @return an instant vector result
     */
    public static QueryResult vector(List<TimeSeries> series) {
        return new QueryResult(ResultType.VECTOR, series);
    }

    /**
     * @param series the result series
     * @return a range matrix result
     */
    public static QueryResult matrix(List<TimeSeries> series) {
        return new QueryResult(ResultType.MATRIX, series);
    }

    public ResultType getResultType() {
        return resultType;
    }

    /**
     * @return the series of the result, none of them empty
     */
    public List<TimeSeries> getSeries() {
        return series;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(FIELD_STATUS, STATUS_SUCCESS);
        builder.startObject(FIELD_DATA);
        builder.field(FIELD_RESULT_TYPE, resultType.toString());
        builder.startArray(FIELD_RESULT);
        for (TimeSeries s : series) {
            builder.startObject();
            builder.startObject(FIELD_METRIC);
            for (Map.Entry<String, String> label : s.getLabelsMap().entrySet()) {
                builder.field(label.getKey(), label.getValue());
            }
            builder.endObject();
            if (resultType == ResultType.VECTOR) {
                builder.field(FIELD_VALUE);
                writeSample(builder, s.getLastSample());
            } else {
                builder.startArray(FIELD_VALUES);
                for (Sample sample : s.getSamples()) {
                    writeSample(builder, sample);
                }
                builder.endArray();
            }
            builder.endObject();
        }
        builder.endArray();
        builder.endObject();
        builder.endObject();
        return builder;
    }

    private static void writeSample(XContentBuilder builder, Sample sample) throws IOException {
        builder.startArray();
        builder.value(sample.getTimestamp() / 1000.0);
        builder.value(formatValue(sample.getValue()));
        builder.endArray();
    }

    /**
     * Format a sample value the way Prometheus does: {@code NaN}, {@code +Inf}, {@code -Inf}, or the
     * shortest plain decimal representation.
     *
     * @param value the value
     * @return its string form
     */
    public static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (value == Double.POSITIVE_INFINITY) {
            return "+Inf";
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return "-Inf";
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryResult that = (QueryResult) o;
        return resultType == that.resultType && series.equals(that.series);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultType, series);
    }

    @Override
    public String toString() {
        return "QueryResult{" + "resultType=" + resultType + ", series=" + series + '}';
    }
}
