/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.function;

import org.opensearch.promql.lang.prom.common.FunctionType;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Pointwise math functions.
 */
public final class ScalarFunctions {

    private ScalarFunctions() {}

    /**
     * Resolve the pointwise operator of a scalar function.
     *
     * @param type the function
     * @param arguments numeric arguments of the call, excluding the series argument
     * @return the operator applied to every sample value
     * @throws IllegalArgumentException if the function is not pointwise
     */
    public static DoubleUnaryOperator operator(FunctionType type, List<Double> arguments) {
        return switch (type) {
            case ABS -> Math::abs;
            case CEIL -> Math::ceil;
            case FLOOR -> Math::floor;
            case ROUND -> round(arguments.isEmpty() ? 1.0 : arguments.get(0));
            case SQRT -> Math::sqrt;
            case EXP -> Math::exp;
            case LN -> Math::log;
            case LOG2 -> v -> Math.log(v) / Math.log(2.0);
            case LOG10 -> Math::log10;
            case SGN -> Math::signum;
            case CLAMP -> clamp(arguments.get(0), arguments.get(1));
            case CLAMP_MIN -> clampMin(arguments.get(0));
            case CLAMP_MAX -> clampMax(arguments.get(0));
            case ACOS -> Math::acos;
            case ACOSH -> ScalarFunctions::acosh;
            case ASIN -> Math::asin;
            case ASINH -> ScalarFunctions::asinh;
            case ATAN -> Math::atan;
            case ATANH -> ScalarFunctions::atanh;
            case COS -> Math::cos;
            case COSH -> Math::cosh;
            case SIN -> Math::sin;
            case SINH -> Math::sinh;
            case TAN -> Math::tan;
            case TANH -> Math::tanh;
            case DEG -> Math::toDegrees;
            case RAD -> Math::toRadians;
            default -> throw new IllegalArgumentException("Not a pointwise function: " + type);
        };
    }

    /**
     * Round to the nearest multiple of {@code toNearest}, halves rounding up. Zero leaves values unchanged.
     */
    static DoubleUnaryOperator round(double toNearest) {
        if (toNearest == 0) {
            return DoubleUnaryOperator.identity();
        }
        double inverse = 1.0 / toNearest;
        return v -> Math.floor(v * inverse + 0.5) / inverse;
    }

    static DoubleUnaryOperator clamp(double min, double max) {
        return v -> Math.max(min, Math.min(max, v));
    }

    static DoubleUnaryOperator clampMin(double min) {
        return v -> Math.max(min, v);
    }

    static DoubleUnaryOperator clampMax(double max) {
        return v -> Math.min(max, v);
    }

    static double acosh(double v) {
        return Math.log(v + Math.sqrt(v * v - 1.0));
    }

    static double asinh(double v) {
        double abs = Math.abs(v);
        return Math.copySign(Math.log(abs + Math.sqrt(abs * abs + 1.0)), v);
    }

    static double atanh(double v) {
        return 0.5 * Math.log((1.0 + v) / (1.0 - v));
    }
}
