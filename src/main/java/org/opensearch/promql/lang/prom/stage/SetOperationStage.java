/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code and}, {@code or} and {@code unless}. Whole series are kept or dropped by signature;
 * samples are never combined.
 */
public class SetOperationStage extends AbstractVectorMatchingStage {

    /**
     * Constructor for SetOperationStage.
     * @param operator a set operator
     * @param modifier matching options, null for none
     */
    public SetOperationStage(BinaryOperatorType operator, BinaryModifier modifier) {
        super(operator, modifier);
        if (operator.isSetOperator() == false) {
            throw new IllegalArgumentException("Not a set operator: " + operator);
        }
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> left, List<TimeSeries> right) {
        Set<Labels> rightSignatures = signatures(right);
        List<TimeSeries> result = new ArrayList<>();
        switch (operator) {
            case AND:
                for (TimeSeries series : left) {
                    if (rightSignatures.contains(signature(series.getLabels()))) {
                        result.add(series);
                    }
                }
                break;
            case UNLESS:
                for (TimeSeries series : left) {
                    if (rightSignatures.contains(signature(series.getLabels())) == false) {
                        result.add(series);
                    }
                }
                break;
            case OR:
                Set<Labels> leftSignatures = signatures(left);
                result.addAll(left);
                for (TimeSeries series : right) {
                    if (leftSignatures.contains(signature(series.getLabels())) == false) {
                        result.add(series);
                    }
                }
                break;
            default:
                throw new IllegalStateException("Unexpected operator: " + operator);
        }
        return result;
    }

    private Set<Labels> signatures(List<TimeSeries> series) {
        Set<Labels> signatures = new HashSet<>();
        for (TimeSeries s : series) {
            signatures.add(signature(s.getLabels()));
        }
        return signatures;
    }
}
