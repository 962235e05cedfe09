/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.LabelConstants;
import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.BinaryModifier;
import org.opensearch.promql.lang.prom.common.BinaryOperatorType;
import org.opensearch.promql.query.stage.BinaryPipelineStage;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for binary stages that pair series of the two operands by label signature.
 */
public abstract class AbstractVectorMatchingStage implements BinaryPipelineStage {

    /** The operator. */
    protected final BinaryOperatorType operator;

    /** Matching options of the operation. */
    protected final BinaryModifier modifier;

    /**
     * Constructor for a vector matching stage.
     * @param operator the operator
     * @param modifier matching options, null for none
     */
    protected AbstractVectorMatchingStage(BinaryOperatorType operator, BinaryModifier modifier) {
        this.operator = operator;
        this.modifier = modifier != null ? modifier : BinaryModifier.none();
    }

    @Override
    public String getName() {
        return operator.getOperator();
    }

    /**
     * Compute the match signature of a label set.
     *
     * <p>With {@code on(...)} the signature holds the listed labels the series carries. Otherwise it
     * holds every label except {@code __name__} and, for {@code ignoring(...)}, the listed labels.</p>
     *
     * @param labels labels of an operand series
     * @return the labels two series must share to be paired
     */
    protected Labels signature(Labels labels) {
        if (modifier.isOn()) {
            return labels.keepOnly(modifier.getMatchingLabels());
        }
        List<String> dropped = new ArrayList<>(modifier.getMatchingLabels());
        dropped.add(LabelConstants.METRIC_NAME);
        return labels.without(dropped);
    }

    /**
     * Whether an operand is a scalar: exactly one series and no labels.
     *
     * @param operand the evaluated operand
     * @return true if the operand acts as a scalar
     */
    protected static boolean isScalar(List<TimeSeries> operand) {
        return operand.size() == 1 && operand.get(0).isScalar();
    }
}
