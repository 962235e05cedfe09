/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.promql.parser.nodes;

import com.google.re2j.PatternSyntaxException;
import org.opensearch.promql.core.model.LabelConstants;
import org.opensearch.promql.core.model.LabelMatcher;
import org.opensearch.promql.exception.InvalidArgumentException;
import org.opensearch.promql.lang.prom.common.MatcherType;

/**
 * One {@code name op "value"} clause inside selector braces, e.g. {@code method!="POST"}.
 *
 * <p>Matchers are leaves of the tree. They only appear in {@link VectorSelectorNode#getMatchers()}
 * and are never evaluated on their own.</p>
 */
public class LabelMatcherNode extends PromASTNode {
    private final String labelName;
    private final MatcherType matcherType;
    private final String value;

    public LabelMatcherNode(String labelName, MatcherType matcherType, String value) {
        super();
        this.labelName = labelName;
        this.matcherType = matcherType;
        this.value = value != null ? value : LabelConstants.EMPTY_STRING;
    }

    public String getLabelName() {
        return labelName;
    }

    public MatcherType getMatcherType() {
        return matcherType;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return true for {@code __name__="x"} with a non-empty value, the only matcher form that pins a metric name
     */
    public boolean isMetricNameEquality() {
        return LabelConstants.METRIC_NAME.equals(labelName) && matcherType == MatcherType.EQUAL && value.isEmpty() == false;
    }

    /**
     * Compile this clause into a matcher usable against series labels and store rows.
     *
     * @return the compiled matcher
     * @throws InvalidArgumentException if a regex matcher carries an invalid pattern
     */
    public LabelMatcher toLabelMatcher() {
        try {
            return new LabelMatcher(labelName, matcherType, value);
        } catch (PatternSyntaxException e) {
            throw new InvalidArgumentException("invalid regex [{}] for label [{}]", e, value, labelName);
        }
    }

    @Override
    public <T> T accept(PromASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return labelName + matcherType.getOperator() + "\"" + value + "\"";
    }
}
