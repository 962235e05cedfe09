/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.promql.lang.prom.stage;

import org.opensearch.promql.core.model.Labels;
import org.opensearch.promql.core.model.MapLabels;
import org.opensearch.promql.core.model.TimeSeries;
import org.opensearch.promql.lang.prom.common.GroupingModifier;
import org.opensearch.promql.query.stage.UnaryPipelineStage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Abstract base class for pipeline stages that support label grouping.
 * Provides common functionality for partitioning time series by their group labels and
 * applying an operation within each group.
 *
 * <p>The group key of a series is:</p>
 * <ul>
 *   <li>{@code by (l1, ...)}: only the listed labels that the series carries</li>
 *   <li>{@code without (l1, ...)}: every label except the listed ones and {@code __name__}</li>
 *   <li>no modifier: empty labels, so all series form one group</li>
 * </ul>
 * Groups are processed in the order their first member appears in the input.
 */
public abstract class AbstractGroupingStage implements UnaryPipelineStage {

    /** The grouping modifier, null when the aggregation has none. */
    protected final GroupingModifier modifier;

    /** Label names of the grouping clause. */
    protected final List<String> groupingLabels;

    /**
     * Constructor for a grouping stage.
     * @param modifier {@code by}, {@code without} or null
     * @param groupingLabels label names of the clause, ignored when {@code modifier} is null
     */
    protected AbstractGroupingStage(GroupingModifier modifier, List<String> groupingLabels) {
        this.modifier = modifier;
        this.groupingLabels = groupingLabels != null ? List.copyOf(groupingLabels) : List.of();
    }

    @Override
    public List<TimeSeries> process(List<TimeSeries> input) {
        if (input.isEmpty()) {
            return new ArrayList<>();
        }

        Map<Labels, List<TimeSeries>> groups = new LinkedHashMap<>();
        for (TimeSeries series : input) {
            groups.computeIfAbsent(groupLabels(series.getLabels()), k -> new ArrayList<>()).add(series);
        }

        List<TimeSeries> result = new ArrayList<>();
        for (Map.Entry<Labels, List<TimeSeries>> entry : groups.entrySet()) {
            result.addAll(processGroup(entry.getValue(), entry.getKey()));
        }
        return result;
    }

    /**
     * Compute the group key of a label set.
     *
     * @param labels labels of a member series
     * @return the labels identifying its group
     */
    protected Labels groupLabels(Labels labels) {
        if (modifier == null) {
            return MapLabels.emptyLabels();
        }
        Map<String, String> kept = new TreeMap<>();
        for (Map.Entry<String, String> label : labels.toMapView().entrySet()) {
            if (modifier.keepsLabel(label.getKey(), groupingLabels)) {
                kept.put(label.getKey(), label.getValue());
            }
        }
        return MapLabels.fromMap(kept);
    }

    /**
     * Process the members of one group.
     *
     * @param groupSeries series sharing the same group key, in input order
     * @param groupLabels the group key
     * @return the output series of this group, possibly empty
     */
    protected abstract List<TimeSeries> processGroup(List<TimeSeries> groupSeries, Labels groupLabels);
}
