/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.lakehouse.query.execution.fault.snapshot.GroupState;
import org.lakehouse.query.execution.operator.RowKeys;
import org.lakehouse.query.execution.plan.AggregateCall;

/**
 * Hash table from group key to one accumulator per aggregate call. Partial aggregators built over
 * disjoint subsets of the input are combined with {@link #merge}.
 *
 * <p>A global aggregation (no grouping columns) always yields exactly one row, even over empty
 * input.
 */
public class GroupedAggregator {

  private final int[] groupIndices;
  private final int[] argumentIndices;
  private final List<AggregateCall> calls;
  private final Map<List<Object>, Accumulator[]> groups = new LinkedHashMap<>();

  /**
   * @param inputColumns columns of the rows fed to {@link #add}
   * @param groupBy grouping columns
   * @param calls aggregate calls; COUNT(*) has no argument column
   */
  public GroupedAggregator(
      List<String> inputColumns, List<String> groupBy, List<AggregateCall> calls) {
    this.groupIndices = RowKeys.indicesOf(inputColumns, groupBy);
    this.calls = List.copyOf(calls);
    this.argumentIndices = new int[calls.size()];
    for (int i = 0; i < calls.size(); i++) {
      String column = calls.get(i).column();
      argumentIndices[i] = column == null ? -1 : inputColumns.indexOf(column);
      if (column != null && argumentIndices[i] < 0) {
        throw new IllegalArgumentException("Unknown column " + column + " in " + inputColumns);
      }
    }
  }

  public void add(List<Object> row) {
    Accumulator[] accumulators =
        groups.computeIfAbsent(RowKeys.groupKey(row, groupIndices), k -> newAccumulators());
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i].add(argumentIndices[i] < 0 ? null : row.get(argumentIndices[i]));
    }
  }

  /** Folds another aggregator over the same calls into this one. */
  public void merge(GroupedAggregator other) {
    for (Map.Entry<List<Object>, Accumulator[]> entry : other.groups.entrySet()) {
      Accumulator[] target = groups.computeIfAbsent(entry.getKey(), k -> newAccumulators());
      for (int i = 0; i < target.length; i++) {
        target[i].merge(entry.getValue()[i]);
      }
    }
  }

  public int groupCount() {
    return groups.size();
  }

  /** Returns one row per group: the key values followed by the aggregate results. */
  public List<List<Object>> resultRows() {
    if (groups.isEmpty() && groupIndices.length == 0) {
      groups.put(List.of(), newAccumulators());
    }
    List<List<Object>> rows = new ArrayList<>(groups.size());
    for (Map.Entry<List<Object>, Accumulator[]> entry : groups.entrySet()) {
      List<Object> row = new ArrayList<>(entry.getKey());
      for (Accumulator accumulator : entry.getValue()) {
        row.add(accumulator.result());
      }
      rows.add(row);
    }
    return rows;
  }

  public List<GroupState> toState() {
    List<GroupState> states = new ArrayList<>(groups.size());
    for (Map.Entry<List<Object>, Accumulator[]> entry : groups.entrySet()) {
      List<List<Object>> accumulatorStates = new ArrayList<>();
      for (Accumulator accumulator : entry.getValue()) {
        accumulatorStates.add(accumulator.state());
      }
      states.add(new GroupState(new ArrayList<>(entry.getKey()), accumulatorStates));
    }
    return states;
  }

  /** Replaces all groups with checkpointed ones. */
  public void restore(List<GroupState> states) {
    groups.clear();
    for (GroupState state : states) {
      Accumulator[] accumulators = newAccumulators();
      for (int i = 0; i < accumulators.length; i++) {
        accumulators[i].restore(state.getAccumulators().get(i));
      }
      groups.put(RowKeys.normalizeAll(state.getKey()), accumulators);
    }
  }

  private Accumulator[] newAccumulators() {
    Accumulator[] accumulators = new Accumulator[calls.size()];
    for (int i = 0; i < accumulators.length; i++) {
      accumulators[i] = Accumulators.create(calls.get(i));
    }
    return accumulators;
  }
}
