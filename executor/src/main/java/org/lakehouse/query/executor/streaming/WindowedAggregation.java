/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import org.lakehouse.query.execution.aggregation.GroupedAggregator;
import org.lakehouse.query.execution.fault.snapshot.WindowAggregationState;
import org.lakehouse.query.execution.fault.snapshot.WindowAggregationState.WindowState;
import org.lakehouse.query.execution.plan.PlanNode;

/**
 * Event-time hopping windows over a stream. Window starts are multiples of the slide; an event
 * belongs to every window {@code [start, start + size)} containing its timestamp. Each open window
 * keeps one aggregate per group key. A window is emitted once, when the current time reaches its
 * end. Events whose windows were all emitted already are late and dropped.
 *
 * <p>Not thread-safe; owned by the streaming event loop.
 */
public class WindowedAggregation {

  private final PlanNode node;
  private final long sizeMillis;
  private final long slideMillis;
  private final TreeMap<Long, GroupedAggregator> windows = new TreeMap<>();

  /** Windows ending at or before this time were emitted. */
  @Getter private long closedUpToMillis = Long.MIN_VALUE;

  @Getter private long lateEvents;

  public WindowedAggregation(PlanNode windowAggregateNode) {
    this.node = windowAggregateNode;
    this.sizeMillis = windowAggregateNode.getWindowSizeMillis();
    this.slideMillis = windowAggregateNode.getWindowSlideMillis();
  }

  /**
   * Adds an input row observed at {@code timestampMillis} to its open windows.
   *
   * @return false if the row was late and dropped
   */
  public boolean add(long timestampMillis, List<Object> row) {
    long lastStart = Math.floorDiv(timestampMillis, slideMillis) * slideMillis;
    if (lastStart + sizeMillis <= closedUpToMillis) {
      lateEvents++;
      return false;
    }
    for (long start = lastStart; start > timestampMillis - sizeMillis; start -= slideMillis) {
      if (start + sizeMillis > closedUpToMillis) {
        windows.computeIfAbsent(start, k -> newAggregator()).add(row);
      }
    }
    return true;
  }

  /** Emits every open window ending at or before {@code nowMillis}, oldest first. */
  public List<List<Object>> closeUpTo(long nowMillis) {
    List<List<Object>> output = new ArrayList<>();
    Iterator<Map.Entry<Long, GroupedAggregator>> open = windows.entrySet().iterator();
    while (open.hasNext()) {
      Map.Entry<Long, GroupedAggregator> window = open.next();
      if (window.getKey() + sizeMillis > nowMillis) {
        break;
      }
      emit(window.getKey(), window.getValue(), output);
      open.remove();
    }
    closedUpToMillis = Math.max(closedUpToMillis, nowMillis);
    return output;
  }

  /** Emits all open windows, complete or not. Used when the stream stops. */
  public List<List<Object>> flush() {
    List<List<Object>> output = new ArrayList<>();
    windows.forEach((start, aggregator) -> emit(start, aggregator, output));
    if (!windows.isEmpty()) {
      closedUpToMillis = Math.max(closedUpToMillis, windows.lastKey() + sizeMillis);
    }
    windows.clear();
    return output;
  }

  public int openWindowCount() {
    return windows.size();
  }

  public WindowAggregationState snapshot() {
    List<WindowState> states = new ArrayList<>(windows.size());
    windows.forEach(
        (start, aggregator) -> states.add(new WindowState(start, aggregator.toState())));
    return new WindowAggregationState(closedUpToMillis, states);
  }

  public void restore(WindowAggregationState state) {
    windows.clear();
    closedUpToMillis = state.getClosedUpToMillis();
    for (WindowState window : state.getWindows()) {
      GroupedAggregator aggregator = newAggregator();
      aggregator.restore(window.getGroups());
      windows.put(window.getStartMillis(), aggregator);
    }
  }

  private GroupedAggregator newAggregator() {
    return new GroupedAggregator(
        node.getInput().getOutputColumns(), node.getGroupBy(), node.getAggregates());
  }

  private void emit(long start, GroupedAggregator aggregator, List<List<Object>> output) {
    for (List<Object> row : aggregator.resultRows()) {
      List<Object> windowRow = new ArrayList<>(row.size() + 2);
      windowRow.add(start);
      windowRow.add(start + sizeMillis);
      windowRow.addAll(row);
      output.add(windowRow);
    }
  }
}
