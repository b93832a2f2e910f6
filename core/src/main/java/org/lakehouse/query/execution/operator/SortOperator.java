/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.fault.snapshot.SortState;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.PlanNode;

/** Buffers all input and emits it sorted by the SORT node's keys once input is finished. */
public class SortOperator implements StatefulOperator {

  private final Comparator<List<Object>> comparator;
  private final int channelCount;
  private final OperatorContext context;
  private final List<List<Object>> buffered = new ArrayList<>();
  private final Deque<Page> output = new ArrayDeque<>();

  private boolean inputFinished;

  public SortOperator(PlanNode sortNode, OperatorContext context) {
    this.comparator = RowComparators.of(sortNode.getOutputColumns(), sortNode.getSortKeys());
    this.channelCount = sortNode.getOutputColumns().size();
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    buffered.addAll(page.toRows());
  }

  @Override
  public Page getOutput() {
    return output.poll();
  }

  @Override
  public boolean isFinished() {
    return inputFinished && output.isEmpty();
  }

  @Override
  public void finish() {
    if (inputFinished) {
      return;
    }
    inputFinished = true;
    buffered.sort(comparator);
    output.addAll(PageBuilder.paginate(buffered, channelCount, context.getPageSize()));
    buffered.clear();
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public OperatorState snapshotState() {
    return new SortState(new ArrayList<>(buffered));
  }

  @Override
  public void restoreState(OperatorState state) {
    SortState sortState =
        OperatorState.require(state, SortState.class, SortState.VERSION, context.getOperatorId());
    buffered.clear();
    buffered.addAll(sortState.getRows());
  }
}
