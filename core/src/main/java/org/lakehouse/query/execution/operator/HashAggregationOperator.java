/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.ArrayDeque;
import java.util.Deque;
import lombok.Getter;
import org.lakehouse.query.execution.aggregation.GroupedAggregator;
import org.lakehouse.query.execution.fault.snapshot.AggregationState;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.PlanNode;

/**
 * Hash aggregation over the input of an AGGREGATE node. In final mode the operator emits one row
 * per group when its input finishes; in partial mode it emits nothing and the caller merges
 * {@link #getAggregator()} with the partials of sibling partitions.
 */
public class HashAggregationOperator implements StatefulOperator {

  private final PlanNode aggregateNode;
  private final OperatorContext context;
  private final boolean emitFinal;
  @Getter private final GroupedAggregator aggregator;
  private final Deque<Page> output = new ArrayDeque<>();

  private boolean inputFinished;

  public HashAggregationOperator(
      PlanNode aggregateNode, OperatorContext context, boolean emitFinal) {
    this.aggregateNode = aggregateNode;
    this.context = context;
    this.emitFinal = emitFinal;
    this.aggregator =
        new GroupedAggregator(
            aggregateNode.getInput().getOutputColumns(),
            aggregateNode.getGroupBy(),
            aggregateNode.getAggregates());
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    for (int position = 0; position < page.getPositionCount(); position++) {
      aggregator.add(page.getRow(position));
    }
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
    if (emitFinal) {
      output.addAll(
          PageBuilder.paginate(
              aggregator.resultRows(),
              aggregateNode.getOutputColumns().size(),
              context.getPageSize()));
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public OperatorState snapshotState() {
    return new AggregationState(aggregator.toState());
  }

  @Override
  public void restoreState(OperatorState state) {
    aggregator.restore(
        OperatorState.require(
                state, AggregationState.class, AggregationState.VERSION, context.getOperatorId())
            .getGroups());
  }
}
