/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.List;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.FilterCondition;
import org.lakehouse.query.execution.plan.PlanNode;

/** Keeps the rows satisfying every condition of a FILTER node. */
public class FilterOperator implements Operator {

  private final List<FilterCondition> conditions;
  private final int[] conditionIndices;
  private final int channelCount;
  private final OperatorContext context;

  private Page pendingOutput;
  private boolean inputFinished;

  public FilterOperator(PlanNode filterNode, OperatorContext context) {
    this.conditions = filterNode.getConditions();
    List<String> columns = filterNode.getInput().getOutputColumns();
    this.conditionIndices =
        RowKeys.indicesOf(columns, conditions.stream().map(FilterCondition::column).toList());
    this.channelCount = columns.size();
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    PageBuilder builder = new PageBuilder(channelCount, Math.max(1, page.getPositionCount()));
    for (int position = 0; position < page.getPositionCount(); position++) {
      if (matches(page, position)) {
        builder.appendRow(page.getRow(position));
      }
    }
    if (!builder.isEmpty()) {
      pendingOutput = builder.build();
    }
  }

  private boolean matches(Page page, int position) {
    for (int i = 0; i < conditionIndices.length; i++) {
      if (!conditions.get(i).test(page.getValue(position, conditionIndices[i]))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return inputFinished && pendingOutput == null;
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }
}
