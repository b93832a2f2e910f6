/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.ArrayList;
import java.util.List;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.PlanNode;

/** Reorders and narrows columns to the projection of a PROJECT node. */
public class ProjectOperator implements Operator {

  private final int[] projection;
  private final OperatorContext context;

  private Page pendingOutput;
  private boolean inputFinished;

  public ProjectOperator(PlanNode projectNode, OperatorContext context) {
    this.projection =
        RowKeys.indicesOf(projectNode.getInput().getOutputColumns(), projectNode.getProjections());
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    PageBuilder builder = new PageBuilder(projection.length, Math.max(1, page.getPositionCount()));
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<Object> row = new ArrayList<>(projection.length);
      for (int channel : projection) {
        row.add(page.getValue(position, channel));
      }
      builder.appendRow(row);
    }
    pendingOutput = builder.build();
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
