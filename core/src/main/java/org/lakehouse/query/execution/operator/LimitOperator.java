/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import org.lakehouse.query.execution.fault.snapshot.LimitState;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.page.Page;

/**
 * Operator that limits the number of rows passing through the pipeline. Truncates pages when the
 * accumulated row count reaches the configured limit. Reports finished as soon as the limit is
 * reached so the driver can stop reading its source.
 */
public class LimitOperator implements StatefulOperator {

  private final long limit;
  private final OperatorContext context;

  private long accumulatedRows;
  private Page pendingOutput;
  private boolean inputFinished;

  public LimitOperator(long limit, OperatorContext context) {
    this.limit = limit;
    this.context = context;
  }

  @Override
  public boolean needsInput() {
    return pendingOutput == null && accumulatedRows < limit && !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    if (page == null || accumulatedRows >= limit) {
      return;
    }
    long remaining = limit - accumulatedRows;
    int pageRows = page.getPositionCount();
    if (pageRows <= remaining) {
      accumulatedRows += pageRows;
      pendingOutput = page;
    } else {
      pendingOutput = page.getRegion(0, (int) remaining);
      accumulatedRows += remaining;
    }
  }

  @Override
  public Page getOutput() {
    Page output = pendingOutput;
    pendingOutput = null;
    return output;
  }

  @Override
  public boolean isFinished() {
    return pendingOutput == null && (accumulatedRows >= limit || inputFinished);
  }

  @Override
  public void finish() {
    inputFinished = true;
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public OperatorState snapshotState() {
    return new LimitState(accumulatedRows);
  }

  @Override
  public void restoreState(OperatorState state) {
    accumulatedRows =
        OperatorState.require(state, LimitState.class, LimitState.VERSION, context.getOperatorId())
            .getEmittedRows();
  }
}
