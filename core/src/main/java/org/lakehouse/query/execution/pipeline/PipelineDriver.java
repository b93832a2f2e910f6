/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongConsumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lakehouse.query.execution.operator.Operator;
import org.lakehouse.query.execution.operator.SourceOperator;
import org.lakehouse.query.execution.page.Page;

/**
 * Executes a pipeline by driving data through a chain of operators. Each step pulls one page from
 * the source and pushes it through every operator down to the sink, draining each operator's
 * output before the next page is read. Between steps no operator holds an unprocessed page, which
 * is what makes a snapshot taken there consistent.
 *
 * <p>Execution model:
 *
 * <ol>
 *   <li>Source operator produces a page
 *   <li>Each intermediate operator transforms it, possibly buffering
 *   <li>The sink receives whatever reaches the end of the chain
 *   <li>When the source is exhausted, or an operator such as a limit needs no more input, {@link
 *       Operator#finish()} cascades down the chain and buffered output is flushed
 * </ol>
 */
public class PipelineDriver {

  private static final Logger log = LogManager.getLogger(PipelineDriver.class);

  private final SourceOperator sourceOperator;
  private final List<Operator> operators;
  private final PageSink sink;

  private boolean finished;

  /**
   * Creates a PipelineDriver from pre-built operators.
   *
   * @param sourceOperator the source operator
   * @param operators the intermediate operators
   * @param sink receiver of the last operator's output
   */
  public PipelineDriver(SourceOperator sourceOperator, List<Operator> operators, PageSink sink) {
    this.sourceOperator = sourceOperator;
    this.operators = new ArrayList<>(operators);
    this.sink = sink;
  }

  /**
   * Runs the pipeline to completion or cancellation.
   *
   * @param afterPage called between steps with the number of source rows the step consumed
   */
  public void run(LongConsumer afterPage) {
    try {
      while (!finished) {
        sourceOperator.getContext().checkCancelled();
        long rows = processOnce();
        afterPage.accept(rows);
      }
    } finally {
      closeAll();
    }
  }

  /**
   * Processes one step of the pipeline. Returns the number of source rows consumed by the step.
   */
  long processOnce() {
    int satisfied = firstSatisfiedOperator();
    if (satisfied >= 0) {
      finishFrom(satisfied);
      return 0;
    }
    if (sourceOperator.isFinished()) {
      finishFrom(0);
      return 0;
    }
    long before = sourceOperator.getPosition();
    Page page = sourceOperator.getOutput();
    if (page != null && page.getPositionCount() > 0) {
      push(0, page);
    }
    return sourceOperator.getPosition() - before;
  }

  /** Returns true once every operator has finished and all output reached the sink. */
  public boolean isFinished() {
    return finished;
  }

  private void push(int index, Page page) {
    if (index == operators.size()) {
      sink.accept(page);
      return;
    }
    Operator operator = operators.get(index);
    if (!operator.needsInput()) {
      // a satisfied limit drops the rest of its input
      return;
    }
    operator.addInput(page);
    drain(index);
  }

  private void drain(int index) {
    Operator operator = operators.get(index);
    Page output;
    while ((output = operator.getOutput()) != null) {
      if (output.getPositionCount() > 0) {
        push(index + 1, output);
      }
    }
  }

  /** Returns the first operator that finished before its input did, or -1. */
  private int firstSatisfiedOperator() {
    for (int i = 0; i < operators.size(); i++) {
      if (operators.get(i).isFinished()) {
        return i;
      }
    }
    return -1;
  }

  private void finishFrom(int start) {
    if (start > 0) {
      log.debug(
          "Operator {} needs no more input, stopping source early",
          operators.get(start).getContext().getOperatorId());
    }
    for (int i = start; i < operators.size(); i++) {
      operators.get(i).finish();
      drain(i);
    }
    finished = true;
  }

  /** Closes all operators, releasing resources. */
  private void closeAll() {
    try {
      sourceOperator.close();
    } catch (Exception e) {
      log.warn("Error closing source operator", e);
    }
    for (Operator op : operators) {
      try {
        op.close();
      } catch (Exception e) {
        log.warn("Error closing operator", e);
      }
    }
  }
}
