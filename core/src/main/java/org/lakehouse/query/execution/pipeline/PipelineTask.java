/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongConsumer;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.fault.Checkpointer;
import org.lakehouse.query.execution.fault.ResumableTask;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;
import org.lakehouse.query.execution.operator.Operator;
import org.lakehouse.query.execution.operator.OperatorContext;
import org.lakehouse.query.execution.operator.SourceOperator;
import org.lakehouse.query.execution.operator.StatefulOperator;
import org.lakehouse.query.execution.page.Page;

/**
 * Runs a {@link Pipeline} as a resumable task.
 *
 * <p>Output is staged and only handed to the downstream sink once a checkpoint covering it has
 * been persisted, or when the pipeline completes. A restart from a checkpoint therefore never
 * re-delivers rows. A restart from the beginning (no checkpoint yet, or an unreadable one)
 * re-executes deterministically and drops the rows that were already delivered.
 *
 * <p>Source rows are reported to the progress listener once, the first time they are read.
 */
@Log4j2
public class PipelineTask implements ResumableTask {

  private final Pipeline pipeline;
  private final OperatorContext context;
  private final PageSink downstream;
  private final LongConsumer sourceRowsListener;

  /** Output rows delivered downstream across all attempts. */
  private long committedRows;

  /** Highest source position reported to the progress listener. */
  private long reportedPosition;

  public PipelineTask(
      Pipeline pipeline,
      OperatorContext context,
      PageSink downstream,
      LongConsumer sourceRowsListener) {
    this.pipeline = pipeline;
    this.context = context.forOperator(pipeline.getPipelineId());
    this.downstream = downstream;
    this.sourceRowsListener = sourceRowsListener;
  }

  @Override
  public String getTaskId() {
    return pipeline.getPipelineId();
  }

  @Override
  public void run(PipelineSnapshot restoreFrom, Checkpointer checkpointer) {
    long startPosition = restoreFrom == null ? 0 : restoreFrom.getPosition();
    long baseOutput = restoreFrom == null ? 0 : restoreFrom.getOutputRows();
    SourceOperator source = pipeline.getSourceFactory().createOperator(context, startPosition);
    List<Operator> operators = new ArrayList<>();
    for (OperatorFactory factory : pipeline.getOperatorFactories()) {
      operators.add(factory.createOperator(context));
    }
    if (restoreFrom != null) {
      restore(operators, restoreFrom);
    }
    log.debug(
        "Running pipeline {} of query {} from position {}",
        getTaskId(),
        context.getQueryId(),
        startPosition);

    StagingSink staging = new StagingSink(baseOutput, committedRows - baseOutput);
    PipelineDriver driver = new PipelineDriver(source, operators, staging);
    driver.run(
        rows -> {
          reportProgress(source.getPosition());
          boolean persisted =
              checkpointer.onRowsProcessed(
                  rows,
                  () ->
                      new PipelineSnapshot(
                          source.getPosition(), staging.producedRows(), snapshot(operators)));
          if (persisted) {
            staging.commit();
          }
        });
    staging.commit();
  }

  private void restore(List<Operator> operators, PipelineSnapshot snapshot) {
    for (Operator operator : operators) {
      if (operator instanceof StatefulOperator) {
        OperatorState state = snapshot.getOperators().get(operator.getContext().getOperatorId());
        if (state != null) {
          ((StatefulOperator) operator).restoreState(state);
        }
      }
    }
  }

  private static Map<String, OperatorState> snapshot(List<Operator> operators) {
    Map<String, OperatorState> states = new LinkedHashMap<>();
    for (Operator operator : operators) {
      if (operator instanceof StatefulOperator) {
        states.put(
            operator.getContext().getOperatorId(),
            ((StatefulOperator) operator).snapshotState());
      }
    }
    return states;
  }

  private void reportProgress(long position) {
    if (position > reportedPosition) {
      sourceRowsListener.accept(position - reportedPosition);
      reportedPosition = position;
    }
  }

  /** Holds output until it is covered by a checkpoint. */
  private final class StagingSink implements PageSink {

    private final long baseOutput;
    private final List<Page> staged = new ArrayList<>();
    private long toSkip;
    private long produced;

    StagingSink(long baseOutput, long toSkip) {
      this.baseOutput = baseOutput;
      this.toSkip = Math.max(0, toSkip);
    }

    @Override
    public void accept(Page page) {
      int rows = page.getPositionCount();
      produced += rows;
      if (toSkip >= rows) {
        toSkip -= rows;
        return;
      }
      if (toSkip > 0) {
        page = page.getRegion((int) toSkip, rows - (int) toSkip);
        toSkip = 0;
      }
      staged.add(page);
    }

    /** Rows produced up to now counted from the start of the pipeline's output. */
    long producedRows() {
      return baseOutput + produced;
    }

    void commit() {
      for (Page page : staged) {
        downstream.accept(page);
      }
      staged.clear();
      committedRows = Math.max(committedRows, producedRows());
    }
  }
}
