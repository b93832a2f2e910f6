/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.operator.HashAggregationOperator;
import org.lakehouse.query.execution.operator.HashJoinOperator;
import org.lakehouse.query.execution.operator.RowsSourceOperator;
import org.lakehouse.query.execution.operator.SortOperator;
import org.lakehouse.query.execution.pipeline.CollectingSink;
import org.lakehouse.query.execution.pipeline.OperatorFactory;
import org.lakehouse.query.execution.pipeline.PageSink;
import org.lakehouse.query.execution.pipeline.Pipeline;
import org.lakehouse.query.execution.pipeline.PipelineCompiler;
import org.lakehouse.query.execution.pipeline.PipelineTask;
import org.lakehouse.query.execution.pipeline.SourceOperatorFactory;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.PlanNodeType;

/**
 * Starts a plan serially and re-decides at every join, aggregation and sort. Those are the safe
 * boundaries: their inputs are fully materialized, so the observed row count is exact. When it
 * exceeds the parallel row threshold and the query holds worker pools, the node runs on the
 * parallel engine instead.
 */
@Log4j2
public class AdaptiveExecutor implements BoundedExecutor {

  /** Relative error between observed and estimated rows worth reporting. */
  private static final double MISESTIMATE_RATIO = 0.5;

  private final ParallelExecutionEngine parallel;

  public AdaptiveExecutor(ParallelExecutionEngine parallel) {
    this.parallel = parallel;
  }

  @Override
  public void execute(ExecutionContext context, PageSink sink) {
    context.getProgressTracker().setPhase("adaptive");
    stream(context, context.getPlan().getRoot(), sink);
  }

  private void stream(ExecutionContext context, PlanNode node, PageSink sink) {
    PlanNode boundary = node;
    while (boundary.getType() == PlanNodeType.FILTER
        || boundary.getType() == PlanNodeType.PROJECT
        || boundary.getType() == PlanNodeType.LIMIT) {
      boundary = boundary.getInput();
    }
    if (boundary.getType().isLeaf()) {
      SerialExecutor.run(context, node, Map.of(), sink);
      return;
    }
    List<List<Object>> rows = evaluate(context, boundary);
    SerialExecutor.run(context, node, Map.of(boundary.getId(), rowsSource(boundary, rows)), sink);
  }

  private List<List<Object>> evaluate(ExecutionContext context, PlanNode node) {
    switch (node.getType()) {
      case HASH_JOIN:
        {
          List<List<Object>> left = materialize(context, node.getLeft());
          List<List<Object>> right = materialize(context, node.getRight());
          if (goParallel(context, node, left.size() + right.size())) {
            return parallel.joinRows(context, node, left, right);
          }
          boolean buildIsLeft = PipelineCompiler.buildsOnLeft(node);
          List<List<Object>> build = buildIsLeft ? left : right;
          return runSerial(
              context,
              buildIsLeft ? node.getRight() : node.getLeft(),
              buildIsLeft ? right : left,
              node,
              operatorContext ->
                  new HashJoinOperator(
                      node, build, buildIsLeft, operatorContext.forOperator(node.getId())));
        }
      case AGGREGATE:
        {
          List<List<Object>> input = materialize(context, node.getInput());
          if (goParallel(context, node, input.size())) {
            return parallel.aggregateRows(context, node, input);
          }
          return runSerial(
              context,
              node.getInput(),
              input,
              node,
              operatorContext ->
                  new HashAggregationOperator(
                      node, operatorContext.forOperator(node.getId()), true));
        }
      case SORT:
        {
          List<List<Object>> input = materialize(context, node.getInput());
          if (goParallel(context, node, input.size())) {
            return parallel.sortRows(context, node, input);
          }
          return runSerial(
              context,
              node.getInput(),
              input,
              node,
              operatorContext -> new SortOperator(node, operatorContext.forOperator(node.getId())));
        }
      default:
        throw new IllegalArgumentException("Not an adaptive boundary: " + node);
    }
  }

  private List<List<Object>> materialize(ExecutionContext context, PlanNode node) {
    CollectingSink sink = new CollectingSink();
    stream(context, node, sink);
    return sink.getRows();
  }

  private boolean goParallel(ExecutionContext context, PlanNode node, long observedRows) {
    long estimated = node.estimatedInputRows();
    if (estimated > 0
        && Math.abs(observedRows - estimated) > MISESTIMATE_RATIO * estimated) {
      log.info(
          "Query {} node {} observed {} input rows against an estimate of {}",
          context.getQueryId(),
          node.getId(),
          observedRows,
          estimated);
    }
    boolean parallelize =
        observedRows > context.getSettings().getParallelRowThreshold()
            && context.getPlan().getParallelism() > 1
            && context.getWorkerPools().isPresent();
    if (parallelize) {
      context.getStatistics().recordStrategySwitch();
      log.info(
          "Query {} switching node {} to parallel execution with {} partitions after {} rows",
          context.getQueryId(),
          node.getId(),
          context.getPlan().getParallelism(),
          observedRows);
    }
    return parallelize;
  }

  /** Runs one operator over materialized input rows on the calling thread. */
  private static List<List<Object>> runSerial(
      ExecutionContext context,
      PlanNode input,
      List<List<Object>> rows,
      PlanNode node,
      OperatorFactory operator) {
    CollectingSink sink = new CollectingSink();
    Pipeline pipeline =
        new Pipeline(
            node.getId() + "#serial",
            rowsSource(input, rows),
            List.of(operator),
            node.getOutputColumns().size());
    context
        .getShell()
        .execute(new PipelineTask(pipeline, context.operatorContext(), sink, count -> {}));
    return sink.getRows();
  }

  private static SourceOperatorFactory rowsSource(PlanNode node, List<List<Object>> rows) {
    int channels = node.getOutputColumns().size();
    return (operatorContext, startPosition) ->
        new RowsSourceOperator(
            rows, channels, startPosition, operatorContext.forOperator(node.getId()));
  }
}
