/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import java.util.List;
import java.util.Map;
import java.util.function.LongConsumer;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.pipeline.CollectingSink;
import org.lakehouse.query.execution.pipeline.PageSink;
import org.lakehouse.query.execution.pipeline.Pipeline;
import org.lakehouse.query.execution.pipeline.PipelineCompiler;
import org.lakehouse.query.execution.pipeline.PipelineTask;
import org.lakehouse.query.execution.pipeline.SourceOperatorFactory;
import org.lakehouse.query.execution.plan.PlanNode;

/**
 * Runs a plan on the calling thread. The plan is compiled into a pipeline along the probe path of
 * its joins; each join's build input runs first as its own pipeline. Every pipeline runs under the
 * fault-tolerant shell.
 */
@Log4j2
public class SerialExecutor implements BoundedExecutor {

  @Override
  public void execute(ExecutionContext context, PageSink sink) {
    context.getProgressTracker().setPhase("serial");
    run(context, context.getPlan().getRoot(), Map.of(), sink);
  }

  /**
   * Compiles and runs one subtree.
   *
   * @param sourceOverrides sources replacing the subtrees rooted at the given node ids
   */
  static void run(
      ExecutionContext context,
      PlanNode root,
      Map<String, SourceOperatorFactory> sourceOverrides,
      PageSink sink) {
    PipelineCompiler compiler =
        new PipelineCompiler(
            context.getStorage(), (joinNode, buildInput) -> materialize(context, buildInput));
    Pipeline pipeline = compiler.compile(root, sourceOverrides);
    log.debug("Query {} running pipeline {}", context.getQueryId(), pipeline.getPipelineId());
    // rows replayed from memory were already counted when they were read
    LongConsumer rowsListener =
        sourceOverrides.containsKey(pipeline.getPipelineId())
            ? rows -> {}
            : context::recordSourceRows;
    context
        .getShell()
        .execute(new PipelineTask(pipeline, context.operatorContext(), sink, rowsListener));
  }

  /** Runs a subtree and returns all of its rows. */
  static List<List<Object>> materialize(ExecutionContext context, PlanNode root) {
    CollectingSink sink = new CollectingSink();
    run(context, root, Map.of(), sink);
    return sink.getRows();
  }
}
