/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.lakehouse.query.execution.operator.FilterOperator;
import org.lakehouse.query.execution.operator.HashAggregationOperator;
import org.lakehouse.query.execution.operator.HashJoinOperator;
import org.lakehouse.query.execution.operator.LimitOperator;
import org.lakehouse.query.execution.operator.ProjectOperator;
import org.lakehouse.query.execution.operator.ScanOperator;
import org.lakehouse.query.execution.operator.SortOperator;
import org.lakehouse.query.execution.plan.JoinType;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.ScanRange;
import org.lakehouse.query.execution.storage.StorageEngine;

/**
 * Compiles a bounded plan subtree into a single {@link Pipeline}. The pipeline follows the probe
 * side of every join down to one source leaf; the build side of each join is materialized through
 * a {@link JoinBuildProvider} before the pipeline runs.
 */
public class PipelineCompiler {

  /** Materializes the build input of a hash join. */
  @FunctionalInterface
  public interface JoinBuildProvider {

    List<List<Object>> buildRows(PlanNode joinNode, PlanNode buildInput);
  }

  private final StorageEngine storage;
  private final JoinBuildProvider buildProvider;

  public PipelineCompiler(StorageEngine storage, JoinBuildProvider buildProvider) {
    this.storage = storage;
    this.buildProvider = buildProvider;
  }

  /** Compiles a subtree whose source is the scan leaf on its probe path. */
  public Pipeline compile(PlanNode root) {
    return compile(root, Map.of());
  }

  /**
   * Compiles a subtree.
   *
   * @param sourceOverrides sources replacing the subtrees rooted at the given node ids, such as
   *     already materialized intermediate results or a single partition of a scan
   */
  public Pipeline compile(PlanNode root, Map<String, SourceOperatorFactory> sourceOverrides) {
    List<OperatorFactory> factories = new ArrayList<>();
    PlanNode current = root;
    while (!sourceOverrides.containsKey(current.getId()) && !current.getType().isLeaf()) {
      factories.add(operatorFactory(current));
      current = probeInput(current);
    }
    Collections.reverse(factories);
    SourceOperatorFactory source = sourceOverrides.get(current.getId());
    if (source == null) {
      source = scanFactory(storage, current, null);
    }
    return new Pipeline(current.getId(), source, factories, root.getOutputColumns().size());
  }

  /** Returns true if an INNER join builds its hash table on the smaller left input. */
  public static boolean buildsOnLeft(PlanNode joinNode) {
    return joinNode.getJoinType() == JoinType.INNER
        && joinNode.getLeft().getEstimatedRows() < joinNode.getRight().getEstimatedRows();
  }

  /** Returns the input a pipeline streams through a node. */
  public static PlanNode probeInput(PlanNode node) {
    if (node.getType().isStreaming()) {
      throw new IllegalArgumentException(
          "Node " + node + " is unbounded and can only run in a streaming engine");
    }
    return switch (node.getType()) {
      case HASH_JOIN -> buildsOnLeft(node) ? node.getRight() : node.getLeft();
      default -> node.getInput();
    };
  }

  /**
   * Returns a factory scanning a leaf.
   *
   * @param range rows to scan, or null for the whole leaf
   */
  public static SourceOperatorFactory scanFactory(
      StorageEngine storage, PlanNode leaf, ScanRange range) {
    if (!leaf.getType().isScan()) {
      throw new IllegalArgumentException("Node " + leaf + " is not a bounded scan");
    }
    return (context, startPosition) ->
        new ScanOperator(
            storage,
            leaf,
            range != null ? range : ScanRange.all(storage.rowCount(leaf)),
            startPosition,
            context.forOperator(leaf.getId()));
  }

  private OperatorFactory operatorFactory(PlanNode node) {
    String id = node.getId();
    switch (node.getType()) {
      case FILTER:
        return context -> new FilterOperator(node, context.forOperator(id));
      case PROJECT:
        return context -> new ProjectOperator(node, context.forOperator(id));
      case LIMIT:
        return context -> new LimitOperator(node.getLimit(), context.forOperator(id));
      case SORT:
        return context -> new SortOperator(node, context.forOperator(id));
      case AGGREGATE:
        return context -> new HashAggregationOperator(node, context.forOperator(id), true);
      case HASH_JOIN:
        boolean buildIsLeft = buildsOnLeft(node);
        List<List<Object>> buildRows =
            buildProvider.buildRows(node, buildIsLeft ? node.getLeft() : node.getRight());
        return context ->
            new HashJoinOperator(node, buildRows, buildIsLeft, context.forOperator(id));
      default:
        throw new IllegalArgumentException("Unsupported node in a pipeline: " + node);
    }
  }
}
