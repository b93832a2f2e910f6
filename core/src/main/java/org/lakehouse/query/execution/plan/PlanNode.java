/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable node of an optimized, index-annotated query plan. Plans are produced by the optimizer
 * and are read-only to the execution core.
 *
 * <p>Nodes are created through the static factories, which derive the output columns from the
 * children. Attributes that do not apply to a node type are left empty.
 */
@Getter
@EqualsAndHashCode
@Builder(access = AccessLevel.PRIVATE)
public final class PlanNode {

  public static final String WINDOW_START = "window_start";
  public static final String WINDOW_END = "window_end";

  private final String id;
  private final PlanNodeType type;
  private final List<PlanNode> children;
  private final List<String> outputColumns;

  /** Optimizer cardinality estimate of this node's output. */
  private final long estimatedRows;

  /** Index chosen by the optimizer, null when the leaf is a plain table scan. */
  private final IndexAccessPath accessPath;

  /** Source table for scan leaves. */
  private final String table;

  /** Stream identifier for STREAM_SOURCE leaves. */
  private final String streamId;

  private final List<FilterCondition> conditions;
  private final List<String> projections;
  private final JoinType joinType;
  private final List<String> leftKeys;
  private final List<String> rightKeys;
  private final List<String> groupBy;
  private final List<AggregateCall> aggregates;
  private final List<SortKey> sortKeys;
  private final long limit;
  private final long windowSizeMillis;
  private final long windowSlideMillis;

  public static PlanNode tableScan(
      String id, String table, List<String> columns, long estimatedRows) {
    return leaf(id, PlanNodeType.TABLE_SCAN, table, null, columns, estimatedRows);
  }

  public static PlanNode indexScan(
      String id,
      String table,
      List<String> columns,
      long estimatedRows,
      IndexAccessPath accessPath) {
    Preconditions.checkNotNull(accessPath, "index scan requires an access path");
    return leaf(id, PlanNodeType.INDEX_SCAN, table, accessPath, columns, estimatedRows);
  }

  public static PlanNode filter(String id, PlanNode child, List<FilterCondition> conditions) {
    for (FilterCondition condition : conditions) {
      requireColumn(child, condition.column());
    }
    return base(id, PlanNodeType.FILTER, List.of(child), child.getOutputColumns())
        .estimatedRows(child.getEstimatedRows())
        .conditions(ImmutableList.copyOf(conditions))
        .build();
  }

  public static PlanNode project(String id, PlanNode child, List<String> columns) {
    for (String column : columns) {
      requireColumn(child, column);
    }
    return base(id, PlanNodeType.PROJECT, List.of(child), columns)
        .estimatedRows(child.getEstimatedRows())
        .projections(ImmutableList.copyOf(columns))
        .build();
  }

  public static PlanNode hashJoin(
      String id,
      PlanNode left,
      PlanNode right,
      JoinType joinType,
      List<String> leftKeys,
      List<String> rightKeys,
      long estimatedRows) {
    checkJoinKeys(left, right, leftKeys, rightKeys);
    return base(
            id, PlanNodeType.HASH_JOIN, List.of(left, right), joinColumns(left, right, joinType))
        .estimatedRows(estimatedRows)
        .joinType(joinType)
        .leftKeys(ImmutableList.copyOf(leftKeys))
        .rightKeys(ImmutableList.copyOf(rightKeys))
        .build();
  }

  public static PlanNode aggregate(
      String id,
      PlanNode child,
      List<String> groupBy,
      List<AggregateCall> aggregates,
      long estimatedRows) {
    checkAggregates(child, groupBy, aggregates);
    return base(id, PlanNodeType.AGGREGATE, List.of(child), aggregateColumns(groupBy, aggregates))
        .estimatedRows(estimatedRows)
        .groupBy(ImmutableList.copyOf(groupBy))
        .aggregates(ImmutableList.copyOf(aggregates))
        .build();
  }

  public static PlanNode sort(String id, PlanNode child, List<SortKey> sortKeys) {
    for (SortKey key : sortKeys) {
      requireColumn(child, key.column());
    }
    return base(id, PlanNodeType.SORT, List.of(child), child.getOutputColumns())
        .estimatedRows(child.getEstimatedRows())
        .sortKeys(ImmutableList.copyOf(sortKeys))
        .build();
  }

  public static PlanNode limit(String id, PlanNode child, long limit) {
    Preconditions.checkArgument(limit >= 0, "limit must be non-negative: %s", limit);
    return base(id, PlanNodeType.LIMIT, List.of(child), child.getOutputColumns())
        .estimatedRows(Math.min(limit, child.getEstimatedRows()))
        .limit(limit)
        .build();
  }

  public static PlanNode streamSource(String id, String streamId, List<String> columns) {
    return base(id, PlanNodeType.STREAM_SOURCE, List.of(), columns).streamId(streamId).build();
  }

  /**
   * Windowed aggregation over a stream. Output columns are {@code window_start, window_end}, then
   * the group-by columns, then the aggregate aliases.
   *
   * @param windowSizeMillis window length
   * @param windowSlideMillis distance between window starts, equal to the size for tumbling windows
   */
  public static PlanNode windowAggregate(
      String id,
      PlanNode child,
      List<String> groupBy,
      List<AggregateCall> aggregates,
      long windowSizeMillis,
      long windowSlideMillis) {
    checkAggregates(child, groupBy, aggregates);
    Preconditions.checkArgument(windowSizeMillis > 0, "window size must be positive");
    Preconditions.checkArgument(
        windowSlideMillis > 0 && windowSlideMillis <= windowSizeMillis,
        "window slide must be in (0, size]");
    ImmutableList<String> columns =
        ImmutableList.<String>builder()
            .add(WINDOW_START, WINDOW_END)
            .addAll(aggregateColumns(groupBy, aggregates))
            .build();
    return base(id, PlanNodeType.WINDOW_AGGREGATE, List.of(child), columns)
        .groupBy(ImmutableList.copyOf(groupBy))
        .aggregates(ImmutableList.copyOf(aggregates))
        .windowSizeMillis(windowSizeMillis)
        .windowSlideMillis(windowSlideMillis)
        .build();
  }

  /** Inner equi-join of two streams over their current windows. */
  public static PlanNode streamJoin(
      String id,
      PlanNode left,
      PlanNode right,
      List<String> leftKeys,
      List<String> rightKeys,
      long windowSizeMillis) {
    checkJoinKeys(left, right, leftKeys, rightKeys);
    Preconditions.checkArgument(
        left.getType() == PlanNodeType.STREAM_SOURCE
            && right.getType() == PlanNodeType.STREAM_SOURCE,
        "stream join inputs must be stream sources");
    Preconditions.checkArgument(windowSizeMillis > 0, "window size must be positive");
    return base(
            id,
            PlanNodeType.STREAM_JOIN,
            List.of(left, right),
            joinColumns(left, right, JoinType.INNER))
        .joinType(JoinType.INNER)
        .leftKeys(ImmutableList.copyOf(leftKeys))
        .rightKeys(ImmutableList.copyOf(rightKeys))
        .windowSizeMillis(windowSizeMillis)
        .windowSlideMillis(windowSizeMillis)
        .build();
  }

  /** Returns the single input of a unary node. */
  public PlanNode getInput() {
    Preconditions.checkState(children.size() == 1, "%s is not a unary node", id);
    return children.get(0);
  }

  public PlanNode getLeft() {
    Preconditions.checkState(children.size() == 2, "%s is not a binary node", id);
    return children.get(0);
  }

  public PlanNode getRight() {
    Preconditions.checkState(children.size() == 2, "%s is not a binary node", id);
    return children.get(1);
  }

  /** Returns the position of a column in this node's output, or -1 if absent. */
  public int columnIndex(String column) {
    return outputColumns.indexOf(column);
  }

  /** Returns true if this node or any descendant reads a live stream. */
  public boolean isUnbounded() {
    if (type.isStreaming()) {
      return true;
    }
    return children.stream().anyMatch(PlanNode::isUnbounded);
  }

  /** Returns true if this subtree contains a join or an aggregation. */
  public boolean containsJoinOrAggregation() {
    if (type == PlanNodeType.HASH_JOIN || type == PlanNodeType.AGGREGATE) {
      return true;
    }
    return children.stream().anyMatch(PlanNode::containsJoinOrAggregation);
  }

  /** Returns true if this subtree contains both a join and an aggregation. */
  public boolean isComplex() {
    boolean[] seen = new boolean[2];
    forEach(
        node -> {
          seen[0] |= node.getType() == PlanNodeType.HASH_JOIN;
          seen[1] |= node.getType() == PlanNodeType.AGGREGATE;
        });
    return seen[0] && seen[1];
  }

  /** Sum of the estimated rows of all leaves, the input volume the query reads. */
  public long estimatedInputRows() {
    if (type.isLeaf()) {
      return estimatedRows;
    }
    return children.stream().mapToLong(PlanNode::estimatedInputRows).sum();
  }

  /**
   * Largest number of partitions any leaf of this subtree can be split into when no partition is
   * smaller than {@code rowsPerPartition}. At least 1.
   */
  public int maxFanOut(long rowsPerPartition) {
    Preconditions.checkArgument(rowsPerPartition > 0, "rowsPerPartition must be positive");
    if (type.isLeaf()) {
      long parts = (estimatedRows + rowsPerPartition - 1) / rowsPerPartition;
      return (int) Math.max(1, Math.min(Integer.MAX_VALUE, parts));
    }
    int fanOut = 1;
    for (PlanNode child : children) {
      fanOut = Math.max(fanOut, child.maxFanOut(rowsPerPartition));
    }
    return fanOut;
  }

  /** Visits this node and all descendants in pre-order. */
  public void forEach(Consumer<PlanNode> visitor) {
    visitor.accept(this);
    for (PlanNode child : children) {
      child.forEach(visitor);
    }
  }

  /**
   * Returns a canonical, deterministic rendering of the subtree. Node ids are excluded so logically
   * equivalent plans render identically.
   */
  public String explain() {
    StringBuilder sb = new StringBuilder();
    explain(sb, 0);
    return sb.toString();
  }

  private void explain(StringBuilder sb, int depth) {
    sb.append("  ".repeat(depth)).append(type);
    switch (type) {
      case TABLE_SCAN, INDEX_SCAN -> {
        sb.append(" table=").append(table).append(" columns=").append(outputColumns);
        if (accessPath != null) {
          sb.append(" index=").append(accessPath);
        }
      }
      case FILTER -> sb.append(" conditions=").append(conditions);
      case PROJECT -> sb.append(" columns=").append(projections);
      case HASH_JOIN -> sb.append(' ')
          .append(joinType)
          .append(" left=")
          .append(leftKeys)
          .append(" right=")
          .append(rightKeys);
      case AGGREGATE -> sb.append(" groupBy=").append(groupBy).append(" aggs=").append(aggregates);
      case SORT -> sb.append(" keys=").append(sortKeys);
      case LIMIT -> sb.append(" limit=").append(limit);
      case STREAM_SOURCE -> sb.append(" stream=").append(streamId).append(" columns=")
          .append(outputColumns);
      case WINDOW_AGGREGATE -> sb.append(" window=")
          .append(windowSizeMillis)
          .append('/')
          .append(windowSlideMillis)
          .append(" groupBy=")
          .append(groupBy)
          .append(" aggs=")
          .append(aggregates);
      case STREAM_JOIN -> sb.append(" window=")
          .append(windowSizeMillis)
          .append(" left=")
          .append(leftKeys)
          .append(" right=")
          .append(rightKeys);
    }
    sb.append('\n');
    for (PlanNode child : children) {
      child.explain(sb, depth + 1);
    }
  }

  @Override
  public String toString() {
    return type + "[" + id + "]";
  }

  private static PlanNode leaf(
      String id,
      PlanNodeType type,
      String table,
      IndexAccessPath accessPath,
      List<String> columns,
      long estimatedRows) {
    Preconditions.checkArgument(estimatedRows >= 0, "estimatedRows must be non-negative");
    return base(id, type, List.of(), columns)
        .table(table)
        .accessPath(accessPath)
        .estimatedRows(estimatedRows)
        .build();
  }

  private static PlanNodeBuilder base(
      String id, PlanNodeType type, List<PlanNode> children, List<String> columns) {
    Preconditions.checkNotNull(id, "node id");
    return PlanNode.builder()
        .id(id)
        .type(type)
        .children(ImmutableList.copyOf(children))
        .outputColumns(ImmutableList.copyOf(columns))
        .conditions(List.of())
        .projections(List.of())
        .leftKeys(List.of())
        .rightKeys(List.of())
        .groupBy(List.of())
        .aggregates(List.of())
        .sortKeys(List.of());
  }

  private static void requireColumn(PlanNode node, String column) {
    Preconditions.checkArgument(
        node.columnIndex(column) >= 0, "column %s not produced by %s", column, node);
  }

  private static void checkJoinKeys(
      PlanNode left, PlanNode right, List<String> leftKeys, List<String> rightKeys) {
    Preconditions.checkArgument(!leftKeys.isEmpty(), "join requires at least one key");
    Preconditions.checkArgument(
        leftKeys.size() == rightKeys.size(), "join key lists differ in length");
    leftKeys.forEach(key -> requireColumn(left, key));
    rightKeys.forEach(key -> requireColumn(right, key));
  }

  private static void checkAggregates(
      PlanNode child, List<String> groupBy, List<AggregateCall> aggregates) {
    groupBy.forEach(column -> requireColumn(child, column));
    for (AggregateCall call : aggregates) {
      if (call.column() != null) {
        requireColumn(child, call.column());
      }
    }
  }

  private static List<String> joinColumns(PlanNode left, PlanNode right, JoinType joinType) {
    if (joinType.projectsLeftOnly()) {
      return left.getOutputColumns();
    }
    return ImmutableList.<String>builder()
        .addAll(left.getOutputColumns())
        .addAll(right.getOutputColumns())
        .build();
  }

  private static List<String> aggregateColumns(
      List<String> groupBy, List<AggregateCall> aggregates) {
    ImmutableList.Builder<String> columns = ImmutableList.<String>builder().addAll(groupBy);
    aggregates.forEach(call -> columns.add(call.alias()));
    return columns.build();
  }
}
