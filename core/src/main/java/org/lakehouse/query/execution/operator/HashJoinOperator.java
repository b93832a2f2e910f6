/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.lakehouse.query.execution.fault.snapshot.JoinState;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.plan.JoinType;
import org.lakehouse.query.execution.plan.PlanNode;

/**
 * Hash join: builds a hash table over one materialized input and streams the other input through
 * it as pages. The build side is normally the right input; an INNER join may build on the left
 * input instead when it is the smaller one. Output rows are always left columns followed by right
 * columns (left only for SEMI and ANTI).
 *
 * <p>Supports: INNER, LEFT, RIGHT, FULL, SEMI, ANTI join types. NULL keys never match (SQL
 * semantics).
 */
public class HashJoinOperator implements StatefulOperator {

  private final JoinType joinType;
  private final boolean buildIsLeft;
  private final List<List<Object>> buildRows;
  private final Map<List<Object>, List<Integer>> hashTable = new HashMap<>();
  private final int[] probeKeyIndices;
  private final int leftFieldCount;
  private final int rightFieldCount;
  private final int outputChannels;
  private final OperatorContext context;
  private final BitSet matchedBuildRows = new BitSet();
  private final Deque<Page> output = new ArrayDeque<>();

  private boolean inputFinished;

  /**
   * @param joinNode the HASH_JOIN node
   * @param buildRows materialized rows of the build input
   * @param buildIsLeft true if {@code buildRows} are the left input; INNER joins only
   */
  public HashJoinOperator(
      PlanNode joinNode,
      List<List<Object>> buildRows,
      boolean buildIsLeft,
      OperatorContext context) {
    this.joinType = joinNode.getJoinType();
    Preconditions.checkArgument(
        !buildIsLeft || joinType == JoinType.INNER,
        "only INNER joins may build on the left input, not %s",
        joinType);
    this.buildIsLeft = buildIsLeft;
    this.buildRows = buildRows;
    this.context = context;
    PlanNode left = joinNode.getLeft();
    PlanNode right = joinNode.getRight();
    this.leftFieldCount = left.getOutputColumns().size();
    this.rightFieldCount = right.getOutputColumns().size();
    this.outputChannels = joinNode.getOutputColumns().size();

    int[] leftKeys = RowKeys.indicesOf(left.getOutputColumns(), joinNode.getLeftKeys());
    int[] rightKeys = RowKeys.indicesOf(right.getOutputColumns(), joinNode.getRightKeys());
    int[] buildKeyIndices = buildIsLeft ? leftKeys : rightKeys;
    this.probeKeyIndices = buildIsLeft ? rightKeys : leftKeys;
    for (int i = 0; i < buildRows.size(); i++) {
      List<Object> key = RowKeys.joinKey(buildRows.get(i), buildKeyIndices);
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
      }
    }
  }

  @Override
  public boolean needsInput() {
    return !inputFinished;
  }

  @Override
  public void addInput(Page page) {
    context.checkCancelled();
    List<List<Object>> joined = new ArrayList<>();
    for (int position = 0; position < page.getPositionCount(); position++) {
      probe(page.getRow(position), joined);
    }
    output.addAll(PageBuilder.paginate(joined, outputChannels, context.getPageSize()));
  }

  private void probe(List<Object> probeRow, List<List<Object>> joined) {
    List<Object> key = RowKeys.joinKey(probeRow, probeKeyIndices);
    List<Integer> matches = key == null ? null : hashTable.get(key);
    boolean hasMatch = matches != null && !matches.isEmpty();
    switch (joinType) {
      case INNER, LEFT, RIGHT, FULL -> {
        if (hasMatch) {
          for (int buildIndex : matches) {
            List<Object> buildRow = buildRows.get(buildIndex);
            joined.add(buildIsLeft ? concat(buildRow, probeRow) : concat(probeRow, buildRow));
            matchedBuildRows.set(buildIndex);
          }
        } else if (joinType.emitsUnmatchedLeft()) {
          joined.add(concat(probeRow, Collections.nCopies(rightFieldCount, null)));
        }
      }
      case SEMI -> {
        if (hasMatch) {
          joined.add(probeRow);
        }
      }
      case ANTI -> {
        if (!hasMatch) {
          joined.add(probeRow);
        }
      }
      default -> throw new UnsupportedOperationException("Unsupported join type: " + joinType);
    }
  }

  private static List<Object> concat(List<Object> left, List<Object> right) {
    List<Object> combined = new ArrayList<>(left.size() + right.size());
    combined.addAll(left);
    combined.addAll(right);
    return combined;
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
    if (joinType.emitsUnmatchedRight()) {
      List<List<Object>> unmatched = new ArrayList<>();
      for (int i = matchedBuildRows.nextClearBit(0); i < buildRows.size();
          i = matchedBuildRows.nextClearBit(i + 1)) {
        unmatched.add(concat(Collections.nCopies(leftFieldCount, null), buildRows.get(i)));
      }
      output.addAll(PageBuilder.paginate(unmatched, outputChannels, context.getPageSize()));
    }
  }

  @Override
  public OperatorContext getContext() {
    return context;
  }

  @Override
  public OperatorState snapshotState() {
    return new JoinState(matchedBuildRows.stream().boxed().toList());
  }

  @Override
  public void restoreState(OperatorState state) {
    JoinState joinState =
        OperatorState.require(state, JoinState.class, JoinState.VERSION, context.getOperatorId());
    matchedBuildRows.clear();
    joinState.getMatchedBuildRows().forEach(matchedBuildRows::set);
  }
}
