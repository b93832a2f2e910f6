/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.Getter;
import org.lakehouse.query.execution.operator.RowKeys;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.StreamEvent;

/**
 * Inner equi-join of two streams over their current windows, as a symmetric hash join. Both
 * buffers are indexed by join key; each arriving event is buffered on its side and probed against
 * the bucket of its key on the other side. Two events match when their keys are equal and
 * non-null and their timestamps lie within one window of each other.
 *
 * <p>Not thread-safe; owned by the streaming event loop. {@link #probe(StreamEvent, boolean,
 * Iterator)} is pure and may run on a worker thread over a copy of the candidates.
 */
public class StreamJoin {

  @Getter private final String operatorId;
  @Getter private final StreamBuffer leftBuffer;
  @Getter private final StreamBuffer rightBuffer;
  private final int[] leftKeys;
  private final int[] rightKeys;
  private final long windowMillis;

  public StreamJoin(PlanNode streamJoinNode, StreamBuffer leftBuffer, StreamBuffer rightBuffer) {
    this.operatorId = streamJoinNode.getId();
    this.leftBuffer = leftBuffer;
    this.rightBuffer = rightBuffer;
    this.leftKeys =
        RowKeys.indicesOf(
            streamJoinNode.getLeft().getOutputColumns(), streamJoinNode.getLeftKeys());
    this.rightKeys =
        RowKeys.indicesOf(
            streamJoinNode.getRight().getOutputColumns(), streamJoinNode.getRightKeys());
    this.windowMillis = streamJoinNode.getWindowSizeMillis();
    leftBuffer.indexBy(event -> RowKeys.joinKey(event.values(), leftKeys));
    rightBuffer.indexBy(event -> RowKeys.joinKey(event.values(), rightKeys));
  }

  /** Returns the buffer holding one side's events. */
  public StreamBuffer buffer(boolean left) {
    return left ? leftBuffer : rightBuffer;
  }

  /** Probes an event against the other side's buffer in place. */
  public List<List<Object>> probe(StreamEvent event, boolean eventIsLeft) {
    List<Object> key = keyOf(event, eventIsLeft);
    if (key == null) {
      return new ArrayList<>();
    }
    return probe(event, eventIsLeft, buffer(!eventIsLeft).iteratorWithKey(key));
  }

  /** Copies the other side's events sharing the event's key, for a probe off the loop. */
  public List<StreamEvent> candidates(StreamEvent event, boolean eventIsLeft) {
    List<Object> key = keyOf(event, eventIsLeft);
    return key == null ? List.of() : buffer(!eventIsLeft).eventsWithKey(key);
  }

  private List<Object> keyOf(StreamEvent event, boolean eventIsLeft) {
    return RowKeys.joinKey(event.values(), eventIsLeft ? leftKeys : rightKeys);
  }

  /** Probes an event against candidate events of the other side. */
  public List<List<Object>> probe(
      StreamEvent event, boolean eventIsLeft, Iterator<StreamEvent> candidates) {
    List<Object> key = keyOf(event, eventIsLeft);
    List<List<Object>> matches = new ArrayList<>();
    if (key == null) {
      return matches;
    }
    int[] otherKeys = eventIsLeft ? rightKeys : leftKeys;
    while (candidates.hasNext()) {
      StreamEvent candidate = candidates.next();
      if (Math.abs(candidate.timestampMillis() - event.timestampMillis()) > windowMillis
          || !key.equals(RowKeys.joinKey(candidate.values(), otherKeys))) {
        continue;
      }
      List<Object> row = new ArrayList<>(event.values().size() + candidate.values().size());
      if (eventIsLeft) {
        row.addAll(event.values());
        row.addAll(candidate.values());
      } else {
        row.addAll(candidate.values());
        row.addAll(event.values());
      }
      matches.add(row);
    }
    return matches;
  }
}
