/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.lakehouse.query.execution.fault.snapshot.CheckpointRecord;
import org.lakehouse.query.execution.fault.snapshot.SnapshotCodec;

/**
 * Keeps the last {@code retention} encoded checkpoints of every operator in memory. Records are
 * stored encoded so a restore goes through the same schema checks as a durable store.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

  private final int retention;
  private final Map<String, Map<String, Deque<byte[]>>> checkpoints = new HashMap<>();

  public InMemoryCheckpointStore(int retention) {
    Preconditions.checkArgument(retention > 0, "retention must be positive: %s", retention);
    this.retention = retention;
  }

  @Override
  public synchronized void write(CheckpointRecord record) {
    byte[] encoded = SnapshotCodec.encode(record);
    Deque<byte[]> history =
        checkpoints
            .computeIfAbsent(record.getQueryId(), k -> new HashMap<>())
            .computeIfAbsent(record.getOperatorId(), k -> new ArrayDeque<>());
    history.addLast(encoded);
    while (history.size() > retention) {
      history.pollFirst();
    }
  }

  @Override
  public synchronized Optional<CheckpointRecord> latest(String queryId, String operatorId) {
    Deque<byte[]> history = historyOf(queryId, operatorId);
    if (history == null || history.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(SnapshotCodec.decode(operatorId, history.peekLast()));
  }

  @Override
  public synchronized List<CheckpointRecord> history(String queryId, String operatorId) {
    List<CheckpointRecord> records = new ArrayList<>();
    Deque<byte[]> history = historyOf(queryId, operatorId);
    if (history != null) {
      for (byte[] encoded : history) {
        records.add(SnapshotCodec.decode(operatorId, encoded));
      }
    }
    return records;
  }

  @Override
  public synchronized void clear(String queryId, String operatorId) {
    Map<String, Deque<byte[]>> query = checkpoints.get(queryId);
    if (query != null) {
      query.remove(operatorId);
      if (query.isEmpty()) {
        checkpoints.remove(queryId);
      }
    }
  }

  @Override
  public synchronized void clearQuery(String queryId) {
    checkpoints.remove(queryId);
  }

  private Deque<byte[]> historyOf(String queryId, String operatorId) {
    Map<String, Deque<byte[]>> query = checkpoints.get(queryId);
    return query == null ? null : query.get(operatorId);
  }
}
