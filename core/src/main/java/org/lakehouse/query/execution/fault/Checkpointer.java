/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.CheckpointException;
import org.lakehouse.query.execution.fault.snapshot.CheckpointRecord;
import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;

/**
 * Decides when a running task checkpoints: after every {@code intervalRows} source rows or every
 * {@code intervalMillis}, whichever comes first. A failed write is logged and the task keeps
 * running; the caller keeps its output staged until a later checkpoint succeeds.
 */
@Log4j2
public class Checkpointer {

  private final CheckpointStore store;
  private final String queryId;
  private final String operatorId;
  private final long intervalRows;
  private final long intervalMillis;
  private final Clock clock;
  private final AtomicLong sequence;
  private final AtomicLong written;

  private long rowsSinceCheckpoint;
  private long lastCheckpointMillis;

  public Checkpointer(
      CheckpointStore store,
      String queryId,
      String operatorId,
      long intervalRows,
      long intervalMillis,
      Clock clock,
      AtomicLong sequence,
      AtomicLong written) {
    this.store = store;
    this.queryId = queryId;
    this.operatorId = operatorId;
    this.intervalRows = intervalRows;
    this.intervalMillis = intervalMillis;
    this.clock = clock;
    this.sequence = sequence;
    this.written = written;
    this.lastCheckpointMillis = clock.millis();
  }

  /**
   * Accounts for rows processed since the last call and checkpoints if an interval elapsed.
   *
   * @param rows source rows consumed since the last call
   * @param snapshot captures the task state; only invoked when a checkpoint is due
   * @return true if a checkpoint was persisted by this call
   */
  public boolean onRowsProcessed(long rows, Supplier<PipelineSnapshot> snapshot) {
    rowsSinceCheckpoint += rows;
    long now = clock.millis();
    if (rowsSinceCheckpoint < intervalRows && now - lastCheckpointMillis < intervalMillis) {
      return false;
    }
    rowsSinceCheckpoint = 0;
    lastCheckpointMillis = now;
    return write(snapshot.get());
  }

  /**
   * Persists a snapshot regardless of the intervals, for callers that schedule checkpoints
   * themselves.
   *
   * @return true if the checkpoint was persisted
   */
  public boolean write(PipelineSnapshot snapshot) {
    CheckpointRecord record =
        new CheckpointRecord(
            queryId, operatorId, sequence.incrementAndGet(), clock.millis(), snapshot);
    try {
      store.write(record);
    } catch (CheckpointException e) {
      log.warn(
          "Checkpoint {} of operator {} in query {} failed, continuing without it",
          record.getSequence(),
          operatorId,
          queryId,
          e);
      return false;
    }
    written.incrementAndGet();
    log.debug(
        "Checkpoint {} of operator {} at position {}",
        record.getSequence(),
        operatorId,
        record.getSnapshot().getPosition());
    return true;
  }
}
