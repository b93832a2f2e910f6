/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import java.util.List;
import java.util.Optional;
import org.lakehouse.query.execution.fault.snapshot.CheckpointRecord;

/**
 * Durable home of operator checkpoints, keyed by query and operator. Implementations must be
 * thread-safe; partitions of a parallel query write concurrently under distinct operator ids.
 */
public interface CheckpointStore {

  /**
   * Persists a checkpoint, superseding older ones of the same operator.
   *
   * @throws org.lakehouse.query.execution.error.CheckpointException if the write fails
   */
  void write(CheckpointRecord record);

  /**
   * Returns the newest checkpoint of an operator.
   *
   * @throws org.lakehouse.query.execution.error.CheckpointException if it exists but cannot be read
   */
  Optional<CheckpointRecord> latest(String queryId, String operatorId);

  /** Returns the retained checkpoints of an operator, oldest first. */
  List<CheckpointRecord> history(String queryId, String operatorId);

  /** Removes every checkpoint of an operator. */
  void clear(String queryId, String operatorId);

  /** Removes every checkpoint of a query. */
  void clearQuery(String queryId);
}
