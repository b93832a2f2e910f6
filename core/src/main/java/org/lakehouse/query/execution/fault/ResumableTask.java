/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;

/** A unit of work the {@link FaultTolerantShell} can restart from its latest checkpoint. */
public interface ResumableTask {

  /** Identifier checkpoints and failures of this task are recorded under. */
  String getTaskId();

  /**
   * Runs the task to completion.
   *
   * @param restoreFrom snapshot to resume from, or null to start from the beginning
   * @param checkpointer receives progress between pages and decides when to checkpoint
   */
  void run(PipelineSnapshot restoreFrom, Checkpointer checkpointer);
}
