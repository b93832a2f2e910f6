/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import java.time.Clock;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.fault.FaultTolerantShell;
import org.lakehouse.query.execution.operator.CancellationToken;
import org.lakehouse.query.execution.operator.OperatorContext;
import org.lakehouse.query.execution.progress.ExecutionStatistics;
import org.lakehouse.query.execution.progress.ProgressTracker;
import org.lakehouse.query.execution.storage.LiveSource;
import org.lakehouse.query.execution.storage.StorageEngine;
import org.lakehouse.query.executor.bridge.OptimizedPlan;
import org.lakehouse.query.executor.resource.WorkerPools;

/** Resources of one query run, passed to the engine that executes it. */
@Getter
@Builder
public class ExecutionContext {

  private final String queryId;
  private final OptimizedPlan plan;
  private final ExecutionSettings settings;
  private final StorageEngine storage;
  private final LiveSource liveSource;
  private final FaultTolerantShell shell;
  private final ProgressTracker progressTracker;
  private final ExecutionStatistics statistics;
  private final CancellationToken cancellationToken;
  private final Clock clock;

  /** Present for PARALLEL and ADAPTIVE runs. */
  private final WorkerPools workerPools;

  public Optional<WorkerPools> getWorkerPools() {
    return Optional.ofNullable(workerPools);
  }

  /** Returns an operator context under the query's cancellation token. */
  public OperatorContext operatorContext() {
    return operatorContext(cancellationToken);
  }

  /** Returns an operator context under a child token, for partitions cancelled together. */
  public OperatorContext operatorContext(CancellationToken token) {
    return new OperatorContext(queryId, queryId, settings.getPageSize(), token);
  }

  /** Accounts for source rows read by any operator of the query. */
  public void recordSourceRows(long rows) {
    statistics.addRowsRead(rows);
    progressTracker.recordRows(rows);
  }
}
