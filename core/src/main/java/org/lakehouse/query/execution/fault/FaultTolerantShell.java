/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.error.CheckpointException;
import org.lakehouse.query.execution.error.ErrorKind;
import org.lakehouse.query.execution.error.FatalOperatorException;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.error.QueryExecutionException;
import org.lakehouse.query.execution.error.TransientOperatorException;
import org.lakehouse.query.execution.fault.snapshot.CheckpointRecord;
import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;

/**
 * Runs operators of one query with checkpointing, retry and recovery.
 *
 * <p>Every attempt resumes from the operator's latest checkpoint. {@link
 * TransientOperatorException}s are retried with exponential backoff up to {@code maxRetries}
 * times; any other failure is fatal at once. When the retry budget is exhausted, registered {@link
 * RecoveryHandler}s get up to {@code maxRecoveries} chances to repair the environment before the
 * operator is failed. An operator the {@link FailureDetector} marks permanently failed is neither
 * retried nor recovered.
 *
 * <p>Safe for concurrent use by the partitions of a parallel query, which run under distinct
 * operator ids.
 */
@Log4j2
public class FaultTolerantShell {

  /** resilience4j rejects shorter retry intervals. */
  private static final long MIN_BACKOFF_MILLIS = 10L;

  private final String queryId;
  private final ExecutionSettings settings;
  @Getter private final CheckpointStore checkpointStore;
  @Getter private final FailureDetector failureDetector;
  private final Clock clock;
  private final RetryConfig retryConfig;
  private final List<RecoveryHandler> recoveryHandlers = new CopyOnWriteArrayList<>();
  private final Map<String, OperatorStatus> statuses = new ConcurrentHashMap<>();
  private final Map<String, List<OperatorStatus>> statusHistory = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();
  private final AtomicLong checkpointsWritten = new AtomicLong();
  private final AtomicLong retries = new AtomicLong();
  private final AtomicLong recoveries = new AtomicLong();

  public FaultTolerantShell(
      String queryId,
      ExecutionSettings settings,
      CheckpointStore checkpointStore,
      FailureDetector failureDetector,
      Clock clock) {
    this.queryId = queryId;
    this.settings = settings;
    this.checkpointStore = checkpointStore;
    this.failureDetector = failureDetector;
    this.clock = clock;
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(settings.getMaxRetries() + 1)
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    Math.max(MIN_BACKOFF_MILLIS, settings.getInitialBackoffMillis()),
                    settings.getBackoffMultiplier()))
            .build();
  }

  /** Creates a shell for one query with its own failure detector. */
  public static FaultTolerantShell forQuery(
      String queryId, ExecutionSettings settings, CheckpointStore store, Clock clock) {
    return new FaultTolerantShell(
        queryId,
        settings,
        store,
        new FailureDetector(
            settings.getFailureThreshold(), settings.getFailureWindowMillis(), clock),
        clock);
  }

  /** Registers a handler consulted when an operator exhausts its retries. */
  public void registerRecoveryHandler(RecoveryHandler handler) {
    recoveryHandlers.add(handler);
  }

  /**
   * Runs a task to completion under checkpointing and retry.
   *
   * @throws QueryCancelledException if the query was cancelled
   * @throws QueryExecutionException if the task failed for good; transient failures surface as
   *     {@link FatalOperatorException} once retries and recoveries are exhausted
   */
  public void execute(ResumableTask task) {
    String operatorId = task.getTaskId();
    int recoveryAttempts = 0;
    while (true) {
      try {
        runWithRetry(task);
        failureDetector.recordSuccess(operatorId);
        transition(operatorId, OperatorStatus.COMPLETED);
        clearCheckpoints(operatorId);
        return;
      } catch (QueryCancelledException e) {
        clearCheckpoints(operatorId);
        throw e;
      } catch (TransientOperatorException e) {
        if (failureDetector.isPermanentlyFailed(operatorId)) {
          transition(operatorId, OperatorStatus.FAILED);
          throw new FatalOperatorException(
              operatorId,
              "Operator failed "
                  + settings.getFailureThreshold()
                  + " times within "
                  + settings.getFailureWindowMillis()
                  + " ms: "
                  + e.getMessage(),
              e);
        }
        if (recoveryAttempts < settings.getMaxRecoveries() && !recoveryHandlers.isEmpty()) {
          recoveryAttempts++;
          recover(operatorId, e);
          continue;
        }
        transition(operatorId, OperatorStatus.FAILED);
        throw new FatalOperatorException(
            operatorId,
            "Retries exhausted after "
                + (settings.getMaxRetries() + 1)
                + " attempts: "
                + e.getMessage(),
            e);
      } catch (QueryExecutionException e) {
        transition(operatorId, OperatorStatus.FAILED);
        throw e;
      } catch (RuntimeException e) {
        transition(operatorId, OperatorStatus.FAILED);
        throw new FatalOperatorException(operatorId, String.valueOf(e.getMessage()), e);
      }
    }
  }

  private void runWithRetry(ResumableTask task) {
    String operatorId = task.getTaskId();
    Retry retry =
        Retry.of(
            queryId + "/" + operatorId,
            RetryConfig.from(retryConfig)
                .retryOnException(
                    e ->
                        e instanceof TransientOperatorException
                            && !failureDetector.isPermanentlyFailed(operatorId))
                .build());
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              retries.incrementAndGet();
              log.warn(
                  "Retrying operator {} of query {} (attempt {}) in {}: {}",
                  operatorId,
                  queryId,
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval(),
                  event.getLastThrowable().getMessage());
              transition(operatorId, OperatorStatus.RETRYING);
            });
    Retry.decorateRunnable(retry, () -> attempt(task)).run();
  }

  private void attempt(ResumableTask task) {
    String operatorId = task.getTaskId();
    transition(operatorId, OperatorStatus.RUNNING);
    PipelineSnapshot snapshot = loadCheckpoint(operatorId);
    Checkpointer checkpointer =
        new Checkpointer(
            checkpointStore,
            queryId,
            operatorId,
            settings.getCheckpointIntervalRows(),
            settings.getCheckpointIntervalMillis(),
            clock,
            sequences.computeIfAbsent(operatorId, k -> new AtomicLong()),
            checkpointsWritten);
    try {
      task.run(snapshot, checkpointer);
    } catch (QueryCancelledException e) {
      throw e;
    } catch (QueryExecutionException e) {
      failureDetector.recordFailure(operatorId, e.getErrorKind());
      throw e;
    } catch (RuntimeException e) {
      failureDetector.recordFailure(operatorId, ErrorKind.FATAL);
      throw e;
    }
  }

  /**
   * Loads the latest checkpoint. An unreadable checkpoint restarts the operator from the
   * beginning, unless strict recovery is configured, in which case it fails the operator.
   */
  private PipelineSnapshot loadCheckpoint(String operatorId) {
    try {
      Optional<CheckpointRecord> latest = checkpointStore.latest(queryId, operatorId);
      if (latest.isPresent()) {
        log.info(
            "Resuming operator {} of query {} from checkpoint {} at position {}",
            operatorId,
            queryId,
            latest.get().getSequence(),
            latest.get().getSnapshot().getPosition());
        return latest.get().getSnapshot();
      }
      return null;
    } catch (CheckpointException e) {
      if (settings.isStrictCheckpointRecovery()) {
        throw e;
      }
      log.error(
          "Checkpoint of operator {} in query {} is unreadable, restarting from the beginning",
          operatorId,
          queryId,
          e);
      return null;
    }
  }

  private void recover(String operatorId, TransientOperatorException cause) {
    transition(operatorId, OperatorStatus.RECOVERING);
    recoveries.incrementAndGet();
    log.warn("Recovering operator {} of query {} after exhausted retries", operatorId, queryId);
    for (RecoveryHandler handler : recoveryHandlers) {
      try {
        handler.onRecovery(queryId, operatorId, cause);
      } catch (RuntimeException e) {
        transition(operatorId, OperatorStatus.FAILED);
        throw new FatalOperatorException(operatorId, "Recovery failed: " + e.getMessage(), e);
      }
    }
  }

  private void clearCheckpoints(String operatorId) {
    try {
      checkpointStore.clear(queryId, operatorId);
    } catch (RuntimeException e) {
      log.warn("Failed to clear checkpoints of operator {} in query {}", operatorId, queryId, e);
    }
  }

  private void transition(String operatorId, OperatorStatus status) {
    statuses.put(operatorId, status);
    statusHistory
        .computeIfAbsent(operatorId, k -> Collections.synchronizedList(new ArrayList<>()))
        .add(status);
  }

  /** Returns the current status of an operator, if it ran under this shell. */
  public Optional<OperatorStatus> getStatus(String operatorId) {
    return Optional.ofNullable(statuses.get(operatorId));
  }

  /** Returns every status an operator went through, in order. */
  public List<OperatorStatus> getStatusHistory(String operatorId) {
    List<OperatorStatus> history = statusHistory.get(operatorId);
    if (history == null) {
      return List.of();
    }
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  public long getCheckpointsWritten() {
    return checkpointsWritten.get();
  }

  public long getRetries() {
    return retries.get();
  }

  public long getRecoveries() {
    return recoveries.get();
  }
}
