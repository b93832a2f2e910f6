/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lakehouse.query.execution.plan.PlanFingerprint;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.executor.resource.WorkerReservation;

/**
 * A plan bound to its execution strategy and resources. Exactly one is created per submission.
 */
@Getter
@Builder
@ToString(exclude = {"cachedResult", "reservation"})
public class OptimizedPlan {

  private final PlanNode root;
  private final PlanFingerprint fingerprint;
  private final ExecutionStrategy strategy;

  /** Partitions per parallel operator; 1 unless PARALLEL or ADAPTIVE. */
  private final int parallelism;

  /** Scan threads of the query's I/O pool; reserved together with the CPU workers. */
  private final int ioThreads;

  private final int pageSize;

  /** Capacity of each stream buffer. */
  private final int streamBufferCapacity;

  /** Time span stream buffers retain; at least the largest window of the plan. */
  private final long streamWindowMillis;

  /** Period of the streaming event loop's tick. */
  private final long streamTickMillis;

  private final CachePolicy cachePolicy;
  private final List<MonitoringHook> monitoringHooks;
  private final double costEstimate;

  /** Rows replayed by a CACHED execution. */
  private final List<List<Object>> cachedResult;

  /** CPU and I/O workers reserved for PARALLEL or ADAPTIVE execution. */
  private final WorkerReservation reservation;

  public Optional<WorkerReservation> getReservation() {
    return Optional.ofNullable(reservation);
  }
}
