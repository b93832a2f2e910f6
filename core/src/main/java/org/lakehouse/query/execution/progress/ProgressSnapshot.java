/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.progress;

import java.time.Duration;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Immutable view of a query's progress at one instant. */
@Getter
@Builder
@ToString
public class ProgressSnapshot {

  private final String queryId;
  private final ProgressState state;

  /** Source rows read so far, each counted once. */
  private final long rowsProcessed;

  /** Optimizer estimate of the source rows, fixed for the run. Zero when unknown. */
  private final long estimatedTotalRows;

  /** Between 0 and 100, never decreasing. */
  private final double percentComplete;

  /** Running time, excluding time spent paused. */
  private final long elapsedMillis;

  private final Long estimatedRemainingMillis;

  /** What the query is doing, such as "scan", "build" or "merge". */
  private final String phase;

  /** Returns the estimated time to completion, empty until some progress has been made. */
  public Optional<Duration> getEstimatedRemaining() {
    return Optional.ofNullable(estimatedRemainingMillis).map(Duration::ofMillis);
  }
}
