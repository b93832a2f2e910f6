/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.ErrorKind;

/**
 * Counts failures per operator in a sliding time window. An operator that reaches the threshold
 * within the window is marked permanently failed and is not retried or recovered again.
 */
@Log4j2
public class FailureDetector {

  private final int threshold;
  private final long windowMillis;
  private final Clock clock;
  private final Map<String, Deque<Long>> failures = new HashMap<>();
  private final Map<String, ErrorKind> lastKinds = new HashMap<>();
  private final Set<String> permanentlyFailed = new HashSet<>();

  public FailureDetector(int threshold, long windowMillis, Clock clock) {
    this.threshold = threshold;
    this.windowMillis = windowMillis;
    this.clock = clock;
  }

  /**
   * Records a failure.
   *
   * @return true if the operator has now failed {@code threshold} times within the window
   */
  public synchronized boolean recordFailure(String operatorId, ErrorKind kind) {
    long now = clock.millis();
    Deque<Long> window = failures.computeIfAbsent(operatorId, k -> new ArrayDeque<>());
    window.addLast(now);
    evict(window, now);
    lastKinds.put(operatorId, kind);
    if (window.size() >= threshold && permanentlyFailed.add(operatorId)) {
      log.error(
          "Operator {} failed {} times within {} ms, marking it permanently failed",
          operatorId,
          window.size(),
          windowMillis);
    }
    return permanentlyFailed.contains(operatorId);
  }

  /** Clears the failure history of an operator that completed. */
  public synchronized void recordSuccess(String operatorId) {
    failures.remove(operatorId);
    lastKinds.remove(operatorId);
    permanentlyFailed.remove(operatorId);
  }

  public synchronized boolean isPermanentlyFailed(String operatorId) {
    return permanentlyFailed.contains(operatorId);
  }

  /** Returns the failures of an operator still inside the window, if any. */
  public synchronized Optional<FailureRecord> getRecord(String operatorId) {
    Deque<Long> window = failures.get(operatorId);
    if (window == null) {
      return Optional.empty();
    }
    evict(window, clock.millis());
    if (window.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new FailureRecord(operatorId, window.peekLast(), lastKinds.get(operatorId), window.size()));
  }

  private void evict(Deque<Long> window, long now) {
    while (!window.isEmpty() && window.peekFirst() <= now - windowMillis) {
      window.pollFirst();
    }
  }
}
