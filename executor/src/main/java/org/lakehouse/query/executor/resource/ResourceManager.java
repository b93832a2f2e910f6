/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import lombok.extern.log4j.Log4j2;

/**
 * Budget of worker threads shared by all queries of one service. A parallel query reserves its
 * workers up front and returns them when its pools are torn down.
 */
@Log4j2
public class ResourceManager {

  private final int maxWorkers;
  private final Semaphore budget;

  public ResourceManager(int maxWorkers) {
    this.maxWorkers = maxWorkers;
    this.budget = new Semaphore(maxWorkers);
  }

  /** Reserves workers without waiting. Empty if the budget cannot cover them right now. */
  public Optional<WorkerReservation> tryReserve(String queryId, int workers) {
    if (workers > maxWorkers || !budget.tryAcquire(workers)) {
      log.debug(
          "Query {} could not reserve {} workers, {} of {} available",
          queryId,
          workers,
          budget.availablePermits(),
          maxWorkers);
      return Optional.empty();
    }
    return Optional.of(new WorkerReservation(queryId, workers, budget));
  }

  public int availableWorkers() {
    return budget.availablePermits();
  }
}
