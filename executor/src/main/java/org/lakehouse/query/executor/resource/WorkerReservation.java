/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/** Workers granted to one query by the {@link ResourceManager}. Released exactly once. */
public class WorkerReservation implements AutoCloseable {

  @Getter private final String queryId;
  @Getter private final int workers;
  private final Semaphore budget;
  private final AtomicBoolean released = new AtomicBoolean(false);

  WorkerReservation(String queryId, int workers, Semaphore budget) {
    this.queryId = queryId;
    this.workers = workers;
    this.budget = budget;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      budget.release(workers);
    }
  }
}
