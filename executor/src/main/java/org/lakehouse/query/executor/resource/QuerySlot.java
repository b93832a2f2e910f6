/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/** Running slot granted to one query by {@link QueryAdmission}. Released exactly once. */
public class QuerySlot implements AutoCloseable {

  @Getter private final String queryId;
  private final Semaphore slots;
  private final AtomicBoolean released = new AtomicBoolean(false);

  QuerySlot(String queryId, Semaphore slots) {
    this.queryId = queryId;
    this.slots = slots;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      slots.release();
    }
  }
}
