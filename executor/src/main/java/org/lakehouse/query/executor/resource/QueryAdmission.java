/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.operator.CancellationToken;

/**
 * Limits how many queries of one service run at once. A query that finds every slot taken, or the
 * heap above the memory limit, waits in arrival order until a slot frees up or it is cancelled.
 */
@Log4j2
public class QueryAdmission {

  private static final long POLL_MILLIS = 50L;
  private static final String OPERATOR_ID = "admission";

  private final int maxConcurrentQueries;
  private final long maxMemoryBytes;
  private final LongSupplier usedMemory;
  private final Semaphore slots;
  private final AtomicInteger queued = new AtomicInteger();
  private final AtomicInteger peakActive = new AtomicInteger();

  /** @param maxMemoryBytes heap limit for admitting queries, 0 for none */
  public QueryAdmission(int maxConcurrentQueries, long maxMemoryBytes) {
    this(maxConcurrentQueries, maxMemoryBytes, QueryAdmission::heapInUse);
  }

  public QueryAdmission(int maxConcurrentQueries, long maxMemoryBytes, LongSupplier usedMemory) {
    this.maxConcurrentQueries = maxConcurrentQueries;
    this.maxMemoryBytes = maxMemoryBytes;
    this.usedMemory = usedMemory;
    this.slots = new Semaphore(maxConcurrentQueries, true);
  }

  /**
   * Waits for a slot.
   *
   * @throws QueryCancelledException if the query is cancelled, or its thread interrupted, while
   *     queued
   */
  public QuerySlot admit(String queryId, CancellationToken token) {
    token.throwIfCancelled(OPERATOR_ID);
    if (!memoryExhausted() && slots.tryAcquire()) {
      return granted(queryId);
    }
    int waiting = queued.incrementAndGet();
    log.info(
        "Query {} queued: {} of {} queries running, {} waiting",
        queryId,
        activeQueries(),
        maxConcurrentQueries,
        waiting);
    try {
      while (true) {
        token.throwIfCancelled(OPERATOR_ID);
        if (memoryExhausted()) {
          TimeUnit.MILLISECONDS.sleep(POLL_MILLIS);
        } else if (slots.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          return granted(queryId);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(OPERATOR_ID);
    } finally {
      queued.decrementAndGet();
    }
  }

  public int activeQueries() {
    return maxConcurrentQueries - slots.availablePermits();
  }

  public int queuedQueries() {
    return queued.get();
  }

  /** Most queries seen running at once. */
  public int peakActiveQueries() {
    return peakActive.get();
  }

  private QuerySlot granted(String queryId) {
    peakActive.accumulateAndGet(activeQueries(), Math::max);
    log.debug("Query {} admitted, {} queries running", queryId, activeQueries());
    return new QuerySlot(queryId, slots);
  }

  private boolean memoryExhausted() {
    if (maxMemoryBytes <= 0) {
      return false;
    }
    long used = usedMemory.getAsLong();
    if (used >= maxMemoryBytes) {
      log.debug("Heap in use {} bytes is at the limit of {}", used, maxMemoryBytes);
      return true;
    }
    return false;
  }

  private static long heapInUse() {
    Runtime runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }
}
