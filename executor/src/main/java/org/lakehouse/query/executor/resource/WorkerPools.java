/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Worker pools owned by one query: a bounded pool for I/O-bound work such as scans and a pool
 * sized to the available cores for CPU-bound work such as join probes and aggregation. Torn down
 * when the query ends.
 */
@Log4j2
public class WorkerPools implements AutoCloseable {

  @Getter private final ExecutorService ioPool;
  @Getter private final ExecutorService cpuPool;
  private final String queryId;
  private final long shutdownTimeoutMillis;

  public WorkerPools(String queryId, int ioThreads, int cpuThreads, long shutdownTimeoutMillis) {
    this.queryId = queryId;
    this.shutdownTimeoutMillis = shutdownTimeoutMillis;
    this.ioPool = newPool(ioThreads, "query-" + queryId + "-io-%d");
    this.cpuPool = newPool(cpuThreads, "query-" + queryId + "-cpu-%d");
  }

  private static ExecutorService newPool(int threads, String nameFormat) {
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build());
  }

  /**
   * Stops accepting work and waits up to the shutdown timeout for running tasks. Tasks still
   * running afterwards are left to finish on their own.
   */
  @Override
  public void close() {
    ioPool.shutdown();
    cpuPool.shutdown();
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownTimeoutMillis);
    try {
      boolean terminated =
          ioPool.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)
              && cpuPool.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);
      if (!terminated) {
        log.warn(
            "Worker pools of query {} did not terminate within {} ms",
            queryId,
            shutdownTimeoutMillis);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while shutting down worker pools of query {}", queryId);
    }
  }

  public boolean isTerminated() {
    return ioPool.isTerminated() && cpuPool.isTerminated();
  }

  private static long remaining(long deadline) {
    return Math.max(0, deadline - System.nanoTime());
  }
}
