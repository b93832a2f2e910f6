/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.exchange;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import org.lakehouse.query.execution.error.FatalOperatorException;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.error.QueryExecutionException;
import org.lakehouse.query.execution.operator.CancellationToken;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.pipeline.PageSink;

/**
 * Bounded single-producer, single-consumer channel carrying the output pages of one partition to
 * the coordinator. A full channel blocks the producer, which is the back-pressure between
 * partitions and the gather step. The producer ends the channel with {@link #close()} or {@link
 * #fail(Throwable)}.
 */
public class PartitionChannel implements PageSink {

  private static final long POLL_MILLIS = 50L;

  @Getter private final String partitionId;
  private final BlockingQueue<Page> pages;
  private final CancellationToken cancellationToken;

  private volatile boolean closed;
  private volatile Throwable failure;

  public PartitionChannel(String partitionId, int capacity, CancellationToken cancellationToken) {
    this.partitionId = partitionId;
    this.pages = new ArrayBlockingQueue<>(capacity);
    this.cancellationToken = cancellationToken;
  }

  /** Enqueues a page, waiting while the channel is full. */
  @Override
  public void accept(Page page) {
    try {
      while (!pages.offer(page, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        cancellationToken.throwIfCancelled(partitionId);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryCancelledException(partitionId);
    }
  }

  /**
   * Enqueues a page without waiting. When the channel is full the oldest page is dropped to make
   * room.
   *
   * @return number of pages dropped
   */
  public int offerDroppingOldest(Page page) {
    int dropped = 0;
    while (!pages.offer(page)) {
      if (pages.poll() != null) {
        dropped++;
      }
    }
    return dropped;
  }

  /** Signals that no more pages will be enqueued. */
  public void close() {
    closed = true;
  }

  /** Ends the channel with a failure the consumer rethrows. */
  public void fail(Throwable cause) {
    failure = cause;
    closed = true;
  }

  /**
   * Returns the next page, or null if none arrived within the timeout.
   *
   * @throws QueryExecutionException the producer's failure, once all pages before it were taken
   */
  public Page poll(long timeout, TimeUnit unit) throws InterruptedException {
    Page page = pages.poll(timeout, unit);
    if (page == null && failure != null && pages.isEmpty()) {
      if (failure instanceof QueryExecutionException) {
        throw (QueryExecutionException) failure;
      }
      throw new FatalOperatorException(partitionId, String.valueOf(failure.getMessage()), failure);
    }
    return page;
  }

  /** Returns true once the producer closed the channel and every page was taken. */
  public boolean isFinished() {
    return closed && pages.isEmpty();
  }
}
