/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.exchange.PartitionChannel;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.progress.ExecutionStatistics;
import org.lakehouse.query.execution.progress.ProgressHandler;
import org.lakehouse.query.execution.progress.ProgressSnapshot;
import org.lakehouse.query.execution.progress.ProgressState;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.engine.ExecutionContext;
import org.lakehouse.query.executor.monitor.Recommendation;

/**
 * Caller's view of one submitted query. Results are pulled lazily through {@link #results()};
 * the query runs on its own thread and blocks once the caller falls behind, except for streaming
 * queries, which drop their oldest unread results instead.
 */
@Log4j2
public class ExecutionHandle {

  private static final long POLL_MILLIS = 50L;

  @Getter private final String queryId;

  @Getter(AccessLevel.PACKAGE)
  private final ExecutionContext context;

  @Getter(AccessLevel.PACKAGE)
  private final PartitionChannel resultChannel;

  private final CountDownLatch done = new CountDownLatch(1);
  private final AtomicBoolean resultsTaken = new AtomicBoolean(false);
  private volatile QueryFailure failure;
  private volatile List<Recommendation> recommendations = List.of();

  ExecutionHandle(ExecutionContext context, PartitionChannel resultChannel) {
    this.queryId = context.getQueryId();
    this.context = context;
    this.resultChannel = resultChannel;
  }

  /**
   * Returns the result rows. Finite for bounded queries; a streaming query yields rows until it is
   * cancelled. The sequence can be consumed only once.
   *
   * @throws IllegalStateException if called a second time
   */
  public Iterator<List<Object>> results() {
    if (!resultsTaken.compareAndSet(false, true)) {
      throw new IllegalStateException("Results of query " + queryId + " were already consumed");
    }
    return new ResultIterator();
  }

  public ProgressSnapshot progress() {
    return context.getProgressTracker().snapshot();
  }

  /** Requests cancellation. Workers stop at their next check; rows already queued stay readable. */
  public void cancel() {
    if (context.getCancellationToken().cancel()) {
      log.info("Query {} cancellation requested", queryId);
    }
  }

  public ProgressState status() {
    return context.getProgressTracker().getState();
  }

  public Optional<QueryFailure> failure() {
    return Optional.ofNullable(failure);
  }

  /** Pauses progress accounting and notifications; execution itself continues. */
  public void pause() {
    context.getProgressTracker().pause();
  }

  public void resume() {
    context.getProgressTracker().resume();
  }

  /**
   * Waits for the query to end.
   *
   * @return true if it ended within the timeout
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Tuning advice for a query that completed or was cancelled. Empty until then. */
  public List<Recommendation> recommendations() {
    return recommendations;
  }

  public ExecutionStatistics statistics() {
    return context.getStatistics();
  }

  public ExecutionStrategy strategy() {
    return context.getPlan().getStrategy();
  }

  public void registerProgressHandler(ProgressHandler handler) {
    context.getProgressTracker().registerHandler(handler);
  }

  void markFailed(QueryFailure failure) {
    this.failure = failure;
  }

  void setRecommendations(List<Recommendation> recommendations) {
    this.recommendations = List.copyOf(recommendations);
  }

  void markDone() {
    done.countDown();
  }

  private class ResultIterator implements Iterator<List<Object>> {

    private final Deque<List<Object>> buffered = new ArrayDeque<>();

    @Override
    public boolean hasNext() {
      while (buffered.isEmpty()) {
        Page page;
        try {
          page = resultChannel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new QueryCancelledException(queryId);
        }
        if (page != null) {
          for (int position = 0; position < page.getPositionCount(); position++) {
            buffered.add(page.getRow(position));
          }
        } else if (resultChannel.isFinished()) {
          if (failure != null) {
            throw new QueryFailedException(queryId, failure);
          }
          return false;
        }
      }
      return true;
    }

    @Override
    public List<Object> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffered.poll();
    }
  }
}
