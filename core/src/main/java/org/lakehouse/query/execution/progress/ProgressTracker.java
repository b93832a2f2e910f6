/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.progress;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.log4j.Log4j2;

/**
 * Tracks how far a query got and notifies handlers every {@code intervalRows} rows or {@code
 * intervalMillis}, whichever comes first, and on every state change. Rows are recorded
 * concurrently by the partitions of a parallel query.
 *
 * <p>The reported percentage is rows processed over the optimizer's estimate, clamped to [0, 100],
 * and never decreases. The estimate is not corrected mid-run. While paused, rows are still counted
 * but no notifications are sent.
 *
 * <p>Handlers see snapshots one at a time and in the order they were taken. A snapshot that loses
 * the race to a newer one is dropped rather than delivered late.
 */
@Log4j2
public class ProgressTracker {

  private final String queryId;
  private final long estimatedTotalRows;
  private final long intervalRows;
  private final long intervalMillis;
  private final Clock clock;
  private final List<ProgressHandler> handlers = new CopyOnWriteArrayList<>();
  private final Object deliveryLock = new Object();

  private ProgressState state = ProgressState.PENDING;
  private String phase = "pending";
  private long rowsProcessed;
  private double percent;
  private long startMillis;
  private long pausedMillis;
  private long pausedSince;
  private long endMillis;
  private long rowsAtLastNotification;
  private long lastNotificationMillis;
  private long sequence;

  /** Guarded by {@link #deliveryLock}. */
  private long deliveredSequence;

  public ProgressTracker(
      String queryId,
      long estimatedTotalRows,
      long intervalRows,
      long intervalMillis,
      Clock clock) {
    this.queryId = queryId;
    this.estimatedTotalRows = Math.max(0, estimatedTotalRows);
    this.intervalRows = intervalRows;
    this.intervalMillis = intervalMillis;
    this.clock = clock;
  }

  public void registerHandler(ProgressHandler handler) {
    handlers.add(handler);
  }

  public void start() {
    Sequenced snapshot;
    synchronized (this) {
      if (state != ProgressState.PENDING) {
        return;
      }
      startMillis = clock.millis();
      lastNotificationMillis = startMillis;
      state = ProgressState.RUNNING;
      snapshot = new Sequenced(++sequence, snapshotLocked());
    }
    notifyHandlers(snapshot);
  }

  /** Adds source rows read. */
  public void recordRows(long rows) {
    Sequenced snapshot = null;
    synchronized (this) {
      if (state.isTerminal() || rows <= 0) {
        return;
      }
      rowsProcessed += rows;
      if (state == ProgressState.RUNNING && notificationDue()) {
        snapshot = new Sequenced(++sequence, snapshotLocked());
      }
    }
    if (snapshot != null) {
      notifyHandlers(snapshot);
    }
  }

  /** Names the current phase of execution. */
  public synchronized void setPhase(String phase) {
    this.phase = phase;
  }

  public void pause() {
    transition(ProgressState.PAUSED);
  }

  public void resume() {
    transition(ProgressState.RUNNING);
  }

  public void complete() {
    transition(ProgressState.COMPLETED);
  }

  public void fail() {
    transition(ProgressState.FAILED);
  }

  public void cancel() {
    transition(ProgressState.CANCELLED);
  }

  public synchronized ProgressState getState() {
    return state;
  }

  public synchronized ProgressSnapshot snapshot() {
    return snapshotLocked();
  }

  private void transition(ProgressState target) {
    Sequenced snapshot;
    synchronized (this) {
      if (state.isTerminal() || state == target || !allowed(target)) {
        return;
      }
      long now = clock.millis();
      if (state == ProgressState.PENDING) {
        startMillis = now;
      }
      if (state == ProgressState.PAUSED) {
        pausedMillis += now - pausedSince;
      }
      if (target == ProgressState.PAUSED) {
        pausedSince = now;
      }
      if (target.isTerminal()) {
        endMillis = now;
      }
      state = target;
      snapshot = new Sequenced(++sequence, snapshotLocked());
    }
    notifyHandlers(snapshot);
  }

  private boolean allowed(ProgressState target) {
    switch (target) {
      case PAUSED:
        return state == ProgressState.RUNNING;
      case RUNNING:
        return state == ProgressState.PAUSED;
      default:
        return true;
    }
  }

  private boolean notificationDue() {
    long now = clock.millis();
    if (rowsProcessed - rowsAtLastNotification >= intervalRows
        || now - lastNotificationMillis >= intervalMillis) {
      rowsAtLastNotification = rowsProcessed;
      lastNotificationMillis = now;
      return true;
    }
    return false;
  }

  private ProgressSnapshot snapshotLocked() {
    long elapsed = elapsedLocked();
    if (state == ProgressState.COMPLETED) {
      percent = 100.0;
    } else if (estimatedTotalRows > 0) {
      double raw = Math.min(100.0, rowsProcessed * 100.0 / estimatedTotalRows);
      percent = Math.max(percent, raw);
    }
    Long remaining = null;
    if (state == ProgressState.COMPLETED) {
      remaining = 0L;
    } else if (percent > 0 && !state.isTerminal()) {
      remaining = (long) (elapsed * (100.0 - percent) / percent);
    }
    return ProgressSnapshot.builder()
        .queryId(queryId)
        .state(state)
        .rowsProcessed(rowsProcessed)
        .estimatedTotalRows(estimatedTotalRows)
        .percentComplete(percent)
        .elapsedMillis(elapsed)
        .estimatedRemainingMillis(remaining)
        .phase(phase)
        .build();
  }

  private long elapsedLocked() {
    if (state == ProgressState.PENDING) {
      return 0;
    }
    long end = state.isTerminal() ? endMillis : clock.millis();
    long paused = pausedMillis + (state == ProgressState.PAUSED ? end - pausedSince : 0);
    return Math.max(0, end - startMillis - paused);
  }

  private void notifyHandlers(Sequenced sequenced) {
    synchronized (deliveryLock) {
      if (sequenced.sequence <= deliveredSequence) {
        return;
      }
      deliveredSequence = sequenced.sequence;
      for (ProgressHandler handler : handlers) {
        try {
          handler.onProgress(sequenced.snapshot);
        } catch (RuntimeException e) {
          log.warn("Progress handler of query {} failed", queryId, e);
        }
      }
    }
  }

  /** Snapshot numbered in the order it was taken under the tracker's lock. */
  private static final class Sequenced {
    private final long sequence;
    private final ProgressSnapshot snapshot;

    private Sequenced(long sequence, ProgressSnapshot snapshot) {
      this.sequence = sequence;
      this.snapshot = snapshot;
    }
  }
}
