/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.progress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.MutableClock;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ProgressTrackerTest {

  private final MutableClock clock = new MutableClock(10_000);
  private final ProgressTracker tracker = new ProgressTracker("q1", 1_000, 100, 1_000, clock);
  private final List<ProgressSnapshot> notifications = new ArrayList<>();

  @Test
  void should_notify_on_start_and_every_interval_rows() {
    // Given
    tracker.registerHandler(notifications::add);

    // When
    tracker.start();
    tracker.recordRows(50);
    tracker.recordRows(60);
    tracker.recordRows(10);

    // Then
    assertEquals(2, notifications.size());
    assertEquals(ProgressState.RUNNING, notifications.get(0).getState());
    assertEquals(110, notifications.get(1).getRowsProcessed());
    assertEquals(11.0, notifications.get(1).getPercentComplete(), 1e-9);
    assertEquals(120, tracker.snapshot().getRowsProcessed());
  }

  @Test
  void should_notify_when_interval_millis_elapse() {
    tracker.registerHandler(notifications::add);
    tracker.start();

    clock.advance(1_000);
    tracker.recordRows(1);

    assertEquals(2, notifications.size());
  }

  @Test
  void should_estimate_remaining_time_from_rate() {
    tracker.start();
    clock.advance(1_000);
    tracker.recordRows(250);

    ProgressSnapshot snapshot = tracker.snapshot();

    assertEquals(1_000, snapshot.getElapsedMillis());
    assertEquals(Duration.ofMillis(3_000), snapshot.getEstimatedRemaining().orElseThrow());
  }

  @Test
  void should_exclude_paused_time_from_elapsed() {
    // Given
    tracker.start();
    clock.advance(100);

    // When
    tracker.pause();
    clock.advance(500);
    assertEquals(100, tracker.snapshot().getElapsedMillis());
    tracker.resume();
    clock.advance(100);

    // Then
    assertEquals(ProgressState.RUNNING, tracker.getState());
    assertEquals(200, tracker.snapshot().getElapsedMillis());
  }

  @Test
  void should_cap_percent_when_estimate_is_exceeded_and_finish_at_hundred() {
    tracker.start();
    tracker.recordRows(5_000);
    assertEquals(100.0, tracker.snapshot().getPercentComplete(), 1e-9);

    tracker.complete();

    ProgressSnapshot done = tracker.snapshot();
    assertEquals(ProgressState.COMPLETED, done.getState());
    assertEquals(Duration.ZERO, done.getEstimatedRemaining().orElseThrow());
  }

  @Test
  void should_ignore_updates_after_terminal_state() {
    tracker.start();
    tracker.recordRows(10);
    tracker.cancel();

    tracker.recordRows(10);
    tracker.fail();
    tracker.resume();

    assertEquals(ProgressState.CANCELLED, tracker.getState());
    assertEquals(10, tracker.snapshot().getRowsProcessed());
  }

  @Test
  void should_report_no_percent_for_unknown_estimate() {
    ProgressTracker unbounded = new ProgressTracker("q2", 0, 100, 1_000, clock);
    unbounded.start();
    unbounded.recordRows(500);

    ProgressSnapshot snapshot = unbounded.snapshot();

    assertEquals(0.0, snapshot.getPercentComplete(), 1e-9);
    assertTrue(snapshot.getEstimatedRemaining().isEmpty());
  }

  @Test
  void should_keep_notifying_after_a_handler_fails() {
    tracker.registerHandler(
        snapshot -> {
          throw new IllegalStateException("handler bug");
        });
    tracker.registerHandler(notifications::add);

    tracker.start();
    tracker.complete();

    assertEquals(2, notifications.size());
    assertEquals(ProgressState.COMPLETED, notifications.get(1).getState());
  }

  @Test
  void should_deliver_non_decreasing_progress_to_handlers_under_concurrent_updates()
      throws InterruptedException {
    // Given: every row is due for a notification
    ProgressTracker concurrent = new ProgressTracker("q2", 80_000, 1, 1_000, clock);
    List<ProgressSnapshot> seen = Collections.synchronizedList(new ArrayList<>());
    concurrent.registerHandler(seen::add);
    concurrent.start();
    ExecutorService partitions = Executors.newFixedThreadPool(8);

    // When
    CountDownLatch ready = new CountDownLatch(1);
    for (int p = 0; p < 8; p++) {
      partitions.execute(
          () -> {
            Uninterruptibles.awaitUninterruptibly(ready);
            for (int i = 0; i < 10_000; i++) {
              concurrent.recordRows(1);
            }
          });
    }
    ready.countDown();
    partitions.shutdown();
    assertTrue(partitions.awaitTermination(30, TimeUnit.SECONDS));

    // Then
    List<ProgressSnapshot> delivered = new ArrayList<>(seen);
    for (int i = 1; i < delivered.size(); i++) {
      ProgressSnapshot previous = delivered.get(i - 1);
      ProgressSnapshot current = delivered.get(i);
      assertTrue(current.getRowsProcessed() > previous.getRowsProcessed());
      assertTrue(current.getPercentComplete() >= previous.getPercentComplete());
    }
    assertEquals(80_000, concurrent.snapshot().getRowsProcessed());
  }
}
