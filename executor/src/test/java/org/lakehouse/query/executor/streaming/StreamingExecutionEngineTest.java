/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.fault.InMemoryCheckpointStore;
import org.lakehouse.query.execution.plan.AggregateCall;
import org.lakehouse.query.execution.plan.FilterCondition;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.progress.ProgressState;
import org.lakehouse.query.execution.storage.InMemoryLiveSource;
import org.lakehouse.query.execution.storage.InMemoryStorageEngine;
import org.lakehouse.query.executor.ExecutionHandle;
import org.lakehouse.query.executor.MutableClock;
import org.lakehouse.query.executor.QueryExecutionService;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.cache.InMemoryResultCache;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamingExecutionEngineTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final InMemoryLiveSource liveSource = new InMemoryLiveSource();
  private final MutableClock clock = new MutableClock(0);
  private QueryExecutionService service;

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.close();
    }
  }

  private void start(ExecutionSettings settings) {
    service =
        new QueryExecutionService(
            settings,
            new InMemoryStorageEngine(),
            liveSource,
            new InMemoryResultCache(100, clock),
            new InMemoryCheckpointStore(1),
            clock);
  }

  private void awaitSubscribers(String streamId, int count) throws InterruptedException {
    long deadline = System.nanoTime() + TIMEOUT.toNanos();
    while (liveSource.subscriberCount(streamId) < count) {
      assertTrue(System.nanoTime() < deadline, "no subscriber on " + streamId);
      Thread.sleep(5);
    }
  }

  private static PlanNode clicks() {
    return PlanNode.streamSource("src", "clicks", List.of("user", "value"));
  }

  @Test
  void should_emit_tumbling_window_counts_and_flush_on_cancel() throws Exception {
    // Given
    start(ExecutionSettings.defaults());
    PlanNode plan =
        PlanNode.windowAggregate(
            "win", clicks(), List.of(), List.of(AggregateCall.countAll("cnt")), 5_000, 5_000);
    ExecutionHandle handle = service.submit(plan);
    awaitSubscribers("clicks", 1);

    // When
    for (long ts = 0; ts <= 11_000; ts += 1_000) {
      liveSource.emit("clicks", ts, List.of("u" + ts, 1));
    }
    liveSource.emit("clicks", 3_000, List.of("late", 1));
    handle.cancel();
    List<List<Object>> rows = ImmutableList.copyOf(handle.results());
    assertTrue(handle.awaitCompletion(TIMEOUT));

    // Then
    assertEquals(ExecutionStrategy.STREAMING, handle.strategy());
    assertEquals(
        List.of(
            List.of(0L, 5_000L, 5L), List.of(5_000L, 10_000L, 5L), List.of(10_000L, 15_000L, 2L)),
        rows);
    assertEquals(ProgressState.CANCELLED, handle.status());
    assertTrue(handle.failure().isEmpty());
    assertEquals(1, handle.statistics().getLateEvents());
    assertEquals(12, handle.statistics().getRowsRead());
    assertEquals(0, liveSource.subscriberCount("clicks"));
  }

  @Test
  void should_filter_events_before_delivering_them() throws Exception {
    // Given
    start(ExecutionSettings.defaults());
    PlanNode plan =
        PlanNode.filter(
            "filter",
            clicks(),
            List.of(new FilterCondition("value", FilterCondition.Comparison.GT, 10)));
    ExecutionHandle handle = service.submit(plan);
    awaitSubscribers("clicks", 1);

    // When
    liveSource.emit("clicks", 1, List.of("a", 5));
    liveSource.emit("clicks", 2, List.of("b", 50));
    liveSource.emit("clicks", 3, List.of("c", 11));
    handle.cancel();

    // Then
    assertEquals(
        List.of(List.of("b", 50), List.of("c", 11)), ImmutableList.copyOf(handle.results()));
  }

  @Test
  void should_drop_the_oldest_results_when_the_caller_falls_behind() throws Exception {
    // Given
    start(ExecutionSettings.builder().channelCapacity(2).build());
    ExecutionHandle handle = service.submit(clicks());
    awaitSubscribers("clicks", 1);

    // When
    for (int i = 0; i < 5; i++) {
      liveSource.emit("clicks", i, List.of("u" + i, i));
    }
    handle.cancel();
    List<List<Object>> rows = ImmutableList.copyOf(handle.results());
    assertTrue(handle.awaitCompletion(TIMEOUT));

    // Then
    assertEquals(List.of(List.of("u3", 3), List.of("u4", 4)), rows);
    assertEquals(5, handle.statistics().getRowsProduced());
  }

  @Test
  void should_offload_probes_against_a_large_window() throws Exception {
    // Given
    start(ExecutionSettings.builder().offloadThreshold(1).build());
    PlanNode plan =
        PlanNode.streamJoin(
            "join",
            PlanNode.streamSource("views", "views", List.of("user", "page")),
            PlanNode.streamSource("orders", "orders", List.of("buyer", "item")),
            List.of("user"),
            List.of("buyer"),
            1_000);
    ExecutionHandle handle = service.submit(plan);
    awaitSubscribers("views", 1);
    awaitSubscribers("orders", 1);
    Iterator<List<Object>> results = handle.results();

    // When
    liveSource.emit("orders", 100, List.of("u1", "book"));
    liveSource.emit("orders", 200, List.of("u1", "pen"));
    liveSource.emit("orders", 300, List.of("u2", "ink"));
    liveSource.emit("views", 400, List.of("u1", "home"));

    // Then
    assertEquals(List.of("u1", "home", "u1", "book"), results.next());
    assertEquals(List.of("u1", "home", "u1", "pen"), results.next());
    handle.cancel();
    assertFalse(results.hasNext());
    assertTrue(handle.awaitCompletion(TIMEOUT));
    assertEquals(1, handle.statistics().getOffloadedBatches());
  }
}
