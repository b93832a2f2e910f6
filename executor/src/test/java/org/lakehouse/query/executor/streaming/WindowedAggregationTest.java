/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.plan.AggregateCall;
import org.lakehouse.query.execution.plan.AggregateFunction;
import org.lakehouse.query.execution.plan.PlanNode;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WindowedAggregationTest {

  private PlanNode node;
  private WindowedAggregation aggregation;

  /** Hopping windows of 10 ms every 5 ms, counting and summing per user. */
  @BeforeEach
  void setUp() {
    PlanNode source = PlanNode.streamSource("src", "clicks", List.of("user", "value"));
    node =
        PlanNode.windowAggregate(
            "win",
            source,
            List.of("user"),
            List.of(
                AggregateCall.countAll("cnt"),
                AggregateCall.of(AggregateFunction.SUM, "value", "total")),
            10,
            5);
    aggregation = new WindowedAggregation(node);
    aggregation.add(12, List.of("a", 1));
    aggregation.add(13, List.of("b", 2));
    aggregation.add(17, List.of("a", 4));
  }

  @Test
  void should_assign_an_event_to_every_window_containing_it() {
    assertEquals(3, aggregation.openWindowCount());
  }

  @Test
  void should_emit_windows_once_time_reaches_their_end() {
    // When
    List<List<Object>> closed = aggregation.closeUpTo(15);

    // Then
    assertEquals(
        List.of(List.of(5L, 15L, "a", 1L, 1L), List.of(5L, 15L, "b", 1L, 2L)), closed);
    assertEquals(2, aggregation.openWindowCount());
    assertTrue(aggregation.closeUpTo(15).isEmpty());
    assertEquals(15, aggregation.getClosedUpToMillis());
  }

  @Test
  void should_drop_events_whose_windows_were_all_emitted() {
    // Given
    aggregation.closeUpTo(15);

    // When
    boolean late = !aggregation.add(8, List.of("a", 100));
    boolean onTime = aggregation.add(12, List.of("c", 7));

    // Then
    assertTrue(late);
    assertTrue(onTime);
    assertEquals(1, aggregation.getLateEvents());
    assertEquals(
        List.of(
            List.of(10L, 20L, "a", 2L, 5L),
            List.of(10L, 20L, "b", 1L, 2L),
            List.of(10L, 20L, "c", 1L, 7L)),
        aggregation.closeUpTo(20));
  }

  @Test
  void should_flush_incomplete_windows_oldest_first() {
    // Given
    aggregation.closeUpTo(15);

    // When
    List<List<Object>> flushed = aggregation.flush();

    // Then
    assertEquals(
        List.of(
            List.of(10L, 20L, "a", 2L, 5L),
            List.of(10L, 20L, "b", 1L, 2L),
            List.of(15L, 25L, "a", 1L, 4L)),
        flushed);
    assertEquals(0, aggregation.openWindowCount());
    assertEquals(25, aggregation.getClosedUpToMillis());
    assertFalse(aggregation.add(14, List.of("a", 1)));
  }

  @Test
  void should_resume_from_a_snapshot() {
    // Given
    aggregation.closeUpTo(15);
    WindowedAggregation restored = new WindowedAggregation(node);

    // When
    restored.restore(aggregation.snapshot());
    restored.add(18, List.of("b", 3));

    // Then
    assertEquals(15, restored.getClosedUpToMillis());
    assertEquals(
        List.of(
            List.of(10L, 20L, "a", 2L, 5L),
            List.of(10L, 20L, "b", 2L, 5L),
            List.of(15L, 25L, "a", 1L, 4L),
            List.of(15L, 25L, "b", 1L, 3L)),
        restored.closeUpTo(25));
  }
}
