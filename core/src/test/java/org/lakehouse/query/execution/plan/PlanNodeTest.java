/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanNodeTest {

  private final PlanNode orders =
      PlanNode.tableScan("orders", "orders", List.of("order_id", "customer", "amount"), 10_000);
  private final PlanNode customers =
      PlanNode.tableScan("customers", "customers", List.of("customer_id", "region"), 100);

  @Test
  void should_derive_join_and_aggregate_columns() {
    PlanNode join =
        PlanNode.hashJoin(
            "join", orders, customers, JoinType.INNER, List.of("customer"), List.of("customer_id"),
            10_000);
    PlanNode aggregate =
        PlanNode.aggregate(
            "agg",
            join,
            List.of("region"),
            List.of(
                AggregateCall.countAll("orders"),
                AggregateCall.of(AggregateFunction.SUM, "amount", "total")),
            10);

    assertEquals(
        List.of("order_id", "customer", "amount", "customer_id", "region"),
        join.getOutputColumns());
    assertEquals(List.of("region", "orders", "total"), aggregate.getOutputColumns());
    assertTrue(aggregate.isComplex());
    assertTrue(aggregate.containsJoinOrAggregation());
    assertEquals(10_100, aggregate.estimatedInputRows());
  }

  @Test
  void should_keep_only_left_columns_for_semi_join() {
    PlanNode semi =
        PlanNode.hashJoin(
            "semi", orders, customers, JoinType.SEMI, List.of("customer"), List.of("customer_id"),
            100);

    assertEquals(orders.getOutputColumns(), semi.getOutputColumns());
  }

  @Test
  void should_reject_unknown_columns() {
    assertThrows(
        IllegalArgumentException.class,
        () -> PlanNode.project("p", orders, List.of("missing")));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            PlanNode.filter(
                "f",
                orders,
                List.of(new FilterCondition("missing", FilterCondition.Comparison.EQ, 1))));
  }

  @Test
  void should_mark_plans_reading_streams_unbounded() {
    PlanNode stream = PlanNode.streamSource("events", "clicks", List.of("user", "ts"));
    PlanNode windowed =
        PlanNode.windowAggregate(
            "window", stream, List.of("user"), List.of(AggregateCall.countAll("n")), 5_000, 5_000);

    assertTrue(windowed.isUnbounded());
    assertFalse(orders.isUnbounded());
    assertEquals(
        List.of(PlanNode.WINDOW_START, PlanNode.WINDOW_END, "user", "n"),
        windowed.getOutputColumns());
  }

  @Test
  void should_compute_fan_out_from_the_largest_leaf() {
    PlanNode join =
        PlanNode.hashJoin(
            "join", orders, customers, JoinType.INNER, List.of("customer"), List.of("customer_id"),
            10_000);

    assertEquals(10, join.maxFanOut(1_000));
    assertEquals(1, customers.maxFanOut(1_000));
    assertEquals(1, PlanNode.tableScan("empty", "empty", List.of("a"), 0).maxFanOut(1_000));
  }

  @Test
  void should_compare_numbers_across_boxed_types() {
    assertEquals(0, FilterCondition.compareValues(5, 5L));
    assertTrue(FilterCondition.compareValues(2, 2.5) < 0);
    assertTrue(new FilterCondition("a", FilterCondition.Comparison.GE, 10).test(10L));
    assertFalse(new FilterCondition("a", FilterCondition.Comparison.EQ, 1).test(null));
  }

  @Test
  void should_fingerprint_equivalent_plans_identically() {
    PlanNode first =
        PlanNode.filter(
            "f1",
            PlanNode.tableScan("s1", "orders", List.of("order_id", "amount"), 10),
            List.of(new FilterCondition("amount", FilterCondition.Comparison.GT, 100)));
    PlanNode renamed =
        PlanNode.filter(
            "f2",
            PlanNode.tableScan("s2", "orders", List.of("order_id", "amount"), 10),
            List.of(new FilterCondition("amount", FilterCondition.Comparison.GT, 100)));
    PlanNode different =
        PlanNode.filter(
            "f1",
            PlanNode.tableScan("s1", "orders", List.of("order_id", "amount"), 10),
            List.of(new FilterCondition("amount", FilterCondition.Comparison.GT, 200)));

    assertEquals(PlanFingerprint.of(first), PlanFingerprint.of(renamed));
    assertNotEquals(PlanFingerprint.of(first), PlanFingerprint.of(different));
  }
}
