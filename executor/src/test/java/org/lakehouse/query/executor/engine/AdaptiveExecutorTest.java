/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.fault.InMemoryCheckpointStore;
import org.lakehouse.query.execution.plan.AggregateCall;
import org.lakehouse.query.execution.plan.JoinType;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.SortKey;
import org.lakehouse.query.execution.storage.InMemoryLiveSource;
import org.lakehouse.query.executor.ExecutionHandle;
import org.lakehouse.query.executor.QueryExecutionService;
import org.lakehouse.query.executor.RecordingStorage;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.bridge.RuntimeHints;
import org.lakehouse.query.executor.cache.InMemoryResultCache;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class AdaptiveExecutorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private RecordingStorage storage;
  private QueryExecutionService service;

  /** Plans estimate 50 rows per table; a threshold of 100 rows makes real tables look large. */
  @BeforeEach
  void setUp() {
    List<List<Object>> customers = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      customers.add(List.of(i, "customer-" + i));
    }
    List<List<Object>> orders = new ArrayList<>();
    for (int i = 0; i < 1_000; i++) {
      orders.add(List.of(i, i % 100, i % 7));
    }
    storage =
        new RecordingStorage()
            .register("customers", customers)
            .register("orders", orders)
            .register("small_orders", orders.subList(0, 40));
    service =
        start(
            ExecutionSettings.builder()
                .maxParallelism(4)
                .pageSize(10)
                .parallelRowThreshold(100)
                .build());
  }

  private QueryExecutionService start(ExecutionSettings settings) {
    Clock clock = Clock.systemUTC();
    return new QueryExecutionService(
        settings,
        storage,
        new InMemoryLiveSource(),
        new InMemoryResultCache(100, clock),
        new InMemoryCheckpointStore(1),
        clock);
  }

  @AfterEach
  void tearDown() {
    service.close();
  }

  private static PlanNode orders(String table) {
    return PlanNode.tableScan(table, table, List.of("oid", "customer_id", "qty"), 50);
  }

  private static PlanNode countByQuantity(String table) {
    return PlanNode.aggregate(
        "agg", orders(table), List.of("qty"), List.of(AggregateCall.countAll("cnt")), 7);
  }

  private ExecutionHandle submit(PlanNode plan, ExecutionStrategy preferred) {
    return service.submit(
        plan,
        RuntimeHints.builder()
            .availableProcessors(4)
            .bypassCache(true)
            .preferredStrategy(preferred)
            .build());
  }

  private static List<List<Object>> drain(ExecutionHandle handle) throws InterruptedException {
    List<List<Object>> rows = ImmutableList.copyOf(handle.results());
    assertTrue(handle.awaitCompletion(TIMEOUT));
    return rows;
  }

  @Test
  void should_switch_to_parallel_when_observed_rows_exceed_the_threshold() throws Exception {
    // When
    ExecutionHandle handle = submit(countByQuantity("orders"), null);
    List<List<Object>> adaptive = drain(handle);

    // Then
    assertEquals(ExecutionStrategy.ADAPTIVE, handle.strategy());
    assertEquals(1, handle.statistics().getStrategySwitches());
    assertEquals(1_000, handle.statistics().getRowsRead());
    assertEquals(
        HashMultiset.create(drain(submit(countByQuantity("orders"), ExecutionStrategy.SERIAL))),
        HashMultiset.create(adaptive));
  }

  @Test
  void should_switch_when_a_table_estimated_within_one_page_turns_out_large() throws Exception {
    // Given
    List<List<Object>> orders = new ArrayList<>();
    for (int i = 0; i < 50_000; i++) {
      orders.add(List.of(i, i % 100, i % 7));
    }
    storage.register("big_orders", orders);
    service.close();
    service =
        start(ExecutionSettings.builder().maxParallelism(4).parallelRowThreshold(1_000).build());
    PlanNode plan =
        PlanNode.aggregate(
            "agg",
            PlanNode.tableScan(
                "big_orders", "big_orders", List.of("oid", "customer_id", "qty"), 500),
            List.of("qty"),
            List.of(AggregateCall.countAll("cnt")),
            7);

    // When
    ExecutionHandle handle = submit(plan, null);
    List<List<Object>> rows = drain(handle);

    // Then
    assertEquals(ExecutionStrategy.ADAPTIVE, handle.strategy());
    assertEquals(1, handle.statistics().getStrategySwitches());
    assertEquals(50_000, handle.statistics().getRowsRead());
    assertEquals(7, rows.size());
    assertEquals(50_000L, rows.stream().mapToLong(row -> (Long) row.get(1)).sum());
  }

  @Test
  void should_stay_serial_when_the_estimate_holds() throws Exception {
    // When
    ExecutionHandle handle = submit(countByQuantity("small_orders"), null);
    List<List<Object>> rows = drain(handle);

    // Then
    assertEquals(ExecutionStrategy.ADAPTIVE, handle.strategy());
    assertEquals(0, handle.statistics().getStrategySwitches());
    assertEquals(7, rows.size());
    assertEquals(40L, rows.stream().mapToLong(row -> (Long) row.get(1)).sum());
  }

  @Test
  void should_decide_again_at_every_boundary() throws Exception {
    // Given
    PlanNode plan =
        PlanNode.sort(
            "sort",
            PlanNode.hashJoin(
                "join",
                PlanNode.tableScan("customers", "customers", List.of("cid", "name"), 50),
                orders("orders"),
                JoinType.INNER,
                List.of("cid"),
                List.of("customer_id"),
                50),
            List.of(SortKey.ascending("oid")));

    // When
    ExecutionHandle handle = submit(plan, null);
    List<List<Object>> adaptive = drain(handle);

    // Then
    assertEquals(ExecutionStrategy.ADAPTIVE, handle.strategy());
    assertEquals(2, handle.statistics().getStrategySwitches());
    assertEquals(1_000, adaptive.size());
    assertEquals(drain(submit(plan, ExecutionStrategy.SERIAL)), adaptive);
  }
}
