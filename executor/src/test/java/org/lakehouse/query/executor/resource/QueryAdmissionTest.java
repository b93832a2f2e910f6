/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.operator.CancellationToken;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryAdmissionTest {

  @Test
  void should_admit_queries_up_to_the_limit_without_waiting() {
    // Given
    QueryAdmission admission = new QueryAdmission(2, 0);

    // When
    QuerySlot first = admission.admit("q1", new CancellationToken());
    QuerySlot second = admission.admit("q2", new CancellationToken());

    // Then
    assertEquals(2, admission.activeQueries());
    assertEquals(0, admission.queuedQueries());
    assertEquals(2, admission.peakActiveQueries());
    first.close();
    first.close();
    assertTrue(first.isReleased());
    assertEquals(1, admission.activeQueries());
    second.close();
  }

  @Test
  void should_queue_a_query_until_a_slot_is_released() throws Exception {
    // Given
    QueryAdmission admission = new QueryAdmission(1, 0);
    QuerySlot running = admission.admit("q1", new CancellationToken());

    // When
    CompletableFuture<QuerySlot> waiting =
        CompletableFuture.supplyAsync(() -> admission.admit("q2", new CancellationToken()));
    awaitTrue(() -> admission.queuedQueries() == 1);

    // Then
    assertFalse(waiting.isDone());
    running.close();
    QuerySlot admitted = waiting.get(5, TimeUnit.SECONDS);
    assertEquals("q2", admitted.getQueryId());
    assertEquals(0, admission.queuedQueries());
    assertEquals(1, admission.activeQueries());
    admitted.close();
  }

  @Test
  void should_leave_the_queue_when_cancelled() throws Exception {
    // Given
    QueryAdmission admission = new QueryAdmission(1, 0);
    QuerySlot running = admission.admit("q1", new CancellationToken());
    CancellationToken token = new CancellationToken();
    CompletableFuture<QuerySlot> waiting =
        CompletableFuture.supplyAsync(() -> admission.admit("q2", token));
    awaitTrue(() -> admission.queuedQueries() == 1);

    // When
    token.cancel();

    // Then
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
    assertInstanceOf(QueryCancelledException.class, e.getCause());
    assertEquals(0, admission.queuedQueries());
    assertEquals(1, admission.activeQueries());
    running.close();
  }

  @Test
  void should_hold_queries_back_while_memory_is_over_the_limit() throws Exception {
    // Given
    AtomicLong used = new AtomicLong(2_000);
    QueryAdmission admission = new QueryAdmission(4, 1_000, used::get);

    // When
    CompletableFuture<QuerySlot> waiting =
        CompletableFuture.supplyAsync(() -> admission.admit("q1", new CancellationToken()));
    awaitTrue(() -> admission.queuedQueries() == 1);

    // Then
    assertThrows(TimeoutException.class, () -> waiting.get(200, TimeUnit.MILLISECONDS));
    used.set(500);
    waiting.get(5, TimeUnit.SECONDS).close();
    assertEquals(0, admission.activeQueries());
  }

  @Test
  void should_reject_an_already_cancelled_query() {
    // Given
    CancellationToken token = new CancellationToken();
    token.cancel();

    // Then
    assertThrows(
        QueryCancelledException.class, () -> new QueryAdmission(1, 0).admit("q1", token));
  }

  private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not reached in time");
      Thread.sleep(10);
    }
  }
}
