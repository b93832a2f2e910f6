/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResourceManagerTest {

  private final ResourceManager resourceManager = new ResourceManager(8);

  @Test
  void should_reserve_workers_from_the_budget() {
    // When
    WorkerReservation reservation = resourceManager.tryReserve("q1", 6).orElseThrow();

    // Then
    assertEquals("q1", reservation.getQueryId());
    assertEquals(6, reservation.getWorkers());
    assertEquals(2, resourceManager.availableWorkers());
    assertTrue(resourceManager.tryReserve("q2", 3).isEmpty());
    assertTrue(resourceManager.tryReserve("q2", 2).isPresent());
  }

  @Test
  void should_release_a_reservation_exactly_once() {
    // Given
    WorkerReservation reservation = resourceManager.tryReserve("q1", 5).orElseThrow();

    // When
    reservation.close();
    reservation.close();

    // Then
    assertTrue(reservation.isReleased());
    assertEquals(8, resourceManager.availableWorkers());
  }

  @Test
  void should_refuse_more_workers_than_the_whole_budget() {
    // When
    Optional<WorkerReservation> reservation = resourceManager.tryReserve("q1", 9);

    // Then
    assertTrue(reservation.isEmpty());
    assertEquals(8, resourceManager.availableWorkers());
  }

  @Test
  void should_terminate_worker_pools_on_close() throws Exception {
    // Given
    WorkerPools pools = new WorkerPools("q1", 2, 2, 1_000);
    pools.getIoPool().submit(() -> "io").get();
    pools.getCpuPool().submit(() -> "cpu").get();

    // When
    pools.close();

    // Then
    assertTrue(pools.isTerminated());
    assertTrue(pools.getIoPool().isShutdown());
  }

  @Test
  void should_not_report_open_pools_as_terminated() {
    // Given
    WorkerPools pools = new WorkerPools("q1", 1, 1, 1_000);

    try {
      // Then
      assertFalse(pools.isTerminated());
    } finally {
      pools.close();
    }
  }
}
