/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.fault;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.MutableClock;
import org.lakehouse.query.execution.error.ErrorKind;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FailureDetectorTest {

  private final MutableClock clock = new MutableClock(0);
  private final FailureDetector detector = new FailureDetector(3, 1_000, clock);

  @Test
  void should_mark_permanent_after_threshold_failures_in_window() {
    assertFalse(detector.recordFailure("scan", ErrorKind.TRANSIENT));
    clock.advance(100);
    assertFalse(detector.recordFailure("scan", ErrorKind.TRANSIENT));
    clock.advance(100);

    assertTrue(detector.recordFailure("scan", ErrorKind.FATAL));
    assertTrue(detector.isPermanentlyFailed("scan"));
    assertFalse(detector.isPermanentlyFailed("agg"));
  }

  @Test
  void should_forget_failures_outside_window() {
    // Given
    detector.recordFailure("scan", ErrorKind.TRANSIENT);
    detector.recordFailure("scan", ErrorKind.TRANSIENT);

    // When
    clock.advance(1_000);

    // Then
    assertFalse(detector.recordFailure("scan", ErrorKind.TRANSIENT));
    FailureRecord record = detector.getRecord("scan").orElseThrow();
    assertEquals(1, record.getConsecutiveFailures());
    assertEquals(1_000, record.getLastFailureMillis());
  }

  @Test
  void should_reset_on_success() {
    for (int i = 0; i < 3; i++) {
      detector.recordFailure("scan", ErrorKind.TRANSIENT);
    }

    detector.recordSuccess("scan");

    assertFalse(detector.isPermanentlyFailed("scan"));
    assertTrue(detector.getRecord("scan").isEmpty());
  }
}
