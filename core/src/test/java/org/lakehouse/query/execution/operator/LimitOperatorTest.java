/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.lakehouse.query.execution.operator.OperatorHarness.context;
import static org.lakehouse.query.execution.operator.OperatorHarness.run;
import static org.lakehouse.query.execution.operator.OperatorHarness.source;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.fault.snapshot.LimitState;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LimitOperatorTest {

  @Test
  void should_cut_page_at_limit_and_stop_source_early() {
    // Given
    RowsSourceOperator source = source(numbers(10), 1, 2);

    // When
    List<List<Object>> rows = run(source, new LimitOperator(5, context("limit", 2)));

    // Then
    assertEquals(numbers(5), rows);
    assertEquals(6, source.getPosition());
  }

  @Test
  void should_read_nothing_for_zero_limit() {
    RowsSourceOperator source = source(numbers(10), 1, 2);

    List<List<Object>> rows = run(source, new LimitOperator(0, context("limit", 2)));

    assertTrue(rows.isEmpty());
    assertEquals(0, source.getPosition());
  }

  @Test
  void should_pass_everything_when_input_is_shorter() {
    assertEquals(numbers(3), run(numbers(3), 1, 2, new LimitOperator(5, context("limit", 2))));
  }

  @Test
  void should_count_rows_emitted_before_restore() {
    // Given
    LimitOperator limit = new LimitOperator(5, context("limit", 2));
    limit.restoreState(new LimitState(3));

    // When
    List<List<Object>> rows = run(numbers(10), 1, 2, limit);

    // Then
    assertEquals(numbers(2), rows);
    assertEquals(5L, ((LimitState) limit.snapshotState()).getEmittedRows());
  }

  private static List<List<Object>> numbers(int count) {
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      rows.add(List.of(i));
    }
    return rows;
  }
}
