/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.error.QueryCancelledException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CancellationTokenTest {

  @Test
  void should_propagate_cancellation_to_children_only() {
    CancellationToken parent = new CancellationToken();
    CancellationToken child = parent.child();

    assertTrue(child.cancel());
    assertFalse(parent.isCancelled());

    CancellationToken sibling = parent.child();
    parent.cancel();
    assertTrue(sibling.isCancelled());
  }

  @Test
  void should_report_first_cancel_only() {
    CancellationToken token = new CancellationToken();

    assertTrue(token.cancel());
    assertFalse(token.cancel());
  }

  @Test
  void should_throw_with_operator_id_once_cancelled() throws InterruptedException {
    CancellationToken token = new CancellationToken();
    assertFalse(token.awaitCancellation(10, TimeUnit.MILLISECONDS));
    token.throwIfCancelled("scan");

    token.cancel();

    assertTrue(token.awaitCancellation(10, TimeUnit.MILLISECONDS));
    QueryCancelledException e =
        assertThrows(QueryCancelledException.class, () -> token.throwIfCancelled("scan"));
    assertEquals("scan", e.getOperatorId());
  }
}
