/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.security;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.InMemoryStorageEngine;
import org.lakehouse.query.execution.storage.RowCursor;
import org.lakehouse.query.execution.storage.ScanRange;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MaskingStorageEngineTest {

  private static final PlanNode PEOPLE =
      PlanNode.tableScan("people", "people", List.of("name", "ssn", "salary"), 2);

  private final InMemoryStorageEngine storage = new InMemoryStorageEngine();
  private final QueryAuthorizer authorizer =
      new QueryAuthorizer(
          SecurityPolicy.builder()
              .columnLevel("ssn", AccessLevel.RESTRICTED)
              .columnLevel("salary", AccessLevel.CONFIDENTIAL)
              .build());

  MaskingStorageEngineTest() {
    storage.register(
        "people", List.of(List.of("ann", "123-45", 5_000), List.of("bob", "678-90", 7_000)));
  }

  @Test
  void should_mask_the_columns_above_the_identity_clearance() {
    // Given
    MaskingStorageEngine engine =
        new MaskingStorageEngine(
            storage, authorizer, SecurityIdentity.of("ana", Set.of(), AccessLevel.INTERNAL));

    // When
    List<List<Object>> rows = read(engine, new ScanRange(0, 2));

    // Then
    assertEquals(
        List.of(Arrays.asList("ann", "******", null), Arrays.asList("bob", "******", null)), rows);
    assertEquals(2, engine.rowCount(PEOPLE));
  }

  @Test
  void should_pass_rows_through_for_a_cleared_identity() {
    // Given
    MaskingStorageEngine engine =
        new MaskingStorageEngine(
            storage, authorizer, SecurityIdentity.of("root", Set.of(), AccessLevel.RESTRICTED));

    // Then
    assertEquals(List.of(List.of("bob", "678-90", 7_000)), read(engine, new ScanRange(1, 2)));
  }

  private static List<List<Object>> read(MaskingStorageEngine engine, ScanRange range) {
    try (RowCursor cursor = engine.scan(PEOPLE, range)) {
      return ImmutableList.copyOf(cursor);
    }
  }
}
