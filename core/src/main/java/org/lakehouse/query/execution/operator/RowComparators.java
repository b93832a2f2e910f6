/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.operator;

import java.util.Comparator;
import java.util.List;
import org.lakehouse.query.execution.plan.FilterCondition;
import org.lakehouse.query.execution.plan.SortKey;

/** Builds row comparators from sort keys. */
public final class RowComparators {

  private RowComparators() {}

  public static Comparator<List<Object>> of(List<String> columns, List<SortKey> sortKeys) {
    Comparator<List<Object>> comparator = (a, b) -> 0;
    for (SortKey key : sortKeys) {
      int index = RowKeys.indicesOf(columns, List.of(key.column()))[0];
      comparator = comparator.thenComparing(byKey(index, key));
    }
    return comparator;
  }

  private static Comparator<List<Object>> byKey(int index, SortKey key) {
    return (a, b) -> {
      Object left = a.get(index);
      Object right = b.get(index);
      if (left == null || right == null) {
        if (left == right) {
          return 0;
        }
        // nulls placement is independent of the sort direction
        return (left == null) == key.nullsLast() ? 1 : -1;
      }
      int cmp = FilterCondition.compareValues(left, right);
      return key.descending() ? -cmp : cmp;
    };
  }
}
