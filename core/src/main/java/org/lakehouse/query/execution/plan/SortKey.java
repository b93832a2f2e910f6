/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

/** Represents a sort key with column name, direction, and null ordering. */
public record SortKey(String column, boolean descending, boolean nullsLast) {

  public static SortKey ascending(String column) {
    return new SortKey(column, false, true);
  }

  public static SortKey descending(String column) {
    return new SortKey(column, true, true);
  }

  @Override
  public String toString() {
    return column + (descending ? " DESC" : " ASC") + (nullsLast ? " NULLS LAST" : " NULLS FIRST");
  }
}
