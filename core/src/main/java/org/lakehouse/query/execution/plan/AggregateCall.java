/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import java.util.Objects;

/**
 * One aggregate in an AGGREGATE or WINDOW_AGGREGATE node.
 *
 * @param function the aggregate function
 * @param column input column, null for COUNT(*)
 * @param alias output column name
 */
public record AggregateCall(AggregateFunction function, String column, String alias) {

  public AggregateCall {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(alias, "alias");
    if (column == null && function != AggregateFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires an input column");
    }
  }

  public static AggregateCall countAll(String alias) {
    return new AggregateCall(AggregateFunction.COUNT, null, alias);
  }

  public static AggregateCall of(AggregateFunction function, String column, String alias) {
    return new AggregateCall(function, column, alias);
  }

  @Override
  public String toString() {
    return function + "(" + (column == null ? "*" : column) + ") AS " + alias;
  }
}
