/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

import java.util.Objects;

/**
 * A single {@code column <op> literal} comparison. A FILTER node keeps rows that satisfy all of its
 * conditions. Null values never satisfy a comparison.
 */
public record FilterCondition(String column, Comparison comparison, Object value) {

  /** Supported comparison operators. */
  public enum Comparison {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    Comparison(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  public FilterCondition {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(comparison, "comparison");
  }

  /** Evaluates the condition against one column value. */
  public boolean test(Object rowValue) {
    if (rowValue == null || value == null) {
      return false;
    }
    int cmp = compareValues(rowValue, value);
    return switch (comparison) {
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
      case LT -> cmp < 0;
      case LE -> cmp <= 0;
      case GT -> cmp > 0;
      case GE -> cmp >= 0;
    };
  }

  /**
   * Compares two non-null values. Numbers compare by numeric value regardless of boxed type, other
   * values must be mutually {@link Comparable}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compareValues(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      if (isIntegral(left) && isIntegral(right)) {
        return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
      }
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable) left).compareTo(right);
    }
    return left.toString().compareTo(right.toString());
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  @Override
  public String toString() {
    return column + " " + comparison.getSymbol() + " " + value;
  }
}
