/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.aggregation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.lakehouse.query.execution.operator.RowKeys;
import org.lakehouse.query.execution.plan.AggregateCall;
import org.lakehouse.query.execution.plan.FilterCondition;

/** Accumulator implementations for COUNT, SUM, MIN, MAX and AVG. */
public final class Accumulators {

  private Accumulators() {}

  /** Creates an empty accumulator for an aggregate call. */
  public static Accumulator create(AggregateCall call) {
    return switch (call.function()) {
      case COUNT -> new Count(call.column() == null);
      case SUM -> new Sum();
      case MIN -> new Extreme(false);
      case MAX -> new Extreme(true);
      case AVG -> new Avg();
    };
  }

  static long asLong(Object value) {
    return ((Number) value).longValue();
  }

  static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  /** COUNT(*) counts every row, COUNT(column) only non-null values. */
  static final class Count implements Accumulator {
    private final boolean countAll;
    private long count;

    Count(boolean countAll) {
      this.countAll = countAll;
    }

    @Override
    public void add(Object value) {
      if (countAll || value != null) {
        count++;
      }
    }

    @Override
    public void merge(Accumulator other) {
      count += ((Count) other).count;
    }

    @Override
    public Object result() {
      return count;
    }

    @Override
    public List<Object> state() {
      return new ArrayList<>(List.of(count));
    }

    @Override
    public void restore(List<Object> state) {
      count = asLong(state.get(0));
    }
  }

  /**
   * Sums integral values exactly as longs and everything else as doubles. The result stays a Long
   * while only integral values were seen.
   */
  static final class Sum implements Accumulator {
    private long longSum;
    private double doubleSum;
    private boolean sawDouble;
    private boolean sawValue;

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      sawValue = true;
      if (isIntegral(value)) {
        longSum += asLong(value);
      } else {
        sawDouble = true;
        doubleSum += ((Number) value).doubleValue();
      }
    }

    @Override
    public void merge(Accumulator other) {
      Sum that = (Sum) other;
      longSum += that.longSum;
      doubleSum += that.doubleSum;
      sawDouble |= that.sawDouble;
      sawValue |= that.sawValue;
    }

    @Override
    public Object result() {
      if (!sawValue) {
        return null;
      }
      return sawDouble ? (Object) (doubleSum + longSum) : (Object) longSum;
    }

    @Override
    public List<Object> state() {
      return new ArrayList<>(Arrays.asList(longSum, doubleSum, sawDouble, sawValue));
    }

    @Override
    public void restore(List<Object> state) {
      longSum = asLong(state.get(0));
      doubleSum = ((Number) state.get(1)).doubleValue();
      sawDouble = (Boolean) state.get(2);
      sawValue = (Boolean) state.get(3);
    }
  }

  /**
   * MIN or MAX under {@link FilterCondition#compareValues}. Values are held in their {@link
   * RowKeys#normalize normalized} type, the type a checkpointed value decodes to.
   */
  static final class Extreme implements Accumulator {
    private final boolean max;
    private Object current;

    Extreme(boolean max) {
      this.max = max;
    }

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      value = RowKeys.normalize(value);
      if (current == null) {
        current = value;
        return;
      }
      int cmp = FilterCondition.compareValues(value, current);
      if (max ? cmp > 0 : cmp < 0) {
        current = value;
      }
    }

    @Override
    public void merge(Accumulator other) {
      add(((Extreme) other).current);
    }

    @Override
    public Object result() {
      return current;
    }

    @Override
    public List<Object> state() {
      return new ArrayList<>(Arrays.asList(current));
    }

    @Override
    public void restore(List<Object> state) {
      current = RowKeys.normalize(state.get(0));
    }
  }

  /** AVG keeps the sum and count of non-null values and always yields a Double. */
  static final class Avg implements Accumulator {
    private double sum;
    private long count;

    @Override
    public void add(Object value) {
      if (value == null) {
        return;
      }
      sum += ((Number) value).doubleValue();
      count++;
    }

    @Override
    public void merge(Accumulator other) {
      Avg that = (Avg) other;
      sum += that.sum;
      count += that.count;
    }

    @Override
    public Object result() {
      return count == 0 ? null : sum / count;
    }

    @Override
    public List<Object> state() {
      return new ArrayList<>(Arrays.asList(sum, count));
    }

    @Override
    public void restore(List<Object> state) {
      sum = ((Number) state.get(0)).doubleValue();
      count = asLong(state.get(1));
    }
  }
}
