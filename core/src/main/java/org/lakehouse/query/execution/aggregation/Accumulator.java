/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.aggregation;

import java.util.List;

/**
 * Mergeable partial state of one aggregate function over one group. Merging is associative and
 * commutative, so partial accumulators built by any partitioning of the input merge to the same
 * result as a single accumulator over the whole input.
 */
public interface Accumulator {

  /** Folds one input value into the state. Ignored for nulls except by COUNT(*). */
  void add(Object value);

  /** Folds another accumulator of the same function into this one. */
  void merge(Accumulator other);

  /** Returns the final value. Null if no non-null input was seen, except for COUNT. */
  Object result();

  /** Returns the state as plain values for checkpointing. */
  List<Object> state();

  /** Replaces the state with one returned by {@link #state()}. */
  void restore(List<Object> state);
}
