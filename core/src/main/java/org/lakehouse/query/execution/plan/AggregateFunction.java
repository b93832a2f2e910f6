/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

/** Aggregate functions whose partial states merge associatively and commutatively. */
public enum AggregateFunction {
  COUNT,
  SUM,
  MIN,
  MAX,
  /** Weighted mean, carried as sum and count. */
  AVG
}
