/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.plan;

/** Operator kinds that can appear in an optimized plan. */
public enum PlanNodeType {
  TABLE_SCAN(true, false),
  INDEX_SCAN(true, false),
  FILTER(false, false),
  PROJECT(false, false),
  HASH_JOIN(false, false),
  AGGREGATE(false, false),
  SORT(false, false),
  LIMIT(false, false),

  /** Live, unbounded source. Any plan containing one is continuous. */
  STREAM_SOURCE(true, true),
  WINDOW_AGGREGATE(false, true),
  STREAM_JOIN(false, true);

  private final boolean leaf;
  private final boolean streaming;

  PlanNodeType(boolean leaf, boolean streaming) {
    this.leaf = leaf;
    this.streaming = streaming;
  }

  public boolean isLeaf() {
    return leaf;
  }

  public boolean isStreaming() {
    return streaming;
  }

  /** Returns true for the bounded scan leaves that storage engines implement. */
  public boolean isScan() {
    return this == TABLE_SCAN || this == INDEX_SCAN;
  }
}
