/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import org.lakehouse.query.execution.plan.PlanNode;

/**
 * Leaf-operator implementation supplied by the vector, time-series and spatial storage engines.
 * The execution core partitions and fault-tolerance-wraps scans but never implements them.
 *
 * <p>Implementations must be thread-safe: parallel scans call {@link #scan} concurrently with
 * disjoint ranges.
 */
public interface StorageEngine {

  /**
   * Returns the exact number of rows the scan leaf produces. Range partitioning splits this count.
   *
   * @param scanNode a TABLE_SCAN or INDEX_SCAN node
   */
  long rowCount(PlanNode scanNode);

  /**
   * Opens a cursor over the rows at offsets {@code [range.start, range.end)} of the scan, honoring
   * the node's index access path. Rows are returned in the node's output column order, and a given
   * offset always addresses the same row so that a resumed scan continues where it stopped.
   *
   * @param scanNode a TABLE_SCAN or INDEX_SCAN node
   * @param range the rows to read
   * @return cursor over the rows
   */
  RowCursor scan(PlanNode scanNode, ScanRange range);
}
