/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.storage;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.lakehouse.query.execution.plan.PlanNode;

/**
 * {@link StorageEngine} over rows held in memory. Tables are registered up front; index scans read
 * the rows registered under the index name when present and fall back to the table otherwise.
 */
public class InMemoryStorageEngine implements StorageEngine {

  private final Map<String, List<List<Object>>> tables = new ConcurrentHashMap<>();

  /** Registers (or replaces) a table or index under the given name. */
  public InMemoryStorageEngine register(String name, List<List<Object>> rows) {
    tables.put(name, ImmutableList.copyOf(rows));
    return this;
  }

  @Override
  public long rowCount(PlanNode scanNode) {
    return rowsFor(scanNode).size();
  }

  @Override
  public RowCursor scan(PlanNode scanNode, ScanRange range) {
    List<List<Object>> rows = rowsFor(scanNode);
    int start = (int) Math.min(range.start(), rows.size());
    int end = (int) Math.min(range.end(), rows.size());
    return RowCursor.of(rows.subList(start, end).iterator());
  }

  private List<List<Object>> rowsFor(PlanNode scanNode) {
    if (scanNode.getAccessPath() != null) {
      List<List<Object>> indexed = tables.get(scanNode.getAccessPath().indexName());
      if (indexed != null) {
        return indexed;
      }
    }
    List<List<Object>> rows = tables.get(scanNode.getTable());
    if (rows == null) {
      throw new IllegalArgumentException("Unknown table: " + scanNode.getTable());
    }
    return rows;
  }
}
