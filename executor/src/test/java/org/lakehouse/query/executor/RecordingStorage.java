/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.storage.InMemoryStorageEngine;
import org.lakehouse.query.execution.storage.RowCursor;
import org.lakehouse.query.execution.storage.ScanRange;
import org.lakehouse.query.execution.storage.StorageEngine;

/** In-memory storage that records every scan it serves and can fail scans of one range. */
public class RecordingStorage implements StorageEngine {

  private final InMemoryStorageEngine delegate = new InMemoryStorageEngine();
  private final List<ScanRange> scannedRanges = new CopyOnWriteArrayList<>();
  private final AtomicInteger scans = new AtomicInteger();
  private volatile long failingRangeStart = -1;

  public RecordingStorage register(String table, List<List<Object>> rows) {
    delegate.register(table, rows);
    return this;
  }

  /** Makes every scan starting at {@code start} throw. */
  public RecordingStorage failScansStartingAt(long start) {
    this.failingRangeStart = start;
    return this;
  }

  @Override
  public long rowCount(PlanNode scanNode) {
    return delegate.rowCount(scanNode);
  }

  @Override
  public RowCursor scan(PlanNode scanNode, ScanRange range) {
    scans.incrementAndGet();
    scannedRanges.add(range);
    if (range.start() == failingRangeStart) {
      throw new IllegalStateException("disk gone");
    }
    return delegate.scan(scanNode, range);
  }

  public List<ScanRange> getScannedRanges() {
    return List.copyOf(scannedRanges);
  }

  public int getScans() {
    return scans.get();
  }
}
