/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.execution.progress;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** Counters of one query execution, updated concurrently by its workers. */
public class ExecutionStatistics {

  private final AtomicLong rowsRead = new AtomicLong();
  private final AtomicLong rowsProduced = new AtomicLong();
  private final AtomicLong partitions = new AtomicLong();
  private final AtomicLong strategySwitches = new AtomicLong();
  private final AtomicLong droppedEvents = new AtomicLong();
  private final AtomicLong lateEvents = new AtomicLong();
  private final AtomicLong offloadedBatches = new AtomicLong();

  public void addRowsRead(long rows) {
    rowsRead.addAndGet(rows);
  }

  public void addRowsProduced(long rows) {
    rowsProduced.addAndGet(rows);
  }

  public void addPartitions(long count) {
    partitions.addAndGet(count);
  }

  public void recordStrategySwitch() {
    strategySwitches.incrementAndGet();
  }

  public void addDroppedEvents(long count) {
    droppedEvents.addAndGet(count);
  }

  public void addLateEvents(long count) {
    lateEvents.addAndGet(count);
  }

  public void recordOffload() {
    offloadedBatches.incrementAndGet();
  }

  public long getRowsRead() {
    return rowsRead.get();
  }

  public long getRowsProduced() {
    return rowsProduced.get();
  }

  public long getPartitions() {
    return partitions.get();
  }

  public long getStrategySwitches() {
    return strategySwitches.get();
  }

  public long getDroppedEvents() {
    return droppedEvents.get();
  }

  public long getLateEvents() {
    return lateEvents.get();
  }

  public long getOffloadedBatches() {
    return offloadedBatches.get();
  }

  /** Returns the counters by name, for monitoring hooks. */
  public Map<String, Long> asMap() {
    Map<String, Long> values = new LinkedHashMap<>();
    values.put("rowsRead", getRowsRead());
    values.put("rowsProduced", getRowsProduced());
    values.put("partitions", getPartitions());
    values.put("strategySwitches", getStrategySwitches());
    values.put("droppedEvents", getDroppedEvents());
    values.put("lateEvents", getLateEvents());
    values.put("offloadedBatches", getOffloadedBatches());
    return values;
  }
}
