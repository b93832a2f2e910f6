/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.monitor;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lakehouse.query.execution.progress.ExecutionStatistics;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.bridge.MonitoringHook;
import org.lakehouse.query.executor.bridge.OptimizedPlan;

/** What the analyzer knows about one finished query run. */
@Getter
@Builder
@ToString
public class QueryProfile {

  private final String queryId;
  private final ExecutionStrategy strategy;
  @Builder.Default private final List<MonitoringHook> monitoringHooks = List.of();
  private final long estimatedRows;
  private final long rowsRead;
  private final long elapsedMillis;
  private final long strategySwitches;
  private final long droppedEvents;
  private final long lateEvents;

  /** Result cache lookups of the service so far. */
  private final long cacheHits;

  private final long cacheMisses;

  public static QueryProfileBuilder of(
      String queryId, OptimizedPlan plan, ExecutionStatistics statistics, long elapsedMillis) {
    return QueryProfile.builder()
        .queryId(queryId)
        .strategy(plan.getStrategy())
        .monitoringHooks(plan.getMonitoringHooks())
        .estimatedRows(plan.getRoot().isUnbounded() ? 0 : plan.getRoot().estimatedInputRows())
        .rowsRead(statistics.getRowsRead())
        .elapsedMillis(elapsedMillis)
        .strategySwitches(statistics.getStrategySwitches())
        .droppedEvents(statistics.getDroppedEvents())
        .lateEvents(statistics.getLateEvents());
  }

  public boolean hasHook(MonitoringHook hook) {
    return monitoringHooks.contains(hook);
  }
}
