/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.monitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.bridge.MonitoringHook;

/**
 * Turns the profile of a finished query into tuning recommendations. Which rules apply follows the
 * monitoring hooks the strategy bridge attached to the plan.
 */
public class PerformanceAnalyzer {

  /** Rates of shorter runs are dominated by start-up cost. */
  static final long MIN_MEASURED_MILLIS = 100L;

  static final long MIN_CACHE_LOOKUPS = 10L;

  private final ExecutionSettings settings;

  public PerformanceAnalyzer(ExecutionSettings settings) {
    this.settings = settings;
  }

  public List<Recommendation> analyze(QueryProfile profile) {
    List<Recommendation> recommendations = new ArrayList<>();
    if (profile.hasHook(MonitoringHook.PERFORMANCE)
        && profile.getStrategy() != ExecutionStrategy.STREAMING
        && profile.getElapsedMillis() >= MIN_MEASURED_MILLIS) {
      double rowsPerSecond = profile.getRowsRead() * 1000.0 / profile.getElapsedMillis();
      if (rowsPerSecond < settings.getMinRowsPerSecond()) {
        recommendations.add(
            new Recommendation(
                RecommendationKind.LOW_THROUGHPUT,
                format(
                    "Read %.0f rows/s, below %d. Consider an index access path or a more"
                        + " selective filter",
                    rowsPerSecond,
                    settings.getMinRowsPerSecond())));
      }
    }

    long lookups = profile.getCacheHits() + profile.getCacheMisses();
    if (lookups >= MIN_CACHE_LOOKUPS) {
      double hitRatio = (double) profile.getCacheHits() / lookups;
      if (hitRatio < settings.getMinCacheHitRatio()) {
        recommendations.add(
            new Recommendation(
                RecommendationKind.LOW_CACHE_HIT_RATIO,
                format(
                    "Result cache hit ratio %.1f%% is below %.1f%%. Consider longer cache TTLs"
                        + " or more cached rows",
                    hitRatio * 100,
                    settings.getMinCacheHitRatio() * 100)));
      }
    }

    if (profile.getStrategy() == ExecutionStrategy.SERIAL
        && profile.getRowsRead() > settings.getParallelRowThreshold()) {
      recommendations.add(
          new Recommendation(
              RecommendationKind.CONSIDER_PARALLEL,
              format(
                  "Serial run read %d rows, above the parallel threshold of %d. The row estimate"
                      + " was %d; refresh table statistics or raise maxWorkerThreads",
                  profile.getRowsRead(),
                  settings.getParallelRowThreshold(),
                  profile.getEstimatedRows())));
    }

    if (profile.hasHook(MonitoringHook.ADAPTATION_EVENTS) && profile.getStrategySwitches() > 0) {
      recommendations.add(
          new Recommendation(
              RecommendationKind.UNDERESTIMATED_INPUT,
              format(
                  "Switched to parallel execution after reading %d rows against an estimate of"
                      + " %d. Refresh table statistics",
                  profile.getRowsRead(),
                  profile.getEstimatedRows())));
    }

    if (profile.hasHook(MonitoringHook.BUFFER_OVERFLOW) && profile.getDroppedEvents() > 0) {
      recommendations.add(
          new Recommendation(
              RecommendationKind.STREAM_BUFFER_OVERFLOW,
              format(
                  "Dropped %d events on full stream buffers. Raise streamBufferCapacity or the"
                      + " latency budget",
                  profile.getDroppedEvents())));
    }
    if (profile.getStrategy() == ExecutionStrategy.STREAMING && profile.getLateEvents() > 0) {
      recommendations.add(
          new Recommendation(
              RecommendationKind.LATE_EVENTS,
              format(
                  "Ignored %d events that arrived after their window closed. Widen the window"
                      + " or the latency budget",
                  profile.getLateEvents())));
    }
    return recommendations;
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.ROOT, template, args);
  }
}
