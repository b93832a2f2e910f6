/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

import java.util.ArrayList;
import java.util.List;

/** Monitoring hooks attached to an optimized plan. */
public enum MonitoringHook {
  PERFORMANCE,
  RESOURCE_USAGE,
  PARALLELISM_EFFICIENCY,
  THREAD_USAGE,
  THROUGHPUT,
  BUFFER_OVERFLOW,
  ADAPTATION_EVENTS;

  /** Returns the hooks enabled for a strategy. */
  public static List<MonitoringHook> forStrategy(ExecutionStrategy strategy) {
    List<MonitoringHook> hooks = new ArrayList<>(List.of(PERFORMANCE, RESOURCE_USAGE));
    hooks.addAll(
        strategy.accept(
            new StrategyVisitor<List<MonitoringHook>>() {
              @Override
              public List<MonitoringHook> visitSerial() {
                return List.of();
              }

              @Override
              public List<MonitoringHook> visitParallel() {
                return List.of(PARALLELISM_EFFICIENCY, THREAD_USAGE);
              }

              @Override
              public List<MonitoringHook> visitStreaming() {
                return List.of(THROUGHPUT, BUFFER_OVERFLOW);
              }

              @Override
              public List<MonitoringHook> visitCached() {
                return List.of();
              }

              @Override
              public List<MonitoringHook> visitAdaptive() {
                return List.of(ADAPTATION_EVENTS);
              }
            }));
    return List.copyOf(hooks);
  }
}
