/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.bridge;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.error.ConfigurationException;
import org.lakehouse.query.execution.plan.PlanFingerprint;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.PlanNodeType;
import org.lakehouse.query.executor.cache.ResultCache;
import org.lakehouse.query.executor.resource.ResourceManager;
import org.lakehouse.query.executor.resource.WorkerReservation;

/**
 * Picks the execution strategy of a plan. Rules, in order:
 *
 * <ol>
 *   <li>a valid cached result of an equivalent plan: CACHED
 *   <li>an unbounded plan: STREAMING, with buffer and tick sized from the latency budget
 *   <li>estimated input above the row threshold with a join or aggregation: PARALLEL
 *   <li>adaptive execution enabled and a join or aggregation present: ADAPTIVE
 *   <li>otherwise SERIAL
 * </ol>
 *
 * PARALLEL and ADAPTIVE reserve workers from the {@link ResourceManager}; when the reservation
 * fails the plan is downgraded to SERIAL.
 */
@Log4j2
public class StrategyBridge {

  private static final long MIN_TICK_MILLIS = 10L;

  private final ExecutionSettings settings;
  private final ResultCache resultCache;
  private final ResourceManager resourceManager;
  private final AtomicLong downgrades = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();

  public StrategyBridge(
      ExecutionSettings settings, ResultCache resultCache, ResourceManager resourceManager) {
    this.settings = settings;
    this.resultCache = resultCache;
    this.resourceManager = resourceManager;
  }

  /** Binds a plan to a strategy and resources under a fresh query id. */
  public OptimizedPlan select(PlanNode plan, RuntimeHints hints) {
    return select(UUID.randomUUID().toString(), plan, hints);
  }

  /**
   * Binds a plan to a strategy and resources.
   *
   * @param queryId query the resources are reserved for
   * @throws ConfigurationException if the settings or hints are invalid; nothing has started
   */
  public OptimizedPlan select(String queryId, PlanNode plan, RuntimeHints hints) {
    settings.validate();
    if (hints.getAvailableProcessors() <= 0) {
      throw new ConfigurationException(
          "availableProcessors must be positive: " + hints.getAvailableProcessors());
    }
    PlanFingerprint fingerprint = PlanFingerprint.of(plan);
    boolean unbounded = plan.isUnbounded();

    if (!unbounded && settings.isCacheEnabled() && !hints.isBypassCache()) {
      Optional<List<List<Object>>> cached = resultCache.get(fingerprint);
      if (cached.isPresent()) {
        cacheHits.incrementAndGet();
        log.info("Query {} served from cached result {}", queryId, fingerprint);
        return build(plan, fingerprint, ExecutionStrategy.CACHED, 1, null)
            .cachedResult(cached.get())
            .build();
      }
      cacheMisses.incrementAndGet();
    }
    if (unbounded) {
      return build(plan, fingerprint, ExecutionStrategy.STREAMING, 1, null).build();
    }

    ExecutionStrategy strategy = chooseBounded(plan, hints);
    int parallelism = 1;
    int ioThreads = 0;
    WorkerReservation reservation = null;
    if (strategy == ExecutionStrategy.PARALLEL || strategy == ExecutionStrategy.ADAPTIVE) {
      parallelism = Math.min(hints.getAvailableProcessors(), settings.getMaxParallelism());
      if (strategy == ExecutionStrategy.PARALLEL) {
        // adaptive plans size partitions from observed rows, not from the estimate
        parallelism = Math.min(parallelism, plan.maxFanOut(settings.getPageSize()));
      }
      parallelism = Math.max(1, parallelism);
      ioThreads = Math.min(settings.getMaxIoThreads(), parallelism);
      int workers = parallelism + ioThreads;
      Optional<WorkerReservation> reserved = resourceManager.tryReserve(queryId, workers);
      if (reserved.isEmpty()) {
        downgrades.incrementAndGet();
        log.warn(
            "Query {} could not reserve {} workers, downgrading {} to SERIAL",
            queryId,
            workers,
            strategy);
        strategy = ExecutionStrategy.SERIAL;
        parallelism = 1;
        ioThreads = 0;
      } else {
        reservation = reserved.get();
      }
    }
    return build(plan, fingerprint, strategy, parallelism, reservation)
        .ioThreads(ioThreads)
        .build();
  }

  private ExecutionStrategy chooseBounded(PlanNode plan, RuntimeHints hints) {
    ExecutionStrategy preferred = hints.getPreferredStrategy();
    if (preferred != null
        && preferred != ExecutionStrategy.STREAMING
        && preferred != ExecutionStrategy.CACHED) {
      return preferred;
    }
    boolean joinOrAggregation = plan.containsJoinOrAggregation();
    if (plan.estimatedInputRows() > settings.getParallelRowThreshold() && joinOrAggregation) {
      return ExecutionStrategy.PARALLEL;
    }
    if (settings.isAdaptiveEnabled() && joinOrAggregation) {
      return ExecutionStrategy.ADAPTIVE;
    }
    return ExecutionStrategy.SERIAL;
  }

  private OptimizedPlan.OptimizedPlanBuilder build(
      PlanNode plan,
      PlanFingerprint fingerprint,
      ExecutionStrategy strategy,
      int parallelism,
      WorkerReservation reservation) {
    long windowMillis = Math.max(settings.getLatencyBudgetMillis(), largestWindow(plan));
    return OptimizedPlan.builder()
        .root(plan)
        .fingerprint(fingerprint)
        .strategy(strategy)
        .parallelism(parallelism)
        .pageSize(settings.getPageSize())
        .streamBufferCapacity(settings.getStreamBufferCapacity())
        .streamWindowMillis(windowMillis)
        .streamTickMillis(Math.max(MIN_TICK_MILLIS, settings.getLatencyBudgetMillis() / 10))
        .cachePolicy(cachePolicy(plan, strategy))
        .monitoringHooks(MonitoringHook.forStrategy(strategy))
        .costEstimate(plan.estimatedInputRows() * costMultiplier(strategy))
        .reservation(reservation);
  }

  private CachePolicy cachePolicy(PlanNode plan, ExecutionStrategy strategy) {
    if (!settings.isCacheEnabled()
        || strategy == ExecutionStrategy.STREAMING
        || strategy == ExecutionStrategy.CACHED) {
      return CachePolicy.disabled();
    }
    long ttlSeconds =
        plan.isComplex() ? settings.getComplexCacheTtlSeconds() : settings.getCacheTtlSeconds();
    return CachePolicy.writeThrough(Duration.ofSeconds(ttlSeconds), settings.getMaxCachedRows());
  }

  static double costMultiplier(ExecutionStrategy strategy) {
    return strategy.accept(
        new StrategyVisitor<Double>() {
          @Override
          public Double visitSerial() {
            return 1.0;
          }

          @Override
          public Double visitParallel() {
            return 0.8;
          }

          @Override
          public Double visitStreaming() {
            return 0.9;
          }

          @Override
          public Double visitCached() {
            return 0.1;
          }

          @Override
          public Double visitAdaptive() {
            return 0.85;
          }
        });
  }

  private static long largestWindow(PlanNode plan) {
    long[] largest = {0L};
    plan.forEach(
        node -> {
          if (node.getType() == PlanNodeType.WINDOW_AGGREGATE
              || node.getType() == PlanNodeType.STREAM_JOIN) {
            largest[0] = Math.max(largest[0], node.getWindowSizeMillis());
          }
        });
    return largest[0];
  }

  /** Number of plans downgraded to SERIAL for lack of workers. */
  public long getDowngrades() {
    return downgrades.get();
  }

  /** Result cache lookups that found a valid result. */
  public long getCacheHits() {
    return cacheHits.get();
  }

  public long getCacheMisses() {
    return cacheMisses.get();
  }
}
