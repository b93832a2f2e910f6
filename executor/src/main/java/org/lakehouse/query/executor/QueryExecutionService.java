/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.config.ExecutionSettings;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.exchange.PartitionChannel;
import org.lakehouse.query.execution.fault.CheckpointStore;
import org.lakehouse.query.execution.fault.FaultTolerantShell;
import org.lakehouse.query.execution.fault.InMemoryCheckpointStore;
import org.lakehouse.query.execution.operator.CancellationToken;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.pipeline.PageSink;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.progress.ExecutionStatistics;
import org.lakehouse.query.execution.progress.ProgressTracker;
import org.lakehouse.query.execution.storage.LiveSource;
import org.lakehouse.query.execution.storage.StorageEngine;
import org.lakehouse.query.executor.bridge.CachePolicy;
import org.lakehouse.query.executor.bridge.ExecutionStrategy;
import org.lakehouse.query.executor.bridge.OptimizedPlan;
import org.lakehouse.query.executor.bridge.RuntimeHints;
import org.lakehouse.query.executor.bridge.StrategyBridge;
import org.lakehouse.query.executor.bridge.StrategyVisitor;
import org.lakehouse.query.executor.cache.InMemoryResultCache;
import org.lakehouse.query.executor.cache.ResultCache;
import org.lakehouse.query.executor.engine.AdaptiveExecutor;
import org.lakehouse.query.executor.engine.CachedResultExecutor;
import org.lakehouse.query.executor.engine.ExecutionContext;
import org.lakehouse.query.executor.engine.ParallelExecutionEngine;
import org.lakehouse.query.executor.engine.SerialExecutor;
import org.lakehouse.query.executor.monitor.PerformanceAnalyzer;
import org.lakehouse.query.executor.monitor.QueryProfile;
import org.lakehouse.query.executor.monitor.Recommendation;
import org.lakehouse.query.executor.resource.QueryAdmission;
import org.lakehouse.query.executor.resource.QuerySlot;
import org.lakehouse.query.executor.resource.ResourceManager;
import org.lakehouse.query.executor.resource.WorkerPools;
import org.lakehouse.query.executor.resource.WorkerReservation;
import org.lakehouse.query.executor.security.MaskingStorageEngine;
import org.lakehouse.query.executor.security.QueryAuthorizer;
import org.lakehouse.query.executor.security.SecurityIdentity;
import org.lakehouse.query.executor.streaming.StreamingExecutionEngine;

/**
 * Entry point of the execution core. {@link #submit} binds a plan to a strategy through the
 * {@link StrategyBridge} and runs it on a dedicated thread under a fault-tolerant shell, with a
 * progress tracker and, for parallel plans, worker pools owned by the query.
 *
 * <p>At most {@code maxConcurrentQueries} queries run at once; later ones wait for a slot. With a
 * {@link QueryAuthorizer} configured, every plan is checked against the submitting identity before
 * anything runs.
 */
@Log4j2
public class QueryExecutionService implements AutoCloseable {

  private static final long DEFAULT_CACHE_ENTRIES = 1_000L;

  private final ExecutionSettings settings;
  private final StorageEngine storage;
  private final LiveSource liveSource;
  private final ResultCache resultCache;
  private final CheckpointStore checkpointStore;
  private final Clock clock;
  @Getter private final StrategyBridge bridge;
  @Getter private final ResourceManager resourceManager;
  @Getter private final QueryAdmission admission;
  private final PerformanceAnalyzer analyzer;

  /** Null when queries run without access checks. */
  private final QueryAuthorizer authorizer;
  private final ParallelExecutionEngine parallelEngine = new ParallelExecutionEngine();
  private final ExecutorService queryThreads;

  public QueryExecutionService(
      ExecutionSettings settings,
      StorageEngine storage,
      LiveSource liveSource,
      ResultCache resultCache,
      CheckpointStore checkpointStore,
      Clock clock) {
    this(settings, storage, liveSource, resultCache, checkpointStore, clock, null);
  }

  public QueryExecutionService(
      ExecutionSettings settings,
      StorageEngine storage,
      LiveSource liveSource,
      ResultCache resultCache,
      CheckpointStore checkpointStore,
      Clock clock,
      QueryAuthorizer authorizer) {
    settings.validate();
    this.settings = settings;
    this.storage = storage;
    this.liveSource = liveSource;
    this.resultCache = resultCache;
    this.checkpointStore = checkpointStore;
    this.clock = clock;
    this.resourceManager = new ResourceManager(settings.getMaxWorkerThreads());
    this.bridge = new StrategyBridge(settings, resultCache, resourceManager);
    this.admission =
        new QueryAdmission(settings.getMaxConcurrentQueries(), settings.getMaxMemoryBytes());
    this.analyzer = new PerformanceAnalyzer(settings);
    this.authorizer = authorizer;
    this.queryThreads =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("query-runner-%d").setDaemon(true).build());
  }

  /** Creates a service with an in-memory result cache and checkpoint store. */
  public static QueryExecutionService create(
      ExecutionSettings settings, StorageEngine storage, LiveSource liveSource) {
    Clock clock = Clock.systemUTC();
    return new QueryExecutionService(
        settings,
        storage,
        liveSource,
        new InMemoryResultCache(DEFAULT_CACHE_ENTRIES, clock),
        new InMemoryCheckpointStore(settings.getCheckpointRetention()),
        clock);
  }

  public ExecutionHandle submit(PlanNode plan) {
    return submit(plan, RuntimeHints.defaults());
  }

  /**
   * Starts executing a plan.
   *
   * @throws org.lakehouse.query.execution.error.ConfigurationException if the settings or hints
   *     are invalid; nothing runs in that case
   * @throws org.lakehouse.query.execution.error.AccessDeniedException if the identity of the hints
   *     may not read a table or stream of the plan
   */
  public ExecutionHandle submit(PlanNode plan, RuntimeHints hints) {
    String queryId = UUID.randomUUID().toString();
    StorageEngine queryStorage = storage;
    boolean masked = false;
    if (authorizer != null) {
      SecurityIdentity identity = hints.getIdentity();
      authorizer.authorize(identity, plan);
      if (authorizer.masksAny(identity, plan)) {
        // results differ per identity, so they neither come from nor go to the shared cache
        masked = true;
        hints = hints.toBuilder().bypassCache(true).build();
        queryStorage = new MaskingStorageEngine(storage, authorizer, identity);
      }
    }
    OptimizedPlan optimized = bridge.select(queryId, plan, hints);
    log.info(
        "Query {} submitted: strategy {}, parallelism {}, estimated cost {}",
        queryId,
        optimized.getStrategy(),
        optimized.getParallelism(),
        optimized.getCostEstimate());
    log.debug("Query {} plan:\n{}", queryId, plan.explain());

    CancellationToken token = new CancellationToken();
    ExecutionContext context =
        ExecutionContext.builder()
            .queryId(queryId)
            .plan(optimized)
            .settings(settings)
            .storage(queryStorage)
            .liveSource(liveSource)
            .shell(FaultTolerantShell.forQuery(queryId, settings, checkpointStore, clock))
            .progressTracker(
                new ProgressTracker(
                    queryId,
                    plan.isUnbounded() ? 0 : plan.estimatedInputRows(),
                    settings.getProgressIntervalRows(),
                    settings.getProgressIntervalMillis(),
                    clock))
            .statistics(new ExecutionStatistics())
            .cancellationToken(token)
            .clock(clock)
            .workerPools(workerPools(queryId, optimized, hints))
            .build();
    ExecutionHandle handle =
        new ExecutionHandle(
            context, new PartitionChannel(queryId, settings.getChannelCapacity(), token));
    boolean cacheable = !masked;
    queryThreads.execute(() -> run(handle, cacheable));
    return handle;
  }

  private WorkerPools workerPools(String queryId, OptimizedPlan plan, RuntimeHints hints) {
    switch (plan.getStrategy()) {
      case PARALLEL:
      case ADAPTIVE:
        return new WorkerPools(
            queryId,
            plan.getIoThreads(),
            plan.getParallelism(),
            settings.getPoolShutdownTimeoutMillis());
      case STREAMING:
        // offloaded join probes only
        return new WorkerPools(
            queryId,
            1,
            Math.max(1, Math.min(settings.getMaxParallelism(), hints.getAvailableProcessors())),
            settings.getPoolShutdownTimeoutMillis());
      default:
        return null;
    }
  }

  private void run(ExecutionHandle handle, boolean cacheable) {
    ExecutionContext context = handle.getContext();
    OptimizedPlan plan = context.getPlan();
    PartitionChannel channel = handle.getResultChannel();
    ResultSink sink = new ResultSink(channel, context.getStatistics(), plan.getCachePolicy());
    ProgressTracker tracker = context.getProgressTracker();
    String queryId = context.getQueryId();
    long startMillis = clock.millis();
    boolean failed = false;
    QuerySlot slot = null;
    try {
      slot = admission.admit(queryId, context.getCancellationToken());
      startMillis = clock.millis();
      tracker.start();
      engineFor(context, sink, channel).run();
      tracker.complete();
      if (cacheable) {
        writeThrough(plan, sink);
      }
      log.info(
          "Query {} completed: {} rows in {} ms",
          queryId,
          context.getStatistics().getRowsProduced(),
          clock.millis() - startMillis);
      handle.setRecommendations(analyze(context, clock.millis() - startMillis));
    } catch (QueryCancelledException e) {
      tracker.cancel();
      log.info("Query {} cancelled after {} ms", queryId, clock.millis() - startMillis);
      if (slot != null) {
        handle.setRecommendations(analyze(context, clock.millis() - startMillis));
      }
    } catch (RuntimeException e) {
      failed = true;
      QueryFailure failure = QueryFailure.of(e);
      handle.markFailed(failure);
      tracker.fail();
      log.error("Query {} failed: {}", queryId, failure, e);
    } finally {
      if (slot != null) {
        slot.close();
      }
      channel.close();
      context.getWorkerPools().ifPresent(WorkerPools::close);
      plan.getReservation().ifPresent(WorkerReservation::close);
      if (!failed) {
        clearCheckpoints(queryId);
      }
      handle.markDone();
    }
  }

  private Runnable engineFor(ExecutionContext context, PageSink sink, PartitionChannel channel) {
    return context
        .getPlan()
        .getStrategy()
        .accept(
            new StrategyVisitor<Runnable>() {
              @Override
              public Runnable visitSerial() {
                return () -> new SerialExecutor().execute(context, sink);
              }

              @Override
              public Runnable visitParallel() {
                return () -> parallelEngine.execute(context, sink);
              }

              @Override
              public Runnable visitStreaming() {
                return () -> stream(context, channel);
              }

              @Override
              public Runnable visitCached() {
                return () -> new CachedResultExecutor().execute(context, sink);
              }

              @Override
              public Runnable visitAdaptive() {
                return () -> new AdaptiveExecutor(parallelEngine).execute(context, sink);
              }
            });
  }

  private void stream(ExecutionContext context, PartitionChannel channel) {
    StreamingExecutionEngine engine = new StreamingExecutionEngine(context);
    int channels = context.getPlan().getRoot().getOutputColumns().size();
    int pageSize = context.getPlan().getPageSize();
    long[] droppedPages = new long[1];
    engine.registerHandler(
        (operatorId, rows) -> {
          context.getStatistics().addRowsProduced(rows.size());
          for (Page page : PageBuilder.paginate(rows, channels, pageSize)) {
            int dropped = channel.offerDroppingOldest(page);
            if (dropped > 0 && droppedPages[0] == 0) {
              log.warn(
                  "Results of query {} are not consumed fast enough, dropping the oldest",
                  context.getQueryId());
            }
            droppedPages[0] += dropped;
          }
        });
    engine.run();
  }

  private List<Recommendation> analyze(ExecutionContext context, long elapsedMillis) {
    QueryProfile profile =
        QueryProfile.of(
                context.getQueryId(), context.getPlan(), context.getStatistics(), elapsedMillis)
            .cacheHits(bridge.getCacheHits())
            .cacheMisses(bridge.getCacheMisses())
            .build();
    List<Recommendation> recommendations = analyzer.analyze(profile);
    for (Recommendation recommendation : recommendations) {
      log.info("Query {} recommendation: {}", context.getQueryId(), recommendation);
    }
    return recommendations;
  }

  private void writeThrough(OptimizedPlan plan, ResultSink sink) {
    CachePolicy policy = plan.getCachePolicy();
    if (plan.getStrategy() == ExecutionStrategy.CACHED || !policy.isWriteThrough()) {
      return;
    }
    if (sink.isOverflowed()) {
      log.debug(
          "Result of plan {} exceeds {} rows, not cached",
          plan.getFingerprint(),
          policy.getMaxRows());
      return;
    }
    resultCache.put(plan.getFingerprint(), sink.getRows(), policy.getTtl());
  }

  private void clearCheckpoints(String queryId) {
    try {
      checkpointStore.clearQuery(queryId);
    } catch (RuntimeException e) {
      log.warn("Failed to clear checkpoints of query {}", queryId, e);
    }
  }

  /** Stops accepting queries. Running queries are cancelled only through their handles. */
  @Override
  public void close() {
    queryThreads.shutdown();
    try {
      if (!queryThreads.awaitTermination(
          settings.getPoolShutdownTimeoutMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Query threads still running after shutdown");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Forwards result pages to the caller and keeps a copy for the result cache. */
  private static final class ResultSink implements PageSink {

    private final PartitionChannel channel;
    private final ExecutionStatistics statistics;
    private final int maxCachedRows;
    private final List<List<Object>> rows = new ArrayList<>();
    @Getter private boolean overflowed;

    ResultSink(PartitionChannel channel, ExecutionStatistics statistics, CachePolicy policy) {
      this.channel = channel;
      this.statistics = statistics;
      this.maxCachedRows = policy.isWriteThrough() ? policy.getMaxRows() : 0;
      this.overflowed = !policy.isWriteThrough();
    }

    @Override
    public void accept(Page page) {
      statistics.addRowsProduced(page.getPositionCount());
      if (!overflowed) {
        if (rows.size() + page.getPositionCount() > maxCachedRows) {
          overflowed = true;
          rows.clear();
        } else {
          for (int position = 0; position < page.getPositionCount(); position++) {
            rows.add(page.getRow(position));
          }
        }
      }
      channel.accept(page);
    }

    List<List<Object>> getRows() {
      return rows;
    }
  }
}
