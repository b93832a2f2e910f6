/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.streaming;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.error.FatalOperatorException;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.error.QueryExecutionException;
import org.lakehouse.query.execution.fault.Checkpointer;
import org.lakehouse.query.execution.fault.ResumableTask;
import org.lakehouse.query.execution.fault.snapshot.OperatorState;
import org.lakehouse.query.execution.fault.snapshot.PipelineSnapshot;
import org.lakehouse.query.execution.fault.snapshot.WindowAggregationState;
import org.lakehouse.query.execution.operator.FilterOperator;
import org.lakehouse.query.execution.operator.Operator;
import org.lakehouse.query.execution.operator.ProjectOperator;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.RowPage;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.PlanNodeType;
import org.lakehouse.query.execution.storage.StreamEvent;
import org.lakehouse.query.executor.engine.ExecutionContext;
import org.lakehouse.query.executor.resource.WorkerPools;

/**
 * Runs a continuous plan on one event loop thread. Every event, tick and offloaded result is a
 * task on that loop, so operator state is never touched concurrently and a step never waits on
 * another. The supported plan shape is a stream source, a windowed aggregation over a (filtered
 * or projected) stream source, or a join of two stream sources, optionally followed by filters and
 * projections.
 *
 * <p>Event timestamps share the epoch of the query clock. The current time of the loop is the
 * larger of the clock and the newest event timestamp; windows close when it passes their end.
 *
 * <p>The run is a task of the fault-tolerant shell under the root node id. The windowed
 * aggregation state is checkpointed by a separate writer thread so persisting never blocks the
 * loop; a restarted run restores it. Events that arrived after the last checkpoint are not
 * replayed, since a live source cannot rewind.
 */
@Log4j2
public class StreamingExecutionEngine {

  private final ExecutionContext context;
  private final PlanNode root;
  private final PlanNode core;
  private final List<PlanNode> sources;
  private final List<PlanNode> inputNodes;
  private final List<PlanNode> outputNodes;
  private final List<StreamResultHandler> handlers = new CopyOnWriteArrayList<>();
  private final AtomicReference<Throwable> loopFailure = new AtomicReference<>();

  private volatile ScheduledExecutorService loop;
  private volatile boolean running;
  private volatile CountDownLatch started = new CountDownLatch(1);

  // state below is confined to the loop thread once a run started
  private ExecutorService checkpointWriter;
  private List<AutoCloseable> subscriptions;
  private List<StreamBuffer> buffers;
  private WindowedAggregation windowAggregation;
  private StreamJoin streamJoin;
  private RowChain inputChain;
  private RowChain outputChain;
  private Checkpointer checkpointer;
  private long currentMillis = Long.MIN_VALUE;
  private long eventsProcessed;
  private long rowsEmitted;
  private long eventsSinceCheckpoint;
  private long lastCheckpointMillis;

  public StreamingExecutionEngine(ExecutionContext context) {
    this.context = context;
    this.root = context.getPlan().getRoot();
    this.outputNodes = rowOperatorsBelow(root);
    this.core = outputNodes.isEmpty() ? root : outputNodes.get(0).getInput();
    switch (core.getType()) {
      case STREAM_SOURCE:
        this.inputNodes = List.of();
        this.sources = List.of(core);
        break;
      case WINDOW_AGGREGATE:
        this.inputNodes = rowOperatorsBelow(core.getInput());
        PlanNode source = inputNodes.isEmpty() ? core.getInput() : inputNodes.get(0).getInput();
        if (source.getType() != PlanNodeType.STREAM_SOURCE) {
          throw new IllegalArgumentException("Windowed aggregation must read a stream: " + core);
        }
        this.sources = List.of(source);
        break;
      case STREAM_JOIN:
        this.inputNodes = List.of();
        this.sources = List.of(core.getLeft(), core.getRight());
        break;
      default:
        throw new IllegalArgumentException("Unsupported node in a streaming plan: " + core);
    }
  }

  /** Returns the filters and projections from {@code top} down, bottom-most first. */
  private static List<PlanNode> rowOperatorsBelow(PlanNode top) {
    List<PlanNode> nodes = new ArrayList<>();
    PlanNode current = top;
    while (current.getType() == PlanNodeType.FILTER
        || current.getType() == PlanNodeType.PROJECT) {
      nodes.add(current);
      current = current.getInput();
    }
    Collections.reverse(nodes);
    return nodes;
  }

  public void registerHandler(StreamResultHandler handler) {
    handlers.add(handler);
  }

  /**
   * Runs the stream until the query is cancelled. Partially filled windows are emitted before
   * this method returns.
   *
   * @throws QueryCancelledException once cancelled, the normal end of a streaming run
   */
  public void run() {
    context.getProgressTracker().setPhase("streaming");
    context.getShell().execute(new StreamingTask());
  }

  /** Stops the stream. Open windows are flushed to the handlers before the run ends. */
  public void cancel() {
    context.getCancellationToken().cancel();
  }

  /**
   * Runs {@code work} on the CPU pool of the query and hands its result to {@code onLoop} on the
   * event loop. Without worker pools the work runs on the loop itself.
   */
  public <T> void offload(Callable<T> work, Consumer<T> onLoop) {
    context.getStatistics().recordOffload();
    Optional<ExecutorService> pool = context.getWorkerPools().map(WorkerPools::getCpuPool);
    if (pool.isEmpty()) {
      post(() -> onLoop.accept(call(work)));
      return;
    }
    try {
      pool.get()
          .execute(
              () -> {
                try {
                  T result = call(work);
                  post(() -> onLoop.accept(result));
                } catch (RuntimeException e) {
                  recordFailure(e);
                }
              });
    } catch (RejectedExecutionException e) {
      log.debug("Query {} dropped offloaded work after shutdown", context.getQueryId());
    }
  }

  /** Waits until the stream subscribed to its sources. */
  public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
    return started.await(timeout, unit);
  }

  /** Waits until every task queued on the loop so far has run. */
  public void drain(long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException {
    ScheduledExecutorService current = loop;
    if (current != null && !current.isShutdown()) {
      current.submit(() -> {}).get(timeout, unit);
    }
  }

  private <T> T call(Callable<T> work) {
    try {
      return work.call();
    } catch (QueryExecutionException e) {
      throw e;
    } catch (Exception e) {
      throw new FatalOperatorException(core.getId(), String.valueOf(e.getMessage()), e);
    }
  }

  private void start(PipelineSnapshot restoreFrom, Checkpointer checkpointer) {
    this.checkpointer = checkpointer;
    loopFailure.set(null);
    subscriptions = new ArrayList<>();
    buffers = new ArrayList<>();
    for (PlanNode source : sources) {
      buffers.add(
          new StreamBuffer(
              source.getStreamId(),
              context.getPlan().getStreamBufferCapacity(),
              context.getPlan().getStreamWindowMillis()));
    }
    windowAggregation =
        core.getType() == PlanNodeType.WINDOW_AGGREGATE ? new WindowedAggregation(core) : null;
    streamJoin =
        core.getType() == PlanNodeType.STREAM_JOIN
            ? new StreamJoin(core, buffers.get(0), buffers.get(1))
            : null;
    inputChain = new RowChain(inputNodes);
    outputChain = new RowChain(outputNodes);
    eventsProcessed = 0;
    rowsEmitted = 0;
    eventsSinceCheckpoint = 0;
    lastCheckpointMillis = context.getClock().millis();
    if (restoreFrom != null) {
      restore(restoreFrom);
    }

    String queryId = context.getQueryId();
    loop =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("query-" + queryId + "-stream-loop")
                .setDaemon(true)
                .build());
    checkpointWriter =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("query-" + queryId + "-stream-checkpoint")
                .setDaemon(true)
                .build());
    running = true;
    long tickMillis = context.getPlan().getStreamTickMillis();
    loop.scheduleAtFixedRate(
        () -> guarded(this::tick), tickMillis, tickMillis, TimeUnit.MILLISECONDS);
    for (int i = 0; i < sources.size(); i++) {
      int side = i;
      subscriptions.add(
          context
              .getLiveSource()
              .subscribe(sources.get(i), event -> post(() -> onEvent(side, event))));
    }
    log.info(
        "Query {} streaming from {} with {} ms windows and {} ms ticks",
        queryId,
        sources.stream().map(PlanNode::getStreamId).toList(),
        context.getPlan().getStreamWindowMillis(),
        tickMillis);
    started.countDown();
  }

  private void restore(PipelineSnapshot snapshot) {
    eventsProcessed = snapshot.getPosition();
    rowsEmitted = snapshot.getOutputRows();
    if (windowAggregation != null) {
      OperatorState state = snapshot.getOperators().get(core.getId());
      windowAggregation.restore(
          OperatorState.require(
              state, WindowAggregationState.class, WindowAggregationState.VERSION, core.getId()));
      log.info(
          "Query {} restored {} open windows of {}",
          context.getQueryId(),
          windowAggregation.openWindowCount(),
          core.getId());
    }
  }

  /**
   * Stops delivery and tears the loop down. Tasks already queued still run; with {@code flush}
   * the open windows are emitted after them.
   */
  private void stop(boolean flush) {
    running = false;
    if (loop == null) {
      return;
    }
    for (AutoCloseable subscription : subscriptions) {
      try {
        subscription.close();
      } catch (Exception e) {
        log.warn("Query {} failed to close a stream subscription", context.getQueryId(), e);
      }
    }
    long timeoutMillis = context.getSettings().getPoolShutdownTimeoutMillis();
    if (flush && windowAggregation != null) {
      try {
        loop.submit(() -> guarded(() -> emit(windowAggregation.flush())))
            .get(timeoutMillis, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException | TimeoutException e) {
        log.warn("Query {} could not flush open windows", context.getQueryId(), e);
      }
    }
    shutdown(loop, "event loop", timeoutMillis);
    shutdown(checkpointWriter, "checkpoint writer", timeoutMillis);
    loop = null;
    started = new CountDownLatch(1);
  }

  private void shutdown(ExecutorService executor, String name, long timeoutMillis) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn(
            "Stream {} of query {} did not stop within {} ms",
            name,
            context.getQueryId(),
            timeoutMillis);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void post(Runnable task) {
    ScheduledExecutorService current = loop;
    if (!running || current == null) {
      return;
    }
    try {
      current.execute(() -> guarded(task));
    } catch (RejectedExecutionException e) {
      log.debug("Query {} dropped a task posted after the loop stopped", context.getQueryId());
    }
  }

  private void guarded(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      recordFailure(e);
    }
  }

  private void recordFailure(RuntimeException e) {
    if (loopFailure.compareAndSet(null, e)) {
      log.error("Stream loop of query {} failed", context.getQueryId(), e);
    }
  }

  private long advance(long millis) {
    currentMillis = Math.max(currentMillis, Math.max(millis, context.getClock().millis()));
    return currentMillis;
  }

  private void onEvent(int side, StreamEvent event) {
    long now = advance(event.timestampMillis());
    closeWindows(now);
    StreamBuffer buffer = buffers.get(side);
    long droppedBefore = buffer.getDroppedEvents();
    if (!buffer.add(event, now)) {
      context.getStatistics().addLateEvents(1);
      return;
    }
    long dropped = buffer.getDroppedEvents() - droppedBefore;
    if (dropped > 0) {
      context.getStatistics().addDroppedEvents(dropped);
      if (droppedBefore == 0) {
        log.warn(
            "Stream buffer {} of query {} is full, dropping the oldest events",
            buffer.getStreamId(),
            context.getQueryId());
      }
    }
    eventsProcessed++;
    eventsSinceCheckpoint++;
    context.recordSourceRows(1);

    switch (core.getType()) {
      case STREAM_SOURCE:
        emit(List.of(event.values()));
        break;
      case WINDOW_AGGREGATE:
        for (List<Object> row : inputChain.apply(List.of(event.values()))) {
          if (!windowAggregation.add(event.timestampMillis(), row)) {
            context.getStatistics().addLateEvents(1);
          }
        }
        break;
      default:
        join(side == 0, event);
        break;
    }
    maybeCheckpoint();
  }

  private void join(boolean left, StreamEvent event) {
    List<StreamEvent> candidates = streamJoin.candidates(event, left);
    if (candidates.size() > context.getSettings().getOffloadThreshold()) {
      offload(() -> streamJoin.probe(event, left, candidates.iterator()), this::emit);
    } else {
      emit(streamJoin.probe(event, left, candidates.iterator()));
    }
  }

  private void tick() {
    long now = advance(context.getClock().millis());
    closeWindows(now);
    for (StreamBuffer buffer : buffers) {
      buffer.evictExpired(now);
    }
    maybeCheckpoint();
  }

  private void closeWindows(long now) {
    if (windowAggregation != null) {
      emit(windowAggregation.closeUpTo(now));
    }
  }

  private void emit(List<List<Object>> rows) {
    List<List<Object>> output = outputChain.apply(rows);
    if (output.isEmpty()) {
      return;
    }
    rowsEmitted += output.size();
    for (StreamResultHandler handler : handlers) {
      try {
        handler.onRows(core.getId(), output);
      } catch (RuntimeException e) {
        log.warn("Result handler of query {} failed", context.getQueryId(), e);
      }
    }
  }

  private void maybeCheckpoint() {
    long now = context.getClock().millis();
    if (eventsSinceCheckpoint == 0
        || (eventsSinceCheckpoint < context.getSettings().getCheckpointIntervalRows()
            && now - lastCheckpointMillis < context.getSettings().getCheckpointIntervalMillis())) {
      return;
    }
    eventsSinceCheckpoint = 0;
    lastCheckpointMillis = now;
    PipelineSnapshot snapshot =
        new PipelineSnapshot(
            eventsProcessed,
            rowsEmitted,
            windowAggregation == null
                ? Map.of()
                : Map.of(core.getId(), windowAggregation.snapshot()));
    Checkpointer target = checkpointer;
    try {
      checkpointWriter.execute(() -> target.write(snapshot));
    } catch (RejectedExecutionException e) {
      log.debug("Query {} skipped a checkpoint after shutdown", context.getQueryId());
    }
  }

  /** The shell task of a streaming run: it lasts until the query is cancelled. */
  private class StreamingTask implements ResumableTask {

    @Override
    public String getTaskId() {
      return root.getId();
    }

    @Override
    public void run(PipelineSnapshot restoreFrom, Checkpointer checkpointer) {
      boolean cancelled = false;
      try {
        start(restoreFrom, checkpointer);
        while (!cancelled) {
          Throwable failure = loopFailure.get();
          if (failure != null) {
            throw failure instanceof QueryExecutionException
                ? (QueryExecutionException) failure
                : new FatalOperatorException(
                    core.getId(), String.valueOf(failure.getMessage()), failure);
          }
          cancelled =
              context
                  .getCancellationToken()
                  .awaitCancellation(
                      context.getPlan().getStreamTickMillis(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelled = true;
      } finally {
        stop(cancelled);
      }
      log.info(
          "Query {} stream stopped after {} events and {} rows",
          context.getQueryId(),
          eventsProcessed,
          rowsEmitted);
      throw new QueryCancelledException(root.getId());
    }
  }

  /** Filters and projections applied row by row on the loop. */
  private final class RowChain {

    private final List<PlanNode> nodes;
    private final List<Operator> operators = new ArrayList<>();

    RowChain(List<PlanNode> nodes) {
      this.nodes = nodes;
      for (PlanNode node : nodes) {
        operators.add(
            node.getType() == PlanNodeType.FILTER
                ? new FilterOperator(node, context.operatorContext().forOperator(node.getId()))
                : new ProjectOperator(node, context.operatorContext().forOperator(node.getId())));
      }
    }

    List<List<Object>> apply(List<List<Object>> rows) {
      List<List<Object>> current = rows;
      for (int i = 0; i < operators.size() && !current.isEmpty(); i++) {
        operators
            .get(i)
            .addInput(
                RowPage.fromRows(current, nodes.get(i).getInput().getOutputColumns().size()));
        Page output = operators.get(i).getOutput();
        current = new ArrayList<>();
        if (output != null) {
          for (int position = 0; position < output.getPositionCount(); position++) {
            current.add(output.getRow(position));
          }
        }
      }
      return current;
    }
  }
}
