/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lakehouse.query.executor.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;
import lombok.extern.log4j.Log4j2;
import org.lakehouse.query.execution.aggregation.GroupedAggregator;
import org.lakehouse.query.execution.error.FatalOperatorException;
import org.lakehouse.query.execution.error.QueryCancelledException;
import org.lakehouse.query.execution.error.QueryExecutionException;
import org.lakehouse.query.execution.exchange.PartitionChannel;
import org.lakehouse.query.execution.operator.CancellationToken;
import org.lakehouse.query.execution.operator.HashAggregationOperator;
import org.lakehouse.query.execution.operator.HashJoinOperator;
import org.lakehouse.query.execution.operator.RowComparators;
import org.lakehouse.query.execution.operator.RowKeys;
import org.lakehouse.query.execution.operator.RowsSourceOperator;
import org.lakehouse.query.execution.operator.SortOperator;
import org.lakehouse.query.execution.page.Page;
import org.lakehouse.query.execution.page.PageBuilder;
import org.lakehouse.query.execution.pipeline.CollectingSink;
import org.lakehouse.query.execution.pipeline.OperatorFactory;
import org.lakehouse.query.execution.pipeline.PageSink;
import org.lakehouse.query.execution.pipeline.Pipeline;
import org.lakehouse.query.execution.pipeline.PipelineCompiler;
import org.lakehouse.query.execution.pipeline.PipelineTask;
import org.lakehouse.query.execution.pipeline.SourceOperatorFactory;
import org.lakehouse.query.execution.plan.PlanNode;
import org.lakehouse.query.execution.plan.PlanNodeType;
import org.lakehouse.query.execution.storage.ScanRange;
import org.lakehouse.query.executor.resource.WorkerPools;

/**
 * Executes a bounded plan over P partitions on the query's worker pools.
 *
 * <ul>
 *   <li>Scans, with any filters and projections directly above them, are split into P row ranges.
 *       Each range runs on the I/O pool and hands its pages to the coordinator through its own
 *       bounded {@link PartitionChannel}. Order across partitions is unspecified.
 *   <li>Hash joins partition both inputs by join key with the same function, so equal keys meet in
 *       one partition, and probe each partition on the CPU pool.
 *   <li>Aggregations compute partial aggregates per partition and merge them.
 *   <li>Sorts sort each partition and merge the sorted runs.
 *   <li>Limits, filters and projections above those run on the coordinator.
 * </ul>
 *
 * Every partition runs under the fault-tolerant shell as operator {@code <node id>#p<i>}. The first
 * failing partition fails the query; its siblings are cancelled.
 */
@Log4j2
public class ParallelExecutionEngine implements BoundedExecutor {

  private static final long POLL_MILLIS = 1L;

  @Override
  public void execute(ExecutionContext context, PageSink sink) {
    context.getProgressTracker().setPhase("parallel");
    new Run(context).stream(context.getPlan().getRoot(), sink);
  }

  /** Joins two materialized inputs in parallel. */
  public List<List<Object>> joinRows(
      ExecutionContext context,
      PlanNode joinNode,
      List<List<Object>> leftRows,
      List<List<Object>> rightRows) {
    return new Run(context).join(joinNode, leftRows, rightRows);
  }

  /** Aggregates a materialized input in parallel. */
  public List<List<Object>> aggregateRows(
      ExecutionContext context, PlanNode aggregateNode, List<List<Object>> rows) {
    Run run = new Run(context);
    return run.aggregate(aggregateNode, run.hashPartitions(aggregateNode, rows));
  }

  /** Sorts a materialized input in parallel. */
  public List<List<Object>> sortRows(
      ExecutionContext context, PlanNode sortNode, List<List<Object>> rows) {
    Run run = new Run(context);
    return run.sort(sortNode, run.chunkPartitions(sortNode.getInput(), rows));
  }

  /** Returns true for a scan leaf with only filters and projections above it. */
  static boolean isScanChain(PlanNode node) {
    if (node.getType().isScan()) {
      return true;
    }
    if (node.getType() == PlanNodeType.FILTER || node.getType() == PlanNodeType.PROJECT) {
      return isScanChain(node.getInput());
    }
    return false;
  }

  /** The pipeline of one partition, and whether it reads storage or materialized rows. */
  private record Partition(Pipeline pipeline, boolean readsStorage) {

    Partition withOperator(OperatorFactory factory, int outputChannels) {
      List<OperatorFactory> factories = new ArrayList<>(pipeline.getOperatorFactories());
      factories.add(factory);
      return new Partition(
          new Pipeline(
              pipeline.getPipelineId(), pipeline.getSourceFactory(), factories, outputChannels),
          readsStorage);
    }
  }

  /** State of one parallel execution. */
  private static final class Run {

    private final ExecutionContext context;
    private final WorkerPools pools;
    private final int degree;
    private final PipelineCompiler compiler;

    Run(ExecutionContext context) {
      this.context = context;
      this.pools =
          context
              .getWorkerPools()
              .orElseThrow(
                  () -> new IllegalStateException("Parallel execution requires worker pools"));
      this.degree = Math.max(1, context.getPlan().getParallelism());
      this.compiler =
          new PipelineCompiler(
              context.getStorage(),
              (joinNode, buildInput) -> {
                throw new IllegalStateException("Joins are not compiled into partition pipelines");
              });
    }

    /** Streams the rows of a subtree to a sink. */
    void stream(PlanNode node, PageSink sink) {
      if (isScanChain(node)) {
        scan(node, sink);
        return;
      }
      PlanNode boundary = boundaryOf(node);
      List<List<Object>> rows = evaluate(boundary);
      if (boundary == node) {
        emit(rows, node, sink);
        return;
      }
      SerialExecutor.run(context, node, Map.of(boundary.getId(), rowsSource(boundary, rows)), sink);
    }

    /** Materializes the rows of a subtree. */
    List<List<Object>> evaluate(PlanNode node) {
      switch (node.getType()) {
        case HASH_JOIN:
          return join(node, evaluate(node.getLeft()), evaluate(node.getRight()));
        case AGGREGATE:
          return aggregate(node, partitionsOf(node.getInput(), node));
        case SORT:
          return sort(node, partitionsOf(node.getInput(), null));
        default:
          CollectingSink sink = new CollectingSink();
          stream(node, sink);
          return sink.getRows();
      }
    }

    /** Walks down filters, projections and limits to the node whose rows they consume. */
    private PlanNode boundaryOf(PlanNode node) {
      PlanNode current = node;
      while (!isScanChain(current)
          && (current.getType() == PlanNodeType.FILTER
              || current.getType() == PlanNodeType.PROJECT
              || current.getType() == PlanNodeType.LIMIT)) {
        current = current.getInput();
      }
      return current;
    }

    private void scan(PlanNode chain, PageSink sink) {
      List<Partition> partitions = partitionsOf(chain, null);
      CancellationToken token = context.getCancellationToken().child();
      CompletionService<Void> completion = new ExecutorCompletionService<>(pools.getIoPool());
      List<Future<Void>> futures = new ArrayList<>();
      List<PartitionChannel> open = new ArrayList<>();
      for (Partition partition : partitions) {
        Pipeline pipeline = partition.pipeline();
        PartitionChannel channel =
            new PartitionChannel(
                pipeline.getPipelineId(), context.getSettings().getChannelCapacity(), token);
        open.add(channel);
        futures.add(
            completion.submit(
                () -> {
                  try {
                    runTask(pipeline, token, channel, true);
                    channel.close();
                  } catch (RuntimeException e) {
                    channel.fail(e);
                    throw e;
                  }
                  return null;
                }));
      }
      context.getStatistics().addPartitions(partitions.size());
      try {
        while (!open.isEmpty()) {
          context.getCancellationToken().throwIfCancelled(context.getQueryId());
          Iterator<PartitionChannel> channels = open.iterator();
          while (channels.hasNext()) {
            PartitionChannel channel = channels.next();
            Page page = channel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (page != null) {
              sink.accept(page);
            } else if (channel.isFinished()) {
              channels.remove();
            }
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelSiblings(token, futures);
        throw new QueryCancelledException(context.getQueryId());
      } catch (QueryExecutionException e) {
        cancelSiblings(token, futures);
        throw e;
      }
      awaitAll(completion, futures, token);
    }

    List<List<Object>> join(
        PlanNode node, List<List<Object>> leftRows, List<List<Object>> rightRows) {
      boolean buildIsLeft = PipelineCompiler.buildsOnLeft(node);
      PlanNode probeNode = buildIsLeft ? node.getRight() : node.getLeft();
      List<List<List<Object>>> leftBuckets =
          joinBuckets(leftRows, node.getLeft().getOutputColumns(), node.getLeftKeys());
      List<List<List<Object>>> rightBuckets =
          joinBuckets(rightRows, node.getRight().getOutputColumns(), node.getRightKeys());
      int outputChannels = node.getOutputColumns().size();
      List<Partition> partitions = new ArrayList<>(degree);
      for (int i = 0; i < degree; i++) {
        List<List<Object>> build = buildIsLeft ? leftBuckets.get(i) : rightBuckets.get(i);
        List<List<Object>> probe = buildIsLeft ? rightBuckets.get(i) : leftBuckets.get(i);
        String id = node.getId() + "#p" + i;
        OperatorFactory joinFactory =
            operatorContext ->
                new HashJoinOperator(
                    node, build, buildIsLeft, operatorContext.forOperator(node.getId()));
        partitions.add(
            new Partition(
                new Pipeline(
                    id,
                    rowsSource(id, probe, probeNode.getOutputColumns().size()),
                    List.of(joinFactory),
                    outputChannels),
                false));
      }
      context.getProgressTracker().setPhase("join");
      return flatten(runPartitions(partitions));
    }

    List<List<Object>> aggregate(PlanNode node, List<Partition> partitions) {
      List<AtomicReference<HashAggregationOperator>> partials = new ArrayList<>();
      List<Partition> withPartials = new ArrayList<>();
      for (Partition partition : partitions) {
        AtomicReference<HashAggregationOperator> partial = new AtomicReference<>();
        partials.add(partial);
        withPartials.add(
            partition.withOperator(
                operatorContext -> {
                  HashAggregationOperator operator =
                      new HashAggregationOperator(
                          node, operatorContext.forOperator(node.getId()), false);
                  partial.set(operator);
                  return operator;
                },
                node.getOutputColumns().size()));
      }
      context.getProgressTracker().setPhase("aggregate");
      runPartitions(withPartials);
      context.getProgressTracker().setPhase("merge");
      GroupedAggregator merged =
          new GroupedAggregator(
              node.getInput().getOutputColumns(), node.getGroupBy(), node.getAggregates());
      for (AtomicReference<HashAggregationOperator> partial : partials) {
        merged.merge(partial.get().getAggregator());
      }
      return merged.resultRows();
    }

    List<List<Object>> sort(PlanNode node, List<Partition> partitions) {
      List<Partition> sorted = new ArrayList<>();
      for (Partition partition : partitions) {
        sorted.add(
            partition.withOperator(
                operatorContext ->
                    new SortOperator(node, operatorContext.forOperator(node.getId())),
                node.getOutputColumns().size()));
      }
      context.getProgressTracker().setPhase("sort");
      List<List<List<Object>>> runs = runPartitions(sorted);
      context.getProgressTracker().setPhase("merge");
      return mergeSorted(runs, RowComparators.of(node.getOutputColumns(), node.getSortKeys()));
    }

    /**
     * Splits the rows of a subtree into one partition per worker: row ranges for a scan chain,
     * key-hash buckets of its materialized rows otherwise.
     *
     * @param aggregateNode hash key source for an aggregation input, null to split evenly
     */
    private List<Partition> partitionsOf(PlanNode child, PlanNode aggregateNode) {
      if (isScanChain(child)) {
        PlanNode leaf = leafOf(child);
        List<ScanRange> ranges =
            ScanRange.all(context.getStorage().rowCount(leaf)).split(degree);
        List<Partition> partitions = new ArrayList<>(degree);
        for (int i = 0; i < ranges.size(); i++) {
          Pipeline pipeline =
              compiler.compile(
                  child,
                  Map.of(
                      leaf.getId(),
                      PipelineCompiler.scanFactory(context.getStorage(), leaf, ranges.get(i))));
          partitions.add(
              new Partition(
                  new Pipeline(
                      leaf.getId() + "#p" + i,
                      pipeline.getSourceFactory(),
                      pipeline.getOperatorFactories(),
                      pipeline.getOutputChannels()),
                  true));
        }
        return partitions;
      }
      List<List<Object>> rows = evaluate(child);
      return aggregateNode == null
          ? chunkPartitions(child, rows)
          : hashPartitions(aggregateNode, rows);
    }

    List<Partition> hashPartitions(PlanNode aggregateNode, List<List<Object>> rows) {
      PlanNode child = aggregateNode.getInput();
      int[] keys = RowKeys.indicesOf(child.getOutputColumns(), aggregateNode.getGroupBy());
      List<List<List<Object>>> buckets = emptyBuckets();
      for (List<Object> row : rows) {
        buckets.get(RowKeys.partitionOf(RowKeys.groupKey(row, keys), degree)).add(row);
      }
      return rowPartitions(child, buckets);
    }

    List<Partition> chunkPartitions(PlanNode child, List<List<Object>> rows) {
      List<List<List<Object>>> buckets = new ArrayList<>(degree);
      for (ScanRange range : ScanRange.all(rows.size()).split(degree)) {
        buckets.add(rows.subList((int) range.start(), (int) range.end()));
      }
      return rowPartitions(child, buckets);
    }

    private List<Partition> rowPartitions(PlanNode child, List<List<List<Object>>> buckets) {
      List<Partition> partitions = new ArrayList<>(buckets.size());
      int channels = child.getOutputColumns().size();
      for (int i = 0; i < buckets.size(); i++) {
        String id = child.getId() + "#p" + i;
        partitions.add(
            new Partition(
                new Pipeline(id, rowsSource(id, buckets.get(i), channels), List.of(), channels),
                false));
      }
      return partitions;
    }

    /** Routes rows by join key; rows with a null key all go to partition 0. */
    private List<List<List<Object>>> joinBuckets(
        List<List<Object>> rows, List<String> columns, List<String> keyColumns) {
      int[] keys = RowKeys.indicesOf(columns, keyColumns);
      List<List<List<Object>>> buckets = emptyBuckets();
      for (List<Object> row : rows) {
        buckets.get(RowKeys.partitionOf(RowKeys.joinKey(row, keys), degree)).add(row);
      }
      return buckets;
    }

    private List<List<List<Object>>> emptyBuckets() {
      List<List<List<Object>>> buckets = new ArrayList<>(degree);
      for (int i = 0; i < degree; i++) {
        buckets.add(new ArrayList<>());
      }
      return buckets;
    }

    /** Runs partitions to completion and returns the output of each, in partition order. */
    private List<List<List<Object>>> runPartitions(List<Partition> partitions) {
      CancellationToken token = context.getCancellationToken().child();
      List<CollectingSink> sinks = new ArrayList<>();
      List<Future<Void>> futures = new ArrayList<>();
      ExecutorService pool =
          partitions.stream().anyMatch(Partition::readsStorage)
              ? pools.getIoPool()
              : pools.getCpuPool();
      CompletionService<Void> completion = new ExecutorCompletionService<>(pool);
      for (Partition partition : partitions) {
        CollectingSink sink = new CollectingSink();
        sinks.add(sink);
        futures.add(
            completion.submit(
                () -> {
                  runTask(partition.pipeline(), token, sink, partition.readsStorage());
                  return null;
                }));
      }
      context.getStatistics().addPartitions(partitions.size());
      awaitAll(completion, futures, token);
      List<List<List<Object>>> outputs = new ArrayList<>();
      for (CollectingSink sink : sinks) {
        outputs.add(sink.getRows());
      }
      return outputs;
    }

    private void runTask(
        Pipeline pipeline, CancellationToken token, PageSink sink, boolean readsStorage) {
      LongConsumer rowsListener = readsStorage ? context::recordSourceRows : rows -> {};
      context
          .getShell()
          .execute(new PipelineTask(pipeline, context.operatorContext(token), sink, rowsListener));
    }

    /**
     * Waits for every partition in completion order. The first failure cancels the siblings; it
     * is rethrown once all partitions stopped, in preference to the cancellations it caused.
     */
    private void awaitAll(
        CompletionService<Void> completion, List<Future<Void>> futures, CancellationToken token) {
      QueryExecutionException first = null;
      for (int i = 0; i < futures.size(); i++) {
        try {
          completion.take().get();
        } catch (ExecutionException e) {
          QueryExecutionException failure = asQueryException(e.getCause());
          if (first == null
              || (first instanceof QueryCancelledException
                  && !(failure instanceof QueryCancelledException))) {
            first = failure;
          }
          if (!(failure instanceof QueryCancelledException)) {
            log.error(
                "Partition {} of query {} failed, cancelling its siblings",
                failure.getOperatorId(),
                context.getQueryId());
          }
          cancelSiblings(token, futures);
        } catch (CancellationException e) {
          // a sibling cancelled before it started
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          cancelSiblings(token, futures);
          throw new QueryCancelledException(context.getQueryId());
        }
      }
      if (first != null) {
        throw first;
      }
    }

    private void cancelSiblings(CancellationToken token, List<Future<Void>> futures) {
      if (token.cancel()) {
        futures.forEach(future -> future.cancel(false));
      }
    }

    private QueryExecutionException asQueryException(Throwable cause) {
      if (cause instanceof QueryExecutionException) {
        return (QueryExecutionException) cause;
      }
      return new FatalOperatorException(null, String.valueOf(cause.getMessage()), cause);
    }

    private SourceOperatorFactory rowsSource(PlanNode node, List<List<Object>> rows) {
      return rowsSource(node.getId(), rows, node.getOutputColumns().size());
    }

    private static SourceOperatorFactory rowsSource(
        String id, List<List<Object>> rows, int channels) {
      return (operatorContext, startPosition) ->
          new RowsSourceOperator(rows, channels, startPosition, operatorContext.forOperator(id));
    }

    private void emit(List<List<Object>> rows, PlanNode node, PageSink sink) {
      for (Page page :
          PageBuilder.paginate(
              rows, node.getOutputColumns().size(), context.getSettings().getPageSize())) {
        sink.accept(page);
      }
    }

    private static PlanNode leafOf(PlanNode chain) {
      PlanNode current = chain;
      while (!current.getType().isLeaf()) {
        current = current.getInput();
      }
      return current;
    }

    private static List<List<Object>> flatten(List<List<List<Object>>> outputs) {
      List<List<Object>> rows = new ArrayList<>();
      outputs.forEach(rows::addAll);
      return rows;
    }

    /** Merges sorted runs into one sorted list. */
    private static List<List<Object>> mergeSorted(
        List<List<List<Object>>> runs, Comparator<List<Object>> comparator) {
      PriorityQueue<RunCursor> heads =
          new PriorityQueue<>((a, b) -> comparator.compare(a.current(), b.current()));
      int total = 0;
      for (List<List<Object>> run : runs) {
        total += run.size();
        if (!run.isEmpty()) {
          heads.add(new RunCursor(run));
        }
      }
      List<List<Object>> merged = new ArrayList<>(total);
      while (!heads.isEmpty()) {
        RunCursor head = heads.poll();
        merged.add(head.current());
        if (head.advance()) {
          heads.add(head);
        }
      }
      return merged;
    }
  }

  private static final class RunCursor {
    private final List<List<Object>> rows;
    private int index;

    RunCursor(List<List<Object>> rows) {
      this.rows = rows;
    }

    List<Object> current() {
      return rows.get(index);
    }

    boolean advance() {
      return ++index < rows.size();
    }
  }
}
