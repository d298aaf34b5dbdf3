/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.rollup.stream;

import com.google.common.collect.ImmutableMap;
import io.isima.rollup.common.RollupConfig;
import io.isima.rollup.errors.exception.InvalidConfigurationException;
import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.errors.exception.UnknownStreamTaskException;
import io.isima.rollup.execution.ExecutionHelper;
import io.isima.rollup.execution.ExecutionState;
import io.isima.rollup.ingest.IngestionContext;
import io.isima.rollup.meta.MetaClient;
import io.isima.rollup.models.FieldType;
import io.isima.rollup.models.Row;
import io.isima.rollup.models.StreamInfo;
import io.isima.rollup.stream.shard.ShardResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of stream calculation.
 *
 * <p>Keeps the registered stream tasks and runs batches of rows through them. The task registry is
 * an immutable snapshot replaced on every change, so batches read it without locking. Batches run
 * concurrently, each with its own pooled {@link StreamContext}.
 */
@Slf4j
public class StreamCoordinator {
  private final MetaClient metaClient;
  private final Clock clock;
  private final ShardResolver shardResolver = new ShardResolver();
  private final ContextPool<StreamContext> contextPool;

  private volatile Map<String, StreamTask> tasks = ImmutableMap.of();

  public StreamCoordinator(MetaClient metaClient) {
    this(metaClient, Clock.systemUTC());
  }

  public StreamCoordinator(MetaClient metaClient, Clock clock) {
    this(
        metaClient,
        clock,
        new ContextPool<>(StreamContext::new, RollupConfig.contextPoolCapacity()));
  }

  public StreamCoordinator(
      MetaClient metaClient, Clock clock, ContextPool<StreamContext> contextPool) {
    this.metaClient = Objects.requireNonNull(metaClient);
    this.clock = Objects.requireNonNull(clock);
    this.contextPool = Objects.requireNonNull(contextPool);
  }

  /**
   * Registers a stream task, replacing the task of the same name if any.
   *
   * @param streamInfo The registration
   * @param srcSchema Column types of the source measurement
   * @param dstSchema Column types of the destination measurement
   * @return The compiled task
   * @throws InvalidConfigurationException when the registration is invalid
   */
  public StreamTask registerTask(
      StreamInfo streamInfo, Map<String, FieldType> srcSchema, Map<String, FieldType> dstSchema)
      throws InvalidConfigurationException {
    final var task = StreamTask.build(streamInfo, srcSchema, dstSchema);
    synchronized (this) {
      final var updated = new HashMap<>(tasks);
      final var previous = updated.put(task.getName(), task);
      tasks = ImmutableMap.copyOf(updated);
      log.info(
          "Stream task {}; stream={}, id={}, dims={}, interval={}",
          previous == null ? "registered" : "replaced",
          task.getName(),
          task.getId(),
          streamInfo.getDims(),
          streamInfo.getInterval());
    }
    return task;
  }

  /**
   * Unregisters a stream task.
   *
   * @return True if the task was registered
   */
  public boolean unregisterTask(String streamName) {
    synchronized (this) {
      if (!tasks.containsKey(streamName)) {
        return false;
      }
      final var updated = new HashMap<>(tasks);
      updated.remove(streamName);
      tasks = ImmutableMap.copyOf(updated);
    }
    log.info("Stream task unregistered; stream={}", streamName);
    return true;
  }

  /** Returns the task of the stream, or null if it is not registered. */
  public StreamTask getTask(String streamName) {
    return tasks.get(streamName);
  }

  public List<String> listTaskNames() {
    final var names = new ArrayList<>(tasks.keySet());
    names.sort(null);
    return names;
  }

  /**
   * Calculates a batch of rows for a stream.
   *
   * <p>The rows are aggregated by group and window, and the aggregated rows are staged in the
   * ingestion context per destination shard. Rows that cannot be routed are dropped and counted;
   * other errors abort the batch.
   *
   * @param streamName Name of the stream task
   * @param rows Rows written to the source measurement
   * @param ingestionContext Destination of the output rows
   * @param state Execution state
   * @return Batch counters
   * @throws UnknownStreamTaskException when the stream is not registered
   * @throws RollupException when the batch is aborted
   */
  public StreamStats calculate(
      String streamName, List<Row> rows, IngestionContext ingestionContext, ExecutionState state)
      throws RollupException {
    final StreamTask task = tasks.get(streamName);
    if (task == null) {
      throw new UnknownStreamTaskException(streamName);
    }
    state.setStreamName(streamName);
    state.putLogContext("stream", streamName);
    state.putLogContext("rows", rows.size());
    final var stats = new StreamStats(streamName);
    final var context = contextPool.take();
    try {
      state.addHistory("(prepare");
      context.prepare(task, metaClient, clock);
      state.addHistory(")(accumulate");
      task.getAccumulator().accumulate(rows, context, state, stats);
      state.addHistory(")(mapRowsToShard");
      shardResolver.resolve(task, context, ingestionContext, state, stats);
      state.addHistory(")");
      state.markDone();
      return stats;
    } catch (RollupException e) {
      state.markError();
      log.debug(
          "Stream batch aborted; {}, error={}\n{}",
          state.getLogContext(),
          e.toString(),
          state.getCallTraceString());
      throw e;
    } finally {
      contextPool.release(context);
    }
  }

  /**
   * Runs {@link #calculate} on the executor of the execution state.
   *
   * @return Future of the batch counters; completes exceptionally with a CompletionException that
   *     wraps the RollupException of an aborted batch
   */
  public CompletableFuture<StreamStats> calculateAsync(
      String streamName, List<Row> rows, IngestionContext ingestionContext, ExecutionState state) {
    return ExecutionHelper.supplyAsync(
        () -> calculate(streamName, rows, ingestionContext, state), state.getExecutor());
  }

  ContextPool<StreamContext> getContextPool() {
    return contextPool;
  }
}
