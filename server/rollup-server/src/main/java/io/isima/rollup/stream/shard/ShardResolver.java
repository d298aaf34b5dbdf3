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
package io.isima.rollup.stream.shard;

import io.isima.rollup.common.RollupConfig;
import io.isima.rollup.errors.exception.MissingShardKeyException;
import io.isima.rollup.errors.exception.NoShardKeyException;
import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.errors.exception.ShardKeyTooLargeException;
import io.isima.rollup.errors.exception.UnroutableRowException;
import io.isima.rollup.execution.ExecutionState;
import io.isima.rollup.ingest.IngestionContext;
import io.isima.rollup.meta.ShardInfo;
import io.isima.rollup.meta.ShardKeyInfo;
import io.isima.rollup.models.Field;
import io.isima.rollup.models.Row;
import io.isima.rollup.stream.StreamContext;
import io.isima.rollup.stream.StreamStats;
import io.isima.rollup.stream.StreamTask;
import io.isima.rollup.stream.window.WindowSlots;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the accumulated windows of a batch into output rows and routes them to shards.
 *
 * <p>Each (group, window) with at least one accumulated value becomes a row of the destination
 * measurement, timestamped at the last nanosecond of the window and tagged with the dimension
 * values of the group. The row is routed by the same shard group and shard key rules as a direct
 * write and staged in the ingestion context.
 *
 * <p>Row-level routing failures drop the row. Other failures abort the batch.
 */
public class ShardResolver {
  private static final Logger logger = LoggerFactory.getLogger(ShardResolver.class);

  /**
   * Materializes and routes the output rows of a batch.
   *
   * @param task The stream task
   * @param context The batch context, accumulated
   * @param ingestionContext Destination of the output rows
   * @param state Execution state, checked for cancellation between groups
   * @param stats Batch counters
   * @throws RollupException when the batch must be aborted
   */
  public void resolve(
      StreamTask task,
      StreamContext context,
      IngestionContext ingestionContext,
      ExecutionState state,
      StreamStats stats)
      throws RollupException {
    final var codec = task.getGroupKeyCodec();
    final var tagDimKeys = codec.getTagDimKeys();
    final var fieldIndexKeys = codec.getFieldIndexKeys();
    final var calls = task.getCalls();
    final var rowBuffer = ingestionContext.getRowBuffer();
    final int maxShardKeyLength = RollupConfig.maxShardKeyLength();
    final String measurementName = context.getMeasurement().getName();

    for (final var group : context.getDataCache().getGroups().entrySet()) {
      state.checkCanceled();
      final List<String> dimValues = codec.decode(group.getKey());
      for (final var window : group.getValue().entrySet()) {
        final WindowSlots slots = window.getValue();
        if (slots.presentCount() == 0) {
          stats.incrementEmptyWindowsSkipped();
          continue;
        }
        final Row row = rowBuffer.next();
        row.setName(measurementName);
        row.setTimestamp(window.getKey());
        row.setStreamOnly(true);
        for (final var call : calls) {
          final int index = call.getSourceIndex();
          if (slots.isPresent(index)) {
            row.addField(Field.ofNumber(call.getAlias(), call.getOutputType(), slots.get(index)));
          }
        }
        for (int i = 0; i < tagDimKeys.size(); ++i) {
          row.addTag(tagDimKeys.get(i), dimValues.get(i));
        }
        for (int i = 0; i < fieldIndexKeys.size(); ++i) {
          row.addTag(fieldIndexKeys.get(i), dimValues.get(tagDimKeys.size() + i));
        }

        final ShardInfo shard;
        try {
          shard = route(row, context, maxShardKeyLength);
        } catch (RollupException e) {
          if (!e.isRowScoped()) {
            throw e;
          }
          rowBuffer.discardLast();
          countDrop(e, stats);
          logDrop(task, row, e);
          continue;
        }
        row.addStreamId(task.getId());
        ingestionContext.recordStreamDestination(shard.getId(), task.getId());
        ingestionContext.setShardRow(shard, row);
        stats.incrementRowsRouted();
      }
    }
  }

  /**
   * Finds the destination shard of a row.
   *
   * <p>Sets the shard key of the row as a side effect.
   *
   * @throws NoShardKeyException when neither the database nor the measurement has a shard key
   * @throws MissingShardKeyException when the row lacks a shard key tag (row scoped)
   * @throws ShardKeyTooLargeException when the shard key is too long (row scoped)
   * @throws UnroutableRowException when no shard accepts the row (row scoped)
   */
  ShardInfo route(Row row, StreamContext context, int maxShardKeyLength) throws RollupException {
    final var database = context.getDatabase();
    final var measurement = context.getMeasurement();
    final var resolution =
        context
            .getWriteHelper()
            .createShardGroup(
                database.getName(),
                context.getRetentionPolicyName(),
                row.getTimestamp(),
                measurement.getEngineType());
    final var shardGroup = resolution.getShardGroup();
    if (!resolution.isSameAsPrevious() || context.getShardKeyInfo() == null) {
      final ShardKeyInfo shardKeyInfo =
          database.hasShardKey()
              ? database.getShardKey()
              : measurement.getShardKey(shardGroup.getId());
      if (shardKeyInfo == null) {
        throw new NoShardKeyException(
            database.getName(), measurement.getName(), shardGroup.getId());
      }
      context.setShardKeyInfo(shardKeyInfo);
      context.setAliveShardIndexes(
          context.getWriteHelper().getMetaClient().getAliveShards(database.getName(), shardGroup));
    }
    final ShardKeyInfo shardKeyInfo = context.getShardKeyInfo();

    final byte[] shardKey = ShardKeyBuilder.build(row, shardKeyInfo);
    if (shardKey.length > maxShardKeyLength) {
      throw new ShardKeyTooLargeException(shardKey.length, maxShardKeyLength);
    }
    row.setShardKey(shardKey);

    final ShardInfo shard;
    if (shardKeyInfo.isRange()) {
      shard = shardGroup.destShardByRange(new String(shardKey, StandardCharsets.UTF_8));
    } else {
      final int offset =
          shardKeyInfo.hasKeys() ? ShardKeyBuilder.prefixLength(row.getName()) : 0;
      final long hash = ShardKeyHasher.hash(shardKey, offset, shardKey.length - offset);
      shard = shardGroup.destShardByHash(hash, context.getAliveShardIndexes());
    }
    if (shard == null) {
      throw new UnroutableRowException(row.getName(), row.getTimestamp(), shardGroup.getId());
    }
    return shard;
  }

  private static void countDrop(RollupException e, StreamStats stats) {
    if (e instanceof MissingShardKeyException) {
      stats.incrementRowsDroppedMissingShardKey();
    } else if (e instanceof ShardKeyTooLargeException) {
      stats.incrementRowsDroppedShardKeyTooLarge();
    } else {
      stats.incrementRowsDroppedUnroutable();
    }
  }

  private static void logDrop(StreamTask task, Row row, RollupException e) {
    if (e instanceof MissingShardKeyException) {
      logger.debug(
          "Stream row dropped; stream={}, measurement={}, timestamp={}, error={}",
          task.getName(),
          row.getName(),
          row.getTimestamp(),
          e.getMessage());
    } else {
      logger.warn(
          "Stream row dropped; stream={}, measurement={}, timestamp={}, error={}",
          task.getName(),
          row.getName(),
          row.getTimestamp(),
          e.getMessage());
    }
  }
}
