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
package io.isima.rollup.ingest;

import io.isima.rollup.common.RollupConfig;
import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.meta.ShardInfo;
import io.isima.rollup.models.Row;
import io.isima.rollup.stream.Resettable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-side state of an ingestion batch.
 *
 * <p>Holds the rows produced by stream tasks, the rows staged per destination shard, and the
 * mapping from shard to (stream ID to destination shard ID). An instance is written by a single
 * thread at a time.
 */
public class IngestionContext implements Resettable {
  private static final Logger logger = LoggerFactory.getLogger(IngestionContext.class);

  private final RowBuffer rowBuffer;

  private final Map<Long, Map<Long, Long>> srcStreamDstShardIdMap = new LinkedHashMap<>();
  private final Map<Long, ShardInfo> shards = new LinkedHashMap<>();
  private final Map<Long, List<Row>> shardRows = new LinkedHashMap<>();

  public IngestionContext() {
    this(RollupConfig.rowBufferInitialCapacity());
  }

  public IngestionContext(int rowBufferCapacity) {
    rowBuffer = new RowBuffer(rowBufferCapacity);
  }

  public RowBuffer getRowBuffer() {
    return rowBuffer;
  }

  /** Records that rows of the stream are written to the shard. */
  public void recordStreamDestination(long shardId, long streamId) {
    srcStreamDstShardIdMap
        .computeIfAbsent(shardId, key -> new LinkedHashMap<>())
        .put(streamId, shardId);
  }

  public Map<Long, Long> getStreamDestinations(long shardId) {
    final var map = srcStreamDstShardIdMap.get(shardId);
    return map != null ? Collections.unmodifiableMap(map) : Collections.emptyMap();
  }

  public Map<Long, Map<Long, Long>> getSrcStreamDstShardIdMap() {
    return Collections.unmodifiableMap(srcStreamDstShardIdMap);
  }

  /** Stages a row for a shard. */
  public void setShardRow(ShardInfo shard, Row row) {
    shards.putIfAbsent(shard.getId(), shard);
    shardRows.computeIfAbsent(shard.getId(), key -> new ArrayList<>()).add(row);
  }

  public List<Row> getShardRows(long shardId) {
    final var rows = shardRows.get(shardId);
    return rows != null ? Collections.unmodifiableList(rows) : Collections.emptyList();
  }

  public List<ShardInfo> getStagedShards() {
    return new ArrayList<>(shards.values());
  }

  public int getStagedRowCount() {
    int count = 0;
    for (final var rows : shardRows.values()) {
      count += rows.size();
    }
    return count;
  }

  /**
   * Writes the staged rows, one dispatcher call per shard.
   *
   * @param dispatcher The dispatcher
   * @param database Database name
   * @param retentionPolicy Retention policy name
   * @return Number of rows dispatched
   * @throws RollupException when the dispatcher fails. Shards after the failed one are not
   *     written
   */
  public int dispatch(WriteDispatcher dispatcher, String database, String retentionPolicy)
      throws RollupException {
    int dispatched = 0;
    for (final var entry : shardRows.entrySet()) {
      final var shard = shards.get(entry.getKey());
      final var rows = entry.getValue();
      logger.trace("dispatching {} rows to shard {}", rows.size(), shard.getId());
      dispatcher.writeRows(
          shard, database, retentionPolicy, rows, getStreamDestinations(shard.getId()));
      dispatched += rows.size();
    }
    return dispatched;
  }

  @Override
  public void reset() {
    rowBuffer.reset();
    srcStreamDstShardIdMap.clear();
    shards.clear();
    shardRows.clear();
  }
}
