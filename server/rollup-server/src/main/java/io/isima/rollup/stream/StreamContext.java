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

import io.isima.rollup.common.RollupConfig;
import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.meta.DatabaseInfo;
import io.isima.rollup.meta.MeasurementInfo;
import io.isima.rollup.meta.MetaClient;
import io.isima.rollup.meta.RetentionPolicyInfo;
import io.isima.rollup.meta.ShardKeyInfo;
import io.isima.rollup.meta.WriteHelper;
import io.isima.rollup.stream.window.DataCache;
import io.isima.rollup.stream.window.WindowOptions;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-batch state of a stream calculation.
 *
 * <p>Instances are pooled. The data cache, the alive shard list and the write helper survive
 * {@link #reset()} so that a reused context does not reallocate them.
 */
@Getter
public class StreamContext implements Resettable {
  private long minTime = Long.MIN_VALUE;
  private DatabaseInfo database;
  private RetentionPolicyInfo retentionPolicy;
  private MeasurementInfo measurement;
  private WindowOptions windowOptions;

  @Setter private ShardKeyInfo shardKeyInfo;

  private final List<Integer> aliveShardIndexes = new ArrayList<>();
  private WriteHelper writeHelper;
  private final DataCache dataCache = new DataCache();

  /**
   * Resolves the destination of the task and prepares the context for the batch.
   *
   * <p>An empty retention policy in the registration means the default policy of the database.
   * When expired rows are skipped and the policy has a finite duration, rows older than (now -
   * duration) are not accumulated.
   *
   * @throws RollupException when the database, the retention policy or the measurement cannot be
   *     resolved
   */
  public void prepare(StreamTask task, MetaClient metaClient, Clock clock)
      throws RollupException {
    database = metaClient.getDatabase(task.getDestinationDatabase());
    final String rpName =
        task.getDestinationRetentionPolicy().isEmpty()
            ? database.getDefaultRetentionPolicy()
            : task.getDestinationRetentionPolicy();
    retentionPolicy = database.getRetentionPolicy(rpName);
    minTime = Long.MIN_VALUE;
    if (RollupConfig.skipExpiredRows() && !retentionPolicy.isInfinite()) {
      minTime = nowNanos(clock) - retentionPolicy.getDuration();
    }
    windowOptions = task.getWindowOptions();
    if (writeHelper == null || writeHelper.getMetaClient() != metaClient) {
      writeHelper = new WriteHelper(metaClient);
    }
    measurement =
        writeHelper.createMeasurement(
            database.getName(), retentionPolicy.getName(), task.getDestinationMeasurement());
  }

  public String getDatabaseName() {
    return database.getName();
  }

  public String getRetentionPolicyName() {
    return retentionPolicy.getName();
  }

  public void setAliveShardIndexes(List<Integer> indexes) {
    aliveShardIndexes.clear();
    if (indexes != null) {
      aliveShardIndexes.addAll(indexes);
    }
  }

  @Override
  public void reset() {
    minTime = Long.MIN_VALUE;
    database = null;
    retentionPolicy = null;
    measurement = null;
    windowOptions = null;
    shardKeyInfo = null;
    aliveShardIndexes.clear();
    if (writeHelper != null) {
      writeHelper.reset();
    }
    dataCache.clear();
  }

  private static long nowNanos(Clock clock) {
    final Instant now = clock.instant();
    return now.getEpochSecond() * 1_000_000_000L + now.getNano();
  }
}
