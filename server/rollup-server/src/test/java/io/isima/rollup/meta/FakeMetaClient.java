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
package io.isima.rollup.meta;

import io.isima.rollup.errors.exception.NoSuchDatabaseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory metadata directory for tests.
 *
 * <p>Shard groups partition time by a fixed duration; group N covers [N * duration, (N + 1) *
 * duration) and has ID N + 1. Shard i of group G has ID G * 100 + i.
 */
public class FakeMetaClient implements MetaClient {
  private final long shardGroupDuration;
  private final int shardsPerGroup;

  private final Map<String, DatabaseInfo> databases = new HashMap<>();
  private final Map<String, MeasurementInfo> measurements = new HashMap<>();
  private List<Integer> aliveShards;
  private String[] rangeSplitPoints = new String[0];

  private int createShardGroupCount;
  private int getAliveShardsCount;
  private int createMeasurementCount;

  public FakeMetaClient(long shardGroupDuration, int shardsPerGroup) {
    this.shardGroupDuration = shardGroupDuration;
    this.shardsPerGroup = shardsPerGroup;
  }

  public FakeMetaClient addDatabase(DatabaseInfo database) {
    databases.put(database.getName(), database);
    return this;
  }

  public FakeMetaClient addMeasurement(MeasurementInfo measurement) {
    measurements.put(measurement.getName(), measurement);
    return this;
  }

  /** Sets the alive shard indexes; null means all shards are alive. */
  public FakeMetaClient setAliveShards(List<Integer> aliveShards) {
    this.aliveShards = aliveShards;
    return this;
  }

  /** Shard i covers keys [points[i - 1], points[i]). */
  public FakeMetaClient setRangeSplitPoints(String... points) {
    this.rangeSplitPoints = points;
    return this;
  }

  public int getCreateShardGroupCount() {
    return createShardGroupCount;
  }

  public int getGetAliveShardsCount() {
    return getAliveShardsCount;
  }

  public int getCreateMeasurementCount() {
    return createMeasurementCount;
  }

  @Override
  public DatabaseInfo getDatabase(String name) throws NoSuchDatabaseException {
    final var database = databases.get(name);
    if (database == null) {
      throw new NoSuchDatabaseException(name);
    }
    return database;
  }

  @Override
  public List<Integer> getAliveShards(String database, ShardGroupInfo shardGroup) {
    ++getAliveShardsCount;
    if (aliveShards != null) {
      return aliveShards;
    }
    final var all = new ArrayList<Integer>();
    for (int i = 0; i < shardGroup.getShards().size(); ++i) {
      all.add(i);
    }
    return all;
  }

  @Override
  public ShardGroupInfo createShardGroup(
      String database, String retentionPolicy, long timestamp, EngineType engineType) {
    ++createShardGroupCount;
    final long index = Math.floorDiv(timestamp, shardGroupDuration);
    final long id = index + 1;
    final var shardGroup =
        new ShardGroupInfo(id, index * shardGroupDuration, (index + 1) * shardGroupDuration);
    shardGroup.setEngineType(engineType);
    for (int i = 0; i < shardsPerGroup; ++i) {
      final String min = i > 0 && i - 1 < rangeSplitPoints.length ? rangeSplitPoints[i - 1] : "";
      final String max = i < rangeSplitPoints.length ? rangeSplitPoints[i] : "";
      shardGroup.addShard(new ShardInfo(id * 100 + i, min, max));
    }
    return shardGroup;
  }

  @Override
  public MeasurementInfo createMeasurement(String database, String retentionPolicy, String name) {
    ++createMeasurementCount;
    return measurements.computeIfAbsent(name, MeasurementInfo::new);
  }
}
