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

import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.errors.exception.ShardGroupUnavailableException;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-batch front of the {@link MetaClient}.
 *
 * <p>Remembers the last resolved shard group so that consecutive rows in the same time range skip
 * the metadata lookup, and caches resolved measurements. Not thread safe; owned by a single
 * batch.
 */
public class WriteHelper {

  /** Result of a shard group resolution. */
  @Getter
  @RequiredArgsConstructor
  public static class ShardGroupResolution {
    private final ShardGroupInfo shardGroup;

    /** True when the shard group is the one resolved by the previous call. */
    private final boolean sameAsPrevious;
  }

  @Getter private final MetaClient metaClient;

  private ShardGroupInfo lastShardGroup;
  private String lastDatabase;
  private String lastRetentionPolicy;
  private EngineType lastEngineType;

  private final Map<String, MeasurementInfo> measurements = new HashMap<>();

  public WriteHelper(MetaClient metaClient) {
    this.metaClient = metaClient;
  }

  /**
   * Resolves the shard group for a timestamp.
   *
   * @throws ShardGroupUnavailableException when the directory does not return a shard group
   * @throws RollupException when the directory fails
   */
  public ShardGroupResolution createShardGroup(
      String database, String retentionPolicy, long timestamp, EngineType engineType)
      throws RollupException {
    if (lastShardGroup != null
        && lastShardGroup.contains(timestamp)
        && engineType == lastEngineType
        && database.equals(lastDatabase)
        && retentionPolicy.equals(lastRetentionPolicy)) {
      return new ShardGroupResolution(lastShardGroup, true);
    }
    final var shardGroup =
        metaClient.createShardGroup(database, retentionPolicy, timestamp, engineType);
    if (shardGroup == null) {
      throw new ShardGroupUnavailableException(database, retentionPolicy, timestamp);
    }
    final boolean same = lastShardGroup != null && lastShardGroup.getId() == shardGroup.getId();
    lastShardGroup = shardGroup;
    lastDatabase = database;
    lastRetentionPolicy = retentionPolicy;
    lastEngineType = engineType;
    return new ShardGroupResolution(shardGroup, same);
  }

  /** Resolves a measurement once per helper lifetime. */
  public MeasurementInfo createMeasurement(String database, String retentionPolicy, String name)
      throws RollupException {
    final String cacheKey = database + "." + retentionPolicy + "." + name;
    var measurement = measurements.get(cacheKey);
    if (measurement == null) {
      measurement = metaClient.createMeasurement(database, retentionPolicy, name);
      measurements.put(cacheKey, measurement);
    }
    return measurement;
  }

  public void reset() {
    lastShardGroup = null;
    lastDatabase = null;
    lastRetentionPolicy = null;
    lastEngineType = null;
    measurements.clear();
  }
}
