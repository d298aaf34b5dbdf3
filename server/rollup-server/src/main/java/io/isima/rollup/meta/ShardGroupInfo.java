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

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A shard group covers a time range [startTime, endTime) of a retention policy.
 *
 * <p>Times are in nanoseconds.
 */
@Getter
@Setter
@ToString
public class ShardGroupInfo {
  private long id;
  private long startTime;
  private long endTime;
  private EngineType engineType = EngineType.TSSTORE;
  private final List<ShardInfo> shards = new ArrayList<>();

  public ShardGroupInfo() {}

  public ShardGroupInfo(long id, long startTime, long endTime) {
    this.id = id;
    this.startTime = startTime;
    this.endTime = endTime;
  }

  public ShardGroupInfo addShard(ShardInfo shard) {
    shards.add(shard);
    return this;
  }

  public boolean contains(long timestamp) {
    return startTime <= timestamp && timestamp < endTime;
  }

  /**
   * Finds the shard whose key range covers the key.
   *
   * @param shardKey The shard key
   * @return The shard, or null if no shard covers the key
   */
  public ShardInfo destShardByRange(String shardKey) {
    for (final var shard : shards) {
      if (shard.containsKey(shardKey)) {
        return shard;
      }
    }
    return null;
  }

  /**
   * Picks one of the alive shards by hash.
   *
   * @param hash Hash of the shard key
   * @param aliveShardIndexes Indexes in the shard list of the shards that accept writes
   * @return The shard, or null if no shard is alive
   */
  public ShardInfo destShardByHash(long hash, List<Integer> aliveShardIndexes) {
    if (aliveShardIndexes == null || aliveShardIndexes.isEmpty()) {
      return null;
    }
    final int index =
        aliveShardIndexes.get((int) Long.remainderUnsigned(hash, aliveShardIndexes.size()));
    if (index < 0 || index >= shards.size()) {
      return null;
    }
    return shards.get(index);
  }
}
