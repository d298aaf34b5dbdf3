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

/** Measurement metadata. */
@Getter
@Setter
@ToString
public class MeasurementInfo {
  private String name;
  private EngineType engineType = EngineType.TSSTORE;

  /** Shard key history, ordered by the shard group the descriptor starts at. */
  private final List<ShardKeyInfo> shardKeys = new ArrayList<>();

  public MeasurementInfo() {}

  public MeasurementInfo(String name) {
    this.name = name;
  }

  public MeasurementInfo(String name, EngineType engineType) {
    this.name = name;
    this.engineType = engineType;
  }

  public MeasurementInfo addShardKey(ShardKeyInfo shardKey) {
    shardKeys.add(shardKey);
    return this;
  }

  /**
   * Returns the shard key effective for a shard group.
   *
   * @param shardGroupId Shard group ID
   * @return The latest descriptor that starts at or before the shard group, or null if there is
   *     none
   */
  public ShardKeyInfo getShardKey(long shardGroupId) {
    ShardKeyInfo result = null;
    for (final var shardKey : shardKeys) {
      if (shardKey.getShardGroupId() <= shardGroupId) {
        result = shardKey;
      }
    }
    return result;
  }
}
