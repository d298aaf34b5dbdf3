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

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Shard key descriptor.
 *
 * <p>An empty key list means the whole series key (measurement name and all tags) is the shard
 * key.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class ShardKeyInfo {
  @JsonProperty("shardKey")
  private List<String> shardKey = new ArrayList<>();

  @JsonProperty("type")
  private ShardKeyType type = ShardKeyType.HASH;

  /** ID of the first shard group this descriptor applies to. */
  @JsonProperty("shardGroupId")
  private long shardGroupId;

  public ShardKeyInfo() {}

  public ShardKeyInfo(List<String> shardKey, ShardKeyType type) {
    this.shardKey = shardKey != null ? shardKey : new ArrayList<>();
    this.type = type;
  }

  public ShardKeyInfo(List<String> shardKey, ShardKeyType type, long shardGroupId) {
    this(shardKey, type);
    this.shardGroupId = shardGroupId;
  }

  public boolean hasKeys() {
    return !shardKey.isEmpty();
  }

  public boolean isRange() {
    return type == ShardKeyType.RANGE;
  }
}
