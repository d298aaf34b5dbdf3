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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A shard of a shard group.
 *
 * <p>min and max bound the shard keys stored by the shard when the shard group is range
 * partitioned, min inclusive and max exclusive. An empty bound is open.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class ShardInfo {
  private long id;
  private String min = "";
  private String max = "";

  public ShardInfo(long id) {
    this.id = id;
  }

  public boolean containsKey(String key) {
    return (min == null || min.isEmpty() || min.compareTo(key) <= 0)
        && (max == null || max.isEmpty() || key.compareTo(max) < 0);
  }
}
