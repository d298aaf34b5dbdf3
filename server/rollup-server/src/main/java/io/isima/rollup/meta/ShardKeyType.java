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

import com.fasterxml.jackson.annotation.JsonCreator;

/** How a shard key maps to a shard of a shard group. */
public enum ShardKeyType {
  /** The hash of the shard key picks one of the alive shards. */
  HASH,
  /** The shard whose key range covers the shard key. */
  RANGE;

  @JsonCreator
  public static ShardKeyType forValueCaseInsensitive(String value) {
    return value == null ? null : ShardKeyType.valueOf(value.trim().toUpperCase());
  }
}
