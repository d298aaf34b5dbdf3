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
package io.isima.rollup.errors.exception;

import io.isima.rollup.errors.WriteError;

/** Exception thrown when neither the database nor the measurement declares a shard key. */
public class NoShardKeyException extends RollupException {

  private static final long serialVersionUID = 9165677297954449342L;

  public NoShardKeyException(String database, String measurement, long shardGroupId) {
    super(
        WriteError.NO_SHARD_KEY,
        String.format("db=%s, measurement=%s, shardGroup=%d", database, measurement, shardGroupId));
  }
}
