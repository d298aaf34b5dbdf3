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

import io.isima.rollup.errors.MetaError;

/** Exception thrown when the shard group covering a timestamp can be neither found nor created. */
public class ShardGroupUnavailableException extends RollupException {

  private static final long serialVersionUID = 3320207277277236128L;

  public ShardGroupUnavailableException(String database, String retentionPolicy, long timestamp) {
    super(
        MetaError.SHARD_GROUP_UNAVAILABLE,
        String.format("db=%s, rp=%s, timestamp=%d", database, retentionPolicy, timestamp));
  }

  public ShardGroupUnavailableException(
      String database, String retentionPolicy, long timestamp, Throwable t) {
    super(
        MetaError.SHARD_GROUP_UNAVAILABLE,
        String.format("db=%s, rp=%s, timestamp=%d", database, retentionPolicy, timestamp),
        t);
  }
}
