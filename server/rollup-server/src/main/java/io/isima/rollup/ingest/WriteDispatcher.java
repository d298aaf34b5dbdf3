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
package io.isima.rollup.ingest;

import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.meta.ShardInfo;
import io.isima.rollup.models.Row;
import java.util.List;
import java.util.Map;

/** Writes rows to a storage shard. Retries, if any, are the implementation's business. */
@FunctionalInterface
public interface WriteDispatcher {

  /**
   * Writes rows to a shard.
   *
   * @param shard Destination shard
   * @param database Database name
   * @param retentionPolicy Retention policy name
   * @param rows The rows
   * @param streamToShard Stream ID to destination shard ID of the stream rows in the batch; empty
   *     when the shard receives no stream rows
   * @throws RollupException when the write fails
   */
  void writeRows(
      ShardInfo shard,
      String database,
      String retentionPolicy,
      List<Row> rows,
      Map<Long, Long> streamToShard)
      throws RollupException;
}
