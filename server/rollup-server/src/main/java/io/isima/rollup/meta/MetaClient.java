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
import io.isima.rollup.errors.exception.RollupException;
import java.util.List;

/** Metadata directory of the cluster. */
public interface MetaClient {

  /**
   * Gets a database.
   *
   * @param name Database name
   * @return The database
   * @throws NoSuchDatabaseException when the database does not exist
   */
  DatabaseInfo getDatabase(String name) throws NoSuchDatabaseException;

  /**
   * Returns the indexes of the shards of the shard group that accept writes.
   *
   * @param database Database name
   * @param shardGroup The shard group
   * @return Indexes into {@link ShardGroupInfo#getShards()}
   */
  List<Integer> getAliveShards(String database, ShardGroupInfo shardGroup);

  /**
   * Returns the shard group that covers the timestamp, creating it if necessary.
   *
   * @throws RollupException when the shard group cannot be resolved
   */
  ShardGroupInfo createShardGroup(
      String database, String retentionPolicy, long timestamp, EngineType engineType)
      throws RollupException;

  /**
   * Returns the measurement, creating it if necessary.
   *
   * @throws RollupException when the measurement cannot be resolved
   */
  MeasurementInfo createMeasurement(String database, String retentionPolicy, String name)
      throws RollupException;
}
