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
package io.isima.rollup.common;

import java.util.Properties;

/** Rollup engine configuration value provider. */
public class RollupConfig {

  public static final String MAX_SHARD_KEY_LENGTH = "io.isima.rollup.write.maxShardKeyLength";

  public static final String CONTEXT_POOL_CAPACITY = "io.isima.rollup.stream.contextPoolCapacity";

  public static final String ROW_BUFFER_INITIAL_CAPACITY =
      "io.isima.rollup.stream.rowBufferInitialCapacity";

  public static final String SKIP_EXPIRED_ROWS = "io.isima.rollup.stream.skipExpiredRows";

  public static final int DEFAULT_MAX_SHARD_KEY_LENGTH = 64 * 1024;

  protected static RollupConfigBase getInstance() {
    return RollupConfigBase.getInstance();
  }

  public static void setProperties(Properties properties) {
    RollupConfigBase.setProperties(properties);
  }

  /** Maximum byte length of a shard key; a longer key fails the row. */
  public static int maxShardKeyLength() {
    return getInstance()
        .getInt(MAX_SHARD_KEY_LENGTH, DEFAULT_MAX_SHARD_KEY_LENGTH, 1, Integer.MAX_VALUE);
  }

  /** Maximum number of idle stream contexts kept for reuse. */
  public static int contextPoolCapacity() {
    return getInstance().getInt(CONTEXT_POOL_CAPACITY, 64, 0, 65536);
  }

  /** Number of output rows allocated up front by a fresh row buffer. */
  public static int rowBufferInitialCapacity() {
    return getInstance().getInt(ROW_BUFFER_INITIAL_CAPACITY, 16, 0, 1 << 20);
  }

  /**
   * Whether the aggregation skips rows older than the retention period of the destination.
   *
   * <p>default=true
   */
  public static boolean skipExpiredRows() {
    return getInstance().getBoolean(SKIP_EXPIRED_ROWS, true);
  }
}
