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
package io.isima.rollup.stream.shard;

import io.isima.rollup.errors.exception.MissingShardKeyException;
import io.isima.rollup.meta.ShardKeyInfo;
import io.isima.rollup.models.Row;
import java.nio.charset.StandardCharsets;

/**
 * Builds shard keys of rows.
 *
 * <p>The shard key is the measurement name followed by ",key=value" for each shard key of the
 * descriptor, in the declared order. A descriptor without keys takes the series key: the
 * measurement name followed by ",key=value" for every tag of the row.
 */
public class ShardKeyBuilder {

  private ShardKeyBuilder() {}

  /**
   * Builds the shard key of a row.
   *
   * @param row The row; tags must be sorted
   * @param shardKeyInfo Shard key descriptor
   * @return The shard key in UTF-8
   * @throws MissingShardKeyException when the row lacks a shard key tag or its value is empty
   */
  public static byte[] build(Row row, ShardKeyInfo shardKeyInfo) throws MissingShardKeyException {
    final var sb = new StringBuilder(row.getName());
    if (shardKeyInfo.hasKeys()) {
      for (final var key : shardKeyInfo.getShardKey()) {
        final var tag = row.getTag(key);
        if (tag == null || tag.getValue() == null || tag.getValue().isEmpty()) {
          throw new MissingShardKeyException(key);
        }
        sb.append(',').append(key).append('=').append(tag.getValue());
      }
    } else {
      for (final var tag : row.getTags()) {
        sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
      }
    }
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  /** Length of the "name," prefix of a shard key built for the measurement. */
  public static int prefixLength(String measurementName) {
    return measurementName.getBytes(StandardCharsets.UTF_8).length + 1;
  }
}
