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
package io.isima.rollup.stream;

import lombok.Getter;
import lombok.ToString;

/** Counters of a stream batch. */
@Getter
@ToString
public class StreamStats {
  private final String streamName;

  /** Input rows folded into the accumulators. */
  private long rowsAccumulated;

  /** Input rows skipped for being older than the retention period. */
  private long expiredRowsSkipped;

  /** (group, window) pairs without any accumulated value. */
  private long emptyWindowsSkipped;

  /** Output rows staged for a shard. */
  private long rowsRouted;

  private long rowsDroppedMissingShardKey;
  private long rowsDroppedShardKeyTooLarge;
  private long rowsDroppedUnroutable;

  public StreamStats(String streamName) {
    this.streamName = streamName;
  }

  public void incrementRowsAccumulated() {
    ++rowsAccumulated;
  }

  public void incrementExpiredRowsSkipped() {
    ++expiredRowsSkipped;
  }

  public void incrementEmptyWindowsSkipped() {
    ++emptyWindowsSkipped;
  }

  public void incrementRowsRouted() {
    ++rowsRouted;
  }

  public void incrementRowsDroppedMissingShardKey() {
    ++rowsDroppedMissingShardKey;
  }

  public void incrementRowsDroppedShardKeyTooLarge() {
    ++rowsDroppedShardKeyTooLarge;
  }

  public void incrementRowsDroppedUnroutable() {
    ++rowsDroppedUnroutable;
  }

  public long getRowsDropped() {
    return rowsDroppedMissingShardKey + rowsDroppedShardKeyTooLarge + rowsDroppedUnroutable;
  }
}
