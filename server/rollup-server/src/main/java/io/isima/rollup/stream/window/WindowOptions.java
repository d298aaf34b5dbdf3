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
package io.isima.rollup.stream.window;

import lombok.Getter;
import lombok.ToString;

/**
 * Tumbling time windows of a fixed interval, shifted by an offset.
 *
 * <p>Window boundaries are the times t where (t - offset) is a multiple of the interval. Times are
 * in nanoseconds.
 */
@Getter
@ToString
public class WindowOptions {
  private final long interval;
  private final long offset;

  public WindowOptions(long interval, long offset) {
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be positive: " + interval);
    }
    this.interval = interval;
    this.offset = offset;
  }

  /** Returns the inclusive start of the window that contains the timestamp. */
  public long windowStart(long timestamp) {
    final long remainder =
        Math.floorMod(
            Math.floorMod(timestamp, interval) - Math.floorMod(offset, interval), interval);
    if (timestamp < Long.MIN_VALUE + remainder) {
      return Long.MIN_VALUE;
    }
    return timestamp - remainder;
  }

  /** Returns the exclusive end of the window that contains the timestamp. */
  public long windowEnd(long timestamp) {
    final long start = windowStart(timestamp);
    if (start > Long.MAX_VALUE - interval) {
      return Long.MAX_VALUE;
    }
    return start + interval;
  }

  /**
   * Returns the key of the window bucket that contains the timestamp.
   *
   * <p>The key is the last nanosecond of the window, which is also the timestamp of the output row.
   */
  public long bucketKey(long timestamp) {
    return windowEnd(timestamp) - 1;
  }
}
