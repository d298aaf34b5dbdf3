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

import io.isima.rollup.errors.exception.RollupException;
import io.isima.rollup.errors.exception.UnsupportedFieldTypeException;
import io.isima.rollup.execution.ExecutionState;
import io.isima.rollup.models.FieldType;
import io.isima.rollup.models.Row;
import io.isima.rollup.stream.StreamContext;
import io.isima.rollup.stream.StreamStats;
import io.isima.rollup.stream.call.FieldCall;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds the rows of a batch into per-(group, window) accumulators.
 *
 * <p>Instances are immutable and shared by the batches of a stream task.
 */
public class WindowAccumulator {
  private static final Logger logger = LoggerFactory.getLogger(WindowAccumulator.class);

  private final String streamName;
  private final List<FieldCall> calls;
  private final GroupKeyCodec groupKeyCodec;

  public WindowAccumulator(String streamName, List<FieldCall> calls, GroupKeyCodec groupKeyCodec) {
    this.streamName = streamName;
    this.calls = calls;
    this.groupKeyCodec = groupKeyCodec;
  }

  /**
   * Accumulates rows into the data cache of the batch context.
   *
   * <p>Rows older than the context's minimum time are skipped.
   *
   * @param rows Input rows
   * @param context The batch context; provides the window options and the data cache
   * @param state Execution state, checked for cancellation between rows
   * @param stats Batch counters
   * @throws UnsupportedFieldTypeException when a call refers to a string field
   * @throws RollupException when the batch is canceled
   */
  public void accumulate(
      List<Row> rows, StreamContext context, ExecutionState state, StreamStats stats)
      throws RollupException {
    final long minTime = context.getMinTime();
    final WindowOptions windowOptions = context.getWindowOptions();
    final DataCache dataCache = context.getDataCache();
    for (final var row : rows) {
      state.checkCanceled();
      if (row.getTimestamp() < minTime) {
        stats.incrementExpiredRowsSkipped();
        continue;
      }
      final String groupKey = groupKeyCodec.encode(row);
      final long bucketKey = windowOptions.bucketKey(row.getTimestamp());
      final var slots = dataCache.getOrCreate(groupKey, bucketKey, calls.size());
      for (final var call : calls) {
        final var field = row.getField(call.getName());
        if (field == null) {
          continue;
        }
        if (field.getType() == FieldType.STRING) {
          throw new UnsupportedFieldTypeException(field.getKey(), streamName);
        }
        final int index = call.getSourceIndex();
        final double current =
            slots.isPresent(index) ? slots.get(index) : call.getFunction().identity();
        slots.set(index, call.accumulate(current, field.getNumValue()));
      }
      stats.incrementRowsAccumulated();
    }
    if (logger.isTraceEnabled()) {
      logger.trace(
          "stream={}, accumulated {} rows into {} windows of {} groups",
          streamName,
          rows.size(),
          dataCache.windowCount(),
          dataCache.groupCount());
    }
  }
}
