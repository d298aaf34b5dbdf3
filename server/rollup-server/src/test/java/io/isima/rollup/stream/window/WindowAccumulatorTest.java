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

import static io.isima.rollup.stream.StreamTestUtils.SRC_SCHEMA;
import static io.isima.rollup.stream.StreamTestUtils.metaClient;
import static io.isima.rollup.stream.StreamTestUtils.row;
import static io.isima.rollup.stream.StreamTestUtils.streamInfo;
import static io.isima.rollup.stream.StreamTestUtils.tags;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.isima.rollup.common.RollupConfig;
import io.isima.rollup.errors.exception.OperationCanceledException;
import io.isima.rollup.errors.exception.UnsupportedFieldTypeException;
import io.isima.rollup.execution.GenericExecutionState;
import io.isima.rollup.meta.RetentionPolicyInfo;
import io.isima.rollup.models.Field;
import io.isima.rollup.models.Row;
import io.isima.rollup.stream.StreamContext;
import io.isima.rollup.stream.StreamStats;
import io.isima.rollup.stream.StreamTask;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class WindowAccumulatorTest {
  private static final double TOLERANCE = 1e-9;

  private StreamTask task;
  private StreamContext context;
  private StreamStats stats;
  private GenericExecutionState state;

  @Before
  public void setUp() throws Exception {
    final var info =
        streamInfo("cpu_rollup", 60, "host")
            .addCall("value", "total", "sum")
            .addCall("value", "hits", "count")
            .addCall("value", "low", "min")
            .addCall("value", "high", "max");
    task = StreamTask.build(info, SRC_SCHEMA, Map.of());
    context = prepare(task, Clock.systemUTC());
    stats = new StreamStats("cpu_rollup");
    state = new GenericExecutionState("test", ForkJoinPool.commonPool());
  }

  @After
  public void tearDown() {
    RollupConfig.setProperties(System.getProperties());
  }

  private static StreamContext prepare(StreamTask task, Clock clock) throws Exception {
    final var context = new StreamContext();
    context.prepare(task, metaClient(1), clock);
    return context;
  }

  private static Row sample(long timestamp, String host, double value) {
    return row(timestamp, tags("host", host), Field.ofFloat("value", value));
  }

  @Test
  public void testSumPerGroupAndWindow() throws Exception {
    final var rows = List.of(sample(10, "a", 1), sample(50, "a", 2), sample(20, "b", 5));
    task.getAccumulator().accumulate(rows, context, state, stats);

    final var cache = context.getDataCache();
    assertEquals(2, cache.groupCount());
    assertEquals(3.0, cache.get("a", 59).get(0), TOLERANCE);
    assertEquals(5.0, cache.get("b", 59).get(0), TOLERANCE);
    assertEquals(3, stats.getRowsAccumulated());
  }

  @Test
  public void testCountIgnoresValue() throws Exception {
    final var rows =
        List.of(sample(1, "a", 1000), sample(2, "a", -3.5), sample(3, "a", 0), sample(4, "a", 7));
    task.getAccumulator().accumulate(rows, context, state, stats);
    assertEquals(4.0, context.getDataCache().get("a", 59).get(1), TOLERANCE);
  }

  @Test
  public void testMinMaxOfSingleSample() throws Exception {
    task.getAccumulator().accumulate(List.of(sample(1, "a", 42.5)), context, state, stats);
    final var slots = context.getDataCache().get("a", 59);
    assertEquals(42.5, slots.get(2), TOLERANCE);
    assertEquals(42.5, slots.get(3), TOLERANCE);
    task.getAccumulator().accumulate(List.of(sample(61, "a", -7)), context, state, stats);
    final var second = context.getDataCache().get("a", 119);
    assertEquals(-7.0, second.get(2), TOLERANCE);
    assertEquals(-7.0, second.get(3), TOLERANCE);
  }

  @Test
  public void testOrderDoesNotMatter() throws Exception {
    final var rows = new ArrayList<Row>();
    final double[] values = {3.25, -1.5, 8, 0.125, 5, 5, -9.75};
    for (int i = 0; i < values.length; ++i) {
      rows.add(sample(i * 7, "a", values[i]));
    }
    task.getAccumulator().accumulate(rows, context, state, stats);
    final var expected = context.getDataCache().get("a", 59);

    for (long seed = 1; seed <= 5; ++seed) {
      final var shuffled = new ArrayList<>(rows);
      Collections.shuffle(shuffled, new Random(seed));
      final var other = prepare(task, Clock.systemUTC());
      task.getAccumulator().accumulate(shuffled, other, state, new StreamStats("cpu_rollup"));
      final var actual = other.getDataCache().get("a", 59);
      for (int i = 0; i < 4; ++i) {
        assertEquals(expected.get(i), actual.get(i), TOLERANCE);
      }
    }
    assertEquals(10.125, expected.get(0), TOLERANCE);
    assertEquals(7.0, expected.get(1), TOLERANCE);
    assertEquals(-9.75, expected.get(2), TOLERANCE);
    assertEquals(8.0, expected.get(3), TOLERANCE);
  }

  @Test
  public void testMissingFieldLeavesSlotAbsent() throws Exception {
    final var row = row(5, tags("host", "a"), Field.ofInteger("status", 200));
    task.getAccumulator().accumulate(List.of(row), context, state, stats);
    final var slots = context.getDataCache().get("a", 59);
    for (int i = 0; i < slots.size(); ++i) {
      assertFalse(slots.isPresent(i));
    }
    assertEquals(0, slots.presentCount());
  }

  @Test
  public void testStringFieldAbortsBatch() throws Exception {
    final var info = streamInfo("messages", 60).addCall("message", "n", "count");
    final var stringTask = StreamTask.build(info, SRC_SCHEMA, Map.of());
    final var row = row(5, tags("host", "a"), Field.ofString("message", "hello"));
    try {
      stringTask
          .getAccumulator()
          .accumulate(List.of(row), prepare(stringTask, Clock.systemUTC()), state, stats);
      fail("exception is expected");
    } catch (UnsupportedFieldTypeException e) {
      assertTrue(e.getMessage().contains("message"));
    }
  }

  @Test
  public void testExpiredRowsAreSkipped() throws Exception {
    final var metaClient = metaClient(1);
    metaClient
        .getDatabase("telemetry")
        .addRetentionPolicy(new RetentionPolicyInfo("autogen", 1_000_000_000L));
    final var clock = Clock.fixed(Instant.ofEpochSecond(100), ZoneOffset.UTC);
    final var expiring = new StreamContext();
    expiring.prepare(task, metaClient, clock);
    assertEquals(99_000_000_000L, expiring.getMinTime());

    final var rows = List.of(sample(98_999_999_999L, "a", 1), sample(99_000_000_000L, "a", 2));
    task.getAccumulator().accumulate(rows, expiring, state, stats);
    assertEquals(1, stats.getExpiredRowsSkipped());
    assertEquals(1, stats.getRowsAccumulated());
  }

  @Test
  public void testExpiredRowsKeptWhenSkippingDisabled() throws Exception {
    final var properties = new Properties();
    properties.setProperty(RollupConfig.SKIP_EXPIRED_ROWS, "false");
    RollupConfig.setProperties(properties);

    final var metaClient = metaClient(1);
    metaClient
        .getDatabase("telemetry")
        .addRetentionPolicy(new RetentionPolicyInfo("autogen", 1_000_000_000L));
    final var keeping = new StreamContext();
    keeping.prepare(task, metaClient, Clock.fixed(Instant.ofEpochSecond(100), ZoneOffset.UTC));
    assertEquals(Long.MIN_VALUE, keeping.getMinTime());
  }

  @Test(expected = OperationCanceledException.class)
  public void testCanceled() throws Exception {
    state.cancel();
    task.getAccumulator().accumulate(List.of(sample(1, "a", 1)), context, state, stats);
  }
}
