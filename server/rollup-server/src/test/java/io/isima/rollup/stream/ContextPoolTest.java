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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.time.Clock;
import java.util.List;
import org.junit.Test;

public class ContextPoolTest {

  private static class Counter implements Resettable {
    int value;
    int resets;

    @Override
    public void reset() {
      value = 0;
      ++resets;
    }
  }

  @Test
  public void testReuseAfterReset() {
    final var pool = new ContextPool<>(Counter::new, 2);
    final var first = pool.take();
    first.value = 5;
    pool.release(first);
    assertEquals(1, first.resets);
    assertEquals(0, first.value);

    assertSame(first, pool.take());
    assertEquals(1, pool.getCreatedCount());
  }

  @Test
  public void testCapacity() {
    final var pool = new ContextPool<>(Counter::new, 2);
    final var a = pool.take();
    final var b = pool.take();
    final var c = pool.take();
    assertNotSame(a, b);
    pool.release(a);
    pool.release(b);
    pool.release(c);
    assertEquals(2, pool.getIdleCount());
    // the instance over capacity is reset but not kept
    assertEquals(1, c.resets);
    pool.take();
    pool.take();
    pool.take();
    assertEquals(4, pool.getCreatedCount());
    assertEquals(0, pool.getIdleCount());
  }

  @Test
  public void testReleaseNull() {
    final var pool = new ContextPool<>(Counter::new, 2);
    pool.release(null);
    assertEquals(0, pool.getIdleCount());
  }

  @Test
  public void testStreamContextReset() throws Exception {
    final var context = new StreamContext();
    context.prepare(
        StreamTask.build(
            StreamTestUtils.streamInfo("s", 60).addCall("value", "t", "sum"),
            StreamTestUtils.SRC_SCHEMA,
            null),
        StreamTestUtils.metaClient(2),
        Clock.systemUTC());
    context.getDataCache().getOrCreate("", 59, 1).set(0, 1.0);
    context.setAliveShardIndexes(List.of(0, 1));
    final var writeHelper = context.getWriteHelper();

    context.reset();
    assertTrue(context.getDataCache().isEmpty());
    assertTrue(context.getAliveShardIndexes().isEmpty());
    assertEquals(Long.MIN_VALUE, context.getMinTime());
    assertSame(writeHelper, context.getWriteHelper());
  }
}
