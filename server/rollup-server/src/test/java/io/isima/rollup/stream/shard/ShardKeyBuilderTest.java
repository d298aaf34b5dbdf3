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

import static io.isima.rollup.stream.StreamTestUtils.row;
import static io.isima.rollup.stream.StreamTestUtils.tags;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import io.isima.rollup.errors.exception.MissingShardKeyException;
import io.isima.rollup.meta.ShardKeyInfo;
import io.isima.rollup.meta.ShardKeyType;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;

public class ShardKeyBuilderTest {

  private static String build(String[] tags, List<String> keys) throws Exception {
    final var key =
        ShardKeyBuilder.build(row(0, tags), new ShardKeyInfo(keys, ShardKeyType.HASH));
    return new String(key, StandardCharsets.UTF_8);
  }

  @Test
  public void testDeclaredKeys() throws Exception {
    final var tags = tags("host", "a", "region", "us", "zone", "1a");
    assertEquals("cpu,region=us,host=a", build(tags, List.of("region", "host")));
    assertEquals("cpu,host=a", build(tags, List.of("host")));
  }

  @Test
  public void testSeriesKey() throws Exception {
    assertEquals("cpu,host=a,region=us", build(tags("region", "us", "host", "a"), List.of()));
    assertEquals("cpu", build(tags(), List.of()));
  }

  @Test(expected = MissingShardKeyException.class)
  public void testMissingKey() throws Exception {
    build(tags("region", "us"), List.of("host"));
  }

  @Test(expected = MissingShardKeyException.class)
  public void testEmptyValue() throws Exception {
    build(tags("host", ""), List.of("host"));
  }

  @Test
  public void testMissingKeyIsRowScoped() {
    assertEquals(true, new MissingShardKeyException("host").isRowScoped());
  }

  @Test
  public void testPrefixLength() {
    assertEquals(4, ShardKeyBuilder.prefixLength("cpu"));
    assertEquals(7, ShardKeyBuilder.prefixLength("日本"));
  }

  @Test
  public void testHashIsStable() {
    final var a = "host=a".getBytes(StandardCharsets.UTF_8);
    final var prefixed = "cpu,host=a".getBytes(StandardCharsets.UTF_8);
    assertEquals(ShardKeyHasher.hash(a), ShardKeyHasher.hash(prefixed, 4, a.length));
    assertNotEquals(ShardKeyHasher.hash(a), ShardKeyHasher.hash(prefixed));
  }
}
