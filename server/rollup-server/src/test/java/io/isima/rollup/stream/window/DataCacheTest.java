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

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.junit.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class DataCacheTest {

  @Test
  public void testOrdering() {
    final var cache = new DataCache();
    cache.getOrCreate("b", 119, 1).set(0, 1.0);
    cache.getOrCreate("a", 59, 1).set(0, 2.0);
    cache.getOrCreate("b", 59, 1).set(0, 3.0);

    assertThat(cache.getGroups().keySet(), contains("b", "a"));
    assertThat(cache.getGroups().get("b").keySet(), contains(59L, 119L));
    assertEquals(2, cache.groupCount());
    assertEquals(3, cache.windowCount());
    assertSame(cache.get("b", 59), cache.getOrCreate("b", 59, 1));
    assertNull(cache.get("c", 59));
  }

  @Test
  public void testGroupsViewIsReadOnly() {
    final var cache = new DataCache();
    cache.getOrCreate("a", 59, 2);
    final var groups = cache.getGroups();
    try {
      groups.remove("a");
      fail("exception is expected");
    } catch (UnsupportedOperationException e) {
      // expected
    }
    try {
      groups.get("a").put(119L, new WindowSlots(2));
      fail("exception is expected");
    } catch (UnsupportedOperationException e) {
      // expected
    }
    try {
      groups.get("a").clear();
      fail("exception is expected");
    } catch (UnsupportedOperationException e) {
      // expected
    }
    assertEquals(1, cache.windowCount());

    // the view follows the cache
    cache.getOrCreate("b", 59, 2);
    assertThat(groups.keySet(), contains("a", "b"));
    cache.clear();
    assertTrue(groups.isEmpty());
    assertTrue(cache.isEmpty());
  }
}
