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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Batch-local aggregation state: group key to window bucket key to slots.
 *
 * <p>Groups iterate in the order they were first seen and windows in time order, so the output of
 * a batch is deterministic.
 */
public class DataCache {
  private final Map<String, NavigableMap<Long, WindowSlots>> groups = new LinkedHashMap<>();

  /** Read-only views of the windows of each group, in the same order as {@link #groups}. */
  private final Map<String, NavigableMap<Long, WindowSlots>> groupViews = new LinkedHashMap<>();

  private final Map<String, NavigableMap<Long, WindowSlots>> groupsView =
      Collections.unmodifiableMap(groupViews);

  /**
   * Returns the slots of a (group, window) pair, creating them if necessary.
   *
   * @param groupKey Group key
   * @param bucketKey Window bucket key
   * @param size Number of slots
   * @return The slots
   */
  public WindowSlots getOrCreate(String groupKey, long bucketKey, int size) {
    var windows = groups.get(groupKey);
    if (windows == null) {
      windows = new TreeMap<>();
      groups.put(groupKey, windows);
      groupViews.put(groupKey, Collections.unmodifiableNavigableMap(windows));
    }
    return windows.computeIfAbsent(bucketKey, key -> new WindowSlots(size));
  }

  public WindowSlots get(String groupKey, long bucketKey) {
    final var windows = groups.get(groupKey);
    return windows != null ? windows.get(bucketKey) : null;
  }

  /** Returns a read-only view of the cache. The slots themselves stay writable. */
  public Map<String, NavigableMap<Long, WindowSlots>> getGroups() {
    return groupsView;
  }

  public int groupCount() {
    return groups.size();
  }

  public int windowCount() {
    int count = 0;
    for (final var windows : groups.values()) {
      count += windows.size();
    }
    return count;
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  public void clear() {
    groups.clear();
    groupViews.clear();
  }

  @Override
  public String toString() {
    return groups.toString();
  }
}
