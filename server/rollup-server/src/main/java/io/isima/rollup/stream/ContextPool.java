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

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Thread-safe pool of reusable per-batch objects.
 *
 * <p>An instance taken by {@link #take()} belongs to the taker until it is given back by {@link
 * #release(Resettable)}, which resets it. At most {@code capacity} idle instances are kept; extra
 * released instances are left to the garbage collector.
 *
 * @param <T> Pooled type
 */
public class ContextPool<T extends Resettable> {
  private final Supplier<T> factory;
  private final int capacity;

  private final ConcurrentLinkedQueue<T> idle = new ConcurrentLinkedQueue<>();
  private final AtomicInteger idleCount = new AtomicInteger();
  private final AtomicInteger createdCount = new AtomicInteger();

  public ContextPool(Supplier<T> factory, int capacity) {
    this.factory = Objects.requireNonNull(factory);
    this.capacity = capacity;
  }

  /** Returns an idle instance, or a new one if the pool is empty. */
  public T take() {
    final T entry = idle.poll();
    if (entry != null) {
      idleCount.decrementAndGet();
      return entry;
    }
    createdCount.incrementAndGet();
    return factory.get();
  }

  /**
   * Resets an instance and returns it to the pool.
   *
   * @param entry The instance; null is ignored
   */
  public void release(T entry) {
    if (entry == null) {
      return;
    }
    entry.reset();
    if (idleCount.incrementAndGet() <= capacity) {
      idle.offer(entry);
    } else {
      idleCount.decrementAndGet();
    }
  }

  public int getIdleCount() {
    return idleCount.get();
  }

  /** Number of instances the pool has created so far. */
  public int getCreatedCount() {
    return createdCount.get();
  }

  public int getCapacity() {
    return capacity;
  }
}
