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

import java.util.Arrays;

/**
 * Accumulators of one (group, window) pair, one slot per field call.
 *
 * <p>A slot is absent until the first sample is folded into it.
 */
public class WindowSlots {
  private final double[] values;
  private final boolean[] present;

  public WindowSlots(int size) {
    values = new double[size];
    present = new boolean[size];
  }

  public int size() {
    return values.length;
  }

  public boolean isPresent(int index) {
    return present[index];
  }

  /** Returns the slot value. Meaningless unless the slot is present. */
  public double get(int index) {
    return values[index];
  }

  public void set(int index, double value) {
    values[index] = value;
    present[index] = true;
  }

  public int presentCount() {
    int count = 0;
    for (final boolean p : present) {
      if (p) {
        ++count;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder("[");
    for (int i = 0; i < values.length; ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(present[i] ? Double.toString(values[i]) : "-");
    }
    return sb.append("]").toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof WindowSlots)) {
      return false;
    }
    final var that = (WindowSlots) other;
    return Arrays.equals(values, that.values) && Arrays.equals(present, that.present);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + Arrays.hashCode(present);
  }
}
