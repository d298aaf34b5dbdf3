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
package io.isima.rollup.ingest;

import io.isima.rollup.models.Row;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growable buffer of reusable rows.
 *
 * <p>{@link #reset()} only truncates the logical length; the allocated rows are reset and handed
 * out again by {@link #next()}.
 */
public class RowBuffer {
  private final List<Row> rows;
  private int size;

  public RowBuffer(int initialCapacity) {
    rows = new ArrayList<>(initialCapacity);
    for (int i = 0; i < initialCapacity; ++i) {
      rows.add(new Row());
    }
  }

  /** Returns an empty row appended to the buffer. */
  public Row next() {
    final Row row;
    if (size < rows.size()) {
      row = rows.get(size);
      row.reset();
    } else {
      row = new Row();
      rows.add(row);
    }
    ++size;
    return row;
  }

  /** Takes back the last row handed out by {@link #next()}. */
  public void discardLast() {
    if (size > 0) {
      --size;
    }
  }

  public Row get(int index) {
    if (index >= size) {
      throw new IndexOutOfBoundsException("index=" + index + ", size=" + size);
    }
    return rows.get(index);
  }

  public int size() {
    return size;
  }

  /** Number of rows allocated. */
  public int capacity() {
    return rows.size();
  }

  public List<Row> getRows() {
    return Collections.unmodifiableList(rows.subList(0, size));
  }

  public void reset() {
    size = 0;
  }
}
