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
package io.isima.rollup.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A row of a measurement: a timestamp, sorted tags and fields.
 *
 * <p>Column positions are numbered over tags first, then fields; i.e. the field at list index i
 * has position (number of tags + i). The position index is rebuilt lazily after a mutation.
 *
 * <p>Instances are mutable and reusable. {@link #reset()} clears the content but keeps the
 * allocated lists, so that pooled output rows do not reallocate on every batch.
 */
@ToString(exclude = {"tagsView", "fieldsView", "columnToIndex", "indexDirty"})
public class Row {
  @Getter @Setter private String name;

  @Getter @Setter private long timestamp;

  /** Tags sorted by key. */
  private final List<Tag> tags = new ArrayList<>();

  private final List<Field> fields = new ArrayList<>();

  private final List<Tag> tagsView = Collections.unmodifiableList(tags);
  private final List<Field> fieldsView = Collections.unmodifiableList(fields);

  private final Map<String, Integer> columnToIndex = new HashMap<>();
  private boolean indexDirty;

  /** Set when the row is produced by a stream task and must not be aggregated again. */
  @Getter @Setter private boolean streamOnly;

  /** IDs of the stream tasks that produced this row. */
  private final List<Long> streamIds = new ArrayList<>();

  @Getter @Setter private byte[] shardKey;

  public Row() {}

  public Row(String name, long timestamp) {
    this.name = name;
    this.timestamp = timestamp;
  }

  /** Returns the tags sorted by key, read-only. Use {@link #addTag} to modify. */
  public List<Tag> getTags() {
    return tagsView;
  }

  /** Returns the fields in insertion order, read-only. Use {@link #addField} to modify. */
  public List<Field> getFields() {
    return fieldsView;
  }

  /**
   * Adds a tag keeping the tags sorted by key. A tag with an existing key replaces the value.
   *
   * @param key Tag key
   * @param value Tag value
   * @return Self
   */
  public Row addTag(String key, String value) {
    int low = 0;
    int high = tags.size();
    while (low < high) {
      final int mid = (low + high) >>> 1;
      final int cmp = tags.get(mid).getKey().compareTo(key);
      if (cmp < 0) {
        low = mid + 1;
      } else if (cmp > 0) {
        high = mid;
      } else {
        tags.get(mid).setValue(value);
        return this;
      }
    }
    tags.add(low, new Tag(key, value));
    indexDirty = true;
    return this;
  }

  public Row addField(Field field) {
    fields.add(field);
    indexDirty = true;
    return this;
  }

  /**
   * Returns the column position of a tag or field.
   *
   * @param columnName Tag key or field key
   * @return The position, or -1 if the row does not have the column
   */
  public int indexOfColumn(String columnName) {
    if (indexDirty) {
      rebuildColumnIndex();
    }
    final Integer index = columnToIndex.get(columnName);
    return index != null ? index : -1;
  }

  /**
   * Returns a field by key.
   *
   * @param key Field key
   * @return The field, or null if the row does not have the field
   */
  public Field getField(String key) {
    final int index = indexOfColumn(key);
    if (index < tags.size()) {
      return null;
    }
    return fields.get(index - tags.size());
  }

  /**
   * Returns a tag by key.
   *
   * @param key Tag key
   * @return The tag, or null if the row does not have the tag
   */
  public Tag getTag(String key) {
    final int index = indexOfColumn(key);
    if (index < 0 || index >= tags.size()) {
      return null;
    }
    return tags.get(index);
  }

  public void addStreamId(long streamId) {
    streamIds.add(streamId);
  }

  public List<Long> getStreamIds() {
    return Collections.unmodifiableList(streamIds);
  }

  /** Clears the row content. The allocated lists are kept. */
  public void reset() {
    name = null;
    timestamp = 0;
    tags.clear();
    fields.clear();
    columnToIndex.clear();
    indexDirty = false;
    streamOnly = false;
    streamIds.clear();
    shardKey = null;
  }

  private void rebuildColumnIndex() {
    columnToIndex.clear();
    int index = 0;
    for (final var tag : tags) {
      columnToIndex.put(tag.getKey(), index++);
    }
    for (final var field : fields) {
      columnToIndex.put(field.getKey(), index++);
    }
    indexDirty = false;
  }
}
