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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import io.isima.rollup.errors.exception.GroupKeyMismatchException;
import io.isima.rollup.models.Field;
import io.isima.rollup.models.Row;
import io.isima.rollup.models.Tag;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encodes the dimension values of a row into a group key, and decodes them back.
 *
 * <p>A group key is the values of the tag dimensions followed by the values of the field-index
 * dimensions, joined by {@link #SEPARATOR}. A dimension the row does not have contributes an
 * empty string. The key of a stream without dimensions is the empty string.
 */
public class GroupKeyCodec {

  /** Separator of group key components. Tag values must not contain it. */
  public static final char SEPARATOR = '\u0000';

  private static final Joiner JOINER = Joiner.on(SEPARATOR);
  private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

  private final List<String> tagDimKeys;
  private final List<String> fieldIndexKeys;

  /**
   * The constructor.
   *
   * @param tagDimKeys Tag dimension keys, sorted
   * @param fieldIndexKeys Dimension keys that refer to fields
   */
  public GroupKeyCodec(List<String> tagDimKeys, List<String> fieldIndexKeys) {
    this.tagDimKeys = List.copyOf(tagDimKeys);
    this.fieldIndexKeys = List.copyOf(fieldIndexKeys);
  }

  public int dimensionCount() {
    return tagDimKeys.size() + fieldIndexKeys.size();
  }

  public List<String> getTagDimKeys() {
    return tagDimKeys;
  }

  public List<String> getFieldIndexKeys() {
    return fieldIndexKeys;
  }

  public String encode(Row row) {
    if (dimensionCount() == 0) {
      return "";
    }
    final var values = new ArrayList<String>(dimensionCount());
    lookupTags(tagDimKeys, row.getTags(), values);
    for (final var key : fieldIndexKeys) {
      final Field field = row.getField(key);
      values.add(field != null ? field.valueAsString() : "");
    }
    return JOINER.join(values);
  }

  /**
   * Splits a group key into the dimension values.
   *
   * @param groupKey The group key
   * @return Values in the order of the tag dimension keys then the field-index keys
   * @throws GroupKeyMismatchException when the number of components does not match
   */
  public List<String> decode(String groupKey) throws GroupKeyMismatchException {
    return decode(groupKey, dimensionCount());
  }

  public static List<String> decode(String groupKey, int expectedCount)
      throws GroupKeyMismatchException {
    if (groupKey.isEmpty() && expectedCount == 0) {
      return Collections.emptyList();
    }
    final List<String> values = SPLITTER.splitToList(groupKey);
    if (values.size() != expectedCount) {
      throw new GroupKeyMismatchException(values.size(), expectedCount);
    }
    return values;
  }

  /**
   * Finds the values of the keys in a sorted tag list.
   *
   * <p>Each key is looked up by binary search over the tags that follow the previous match, so
   * the keys must be sorted as well for every present tag to be found.
   */
  static void lookupTags(List<String> keys, List<Tag> tags, List<String> values) {
    int from = 0;
    for (final var key : keys) {
      int low = from;
      int high = tags.size();
      while (low < high) {
        final int mid = (low + high) >>> 1;
        if (tags.get(mid).getKey().compareTo(key) < 0) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
      if (low < tags.size() && tags.get(low).getKey().equals(key)) {
        final var value = tags.get(low).getValue();
        values.add(value != null ? value : "");
        from = low + 1;
      } else {
        values.add("");
        from = low;
      }
    }
  }
}
