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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A field (value column) of a row.
 *
 * <p>Numeric types, booleans included, carry their value in numValue. STRING fields carry it in
 * strValue.
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class Field {
  private String key;
  private FieldType type;
  private double numValue;
  private String strValue;

  public static Field ofNumber(String key, FieldType type, double value) {
    return new Field(key, type, value, null);
  }

  public static Field ofFloat(String key, double value) {
    return new Field(key, FieldType.FLOAT, value, null);
  }

  public static Field ofInteger(String key, long value) {
    return new Field(key, FieldType.INTEGER, value, null);
  }

  public static Field ofString(String key, String value) {
    return new Field(key, FieldType.STRING, 0, value);
  }

  /** Returns the value in string form, integers without a fraction part. */
  public String valueAsString() {
    if (type == null) {
      return "";
    }
    switch (type) {
      case STRING:
      case TAG:
        return strValue != null ? strValue : "";
      case INTEGER:
        return Long.toString((long) numValue);
      case BOOLEAN:
        return Boolean.toString(numValue != 0);
      default:
        return Double.toString(numValue);
    }
  }
}
