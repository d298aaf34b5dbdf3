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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Column value type of a measurement schema. */
public enum FieldType {
  TAG,
  INTEGER,
  FLOAT,
  BOOLEAN,
  STRING;

  /**
   * Answers whether a value of the type can be folded by a numeric aggregate function.
   *
   * <p>Booleans are carried as 0/1 numbers and count as numeric.
   */
  public boolean isNumeric() {
    switch (this) {
      case INTEGER:
      case FLOAT:
      case BOOLEAN:
        return true;
      default:
        return false;
    }
  }

  @JsonCreator
  public static FieldType forValueCaseInsensitive(String value) {
    return FieldType.valueOf(value.toUpperCase());
  }

  @JsonValue
  public String stringify() {
    return name();
  }
}
