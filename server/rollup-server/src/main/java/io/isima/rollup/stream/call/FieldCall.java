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
package io.isima.rollup.stream.call;

import io.isima.rollup.models.AggregateFunction;
import io.isima.rollup.models.FieldType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Compiled aggregate of a stream task.
 *
 * <p>sourceIndex and destIndex are the positions of the call in the accumulator slots and in the
 * output field list; both equal the declaration order of the call.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class FieldCall {
  private final int sourceIndex;
  private final int destIndex;

  /** Source field name. */
  private final String name;

  /** Output field name. */
  private final String alias;

  private final AggregateFunction function;
  private final FieldType inputType;
  private final FieldType outputType;

  /**
   * Folds a field value into an accumulator.
   *
   * @param accumulator Current accumulator; the function identity for an empty slot
   * @param value The field value
   * @return The new accumulator
   */
  public double accumulate(double accumulator, double value) {
    return function.combine(accumulator, function.contribution(value));
  }
}
