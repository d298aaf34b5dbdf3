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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.HashMap;
import java.util.Map;

/**
 * Aggregate functions available for stream tasks.
 *
 * <p>Every function is associative and commutative, so the arrival order of samples within a
 * window does not change the result.
 */
public enum AggregateFunction {
  SUM(0.0) {
    @Override
    public double combine(double accumulator, double sample) {
      return accumulator + sample;
    }
  },
  COUNT(0.0) {
    @Override
    public double contribution(double value) {
      return 1.0;
    }

    @Override
    public double combine(double accumulator, double sample) {
      return accumulator + sample;
    }
  },
  MIN(Double.POSITIVE_INFINITY) {
    @Override
    public double combine(double accumulator, double sample) {
      return Math.min(accumulator, sample);
    }
  },
  MAX(Double.NEGATIVE_INFINITY) {
    @Override
    public double combine(double accumulator, double sample) {
      return Math.max(accumulator, sample);
    }
  };

  private static final Map<String, AggregateFunction> nameMap = createNameMap();

  private final double identity;

  AggregateFunction(double identity) {
    this.identity = identity;
  }

  private static Map<String, AggregateFunction> createNameMap() {
    final var map = new HashMap<String, AggregateFunction>();
    for (final var value : values()) {
      map.put(value.name().toLowerCase(), value);
    }
    return map;
  }

  /**
   * Returns the value an empty accumulator is seeded with before the first sample is combined.
   */
  public double identity() {
    return identity;
  }

  /**
   * Converts a field value to the sample this function folds.
   *
   * @param value The field value of an incoming row
   * @return The sample to combine
   */
  public double contribution(double value) {
    return value;
  }

  /**
   * Folds a sample into an accumulator.
   *
   * @param accumulator Current accumulator value
   * @param sample The sample to fold
   * @return New accumulator value
   */
  public abstract double combine(double accumulator, double sample);

  /**
   * Resolves a function by its name, case-insensitively.
   *
   * @param name Function name such as "sum"
   * @return The function, or null if the name is unknown
   */
  public static AggregateFunction forName(String name) {
    if (name == null) {
      return null;
    }
    return nameMap.get(name.trim().toLowerCase());
  }

  @JsonValue
  public String stringify() {
    return name().toLowerCase();
  }
}
