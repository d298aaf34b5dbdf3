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

import io.isima.rollup.errors.exception.InvalidConfigurationException;
import io.isima.rollup.models.AggregateFunction;
import io.isima.rollup.models.FieldType;
import io.isima.rollup.models.StreamInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Compiles the calls of a stream registration. */
public class FieldCallBuilder {

  private FieldCallBuilder() {}

  /**
   * Builds the field calls of a stream, in declaration order.
   *
   * @param streamInfo The stream registration
   * @param srcSchema Column types of the source measurement
   * @param dstSchema Column types of the destination measurement
   * @return Unmodifiable list of field calls
   * @throws InvalidConfigurationException when a call is malformed or names an unknown function
   */
  public static List<FieldCall> build(
      StreamInfo streamInfo, Map<String, FieldType> srcSchema, Map<String, FieldType> dstSchema)
      throws InvalidConfigurationException {
    final var calls = streamInfo.getCalls();
    final var result = new ArrayList<FieldCall>(calls.size());
    for (int i = 0; i < calls.size(); ++i) {
      final var call = calls.get(i);
      if (call.getField() == null || call.getField().isBlank()) {
        throw new InvalidConfigurationException(
            String.format("stream=%s, call #%d: source field is missing", streamInfo.getName(), i));
      }
      final var function = AggregateFunction.forName(call.getCall());
      if (function == null) {
        throw new InvalidConfigurationException(
            String.format(
                "stream=%s, field=%s: unknown aggregate function '%s'",
                streamInfo.getName(), call.getField(), call.getCall()));
      }
      final String alias =
          call.getAlias() != null && !call.getAlias().isBlank() ? call.getAlias() : call.getField();
      final FieldType inputType = lookup(srcSchema, call.getField());
      result.add(
          new FieldCall(
              i,
              i,
              call.getField(),
              alias,
              function,
              inputType,
              outputType(function, inputType, lookup(dstSchema, alias))));
    }
    return Collections.unmodifiableList(result);
  }

  private static FieldType lookup(Map<String, FieldType> schema, String column) {
    return schema != null ? schema.get(column) : null;
  }

  private static FieldType outputType(
      AggregateFunction function, FieldType inputType, FieldType declaredType) {
    if (declaredType != null) {
      return declaredType;
    }
    if (function == AggregateFunction.COUNT) {
      return FieldType.INTEGER;
    }
    return inputType != null && inputType.isNumeric() ? inputType : FieldType.FLOAT;
  }
}
