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
package io.isima.rollup.errors.exception;

import io.isima.rollup.errors.StreamError;

/** Exception thrown when a stream aggregate receives a field of a non-numeric type. */
public class UnsupportedFieldTypeException extends RollupException {

  private static final long serialVersionUID = -4516260582430073768L;

  public UnsupportedFieldTypeException(String fieldName, String streamName) {
    super(
        StreamError.UNSUPPORTED_FIELD_TYPE,
        String.format(
            "the string type of field %s is not supported; stream=%s", fieldName, streamName));
  }
}
