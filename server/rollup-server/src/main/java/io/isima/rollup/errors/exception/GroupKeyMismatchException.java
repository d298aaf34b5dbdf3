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

/**
 * Exception thrown when a group key does not decode to the expected number of dimension values.
 *
 * <p>It indicates corrupted data or a schema change in the middle of a batch.
 */
public class GroupKeyMismatchException extends RollupException {

  private static final long serialVersionUID = -5078351344427697725L;

  public GroupKeyMismatchException(int actualCount, int expectedCount) {
    super(
        StreamError.GROUP_KEY_MISMATCH,
        String.format("groupValues=%d, dimensions=%d", actualCount, expectedCount));
  }

  public GroupKeyMismatchException(String message) {
    super(StreamError.GROUP_KEY_MISMATCH, message);
  }
}
