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

import io.isima.rollup.errors.WriteError;

/** Exception thrown when no destination shard can be determined for a row. */
public class UnroutableRowException extends RollupException {

  private static final long serialVersionUID = -286589324989644547L;

  public UnroutableRowException(String measurement, long timestamp, long shardGroupId) {
    super(
        WriteError.UNROUTABLE_ROW,
        String.format(
            "measurement=%s, timestamp=%d, shardGroup=%d", measurement, timestamp, shardGroupId));
  }

  @Override
  public boolean isRowScoped() {
    return true;
  }
}
