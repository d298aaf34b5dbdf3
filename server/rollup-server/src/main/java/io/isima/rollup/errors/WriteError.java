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
package io.isima.rollup.errors;

import javax.ws.rs.core.Response.Status;

/** Errors of mapping aggregated rows to storage shards. */
public enum WriteError implements RollupError {
  NO_SHARD_KEY("WRITE00", Status.INTERNAL_SERVER_ERROR, "No shard key is available"),
  SHARD_KEY_MISSING("WRITE01", Status.BAD_REQUEST, "Row must have all shard key components"),
  SHARD_KEY_TOO_LARGE("WRITE02", Status.BAD_REQUEST, "Shard key is too large"),
  UNROUTABLE_ROW("WRITE03", Status.INTERNAL_SERVER_ERROR, "Unable to map the row to a shard"),
  ;

  private final String errorCode;
  private final Status status;
  private final String message;

  private WriteError(String errorCode, Status status, String message) {
    this.errorCode = errorCode;
    this.status = status;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public Status getStatus() {
    return status;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}
