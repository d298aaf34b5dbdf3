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

/** Errors of stream task aggregation. */
public enum StreamError implements RollupError {
  UNKNOWN_STREAM_TASK("STREAM00", Status.BAD_REQUEST, "Stream task is not registered"),
  UNSUPPORTED_FIELD_TYPE(
      "STREAM01", Status.BAD_REQUEST, "Field type is not supported by stream aggregation"),
  GROUP_KEY_MISMATCH(
      "STREAM02",
      Status.INTERNAL_SERVER_ERROR,
      "Group key does not match the dimensions of the stream task"),
  ;

  private final String errorCode;
  private final Status status;
  private final String message;

  private StreamError(String errorCode, Status status, String message) {
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
