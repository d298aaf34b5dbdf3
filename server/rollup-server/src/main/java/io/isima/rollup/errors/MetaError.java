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

/** Errors reported by the metadata directory. */
public enum MetaError implements RollupError {
  NO_SUCH_DATABASE("META00", Status.NOT_FOUND, "Database not found"),
  NO_SUCH_RETENTION_POLICY("META01", Status.NOT_FOUND, "Retention policy not found"),
  SHARD_GROUP_UNAVAILABLE(
      "META02", Status.SERVICE_UNAVAILABLE, "Unable to resolve the shard group for the time"),
  ;

  private final String errorCode;
  private final Status status;
  private final String message;

  private MetaError(String errorCode, Status status, String message) {
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
