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

public enum GenericError implements RollupError {
  APPLICATION_ERROR("GENERIC00", Status.INTERNAL_SERVER_ERROR, "Generic server error"),
  INVALID_REQUEST("GENERIC01", Status.BAD_REQUEST, "Invalid request"),
  OPERATION_CANCELED("GENERIC02", Status.SERVICE_UNAVAILABLE, "Operation canceled"),
  INVALID_CONFIGURATION(
      "GENERIC03",
      Status.INTERNAL_SERVER_ERROR,
      "Unable to complete operation due to invalid configuration"),
  ;

  private final String errorCode;
  private final Status status;
  private final String message;

  private GenericError(String errorCode, Status status, String message) {
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
