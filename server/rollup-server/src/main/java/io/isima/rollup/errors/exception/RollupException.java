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

import io.isima.rollup.errors.RollupError;
import java.util.Objects;
import javax.ws.rs.core.Response.Status;

/**
 * An exception thrown when an application error occurred.
 *
 * <p>Most subclasses abort the whole batch being processed. Subclasses that return true from
 * {@link #isRowScoped()} concern a single row only; the caller drops the row and continues.
 */
public class RollupException extends Exception implements RollupError {

  private static final long serialVersionUID = -6630462170718036441L;

  protected final RollupError info;

  protected String mymessage;

  public RollupException(RollupError info) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public RollupException(RollupError info, String additionalMessage) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public RollupException(RollupError info, String additionalMessage, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public RollupError getInfo() {
    return info;
  }

  /** Answers whether the error concerns a single row rather than the whole batch. */
  public boolean isRowScoped() {
    return false;
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  @Override
  public Status getStatus() {
    return info.getStatus();
  }

  @Override
  public String getMessage() {
    return mymessage;
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + ": " + getErrorCode() + " " + getMessage();
  }
}
