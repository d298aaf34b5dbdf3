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
package io.isima.rollup.execution;

import io.isima.rollup.errors.exception.OperationCanceledException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import lombok.Getter;
import lombok.Setter;

/**
 * Class that keeps an operation's state.
 *
 * <p>The class is responsible to
 *
 * <ul>
 *   <li>Keep operation parameters, such as the stream name
 *   <li>Carry the cancellation signal of the operation. Canceling a state cancels its branches
 *   <li>Keep track of operations, in place of stack trace. The history of the process and its
 *       branches tells where an aborted operation stopped
 * </ul>
 *
 * <p>History entries are either stage names or branched states. A stage adds "(stageName" when it
 * starts and ")" when it ends, so that the call trace of a failed batch looks like:
 *
 * <pre>
 * streamCalculate: (checkDbRp)(accumulate)(mapRowsToShard
 * </pre>
 */
public abstract class ExecutionState {
  // required parameters
  protected final String executionName;
  protected final Executor executor;
  protected final ExecutionState parent;

  protected final List<Object> history;

  private volatile boolean canceled;

  // optional parameters
  @Getter @Setter protected String streamName;

  // Context to log when an error happened
  @Getter protected final Map<String, Object> logContext;

  @Getter private final long createdAt = System.currentTimeMillis();

  public ExecutionState(String executionName, Executor executor) {
    Objects.requireNonNull(executionName);
    this.executionName = executionName;
    this.executor = executor;
    this.parent = null;
    history = Collections.synchronizedList(new ArrayList<>());
    logContext = new LinkedHashMap<>();
  }

  public ExecutionState(String executionName, ExecutionState parent) {
    this(executionName, parent, parent.getExecutor());
  }

  public ExecutionState(String executionName, ExecutionState parent, Executor executor) {
    Objects.requireNonNull(executionName);
    Objects.requireNonNull(parent);
    this.executionName = executionName;
    this.executor = executor;
    this.streamName = parent.streamName;
    this.parent = parent;
    parent.addBranch(this);
    history = Collections.synchronizedList(new ArrayList<>());
    logContext = parent.logContext;
  }

  public ExecutionState getParent() {
    return parent;
  }

  public String getExecutionName() {
    return executionName;
  }

  public Executor getExecutor() {
    return executor;
  }

  public void addHistory(String stageName) {
    history.add(stageName);
  }

  public void addBranch(ExecutionState branchedState) {
    history.add(branchedState);
  }

  public void markDone() {
    history.add(":done");
  }

  public void markError() {
    history.add("*");
  }

  /** Requests cancellation. Running stages stop at their next check point. */
  public void cancel() {
    canceled = true;
  }

  /** Answers whether the operation or any of its ancestors is canceled. */
  public boolean isCanceled() {
    return canceled || (parent != null && parent.isCanceled());
  }

  /**
   * Check point for cooperative cancellation.
   *
   * @throws OperationCanceledException when the operation is canceled
   */
  public void checkCanceled() throws OperationCanceledException {
    if (isCanceled()) {
      throw new OperationCanceledException(executionName);
    }
  }

  /**
   * Puts a log object entry.
   *
   * <p>The specified value is not stringified until getting logged.
   *
   * @param name Context name
   * @param value Value as an object. The object must provide a meaningful string by toString
   *     method.
   */
  public void putLogContext(String name, Object value) {
    logContext.put(name, value);
  }

  public List<String> getCallTraces() {
    final var result = new ArrayList<String>();
    dfsHistory(result);
    // deeper threads come first, reversing
    Collections.reverse(result);
    return result;
  }

  public String getCallTraceString() {
    return String.join("\n", getCallTraces());
  }

  private void dfsHistory(ArrayList<String> result) {
    final var sb = new StringBuilder(String.format("%d %s: ", createdAt, executionName));
    synchronized (history) {
      for (var stage : history) {
        if (stage instanceof String) {
          sb.append(stage);
        } else {
          var forked = (ExecutionState) stage;
          sb.append("(->").append(forked.executionName).append(":)");
          forked.dfsHistory(result);
        }
      }
    }
    result.add(sb.toString());
  }
}
