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

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.junit.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.isima.rollup.errors.GenericError;
import io.isima.rollup.errors.exception.OperationCanceledException;
import io.isima.rollup.errors.exception.RollupException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.Test;

public class ExecutionStateTest {

  @Test
  public void testCancelPropagatesToBranches() throws Exception {
    final var parent = new GenericExecutionState("insert", Runnable::run);
    final var branch = new GenericExecutionState("stream", parent);
    assertSame(parent.getExecutor(), branch.getExecutor());
    branch.checkCanceled();

    parent.cancel();
    assertTrue(branch.isCanceled());
    try {
      branch.checkCanceled();
      fail("exception is expected");
    } catch (OperationCanceledException e) {
      assertThat(e.getInfo(), is(GenericError.OPERATION_CANCELED));
      assertThat(e.getMessage(), containsString("stream"));
    }
  }

  @Test
  public void testCancelBranchOnly() {
    final var parent = new GenericExecutionState("insert", Runnable::run);
    final var branch = new GenericExecutionState("stream", parent);
    branch.cancel();
    assertFalse(parent.isCanceled());
  }

  @Test
  public void testCallTrace() {
    final var parent = new GenericExecutionState("insert", Runnable::run);
    parent.addHistory("(parse)");
    final var branch = new GenericExecutionState("streamCalculate", parent);
    branch.addHistory("(prepare)(accumulate");
    branch.markError();

    final var traces = parent.getCallTraces();
    assertEquals(2, traces.size());
    assertThat(traces.get(0), containsString("insert: (parse)(->streamCalculate:)"));
    assertThat(traces.get(1), containsString("streamCalculate: (prepare)(accumulate*"));
  }

  @Test
  public void testLogContextShared() {
    final var parent = new GenericExecutionState("insert", Runnable::run);
    parent.setStreamName("cpu_rollup");
    final var branch = new GenericExecutionState("stream", parent);
    branch.putLogContext("rows", 3);
    assertEquals(3, parent.getLogContext().get("rows"));
    assertEquals("cpu_rollup", branch.getStreamName());
  }

  @Test
  public void testSupplyWrapsRollupException() {
    try {
      ExecutionHelper.supply(
          () -> {
            throw new RollupException(GenericError.APPLICATION_ERROR, "failed");
          });
      fail("exception is expected");
    } catch (CompletionException e) {
      assertThat(e.getCause(), instanceOf(RollupException.class));
    }
    assertEquals(Integer.valueOf(3), ExecutionHelper.supply(() -> 3));
  }

  @Test
  public void testSupplyAsync() throws Exception {
    assertEquals("ok", ExecutionHelper.supplyAsync(() -> "ok", Runnable::run).get());
    try {
      ExecutionHelper.supplyAsync(
              () -> {
                throw new OperationCanceledException("x");
              },
              Runnable::run)
          .get(1, TimeUnit.SECONDS);
      fail("exception is expected");
    } catch (ExecutionException e) {
      assertThat(
          ExecutionHelper.unwrapCompletionException(e),
          instanceOf(OperationCanceledException.class));
    }
  }
}
