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

import io.isima.rollup.errors.exception.RollupException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Helper class that provides functional interfaces that catch rollup exceptions and rethrows them
 * as CompletionException's.
 *
 * <p>Useful for writing asynchronous logic that throws checked rollup exceptions.
 */
public class ExecutionHelper {

  /**
   * Supplier class that may throw RollupException.
   *
   * @param <T> Class to supply
   */
  @FunctionalInterface
  public interface RollupSupplier<T> {
    T get() throws RollupException;
  }

  /**
   * A wrapper method that executes a RollupSupplier instance.
   *
   * <p>The method catches an exception if thrown to convert it to CompletionException.
   *
   * @param supplier The supplier
   * @return The supplied value
   */
  public static <T> T supply(RollupSupplier<T> supplier) {
    try {
      return supplier.get();
    } catch (RollupException e) {
      throw new CompletionException(e);
    }
  }

  /**
   * Runs a supplier asynchronously.
   *
   * @param supplier The supplier
   * @param executor Executor to run the supplier on
   * @return Future of the supplied value; completes exceptionally with a CompletionException that
   *     wraps the RollupException thrown by the supplier
   */
  public static <T> CompletableFuture<T> supplyAsync(
      RollupSupplier<T> supplier, Executor executor) {
    return CompletableFuture.supplyAsync(() -> supply(supplier), executor);
  }

  /**
   * Unwraps CompletionException and ExecutionException to get the original cause.
   *
   * @param t The throwable thrown by a future
   * @return The original cause
   */
  public static Throwable unwrapCompletionException(Throwable t) {
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
