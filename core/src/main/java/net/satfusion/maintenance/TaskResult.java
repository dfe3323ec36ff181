// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.maintenance;

/**
 * The outcome of one unit of work: the input and either the result or the
 * error it failed with.
 * 
 * @param <I> The input type.
 * @param <O> The result type.
 * 
 * @since 1.0
 */
public final class TaskResult<I, O> {
  
  /** The input. */
  private final I input;
  
  /** The result, null on failure. */
  private final O result;
  
  /** The error, null on success. */
  private final Exception error;
  
  private TaskResult(final I input, final O result, final Exception error) {
    this.input = input;
    this.result = result;
    this.error = error;
  }
  
  /**
   * @param input The input.
   * @param result The result, may be null.
   * @return A successful result.
   */
  public static <I, O> TaskResult<I, O> success(final I input, 
                                                final O result) {
    return new TaskResult<I, O>(input, result, null);
  }
  
  /**
   * @param input The input.
   * @param error The non-null error.
   * @return A failed result.
   */
  public static <I, O> TaskResult<I, O> failure(final I input, 
                                                final Exception error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return new TaskResult<I, O>(input, null, error);
  }
  
  /** @return The input. */
  public I input() {
    return input;
  }
  
  /** @return The result, null on failure. */
  public O result() {
    return result;
  }
  
  /** @return The error, null on success. */
  public Exception error() {
    return error;
  }
  
  /** @return True if the unit succeeded. */
  public boolean isSuccess() {
    return error == null;
  }
  
  @Override
  public String toString() {
    return "TaskResult{input=" + input + (error == null 
        ? ", result=" + result : ", error=" + error) + "}";
  }
}
