/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.skc.common.util;

import exm.skc.common.exceptions.SKCRuntimeError;

/**
 * Outcome of a step that may fail.  Used where a failure is found deep
 * inside a recursive walk but must not be raised until the caller has
 * decided nothing will be mutated.
 *
 * @param <T> value type
 * @param <E> error type
 */
public class Result<T, E extends Exception> {
  private final T value;
  private final E error;

  private Result(T value, E error) {
    this.value = value;
    this.error = error;
  }

  public static <T, E extends Exception> Result<T, E> ok(T value) {
    return new Result<T, E>(value, null);
  }

  public static <T, E extends Exception> Result<T, E> error(E error) {
    assert(error != null);
    return new Result<T, E>(null, error);
  }

  public boolean isOk() {
    return error == null;
  }

  /**
   * @return the value
   * @throws SKCRuntimeError if this is an error
   */
  public T get() {
    if (error != null) {
      throw new SKCRuntimeError("Result holds error: " + error.getMessage(),
                                error);
    }
    return value;
  }

  public E getError() {
    return error;
  }

  public T getOrThrow() throws E {
    if (error != null) {
      throw error;
    }
    return value;
  }

  /**
   * Pass error on to a caller expecting a different value type
   */
  public <U> Result<U, E> propagate() {
    if (error == null) {
      throw new SKCRuntimeError("Cannot propagate successful result");
    }
    return Result.error(error);
  }

  @Override
  public String toString() {
    return isOk() ? "Ok(" + value + ")" : "Error(" + error.getMessage() + ")";
  }
}
