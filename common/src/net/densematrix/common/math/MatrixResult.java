/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.densematrix.common.math;

import com.google.common.base.Preconditions;

/**
 * <p>The outcome of a {@link Matrix} operation that has preconditions: either the computed value, or a
 * {@link MatrixError} saying why nothing could be computed.</p>
 *
 * <p>A successful result holding an empty matrix or {@code 0.0} is a legitimate answer, and is never used
 * to signal failure.</p>
 *
 * @param <T> type of the computed value
 * @since 1.0
 */
public final class MatrixResult<T> {

  private final T value;
  private final MatrixError error;
  private final String message;

  private MatrixResult(T value, MatrixError error, String message) {
    this.value = value;
    this.error = error;
    this.message = message;
  }

  public static <T> MatrixResult<T> success(T value) {
    return new MatrixResult<T>(Preconditions.checkNotNull(value), null, null);
  }

  public static <T> MatrixResult<T> failure(MatrixError error, String message) {
    return new MatrixResult<T>(null, Preconditions.checkNotNull(error), message);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @return reason for failure, or {@code null} if this result is a success
   */
  public MatrixError getError() {
    return error;
  }

  /**
   * @return description of the failure, or {@code null} if this result is a success
   */
  public String getMessage() {
    return message;
  }

  /**
   * @return the computed value
   * @throws MatrixException if this result is a failure
   */
  public T get() {
    if (error != null) {
      throw new MatrixException(error, message);
    }
    return value;
  }

  /**
   * @return the computed value, or {@code fallback} if this result is a failure
   */
  public T orElse(T fallback) {
    return error == null ? value : fallback;
  }

  @Override
  public String toString() {
    return error == null ? "Success[" + value + ']' : "Failure[" + error + ": " + message + ']';
  }

}
