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
 * Thrown when a {@link Matrix} can't be built or a failed {@link MatrixResult} is unwrapped.
 *
 * @since 1.0
 */
public final class MatrixException extends IllegalArgumentException {

  private final MatrixError error;

  public MatrixException(MatrixError error, String message) {
    super(message);
    this.error = Preconditions.checkNotNull(error);
  }

  public MatrixError getError() {
    return error;
  }

  @Override
  public String toString() {
    return error + ": " + getMessage();
  }

}
