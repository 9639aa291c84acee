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

/**
 * The kinds of precondition failure a {@link Matrix} operation can report.
 *
 * @since 1.0
 */
public enum MatrixError {

  /** Operand dimensions do not fit the operation, as in adding a 2 x 3 to a 3 x 2 matrix. */
  DIMENSION_MISMATCH,

  /** The operation needs a square, non-empty matrix. */
  NON_SQUARE_MATRIX,

  /** Rows of a literal do not all have the length of the first row. */
  RAGGED_ROWS

}
