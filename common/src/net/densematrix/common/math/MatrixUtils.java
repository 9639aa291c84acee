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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;

import net.densematrix.common.LangUtils;
import net.densematrix.common.random.RandomManager;

/**
 * Contains utility methods for creating and converting {@link Matrix} instances.
 *
 * @since 1.0
 */
public final class MatrixUtils {

  private static final Splitter ROW_SPLITTER = Splitter.on(';').trimResults();
  private static final Splitter VALUE_SPLITTER = Splitter.on(',').trimResults();

  private MatrixUtils() {
  }

  /**
   * Multiplies with the scalar on the left. Same as {@code M.scale(scalar)}.
   *
   * @param scalar value to multiply by
   * @param M matrix to scale
   * @return scalar * M as a newly allocated matrix
   */
  public static Matrix scale(double scalar, Matrix M) {
    return M.scale(scalar);
  }

  /**
   * @return new n x n identity matrix
   */
  public static Matrix identity(int n) {
    Matrix result = new Matrix(n, n);
    for (int i = 0; i < n; i++) {
      result.set(i, i, 1.0);
    }
    return result;
  }

  /**
   * Parses a matrix literal, rows separated by {@code ;} and values within a row by {@code ,}, like
   * {@code "1, 2, 3; 4, 5, 6"} for a 2 x 3 matrix. Whitespace around values is ignored. An empty or blank literal
   * is a 0 x 0 matrix.
   *
   * @param literal matrix literal
   * @return parsed matrix
   * @throws MatrixException with {@link MatrixError#RAGGED_ROWS} if rows have different numbers of values
   * @throws IllegalArgumentException if a value is not a finite number
   */
  public static Matrix parse(CharSequence literal) {
    Preconditions.checkNotNull(literal);
    if (literal.toString().trim().isEmpty()) {
      return new Matrix();
    }
    List<double[]> rows = Lists.newArrayList();
    for (String row : ROW_SPLITTER.split(literal)) {
      List<String> tokens = VALUE_SPLITTER.splitToList(row);
      double[] values = new double[tokens.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = LangUtils.parseDouble(tokens.get(i));
      }
      rows.add(values);
    }
    return Matrix.of(rows.toArray(new double[rows.size()][]));
  }

  /**
   * @return new matrix of values uniformly distributed in [-1,1), drawn from {@link RandomManager#getRandom()}
   */
  public static Matrix random(int rows, int columns) {
    return random(rows, columns, RandomManager.getRandom());
  }

  /**
   * @param random source of values
   * @return new matrix of values uniformly distributed in [-1,1)
   */
  public static Matrix random(int rows, int columns, RandomGenerator random) {
    Matrix result = new Matrix(rows, columns);
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < columns; col++) {
        result.set(row, col, 2.0 * random.nextDouble() - 1.0);
      }
    }
    return result;
  }

  /**
   * @param M matrix to convert; must not be empty, since Commons Math has no empty matrices
   * @return a Commons Math copy of {@code M}
   */
  public static RealMatrix toRealMatrix(Matrix M) {
    Preconditions.checkArgument(!M.isEmpty(), "Can't convert empty %s matrix", M.describeDimensions());
    return new Array2DRowRealMatrix(M.toArray(), false);
  }

  /**
   * @param M Commons Math matrix to convert
   * @return new {@link Matrix} holding a copy of the values of {@code M}
   */
  public static Matrix fromRealMatrix(RealMatrix M) {
    return Matrix.of(M.getData());
  }

}
