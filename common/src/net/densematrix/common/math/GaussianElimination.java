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

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elimination routines behind {@link Matrix#determinant()} and {@link Matrix#rank()}. Each works on its own copy
 * of a row-major buffer. Rows are swapped by exchanging entries of a row offset table, rather than by moving
 * values.
 */
final class GaussianElimination {

  private static final Logger log = LoggerFactory.getLogger(GaussianElimination.class);

  private GaussianElimination() {
  }

  /**
   * @param source row-major values of an n x n matrix; not modified
   * @param n dimension
   * @return determinant, exactly 0.0 if some pivot falls below {@link Matrix#ZERO_THRESHOLD}
   */
  static double determinant(double[] source, int n) {
    double[] a = source.clone();
    int[] rowOffsets = rowOffsets(n, n);
    double det = 1.0;
    int sign = 1;

    for (int i = 0; i < n; i++) {
      // First row holding the largest magnitude in column i wins ties
      int pivot = i;
      double pivotMagnitude = FastMath.abs(a[rowOffsets[i] + i]);
      for (int k = i + 1; k < n; k++) {
        double magnitude = FastMath.abs(a[rowOffsets[k] + i]);
        if (magnitude > pivotMagnitude) {
          pivot = k;
          pivotMagnitude = magnitude;
        }
      }
      if (pivotMagnitude < Matrix.ZERO_THRESHOLD) {
        log.debug("Singular at column {} of {}: pivot magnitude {}", i, n, pivotMagnitude);
        return 0.0;
      }

      if (pivot != i) {
        swap(rowOffsets, i, pivot);
        sign = -sign;
      }

      int pivotOffset = rowOffsets[i];
      double pivotValue = a[pivotOffset + i];
      for (int k = i + 1; k < n; k++) {
        int offset = rowOffsets[k];
        double factor = a[offset + i] / pivotValue;
        if (factor != 0.0) {
          for (int j = i; j < n; j++) {
            a[offset + j] -= factor * a[pivotOffset + j];
          }
        }
      }
      det *= pivotValue;
    }
    return sign * det;
  }

  /**
   * @param source row-major values of a rows x columns matrix; not modified
   * @return number of columns yielding a pivot above {@link Matrix#ZERO_THRESHOLD} in row-echelon reduction
   */
  static int rank(double[] source, int rows, int columns) {
    double[] a = source.clone();
    int[] rowOffsets = rowOffsets(rows, columns);
    int rank = 0;

    int row = 0;
    for (int col = 0; col < columns && row < rows; col++) {
      // Not partial pivoting: the first usable row is taken
      int selected = -1;
      for (int i = row; i < rows; i++) {
        if (FastMath.abs(a[rowOffsets[i] + col]) > Matrix.ZERO_THRESHOLD) {
          selected = i;
          break;
        }
      }
      if (selected < 0) {
        continue;
      }

      if (selected != row) {
        swap(rowOffsets, row, selected);
      }

      int pivotOffset = rowOffsets[row];
      double pivotValue = a[pivotOffset + col];
      for (int i = row + 1; i < rows; i++) {
        int offset = rowOffsets[i];
        double factor = a[offset + col] / pivotValue;
        if (factor != 0.0) {
          for (int j = col; j < columns; j++) {
            a[offset + j] -= factor * a[pivotOffset + j];
          }
        }
      }
      row++;
      rank++;
    }
    log.debug("Rank of {} x {} matrix is {}", rows, columns, rank);
    return rank;
  }

  private static int[] rowOffsets(int rows, int columns) {
    int[] offsets = new int[rows];
    for (int i = 0; i < rows; i++) {
      offsets[i] = i * columns;
    }
    return offsets;
  }

  private static void swap(int[] values, int i, int j) {
    int temp = values[i];
    values[i] = values[j];
    values[j] = temp;
  }

}
