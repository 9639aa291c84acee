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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A dense matrix of {@code double} entries. Entries live in a single buffer owned by the instance, in
 * row-major order; entry (row, col) is at {@code row * columnCount + col}. No two instances share a buffer.</p>
 *
 * <p>A matrix with zero rows or zero columns is a valid, empty matrix.</p>
 *
 * <p>Operations with preconditions on their operands ({@link #add(Matrix)}, {@link #multiply(Matrix)},
 * {@link #determinant()}) return a {@link MatrixResult} rather than throwing, so that a failed operation is
 * never mistaken for a legitimate empty or zero result.</p>
 *
 * <p>This class is not thread-safe.</p>
 *
 * @since 1.0
 */
public final class Matrix {

  private static final Logger log = LoggerFactory.getLogger(Matrix.class);

  /**
   * Absolute tolerance below which a pivot is considered zero by {@link #determinant()} and {@link #rank()}.
   */
  public static final double ZERO_THRESHOLD =
      Double.parseDouble(System.getProperty("densematrix.zeroThreshold", "1.0e-12"));

  private static final double[] NO_DATA = new double[0];

  private int rowCount;
  private int columnCount;
  private double[] data;

  /**
   * Creates an empty 0 x 0 matrix.
   */
  public Matrix() {
    this(0, 0);
  }

  /**
   * Creates a {@code rows} x {@code columns} matrix of zeroes.
   */
  public Matrix(int rows, int columns) {
    Preconditions.checkArgument(rows >= 0 && columns >= 0, "Bad dimensions: %s x %s", rows, columns);
    Preconditions.checkArgument((long) rows * columns <= Integer.MAX_VALUE,
                                "Too many entries: %s x %s", rows, columns);
    this.rowCount = rows;
    this.columnCount = columns;
    this.data = rows == 0 || columns == 0 ? NO_DATA : new double[rows * columns];
  }

  private Matrix(int rows, int columns, double[] data) {
    this.rowCount = rows;
    this.columnCount = columns;
    this.data = data;
  }

  /**
   * Builds a matrix from literal rows. The row count is the number of rows given, and the column count is the
   * length of the first row. Values are copied.
   *
   * @param rows rows of the matrix, all of the same length
   * @return new matrix holding a copy of {@code rows}
   * @throws MatrixException with {@link MatrixError#RAGGED_ROWS} if rows differ in length
   */
  public static Matrix of(double[]... rows) {
    Preconditions.checkNotNull(rows);
    int numRows = rows.length;
    int numColumns = numRows == 0 ? 0 : Preconditions.checkNotNull(rows[0], "Row 0 is null").length;
    Matrix result = new Matrix(numRows, numColumns);
    for (int row = 0; row < numRows; row++) {
      double[] values = Preconditions.checkNotNull(rows[row], "Row %s is null", row);
      if (values.length != numColumns) {
        throw new MatrixException(MatrixError.RAGGED_ROWS,
                                  "Row " + row + " has " + values.length + " values but row 0 has " + numColumns);
      }
      System.arraycopy(values, 0, result.data, row * numColumns, numColumns);
    }
    return result;
  }

  public int getRowCount() {
    return rowCount;
  }

  public int getColumnCount() {
    return columnCount;
  }

  public boolean isEmpty() {
    return rowCount == 0 || columnCount == 0;
  }

  public boolean isSquare() {
    return rowCount == columnCount;
  }

  public double get(int row, int column) {
    return data[index(row, column)];
  }

  public void set(int row, int column, double value) {
    data[index(row, column)] = value;
  }

  private int index(int row, int column) {
    Preconditions.checkElementIndex(row, rowCount, "row");
    Preconditions.checkElementIndex(column, columnCount, "column");
    return row * columnCount + column;
  }

  /**
   * @return a copy of the values in row {@code row}
   */
  public double[] getRow(int row) {
    Preconditions.checkElementIndex(row, rowCount, "row");
    int start = row * columnCount;
    return Arrays.copyOfRange(data, start, start + columnCount);
  }

  /**
   * @return a copy of this matrix's values, as an array of rows
   */
  public double[][] toArray() {
    double[][] result = new double[rowCount][];
    for (int row = 0; row < rowCount; row++) {
      result[row] = getRow(row);
    }
    return result;
  }

  /**
   * @return a deep copy of this matrix
   */
  public Matrix copy() {
    return new Matrix(rowCount, columnCount, data.clone());
  }

  /**
   * Replaces the dimensions and all values of this matrix with a copy of those of {@code other}.
   * The previous buffer is dropped, not reused.
   *
   * @param other matrix to copy from
   */
  public void assign(Matrix other) {
    Preconditions.checkNotNull(other);
    if (other == this) {
      return;
    }
    rowCount = other.rowCount;
    columnCount = other.columnCount;
    data = other.data.clone();
  }

  /**
   * @return new {@code columns x rows} matrix whose entry (j,i) is this matrix's entry (i,j)
   */
  public Matrix transpose() {
    Matrix result = new Matrix(columnCount, rowCount);
    double[] resultData = result.data;
    for (int row = 0; row < rowCount; row++) {
      int offset = row * columnCount;
      for (int col = 0; col < columnCount; col++) {
        resultData[col * rowCount + row] = data[offset + col];
      }
    }
    return result;
  }

  /**
   * @param other matrix of the same dimensions as this one
   * @return elementwise sum, or {@link MatrixError#DIMENSION_MISMATCH} if dimensions differ
   */
  public MatrixResult<Matrix> add(Matrix other) {
    Preconditions.checkNotNull(other);
    if (rowCount != other.rowCount || columnCount != other.columnCount) {
      log.debug("Can't add {} to {}", other.describeDimensions(), describeDimensions());
      return MatrixResult.failure(MatrixError.DIMENSION_MISMATCH,
                                  "Can't add " + other.describeDimensions() + " to " + describeDimensions());
    }
    Matrix result = new Matrix(rowCount, columnCount);
    double[] resultData = result.data;
    double[] otherData = other.data;
    for (int i = 0; i < resultData.length; i++) {
      resultData[i] = data[i] + otherData[i];
    }
    return MatrixResult.success(result);
  }

  /**
   * Computes this matrix times {@code other}. Row i of the result accumulates, for each k, entry (i,k) of this
   * matrix times row k of {@code other}; terms where entry (i,k) is exactly zero are skipped.
   *
   * @param other matrix whose row count equals this matrix's column count
   * @return the product, or {@link MatrixError#DIMENSION_MISMATCH} if the dimensions don't chain
   */
  public MatrixResult<Matrix> multiply(Matrix other) {
    Preconditions.checkNotNull(other);
    if (columnCount != other.rowCount) {
      log.debug("Can't multiply {} by {}", describeDimensions(), other.describeDimensions());
      return MatrixResult.failure(MatrixError.DIMENSION_MISMATCH,
                                  "Can't multiply " + describeDimensions() + " by " + other.describeDimensions());
    }
    int resultColumns = other.columnCount;
    Matrix result = new Matrix(rowCount, resultColumns);
    double[] resultData = result.data;
    double[] otherData = other.data;
    for (int i = 0; i < rowCount; i++) {
      int resultOffset = i * resultColumns;
      for (int k = 0; k < columnCount; k++) {
        double aik = data[i * columnCount + k];
        if (aik != 0.0) {
          int otherOffset = k * resultColumns;
          for (int j = 0; j < resultColumns; j++) {
            resultData[resultOffset + j] += aik * otherData[otherOffset + j];
          }
        }
      }
    }
    return MatrixResult.success(result);
  }

  /**
   * @return new matrix with every entry of this one multiplied by {@code scalar}
   * @see MatrixUtils#scale(double, Matrix)
   */
  public Matrix scale(double scalar) {
    Matrix result = new Matrix(rowCount, columnCount);
    double[] resultData = result.data;
    for (int i = 0; i < resultData.length; i++) {
      resultData[i] = data[i] * scalar;
    }
    return result;
  }

  /**
   * Computes the determinant by Gaussian elimination with partial pivoting, on a working copy.
   *
   * @return determinant, or {@link MatrixError#NON_SQUARE_MATRIX} if this matrix is not square or is empty
   */
  public MatrixResult<Double> determinant() {
    if (!isSquare() || isEmpty()) {
      log.debug("No determinant for {} matrix", describeDimensions());
      return MatrixResult.failure(MatrixError.NON_SQUARE_MATRIX,
                                  "No determinant for " + describeDimensions() + " matrix");
    }
    return MatrixResult.success(GaussianElimination.determinant(data, rowCount));
  }

  /**
   * Computes the rank by reduction to row-echelon form, on a working copy. Defined for any dimensions;
   * an empty matrix has rank 0.
   *
   * @return number of linearly independent rows
   */
  public int rank() {
    if (isEmpty()) {
      return 0;
    }
    return GaussianElimination.rank(data, rowCount, columnCount);
  }

  /**
   * @param other matrix to compare to
   * @param tolerance largest absolute difference allowed between corresponding entries
   * @return true iff {@code other} has the same dimensions and all entries are within {@code tolerance}
   */
  public boolean equalsWithin(Matrix other, double tolerance) {
    if (other == null || rowCount != other.rowCount || columnCount != other.columnCount) {
      return false;
    }
    double[] otherData = other.data;
    for (int i = 0; i < data.length; i++) {
      if (!(FastMath.abs(data[i] - otherData[i]) <= tolerance)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Matrix)) {
      return false;
    }
    Matrix other = (Matrix) o;
    return rowCount == other.rowCount && columnCount == other.columnCount && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rowCount + columnCount) + Arrays.hashCode(data);
  }

  String describeDimensions() {
    return rowCount + " x " + columnCount;
  }

  /**
   * @return rendering of the matrix, one {@code [ v0, v1, ... ]} line per row
   * @see MatrixFormat#format(Matrix)
   */
  @Override
  public String toString() {
    return MatrixFormat.format(this);
  }

}
