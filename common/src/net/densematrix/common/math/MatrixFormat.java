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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.google.common.base.Preconditions;

/**
 * <p>Renders a {@link Matrix} for people to read, one line per row:</p>
 *
 * <p><pre>
 * [ 1, 2.5, -3 ]
 * [ 4, 1e-07, 6 ]
 * </pre></p>
 *
 * <p>Entries get 6 significant digits with trailing zeroes dropped, switching to scientific notation for
 * magnitudes under 0.0001 or of 1000000 and up. The exact binary value is rounded half-even, so 1234565 renders
 * as {@code 1.23456e+06}.</p>
 *
 * @since 1.0
 */
public final class MatrixFormat {

  private static final int SIGNIFICANT_DIGITS = 6;
  private static final MathContext ROUNDING = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN);

  private MatrixFormat() {
  }

  /**
   * @param matrix matrix to render
   * @return one {@code "[ v0, v1, ..., vn ]\n"} line per row; the empty string if there are no rows
   */
  public static String format(Matrix matrix) {
    Preconditions.checkNotNull(matrix);
    StringBuilder result = new StringBuilder();
    int columns = matrix.getColumnCount();
    for (int row = 0; row < matrix.getRowCount(); row++) {
      result.append("[ ");
      for (int col = 0; col < columns; col++) {
        result.append(formatEntry(matrix.get(row, col)));
        result.append(col + 1 < columns ? ", " : " ");
      }
      result.append("]\n");
    }
    return result.toString();
  }

  /**
   * @param value entry value
   * @return shortest rendering of {@code value} to 6 significant digits, like {@code 2.5}, {@code -3} or
   *  {@code 1.23457e+06}
   */
  public static String formatEntry(double value) {
    if (Double.isNaN(value)) {
      return "nan";
    }
    if (Double.isInfinite(value)) {
      return value > 0.0 ? "inf" : "-inf";
    }
    if (value == 0.0) {
      return Double.doubleToRawLongBits(value) < 0L ? "-0" : "0";
    }
    BigDecimal rounded = new BigDecimal(value).round(ROUNDING);
    int exponent = rounded.precision() - rounded.scale() - 1;
    BigDecimal stripped = rounded.stripTrailingZeros();
    if (exponent >= -4 && exponent < SIGNIFICANT_DIGITS) {
      return stripped.toPlainString();
    }
    String digits = stripped.unscaledValue().abs().toString();
    StringBuilder result = new StringBuilder();
    if (value < 0.0) {
      result.append('-');
    }
    result.append(digits.charAt(0));
    if (digits.length() > 1) {
      result.append('.').append(digits, 1, digits.length());
    }
    result.append(exponent < 0 ? "e-" : "e+");
    int magnitude = Math.abs(exponent);
    if (magnitude < 10) {
      result.append('0');
    }
    result.append(magnitude);
    return result.toString();
  }

}
