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

package net.densematrix.common;

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, or primitives.
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * Parses a {@code double} from a {@link String} as if by {@link Double#valueOf(String)}, but disallows special
   * values like {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} and {@link Double#NEGATIVE_INFINITY}.
   * Surrounding whitespace is ignored.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Double#NaN}
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s.trim());
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * Parses a non-negative {@code int}, such as a matrix dimension.
   *
   * @throws NumberFormatException if input does not parse as an integer
   * @throws IllegalArgumentException if input is negative
   */
  public static int parseNonNegativeInt(String s) {
    int value = Integer.parseInt(s.trim());
    Preconditions.checkArgument(value >= 0, "Bad value: %s", value);
    return value;
  }

}
