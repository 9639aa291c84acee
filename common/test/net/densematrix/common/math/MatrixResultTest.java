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

import org.junit.Test;

import net.densematrix.common.DenseMatrixTest;

public final class MatrixResultTest extends DenseMatrixTest {

  @Test
  public void testSuccess() {
    MatrixResult<Double> result = MatrixResult.success(0.0);
    assertTrue(result.isSuccess());
    assertNull(result.getError());
    assertNull(result.getMessage());
    assertEquals(0.0, result.get().doubleValue());
    assertEquals(0.0, result.orElse(1.0).doubleValue());
  }

  @Test
  public void testFailure() {
    MatrixResult<Double> result = MatrixResult.failure(MatrixError.NON_SQUARE_MATRIX, "2 x 3");
    assertFalse(result.isSuccess());
    assertSame(MatrixError.NON_SQUARE_MATRIX, result.getError());
    assertEquals("2 x 3", result.getMessage());
    assertEquals(1.0, result.orElse(1.0).doubleValue());
    assertEquals("Failure[NON_SQUARE_MATRIX: 2 x 3]", result.toString());
  }

  @Test
  public void testGetFailure() {
    MatrixResult<Matrix> result = MatrixResult.failure(MatrixError.DIMENSION_MISMATCH, "nope");
    try {
      result.get();
      fail();
    } catch (MatrixException me) {
      assertSame(MatrixError.DIMENSION_MISMATCH, me.getError());
      assertEquals("nope", me.getMessage());
      assertEquals("DIMENSION_MISMATCH: nope", me.toString());
    }
  }

  @Test(expected = NullPointerException.class)
  public void testNullValue() {
    MatrixResult.success(null);
  }

}
