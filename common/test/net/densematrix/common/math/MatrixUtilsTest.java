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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;

import net.densematrix.common.DenseMatrixTest;
import net.densematrix.common.random.RandomManager;

/**
 * Tests {@link MatrixUtils}.
 */
public final class MatrixUtilsTest extends DenseMatrixTest {

  @Test
  public void testScaleOnLeft() {
    Matrix m = Matrix.of(
        new double[] {1, -2},
        new double[] {0.5, 4});
    assertEquals(m.scale(-3.0), MatrixUtils.scale(-3.0, m));
    assertArrayEquals(new double[] {-1.5, -12}, MatrixUtils.scale(-3.0, m).getRow(1));
  }

  @Test
  public void testIdentity() {
    Matrix i = MatrixUtils.identity(3);
    assertArrayEquals(new double[] {1, 0, 0}, i.getRow(0));
    assertArrayEquals(new double[] {0, 1, 0}, i.getRow(1));
    assertArrayEquals(new double[] {0, 0, 1}, i.getRow(2));
    assertTrue(MatrixUtils.identity(0).isEmpty());
  }

  @Test
  public void testParse() {
    Matrix m = MatrixUtils.parse(" 1, 2 ,3 ; 4,5.5,-6");
    assertEquals(Matrix.of(new double[] {1, 2, 3}, new double[] {4, 5.5, -6}), m);
    assertEquals(Matrix.of(new double[] {7}), MatrixUtils.parse("7"));
    assertEquals(new Matrix(), MatrixUtils.parse("  "));
  }

  @Test
  public void testParseRagged() {
    try {
      MatrixUtils.parse("1,2;3");
      fail();
    } catch (MatrixException me) {
      assertSame(MatrixError.RAGGED_ROWS, me.getError());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseNaN() {
    MatrixUtils.parse("1,NaN");
  }

  @Test(expected = NumberFormatException.class)
  public void testParseGarbage() {
    MatrixUtils.parse("1,x;2,3");
  }

  @Test
  public void testRandom() {
    Matrix m = MatrixUtils.random(10, 10);
    for (int row = 0; row < 10; row++) {
      for (int col = 0; col < 10; col++) {
        double value = m.get(row, col);
        assertTrue(value >= -1.0 && value < 1.0);
      }
    }
    // Test seed makes generators repeat
    assertEquals(m, MatrixUtils.random(10, 10));
  }

  @Test
  public void testSharedGeneratorGivesDistinctMatrices() {
    RandomGenerator random = RandomManager.getRandom();
    Matrix first = MatrixUtils.random(3, 4, random);
    Matrix second = MatrixUtils.random(3, 4, random);
    assertFalse(first.equals(second));
  }

  @Test
  public void testToRealMatrix() {
    Matrix m = MatrixUtils.random(3, 2);
    RealMatrix real = MatrixUtils.toRealMatrix(m);
    assertEquals(3, real.getRowDimension());
    assertEquals(2, real.getColumnDimension());
    assertArrayEquals(m.getRow(1), real.getRow(1));
    assertEquals(m, MatrixUtils.fromRealMatrix(real));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testToRealMatrixEmpty() {
    MatrixUtils.toRealMatrix(new Matrix(0, 2));
  }

  @Test
  public void testMultiplyAgreesWithCommonsMath() {
    RandomGenerator random = RandomManager.getRandom();
    Matrix a = MatrixUtils.random(4, 3, random);
    Matrix b = MatrixUtils.random(3, 5, random);
    RealMatrix expected = MatrixUtils.toRealMatrix(a).multiply(MatrixUtils.toRealMatrix(b));
    assertEqualsWithin(MatrixUtils.fromRealMatrix(expected), a.multiply(b).get(), 1.0e-12);
  }

  @Test
  public void testFromRealMatrixCopies() {
    RealMatrix real = new Array2DRowRealMatrix(new double[][] {{1, 2}, {3, 4}});
    Matrix m = MatrixUtils.fromRealMatrix(real);
    real.setEntry(0, 0, 9.0);
    assertEquals(1.0, m.get(0, 0));
  }

}
