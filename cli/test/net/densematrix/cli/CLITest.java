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

package net.densematrix.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Runs {@link CLI} commands and checks what they print.
 */
public final class CLITest extends Assert {

  private PrintStream originalOut;
  private ByteArrayOutputStream captured;

  @Before
  public void setUp() throws Exception {
    originalOut = System.out;
    captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true, "UTF-8"));
  }

  @After
  public void tearDown() throws Exception {
    System.setOut(originalOut);
  }

  private String run(String... args) throws UnsupportedEncodingException {
    CLI.main(args);
    System.out.flush();
    return captured.toString("UTF-8").replace("\r\n", "\n");
  }

  @Test
  public void testMultiply() throws Exception {
    assertEquals("[ 58, 64 ]\n[ 139, 154 ]\n", run("multiply", "1,2,3;4,5,6", "7,8;9,10;11,12"));
  }

  @Test
  public void testMultiplyMismatch() throws Exception {
    assertEquals("Error: DIMENSION_MISMATCH: Can't multiply 2 x 3 by 2 x 3\n",
                 run("multiply", "1,2,3;4,5,6", "1,2,3;4,5,6"));
  }

  @Test
  public void testAdd() throws Exception {
    assertEquals("[ 3, 1, 3 ]\n", run("ADD", "1,2,3", "2,-1,0"));
  }

  @Test
  public void testAddMismatch() throws Exception {
    assertEquals("Error: DIMENSION_MISMATCH: Can't add 1 x 2 to 1 x 3\n", run("add", "1,2,3", "1,2"));
  }

  @Test
  public void testTranspose() throws Exception {
    assertEquals("[ 1, 3 ]\n[ 2, 4 ]\n", run("transpose", "1,2;3,4"));
  }

  @Test
  public void testScale() throws Exception {
    assertEquals("[ 0.5, 1 ]\n", run("scale", "0.5", "1,2"));
  }

  @Test
  public void testNegativeValuesWithLeadingSpace() throws Exception {
    assertEquals("[ -2, -4 ]\n", run("scale", " -2", "1,2"));
    captured.reset();
    assertEquals("[ -1, 3 ]\n[ 2, 4 ]\n", run("transpose", " -1,2;3,4"));
  }

  @Test
  public void testHelpExplainsNegativeValues() throws Exception {
    assertTrue(run("scale").contains("Put a space in front, like \" -2\""));
  }

  @Test
  public void testRandomTooLarge() throws Exception {
    String output = run("random", "65536", "65536");
    assertTrue(output.contains("Dense Matrix command line interface."));
    assertTrue(output.contains("Too many entries: 65536 x 65536"));
  }

  @Test
  public void testDeterminant() throws Exception {
    assertEquals("4\n", run("determinant", "2,-1,0;-1,2,-1;0,-1,2"));
    captured.reset();
    assertEquals("0\n", run("determinant", "1,2,3;4,5,6;7,8,9"));
  }

  @Test
  public void testDeterminantNonSquare() throws Exception {
    assertEquals("Error: NON_SQUARE_MATRIX: No determinant for 1 x 2 matrix\n", run("determinant", "1,2"));
  }

  @Test
  public void testRank() throws Exception {
    assertEquals("1\n", run("rank", "1,2,3;2,4,6;3,6,9"));
  }

  @Test
  public void testRandom() throws Exception {
    String output = run("random", "2", "3");
    String[] lines = output.split("\n");
    assertEquals(2, lines.length);
    for (String line : lines) {
      assertTrue(line.startsWith("[ "));
      assertTrue(line.endsWith(" ]"));
      assertEquals(3, line.split(",").length);
    }
  }

  @Test
  public void testRandomSeed() throws Exception {
    String first = run("--seed", "42", "random", "3", "3");
    captured.reset();
    String second = run("--seed", "42", "random", "3", "3");
    assertEquals(first, second);
    assertEquals(3, first.split("\n").length);
  }

  @Test
  public void testDemo() throws Exception {
    String output = run("demo");
    assertTrue(output.startsWith("Matrix A:\n[ 1, 2, 3 ]\n[ 4, 5, 6 ]\n[ 7, 8, 9 ]\n"));
    assertTrue(output.contains("Transpose A^T:\n[ 1, 4, 7 ]\n[ 2, 5, 8 ]\n[ 3, 6, 9 ]\n"));
    assertTrue(output.contains("Transpose B^T (2x3):\n[ 1, 3, 5 ]\n[ 2, 4, 6 ]\n"));
    assertTrue(output.contains("det(C) = 4\n"));
    assertTrue(output.contains("rank(D) = 1\n"));
    assertTrue(output.contains("C + D =\n[ 3, 1, 3 ]\n[ 1, 6, 5 ]\n[ 3, 5, 11 ]\n"));
    assertTrue(output.contains("E * F =\n[ 58, 64 ]\n[ 139, 154 ]\n"));
    assertTrue(output.contains("E * E =\nError: DIMENSION_MISMATCH"));
    assertTrue(output.contains("2 * E =\n[ 2, 4, 6 ]\n[ 8, 10, 12 ]\n"));
  }

  @Test
  public void testRaggedLiteral() throws Exception {
    String output = run("rank", "1,2;3");
    assertTrue(output.contains("Dense Matrix command line interface."));
    assertTrue(output.contains("Row 1 has 1 values but row 0 has 2"));
  }

  @Test
  public void testWrongArgumentCount() throws Exception {
    String output = run("transpose");
    assertTrue(output.contains("args are M"));
  }

  @Test
  public void testUnknownCommand() throws Exception {
    String output = run("invert", "1");
    assertTrue(output.contains("Dense Matrix command line interface."));
    assertTrue(output.contains("INVERT"));
  }

  @Test
  public void testNoCommand() throws Exception {
    assertTrue(run().contains("Dense Matrix command line interface."));
  }

}
