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

import java.util.List;
import java.util.Locale;

import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.densematrix.common.LangUtils;
import net.densematrix.common.log.LogUtils;
import net.densematrix.common.math.Matrix;
import net.densematrix.common.math.MatrixFormat;
import net.densematrix.common.math.MatrixResult;
import net.densematrix.common.math.MatrixUtils;
import net.densematrix.common.random.RandomManager;

/**
 * <p>A basic command-line interface to {@link Matrix}. It is run like so:</p>
 *
 * <p>{@code java -cp ... net.densematrix.cli.CLI [options] command [arg0 arg1 ...]}</p>
 *
 * <p>"options" may be:</p>
 *
 * <ul>
 *   <li>{@code --verbose}: log the engine's debug messages to standard error</li>
 *   <li>{@code --seed n}: seed for the {@code random} command, so that it prints the same matrix each time</li>
 * </ul>
 *
 * <p>"command" may be any value of {@link CLICommand}, in lower case if you like. Matrix arguments are literals
 * as understood by {@link MatrixUtils#parse(CharSequence)}: rows separated by {@code ;} and values by
 * {@code ,}, quoted for the shell. A literal that starts with a minus sign is taken as an option; put a
 * space in front of it.</p>
 *
 * <ul>
 *   <li>{@code demo}: builds a few sample matrices and prints the results of each operation on them</li>
 *   <li>{@code transpose M}</li>
 *   <li>{@code add M N}</li>
 *   <li>{@code multiply M N}</li>
 *   <li>{@code scale s M}</li>
 *   <li>{@code determinant M}</li>
 *   <li>{@code rank M}</li>
 *   <li>{@code random rows columns}</li>
 * </ul>
 *
 * <p>Matrix results are printed one bracketed row per line; a determinant or rank on a single line. An
 * operation whose operands don't fit prints a line like {@code Error: DIMENSION_MISMATCH: ...}.</p>
 *
 * <p>For example:</p>
 *
 * <p>{@code java -cp ... net.densematrix.cli.CLI multiply "1,2,3;4,5,6" "7,8;9,10;11,12"}</p>
 *
 * <p>... prints:</p>
 *
 * <p>{@code
 * [ 58, 64 ]
 * [ 139, 154 ]
 * }</p>
 */
public final class CLI {

  private static final Logger log = LoggerFactory.getLogger(CLI.class);

  private CLI() {
  }

  public static void main(String[] args) {

    CLIArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(CLIArgs.class, args);
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
      return;
    }

    List<String> programArgsList = cliArgs.getCommands();
    if (programArgsList == null || programArgsList.isEmpty()) {
      printHelp("No command specified");
      return;
    }
    String[] commandArgs = programArgsList.toArray(new String[programArgsList.size()]);

    CLICommand command;
    try {
      command = CLICommand.valueOf(commandArgs[0].toUpperCase(Locale.ENGLISH));
    } catch (IllegalArgumentException iae) {
      printHelp(iae.getMessage());
      return;
    }

    if (cliArgs.isVerbose()) {
      LogUtils.setSensibleLogFormat();
      LogUtils.enableDebugLoggingIn(CLI.class, Matrix.class);
      log.debug("{}", cliArgs);
    }

    try {
      switch (command) {
        case DEMO:
          doDemo(commandArgs);
          break;
        case TRANSPOSE:
          doTranspose(commandArgs);
          break;
        case ADD:
          doAdd(commandArgs);
          break;
        case MULTIPLY:
          doMultiply(commandArgs);
          break;
        case SCALE:
          doScale(commandArgs);
          break;
        case DETERMINANT:
          doDeterminant(commandArgs);
          break;
        case RANK:
          doRank(commandArgs);
          break;
        case RANDOM:
          doRandom(cliArgs, commandArgs);
          break;
      }
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
    } catch (IllegalArgumentException iae) {
      // Also covers unparseable literals and ragged rows
      printHelp(iae.getMessage());
    }
  }

  private static void doDemo(String[] programArgs) {
    if (programArgs.length != 1) {
      throw new ArgumentValidationException("no arguments");
    }

    Matrix a = Matrix.of(
        new double[] {1, 2, 3},
        new double[] {4, 5, 6},
        new double[] {7, 8, 9});
    System.out.print("Matrix A:\n" + a);
    System.out.print("Transpose A^T:\n" + a.transpose());

    Matrix b = Matrix.of(
        new double[] {1, 2},
        new double[] {3, 4},
        new double[] {5, 6});
    System.out.print("\nMatrix B (3x2):\n" + b);
    System.out.print("Transpose B^T (2x3):\n" + b.transpose());

    Matrix c = Matrix.of(
        new double[] {2, -1, 0},
        new double[] {-1, 2, -1},
        new double[] {0, -1, 2});
    System.out.print("\nMatrix C:\n" + c);
    System.out.println("det(C) = " + render(c.determinant()));

    Matrix d = Matrix.of(
        new double[] {1, 2, 3},
        new double[] {2, 4, 6},
        new double[] {3, 6, 9});
    System.out.print("\nMatrix D:\n" + d);
    System.out.println("rank(D) = " + d.rank());
    System.out.print("\nC + D =\n");
    print(c.add(d));

    Matrix e = Matrix.of(
        new double[] {1, 2, 3},
        new double[] {4, 5, 6});
    Matrix f = Matrix.of(
        new double[] {7, 8},
        new double[] {9, 10},
        new double[] {11, 12});
    System.out.print("\nMatrix E (2x3):\n" + e);
    System.out.print("Matrix F (3x2):\n" + f);
    System.out.print("E * F =\n");
    print(e.multiply(f));
    System.out.print("E * E =\n");
    print(e.multiply(e));
    System.out.print("2 * E =\n" + MatrixUtils.scale(2.0, e));
  }

  private static void doTranspose(String[] programArgs) {
    if (programArgs.length != 2) {
      throw new ArgumentValidationException("args are M");
    }
    System.out.print(MatrixUtils.parse(programArgs[1]).transpose());
  }

  private static void doAdd(String[] programArgs) {
    if (programArgs.length != 3) {
      throw new ArgumentValidationException("args are M N");
    }
    Matrix m = MatrixUtils.parse(programArgs[1]);
    Matrix n = MatrixUtils.parse(programArgs[2]);
    print(m.add(n));
  }

  private static void doMultiply(String[] programArgs) {
    if (programArgs.length != 3) {
      throw new ArgumentValidationException("args are M N");
    }
    Matrix m = MatrixUtils.parse(programArgs[1]);
    Matrix n = MatrixUtils.parse(programArgs[2]);
    print(m.multiply(n));
  }

  private static void doScale(String[] programArgs) {
    if (programArgs.length != 3) {
      throw new ArgumentValidationException("args are s M");
    }
    double scalar = LangUtils.parseDouble(programArgs[1]);
    Matrix m = MatrixUtils.parse(programArgs[2]);
    System.out.print(MatrixUtils.scale(scalar, m));
  }

  private static void doDeterminant(String[] programArgs) {
    if (programArgs.length != 2) {
      throw new ArgumentValidationException("args are M");
    }
    System.out.println(render(MatrixUtils.parse(programArgs[1]).determinant()));
  }

  private static void doRank(String[] programArgs) {
    if (programArgs.length != 2) {
      throw new ArgumentValidationException("args are M");
    }
    System.out.println(MatrixUtils.parse(programArgs[1]).rank());
  }

  private static void doRandom(CLIArgs cliArgs, String[] programArgs) {
    if (programArgs.length != 3) {
      throw new ArgumentValidationException("args are rows columns");
    }
    int rows = LangUtils.parseNonNegativeInt(programArgs[1]);
    int columns = LangUtils.parseNonNegativeInt(programArgs[2]);
    Long seed = cliArgs.getSeed();
    Matrix random = seed == null ?
        MatrixUtils.random(rows, columns) :
        MatrixUtils.random(rows, columns, RandomManager.getRandom(seed));
    System.out.print(random);
  }

  private static void print(MatrixResult<Matrix> result) {
    if (result.isSuccess()) {
      System.out.print(result.get());
    } else {
      System.out.println(describeFailure(result));
    }
  }

  private static String render(MatrixResult<Double> result) {
    return result.isSuccess() ? MatrixFormat.formatEntry(result.get()) : describeFailure(result);
  }

  private static String describeFailure(MatrixResult<?> result) {
    log.debug("Operation failed: {}", result);
    return "Error: " + result.getError() + ": " + result.getMessage();
  }

  private static void printHelp(String message) {
    System.out.println();
    System.out.println("Dense Matrix command line interface.");
    System.out.println();
    System.out.println("Commands: demo, transpose M, add M N, multiply M N, scale s M, determinant M, rank M,");
    System.out.println("          random rows columns");
    System.out.println();
    System.out.println("Values starting with '-' are read as options. Put a space in front, like \" -2\" or \" -1,2\".");
    System.out.println();
    if (message != null) {
      System.out.println(message);
      System.out.println();
    }
  }

}
