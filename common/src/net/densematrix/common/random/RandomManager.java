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

package net.densematrix.common.random;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Hands out {@link MersenneTwister} generators. Tests switch every later generator to one fixed seed.
 */
public final class RandomManager {

  private static final long TEST_SEED = 1234567890L;

  private static volatile boolean useTestSeed;

  private RandomManager() {
  }

  /**
   * @return a new generator; after {@link #useTestSeed()}, every one returned repeats the same sequence
   */
  public static RandomGenerator getRandom() {
    return useTestSeed ? new MersenneTwister(TEST_SEED) : new MersenneTwister();
  }

  /**
   * @param seed seed for the generator
   * @return a new generator whose sequence depends only on {@code seed}
   */
  public static RandomGenerator getRandom(long seed) {
    return new MersenneTwister(seed);
  }

  /**
   * Seeds generators created from now on with a fixed value. Existing generators are unaffected.
   */
  public static void useTestSeed() {
    useTestSeed = true;
  }

}
