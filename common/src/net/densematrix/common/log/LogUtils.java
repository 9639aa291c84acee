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

package net.densematrix.common.log;

import java.util.Collection;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for configuring {@code java.util.logging}, which SLF4J logs to at runtime.
 */
public final class LogUtils {

  private static final String LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  // java.util.logging holds loggers weakly; a collected logger loses its level
  private static final Collection<Logger> LOGGERS = new CopyOnWriteArraySet<Logger>();

  private LogUtils() {
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to something more sensible than the 2-line default.
   * This can be overridden further on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 FINE Rank of 3 x 3 matrix is 1
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(LOG_FORMAT_PROP) == null) {
      System.setProperty(LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

  /**
   * Turns on {@link Level#FINE} logging, which SLF4J's debug level maps to, for the loggers of the packages of
   * the given classes and for the handlers they publish to. Loggers of other classes in those packages inherit
   * the level.
   *
   * @param classes classes whose packages should log at debug level
   */
  public static void enableDebugLoggingIn(Class<?>... classes) {
    for (Class<?> c : classes) {
      Logger julLogger = Logger.getLogger(c.getPackage().getName());
      LOGGERS.add(julLogger);
      julLogger.setLevel(Level.FINE);
      while (julLogger != null) {
        for (Handler handler : julLogger.getHandlers()) {
          handler.setLevel(Level.FINE);
        }
        julLogger = julLogger.getParent();
      }
    }
  }

  static int trackedLoggerCount() {
    return LOGGERS.size();
  }

}
