/*
 * Copyright 2025 The Lispic Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lispic.util;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

/** Access to the compiler's log4j logger. */
public final class Logging {

  private static final String LOGGER_NAME = "org.lispic";

  private static final String CONSOLE_PATTERN = "%-5p %c{1}: %m%n";

  // Static methods only
  private Logging() {}

  /** Returns the logger shared by all compiler passes. */
  public static Logger getLogger() {
    return Logger.getLogger(LOGGER_NAME);
  }

  /**
   * Sends compiler log messages at or above {@code level} to stderr, replacing any appenders
   * previously attached to the compiler logger. Used by command-line tools; library callers are
   * expected to configure log4j themselves.
   */
  public static Logger setupConsole(Level level) {
    Logger logger = getLogger();
    logger.removeAllAppenders();
    ConsoleAppender appender = new ConsoleAppender(new PatternLayout(CONSOLE_PATTERN));
    appender.setTarget(ConsoleAppender.SYSTEM_ERR);
    appender.activateOptions();
    logger.addAppender(appender);
    logger.setAdditivity(false);
    logger.setLevel(level);
    return logger;
  }
}
