/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.skc.common;

import java.io.IOException;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.skc.common.exceptions.SKCRuntimeError;

public class Logging {
  private static final String SKC_LOGGER_NAME = "exm.skc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getSKCLogger() {
    return Logger.getLogger(SKC_LOGGER_NAME);
  }

  /**
   * Direct compiler logging to a file.
   * @param logfile file to log to. If null or empty, leave the log4j
   *        configuration alone
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger skcLogger = getSKCLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return skcLogger;
    }

    skcLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    if (fileAppender(skcLogger, logfile) != null) {
      // Already logging there
      return skcLogger;
    }
    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      skcLogger.addAppender(appender);
    } catch (IOException e) {
      throw new SKCRuntimeError("Could not open log file " + logfile +
                                ": " + e.getMessage());
    }
    return skcLogger;
  }

  /**
   * @return appender of logger that writes to logfile, or null
   */
  public static FileAppender fileAppender(Logger logger, String logfile) {
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      Object appender = appenders.nextElement();
      if (appender instanceof FileAppender &&
          logfile.equals(((FileAppender)appender).getFile())) {
        return (FileAppender)appender;
      }
    }
    return null;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(level.toString() + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getSKCLogger().warn(msg);
    } else {
      getSKCLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
