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
package exm.iet.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.iet.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String IET_LOGGER_NAME = "exm.iet";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getIETLogger() {
    return Logger.getLogger(IET_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the IET logger.
   * @param logfile if empty, keep whatever log4j configuration is present
   * @param trace log at TRACE rather than DEBUG level
   * @return the IET logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException {
    Logger ietLogger = getIETLogger();
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      return ietLogger;
    }

    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      ietLogger.addAppender(appender);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file \""
                                       + logfile + "\": " + e.getMessage());
    }
    ietLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return ietLogger;
  }

  /**
   * Set up logging from the iet.log.* settings
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
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
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getIETLogger().warn(msg);
    } else {
      Logging.getIETLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
