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
package hypertag.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import hypertag.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String HYPERTAG_LOGGER_NAME = "hypertag";

  /**
   * Messages already emitted.
   */
  private static final HashSet<String> emitted = new HashSet<String>();

  public static Logger getHypertagLogger() {
    return Logger.getLogger(HYPERTAG_LOGGER_NAME);
  }

  /**
   * Configure the project logger: warnings always go to the console,
   * everything else goes to the log file if one is given.
   * @param logfile empty or null for no log file
   * @param trace log at TRACE level into the log file
   * @return the configured logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                      throws InvalidOptionException {
    Logger logger = getHypertagLogger();
    logger.removeAllAppenders();
    logger.setAdditivity(false);

    Layout layout = new PatternLayout("%-5p %m%n");
    ConsoleAppender console = new ConsoleAppender(layout,
                                        ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    logger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(
            new PatternLayout("%-5p %d{HH:mm:ss.SSS} %m%n"), logfile, false);
        logger.addAppender(file);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \""
                                         + logfile + "\": " + e.getMessage());
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      logger.setLevel(Level.WARN);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getHypertagLogger().warn(msg);
    } else {
      Logging.getHypertagLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
