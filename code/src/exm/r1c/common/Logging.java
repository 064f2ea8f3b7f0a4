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

package exm.r1c.common;

import java.io.IOException;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.r1c.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String R1C_LOGGER_NAME = "exm.r1c";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getR1CLogger()
  {
    return Logger.getLogger(R1C_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.  With no log file, only warnings
   * and errors go to stderr.
   * @param logfile may be null or empty
   * @param trace log at trace level instead of debug
   * @return the configured logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                      throws InvalidOptionException
  {
    Logger r1cLogger = getR1CLogger();
    r1cLogger.removeAllAppenders();
    r1cLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (logfile != null && logfile.length() > 0) {
      try {
        r1cLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file \""
                          + logfile + "\": " + e.getMessage());
      }
      r1cLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender console = new ConsoleAppender(layout,
                                      ConsoleAppender.SYSTEM_ERR);
      r1cLogger.addAppender(console);
      r1cLogger.setLevel(Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return r1cLogger;
  }
}
