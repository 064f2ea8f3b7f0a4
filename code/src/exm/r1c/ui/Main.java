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

package exm.r1c.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.r1c.common.Logging;
import exm.r1c.common.Settings;
import exm.r1c.common.exceptions.InvalidOptionException;
import exm.r1c.common.exceptions.R1Fatal;
import exm.r1c.ir.IRTree.IRProgram;

/**
 * Command line interface to R1C compiler.  Settings can also be passed
 * as Java properties.  See Settings.java for handling of these options.
 */
public class Main {
  private static final String EXPR_FLAG = "e";
  private static final String VERBOSE_FLAG = "v";
  private static final String LOG_FILE_FLAG = "l";
  private static final String TRACE_FLAG = "t";
  private static final String SETTING_FLAG = "D";

  public static void main(String[] args) {
    try {
      Settings.initR1CProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args r1cArgs = processArgs(args);

    Logger logger = null;
    try {
      Settings.validateProperties();
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug("Setting " + key + "=" + Settings.get(key));
      }
    }

    String source = r1cArgs.expression;
    if (source == null) {
      source = readSource(System.in);
    }
    if (StringUtils.isBlank(source)) {
      System.err.println("No input expression given");
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      R1Compiler r1c = new R1Compiler(logger);
      IRProgram result = r1c.compileOrFail(source,
                                r1cArgs.verbose ? System.out : null);
      System.out.print(result);
      System.out.flush();
    } catch (R1Fatal ex) {
      System.exit(ex.exitCode);
    }
  }


  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(EXPR_FLAG, "expr", true,
        "Expression to compile.  Read from stdin if absent"));
    opts.addOption(VERBOSE_FLAG, "verbose", false,
        "Print tree after each pass");
    opts.addOption(new Option(LOG_FILE_FLAG, "log-file", true,
        "Write debug log to file"));
    opts.addOption(TRACE_FLAG, "trace", false, "Log at trace level");

    Option setting = new Option(SETTING_FLAG, true, "Override setting");
    setting.setArgs(2);
    setting.setValueSeparator('=');
    opts.addOption(setting);
    return opts;
  }


  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.getArgs().length > 0) {
      System.err.println("Unexpected arguments: "
                         + StringUtils.join(cmd.getArgs(), ' '));
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Properties settings = cmd.getOptionProperties(SETTING_FLAG);
    for (String key: settings.stringPropertyNames()) {
      Settings.set(key, settings.getProperty(key));
    }
    if (cmd.hasOption(LOG_FILE_FLAG)) {
      Settings.set(Settings.LOG_FILE, cmd.getOptionValue(LOG_FILE_FLAG));
    }
    if (cmd.hasOption(TRACE_FLAG)) {
      Settings.set(Settings.LOG_TRACE, "true");
    }

    return new Args(cmd.getOptionValue(EXPR_FLAG),
                    cmd.hasOption(VERBOSE_FLAG));
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static String readSource(InputStream in) {
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error reading standard input: " + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("r1c", opts, true);
  }

  private static class Args {
    public final String expression;
    public final boolean verbose;

    public Args(String expression, boolean verbose) {
      super();
      this.expression = expression;
      this.verbose = verbose;
    }
  }
}
