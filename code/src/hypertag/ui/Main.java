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

package hypertag.ui;

import java.io.File;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import hypertag.common.Logging;
import hypertag.common.Settings;
import hypertag.common.exceptions.HypertagFatal;
import hypertag.common.exceptions.InvalidOptionException;
import hypertag.runtime.MarkupRuntime;

/**
 * Command line entry point:
 *   hypertag [-D name=value]... [-o output] input
 */
public class Main {
  private static final String USAGE = "hypertag [options] <input>";

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Run the command line tool without exiting the JVM
   * @return the exit code
   */
  public static int run(String[] argv) {
    try {
      Args args = Args.parse(argv);
      configure(args);
      Logger logger = Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                  Settings.getBoolean(Settings.LOG_TRACE));

      File input = new File(args.input);
      if (!input.isFile() || !input.canRead()) {
        System.err.println("Input file \"" + input + "\" is not readable");
        return ExitCode.ERROR_IO.code();
      }

      MarkupRuntime runtime = new MarkupRuntime();
      for (String name: args.context.stringPropertyNames()) {
        runtime.addVariable(name, args.context.getProperty(name));
      }
      File output = args.output == null ? null : new File(args.output);
      new HypertagCompiler(logger, runtime).compile(input, output);
      return ExitCode.SUCCESS.code();
    } catch (InvalidOptionException ex) {
      System.err.println("Invalid option: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    } catch (HypertagFatal ex) {
      return ex.exitCode;
    }
  }

  /**
   * Read settings from system properties, then record the file names
   * given on the command line
   */
  private static void configure(Args args) throws InvalidOptionException {
    Settings.initProperties();
    Settings.set(Settings.INPUT_FILENAME, args.input);
    if (args.output != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.output);
    }
  }

  private static class Args {
    private static final String DEFINE = "D";
    private static final String OUTPUT = "o";

    final String input;
    final String output;
    /** Context variables defined with -D */
    final Properties context;

    private Args(String input, String output, Properties context) {
      this.input = input;
      this.output = output;
      this.context = context;
    }

    static Options options() {
      Options opts = new Options();
      opts.addOption(Option.builder(DEFINE).longOpt("define")
          .numberOfArgs(2).valueSeparator('=').argName("name=value")
          .desc("Context variable, importable with: import $name").build());
      opts.addOption(Option.builder(OUTPUT).longOpt("output").hasArg()
          .argName("file").desc("Output file (default: standard output)")
          .build());
      return opts;
    }

    /**
     * @throws HypertagFatal with ERROR_COMMAND after printing usage
     */
    static Args parse(String[] argv) {
      Options opts = options();
      CommandLine cmd;
      try {
        cmd = new DefaultParser().parse(opts, argv);
      } catch (ParseException ex) {
        System.err.println(ex.getMessage());
        throw usage(opts);
      }
      if (cmd.getArgs().length != 1) {
        System.err.println("Expected one input file, but got " +
                           cmd.getArgs().length + " arguments");
        throw usage(opts);
      }
      return new Args(cmd.getArgs()[0], cmd.getOptionValue(OUTPUT),
                      cmd.getOptionProperties(DEFINE));
    }

    private static HypertagFatal usage(Options opts) {
      new HelpFormatter().printHelp(USAGE, opts);
      return new HypertagFatal(ExitCode.ERROR_COMMAND.code());
    }
  }
}
