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
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.backend.TranslatedDocument;
import hypertag.backend.Translator;
import hypertag.common.Logging;
import hypertag.common.Settings;
import hypertag.common.exceptions.HypertagFatal;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.InvalidOptionException;
import hypertag.common.exceptions.UserException;
import hypertag.frontend.Analyzer;
import hypertag.frontend.HypertagParser;
import hypertag.runtime.Runtime;

/**
 * This is the main entry point to the compiler
 */
public class HypertagCompiler {

  /** File name reported for scripts that do not come from a file */
  public static final String NO_FILE = "<string>";

  private final Logger logger;
  private final Runtime runtime;

  public HypertagCompiler(Logger logger, Runtime runtime) {
    this.logger = logger;
    this.runtime = runtime;
  }

  /**
   * Run the whole pipeline over one script: parse, analyse (compactifying
   * when enabled) and translate into a DOM.
   */
  public static TranslatedDocument translate(String script, String fileName,
                          Runtime runtime) throws UserException {
    Logger logger = Logging.getHypertagLogger();
    logger.debug("translating " + fileName);

    HypertagAST ast = new HypertagParser().parse(script, fileName);
    new Analyzer(runtime, compactifyEnabled()).analyseDocument(ast);
    TranslatedDocument doc = new Translator(runtime).translateDocument(ast);

    logger.debug("translated " + fileName);
    return doc;
  }

  /**
   * Translate and render a script given as a string
   */
  public static String render(String script, Runtime runtime)
                                                throws UserException {
    return translate(script, NO_FILE, runtime).render();
  }

  private static boolean compactifyEnabled() {
    try {
      return Settings.getBoolean(Settings.OPT_COMPACTIFY);
    } catch (InvalidOptionException e) {
      throw new HypertagRuntimeError(e.toString());
    }
  }

  /**
   * Compile the input file and write the rendered document to the output
   * file, or to standard output if output is null.
   * @throws HypertagFatal with the exit code once the error is reported
   */
  public void compile(File input, File output) {
    if (logger.isDebugEnabled()) {
      for (String key: Settings.getKeys()) {
        logger.debug(key + " = " + Settings.get(key));
      }
    }
    try {
      String script = FileUtils.readFileToString(input,
                                           StandardCharsets.UTF_8);
      String result = translate(script, input.getPath(), runtime).render();
      if (output == null) {
        System.out.print(result);
        System.out.flush();
      } else {
        FileUtils.writeStringToFile(output, result, StandardCharsets.UTF_8);
      }
      logger.debug("done: " + input.getPath());
    }
    catch (HypertagFatal e) {
      throw e;
    }
    catch (IOException e) {
      System.err.println("I/O error: " + e.getMessage());
      throw new HypertagFatal(ExitCode.ERROR_IO.code());
    }
    catch (UserException e) {
      System.err.println("hypertag error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug("user error", e);
      throw new HypertagFatal(ExitCode.ERROR_USER.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new HypertagFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new HypertagFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("HYPERTAG INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
