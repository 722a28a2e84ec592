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
package hypertag.frontend;

import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.common.Logging;

/**
 * Logging for the compiler passes, with messages located at a node
 */
public class LogHelper {
  static final Logger logger = Logging.getHypertagLogger();

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  /** DEBUG-level message prefixed with the position of node */
  public static void debug(HypertagAST node, String msg) {
    if (logger.isDebugEnabled()) {
      logger.debug(node.locate(msg));
    }
  }

  /**
   * Dump a whole tree at TRACE level, one node per line
   */
  public static void traceTree(String title, HypertagAST tree) {
    if (logger.isTraceEnabled()) {
      logger.trace(title + ":\n" + tree.printTree());
    }
  }
}
