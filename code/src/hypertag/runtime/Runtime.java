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
package hypertag.runtime;

import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.UserException;

/**
 * Environment a document is compiled in: the source of imported modules,
 * the escaping of plain text, and the symbols every document starts with.
 */
public interface Runtime {

  /** Path of the module holding the context of the current render */
  public static final String PATH_CONTEXT = "~";

  /**
   * @param path module path, or null for the context module
   * @param caller import block, for error messages
   * @throws UserException if the module cannot be found or loaded
   */
  public Module importModule(String path, HypertagAST caller)
                                                  throws UserException;

  /** Convert plain text to the target language */
  public String escape(String text);

  /** @return prefixed symbols predefined in every document */
  public Map<String, Object> importDefault();
}
