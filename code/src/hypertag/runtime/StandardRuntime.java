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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.backend.TranslatedDocument;
import hypertag.common.Logging;
import hypertag.common.exceptions.ImportException;
import hypertag.common.exceptions.ModuleNotFoundException;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.Symbols;
import hypertag.ui.HypertagCompiler;

/**
 * Runtime with modules registered by path, either as ready symbol maps or
 * as Hypertag scripts compiled on first import.
 *
 * The context module, path {@link Runtime#PATH_CONTEXT}, holds the
 * variables and tags passed in by the caller of a render; imports without
 * a path read from it.
 */
public class StandardRuntime implements Runtime {

  private static final Logger logger = Logging.getHypertagLogger();

  private final Map<String, Module> modules = new HashMap<String, Module>();
  private final Map<String, String> scripts = new HashMap<String, String>();

  /** Paths of scripts being compiled, to detect import cycles */
  private final Set<String> loading = new HashSet<String>();

  private final Map<String, Object> context =
                                  new LinkedHashMap<String, Object>();

  public StandardRuntime() {
    modules.put(PATH_CONTEXT, new Module(context));
  }

  public void addVariable(String name, Object value) {
    context.put(Symbols.var(name), value);
    modules.put(PATH_CONTEXT, new Module(context));
  }

  public void addTag(String name, Tag tag) {
    context.put(Symbols.tag(name), tag);
    modules.put(PATH_CONTEXT, new Module(context));
  }

  /**
   * Register a module made of prefixed symbols
   */
  public void addModule(String path, Map<String, Object> symbols) {
    modules.put(path, new Module(symbols));
  }

  /**
   * Register a script to be compiled when first imported; its top-level
   * symbols become the module's symbols
   */
  public void addScript(String path, String script) {
    scripts.put(path, script);
    modules.remove(path);
  }

  @Override
  public Module importModule(String path, HypertagAST caller)
                                                throws UserException {
    String canonical = path == null ? PATH_CONTEXT : path;
    Module module = modules.get(canonical);
    if (module == null) {
      module = loadScript(canonical, caller);
      if (module == null) {
        throw new ModuleNotFoundException(caller, "import path not found '"
                                          + path + "'");
      }
      modules.put(canonical, module);
    }
    return module;
  }

  private Module loadScript(String path, HypertagAST caller)
                                                throws UserException {
    String script = scripts.get(path);
    if (script == null) {
      return null;
    }
    if (!loading.add(path)) {
      throw new ImportException(caller, "circular import of module '" +
                                path + "'");
    }
    try {
      logger.debug("compiling module " + path);
      TranslatedDocument doc = HypertagCompiler.translate(script, path, this);
      return new Module(doc.getSymbols(), doc.getState().getValues());
    } finally {
      loading.remove(path);
    }
  }

  @Override
  public String escape(String text) {
    return text;
  }

  @Override
  public Map<String, Object> importDefault() {
    return Collections.unmodifiableMap(Builtins.symbols());
  }
}
