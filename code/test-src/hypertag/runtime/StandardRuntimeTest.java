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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.common.exceptions.ModuleNotFoundException;
import hypertag.common.exceptions.UndefinedVarException;
import hypertag.ui.HypertagCompiler;

public class StandardRuntimeTest {

  private static final String LIB =
      "$greeting = 'Hi'\n" +
      "%hello who\n" +
      "    | $greeting $who\n";

  /** Exposed to documents through a getter and a method */
  public static class User {
    private final String name;

    public User(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    public String greet(String other) {
      return name + " greets " + other;
    }
  }

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testContextVariables() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addVariable("title", "Hello");
    assertEquals("Hello", HypertagCompiler.render("import $title\n| $title", runtime));
    assertEquals("Hello", HypertagCompiler.render("import $title as t\n| $t", runtime));
    assertEquals("Hello", HypertagCompiler.render("import *\n| $title", runtime));
  }

  @Test
  public void testPrivateNotImportedByWildcard() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addVariable("_secret", "x");
    exception.expect(UndefinedVarException.class);
    HypertagCompiler.render("import *\n| $_secret", runtime);
  }

  @Test
  public void testContextFunction() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addVariable("double", (HypertagFunction) (args, kwargs) ->
                                  2 * (Long) args.get(0));
    assertEquals("42", HypertagCompiler.render("import $double\n| {double(21)}",
                                               runtime));
  }

  @Test
  public void testJavaObject() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addVariable("user", new User("Ann"));
    assertEquals("Ann", HypertagCompiler.render("import $user\n| {user.name}",
                                                runtime));
    assertEquals("Ann greets Bob", HypertagCompiler.render(
                  "import $user\n| {user.greet('Bob')}", runtime));
  }

  @Test
  public void testContextTag() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addTag("b", new MarkupTag("b", false, false));
    assertEquals("<b>bold</b>", HypertagCompiler.render("import %b\nb | bold",
                                                        runtime));
  }

  @Test
  public void testScriptModule() throws Exception {
    StandardRuntime runtime = new StandardRuntime();
    runtime.addScript("lib", LIB);
    assertEquals("Hi Ann", HypertagCompiler.render(
                  "from lib import %hello\nhello 'Ann'", runtime));
    assertEquals("Hi", HypertagCompiler.render(
                  "from lib import *\n| $greeting", runtime));
    Module lib = runtime.importModule("lib", null);
    assertSame(lib, runtime.importModule("lib", null));
    assertTrue(lib.contains("%hello"));
  }

  @Test
  public void testModuleNotFound() throws Exception {
    exception.expect(ModuleNotFoundException.class);
    exception.expectMessage("import path not found 'nowhere'");
    new StandardRuntime().importModule("nowhere", null);
  }

  @Test
  public void testDefaults() {
    StandardRuntime runtime = new StandardRuntime();
    assertTrue(runtime.importDefault().containsKey("$len"));
    assertEquals("a < b", runtime.escape("a < b"));
  }
}
