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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import hypertag.common.Logging;
import hypertag.common.Settings;
import hypertag.common.exceptions.HypertagFatal;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.UndefinedVarException;
import hypertag.runtime.MarkupRuntime;
import hypertag.runtime.StandardRuntime;

public class HypertagCompilerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_COMPACTIFY);
  }

  private File script(String name, String text) throws Exception {
    File file = folder.newFile(name);
    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
    return file;
  }

  private static HypertagCompiler compiler() throws Exception {
    return new HypertagCompiler(Logging.getHypertagLogger(), new MarkupRuntime());
  }

  private static int exitCode(HypertagCompiler compiler, File in, File out) {
    try {
      compiler.compile(in, out);
    } catch (HypertagFatal e) {
      return e.exitCode;
    }
    return ExitCode.SUCCESS.code();
  }

  @Test
  public void testRender() throws Exception {
    assertEquals("<p>Hi</p>", HypertagCompiler.render("p | Hi", new MarkupRuntime()));
  }

  @Test
  public void testErrorLocation() throws Exception {
    exception.expect(UndefinedVarException.class);
    exception.expectMessage(HypertagCompiler.NO_FILE + ":");
    exception.expectMessage("variable 'x' is not defined");
    HypertagCompiler.render("| $x", new StandardRuntime());
  }

  @Test
  public void testCompactifyOff() throws Exception {
    Settings.set(Settings.OPT_COMPACTIFY, "false");
    assertEquals("a 3", HypertagCompiler.render("| a {1 + 2}", new StandardRuntime()));
  }

  @Test
  public void testInvalidCompactifyOption() throws Exception {
    Settings.set(Settings.OPT_COMPACTIFY, "maybe");
    exception.expect(HypertagRuntimeError.class);
    HypertagCompiler.render("| a", new StandardRuntime());
  }

  @Test
  public void testCompileToFile() throws Exception {
    File in = script("page.hy", "div\n    | x\n");
    File out = new File(folder.getRoot(), "page.html");
    assertEquals(0, exitCode(compiler(), in, out));
    assertEquals("<div>\n    x\n</div>\n",
                 FileUtils.readFileToString(out, StandardCharsets.UTF_8));
  }

  @Test
  public void testUserError() throws Exception {
    File in = script("bad.hy", "| {1 // 0}");
    assertEquals(ExitCode.ERROR_USER.code(),
                 exitCode(compiler(), in, new File(folder.getRoot(), "out")));
  }

  @Test
  public void testMissingInput() throws Exception {
    File in = new File(folder.getRoot(), "missing.hy");
    try {
      compiler().compile(in, null);
      fail("compiled a missing file");
    } catch (HypertagFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
  }
}
