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
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import hypertag.common.Logging;
import hypertag.common.Settings;

public class MainTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @After
  public void resetSettings() throws Exception {
    System.clearProperty(Settings.LOG_FILE);
    Settings.reset(Settings.LOG_FILE);
    Settings.reset(Settings.INPUT_FILENAME);
    Settings.reset(Settings.OUTPUT_FILENAME);
    Logging.setupLogging(null, false);
  }

  private File script(String text) throws Exception {
    File file = folder.newFile("input.hy");
    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
    return file;
  }

  private String read(File file) throws Exception {
    return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
  }

  @Test
  public void testContextVariable() throws Exception {
    File in = script("import $name\n| Hello $name\n");
    File out = new File(folder.getRoot(), "out.txt");
    int code = Main.run(new String[] {"-D", "name=Ann", "-o", out.getPath(),
                                      in.getPath()});
    assertEquals(ExitCode.SUCCESS.code(), code);
    assertEquals("Hello Ann\n", read(out));
    assertEquals(in.getPath(), Settings.get(Settings.INPUT_FILENAME));
  }

  @Test
  public void testMissingInput() {
    String missing = new File(folder.getRoot(), "nothing.hy").getPath();
    assertEquals(ExitCode.ERROR_IO.code(), Main.run(new String[] {missing}));
  }

  @Test
  public void testBadCommandLine() throws Exception {
    assertEquals(ExitCode.ERROR_COMMAND.code(), Main.run(new String[0]));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"a.hy", "b.hy"}));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
                 Main.run(new String[] {"--bogus", "a.hy"}));
  }

  @Test
  public void testSyntaxError() throws Exception {
    File in = script("div\n| ok\n%%%\n");
    File out = new File(folder.getRoot(), "out.txt");
    assertEquals(ExitCode.ERROR_USER.code(),
                 Main.run(new String[] {"-o", out.getPath(), in.getPath()}));
  }

  @Test
  public void testLogFile() throws Exception {
    File in = script("| plain\n");
    File out = new File(folder.getRoot(), "out.txt");
    File log = new File(folder.getRoot(), "hypertag.log");
    System.setProperty(Settings.LOG_FILE, log.getPath());
    assertEquals(ExitCode.SUCCESS.code(),
                 Main.run(new String[] {"-o", out.getPath(), in.getPath()}));
    assertTrue(read(log).contains("translating " + in.getPath()));
  }
}
