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
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.common.Settings;
import hypertag.common.exceptions.InvalidOptionException;
import hypertag.ui.HypertagCompiler;

public class MarkupRuntimeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset(Settings.ESCAPE);
    Settings.reset(Settings.XHTML);
  }

  @Test
  public void testEscape() throws Exception {
    MarkupRuntime runtime = new MarkupRuntime();
    assertEquals("&lt;b&gt; &amp; c", runtime.escape("<b> & c"));
    assertEquals("a &lt; b", HypertagCompiler.render("| a < b", runtime));
  }

  @Test
  public void testNoEscape() throws Exception {
    Settings.set(Settings.ESCAPE, "none");
    assertEquals("a < b", HypertagCompiler.render("| a < b", new MarkupRuntime()));
  }

  @Test
  public void testInvalidEscape() throws Exception {
    Settings.set(Settings.ESCAPE, "xml");
    exception.expect(InvalidOptionException.class);
    new MarkupRuntime();
  }

  @Test
  public void testXhtml() throws Exception {
    Settings.set(Settings.XHTML, "true");
    assertEquals("<input enabled=\"enabled\" />",
                 HypertagCompiler.render("input enabled=True", new MarkupRuntime()));
  }

  @Test
  public void testDefaultTags() throws Exception {
    MarkupRuntime runtime = new MarkupRuntime();
    assertTrue(runtime.importDefault().containsKey("%div"));
    assertTrue(runtime.importDefault().containsKey("$len"));
    MarkupTag br = (MarkupTag) runtime.importDefault().get("%br");
    assertTrue(br.isVoid());
  }
}
