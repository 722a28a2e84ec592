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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.common.exceptions.TypeMismatchException;

public class MarkupTagTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static final Map<String, Object> NO_ATTRS =
                                      Collections.<String, Object>emptyMap();

  @Test
  public void testQuote() {
    assertEquals("\"a\"", MarkupTag.quote("a"));
    assertEquals("'a\"b'", MarkupTag.quote("a\"b"));
    assertEquals("\"a&quot;b'c\"", MarkupTag.quote("a\"b'c"));
  }

  @Test
  public void testAttributes() {
    Map<String, Object> attrs = new LinkedHashMap<String, Object>();
    attrs.put("id", "x");
    attrs.put("hidden", false);
    attrs.put("title", null);
    attrs.put("checked", true);
    attrs.put("size", 3L);
    assertEquals(" id=\"x\" checked size=\"3\"",
                 new MarkupTag("input", true, false).formatAttrs(attrs));
    assertEquals(" id=\"x\" checked=\"checked\" size=\"3\"",
                 new MarkupTag("input", true, true).formatAttrs(attrs));
  }

  @Test
  public void testExpand() throws Exception {
    MarkupTag p = new MarkupTag("p", false, false);
    assertEquals("<p>x</p>", p.expand("x", Collections.emptyList(), NO_ATTRS));
    assertEquals("<p>\n  x\n</p>",
                 p.expand("\n  x", Collections.emptyList(), NO_ATTRS));
    assertEquals("<br />", new MarkupTag("br", true, false)
                 .expand(null, Collections.emptyList(), NO_ATTRS));
  }

  @Test
  public void testUnnamedAttribute() throws Exception {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("tag <p> does not accept unnamed attributes");
    new MarkupTag("p", false, false).expand("",
        Collections.<Object>singletonList(1L), NO_ATTRS);
  }
}
