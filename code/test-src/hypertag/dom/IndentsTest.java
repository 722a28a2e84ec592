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

package hypertag.dom;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class IndentsTest {

  @Test
  public void testAddIndent() {
    assertEquals("  a\n  b", Indents.addIndent("a\nb", "  "));
    assertEquals("  a\n\n  b", Indents.addIndent("a\n\nb", "  "));
    assertEquals("\n  a", Indents.addIndent("\na", "  "));
    assertEquals("a", Indents.addIndent("a", ""));
  }

  @Test
  public void testGetIndent() {
    assertEquals("  ", Indents.getIndent("  a\n    b\n\n   \n  c"));
    assertEquals("", Indents.getIndent("\ta\n  b"));
    assertEquals("", Indents.getIndent(""));
    assertEquals("", Indents.getIndent("a\n  b"));
  }

  @Test
  public void testDelIndent() {
    assertEquals("a\n  b", Indents.delIndent("  a\n    b", "  "));
    assertEquals("x\ny", Indents.delIndent("    x\n    y"));
    assertEquals("x\n\ny", Indents.delIndent("  x\n\n  y"));
  }
}
