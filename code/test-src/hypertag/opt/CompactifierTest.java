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

package hypertag.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.backend.Translator;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.frontend.Analyzer;
import hypertag.frontend.HypertagParser;
import hypertag.runtime.MarkupRuntime;
import hypertag.runtime.Runtime;

public class CompactifierTest {

  private static final String SCRIPTS[] = {
    "| Ala {1 + 2} x",
    "$x = 1\n| a {1} $x b",
    "div #main .a.b\n    p | {'x' * 3} & more\n    / <i>{2 ** 3}</i>",
    "%H y\n    | {y} {10 // 3}\nH 1\nH {'a' 'b'}",
    "for i in range(3)\n    | {i}:{i * 2} {'x'}",
    "? | {1 // 0}\n| after",
    "| kot { 'Mru' \"czek\" 123 0? }! {456}? {0}?",
  };

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static HypertagAST analyse(String script, Runtime runtime,
                                     boolean compactify) throws Exception {
    HypertagAST root = new HypertagParser().parse(script, "test.hy");
    new Analyzer(runtime, compactify).analyseDocument(root);
    return root;
  }

  private static String render(String script, boolean compactify)
                                                    throws Exception {
    Runtime runtime = new MarkupRuntime();
    HypertagAST root = analyse(script, runtime, compactify);
    return new Translator(runtime).translateDocument(root).render();
  }

  private static List<HypertagAST> merged(HypertagAST tree) {
    List<HypertagAST> out = new ArrayList<HypertagAST>();
    collect(tree, out);
    return out;
  }

  private static void collect(HypertagAST tree, List<HypertagAST> out) {
    if (tree.getKind() == NodeKind.MERGED) {
      out.add(tree);
    }
    for (HypertagAST child: tree.children()) {
      collect(child, out);
    }
  }

  @Test
  public void testSameOutput() throws Exception {
    for (String script: SCRIPTS) {
      assertEquals(script, render(script, false), render(script, true));
    }
  }

  @Test
  public void testWholeLineMerged() throws Exception {
    HypertagAST root = analyse("| Ala {1 + 2} x", new MarkupRuntime(), true);
    List<HypertagAST> nodes = merged(root);
    assertEquals(1, nodes.size());
    assertEquals(" Ala 3 x", nodes.get(0).getValue());
    assertNull(nodes.get(0).getError());
  }

  @Test
  public void testVariableSplitsLine() throws Exception {
    HypertagAST root = analyse("$x = 1\n| a {1} $x b", new MarkupRuntime(), true);
    List<HypertagAST> nodes = merged(root);
    assertEquals(2, nodes.size());
    assertEquals(" a 1 ", nodes.get(0).getValue());
    assertEquals(" b", nodes.get(1).getValue());
  }

  @Test
  public void testDisabled() throws Exception {
    HypertagAST root = analyse("| Ala {1 + 2} x", new MarkupRuntime(), false);
    assertTrue(merged(root).isEmpty());
  }

  @Test
  public void testDefinitionBody() throws Exception {
    HypertagAST root = analyse("%H\n    | a {2}\nH", new MarkupRuntime(), true);
    List<HypertagAST> nodes = merged(root);
    assertEquals(1, nodes.size());
    assertEquals(" a 2", nodes.get(0).getValue());
  }

  @Test
  public void testErrorDeferred() throws Exception {
    HypertagAST root = analyse("| a {1 // 0}", new MarkupRuntime(), true);
    List<HypertagAST> nodes = merged(root);
    assertEquals(1, nodes.size());
    assertNotNull(nodes.get(0).getError());

    exception.expect(InvalidValueException.class);
    exception.expectMessage("integer division or modulo by zero");
    render("| a {1 // 0}", true);
  }
}
