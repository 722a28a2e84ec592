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

import static hypertag.frontend.HypertagParserTest.find;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.ImportException;
import hypertag.common.exceptions.InvalidSyntaxException;
import hypertag.common.exceptions.ModuleNotFoundException;
import hypertag.common.exceptions.UndefinedTagException;
import hypertag.common.exceptions.UndefinedVarException;
import hypertag.common.lang.Slot;
import hypertag.frontend.tree.Document;
import hypertag.runtime.StandardRuntime;

public class AnalyzerTest {

  /** Passes its body through */
  private static final String BOX = "%box @body\n    @body\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static HypertagAST analyse(String script) throws Exception {
    HypertagAST root = new HypertagParser().parse(script, "test.hy");
    new Analyzer(new StandardRuntime(), false).analyseDocument(root);
    return root;
  }

  private static void collect(HypertagAST tree, NodeKind kind,
                              List<HypertagAST> out) {
    if (tree.getKind() == kind) {
      out.add(tree);
    }
    for (HypertagAST child: tree.children()) {
      collect(child, kind, out);
    }
  }

  private static List<HypertagAST> all(HypertagAST tree, NodeKind kind) {
    List<HypertagAST> out = new ArrayList<HypertagAST>();
    collect(tree, kind, out);
    return out;
  }

  @Test
  public void testUndefinedVariable() throws Exception {
    exception.expect(UndefinedVarException.class);
    exception.expectMessage("variable 'x' is not defined");
    analyse("| $x");
  }

  @Test
  public void testUndefinedTag() throws Exception {
    exception.expect(UndefinedTagException.class);
    exception.expectMessage("undefined tag 'foo'");
    analyse("foo");
  }

  @Test
  public void testTaggedBlockIsScope() throws Exception {
    exception.expect(UndefinedVarException.class);
    analyse(BOX + "box\n    $y = 1\n| $y");
  }

  @Test
  public void testHypertagBodyIsScope() throws Exception {
    exception.expect(UndefinedVarException.class);
    analyse("%H\n    $inner = 1\n| $inner");
  }

  @Test
  public void testControlBlockIsNotScope() throws Exception {
    HypertagAST root = analyse("for i in [1, 2]\n    $last = i\n| $last");
    HypertagAST def = find(root, NodeKind.VAR_DEF);
    List<HypertagAST> uses = all(root, NodeKind.VAR_USE);
    HypertagAST use = uses.get(uses.size() - 1);
    assertEquals("last", use.getName());
    // the for target comes first
    HypertagAST lastDef = all(root, NodeKind.VAR_DEF).get(1);
    assertNotSame(def.getSlotWrite(), lastDef.getSlotWrite());
    assertSame(lastDef.getSlotWrite(), use.getSlotRead());
  }

  @Test
  public void testBranchesShareFirstSlot() throws Exception {
    HypertagAST root = analyse(
        "$c = 1\nif c\n    $a = 1\nelse\n    $a = 2\n| $a");
    List<HypertagAST> defs = all(root, NodeKind.VAR_DEF);
    assertEquals(3, defs.size());
    assertSame(defs.get(1).getSlotWrite(), defs.get(2).getSlotWrite());
    List<HypertagAST> uses = all(root, NodeKind.VAR_USE);
    assertSame(defs.get(1).getSlotWrite(),
               uses.get(uses.size() - 1).getSlotRead());
  }

  @Test
  public void testSymbolsOfBothBranchesVisible() throws Exception {
    analyse("$c = 1\nif c\n    $a = 1\nelse\n    $b = 2\n| $a $b");
  }

  @Test
  public void testSlotUniqueness() throws Exception {
    HypertagAST root = analyse(
        "%A\n    $v = 1\n    | $v\n%B\n    $v = 2\n    | $v\n" +
        "$v = 3\n" + BOX + "box\n    $v = 4\n    | $v\n| $v");
    List<HypertagAST> defs = all(root, NodeKind.VAR_DEF);
    assertEquals(4, defs.size());
    for (int i = 0; i < defs.size(); i++) {
      for (int j = i + 1; j < defs.size(); j++) {
        assertNotSame("declarations " + i + " and " + j,
            defs.get(i).getSlotWrite(), defs.get(j).getSlotWrite());
      }
    }
    List<HypertagAST> uses = new ArrayList<HypertagAST>();
    for (HypertagAST use: all(root, NodeKind.VAR_USE)) {
      if (use.getName().equals("v")) {
        uses.add(use);
      }
    }
    assertSame(defs.get(0).getSlotWrite(), uses.get(0).getSlotRead());
    assertSame(defs.get(1).getSlotWrite(), uses.get(1).getSlotRead());
    // inside the tagged block, then after it
    assertSame(defs.get(3).getSlotWrite(), uses.get(2).getSlotRead());
    assertSame(defs.get(2).getSlotWrite(), uses.get(3).getSlotRead());
  }

  @Test
  public void testSlotDepths() throws Exception {
    HypertagAST root = analyse(
        "%A\n    $v = 1\n    | $v\n$v = 2\n" + BOX + "box\n    $v = 3\n");
    List<HypertagAST> defs = all(root, NodeKind.VAR_DEF);
    Slot inHypertag = defs.get(0).getSlotWrite();
    Slot global = defs.get(1).getSlotWrite();
    Slot inBlock = defs.get(2).getSlotWrite();
    assertEquals(1, inHypertag.getDepth());
    assertEquals(1, inHypertag.getHypertagDepth());
    assertEquals(0, global.getDepth());
    assertEquals(0, global.getHypertagDepth());
    assertEquals(1, inBlock.getDepth());
    assertEquals(0, inBlock.getHypertagDepth());
  }

  @Test
  public void testReassignmentReusesSlot() throws Exception {
    HypertagAST root = analyse("$x = 1\n$x = 2\n| $x");
    List<HypertagAST> defs = all(root, NodeKind.VAR_DEF);
    assertSame(defs.get(0).getSlotWrite(), defs.get(1).getSlotWrite());
  }

  @Test
  public void testDefinitionInsideControlBlock() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("hypertag definition inside a control block");
    analyse("if True\n    %H\n        | x");
  }

  @Test
  public void testImportInsideControlBlock() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("import inside a control block");
    analyse("if True\n    import *");
  }

  @Test
  public void testImportUnknownName() throws Exception {
    exception.expect(ImportException.class);
    exception.expectMessage("cannot import '$missing'");
    analyse("import $missing");
  }

  @Test
  public void testImportUnknownPath() throws Exception {
    exception.expect(ModuleNotFoundException.class);
    exception.expectMessage("import path not found 'nowhere'");
    analyse("from nowhere import *");
  }

  @Test
  public void testDocumentSymbols() throws Exception {
    HypertagAST root = analyse("$x = 1\n%H\n    | a\nH");
    Document doc = (Document) root.getDescriptor();
    assertEquals(2, doc.getSlotsOut().size());
    assertTrue(doc.getSlotsOut().containsKey("$x"));
    assertTrue(doc.getSlotsOut().containsKey("%H"));
    assertTrue(doc.getSlotsIn().containsKey("$len"));
  }
}
