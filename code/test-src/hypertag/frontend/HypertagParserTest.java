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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.IndentationException;
import hypertag.common.exceptions.InvalidSyntaxException;
import hypertag.frontend.tree.HypertagDef;
import hypertag.frontend.tree.TagExpand;

public class HypertagParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static HypertagAST parse(String script) throws Exception {
    return new HypertagParser().parse(script, "test.hy");
  }

  /** First node of the given kind, depth first */
  static HypertagAST find(HypertagAST tree, NodeKind kind) {
    if (tree.getKind() == kind) {
      return tree;
    }
    for (HypertagAST child: tree.children()) {
      HypertagAST found = find(child, kind);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  @Test
  public void testStructBlock() throws Exception {
    HypertagAST root = parse("div");
    assertEquals(NodeKind.DOCUMENT, root.getKind());
    HypertagAST block = root.child(0);
    assertEquals(NodeKind.BLOCK, block.getKind());
    assertEquals(NodeKind.MARGIN_OUT, block.child(0).getKind());
    HypertagAST struct = block.child(1);
    assertEquals(NodeKind.BLOCK_STRUCT, struct.getKind());
    assertEquals(NodeKind.TAGS_EXPAND, struct.child(0).getKind());
    assertEquals(NodeKind.BODY, struct.child(1).getKind());

    HypertagAST tag = struct.child(0).child(0);
    assertEquals("div", ((TagExpand) tag.getDescriptor()).getName());
  }

  @Test
  public void testShortAttributes() throws Exception {
    HypertagAST tag = find(parse("#box .top.grey"), NodeKind.TAG_EXPAND);
    TagExpand desc = (TagExpand) tag.getDescriptor();
    assertEquals(TagExpand.DEFAULT_NAME, desc.getName());
    assertEquals(3, desc.getNamed().size());
    assertEquals("id", desc.getNamed().get(0).getKey());
    assertEquals("class", desc.getNamed().get(2).getKey());
    assertEquals("grey", desc.getNamed().get(2).getValue().getValue());
  }

  @Test
  public void testOperatorPrecedence() throws Exception {
    HypertagAST expr = find(parse("| {1 + 2 * 3}"), NodeKind.EXPR);
    HypertagAST arith = expr.child(0);
    assertEquals(NodeKind.ARITH_EXPR, arith.getKind());
    assertEquals(3, arith.childCount());
    assertEquals(Long.valueOf(1), arith.child(0).getValue());
    assertEquals("+", arith.child(1).getOp());
    assertEquals(NodeKind.TERM, arith.child(2).getKind());
  }

  @Test
  public void testQualifier() throws Exception {
    HypertagAST expr = find(parse("| {0}!"), NodeKind.EXPR);
    assertEquals("!", expr.getQualifier());
    assertEquals(1, expr.childCount());
    assertEquals(NodeKind.NUMBER, expr.child(0).getKind());
  }

  @Test
  public void testHypertagSignature() throws Exception {
    HypertagAST def = find(parse("%H @body x y=5\n  | $x"),
                           NodeKind.BLOCK_DEF);
    HypertagDef desc = (HypertagDef) def.getDescriptor();
    assertEquals("H", desc.getName());
    assertEquals("body", desc.getAttrBody().getName());
    assertEquals(2, desc.getAttrRegular().size());
    assertNotNull(desc.getAttr("y"));
    assertEquals(NodeKind.BODY, desc.getBody().getKind());
  }

  @Test
  public void testDuplicateAttribute() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("duplicate attribute 'x'");
    parse("%H x x\n  | $x");
  }

  @Test
  public void testSyntaxErrorLine() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("invalid syntax near line 3: %%%");
    parse("div\n| ok\n%%%");
  }

  @Test
  public void testSyntaxErrorQuoteShortened() throws Exception {
    try {
      parse("| ok\nthis is ( broken line here");
    } catch (InvalidSyntaxException e) {
      assertTrue(e.getMessage(),
          e.getMessage().endsWith("near line 2: this is ( broke..."));
      return;
    }
    throw new AssertionError("syntax error not detected");
  }

  @Test
  public void testIndentationError() throws Exception {
    exception.expect(IndentationException.class);
    parse("div\n  | a\n\t| b");
  }
}
