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

package hypertag.frontend.peg;

import static hypertag.frontend.peg.PegExpr.and;
import static hypertag.frontend.peg.PegExpr.choice;
import static hypertag.frontend.peg.PegExpr.eof;
import static hypertag.frontend.peg.PegExpr.lit;
import static hypertag.frontend.peg.PegExpr.not;
import static hypertag.frontend.peg.PegExpr.opt;
import static hypertag.frontend.peg.PegExpr.re;
import static hypertag.frontend.peg.PegExpr.ref;
import static hypertag.frontend.peg.PegExpr.seq;
import static hypertag.frontend.peg.PegExpr.star;
import static hypertag.frontend.peg.PegExpr.word;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableSet;

import hypertag.common.exceptions.HypertagRuntimeError;

public class PackratParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Grammar sums() {
    Grammar g = new Grammar();
    g.define("sum", seq(ref("num"), star(seq(lit("+"), ref("num")))));
    g.define("num", re("[0-9]+"));
    return g;
  }

  @Test
  public void testTreeOfNamedRules() throws Exception {
    ParseTree tree = sums().parse("1+22+3", "sum");
    assertEquals("sum", tree.getName());
    assertEquals(3, tree.getChildren().size());
    ParseTree second = tree.getChildren().get(1);
    assertEquals("num", second.getName());
    assertEquals(2, second.getStart());
    assertEquals(4, second.getEnd());
  }

  @Test
  public void testIncompleteParse() throws Exception {
    try {
      sums().parse("1+", "sum");
      fail("expected incomplete parse");
    } catch (IncompleteParseException e) {
      assertEquals("farthest failure", 2, e.getPosition());
    }
  }

  @Test
  public void testOrderedChoice() throws Exception {
    Grammar g = new Grammar();
    g.define("first", seq(choice(lit("a"), lit("ab")), eof()));
    g.define("longest", seq(choice(lit("ab"), lit("a")), eof()));
    g.parse("ab", "longest");
    exception.expect(IncompleteParseException.class);
    g.parse("ab", "first");
  }

  @Test
  public void testExcludedWords() throws Exception {
    Grammar g = new Grammar();
    g.define("name", word("[a-z]+", ImmutableSet.of("if", "else")));
    assertEquals(3, g.parse("iff", "name").getEnd());
    exception.expect(IncompleteParseException.class);
    g.parse("if", "name");
  }

  @Test
  public void testLookahead() throws Exception {
    Grammar g = new Grammar();
    g.define("x", seq(lit("x"), and(lit("!")), opt(lit("!"))));
    g.define("y", seq(lit("y"), not(lit("!")), opt(re("[a-z]"))));
    assertEquals(2, g.parse("x!", "x").getEnd());
    assertEquals(2, g.parse("yz", "y").getEnd());
    exception.expect(IncompleteParseException.class);
    g.parse("y!", "y");
  }

  @Test
  public void testRuleDefinedTwice() {
    Grammar g = new Grammar();
    g.define("a", lit("a"));
    exception.expect(HypertagRuntimeError.class);
    g.define("a", lit("b"));
  }
}
