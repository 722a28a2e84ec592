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

import static hypertag.frontend.peg.PegExpr.and;
import static hypertag.frontend.peg.PegExpr.choice;
import static hypertag.frontend.peg.PegExpr.eof;
import static hypertag.frontend.peg.PegExpr.lit;
import static hypertag.frontend.peg.PegExpr.not;
import static hypertag.frontend.peg.PegExpr.opt;
import static hypertag.frontend.peg.PegExpr.plus;
import static hypertag.frontend.peg.PegExpr.re;
import static hypertag.frontend.peg.PegExpr.ref;
import static hypertag.frontend.peg.PegExpr.seq;
import static hypertag.frontend.peg.PegExpr.star;
import static hypertag.frontend.peg.PegExpr.word;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import hypertag.frontend.peg.Grammar;
import hypertag.frontend.peg.PegExpr;

/**
 * Grammar of preprocessed Hypertag scripts.  A grammar is built for one
 * set of indentation markers, since the markers appear as terminals.
 *
 * Rule names double as node kinds after rewriting, see {@link TreeRewriter}.
 */
public class HypertagGrammar {

  public static final String START_RULE = "document";

  /** Names with special meaning inside expressions */
  public static final Set<String> RESERVED = ImmutableSet.of(
      "if", "else", "elif", "for", "while", "is", "in", "not", "and", "or");

  private static final String NAME = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final String XML_START = ":_a-zA-Z\\u00C0-\\u02FF\\u0370-\\u1FFF";
  private static final String XML_CHAR = XML_START + "0-9.\\-\\u00B7";

  /** "--" or a "#" that does not start an id shorthand */
  private static final String COMMENT_MARK = "--|#(?![a-zA-Z0-9_\\-{$])";

  public static Grammar create(IndentMarkers markers) {
    Grammar g = new Grammar();
    String mk = markers.regexClass();
    PegExpr ws = ref("ws");
    PegExpr space = ref("space");
    PegExpr comma = ref("comma");
    PegExpr nl = ref("nl");
    PegExpr eol = and(choice(lit("\n"), lit(String.valueOf(markers.dedentS())),
                             lit(String.valueOf(markers.dedentT())), eof()));

    /* document and blocks */
    g.define("document", seq(opt(ref("core_blocks")), opt(ref("margin")), eof()));
    g.define("core_blocks", plus(choice(ref("tail_blocks"), ref("block"))));
    g.define("tail_blocks", choice(
        seq(ref("indent_s"), ref("core_blocks"), ref("dedent_s")),
        seq(ref("indent_t"), ref("core_blocks"), ref("dedent_t"))));
    g.define("block", seq(ref("margin_out"), opt(seq(ref("dedent"), ws)),
                          ref("block_inner")));
    g.define("block_inner", choice(ref("block_control"), ref("block_def"),
        ref("block_import"), ref("block_embed"), ref("block_pass"),
        ref("block_comment"), seq(ref("block_text"), eol), ref("block_struct")));

    /* control blocks */
    g.define("block_control", choice(ref("block_assign"), ref("block_if"),
        ref("block_try"), ref("block_for"), ref("block_while")));
    g.define("block_assign", seq(lit("$"), ws, ref("targets"), ws,
        opt(ref("op_inplace")), lit("="), not(lit("=")), ws,
        ref("expr_augment"), eol));
    g.define("block_if", seq(lit("if"), ref("clause_if"),
        star(seq(nl, lit("elif"), ref("clause_if"))),
        opt(seq(nl, lit("else"), ref("body")))));
    // inline text after the test only when the test is an embedding,
    // otherwise "|" would be read as an operator
    g.define("clause_if", seq(space, choice(
        seq(ref("embedding"), ref("body")),
        seq(ref("expr_root"), ref("body_struct")))));
    g.define("block_try", choice(
        seq(lit("try"), ref("body"), star(seq(nl, lit("else"), ref("body")))),
        ref("try_short")));
    g.define("try_short", seq(lit("?"), ws,
        choice(ref("block_text"), ref("block_struct"))));
    g.define("block_for", seq(lit("for"), space, ref("targets"), space,
        lit("in"), space, choice(
            seq(ref("embedding"), ref("body")),
            seq(ref("expr_augment"), ref("body_struct")))));
    g.define("block_while", seq(lit("while"), ref("clause_if")));
    g.define("targets", seq(ref("target"), star(seq(comma, ref("target"))),
        opt(seq(ws, lit(",")))));
    g.define("target", choice(seq(lit("("), ws, ref("targets"), ws, lit(")")),
        ref("var_def")));

    /* definitions, imports, other simple blocks */
    g.define("block_def", seq(lit("%"), ws, ref("name_id"),
        opt(seq(space, ref("attr_body"))), star(seq(space, ref("attr_def"))),
        ref("body")));
    g.define("attr_body", seq(lit("@"), ref("name_id")));
    g.define("attr_def", seq(ref("name_id"),
        opt(seq(ws, lit("="), ws, ref("value_of_attr")))));
    g.define("block_import", seq(choice(
        seq(lit("from"), space, ref("path_import"), space, lit("import"),
            space, ref("items_import")),
        seq(lit("import"), space, ref("items_import"))), eol));
    g.define("items_import", seq(ref("item_import"),
        star(seq(comma, ref("item_import")))));
    g.define("item_import", choice(ref("wild_import"), ref("name_import")));
    g.define("wild_import", lit("*"));
    g.define("name_import", seq(ref("symbol"),
        opt(seq(space, lit("as"), space, ref("name_id")))));
    g.define("block_embed", seq(lit("@"), ws,
        choice(ref("embedding"), ref("factor")), eol));
    g.define("block_pass", seq(lit("pass"), eol));
    g.define("block_comment", seq(re(COMMENT_MARK), opt(re("[^" + mk + "\\n]+")),
        opt(ref("tail_verbat"))));

    /* text blocks */
    g.define("block_text", choice(ref("block_verbat"), ref("block_normal"),
        ref("block_markup")));
    g.define("block_verbat", seq(lit("!"), opt(ref("line_verbat")),
        opt(ref("tail_verbat"))));
    g.define("block_normal", seq(lit("|"), opt(ref("line_normal")),
        opt(ref("tail_normal"))));
    g.define("block_markup", seq(lit("/"), opt(ref("line_markup")),
        opt(ref("tail_markup"))));
    for (String kind: new String[] {"verbat", "normal", "markup"}) {
      g.define("tail_" + kind, choice(
          seq(ref("indent_s"), ref("core_" + kind), ref("dedent_s")),
          seq(ref("indent_t"), ref("core_" + kind), ref("dedent_t"))));
      g.define("core_" + kind, plus(choice(ref("tail_" + kind),
          seq(ref("margin"), ref("line_" + kind)))));
    }
    g.define("line_verbat", re("[^" + mk + "\\n]+"));
    g.define("line_normal", ref("line_markup"));
    g.define("line_markup", plus(choice(ref("escape"), ref("embedding"),
        ref("text"))));
    g.define("headline", choice(ref("head_verbat"), ref("head_normal"),
        ref("head_markup")));
    g.define("head_verbat", seq(lit("!"), opt(ref("line_verbat"))));
    g.define("head_normal", seq(lit("|"), opt(ref("line_normal"))));
    g.define("head_markup", seq(lit("/"), opt(ref("line_markup"))));

    /* structural blocks */
    g.define("block_struct", seq(ref("tags_expand"), ref("body")));
    g.define("body", choice(ref("body_text"), ref("body_struct")));
    g.define("body_text", seq(ws, ref("block_text"), eol));
    g.define("body_struct", seq(
        opt(seq(ws, lit(":"), opt(seq(ws, ref("headline"))))),
        opt(ref("comment")), opt(ref("tail_blocks")), eol));
    g.define("comment", seq(ws, re(COMMENT_MARK), opt(re("[^" + mk + "\\n]+"))));
    g.define("tags_expand", seq(ref("tag_item"),
        star(seq(ws, lit(":"), ws, ref("tag_item")))));
    g.define("tag_item", choice(ref("null_tag"), ref("tag_expand")));
    g.define("null_tag", seq(lit("."), not(re("[a-zA-Z0-9_\\-{$]"))));
    g.define("tag_expand", choice(
        seq(ref("name_id"), opt(ref("attrs_val"))),
        seq(and(ref("attr_short")), ref("attrs_val"))));

    /* attributes */
    g.define("attrs_val", plus(choice(seq(ws, ref("attr_short")),
        seq(space, ref("attr_val")))));
    g.define("attr_val", choice(ref("attr_named"), ref("attr_unnamed")));
    g.define("attr_named", seq(ref("name_xml"), ws, lit("="), ws,
        ref("value_of_attr")));
    g.define("attr_unnamed", ref("value_of_attr"));
    g.define("attr_short", seq(re("[.#]"),
        choice(ref("attr_short_lit"), ref("embedding"))));
    g.define("value_of_attr", choice(ref("embedding"), ref("factor_attr")));
    g.define("factor_attr", seq(ref("atom_attr"), star(ref("trailer")),
        opt(ref("qualifier"))));
    g.define("atom_attr", choice(ref("literal"), ref("subexpr"), ref("tuple"),
        ref("list"), ref("dict"), ref("set")));

    /* embeddings */
    g.define("embedding", choice(ref("expr"), ref("expr_var")));
    g.define("expr", seq(lit("{"), ws, ref("expr_augment"), ws, lit("}"),
        opt(ref("qualifier"))));
    g.define("expr_var", seq(lit("$"), ref("factor_var")));
    g.define("factor_var", seq(ref("var_use"), star(ref("trailer")),
        opt(ref("qualifier"))));

    /* expressions */
    g.define("expr_augment", choice(ref("expr_tuple"), ref("expr_root")));
    g.define("expr_tuple", seq(ref("expr_root"), ws, lit(","),
        star(seq(ws, ref("expr_root"), ws, lit(","))),
        opt(seq(ws, ref("expr_root")))));
    g.define("expr_root", ref("ifelse_test"));
    g.define("subexpr", seq(lit("("), ws, ref("expr_root"), ws, lit(")")));
    g.define("tuple", seq(lit("("), ws,
        opt(seq(plus(seq(ref("expr_root"), comma)),
                opt(seq(ref("expr_root"), ws)))), lit(")")));
    g.define("list", seq(lit("["), ws, star(seq(ref("expr_root"), comma)),
        opt(seq(ref("expr_root"), ws)), lit("]")));
    g.define("set", seq(lit("{"), ws, ref("expr_root"),
        star(seq(comma, ref("expr_root"))), ws, opt(seq(lit(","), ws)),
        lit("}")));
    g.define("dict", seq(lit("{"), ws, star(seq(ref("dict_pair"), comma)),
        opt(seq(ref("dict_pair"), ws)), lit("}")));
    g.define("dict_pair", seq(ref("expr_root"), ws, lit(":"), ws,
        ref("expr_root")));
    g.define("atom", choice(ref("literal"), ref("var_use"), ref("subexpr"),
        ref("tuple"), ref("list"), ref("dict"), ref("set")));
    g.define("factor", seq(ref("atom"), star(seq(ws, ref("trailer"))),
        opt(ref("qualifier"))));
    g.define("pow_expr", seq(ref("factor"),
        star(seq(ws, ref("op_power"), ws, ref("factor")))));
    g.define("term", seq(ref("pow_expr"),
        star(seq(ws, ref("op_multiplic"), ws, ref("pow_expr")))));
    g.define("arith_expr", seq(opt(ref("neg")), ws, ref("term"),
        star(seq(ws, ref("op_additive"), ws, ref("term")))));
    g.define("shift_expr", seq(ref("arith_expr"),
        star(seq(ws, ref("op_shift"), ws, ref("arith_expr")))));
    g.define("and_expr", seq(ref("shift_expr"),
        star(seq(ws, lit("&"), ws, ref("shift_expr")))));
    g.define("xor_expr", seq(ref("and_expr"),
        star(seq(ws, lit("^"), ws, ref("and_expr")))));
    g.define("or_expr", seq(ref("xor_expr"),
        star(seq(ws, lit("|"), ws, ref("xor_expr")))));
    g.define("concat_expr", seq(ref("or_expr"), star(seq(space, ref("or_expr")))));
    g.define("comparison", seq(ref("concat_expr"),
        star(seq(ws, ref("op_comp"), ws, ref("concat_expr")))));
    g.define("not_test", seq(star(seq(ref("not"), space)), ref("comparison")));
    g.define("and_test", seq(ref("not_test"),
        star(seq(space, lit("and"), space, ref("not_test")))));
    g.define("or_test", seq(ref("and_test"),
        star(seq(space, lit("or"), space, ref("and_test")))));
    g.define("ifelse_test", seq(ref("or_test"), opt(seq(space, lit("if"),
        space, ref("or_test"),
        opt(seq(space, lit("else"), space, ref("ifelse_test")))))));

    /* tail operators */
    g.define("trailer", choice(ref("call"), ref("index"), ref("member")));
    g.define("call", seq(lit("("), ws, opt(seq(ref("args"), ws)), lit(")")));
    g.define("args", seq(ref("arg"), star(seq(comma, ref("arg"))),
        opt(seq(ws, lit(",")))));
    g.define("arg", choice(ref("kwarg"), ref("expr_root")));
    g.define("kwarg", seq(ref("name_id"), ws, lit("="), not(lit("=")), ws,
        ref("expr_root")));
    g.define("index", seq(lit("["), ref("subscript"), lit("]")));
    g.define("subscript", choice(ref("slice"), seq(ws, ref("expr_augment"), ws)));
    g.define("slice", seq(ref("slice_value"), lit(":"), ref("slice_value"),
        opt(seq(lit(":"), ref("slice_value")))));
    g.define("slice_value", seq(ws, opt(seq(ref("expr_root"), ws))));
    g.define("member", seq(lit("."), ws, ref("name_id")));
    g.define("qualifier", re("[?!](?!=)"));

    /* operators */
    g.define("op_power", lit("**"));
    g.define("op_multiplic", re("\\*(?!\\*)|//|/|%"));
    g.define("op_additive", re("[-+]"));
    g.define("op_shift", re("<<|>>"));
    g.define("op_comp", re("==|!=|>=|<=|<|>|not\\s+in\\b|is\\s+not\\b|in\\b|is\\b"));
    g.define("op_inplace", re("(//|<<|>>|[-+*/%&|^])(?==)"));
    g.define("neg", re("-(?!-)"));
    g.define("not", re("not\\b"));

    /* names and literals */
    g.define("var_use", word("\\$?" + NAME, RESERVED));
    g.define("var_def", word("\\$?" + NAME, RESERVED));
    g.define("name_id", word(NAME, RESERVED));
    g.define("name_xml", re("[" + XML_START + "][" + XML_CHAR + "]*"));
    g.define("symbol", re("[%$]" + NAME));
    g.define("path_import", re("[^\\s" + mk + "]+"));
    g.define("attr_short_lit", re("[a-zA-Z0-9_\\-]+"));
    g.define("literal", choice(ref("number"), ref("string"), ref("boolean"),
        ref("none")));
    g.define("number", re("((\\.\\d+)|(\\d+(\\.\\d*)?))([eE][+-]?\\d+)?"));
    g.define("string", re("'[^']*'|\"[^\"]*\""));
    g.define("boolean", re("(True|False)\\b"));
    g.define("none", re("None\\b"));

    /* basic tokens */
    g.define("escape", re("\\$\\$|\\{\\{|\\}\\}"));
    g.define("text", re("[^" + mk + "\\n${}]+"));
    g.define("indent_s", lit(String.valueOf(markers.indentS())));
    g.define("dedent_s", lit(String.valueOf(markers.dedentS())));
    g.define("indent_t", lit(String.valueOf(markers.indentT())));
    g.define("dedent_t", lit(String.valueOf(markers.dedentT())));
    g.define("dedent", lit("<"));
    g.define("margin", re("\\n+"));
    g.define("margin_out", re("\\n+"));
    g.define("nl", re("\\n+"));
    g.define("comma", re("[ \\t]*,[ \\t]*"));
    g.define("space", re("[ \\t]+"));
    g.define("ws", re("[ \\t]*"));
    return g;
  }
}
