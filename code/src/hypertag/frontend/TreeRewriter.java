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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.ast.SourceText;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.frontend.peg.ParseTree;

/**
 * Rewrites a concrete parse tree into the typed AST:
 * ignored rules are pruned with their subtrees, reduced rules are replaced
 * by their children, and compacted rules are replaced by their only child
 * when rewriting leaves them with exactly one.
 */
public class TreeRewriter {

  static final Set<String> IGNORE = ImmutableSet.of(
      "nl", "ws", "space", "comma", "comment");

  static final Set<String> REDUCE = ImmutableSet.of(
      "block_inner", "block_control", "block_text", "try_short", "target",
      "core_blocks", "tail_blocks", "items_import", "item_import",
      "tail_verbat", "tail_normal", "tail_markup",
      "core_verbat", "core_normal", "core_markup",
      "headline", "body", "tag_item", "attrs_val", "attr_val",
      "value_of_attr", "embedding", "expr_augment", "expr_root", "subexpr",
      "atom", "atom_attr", "literal", "dict_pair", "trailer", "args", "arg",
      "subscript", "slice");

  static final Set<String> COMPACT = ImmutableSet.of(
      "factor", "factor_var", "factor_attr", "pow_expr", "term", "arith_expr",
      "shift_expr", "and_expr", "xor_expr", "or_expr", "concat_expr",
      "comparison", "not_test", "and_test", "or_test", "ifelse_test");

  /** Rules whose nodes share a kind with another rule */
  static final Map<String, NodeKind> ALIASES = ImmutableMap.<String, NodeKind>builder()
      .put("body_text", NodeKind.BODY)
      .put("body_struct", NodeKind.BODY)
      .put("head_verbat", NodeKind.BLOCK_VERBAT)
      .put("head_normal", NodeKind.BLOCK_NORMAL)
      .put("head_markup", NodeKind.BLOCK_MARKUP)
      .put("factor_var", NodeKind.FACTOR)
      .put("factor_attr", NodeKind.FACTOR)
      .put("expr_tuple", NodeKind.TUPLE)
      .build();

  private final SourceText source;

  public TreeRewriter(SourceText source) {
    this.source = source;
  }

  public HypertagAST rewrite(ParseTree root) {
    List<HypertagAST> out = new ArrayList<HypertagAST>(1);
    rewrite(root, out);
    if (out.size() != 1) {
      throw new HypertagRuntimeError("Rewriting of " + root +
                                     " produced " + out.size() + " roots");
    }
    return out.get(0);
  }

  private void rewrite(ParseTree tree, List<HypertagAST> out) {
    String name = tree.getName();
    if (IGNORE.contains(name)) {
      return;
    }

    List<HypertagAST> children = new ArrayList<HypertagAST>();
    for (ParseTree child: tree.getChildren()) {
      rewrite(child, children);
    }

    if (REDUCE.contains(name)) {
      out.addAll(children);
      return;
    }
    if (COMPACT.contains(name) && children.size() == 1) {
      out.add(children.get(0));
      return;
    }
    out.add(new HypertagAST(kindOf(name), source, tree.getStart(),
                            tree.getEnd(), children));
  }

  static NodeKind kindOf(String rule) {
    NodeKind kind = ALIASES.get(rule);
    if (kind != null) {
      return kind;
    }
    try {
      return NodeKind.valueOf(rule.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new HypertagRuntimeError("No node kind for grammar rule: " + rule);
    }
  }
}
