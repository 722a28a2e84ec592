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
package hypertag.ast;

/**
 * Closed set of node kinds produced by the tree rewriter.  Every grammar
 * rule that survives rewriting maps to one constant (by upper-cased name),
 * except for a few aliases resolved in the rewriter.
 *
 * Each kind declares how it takes part in compaction:
 * PURE nodes render the same value in every state, IMPURE nodes never do,
 * and STRUCTURAL nodes are pure exactly when all their children are.
 */
public enum NodeKind {
  /* documents and blocks */
  DOCUMENT(Purity.IMPURE),
  BLOCK(Purity.IMPURE),
  BODY(Purity.IMPURE),
  BLOCK_VERBAT(Purity.IMPURE),
  BLOCK_NORMAL(Purity.IMPURE),
  BLOCK_MARKUP(Purity.IMPURE),
  BLOCK_COMMENT(Purity.IMPURE),
  BLOCK_EMBED(Purity.IMPURE),
  BLOCK_STRUCT(Purity.IMPURE),
  BLOCK_DEF(Purity.IMPURE),
  BLOCK_IMPORT(Purity.IMPURE),
  BLOCK_TRY(Purity.IMPURE),
  BLOCK_IF(Purity.IMPURE),
  CLAUSE_IF(Purity.IMPURE),
  BLOCK_WHILE(Purity.IMPURE),
  BLOCK_FOR(Purity.IMPURE),
  BLOCK_ASSIGN(Purity.IMPURE),
  BLOCK_PASS(Purity.IMPURE),
  TARGETS(Purity.IMPURE),
  WILD_IMPORT(Purity.IMPURE),
  NAME_IMPORT(Purity.IMPURE),

  /* lines of text blocks; rendering depends on the current indentation */
  LINE_VERBAT(Purity.IMPURE),
  LINE_NORMAL(Purity.IMPURE),
  LINE_MARKUP(Purity.IMPURE),

  /* tags and attributes */
  TAGS_EXPAND(Purity.IMPURE),
  TAG_EXPAND(Purity.IMPURE),
  NULL_TAG(Purity.IMPURE),
  ATTR_BODY(Purity.IMPURE),
  ATTR_DEF(Purity.IMPURE),
  ATTR_NAMED(Purity.IMPURE),
  ATTR_UNNAMED(Purity.IMPURE),
  ATTR_SHORT(Purity.IMPURE),

  /* indentation markers */
  INDENT_S(Purity.IMPURE),
  INDENT_T(Purity.IMPURE),
  DEDENT_S(Purity.IMPURE),
  DEDENT_T(Purity.IMPURE),

  /* variables and tail operators */
  VAR_USE(Purity.IMPURE),
  VAR_DEF(Purity.IMPURE),
  CALL(Purity.IMPURE),
  MEMBER(Purity.IMPURE),

  /* expressions */
  EXPR(Purity.STRUCTURAL),
  EXPR_VAR(Purity.STRUCTURAL),
  FACTOR(Purity.STRUCTURAL),
  INDEX(Purity.STRUCTURAL),
  SLICE_VALUE(Purity.STRUCTURAL),
  KWARG(Purity.STRUCTURAL),
  POW_EXPR(Purity.STRUCTURAL),
  TERM(Purity.STRUCTURAL),
  ARITH_EXPR(Purity.STRUCTURAL),
  SHIFT_EXPR(Purity.STRUCTURAL),
  AND_EXPR(Purity.STRUCTURAL),
  XOR_EXPR(Purity.STRUCTURAL),
  OR_EXPR(Purity.STRUCTURAL),
  CONCAT_EXPR(Purity.STRUCTURAL),
  COMPARISON(Purity.STRUCTURAL),
  NOT_TEST(Purity.STRUCTURAL),
  AND_TEST(Purity.STRUCTURAL),
  OR_TEST(Purity.STRUCTURAL),
  IFELSE_TEST(Purity.STRUCTURAL),
  LIST(Purity.STRUCTURAL),
  TUPLE(Purity.STRUCTURAL),
  SET(Purity.STRUCTURAL),
  DICT(Purity.STRUCTURAL),

  /* static leaves: value fixed during setup */
  TEXT(Purity.PURE),
  ESCAPE(Purity.PURE),
  MARGIN(Purity.PURE),
  MARGIN_OUT(Purity.PURE),
  NUMBER(Purity.PURE),
  STRING(Purity.PURE),
  BOOLEAN(Purity.PURE),
  NONE(Purity.PURE),
  ATTR_SHORT_LIT(Purity.PURE),
  NAME_ID(Purity.PURE),
  NAME_XML(Purity.PURE),
  SYMBOL(Purity.PURE),
  PATH_IMPORT(Purity.PURE),
  QUALIFIER(Purity.PURE),
  OP_POWER(Purity.PURE),
  OP_MULTIPLIC(Purity.PURE),
  OP_ADDITIVE(Purity.PURE),
  OP_SHIFT(Purity.PURE),
  OP_COMP(Purity.PURE),
  OP_INPLACE(Purity.PURE),
  NEG(Purity.PURE),
  NOT(Purity.PURE),
  DEDENT(Purity.PURE),

  /** Pre-rendered run of sibling nodes, created by the compactifier */
  MERGED(Purity.PURE);

  public enum Purity {
    PURE,
    IMPURE,
    STRUCTURAL,
  }

  private final Purity purity;

  private NodeKind(Purity purity) {
    this.purity = purity;
  }

  public Purity purity() {
    return purity;
  }

  /**
   * Static nodes carry a value computed once, during setup or compaction,
   * and render to it regardless of the state.
   */
  public boolean isStatic() {
    return purity == Purity.PURE;
  }
}
