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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Packrat parser: runs the rules of a grammar over one input text,
 * memoising every rule application so that backtracking stays linear.
 */
public class PackratParser {

  private static class Memo {
    final int end;
    final ParseTree tree;

    Memo(int end, ParseTree tree) {
      this.end = end;
      this.tree = tree;
    }
  }

  private final Grammar grammar;
  private final String text;
  private final Map<Long, Memo> memo = new HashMap<Long, Memo>();
  private final Map<PegExpr, Matcher> matchers =
      new IdentityHashMap<PegExpr, Matcher>();

  /** Farthest offset where a terminal failed */
  private int farthest = 0;

  public PackratParser(Grammar grammar, String text) {
    this.grammar = grammar;
    this.text = text;
  }

  public Grammar getGrammar() {
    return grammar;
  }

  public String getText() {
    return text;
  }

  /**
   * Parse the whole text with the given start rule
   * @throws IncompleteParseException if the rule fails or stops early
   */
  public ParseTree parse(String startRule) throws IncompleteParseException {
    Rule rule = grammar.getRule(startRule);
    List<ParseTree> out = new ArrayList<ParseTree>(1);
    int end = apply(rule, 0, out);
    if (end < 0) {
      throw new IncompleteParseException(farthest,
          "rule '" + startRule + "' did not match at offset " + farthest);
    }
    if (end != text.length()) {
      throw new IncompleteParseException(Math.max(end, farthest),
          "rule '" + startRule + "' matched only up to offset " + end);
    }
    return out.get(0);
  }

  int apply(Rule rule, int pos, List<ParseTree> out) {
    long key = (long) rule.getIndex() * (text.length() + 1) + pos;
    Memo m = memo.get(key);
    if (m == null) {
      List<ParseTree> children = new ArrayList<ParseTree>();
      int end = rule.getExpr().match(this, pos, children);
      ParseTree tree = end < 0 ? null :
                          new ParseTree(rule, pos, end, children);
      m = new Memo(end, tree);
      memo.put(key, m);
    }
    if (m.end >= 0) {
      out.add(m.tree);
    }
    return m.end;
  }

  Matcher matcher(PegExpr.Regex regex) {
    Matcher m = matchers.get(regex);
    if (m == null) {
      m = regex.getPattern().matcher(text);
      m.useTransparentBounds(true);
      m.useAnchoringBounds(false);
      matchers.put(regex, m);
    }
    return m;
  }

  void fail(int pos) {
    if (pos > farthest) {
      farthest = pos;
    }
  }

  public int getFarthestFailure() {
    return farthest;
  }
}
