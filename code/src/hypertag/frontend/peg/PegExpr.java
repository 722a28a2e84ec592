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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import hypertag.common.exceptions.HypertagRuntimeError;

/**
 * Parsing expression.  Subclasses implement the usual PEG operators;
 * instances are built with the static factory methods and combined into
 * rules of a {@link Grammar}.
 */
public abstract class PegExpr {

  /**
   * Match at pos, appending nodes of named rules to out.
   * @return end offset of the match, or -1 on failure; on failure out is
   *         left as it was
   */
  abstract int match(PackratParser parser, int pos, List<ParseTree> out);

  public static PegExpr lit(String literal) {
    return new Literal(literal);
  }

  public static PegExpr re(String regex) {
    return new Regex(Pattern.compile(regex), Collections.<String>emptySet());
  }

  public static PegExpr re(String regex, int flags) {
    return new Regex(Pattern.compile(regex, flags),
                     Collections.<String>emptySet());
  }

  /**
   * Regex whose match is rejected if it is one of the excluded words
   */
  public static PegExpr word(String regex, Set<String> excluded) {
    return new Regex(Pattern.compile(regex), excluded);
  }

  public static PegExpr seq(PegExpr... exprs) {
    return new Sequence(Arrays.asList(exprs));
  }

  public static PegExpr choice(PegExpr... exprs) {
    return new Choice(Arrays.asList(exprs));
  }

  public static PegExpr star(PegExpr expr) {
    return new Repeat(expr, 0);
  }

  public static PegExpr plus(PegExpr expr) {
    return new Repeat(expr, 1);
  }

  public static PegExpr opt(PegExpr expr) {
    return new Optional(expr);
  }

  public static PegExpr not(PegExpr expr) {
    return new Lookahead(expr, false);
  }

  public static PegExpr and(PegExpr expr) {
    return new Lookahead(expr, true);
  }

  public static PegExpr ref(String ruleName) {
    return new Ref(ruleName);
  }

  public static PegExpr eof() {
    return new EndOfInput();
  }

  private static class Literal extends PegExpr {
    private final String literal;

    Literal(String literal) {
      this.literal = literal;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      if (parser.getText().startsWith(literal, pos)) {
        return pos + literal.length();
      }
      parser.fail(pos);
      return -1;
    }

    @Override
    public String toString() {
      return "'" + literal + "'";
    }
  }

  static class Regex extends PegExpr {
    private final Pattern pattern;
    private final Set<String> excluded;

    Regex(Pattern pattern, Set<String> excluded) {
      this.pattern = pattern;
      this.excluded = excluded;
    }

    Pattern getPattern() {
      return pattern;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      Matcher m = parser.matcher(this);
      m.region(pos, parser.getText().length());
      if (m.lookingAt() &&
          (excluded.isEmpty() || !excluded.contains(m.group()))) {
        return m.end();
      }
      parser.fail(pos);
      return -1;
    }

    @Override
    public String toString() {
      return "~\"" + pattern.pattern() + "\"";
    }
  }

  private static class Sequence extends PegExpr {
    private final List<PegExpr> exprs;

    Sequence(List<PegExpr> exprs) {
      this.exprs = exprs;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      int mark = out.size();
      int cur = pos;
      for (PegExpr e: exprs) {
        cur = e.match(parser, cur, out);
        if (cur < 0) {
          truncate(out, mark);
          return -1;
        }
      }
      return cur;
    }
  }

  private static class Choice extends PegExpr {
    private final List<PegExpr> exprs;

    Choice(List<PegExpr> exprs) {
      this.exprs = exprs;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      for (PegExpr e: exprs) {
        int end = e.match(parser, pos, out);
        if (end >= 0) {
          return end;
        }
      }
      return -1;
    }
  }

  private static class Repeat extends PegExpr {
    private final PegExpr expr;
    private final int min;

    Repeat(PegExpr expr, int min) {
      this.expr = expr;
      this.min = min;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      int mark = out.size();
      int count = 0;
      int cur = pos;
      while (true) {
        int end = expr.match(parser, cur, out);
        if (end < 0) {
          break;
        }
        count++;
        if (end == cur) {
          // empty match would loop forever
          break;
        }
        cur = end;
      }
      if (count < min) {
        truncate(out, mark);
        return -1;
      }
      return cur;
    }
  }

  private static class Optional extends PegExpr {
    private final PegExpr expr;

    Optional(PegExpr expr) {
      this.expr = expr;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      int end = expr.match(parser, pos, out);
      return end < 0 ? pos : end;
    }
  }

  private static class Lookahead extends PegExpr {
    private final PegExpr expr;
    private final boolean positive;

    Lookahead(PegExpr expr, boolean positive) {
      this.expr = expr;
      this.positive = positive;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      List<ParseTree> discard = new ArrayList<ParseTree>();
      boolean matched = expr.match(parser, pos, discard) >= 0;
      return matched == positive ? pos : -1;
    }
  }

  private static class Ref extends PegExpr {
    private final String ruleName;
    private Rule rule = null;

    Ref(String ruleName) {
      this.ruleName = ruleName;
    }

    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      if (rule == null) {
        rule = parser.getGrammar().getRule(ruleName);
        if (rule == null) {
          throw new HypertagRuntimeError("Undefined grammar rule: " + ruleName);
        }
      }
      return parser.apply(rule, pos, out);
    }

    @Override
    public String toString() {
      return ruleName;
    }
  }

  private static class EndOfInput extends PegExpr {
    @Override
    int match(PackratParser parser, int pos, List<ParseTree> out) {
      if (pos == parser.getText().length()) {
        return pos;
      }
      parser.fail(pos);
      return -1;
    }
  }

  private static void truncate(List<ParseTree> out, int size) {
    while (out.size() > size) {
      out.remove(out.size() - 1);
    }
  }
}
