package hypertag.frontend.peg;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import hypertag.common.exceptions.HypertagRuntimeError;

/**
 * Set of named PEG rules.
 */
public class Grammar {
  private final Map<String, Rule> rules = new LinkedHashMap<String, Rule>();

  public Grammar define(String name, PegExpr expr) {
    if (rules.containsKey(name)) {
      throw new HypertagRuntimeError("Grammar rule defined twice: " + name);
    }
    rules.put(name, new Rule(name, rules.size(), expr));
    return this;
  }

  public Rule getRule(String name) {
    return rules.get(name);
  }

  public Collection<Rule> getRules() {
    return Collections.unmodifiableCollection(rules.values());
  }

  public ParseTree parse(String text, String startRule)
                                      throws IncompleteParseException {
    if (!rules.containsKey(startRule)) {
      throw new HypertagRuntimeError("Undefined start rule: " + startRule);
    }
    return new PackratParser(this, text).parse(startRule);
  }
}
