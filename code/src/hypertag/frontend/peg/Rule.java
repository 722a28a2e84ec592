package hypertag.frontend.peg;

/**
 * Named grammar rule.  Results of rule applications are memoised by
 * (rule index, position).
 */
public class Rule {
  private final String name;
  private final int index;
  private final PegExpr expr;

  Rule(String name, int index, PegExpr expr) {
    this.name = name;
    this.index = index;
    this.expr = expr;
  }

  public String getName() {
    return name;
  }

  int getIndex() {
    return index;
  }

  PegExpr getExpr() {
    return expr;
  }

  @Override
  public String toString() {
    return name;
  }
}
