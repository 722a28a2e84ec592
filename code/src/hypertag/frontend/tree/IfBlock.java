package hypertag.frontend.tree;

import java.util.List;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;

/**
 * if/elif/else: one or more clauses, each a test with a body, and an
 * optional else body.
 */
public class IfBlock {
  private final List<HypertagAST> clauses;
  private final HypertagAST elseBody;

  private IfBlock(List<HypertagAST> clauses, HypertagAST elseBody) {
    this.clauses = clauses;
    this.elseBody = elseBody;
  }

  public List<HypertagAST> getClauses() {
    return clauses;
  }

  public HypertagAST getElseBody() {
    return elseBody;
  }

  public boolean hasElse() {
    return elseBody != null;
  }

  public static IfBlock fromAST(HypertagAST tree) {
    assert(tree.getKind() == NodeKind.BLOCK_IF);
    int count = tree.childCount();
    HypertagAST last = tree.child(count - 1);
    if (last.getKind() == NodeKind.CLAUSE_IF) {
      return new IfBlock(tree.children(), null);
    }
    return new IfBlock(tree.children().subList(0, count - 1), last);
  }

  /** Test expression of a clause */
  public static HypertagAST clauseTest(HypertagAST clause) {
    return clause.child(0);
  }

  public static HypertagAST clauseBody(HypertagAST clause) {
    return clause.childCount() == 2 ? clause.child(1) : null;
  }
}
