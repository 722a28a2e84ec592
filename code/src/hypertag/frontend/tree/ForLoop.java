package hypertag.frontend.tree;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.HypertagRuntimeError;

public class ForLoop {
  private final HypertagAST targets;
  private final HypertagAST expr;
  private final HypertagAST body;

  private ForLoop(HypertagAST targets, HypertagAST expr, HypertagAST body) {
    this.targets = targets;
    this.expr = expr;
    this.body = body;
  }

  public HypertagAST getTargets() {
    return targets;
  }

  /** Expression producing the sequence to loop over */
  public HypertagAST getExpr() {
    return expr;
  }

  public HypertagAST getBody() {
    return body;
  }

  public static ForLoop fromAST(HypertagAST tree) {
    assert(tree.getKind() == NodeKind.BLOCK_FOR);
    if (tree.childCount() != 3) {
      throw new HypertagRuntimeError("for: expected 3 children, got "
                                     + tree.childCount());
    }
    return new ForLoop(tree.child(0), tree.child(1), tree.child(2));
  }
}
