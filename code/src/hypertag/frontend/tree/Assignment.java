package hypertag.frontend.tree;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.InvalidSyntaxException;

/**
 * $targets [op]= expression
 */
public class Assignment {
  private final HypertagAST targets;

  /** In-place operator, e.g. "+" for +=; null for plain assignment */
  private final String inplace;
  private final HypertagAST expr;

  private Assignment(HypertagAST targets, String inplace, HypertagAST expr) {
    this.targets = targets;
    this.inplace = inplace;
    this.expr = expr;
  }

  public HypertagAST getTargets() {
    return targets;
  }

  public String getInplace() {
    return inplace;
  }

  public boolean isInplace() {
    return inplace != null;
  }

  public HypertagAST getExpr() {
    return expr;
  }

  /**
   * @return true if the targets unpack a value rather than name a
   *         single variable
   */
  public static boolean isAugmented(HypertagAST targets) {
    return targets.childCount() >= 2 ||
           targets.child(0).getKind() != NodeKind.VAR_DEF;
  }

  public static Assignment fromAST(HypertagAST tree)
                                          throws InvalidSyntaxException {
    assert(tree.getKind() == NodeKind.BLOCK_ASSIGN);
    HypertagAST targets = tree.child(0);
    HypertagAST expr = tree.child(tree.childCount() - 1);
    String inplace = null;
    if (tree.childCount() == 3) {
      inplace = tree.child(1).getOp();
      if (isAugmented(targets)) {
        throw new InvalidSyntaxException(tree, "illegal expression " +
                            inplace + "= for augmented assignment");
      }
      // in-place operators read the variable before writing it
      targets.child(0).setRead(true);
    }
    return new Assignment(targets, inplace, expr);
  }
}
