package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

/**
 * A declared variable was read before any assignment executed in the
 * current render.
 */
public class UnboundVarException extends UndefinedVarException {
  public UnboundVarException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
