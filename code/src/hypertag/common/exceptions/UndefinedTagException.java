package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

public class UndefinedTagException extends UndefinedVarException {
  public UndefinedTagException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
