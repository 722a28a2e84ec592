package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

public class NotATagException extends TypeMismatchException {
  public NotATagException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
