package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

public class VoidTagException extends TypeMismatchException {
  public VoidTagException(HypertagAST node, String message) {
    super(node, message);
  }

  public VoidTagException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
