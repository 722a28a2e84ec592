package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

/**
 * A None value was about to be converted to text.
 */
public class NoneStringException extends TypeMismatchException {
  public NoneStringException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
