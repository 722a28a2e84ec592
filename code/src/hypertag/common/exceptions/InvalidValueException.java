package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

/**
 * Right type but inappropriate value, e.g. unpacking arity mismatch.
 */
public class InvalidValueException extends UserException {
  public InvalidValueException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
