package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

/**
 * An obligatory expression evaluated to a false or empty value.
 */
public class MissingValueException extends UserException {
  public MissingValueException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
