package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

public class ImportException extends UserException {
  public ImportException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
