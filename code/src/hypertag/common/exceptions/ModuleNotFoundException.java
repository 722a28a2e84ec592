package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

public class ModuleNotFoundException extends ImportException {
  public ModuleNotFoundException(HypertagAST node, String message) {
    super(node, message);
  }

  private static final long serialVersionUID = 1L;
}
