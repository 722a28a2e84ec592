package hypertag.dom;

import hypertag.common.exceptions.UserException;

/**
 * Root node of a translated document.
 */
public class HRoot extends HNode {

  /**
   * Children are given in absolute indentation, which becomes relative
   * to the start of the document.
   */
  public HRoot(Sequence body) {
    super(body, "\n");
    this.indent = "";
  }

  /**
   * The preprocessor prepends a newline to every script; it is dropped
   * here unless dropLine is false.
   */
  public String render(boolean dropLine) throws UserException {
    String output = super.render();
    if (dropLine && output.startsWith("\n")) {
      return output.substring(1);
    }
    return output;
  }

  @Override
  public String render() throws UserException {
    return render(true);
  }
}
