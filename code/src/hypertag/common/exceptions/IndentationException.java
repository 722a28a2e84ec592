package hypertag.common.exceptions;

/**
 * Indentation of a line is neither an extension nor a prefix of the
 * indentation of the previous code line.
 */
public class IndentationException extends InvalidSyntaxException {
  private final int line;

  public IndentationException(int line) {
    super("indentation on line " + line
        + " is incompatible with previous line");
    this.line = line;
  }

  public int getLine() {
    return line;
  }

  private static final long serialVersionUID = 1L;
}
