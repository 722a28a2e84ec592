package hypertag.frontend.peg;

/**
 * The start rule did not match the whole input.
 */
public class IncompleteParseException extends Exception {
  private final int position;

  public IncompleteParseException(int position, String message) {
    super(message);
    this.position = position;
  }

  /**
   * @return the farthest offset at which some terminal failed to match
   */
  public int getPosition() {
    return position;
  }

  private static final long serialVersionUID = 1L;
}
