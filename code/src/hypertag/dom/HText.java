package hypertag.dom;

/**
 * Leaf of the DOM tree with plain text or markup.
 */
public class HText extends HNode {
  private final String text;

  public HText(String text) {
    this(text, null);
  }

  public HText(String text, String indent) {
    super(null, null, null, null);
    this.text = text;
    this.indent = indent;
  }

  public String getText() {
    return text;
  }

  /** A leaf has no children to make relative */
  @Override
  public void setIndent(String indent) {
    this.indent = indent;
  }

  @Override
  protected String renderBody() {
    return text;
  }

  @Override
  public String toString() {
    return text;
  }
}
