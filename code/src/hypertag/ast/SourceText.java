package hypertag.ast;

/**
 * Preprocessed script text with enough information to map offsets back to
 * lines and columns of the original input.  Line k of the original (counted
 * from 1) is line k of the preprocessed text (counted from 0).
 */
public class SourceText {
  private final String fileName;
  private final String text;
  private final String[] originalLines;

  public SourceText(String fileName, String text, String original) {
    this.fileName = fileName;
    this.text = text;
    this.originalLines = original.split("\n", -1);
  }

  public String getFileName() {
    return fileName;
  }

  public String getText() {
    return text;
  }

  public String substring(int start, int end) {
    return text.substring(start, end);
  }

  /** @return offset of the first character of the line holding pos */
  public int lineStart(int pos) {
    return text.lastIndexOf('\n', pos - 1) + 1;
  }

  /** @return 1-based line number in the original input */
  public int lineOf(int pos) {
    int line = 0;
    for (int i = 0; i < pos && i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  /** @return 0-based column in the original input */
  public int columnOf(int pos) {
    int line = lineOf(pos);
    int indent = 0;
    if (line >= 1 && line <= originalLines.length) {
      String orig = originalLines[line - 1];
      while (indent < orig.length() &&
             (orig.charAt(indent) == ' ' || orig.charAt(indent) == '\t')) {
        indent++;
      }
    }
    // indentation markers only ever trail a line, never lead it
    return indent + (pos - lineStart(pos));
  }
}
