package hypertag.dom;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Operations on the indentation of multi-line text.
 */
public class Indents {

  /** Start of every non-empty line */
  private static final Pattern LINE_START =
      Pattern.compile("^(?=.)", Pattern.MULTILINE | Pattern.UNIX_LINES);

  /**
   * Prepend indent to every line of text, the first one included.
   * Lines with no characters at all are left untouched.
   */
  public static String addIndent(String text, String indent) {
    if (indent == null || indent.isEmpty()) {
      return text;
    }
    return LINE_START.matcher(text).replaceAll(Matcher.quoteReplacement(indent));
  }

  /**
   * Remove indent from the start of every line where it is a prefix.
   */
  public static String delIndent(String text, String indent) {
    if (text.startsWith(indent)) {
      text = text.substring(indent.length());
    }
    return text.replace("\n" + indent, "\n");
  }

  public static String delIndent(String text) {
    return delIndent(text, getIndent(text));
  }

  /**
   * @return the longest whitespace prefix shared by all lines of text that
   *         contain a non-whitespace character
   */
  public static String getIndent(String text) {
    List<String> lines = new ArrayList<String>();
    for (String line: text.split("\n", -1)) {
      if (!StringUtils.isBlank(line)) {
        lines.add(line);
      }
    }
    if (lines.isEmpty()) {
      return "";
    }

    String first = lines.get(0);
    int shortest = Integer.MAX_VALUE;
    for (String line: lines) {
      shortest = Math.min(shortest, line.length());
    }
    for (int i = 0; i < shortest; i++) {
      char c = first.charAt(i);
      if (!Character.isWhitespace(c)) {
        return first.substring(0, i);
      }
      for (String line: lines) {
        if (line.charAt(i) != c) {
          return first.substring(0, i);
        }
      }
    }
    return first.substring(0, shortest);
  }
}
