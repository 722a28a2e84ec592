package hypertag.runtime;

import java.util.List;
import java.util.Map;

import hypertag.backend.Values;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;

/**
 * Generic element of a markup language: {@code <name attrs>body</name>},
 * or {@code <name attrs />} for a void element.
 */
public class MarkupTag extends ExternalTag {

  /** Render True attributes as name="name" instead of a bare name */
  private final boolean xhtml;

  public MarkupTag(String name, boolean isVoid, boolean xhtml) {
    super(name, isVoid, true);
    this.xhtml = xhtml;
  }

  @Override
  public String expand(Object body, List<Object> attrs,
              Map<String, Object> kwattrs) throws UserException {
    if (!attrs.isEmpty()) {
      throw new TypeMismatchException("tag <" + name + "> does not accept " +
                                      "unnamed attributes: " + attrs);
    }
    String start = name + formatAttrs(kwattrs);
    if (isVoid()) {
      return "<" + start + " />";
    }
    String text = body == null ? "" : (String) body;
    // a multiline body gets the closing tag on a separate line
    if (text.startsWith("\n")) {
      return "<" + start + ">" + text + "\n</" + name + ">";
    }
    return "<" + start + ">" + text + "</" + name + ">";
  }

  String formatAttrs(Map<String, Object> kwattrs) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Object> e: kwattrs.entrySet()) {
      String attr = e.getKey();
      Object value = e.getValue();
      if (value == null || Boolean.FALSE.equals(value)) {
        continue;
      }
      sb.append(' ').append(attr);
      if (Boolean.TRUE.equals(value)) {
        if (xhtml) {
          sb.append("=\"").append(attr).append('"');
        }
        continue;
      }
      sb.append('=').append(quote(Values.str(value)));
    }
    return sb.toString();
  }

  static String quote(String value) {
    if (value.indexOf('"') < 0) {
      return '"' + value + '"';
    } else if (value.indexOf('\'') < 0) {
      return "'" + value + "'";
    }
    return '"' + value.replace("\"", "&quot;") + '"';
  }
}
