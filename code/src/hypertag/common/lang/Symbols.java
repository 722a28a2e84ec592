package hypertag.common.lang;

/**
 * Tags and variables live in one namespace, told apart by a one-character
 * prefix.
 */
public class Symbols {
  public static final char TAG_PREFIX = '%';
  public static final char VAR_PREFIX = '$';

  public static String tag(String name) {
    return TAG_PREFIX + name;
  }

  public static String var(String name) {
    return VAR_PREFIX + name;
  }

  public static boolean isTag(String symbol) {
    return symbol.length() > 0 && symbol.charAt(0) == TAG_PREFIX;
  }

  public static boolean isVar(String symbol) {
    return symbol.length() > 0 && symbol.charAt(0) == VAR_PREFIX;
  }

  /** Name without prefix */
  public static String bareName(String symbol) {
    return symbol.substring(1);
  }

  /** Names starting with an underscore are not exported by wildcard imports */
  public static boolean isPrivate(String symbol) {
    return symbol.length() > 1 && symbol.charAt(1) == '_';
  }
}
