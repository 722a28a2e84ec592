/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package hypertag.backend;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.NoneStringException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.dom.HNode;
import hypertag.dom.Sequence;

/**
 * Value model of expressions.
 *
 * Values are null (None), Boolean, Long, Double, String, List (list),
 * {@link Tuple}, Set, Map (dict), DOM objects, tags, functions, or any
 * Java object supplied by the caller.  Truthiness and conversion to text
 * follow Python.
 */
public class Values {

  /**
   * Map boxed Java numbers to the two numeric types of the language
   */
  public static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short ||
        value instanceof Byte) {
      return Long.valueOf(((Number) value).longValue());
    } else if (value instanceof Float) {
      return Double.valueOf(((Number) value).doubleValue());
    }
    return value;
  }

  public static boolean isTruthy(Object value) {
    value = normalize(value);
    if (value == null) {
      return false;
    } else if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof Long) {
      return (Long) value != 0;
    } else if (value instanceof Double) {
      return (Double) value != 0.0;
    } else if (value instanceof CharSequence) {
      return ((CharSequence) value).length() > 0;
    } else if (value instanceof Collection) {
      return !((Collection<?>) value).isEmpty();
    } else if (value instanceof Map) {
      return !((Map<?, ?>) value).isEmpty();
    } else if (value instanceof Sequence) {
      return !((Sequence) value).isEmpty();
    }
    return true;
  }

  /** Integral value, booleans included */
  public static boolean isInteger(Object value) {
    value = normalize(value);
    return value instanceof Long || value instanceof Boolean;
  }

  public static boolean isNumber(Object value) {
    return isInteger(value) || normalize(value) instanceof Double;
  }

  public static long toLong(Object value) {
    value = normalize(value);
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1 : 0;
    }
    return ((Number) value).longValue();
  }

  public static double toDouble(Object value) {
    value = normalize(value);
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1 : 0;
    }
    return ((Number) value).doubleValue();
  }

  public static String typeName(Object value) {
    value = normalize(value);
    if (value == null) {
      return "NoneType";
    } else if (value instanceof Boolean) {
      return "bool";
    } else if (value instanceof Long) {
      return "int";
    } else if (value instanceof Double) {
      return "float";
    } else if (value instanceof String) {
      return "str";
    } else if (value instanceof Tuple) {
      return "tuple";
    } else if (value instanceof List) {
      return "list";
    } else if (value instanceof Set) {
      return "set";
    } else if (value instanceof Map) {
      return "dict";
    }
    return value.getClass().getSimpleName();
  }

  /**
   * Conversion of a value to text for embedding in markup
   * @throws NoneStringException if the value is None
   */
  public static String toText(Object value, HypertagAST node, String message)
                                          throws NoneStringException {
    if (value == null) {
      throw new NoneStringException(node, message);
    }
    return str(value);
  }

  public static String str(Object value) {
    value = normalize(value);
    if (value instanceof String) {
      return (String) value;
    }
    return repr(value);
  }

  public static String repr(Object value) {
    value = normalize(value);
    if (value == null) {
      return "None";
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? "True" : "False";
    } else if (value instanceof Double) {
      return formatFloat((Double) value);
    } else if (value instanceof String) {
      String s = (String) value;
      if (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) {
        return "\"" + s + "\"";
      }
      return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    } else if (value instanceof Tuple) {
      List<?> items = (List<?>) value;
      if (items.size() == 1) {
        return "(" + repr(items.get(0)) + ",)";
      }
      return join("(", items, ")");
    } else if (value instanceof List) {
      return join("[", (List<?>) value, "]");
    } else if (value instanceof Set) {
      Set<?> items = (Set<?>) value;
      return items.isEmpty() ? "set()" : join("{", items, "}");
    } else if (value instanceof Map) {
      StringBuilder sb = new StringBuilder("{");
      boolean first = true;
      for (Map.Entry<?, ?> e: ((Map<?, ?>) value).entrySet()) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append(repr(e.getKey())).append(": ").append(repr(e.getValue()));
      }
      return sb.append("}").toString();
    }
    return String.valueOf(value);
  }

  private static String join(String open, Collection<?> items, String close) {
    StringBuilder sb = new StringBuilder(open);
    boolean first = true;
    for (Object item: items) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(repr(item));
    }
    return sb.append(close).toString();
  }

  /**
   * Shortest round-trip representation, positional in the same range as
   * Python and with a Python style exponent outside it
   */
  static String formatFloat(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    double abs = Math.abs(d);
    String s = Double.toString(d);
    if (abs == 0.0 || (abs >= 1e-4 && abs < 1e16)) {
      String plain = new BigDecimal(s).stripTrailingZeros().toPlainString();
      return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
    int e = s.indexOf('E');
    String mantissa = s.substring(0, e);
    if (mantissa.endsWith(".0")) {
      mantissa = mantissa.substring(0, mantissa.length() - 2);
    }
    int exp = Integer.parseInt(s.substring(e + 1));
    String expText = String.format(Locale.ROOT, "%02d", Math.abs(exp));
    return mantissa + "e" + (exp < 0 ? "-" : "+") + expText;
  }

  /**
   * Elements of an iterable value: items of collections, keys of maps,
   * characters of strings, nodes of DOM sequences
   */
  public static List<Object> toList(Object value, HypertagAST node)
                                          throws TypeMismatchException {
    List<Object> result = new ArrayList<Object>();
    if (value instanceof Map) {
      result.addAll(((Map<?, ?>) value).keySet());
    } else if (value instanceof String) {
      String s = (String) value;
      for (int i = 0; i < s.length(); i++) {
        result.add(String.valueOf(s.charAt(i)));
      }
    } else if (value instanceof Iterable) {
      Iterator<?> it = ((Iterable<?>) value).iterator();
      while (it.hasNext()) {
        result.add(normalize(it.next()));
      }
    } else if (value instanceof Object[]) {
      for (Object o: (Object[]) value) {
        result.add(normalize(o));
      }
    } else {
      throw new TypeMismatchException(node, "'" + typeName(value) +
                                      "' object is not iterable");
    }
    return result;
  }

  /**
   * @return a DOM sequence from a node, a sequence, or an iterable of these
   */
  public static Sequence toSequence(Object value, HypertagAST node)
                                          throws TypeMismatchException {
    if (value instanceof Sequence) {
      return (Sequence) value;
    } else if (value instanceof HNode) {
      return new Sequence((HNode) value);
    } else if (value instanceof Iterable) {
      Sequence seq = new Sequence();
      for (Object o: (Iterable<?>) value) {
        if (!(o instanceof HNode) && !(o instanceof Sequence)) {
          throw new TypeMismatchException(node, "embedded @-expression " +
            "contains " + typeName(o) + " instead of a DOM element");
        }
        seq.addFlat(o);
      }
      return seq;
    }
    throw new TypeMismatchException(node, "embedded @-expression evaluates to "
        + typeName(value) + " instead of a DOM element (HNode, Sequence, " +
        "an iterable of HNodes)");
  }
}
