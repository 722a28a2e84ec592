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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;

/**
 * Binary and unary operators of expressions, with Python semantics on the
 * values described in {@link Values}.
 */
public class Operators {

  public static Object binary(String op, Object a, Object b, HypertagAST node)
                                                  throws UserException {
    a = Values.normalize(a);
    b = Values.normalize(b);
    switch (op) {
      case "+":
        return add(a, b, node);
      case "-":
        return subtract(a, b, node);
      case "*":
        return multiply(a, b, node);
      case "/":
        return divide(a, b, node);
      case "//":
        return floorDivide(a, b, node);
      case "%":
        return modulo(a, b, node);
      case "**":
        return power(a, b, node);
      case "<<":
      case ">>":
        return shift(op, a, b, node);
      case "&":
      case "|":
      case "^":
        return bitwise(op, a, b, node);
      case "==":
        return equal(a, b);
      case "!=":
        return !equal(a, b);
      case "<":
      case ">":
      case "<=":
      case ">=":
        return ordered(op, a, b, node);
      case "in":
        return contains(b, a, node);
      case "not in":
        return !contains(b, a, node);
      case "is":
        return same(a, b);
      case "is not":
        return !same(a, b);
      default:
        throw new HypertagRuntimeError("Unknown operator: " + op);
    }
  }

  public static Object negate(Object a, HypertagAST node)
                                      throws TypeMismatchException {
    a = Values.normalize(a);
    if (Values.isInteger(a)) {
      return Long.valueOf(-Values.toLong(a));
    } else if (a instanceof Double) {
      return Double.valueOf(-(Double) a);
    }
    throw new TypeMismatchException(node,
        "bad operand type for unary -: '" + Values.typeName(a) + "'");
  }

  private static Object add(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (Values.isInteger(a) && Values.isInteger(b)) {
      try {
        return Math.addExact(Values.toLong(a), Values.toLong(b));
      } catch (ArithmeticException e) {
        throw overflow(node);
      }
    } else if (Values.isNumber(a) && Values.isNumber(b)) {
      return Values.toDouble(a) + Values.toDouble(b);
    } else if (a instanceof String && b instanceof String) {
      return (String) a + (String) b;
    } else if (a instanceof List && b instanceof List &&
               (a instanceof Tuple) == (b instanceof Tuple)) {
      List<Object> result = new ArrayList<Object>((List<?>) a);
      result.addAll((List<?>) b);
      return a instanceof Tuple ? Tuple.copyOf(result) : result;
    }
    throw unsupported("+", a, b, node);
  }

  private static Object subtract(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (Values.isInteger(a) && Values.isInteger(b)) {
      try {
        return Math.subtractExact(Values.toLong(a), Values.toLong(b));
      } catch (ArithmeticException e) {
        throw overflow(node);
      }
    } else if (Values.isNumber(a) && Values.isNumber(b)) {
      return Values.toDouble(a) - Values.toDouble(b);
    } else if (a instanceof Set && b instanceof Set) {
      Set<Object> result = new LinkedHashSet<Object>((Set<?>) a);
      result.removeAll((Set<?>) b);
      return result;
    }
    throw unsupported("-", a, b, node);
  }

  private static Object multiply(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (Values.isInteger(a) && Values.isInteger(b)) {
      try {
        return Math.multiplyExact(Values.toLong(a), Values.toLong(b));
      } catch (ArithmeticException e) {
        throw overflow(node);
      }
    } else if (Values.isNumber(a) && Values.isNumber(b)) {
      return Values.toDouble(a) * Values.toDouble(b);
    } else if (Values.isInteger(b) && (a instanceof String || a instanceof List)) {
      return repeat(a, Values.toLong(b), node);
    } else if (Values.isInteger(a) && (b instanceof String || b instanceof List)) {
      return repeat(b, Values.toLong(a), node);
    }
    throw unsupported("*", a, b, node);
  }

  private static Object repeat(Object seq, long times, HypertagAST node)
                                          throws InvalidValueException {
    int n = (int) Math.max(0, times);
    int size = seq instanceof String ? ((String) seq).length()
                                     : ((List<?>) seq).size();
    if (n != Math.max(0, times) ||
        (size > 0 && n > Integer.MAX_VALUE / size)) {
      throw new InvalidValueException(node, "repeated " +
          Values.typeName(seq) + " would be too long: " + times + " times");
    }
    if (seq instanceof String) {
      return StringUtils.repeat((String) seq, n);
    }
    List<Object> result = new ArrayList<Object>();
    for (int i = 0; i < n; i++) {
      result.addAll((List<?>) seq);
    }
    return seq instanceof Tuple ? Tuple.copyOf(result) : result;
  }

  private static Object divide(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (!Values.isNumber(a) || !Values.isNumber(b)) {
      throw unsupported("/", a, b, node);
    }
    double divisor = Values.toDouble(b);
    if (divisor == 0.0) {
      throw new InvalidValueException(node, "division by zero");
    }
    return Values.toDouble(a) / divisor;
  }

  private static Object floorDivide(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (!Values.isNumber(a) || !Values.isNumber(b)) {
      throw unsupported("//", a, b, node);
    }
    if (Values.toDouble(b) == 0.0) {
      throw new InvalidValueException(node, "integer division or modulo by zero");
    }
    if (Values.isInteger(a) && Values.isInteger(b)) {
      return Math.floorDiv(Values.toLong(a), Values.toLong(b));
    }
    return Math.floor(Values.toDouble(a) / Values.toDouble(b));
  }

  private static Object modulo(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (!Values.isNumber(a) || !Values.isNumber(b)) {
      throw unsupported("%", a, b, node);
    }
    if (Values.toDouble(b) == 0.0) {
      throw new InvalidValueException(node, "integer division or modulo by zero");
    }
    if (Values.isInteger(a) && Values.isInteger(b)) {
      return Math.floorMod(Values.toLong(a), Values.toLong(b));
    }
    double x = Values.toDouble(a), y = Values.toDouble(b);
    return x - y * Math.floor(x / y);
  }

  private static Object power(Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (!Values.isNumber(a) || !Values.isNumber(b)) {
      throw unsupported("**", a, b, node);
    }
    if (Values.isInteger(a) && Values.isInteger(b) && Values.toLong(b) >= 0) {
      long exp = Values.toLong(b);
      if (exp > Integer.MAX_VALUE) {
        throw overflow(node);
      }
      BigInteger result = BigInteger.valueOf(Values.toLong(a)).pow((int) exp);
      if (result.bitLength() > 63) {
        throw overflow(node);
      }
      return result.longValue();
    }
    return Math.pow(Values.toDouble(a), Values.toDouble(b));
  }

  private static Object shift(String op, Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (!Values.isInteger(a) || !Values.isInteger(b)) {
      throw unsupported(op, a, b, node);
    }
    long x = Values.toLong(a), n = Values.toLong(b);
    if (n < 0) {
      throw new InvalidValueException(node, "negative shift count");
    }
    if (op.equals("<<")) {
      if (n >= 64 || (x != 0 && Long.numberOfLeadingZeros(Math.abs(x)) <= n)) {
        throw overflow(node);
      }
      return x << n;
    }
    return n >= 64 ? (x < 0 ? -1L : 0L) : x >> n;
  }

  private static Object bitwise(String op, Object a, Object b, HypertagAST node)
                                            throws UserException {
    if (a instanceof Boolean && b instanceof Boolean) {
      boolean x = (Boolean) a, y = (Boolean) b;
      switch (op) {
        case "&": return x & y;
        case "|": return x | y;
        default: return x ^ y;
      }
    } else if (Values.isInteger(a) && Values.isInteger(b)) {
      long x = Values.toLong(a), y = Values.toLong(b);
      switch (op) {
        case "&": return x & y;
        case "|": return x | y;
        default: return x ^ y;
      }
    } else if (a instanceof Set && b instanceof Set) {
      Set<Object> result = new LinkedHashSet<Object>((Set<?>) a);
      switch (op) {
        case "&":
          result.retainAll((Set<?>) b);
          break;
        case "|":
          result.addAll((Set<?>) b);
          break;
        default:
          result.removeAll((Set<?>) b);
          for (Object o: (Set<?>) b) {
            if (!((Set<?>) a).contains(o)) {
              result.add(o);
            }
          }
      }
      return result;
    }
    throw unsupported(op, a, b, node);
  }

  /**
   * Equality where numbers compare by value regardless of type
   */
  public static boolean equal(Object a, Object b) {
    a = Values.normalize(a);
    b = Values.normalize(b);
    if (Values.isNumber(a) && Values.isNumber(b)) {
      if (Values.isInteger(a) && Values.isInteger(b)) {
        return Values.toLong(a) == Values.toLong(b);
      }
      return Values.toDouble(a) == Values.toDouble(b);
    }
    if (a instanceof List && b instanceof List) {
      List<?> x = (List<?>) a, y = (List<?>) b;
      if (x.size() != y.size()) {
        return false;
      }
      for (int i = 0; i < x.size(); i++) {
        if (!equal(x.get(i), y.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(a, b);
  }

  /**
   * Result of an ordering operator.  Floats are compared as primitives, so
   * -0.0 equals 0.0 and any comparison with NaN is false.  Sequences are
   * decided by their first pair of unequal items.
   */
  public static boolean ordered(String op, Object a, Object b,
                  HypertagAST node) throws TypeMismatchException {
    a = Values.normalize(a);
    b = Values.normalize(b);
    if (Values.isNumber(a) && Values.isNumber(b) &&
        !(Values.isInteger(a) && Values.isInteger(b))) {
      double x = Values.toDouble(a), y = Values.toDouble(b);
      switch (op) {
        case "<":
          return x < y;
        case ">":
          return x > y;
        case "<=":
          return x <= y;
        case ">=":
          return x >= y;
        default:
          throw new HypertagRuntimeError("Not an ordering: " + op);
      }
    }
    if (a instanceof List && b instanceof List) {
      List<?> x = (List<?>) a, y = (List<?>) b;
      for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
        if (!equal(x.get(i), y.get(i))) {
          return ordered(op, x.get(i), y.get(i), node);
        }
      }
      return holds(op, Integer.compare(x.size(), y.size()));
    }
    return holds(op, compare(op, a, b, node));
  }

  private static boolean holds(String op, int cmp) {
    switch (op) {
      case "<":
        return cmp < 0;
      case ">":
        return cmp > 0;
      case "<=":
        return cmp <= 0;
      case ">=":
        return cmp >= 0;
      default:
        throw new HypertagRuntimeError("Not an ordering: " + op);
    }
  }

  /**
   * Ordering of numbers, strings and sequences of these, used for sorting
   */
  public static int compare(String op, Object a, Object b, HypertagAST node)
                                          throws TypeMismatchException {
    a = Values.normalize(a);
    b = Values.normalize(b);
    if (Values.isNumber(a) && Values.isNumber(b)) {
      if (Values.isInteger(a) && Values.isInteger(b)) {
        return Long.compare(Values.toLong(a), Values.toLong(b));
      }
      return Double.compare(Values.toDouble(a), Values.toDouble(b));
    } else if (a instanceof String && b instanceof String) {
      return ((String) a).compareTo((String) b);
    } else if (a instanceof List && b instanceof List) {
      List<?> x = (List<?>) a, y = (List<?>) b;
      for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
        if (!equal(x.get(i), y.get(i))) {
          return compare(op, x.get(i), y.get(i), node);
        }
      }
      return Integer.compare(x.size(), y.size());
    }
    throw new TypeMismatchException(node, "'" + op + "' not supported " +
        "between instances of '" + Values.typeName(a) + "' and '" +
        Values.typeName(b) + "'");
  }

  public static boolean contains(Object container, Object item, HypertagAST node)
                                          throws TypeMismatchException {
    container = Values.normalize(container);
    item = Values.normalize(item);
    if (container instanceof String) {
      if (!(item instanceof String)) {
        throw new TypeMismatchException(node, "'in <string>' requires " +
            "string as left operand, not " + Values.typeName(item));
      }
      return ((String) container).contains((String) item);
    } else if (container instanceof Map) {
      return ((Map<?, ?>) container).containsKey(item);
    } else if (container instanceof Collection) {
      for (Object o: (Collection<?>) container) {
        if (equal(o, item)) {
          return true;
        }
      }
      return false;
    }
    throw new TypeMismatchException(node, "argument of type '" +
        Values.typeName(container) + "' is not iterable");
  }

  /** Identity for objects, equality for immutable scalars */
  private static boolean same(Object a, Object b) {
    if (a == b) {
      return true;
    }
    if (a instanceof Boolean || a instanceof Long || a instanceof String) {
      return a.equals(b);
    }
    return false;
  }

  private static TypeMismatchException unsupported(String op, Object a,
                                             Object b, HypertagAST node) {
    return new TypeMismatchException(node, "unsupported operand type(s) for "
        + op + ": '" + Values.typeName(a) + "' and '" + Values.typeName(b) + "'");
  }

  private static InvalidValueException overflow(HypertagAST node) {
    return new InvalidValueException(node, "integer overflow");
  }
}
