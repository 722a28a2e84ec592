package hypertag.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import hypertag.backend.Operators;
import hypertag.backend.Tuple;
import hypertag.backend.Values;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.Symbols;

/**
 * Functions available to every document.
 */
public class Builtins {

  private static final Map<String, HypertagFunction> FUNCTIONS =
      ImmutableMap.<String, HypertagFunction>builder()
      .put("len", Builtins::len)
      .put("str", (args, kw) -> Values.str(single("str", args)))
      .put("int", Builtins::toInt)
      .put("float", Builtins::toFloat)
      .put("range", Builtins::range)
      .put("list", (args, kw) -> args.isEmpty() ? new ArrayList<Object>()
                                   : Values.toList(single("list", args), null))
      .put("set", (args, kw) -> args.isEmpty() ? new LinkedHashSet<Object>()
              : new LinkedHashSet<Object>(Values.toList(single("set", args), null)))
      .put("dict", Builtins::dict)
      .put("enumerate", Builtins::enumerate)
      .put("sorted", Builtins::sorted)
      .put("upper",
           (args, kw) -> string("upper", args).toUpperCase(Locale.ROOT))
      .put("lower",
           (args, kw) -> string("lower", args).toLowerCase(Locale.ROOT))
      .put("abs", Builtins::abs)
      .put("min", (args, kw) -> extreme("min", args, -1))
      .put("max", (args, kw) -> extreme("max", args, 1))
      .build();

  /** @return builtins as variable symbols */
  public static Map<String, Object> symbols() {
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, HypertagFunction> e: FUNCTIONS.entrySet()) {
      result.put(Symbols.var(e.getKey()), e.getValue());
    }
    return result;
  }

  public static HypertagFunction get(String name) {
    return FUNCTIONS.get(name);
  }

  private static Object single(String function, List<Object> args)
                                        throws TypeMismatchException {
    if (args.size() != 1) {
      throw new TypeMismatchException(function + "() takes exactly one " +
                             "argument (" + args.size() + " given)");
    }
    return Values.normalize(args.get(0));
  }

  private static String string(String function, List<Object> args)
                                        throws TypeMismatchException {
    Object value = single(function, args);
    if (!(value instanceof String)) {
      throw new TypeMismatchException(function + "() requires a str, not "
                                      + Values.typeName(value));
    }
    return (String) value;
  }

  private static Object len(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    Object value = single("len", args);
    if (value instanceof String) {
      return (long) ((String) value).length();
    } else if (value instanceof Collection) {
      return (long) ((Collection<?>) value).size();
    } else if (value instanceof Map) {
      return (long) ((Map<?, ?>) value).size();
    }
    throw new TypeMismatchException("object of type '" +
                          Values.typeName(value) + "' has no len()");
  }

  private static Object toInt(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    Object value = single("int", args);
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1L : 0L;
    } else if (value instanceof Long) {
      return value;
    } else if (value instanceof Double) {
      return (long) ((Double) value).doubleValue();
    } else if (value instanceof String) {
      try {
        return Long.valueOf(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new InvalidValueException(null, "invalid literal for int(): " +
                                        Values.repr(value));
      }
    }
    throw new TypeMismatchException("int() argument must be a string or " +
                            "a number, not '" + Values.typeName(value) + "'");
  }

  private static Object toFloat(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    Object value = single("float", args);
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1.0 : 0.0;
    } else if (Values.isNumber(value)) {
      return Values.toDouble(value);
    } else if (value instanceof String) {
      try {
        return Double.valueOf(((String) value).trim());
      } catch (NumberFormatException e) {
        throw new InvalidValueException(null, "could not convert string " +
                                        "to float: " + Values.repr(value));
      }
    }
    throw new TypeMismatchException("float() argument must be a string or " +
                            "a number, not '" + Values.typeName(value) + "'");
  }

  private static Object range(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    if (args.isEmpty() || args.size() > 3) {
      throw new TypeMismatchException("range expected 1 to 3 arguments, got "
                                      + args.size());
    }
    long bounds[] = new long[args.size()];
    for (int i = 0; i < bounds.length; i++) {
      if (!Values.isInteger(args.get(i))) {
        throw new TypeMismatchException("'" + Values.typeName(args.get(i)) +
                        "' object cannot be interpreted as an integer");
      }
      bounds[i] = Values.toLong(args.get(i));
    }
    long start = bounds.length == 1 ? 0 : bounds[0];
    long stop = bounds.length == 1 ? bounds[0] : bounds[1];
    long step = bounds.length == 3 ? bounds[2] : 1;
    if (step == 0) {
      throw new InvalidValueException(null, "range() arg 3 must not be zero");
    }
    List<Object> result = new ArrayList<Object>();
    for (long i = start; step > 0 ? i < stop : i > stop; ) {
      result.add(i);
      try {
        i = Math.addExact(i, step);
      } catch (ArithmeticException e) {
        // next value is past the integer range, so past stop as well
        break;
      }
    }
    return result;
  }

  private static Object dict(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    Map<Object, Object> result = new LinkedHashMap<Object, Object>();
    if (args.size() > 1) {
      throw new TypeMismatchException("dict expected at most 1 argument, got "
                                      + args.size());
    } else if (args.size() == 1) {
      Object arg = Values.normalize(args.get(0));
      if (arg instanceof Map) {
        result.putAll((Map<?, ?>) arg);
      } else {
        for (Object item: Values.toList(arg, null)) {
          List<Object> pair = Values.toList(item, null);
          if (pair.size() != 2) {
            throw new InvalidValueException(null, "dictionary update " +
                "sequence element has length " + pair.size() + "; 2 is required");
          }
          result.put(pair.get(0), pair.get(1));
        }
      }
    }
    result.putAll(kwargs);
    return result;
  }

  private static Object enumerate(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    if (args.isEmpty() || args.size() > 2) {
      throw new TypeMismatchException("enumerate expected 1 or 2 arguments, "
                                      + "got " + args.size());
    }
    long start = 0;
    Object first = kwargs.containsKey("start") ? kwargs.get("start")
                 : args.size() == 2 ? args.get(1) : null;
    if (first != null) {
      start = Values.toLong(first);
    }
    List<Object> result = new ArrayList<Object>();
    for (Object item: Values.toList(args.get(0), null)) {
      result.add(Tuple.of(start++, item));
    }
    return result;
  }

  /** Carries a comparison failure out of a Comparator */
  private static class CompareFailure extends RuntimeException {
    final UserException cause;

    CompareFailure(UserException cause) {
      this.cause = cause;
    }

    private static final long serialVersionUID = 1L;
  }

  private static final Comparator<Object> ORDER = new Comparator<Object>() {
    @Override
    public int compare(Object a, Object b) {
      try {
        return Operators.compare("<", a, b, null);
      } catch (TypeMismatchException e) {
        throw new CompareFailure(e);
      }
    }
  };

  private static Object sorted(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    List<Object> result = Values.toList(single("sorted", args), null);
    try {
      Collections.sort(result, ORDER);
    } catch (CompareFailure e) {
      throw e.cause;
    }
    if (kwargs.containsKey("reverse") && Values.isTruthy(kwargs.get("reverse"))) {
      Collections.reverse(result);
    }
    return result;
  }

  private static Object abs(List<Object> args, Map<String, Object> kwargs)
                                        throws UserException {
    Object value = single("abs", args);
    if (value instanceof Long) {
      return Math.abs((Long) value);
    } else if (value instanceof Double) {
      return Math.abs((Double) value);
    } else if (value instanceof Boolean) {
      return ((Boolean) value) ? 1L : 0L;
    }
    throw new TypeMismatchException("bad operand type for abs(): '" +
                                    Values.typeName(value) + "'");
  }

  /** min (sign -1) or max (sign 1) of the arguments or of one iterable */
  private static Object extreme(String function, List<Object> args, int sign)
                                        throws UserException {
    List<Object> items = args.size() == 1 ? Values.toList(args.get(0), null)
                                          : args;
    if (items.isEmpty()) {
      throw new InvalidValueException(null, function + "() arg is an " +
                                      "empty sequence");
    }
    Object best = items.get(0);
    for (Object item: items.subList(1, items.size())) {
      if (Operators.compare("<", item, best, null) * sign > 0) {
        best = item;
      }
    }
    return Values.normalize(best);
  }
}
