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

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;
import hypertag.runtime.HypertagFunction;

/**
 * Tail operators of expressions: indexing, slicing, member access and
 * calls.
 */
public class Accessors {

  public static Object index(Object obj, Object index, HypertagAST node)
                                                throws UserException {
    obj = Values.normalize(obj);
    index = Values.normalize(index);
    if (obj instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) obj;
      if (!map.containsKey(index)) {
        throw new InvalidValueException(node, "key not found: " +
                                        Values.repr(index));
      }
      return Values.normalize(map.get(index));
    } else if (obj instanceof List || obj instanceof String) {
      if (!Values.isInteger(index)) {
        throw new TypeMismatchException(node, Values.typeName(obj) +
          " indices must be integers, not " + Values.typeName(index));
      }
      int size = obj instanceof String ? ((String) obj).length()
                                       : ((List<?>) obj).size();
      long i = Values.toLong(index);
      if (i < 0) {
        i += size;
      }
      if (i < 0 || i >= size) {
        throw new InvalidValueException(node, Values.typeName(obj) +
                                        " index out of range");
      }
      if (obj instanceof String) {
        return String.valueOf(((String) obj).charAt((int) i));
      }
      return Values.normalize(((List<?>) obj).get((int) i));
    }
    throw new TypeMismatchException(node, "'" + Values.typeName(obj) +
                                    "' object is not subscriptable");
  }

  /**
   * obj[start:stop:step] on strings, lists and tuples; null bounds are
   * omitted ones
   */
  public static Object slice(Object obj, Object start, Object stop,
                     Object step, HypertagAST node) throws UserException {
    obj = Values.normalize(obj);
    if (!(obj instanceof List) && !(obj instanceof String)) {
      throw new TypeMismatchException(node, "'" + Values.typeName(obj) +
                                      "' object is not subscriptable");
    }
    int size = obj instanceof String ? ((String) obj).length()
                                     : ((List<?>) obj).size();
    long st = sliceIndex(step, 1, node);
    if (st == 0) {
      throw new InvalidValueException(node, "slice step cannot be zero");
    }
    long lower = st > 0 ? 0 : -1;
    long upper = st > 0 ? size : size - 1;
    long from = adjust(start, st > 0 ? lower : upper, size, lower, upper, node);
    long to = adjust(stop, st > 0 ? upper : lower, size, lower, upper, node);

    List<Integer> positions = new ArrayList<Integer>();
    for (long i = from; st > 0 ? i < to : i > to; i += st) {
      positions.add((int) i);
    }
    if (obj instanceof String) {
      String s = (String) obj;
      StringBuilder sb = new StringBuilder();
      for (int i: positions) {
        sb.append(s.charAt(i));
      }
      return sb.toString();
    }
    List<?> list = (List<?>) obj;
    List<Object> result = new ArrayList<Object>();
    for (int i: positions) {
      result.add(list.get(i));
    }
    return obj instanceof Tuple ? Tuple.copyOf(result) : result;
  }

  private static long adjust(Object bound, long dflt, int size, long lower,
              long upper, HypertagAST node) throws TypeMismatchException {
    if (bound == null) {
      return dflt;
    }
    long i = sliceIndex(bound, 0, node);
    if (i < 0) {
      i += size;
      return Math.max(i, lower);
    }
    return Math.min(i, upper);
  }

  private static long sliceIndex(Object value, long dflt, HypertagAST node)
                                          throws TypeMismatchException {
    if (value == null) {
      return dflt;
    }
    if (!Values.isInteger(value)) {
      throw new TypeMismatchException(node, "slice indices must be " +
                                      "integers or None");
    }
    return Values.toLong(value);
  }

  /**
   * obj.name: a key of a map, a bean property, a public field, or a
   * public method bound to obj
   */
  public static Object member(Object obj, String name, HypertagAST node)
                                                throws UserException {
    if (obj instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) obj;
      if (map.containsKey(name)) {
        return Values.normalize(map.get(name));
      }
    } else if (obj != null) {
      Class<?> cls = obj.getClass();
      String cap = StringUtils.capitalize(name);
      for (String getter: new String[] {"get" + cap, "is" + cap}) {
        Method m = findMethod(cls, getter, 0);
        if (m != null) {
          return invoke(m, obj, new Object[0], name, node);
        }
      }
      try {
        Field f = cls.getField(name);
        if (!Modifier.isStatic(f.getModifiers())) {
          return Values.normalize(f.get(obj));
        }
      } catch (NoSuchFieldException | IllegalAccessException e) {
        // try methods below
      }
      if (hasMethod(cls, name)) {
        return boundMethod(obj, name, node);
      }
    }
    throw new TypeMismatchException(node, "'" + Values.typeName(obj) +
                                    "' object has no attribute '" + name + "'");
  }

  public static Object call(Object function, List<Object> args,
         Map<String, Object> kwargs, HypertagAST node) throws UserException {
    if (!(function instanceof HypertagFunction)) {
      throw new TypeMismatchException(node, "'" + Values.typeName(function) +
                                      "' object is not callable");
    }
    try {
      return Values.normalize(((HypertagFunction) function).call(args, kwargs));
    } catch (UserException e) {
      throw e.locateAt(node);
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new TypeMismatchException(node, "function call failed: " +
                                      e.getMessage());
    } catch (RuntimeException e) {
      throw new InvalidValueException(node, "function call failed: " + e);
    }
  }

  private static HypertagFunction boundMethod(final Object obj,
                             final String name, final HypertagAST node) {
    return (args, kwargs) -> {
      if (!kwargs.isEmpty()) {
        throw new TypeMismatchException(node, "method '" + name +
                                "' takes no keyword arguments");
      }
      Method m = findMethod(obj.getClass(), name, args.size());
      if (m == null) {
        throw new TypeMismatchException(node, "method '" + name +
            "' does not take " + args.size() + " arguments");
      }
      return invoke(m, obj, coerce(m.getParameterTypes(), args), name, node);
    };
  }

  private static Object[] coerce(Class<?> types[], List<Object> args) {
    Object result[] = new Object[args.size()];
    for (int i = 0; i < result.length; i++) {
      Object arg = args.get(i);
      Class<?> t = types[i];
      if (arg instanceof Long && (t == int.class || t == Integer.class)) {
        arg = ((Long) arg).intValue();
      } else if (arg instanceof Number &&
                 (t == double.class || t == Double.class)) {
        arg = ((Number) arg).doubleValue();
      }
      result[i] = arg;
    }
    return result;
  }

  private static Object invoke(Method m, Object obj, Object args[],
                    String name, HypertagAST node) throws UserException {
    try {
      return Values.normalize(m.invoke(obj, args));
    } catch (InvocationTargetException e) {
      throw new InvalidValueException(node, "error in '" + name + "': " +
                                      e.getCause());
    } catch (IllegalAccessException | IllegalArgumentException e) {
      throw new TypeMismatchException(node, "cannot access '" + name +
                                      "': " + e.getMessage());
    }
  }

  private static Method findMethod(Class<?> cls, String name, int arity) {
    for (Method m: cls.getMethods()) {
      if (m.getName().equals(name) && m.getParameterCount() == arity &&
          !Modifier.isStatic(m.getModifiers())) {
        return m;
      }
    }
    return null;
  }

  private static boolean hasMethod(Class<?> cls, String name) {
    for (Method m: cls.getMethods()) {
      if (m.getName().equals(name) && !Modifier.isStatic(m.getModifiers())) {
        return true;
      }
    }
    return false;
  }
}
