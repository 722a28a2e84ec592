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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.MissingValueException;
import hypertag.common.exceptions.UnboundVarException;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.Slot;
import hypertag.common.lang.State;

/**
 * Evaluates expression subtrees against a render state.
 *
 * Values follow the dynamic typing of the template language: None is
 * null, integers are Long, floats are Double, tuples are {@link Tuple},
 * lists, sets and dicts are the java.util collections.
 */
public class ExprEvaluator {

  public static final String QUALIFIER_OPTIONAL = "?";
  public static final String QUALIFIER_OBLIGATORY = "!";

  static final String NONE_IN_TEXT =
          "expression to be embedded in markup text evaluates to None";
  static final String NONE_IN_CONCAT =
          "expression to be string-concatenated evaluates to None";

  /**
   * Evaluate an embedded expression and convert it to text
   * @throws UserException if the value is None, or evaluation fails
   */
  public static String render(HypertagAST expr, State state)
                                              throws UserException {
    return Values.toText(evaluate(expr, state), expr, NONE_IN_TEXT);
  }

  public static Object evaluate(HypertagAST expr, State state)
                                              throws UserException {
    String qualifier = expr.getQualifier();
    if (qualifier == null) {
      return evaluateInner(expr, state);
    }

    Object value;
    try {
      value = evaluateInner(expr, state);
    } catch (UserException e) {
      if (qualifier.equals(QUALIFIER_OPTIONAL)) {
        return "";
      }
      throw e;
    }
    if (Values.isTruthy(value)) {
      return value;
    } else if (qualifier.equals(QUALIFIER_OPTIONAL)) {
      return "";
    }
    throw new MissingValueException(expr,
            "Obligatory expression has a false or empty value");
  }

  private static Object evaluateInner(HypertagAST expr, State state)
                                              throws UserException {
    NodeKind kind = expr.getKind();
    switch (kind) {
      case NUMBER:
      case STRING:
      case BOOLEAN:
      case NONE:
      case ATTR_SHORT_LIT:
      case TEXT:
      case ESCAPE:
        return expr.getValue();
      case MERGED:
        return merged(expr);

      case EXPR:
      case EXPR_VAR:
        return evaluate(expr.child(0), state);
      case VAR_USE:
        return readVariable(expr, state);
      case FACTOR:
        return factor(expr, state);

      case POW_EXPR:
      case TERM:
      case SHIFT_EXPR:
      case COMPARISON:
        return chain(expr, evaluate(expr.child(0), state), 1, state);
      case ARITH_EXPR:
        if (expr.child(0).getKind() == NodeKind.NEG) {
          Object head = evaluate(expr.child(1), state);
          if (head != null) {
            head = Operators.negate(head, expr);
          }
          return chain(expr, head, 2, state);
        }
        return chain(expr, evaluate(expr.child(0), state), 1, state);
      case AND_EXPR:
        return simpleChain(expr, "&", state);
      case XOR_EXPR:
        return simpleChain(expr, "^", state);
      case OR_EXPR:
        return simpleChain(expr, "|", state);
      case CONCAT_EXPR:
        return concat(expr, state);

      case NOT_TEST: {
        int count = expr.childCount();
        Object value = evaluate(expr.child(count - 1), state);
        // an odd number of "not" negates
        if ((count - 1) % 2 == 1) {
          return !Values.isTruthy(value);
        }
        return value;
      }
      case AND_TEST: {
        Object res = evaluate(expr.child(0), state);
        for (HypertagAST c: expr.children(1)) {
          if (!Values.isTruthy(res)) {
            return res;
          }
          res = evaluate(c, state);
        }
        return res;
      }
      case OR_TEST: {
        Object res = evaluate(expr.child(0), state);
        for (HypertagAST c: expr.children(1)) {
          if (Values.isTruthy(res)) {
            return res;
          }
          res = evaluate(c, state);
        }
        return res;
      }
      case IFELSE_TEST:
        if (Values.isTruthy(evaluate(expr.child(1), state))) {
          return evaluate(expr.child(0), state);
        } else if (expr.childCount() == 3) {
          return evaluate(expr.child(2), state);
        }
        return null;

      case TUPLE:
        return Tuple.copyOf(evaluateAll(expr.children(), state));
      case LIST:
        return evaluateAll(expr.children(), state);
      case SET:
        return new LinkedHashSet<Object>(evaluateAll(expr.children(), state));
      case DICT: {
        Map<Object, Object> dict = new LinkedHashMap<Object, Object>();
        for (int i = 0; i + 1 < expr.childCount(); i += 2) {
          Object key = evaluate(expr.child(i), state);
          dict.put(key, evaluate(expr.child(i + 1), state));
        }
        return dict;
      }
      default:
        throw new HypertagRuntimeError("Not an expression: " + kind);
    }
  }

  /** Rendered text of a compacted run, or the error it raised */
  static String merged(HypertagAST node) throws UserException {
    if (node.getError() != null) {
      throw node.getError();
    }
    return (String) node.getValue();
  }

  static Object readVariable(HypertagAST var, State state)
                                          throws UnboundVarException {
    Slot slot = var.getSlotRead();
    if (slot == null) {
      throw new HypertagRuntimeError("Variable not analysed: " +
                                     var.getName());
    }
    if (!slot.isSet(state)) {
      throw new UnboundVarException(var, "variable '" + var.getName() +
                                    "' referenced before assignment");
    }
    return slot.get(state);
  }

  public static List<Object> evaluateAll(List<HypertagAST> exprs,
                               State state) throws UserException {
    List<Object> result = new ArrayList<Object>(exprs.size());
    for (HypertagAST e: exprs) {
      result.add(evaluate(e, state));
    }
    return result;
  }

  /** atom followed by calls, indexing and member access */
  private static Object factor(HypertagAST expr, State state)
                                              throws UserException {
    Object value = evaluate(expr.child(0), state);
    for (HypertagAST trailer: expr.children(1)) {
      switch (trailer.getKind()) {
        case CALL:
          value = call(value, trailer, state);
          break;
        case INDEX:
          value = index(value, trailer, state);
          break;
        case MEMBER:
          value = Accessors.member(value, trailer.getName(), trailer);
          break;
        default:
          throw new HypertagRuntimeError("Unexpected trailer: " +
                                         trailer.getKind());
      }
    }
    return value;
  }

  private static Object call(Object function, HypertagAST call, State state)
                                              throws UserException {
    List<Object> args = new ArrayList<Object>();
    Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
    for (HypertagAST arg: call.children()) {
      if (arg.getKind() == NodeKind.KWARG) {
        kwargs.put(arg.getName(), evaluate(arg.child(1), state));
      } else {
        args.add(evaluate(arg, state));
      }
    }
    return Accessors.call(function, args, kwargs, call);
  }

  private static Object index(Object value, HypertagAST index, State state)
                                              throws UserException {
    if (index.child(0).getKind() != NodeKind.SLICE_VALUE) {
      return Accessors.index(value, evaluate(index.child(0), state), index);
    }
    Object bounds[] = new Object[3];
    for (int i = 0; i < index.childCount(); i++) {
      HypertagAST bound = index.child(i);
      if (bound.childCount() > 0) {
        bounds[i] = evaluate(bound.child(0), state);
      }
    }
    return Accessors.slice(value, bounds[0], bounds[1], bounds[2], index);
  }

  /**
   * x1 OP1 x2 OP2 x3 ... evaluated left to right: the result so far is
   * the left operand of the next operator
   */
  private static Object chain(HypertagAST expr, Object head, int start,
                              State state) throws UserException {
    Object result = head;
    for (int i = start; i + 1 < expr.childCount(); i += 2) {
      String op = expr.child(i).getOp();
      Object value = evaluate(expr.child(i + 1), state);
      result = Operators.binary(op, result, value, expr);
    }
    return result;
  }

  private static Object simpleChain(HypertagAST expr, String op, State state)
                                              throws UserException {
    Object result = evaluate(expr.child(0), state);
    for (HypertagAST c: expr.children(1)) {
      result = Operators.binary(op, result, evaluate(c, state), expr);
    }
    return result;
  }

  private static String concat(HypertagAST expr, State state)
                                              throws UserException {
    StringBuilder sb = new StringBuilder();
    for (HypertagAST c: expr.children()) {
      sb.append(Values.toText(evaluate(c, state), c, NONE_IN_CONCAT));
    }
    return sb.toString();
  }
}
