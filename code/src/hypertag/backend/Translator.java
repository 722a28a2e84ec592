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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.Logging;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.NotATagException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UndefinedTagException;
import hypertag.common.exceptions.UserException;
import hypertag.common.exceptions.VoidTagException;
import hypertag.common.lang.Slot;
import hypertag.common.lang.State;
import hypertag.common.lang.ValueSlot;
import hypertag.dom.HRoot;
import hypertag.dom.HText;
import hypertag.dom.Indents;
import hypertag.dom.Sequence;
import hypertag.frontend.LogHelper;
import hypertag.frontend.tree.Assignment;
import hypertag.frontend.tree.Document;
import hypertag.frontend.tree.ForLoop;
import hypertag.frontend.tree.HypertagDef;
import hypertag.frontend.tree.IfBlock;
import hypertag.frontend.tree.TagExpand;
import hypertag.runtime.Runtime;
import hypertag.runtime.Tag;

/**
 * Translates an analysed AST into a DOM, threading a {@link State} through
 * the tree.
 *
 * Blocks are translated to DOM sequences; lines of text blocks and
 * embedded expressions are rendered straight to text.  The state carries
 * the indentation in effect, updated by indent and dedent markers as
 * they are visited.
 */
public class Translator {

  private static final Logger logger = Logging.getHypertagLogger();

  private final Runtime runtime;

  public Translator(Runtime runtime) {
    this.runtime = runtime;
  }

  /**
   * Translate the document in a fresh state.
   * Top-level slots that are still uninitialised at the end (e.g.
   * assigned in an "if" branch that did not run) are left out of the
   * returned symbols.
   */
  public TranslatedDocument translateDocument(HypertagAST document)
                                                    throws UserException {
    assert(document.getKind() == NodeKind.DOCUMENT);
    Document doc = (Document) document.getDescriptor();
    State state = new State();
    for (ValueSlot slot: doc.getSlotsIn().values()) {
      slot.setValue(state);
    }

    Sequence body = translateAll(document.children(), state);
    HRoot root = new HRoot(body);

    Map<String, Object> symbols = new LinkedHashMap<String, Object>();
    State stateOut = new State();
    for (Map.Entry<String, Slot> e: doc.getSlotsOut().entrySet()) {
      Slot slot = e.getValue();
      if (slot.isSet(state)) {
        Object value = slot.get(state);
        symbols.put(e.getKey(), value);
        slot.set(stateOut, value);
      }
    }
    logger.debug("translated document: " + body.size() + " top-level nodes, "
                 + symbols.size() + " symbols");
    return new TranslatedDocument(root, symbols, stateOut);
  }

  public Sequence translate(HypertagAST tree, State state)
                                                    throws UserException {
    switch (tree.getKind()) {
      case BLOCK:
        return block(tree, state);

      case BODY:
        return translateAll(tree.children(), state);

      case BLOCK_VERBAT:
      case BLOCK_NORMAL:
      case BLOCK_MARKUP:
        return new Sequence(new HText(renderText(tree, state),
                                      state.getIndentation()));

      case BLOCK_EMBED:
        return embed(tree, state);

      case BLOCK_STRUCT:
        return struct(tree, state);

      case BLOCK_DEF:
        ((ValueSlot) tree.getSlotWrite()).setValue(state);
        // nothing is output where a hypertag is defined
        return new Sequence();

      case BLOCK_IMPORT:
        importSymbols(tree, state);
        return new Sequence();

      case BLOCK_TRY:
        return tryBlock(tree, state);

      case BLOCK_IF:
        return ifBlock(tree, state);

      case BLOCK_WHILE:
        return whileBlock(tree, state);

      case BLOCK_FOR:
        return forBlock(tree, state);

      case BLOCK_ASSIGN:
        assignment(tree, state);
        return new Sequence();

      case BLOCK_COMMENT:
      case BLOCK_PASS:
        return new Sequence();

      case INDENT_S:
      case INDENT_T:
      case DEDENT_S:
      case DEDENT_T:
        indentMarker(tree, state);
        return new Sequence();

      case MARGIN:
      case MARGIN_OUT:
        return staticText((String) tree.getValue());

      case LINE_VERBAT:
      case LINE_NORMAL:
      case LINE_MARKUP:
        return new Sequence(new HText(renderInline(tree, state)));

      default:
        throw new HypertagRuntimeError("Unexpected node in translation: "
                                       + tree.getKind());
    }
  }

  private Sequence translateAll(List<HypertagAST> nodes, State state)
                                                    throws UserException {
    Sequence result = new Sequence();
    for (HypertagAST node: nodes) {
      result.addAll(translate(node, state));
    }
    return result;
  }

  private static Sequence staticText(String text) {
    if (text == null || text.isEmpty()) {
      return new Sequence();
    }
    return new Sequence(new HText(text));
  }

  /**
   * Margin followed by a block.  The first node of the block starts on a
   * new line; the dedent marker "<" clears its indentation.
   */
  private Sequence block(HypertagAST tree, State state) throws UserException {
    Sequence margin = translate(tree.child(0), state);
    Sequence inner = translate(tree.child(1), state);
    inner.setOutline();
    if (tree.isDedent()) {
      inner.setIndent("");
    }
    Sequence result = new Sequence();
    result.addAll(margin);
    result.addAll(inner);
    return result;
  }

  private Sequence embed(HypertagAST tree, State state) throws UserException {
    HypertagAST expr = tree.child(0);
    Sequence body = Values.toSequence(ExprEvaluator.evaluate(expr, state), tree);
    body.setIndent(state.getIndentation());
    return body;
  }

  private Sequence struct(HypertagAST tree, State state) throws UserException {
    Sequence body = translate(tree.child(1), state);
    body = applyTags(tree.child(0), body, state);
    body.setIndent(state.getIndentation());
    return body;
  }

  /**
   * Wrap body in tags, innermost (last) first
   */
  private Sequence applyTags(HypertagAST tags, Sequence body, State state)
                                                    throws UserException {
    List<HypertagAST> items = tags.children();
    for (int i = items.size() - 1; i >= 0; i--) {
      HypertagAST item = items.get(i);
      if (item.getKind() == NodeKind.NULL_TAG) {
        continue;
      }
      body = expandTag(item, body, state);
    }
    return body;
  }

  private Sequence expandTag(HypertagAST item, Sequence body, State state)
                                                    throws UserException {
    TagExpand desc = (TagExpand) item.getDescriptor();
    Slot slot = item.getSlotRead();
    if (!slot.isSet(state)) {
      throw new UndefinedTagException(item, "undefined tag '" +
                                      desc.getName() + "'");
    }
    Object tag = slot.get(state);
    if (!(tag instanceof Tag)) {
      throw new NotATagException(item, "Not a tag: '" + desc.getName() +
                          "' (" + Values.typeName(tag) + ")");
    }

    List<Object> attrs = ExprEvaluator.evaluateAll(desc.getUnnamed(), state);
    Map<String, Object> kwattrs = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, HypertagAST> attr: desc.getNamed()) {
      Object value = ExprEvaluator.evaluate(attr.getValue(), state);
      if (kwattrs.containsKey(attr.getKey())) {
        // repeated attributes, like .a.b for class, are space-separated
        value = Values.str(kwattrs.get(attr.getKey())) + " " + Values.str(value);
      }
      kwattrs.put(attr.getKey(), value);
    }
    return ((Tag) tag).translateTag(state, body, attrs, kwattrs, item);
  }

  /**
   * Expand a native hypertag: bind its attributes and body in the state,
   * then translate its definition body.
   */
  public Sequence expand(HypertagAST definition, State state, Sequence body,
                  List<Object> attrs, Map<String, Object> kwattrs,
                  HypertagAST caller) throws UserException {
    HypertagDef def = (HypertagDef) definition.getDescriptor();
    if (LogHelper.isDebugEnabled()) {
      LogHelper.debug(caller, "expanding hypertag " + def.getName());
    }
    bindAttrs(def, state, body, attrs, kwattrs, caller);
    Sequence output = translate(def.getBody(), state);
    output.setIndent(state.getIndentation());
    return output;
  }

  private void bindAttrs(HypertagDef def, State state, Sequence body,
                 List<Object> attrs, Map<String, Object> kwattrs,
                 HypertagAST caller) throws UserException {
    String name = def.getName();
    List<HypertagAST> regular = def.getAttrRegular();
    HypertagAST attrBody = def.getAttrBody();

    if (attrs.size() > regular.size()) {
      throw new TypeMismatchException(caller, "hypertag '" + name + "' takes "
          + regular.size() + " positional attributes but " + attrs.size() +
          " were given");
    }
    if (attrBody != null && kwattrs.containsKey(attrBody.getName())) {
      throw new TypeMismatchException(caller, "direct assignment to body " +
          "attribute '" + attrBody.getName() + "' of hypertag '" + name +
          "' is not allowed");
    }

    Map<HypertagAST, Object> values = new LinkedHashMap<HypertagAST, Object>();
    for (Map.Entry<String, Object> e: kwattrs.entrySet()) {
      HypertagAST attr = def.getAttr(e.getKey());
      if (attr == null) {
        throw new TypeMismatchException(caller, "hypertag '" + name +
            "' got an unexpected keyword attribute '" + e.getKey() + "'");
      }
      values.put(attr, e.getValue());
    }
    for (int pos = 0; pos < attrs.size(); pos++) {
      HypertagAST attr = regular.get(pos);
      if (values.containsKey(attr)) {
        throw new TypeMismatchException(caller, "hypertag '" + name +
            "' got multiple values for attribute '" + attr.getName() + "'");
      }
      values.put(attr, attrs.get(pos));
    }
    for (HypertagAST attr: regular) {
      if (!values.containsKey(attr)) {
        if (attr.childCount() < 2) {
          throw new TypeMismatchException(caller, "hypertag '" + name +
              "' missing a required positional attribute '" +
              attr.getName() + "'");
        }
        values.put(attr, ExprEvaluator.evaluate(attr.child(1), state));
      }
    }

    for (Map.Entry<HypertagAST, Object> e: values.entrySet()) {
      e.getKey().getSlotWrite().set(state, e.getValue());
    }
    if (attrBody != null) {
      attrBody.getSlotWrite().set(state, body);
    } else if (!body.isEmpty()) {
      throw new VoidTagException(caller, "non-empty body passed to a void " +
                                 "tag '" + name + "'");
    }
  }

  @SuppressWarnings("unchecked")
  private void importSymbols(HypertagAST tree, State state) {
    for (HypertagAST item: tree.children()) {
      switch (item.getKind()) {
        case WILD_IMPORT:
          for (ValueSlot slot: (List<ValueSlot>) item.getDescriptor()) {
            slot.setValue(state);
          }
          break;
        case NAME_IMPORT:
          ((ValueSlot) item.getSlotWrite()).setValue(state);
          break;
        default:
          // the module path
          break;
      }
    }
  }

  /**
   * First branch that translates without an error wins; an empty
   * sequence if all of them fail
   */
  private Sequence tryBlock(HypertagAST tree, State state)
                                                    throws UserException {
    String indentation = state.getIndentation();
    for (HypertagAST branch: tree.children()) {
      try {
        Sequence body = translate(branch, state);
        body.setIndent(state.getIndentation());
        return body;
      } catch (UserException e) {
        logger.trace("try branch failed: " + e.getMessage());
        // markers inside the failed branch may be left unbalanced
        state.setIndentation(indentation);
      }
    }
    return new Sequence();
  }

  private Sequence ifBlock(HypertagAST tree, State state)
                                                    throws UserException {
    IfBlock desc = (IfBlock) tree.getDescriptor();
    Sequence body = null;
    for (HypertagAST clause: desc.getClauses()) {
      Object test = ExprEvaluator.evaluate(IfBlock.clauseTest(clause), state);
      if (Values.isTruthy(test)) {
        body = clauseBody(clause, state);
        break;
      }
    }
    if (body == null) {
      body = desc.hasElse() ? translate(desc.getElseBody(), state)
                            : new Sequence();
    }
    body.setIndent(state.getIndentation());
    return body;
  }

  private Sequence clauseBody(HypertagAST clause, State state)
                                                    throws UserException {
    HypertagAST body = IfBlock.clauseBody(clause);
    return body == null ? new Sequence() : translate(body, state);
  }

  private Sequence whileBlock(HypertagAST tree, State state)
                                                    throws UserException {
    HypertagAST clause = tree.child(0);
    HypertagAST test = IfBlock.clauseTest(clause);
    Sequence out = new Sequence();
    while (Values.isTruthy(ExprEvaluator.evaluate(test, state))) {
      out.addAll(clauseBody(clause, state));
    }
    out.setIndent(state.getIndentation());
    return out;
  }

  private Sequence forBlock(HypertagAST tree, State state)
                                                    throws UserException {
    ForLoop loop = (ForLoop) tree.getDescriptor();
    Object sequence = ExprEvaluator.evaluate(loop.getExpr(), state);
    Sequence out = new Sequence();
    for (Object item: Values.toList(sequence, loop.getExpr())) {
      assignTargets(loop.getTargets(), item, state);
      out.addAll(translate(loop.getBody(), state));
    }
    out.setIndent(state.getIndentation());
    return out;
  }

  private void assignment(HypertagAST tree, State state)
                                                    throws UserException {
    Assignment assign = (Assignment) tree.getDescriptor();
    Object value = ExprEvaluator.evaluate(assign.getExpr(), state);
    if (assign.isInplace()) {
      HypertagAST var = assign.getTargets().child(0);
      Object current = ExprEvaluator.readVariable(var, state);
      value = Operators.binary(assign.getInplace(), current, value, tree);
    }
    assignTargets(assign.getTargets(), value, state);
  }

  /**
   * Assign to a variable, or unpack a value into nested targets
   */
  void assignTargets(HypertagAST targets, Object value, State state)
                                                    throws UserException {
    if (targets.getKind() == NodeKind.VAR_DEF) {
      targets.getSlotWrite().set(state, value);
      return;
    }
    int count = targets.childCount();
    if (count == 1) {
      assignTargets(targets.child(0), value, state);
      return;
    }
    List<Object> items = Values.toList(value, targets);
    if (items.size() > count) {
      throw new InvalidValueException(targets, "too many values to unpack " +
                                      "(expected " + count + ")");
    } else if (items.size() < count) {
      throw new InvalidValueException(targets, "not enough values to unpack "
          + "(expected " + count + ", got " + items.size() + ")");
    }
    for (int i = 0; i < count; i++) {
      assignTargets(targets.child(i), items.get(i), state);
    }
  }

  private static void indentMarker(HypertagAST tree, State state) {
    switch (tree.getKind()) {
      case INDENT_S:
        state.indent(' ');
        break;
      case INDENT_T:
        state.indent('\t');
        break;
      case DEDENT_S:
        state.dedent(' ');
        break;
      case DEDENT_T:
        state.dedent('\t');
        break;
      default:
        throw new HypertagRuntimeError("Not an indent marker: " +
                                       tree.getKind());
    }
  }

  /**
   * Render a node of a text block to a string
   */
  public String render(HypertagAST tree, State state) throws UserException {
    switch (tree.getKind()) {
      case TEXT:
      case ESCAPE:
      case MARGIN:
        return (String) tree.getValue();

      case MERGED:
        return ExprEvaluator.merged(tree);

      case INDENT_S:
      case INDENT_T:
      case DEDENT_S:
      case DEDENT_T:
        indentMarker(tree, state);
        return "";

      case LINE_VERBAT:
      case LINE_NORMAL:
      case LINE_MARKUP:
        return state.getIndentation() + renderInline(tree, state);

      case EXPR:
      case EXPR_VAR:
        return ExprEvaluator.render(tree, state);

      case BLOCK_VERBAT:
      case BLOCK_NORMAL:
      case BLOCK_MARKUP:
        return renderText(tree, state);

      default:
        throw new HypertagRuntimeError("Unexpected node in text: " +
                                       tree.getKind());
    }
  }

  /**
   * Contents of a line without indentation or margin
   */
  private String renderInline(HypertagAST line, State state)
                                                    throws UserException {
    switch (line.getKind()) {
      case LINE_VERBAT:
        return (String) line.getValue();
      case LINE_NORMAL:
        return runtime.escape(renderInline(line.child(0), state));
      case LINE_MARKUP: {
        StringBuilder sb = new StringBuilder();
        for (HypertagAST piece: line.children()) {
          sb.append(render(piece, state));
        }
        return sb.toString();
      }
      default:
        throw new HypertagRuntimeError("Not a line: " + line.getKind());
    }
  }

  /**
   * Text of a verbatim, normal or markup block.  The marker and any tags
   * before it on the headline are replaced by spaces, so that the tail
   * lines can be aligned with the headline text; then the shared
   * indentation is removed, dropping at most one space after the column
   * of the marker.
   */
  String renderText(HypertagAST block, State state) throws UserException {
    String indentation = state.getIndentation();
    state.setIndentation("");
    int lead = block.getColumn();
    String output;
    try {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < lead; i++) {
        sb.append(' ');
      }
      for (HypertagAST c: block.children()) {
        sb.append(render(c, state));
      }
      output = sb.toString();
    } finally {
      state.setIndentation(indentation);
    }

    String subIndent = Indents.getIndent(output);
    if (subIndent.length() > lead + 1) {
      subIndent = subIndent.substring(0, lead + 1);
    }
    output = Indents.delIndent(output, subIndent);

    // tail lines indented less than the headline: drop the lead and a gap
    if (subIndent.length() < lead) {
      int drop = lead - subIndent.length();
      if (drop < output.length() && output.charAt(drop) == ' ') {
        drop++;
      }
      output = output.substring(Math.min(drop, output.length()));
    }
    return output;
  }
}
