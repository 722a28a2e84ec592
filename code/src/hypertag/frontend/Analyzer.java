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
package hypertag.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.backend.ImportedTag;
import hypertag.backend.NativeTag;
import hypertag.common.Logging;
import hypertag.common.exceptions.ImportException;
import hypertag.common.exceptions.InvalidSyntaxException;
import hypertag.common.exceptions.UndefinedTagException;
import hypertag.common.exceptions.UndefinedVarException;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.Slot;
import hypertag.common.lang.Symbols;
import hypertag.common.lang.ValueSlot;
import hypertag.frontend.tree.Assignment;
import hypertag.frontend.tree.Document;
import hypertag.frontend.tree.ForLoop;
import hypertag.frontend.tree.HypertagDef;
import hypertag.frontend.tree.ImportBlock;
import hypertag.frontend.tree.TagExpand;
import hypertag.opt.Compactifier;
import hypertag.runtime.Module;
import hypertag.runtime.Runtime;

/**
 * Semantic analysis: binds every variable and tag occurrence to a
 * {@link Slot}, checks structural constraints, resolves imports, and
 * compactifies hypertag bodies once they are analysed.
 *
 * Tagged blocks and hypertag bodies are lexical scopes.  Control blocks
 * are not: symbols declared in their branches stay visible after the
 * block.  When several branches declare the same name, only the slot of
 * the first one is kept.
 */
public class Analyzer {

  private static final Logger logger = Logging.getHypertagLogger();

  private final Runtime runtime;

  /** Null if compactification is disabled */
  private final Compactifier compactifier;

  public Analyzer(Runtime runtime, boolean compactify) {
    this.runtime = runtime;
    this.compactifier = compactify ? new Compactifier(runtime) : null;
  }

  /**
   * Analyse a whole document, seeding it with the runtime's default
   * symbols.  The document's descriptor is set to a {@link Document}.
   */
  public void analyseDocument(HypertagAST document) throws UserException {
    assert(document.getKind() == NodeKind.DOCUMENT);
    Context ctx = new Context();

    Map<String, ValueSlot> slotsIn = new LinkedHashMap<String, ValueSlot>();
    for (Map.Entry<String, Object> e: runtime.importDefault().entrySet()) {
      slotsIn.put(e.getKey(), ctx.newValueSlot(e.getKey(), e.getValue()));
    }
    ctx.pushAll(slotsIn);

    int position = ctx.position();
    analyseAll(document.children(), ctx);
    Map<String, Slot> slotsOut = ctx.asDict(position);
    document.setDescriptor(new Document(slotsIn, slotsOut));
    logger.debug("analysis: " + ctx.slotCount() + " slots, " +
                 slotsOut.size() + " top-level symbols");

    if (compactifier != null) {
      compactifier.compactify(document);
    }
    LogHelper.traceTree("AST after analysis", document);
  }

  private void analyseAll(List<HypertagAST> nodes, Context ctx)
                                                  throws UserException {
    for (HypertagAST node: nodes) {
      analyse(node, ctx);
    }
  }

  void analyse(HypertagAST tree, Context ctx) throws UserException {
    switch (tree.getKind()) {
      case BLOCK_DEF:
        hypertagDef(tree, ctx);
        break;

      case BLOCK_IMPORT:
        importBlock(tree, ctx);
        break;

      case BLOCK_STRUCT: {
        ctx.enterRegular();
        int position = ctx.position();
        analyseAll(tree.children(), ctx);
        // a tagged block is a local namespace
        ctx.reset(position);
        ctx.leaveRegular();
        break;
      }

      case BLOCK_IF:
      case BLOCK_TRY:
        ctx.enterControl();
        analyseBranches(tree.children(), ctx);
        ctx.leaveControl();
        break;

      case BLOCK_WHILE:
        ctx.enterControl();
        analyse(tree.child(0), ctx);
        ctx.leaveControl();
        break;

      case BLOCK_FOR: {
        ForLoop loop = (ForLoop) tree.getDescriptor();
        ctx.enterControl();
        analyse(loop.getExpr(), ctx);
        analyse(loop.getTargets(), ctx);
        analyse(loop.getBody(), ctx);
        ctx.leaveControl();
        break;
      }

      case BLOCK_ASSIGN: {
        Assignment assign = (Assignment) tree.getDescriptor();
        analyse(assign.getExpr(), ctx);
        analyse(assign.getTargets(), ctx);
        break;
      }

      case TAG_EXPAND:
        tagExpand(tree, ctx);
        break;

      case VAR_USE:
      case VAR_DEF:
        variable(tree, ctx);
        break;

      default:
        analyseAll(tree.children(), ctx);
        break;
    }
  }

  /**
   * Each branch is analysed from the same checkpoint.  Afterwards, the
   * symbols it declared are pushed into the enclosing scope unless an
   * earlier branch already declared them.
   */
  private void analyseBranches(List<HypertagAST> branches, Context ctx)
                                                  throws UserException {
    for (HypertagAST branch: branches) {
      int position = ctx.position();
      analyse(branch, ctx);
      Map<String, Slot> symbols = ctx.asDict(position);
      ctx.reset(position);
      ctx.pushNew(symbols);
    }
  }

  private void hypertagDef(HypertagAST tree, Context ctx)
                                                  throws UserException {
    if (ctx.getControlDepth() >= 1) {
      throw new InvalidSyntaxException(tree, "hypertag definition inside " +
                                       "a control block is not allowed");
    }
    HypertagDef def = (HypertagDef) tree.getDescriptor();
    LogHelper.debug(tree, "analysing hypertag " + def.getName());

    ctx.enterRegular();
    ctx.enterHypertag();
    int position = ctx.position();

    // defaults are evaluated in the caller's state, before attributes exist
    for (HypertagAST attr: def.getAttrs()) {
      analyseAll(attr.children(1), ctx);
    }
    for (HypertagAST attr: def.getAttrs()) {
      String symbol = Symbols.var(attr.getName());
      Slot slot = ctx.newSlot(symbol);
      ctx.push(symbol, slot);
      attr.setSlotWrite(slot);
    }
    analyse(def.getBody(), ctx);

    ctx.reset(position);
    ctx.leaveHypertag();
    ctx.leaveRegular();

    if (compactifier != null) {
      compactifier.compactify(def.getBody());
    }

    String symbol = Symbols.tag(def.getName());
    ValueSlot slot = ctx.newValueSlot(symbol, new NativeTag(tree, runtime));
    ctx.push(symbol, slot);
    tree.setSlotWrite(slot);
  }

  /**
   * Imports are resolved during analysis; translation only copies the
   * imported values into the state.
   */
  private void importBlock(HypertagAST tree, Context ctx)
                                                  throws UserException {
    if (ctx.getControlDepth() >= 1) {
      throw new InvalidSyntaxException(tree, "import inside a control " +
                                       "block is not allowed");
    }
    ImportBlock block = (ImportBlock) tree.getDescriptor();
    String path = block.getPath();
    for (HypertagAST item: block.getItems()) {
      Module module = runtime.importModule(path, item);
      if (item.getKind() == NodeKind.WILD_IMPORT) {
        List<ValueSlot> slots = new ArrayList<ValueSlot>();
        for (Map.Entry<String, Object> e: module.getSymbols().entrySet()) {
          String symbol = e.getKey();
          if (Symbols.isPrivate(symbol)) {
            continue;
          }
          if (ctx.contains(symbol)) {
            Logging.uniqueWarn(item.locate("wildcard import hides an " +
                               "earlier definition of '" + symbol + "'"));
          }
          ValueSlot slot = ctx.newValueSlot(symbol,
                              importedValue(symbol, e.getValue(), module));
          ctx.push(symbol, slot);
          slots.add(slot);
        }
        item.setDescriptor(slots);
        LogHelper.debug(item, "imported " + slots.size() + " symbols from " +
                        (path == null ? Runtime.PATH_CONTEXT : path));
      } else {
        String symbol = ImportBlock.importedSymbol(item);
        String rename = ImportBlock.boundSymbol(item);
        if (!module.contains(symbol)) {
          throw new ImportException(item, "cannot import '" + symbol +
              "' from a given path (" +
              (path == null ? Runtime.PATH_CONTEXT : path) + ")");
        }
        ValueSlot slot = ctx.newValueSlot(rename,
                            importedValue(symbol, module.get(symbol), module));
        ctx.push(rename, slot);
        item.setSlotWrite(slot);
      }
    }
  }

  /**
   * Native hypertags of another document keep expanding in that
   * document's state
   */
  private static Object importedValue(String symbol, Object value,
                                      Module module) {
    if (Symbols.isTag(symbol) && value instanceof NativeTag) {
      return new ImportedTag((NativeTag) value, module.getState());
    }
    return value;
  }

  private void tagExpand(HypertagAST tree, Context ctx) throws UserException {
    TagExpand tag = (TagExpand) tree.getDescriptor();
    analyseAll(tag.getAttrs(), ctx);
    Slot slot = ctx.get(Symbols.tag(tag.getName()));
    if (slot == null) {
      throw new UndefinedTagException(tree, "undefined tag '" +
                                      tag.getName() + "'");
    }
    tree.setSlotRead(slot);
  }

  /**
   * A read binds to the innermost declaration.  A write reuses the slot
   * of a declaration in the same scope, otherwise declares a new one.
   */
  private void variable(HypertagAST var, Context ctx)
                                          throws UndefinedVarException {
    String symbol = Symbols.var(var.getName());
    Slot slot = ctx.get(symbol);
    if (var.isRead()) {
      if (slot == null) {
        throw new UndefinedVarException(var, "variable '" + var.getName() +
                                        "' is not defined");
      }
      var.setSlotRead(slot);
    }
    if (var.isWrite()) {
      if (slot != null && ctx.isLocal(slot)) {
        var.setSlotWrite(slot);
      } else {
        Slot created = ctx.newSlot(symbol);
        ctx.push(symbol, created);
        var.setSlotWrite(created);
      }
    }
  }
}
