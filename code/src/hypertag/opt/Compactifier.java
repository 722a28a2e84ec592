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
package hypertag.opt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.log4j.Logger;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.backend.Translator;
import hypertag.common.Logging;
import hypertag.common.exceptions.HypertagRuntimeError;
import hypertag.common.exceptions.UserException;
import hypertag.common.lang.State;
import hypertag.runtime.Runtime;

/**
 * Pre-renders constant parts of text lines.
 *
 * A maximal run of pure pieces of a markup line (static text, escapes,
 * expressions without variables or calls) is replaced by one MERGED node
 * holding the rendered text.  If rendering a piece fails, the error is
 * stored in the merged node and raised again whenever the node is
 * rendered, so that the failure surfaces at the same point as without
 * compaction.
 */
public class Compactifier {

  private static final Logger logger = Logging.getHypertagLogger();

  private final Translator translator;

  public Compactifier(Runtime runtime) {
    this.translator = new Translator(runtime);
  }

  /**
   * Compactify the subtree in place.  Bodies of hypertag definitions are
   * skipped: they are compactified when the definition is analysed.
   * @return the number of merged nodes created
   */
  public int compactify(HypertagAST tree) {
    int merged = compactifyTree(tree, new State());
    String kind = tree.getKind().toString().toLowerCase(Locale.ROOT);
    logger.debug("compactified " + kind +
                 ": " + merged + " merged nodes");
    return merged;
  }

  private int compactifyTree(HypertagAST tree, State state) {
    if (tree.getKind() == NodeKind.LINE_MARKUP) {
      return compactifySiblings(tree, state);
    }
    int merged = 0;
    for (HypertagAST child: tree.children()) {
      if (child.getKind() != NodeKind.BLOCK_DEF) {
        merged += compactifyTree(child, state);
      }
    }
    return merged;
  }

  private int compactifySiblings(HypertagAST line, State state) {
    List<HypertagAST> out = new ArrayList<HypertagAST>();
    HypertagAST last = null;
    int merged = 0;
    for (HypertagAST node: line.children()) {
      if (node.getKind() == NodeKind.MERGED) {
        // already compacted
        out.add(node);
        last = null;
      } else if (isPure(node)) {
        if (last == null) {
          last = new HypertagAST(NodeKind.MERGED, node.getSource(),
                                 node.getStart(), node.getEnd());
          last.setValue("");
          out.add(last);
          merged++;
        } else {
          last = extend(last, node);
          out.set(out.size() - 1, last);
        }
        append(last, node, state);
      } else {
        out.add(node);
        last = null;
      }
    }
    line.setChildren(out);
    return merged;
  }

  /** Merged node spanning both nodes, with the same value and error */
  private static HypertagAST extend(HypertagAST merged, HypertagAST node) {
    HypertagAST result = new HypertagAST(NodeKind.MERGED, merged.getSource(),
                                         merged.getStart(), node.getEnd());
    result.setValue(merged.getValue());
    result.setError(merged.getError());
    result.setPure(true);
    return result;
  }

  private void append(HypertagAST merged, HypertagAST node, State state) {
    if (merged.getError() != null) {
      // rendering fails at this point anyway
      return;
    }
    try {
      String text = translator.render(node, state);
      merged.setValue(merged.getValue() + text);
    } catch (UserException e) {
      merged.setError(e);
    }
  }

  /**
   * A node is pure if rendering it always gives the same result and has
   * no side effects.  Computed once per node.
   */
  public static boolean isPure(HypertagAST node) {
    Boolean pure = node.getPure();
    if (pure != null) {
      return pure;
    }
    boolean result;
    switch (node.getKind().purity()) {
      case PURE:
        result = true;
        break;
      case IMPURE:
        result = false;
        break;
      case STRUCTURAL:
        result = true;
        for (HypertagAST child: node.children()) {
          if (!isPure(child)) {
            result = false;
            break;
          }
        }
        break;
      default:
        throw new HypertagRuntimeError("Unknown purity: " +
                                        node.getKind().purity());
    }
    node.setPure(result);
    return result;
  }
}
