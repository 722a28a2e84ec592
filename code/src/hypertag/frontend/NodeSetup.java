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

import java.util.Collections;

import org.apache.commons.lang3.StringUtils;

import hypertag.ast.HypertagAST;
import hypertag.ast.NodeKind;
import hypertag.common.exceptions.InvalidSyntaxException;
import hypertag.frontend.tree.Assignment;
import hypertag.frontend.tree.ForLoop;
import hypertag.frontend.tree.HypertagDef;
import hypertag.frontend.tree.IfBlock;
import hypertag.frontend.tree.ImportBlock;
import hypertag.frontend.tree.TagExpand;

/**
 * Local, children-only preparation of a freshly rewritten tree: values of
 * static leaves, names, qualifiers, operators, and descriptors of
 * composite blocks.  Runs bottom-up, so that a node can read the
 * annotations of its children.
 */
public class NodeSetup {

  public static void setup(HypertagAST tree) throws InvalidSyntaxException {
    for (HypertagAST child: tree.children()) {
      setup(child);
    }
    setupNode(tree);
  }

  private static void setupNode(HypertagAST tree)
                                      throws InvalidSyntaxException {
    String text;
    switch (tree.getKind()) {
      case TEXT:
      case MARGIN:
      case NAME_ID:
      case NAME_XML:
      case SYMBOL:
      case PATH_IMPORT:
      case DEDENT:
      case ATTR_SHORT_LIT:
      case LINE_VERBAT:
        tree.setValue(tree.text());
        if (tree.getKind() == NodeKind.NAME_ID) {
          tree.setName(tree.text());
        }
        break;
      case MARGIN_OUT:
        text = tree.text();
        // the last newline marks the block that follows as outline
        tree.setValue(text.substring(0, text.length() - 1));
        break;
      case ESCAPE:
        tree.setValue(tree.text().substring(0, 1));
        break;
      case QUALIFIER:
        tree.setValue("");
        tree.setQualifier(tree.text());
        break;
      case NUMBER:
        tree.setValue(parseNumber(tree.text()));
        break;
      case STRING:
        text = tree.text();
        tree.setValue(text.substring(1, text.length() - 1));
        break;
      case BOOLEAN:
        tree.setValue(Boolean.valueOf(tree.text().equals("True")));
        break;
      case NONE:
        tree.setValue(null);
        break;
      case OP_POWER:
      case OP_MULTIPLIC:
      case OP_ADDITIVE:
      case OP_SHIFT:
      case OP_COMP:
      case OP_INPLACE:
      case NEG:
      case NOT:
        // "not  in" and "not in" are the same operator
        text = StringUtils.join(StringUtils.split(tree.text()), ' ');
        tree.setOp(text);
        tree.setValue(text);
        break;

      case BLOCK:
        if (tree.childCount() == 3) {
          tree.setDedent(true);
          tree.removeChild(1);
        }
        break;
      case BLOCK_VERBAT:
      case BLOCK_NORMAL:
      case BLOCK_MARKUP:
        tree.setColumn(tree.getStart() -
                       tree.getSource().lineStart(tree.getStart()) + 1);
        break;
      case BLOCK_COMMENT:
        tree.setChildren(Collections.<HypertagAST>emptyList());
        break;

      case EXPR:
      case FACTOR:
        stripQualifier(tree);
        break;
      case VAR_USE:
        tree.setName(varName(tree.text()));
        tree.setRead(true);
        break;
      case VAR_DEF:
        tree.setName(varName(tree.text()));
        tree.setWrite(true);
        break;

      case ATTR_BODY:
      case ATTR_DEF:
      case ATTR_NAMED:
      case KWARG:
      case MEMBER:
        tree.setName((String) tree.child(0).getValue());
        break;
      case ATTR_SHORT:
        tree.setName(tree.text().charAt(0) == '.' ? "class" : "id");
        break;

      case BLOCK_DEF: {
        HypertagDef def = HypertagDef.fromAST(tree);
        tree.setName(def.getName());
        tree.setDescriptor(def);
        break;
      }
      case TAG_EXPAND: {
        TagExpand tag = TagExpand.fromAST(tree);
        tree.setName(tag.getName());
        tree.setDescriptor(tag);
        break;
      }
      case BLOCK_IMPORT:
        tree.setDescriptor(ImportBlock.fromAST(tree));
        break;
      case BLOCK_IF:
        tree.setDescriptor(IfBlock.fromAST(tree));
        break;
      case BLOCK_FOR:
        tree.setDescriptor(ForLoop.fromAST(tree));
        break;
      case BLOCK_ASSIGN:
        tree.setDescriptor(Assignment.fromAST(tree));
        break;
      default:
        // Nothing to prepare
        break;
    }
  }

  /**
   * Integer literal if possible, floating point otherwise.
   * Integers that do not fit a long become floating point.
   */
  static Object parseNumber(String text) {
    try {
      return Long.valueOf(text);
    } catch (NumberFormatException e) {
      return Double.valueOf(text);
    }
  }

  /** $ is optional in front of variables inside {...} */
  private static String varName(String text) {
    return text.startsWith("$") ? text.substring(1) : text;
  }

  private static void stripQualifier(HypertagAST tree) {
    int last = tree.childCount() - 1;
    if (last >= 1 && tree.child(last).getKind() == NodeKind.QUALIFIER) {
      tree.setQualifier(tree.removeChild(last).getQualifier());
    }
  }
}
