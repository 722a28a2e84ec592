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
package hypertag.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import hypertag.common.exceptions.UserException;
import hypertag.common.lang.Slot;

/**
 * Node of the Hypertag AST with slots to store semantic info computed by
 * the setup, analysis and compaction passes.
 *
 * Behaviour is not attached to nodes: the passes dispatch on
 * {@link #getKind()}.
 */
public class HypertagAST {

  private final NodeKind kind;
  private final SourceText source;
  private final int start;
  private final int end;
  private List<HypertagAST> children;

  /** Tag, attribute, variable or hypertag name */
  private String name = null;

  /** Value of a static node, or the rendered text of a merged node */
  private Object value = null;

  /** Error raised while pre-rendering a merged node */
  private UserException error = null;

  /** "?" or "!" on expressions */
  private String qualifier = null;

  /** Operator symbol, for operator leaves and in-place assignments */
  private String op = null;

  /** 1-based column of the marker of a text block */
  private int column = 0;

  /** Block preceded by the "<" dedent marker */
  private boolean dedent = false;

  private boolean read = false;
  private boolean write = false;
  private Slot slotRead = null;
  private Slot slotWrite = null;

  /** Kind-specific summary built during setup, see frontend.tree */
  private Object descriptor = null;

  /** Null until the compactifier decides */
  private Boolean pure = null;

  public HypertagAST(NodeKind kind, SourceText source, int start, int end,
                     List<HypertagAST> children) {
    this.kind = kind;
    this.source = source;
    this.start = start;
    this.end = end;
    this.children = new ArrayList<HypertagAST>(children);
  }

  public HypertagAST(NodeKind kind, SourceText source, int start, int end) {
    this(kind, source, start, end, Collections.<HypertagAST>emptyList());
  }

  public NodeKind getKind() {
    return kind;
  }

  public SourceText getSource() {
    return source;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  /**
   * @return the preprocessed source text spanned by this node
   */
  public String text() {
    return source.substring(start, end);
  }

  public int getLine() {
    return source.lineOf(start);
  }

  /** @return 0-based column in the original input */
  public int getCharPositionInLine() {
    return source.columnOf(start);
  }

  /**
   * Prefix message with the position of this node
   */
  public String locate(String message) {
    String file = source.getFileName();
    if (file == null) {
      file = "<string>";
    }
    return file + ":" + getLine() + ":" + (getCharPositionInLine() + 1) +
           ": " + message;
  }

  /**
   * Shorter alternative to children().size()
   */
  public int childCount() {
    return children.size();
  }

  public HypertagAST child(int i) {
    return children.get(i);
  }

  public List<HypertagAST> children() {
    return children;
  }

  public List<HypertagAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children.subList(start, children.size());
  }

  public void setChildren(List<HypertagAST> children) {
    this.children = new ArrayList<HypertagAST>(children);
  }

  public void setChild(int i, HypertagAST child) {
    children.set(i, child);
  }

  public HypertagAST removeChild(int i) {
    return children.remove(i);
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(Object value) {
    this.value = value;
  }

  public UserException getError() {
    return error;
  }

  public void setError(UserException error) {
    this.error = error;
  }

  public String getQualifier() {
    return qualifier;
  }

  public void setQualifier(String qualifier) {
    this.qualifier = qualifier;
  }

  public String getOp() {
    return op;
  }

  public void setOp(String op) {
    this.op = op;
  }

  public int getColumn() {
    return column;
  }

  public void setColumn(int column) {
    this.column = column;
  }

  public boolean isDedent() {
    return dedent;
  }

  public void setDedent(boolean dedent) {
    this.dedent = dedent;
  }

  public boolean isRead() {
    return read;
  }

  public void setRead(boolean read) {
    this.read = read;
  }

  public boolean isWrite() {
    return write;
  }

  public void setWrite(boolean write) {
    this.write = write;
  }

  public Slot getSlotRead() {
    return slotRead;
  }

  public void setSlotRead(Slot slotRead) {
    this.slotRead = slotRead;
  }

  public Slot getSlotWrite() {
    return slotWrite;
  }

  public void setSlotWrite(Slot slotWrite) {
    this.slotWrite = slotWrite;
  }

  public Object getDescriptor() {
    return descriptor;
  }

  public void setDescriptor(Object descriptor) {
    this.descriptor = descriptor;
  }

  public Boolean getPure() {
    return pure;
  }

  public void setPure(boolean pure) {
    this.pure = pure;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.print(kind.toString().toLowerCase(Locale.ROOT));
    if (name != null) {
      writer.print(" " + name);
    }
    if (kind.isStatic() && value != null) {
      writer.print(" " + escapeForTree(String.valueOf(value)));
    }
    writer.println();
    for (HypertagAST c: children) {
      c.printTree(writer, indent + 2);
    }
  }

  private static String escapeForTree(String s) {
    return "'" + s.replace("\n", "\\n") + "'";
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase(Locale.ROOT) + "@" + start + ":" + end;
  }
}
