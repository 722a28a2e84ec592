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
package hypertag.frontend.peg;

import java.util.Collections;
import java.util.List;

/**
 * Node of a concrete parse tree.  Only applications of named rules create
 * nodes; literals, regexes and anonymous groups contribute the nodes of
 * the named rules inside them.
 */
public class ParseTree {
  private final Rule rule;
  private final int start;
  private final int end;
  private final List<ParseTree> children;

  ParseTree(Rule rule, int start, int end, List<ParseTree> children) {
    this.rule = rule;
    this.start = start;
    this.end = end;
    this.children = Collections.unmodifiableList(children);
  }

  public String getName() {
    return rule.getName();
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public List<ParseTree> getChildren() {
    return children;
  }

  @Override
  public String toString() {
    return getName() + "[" + start + ":" + end + "]";
  }
}
