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
package hypertag.runtime;

import java.util.List;
import java.util.Map;

import hypertag.ast.HypertagAST;
import hypertag.common.exceptions.UserException;
import hypertag.common.exceptions.VoidTagException;
import hypertag.common.lang.State;
import hypertag.dom.HNode;
import hypertag.dom.Sequence;

/**
 * Tag implemented in Java.  Translation only records the occurrence as a
 * DOM node; the tag is expanded to text when the DOM is rendered.
 */
public abstract class ExternalTag implements Tag {

  protected final String name;

  /** A void tag takes no body */
  private final boolean isVoid;

  /**
   * A text tag gets its body rendered to a string before expansion;
   * otherwise it gets the DOM sequence
   */
  private final boolean isText;

  protected ExternalTag(String name, boolean isVoid, boolean isText) {
    this.name = name;
    this.isVoid = isVoid;
    this.isText = isText;
  }

  public String getName() {
    return name;
  }

  public boolean isVoid() {
    return isVoid;
  }

  public boolean isText() {
    return isText;
  }

  @Override
  public Sequence translateTag(State state, Sequence body, List<Object> attrs,
                      Map<String, Object> kwattrs, HypertagAST caller)
                                                  throws UserException {
    if (isVoid && !body.isEmpty()) {
      throw new VoidTagException(caller, "non-empty body passed to a " +
                                 "void tag '" + name + "'");
    }
    return new Sequence(new HNode(body, this, attrs, kwattrs));
  }

  /**
   * Produce the output of one occurrence.  Implementations do not add
   * trailing newlines or indentation: the caller does.
   * @param body rendered body for text tags, the DOM body otherwise,
   *             null for void tags
   */
  public abstract String expand(Object body, List<Object> attrs,
                       Map<String, Object> kwattrs) throws UserException;

  @Override
  public String toString() {
    return name;
  }
}
