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
import hypertag.common.lang.State;
import hypertag.dom.Sequence;

/**
 * Anything that can occur in a tag position of a structural block.
 */
public interface Tag {

  /**
   * Expand one occurrence of the tag.
   * @param state render state of the occurrence
   * @param body translated body of the occurrence, possibly empty
   * @param attrs values of unnamed attributes
   * @param kwattrs values of named attributes, in source order
   * @param caller node of the occurrence, for error messages
   * @return the DOM fragment replacing the occurrence
   */
  public Sequence translateTag(State state, Sequence body, List<Object> attrs,
                               Map<String, Object> kwattrs, HypertagAST caller)
                                                       throws UserException;
}
