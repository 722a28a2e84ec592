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

package hypertag.common.exceptions;

import hypertag.ast.HypertagAST;

/**
 * Represents an error caused by user input: a malformed script, or a script
 * that fails while being translated.  Thus, this should contain good error
 * message information.
 * */
public class UserException
extends Exception
{
  private String message;
  /** True once the message carries a source position */
  private boolean located;

  public UserException(HypertagAST node, String message)
  {
    super(message);
    this.message = node == null ? message : node.locate(message);
    this.located = node != null;
  }

  public UserException(String file, int line, int col, String message) {
    super(message);
    this.message = file + ":" + line + ":" +
                   (col > 0 ? (col + 1) + ":" : "") + " " + message;
    this.located = true;
  }

  public UserException(String message) {
    this((HypertagAST) null, message);
  }

  public UserException(String message, Throwable cause) {
    super(message, cause);
    this.message = message;
    this.located = false;
  }

  @Override
  public String getMessage() {
    return message;
  }

  public boolean isLocated() {
    return located;
  }

  /**
   * Prefix the message with the position of node, unless a position is
   * already known.  Errors raised outside the tree, e.g. by builtins, get
   * the position of the expression that called them.
   * @return this exception
   */
  public UserException locateAt(HypertagAST node) {
    if (!located && node != null) {
      message = node.locate(message);
      located = true;
    }
    return this;
  }

  private static final long serialVersionUID = 1L;
}
