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
package hypertag.common.lang;

/**
 * A storage location for one variable, tag or attribute declaration.
 * Slots are allocated by the analyzer from a per-context arena; the id is
 * the key of the slot's value in a render {@link State}.
 */
public class Slot {
  private final int id;
  private final String symbol;

  /** Nesting level of regular blocks where the slot was declared */
  private final int depth;

  /** Nesting level of hypertag definitions where the slot was declared */
  private final int hypertagDepth;

  public Slot(int id, String symbol, int depth, int hypertagDepth) {
    this.id = id;
    this.symbol = symbol;
    this.depth = depth;
    this.hypertagDepth = hypertagDepth;
  }

  public int getId() {
    return id;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getDepth() {
    return depth;
  }

  public int getHypertagDepth() {
    return hypertagDepth;
  }

  public void set(State state, Object value) {
    state.put(this, value);
  }

  public boolean isSet(State state) {
    return state.contains(this);
  }

  /**
   * @return the value, which may be null for a variable holding None
   * @throws IllegalStateException if the slot was never initialised
   */
  public Object get(State state) {
    return state.get(this);
  }

  @Override
  public String toString() {
    return symbol + "#" + id + "@" + depth + "/" + hypertagDepth;
  }
}
