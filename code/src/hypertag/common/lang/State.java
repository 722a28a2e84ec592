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

import java.util.HashMap;
import java.util.Map;

/**
 * Values of slots during one render, keyed by slot id, together with the
 * indentation of the line currently being rendered.
 *
 * A key that is present with a null value holds None; a missing key is an
 * uninitialised slot.
 */
public class State {
  private final HashMap<Integer, Object> values = new HashMap<Integer, Object>();

  /** Starts at "\n" so that top-level lines are preceded by a newline */
  private final StringBuilder indentation = new StringBuilder("\n");

  public State() {
  }

  /**
   * State initialised with slot values captured from another render,
   * e.g. the top level of an imported module
   */
  public State(Map<Integer, Object> values) {
    this.values.putAll(values);
  }

  public void put(Slot slot, Object value) {
    values.put(slot.getId(), value);
  }

  public boolean contains(Slot slot) {
    return values.containsKey(slot.getId());
  }

  public Object get(Slot slot) {
    Integer id = slot.getId();
    if (!values.containsKey(id)) {
      throw new IllegalStateException("slot not initialised: " + slot);
    }
    return values.get(id);
  }

  public Map<Integer, Object> getValues() {
    return values;
  }

  public String getIndentation() {
    return indentation.toString();
  }

  public void setIndentation(String indent) {
    indentation.setLength(0);
    indentation.append(indent);
  }

  public void indent(char c) {
    indentation.append(c);
  }

  public void dedent(char c) {
    int last = indentation.length() - 1;
    assert last >= 0 && indentation.charAt(last) == c :
        "dedent of '" + c + "' does not match indentation";
    indentation.setLength(last);
  }
}
