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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Maps;

import hypertag.common.lang.Slot;
import hypertag.common.lang.ValueSlot;

/**
 * Symbol table used during analysis: a stack of (symbol, slot) bindings
 * with checkpoints, the arena that hands out slot ids, and the nesting
 * counters used for structural checks.
 *
 * Symbols carry a namespace prefix, see {@link hypertag.common.lang.Symbols}.
 */
public class Context {

  private final List<Map.Entry<String, Slot>> stack =
                                  new ArrayList<Map.Entry<String, Slot>>();

  /** Bindings per symbol, innermost last */
  private final ListMultimap<String, Slot> index = ArrayListMultimap.create();

  private int nextSlot = 0;

  /** Nesting of tagged blocks and hypertag bodies */
  private int regularDepth = 0;

  /** Nesting of hypertag definitions */
  private int hypertagDepth = 0;

  /** Nesting of if/for/while/try blocks */
  private int controlDepth = 0;

  public Slot newSlot(String symbol) {
    return new Slot(nextSlot++, symbol, regularDepth, hypertagDepth);
  }

  public ValueSlot newValueSlot(String symbol, Object value) {
    return new ValueSlot(nextSlot++, symbol, regularDepth, hypertagDepth,
                         value);
  }

  /** @return number of slots allocated so far */
  public int slotCount() {
    return nextSlot;
  }

  public void push(String symbol, Slot slot) {
    stack.add(Maps.immutableEntry(symbol, slot));
    index.put(symbol, slot);
  }

  public void pushAll(Map<String, ? extends Slot> symbols) {
    for (Map.Entry<String, ? extends Slot> e: symbols.entrySet()) {
      push(e.getKey(), e.getValue());
    }
  }

  /**
   * Push only the symbols that are not bound yet
   */
  public void pushNew(Map<String, ? extends Slot> symbols) {
    for (Map.Entry<String, ? extends Slot> e: symbols.entrySet()) {
      if (!index.containsKey(e.getKey())) {
        push(e.getKey(), e.getValue());
      }
    }
  }

  /**
   * @return the innermost slot bound to symbol, or null
   */
  public Slot get(String symbol) {
    List<Slot> slots = index.get(symbol);
    if (slots.isEmpty()) {
      return null;
    }
    return slots.get(slots.size() - 1);
  }

  public boolean contains(String symbol) {
    return index.containsKey(symbol);
  }

  /** Checkpoint for {@link #reset(int)} and {@link #asDict(int)} */
  public int position() {
    return stack.size();
  }

  /**
   * Drop all bindings pushed after the checkpoint
   */
  public void reset(int position) {
    while (stack.size() > position) {
      Map.Entry<String, Slot> top = stack.remove(stack.size() - 1);
      List<Slot> slots = index.get(top.getKey());
      slots.remove(slots.size() - 1);
    }
  }

  /**
   * @return symbols bound after the checkpoint, with their latest slots
   */
  public Map<String, Slot> asDict(int position) {
    Map<String, Slot> symbols = new LinkedHashMap<String, Slot>();
    for (Map.Entry<String, Slot> binding: stack.subList(position, stack.size())) {
      symbols.put(binding.getKey(), binding.getValue());
    }
    return symbols;
  }

  /**
   * @return true if slot was declared at the current block level, so that
   *         an assignment writes into it instead of shadowing it
   */
  public boolean isLocal(Slot slot) {
    return slot.getDepth() == regularDepth &&
           slot.getHypertagDepth() == hypertagDepth;
  }

  public int getControlDepth() {
    return controlDepth;
  }

  public void enterRegular() {
    regularDepth++;
  }

  public void leaveRegular() {
    regularDepth--;
  }

  public void enterHypertag() {
    hypertagDepth++;
  }

  public void leaveHypertag() {
    hypertagDepth--;
  }

  public void enterControl() {
    controlDepth++;
  }

  public void leaveControl() {
    controlDepth--;
  }
}
