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
package hypertag.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;

/**
 * Ordered list of DOM nodes: a body of a node, or an intermediate result of
 * translation.  Nested sequences and iterables are flattened on insertion
 * and nulls are dropped.
 */
public class Sequence implements Iterable<HNode> {
  private final List<HNode> nodes = new ArrayList<HNode>();

  public Sequence() {
  }

  public Sequence(HNode node) {
    if (node != null) {
      nodes.add(node);
    }
  }

  public static Sequence of(Object... items) throws TypeMismatchException {
    Sequence seq = new Sequence();
    for (Object item: items) {
      seq.addFlat(item);
    }
    return seq;
  }

  public void add(HNode node) {
    if (node != null) {
      nodes.add(node);
    }
  }

  public void addAll(Sequence other) {
    nodes.addAll(other.nodes);
  }

  /**
   * Add a node, a sequence, or an iterable of these
   * @throws TypeMismatchException if anything else is found
   */
  public void addFlat(Object item) throws TypeMismatchException {
    if (item == null) {
      return;
    } else if (item instanceof HNode) {
      nodes.add((HNode) item);
    } else if (item instanceof Sequence) {
      nodes.addAll(((Sequence) item).nodes);
    } else if (item instanceof Iterable) {
      for (Object o: (Iterable<?>) item) {
        addFlat(o);
      }
    } else {
      throw new TypeMismatchException("found " + item.getClass().getName() +
                               " instead of an HNode as an element of DOM");
    }
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  public HNode get(int i) {
    return nodes.get(i);
  }

  public List<HNode> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  @Override
  public Iterator<HNode> iterator() {
    return getNodes().iterator();
  }

  public void setIndent(String indent) {
    for (HNode n: nodes) {
      n.setIndent(indent);
    }
  }

  /** Mark the first node, if any, to start on a new line */
  public void setOutline() {
    if (!nodes.isEmpty()) {
      nodes.get(0).setOutline();
    }
  }

  public String render() throws UserException {
    StringBuilder sb = new StringBuilder();
    for (HNode n: nodes) {
      sb.append(n.render());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "Sequence" + nodes;
  }
}
